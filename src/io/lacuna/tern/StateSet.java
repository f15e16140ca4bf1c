package io.lacuna.tern;

import io.lacuna.bifurcan.LinearSet;

import java.util.Iterator;
import java.util.Objects;

/**
 * An immutable set of states, used as the identity of a state produced by determinization or minimization.  Equality
 * and hashing ignore the order in which the states were added.
 *
 * @param <S> the state type
 */
public final class StateSet<S> implements Iterable<S> {

  private final LinearSet<S> states;
  private final int hash;

  private StateSet(LinearSet<S> states) {
    this.states = states;

    int h = 0;
    for (S s : states) {
      h += s.hashCode();
    }
    this.hash = h;
  }

  @SafeVarargs
  public static <S> StateSet<S> of(S... states) {
    LinearSet<S> set = new LinearSet<>();
    for (S s : states) {
      set.add(Objects.requireNonNull(s));
    }
    return new StateSet<>(set);
  }

  public static <S> StateSet<S> from(Iterable<? extends S> states) {
    LinearSet<S> set = new LinearSet<>();
    for (S s : states) {
      set.add(Objects.requireNonNull(s));
    }
    return new StateSet<>(set);
  }

  public int size() {
    return (int) states.size();
  }

  public boolean isEmpty() {
    return states.size() == 0;
  }

  public boolean contains(S state) {
    return states.contains(state);
  }

  public boolean containsAny(Iterable<? extends S> others) {
    for (S s : others) {
      if (states.contains(s)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return a mutable copy of the states
   */
  public LinearSet<S> toSet() {
    return Utils.copy(states);
  }

  @Override
  public Iterator<S> iterator() {
    return states.iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof StateSet)) {
      return false;
    }

    StateSet<S> other = (StateSet<S>) obj;
    if (hash != other.hash || states.size() != other.states.size()) {
      return false;
    }
    for (S s : other.states) {
      if (!states.contains(s)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return hash;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    boolean first = true;
    for (S s : states) {
      if (!first) {
        sb.append(", ");
      }
      sb.append(s);
      first = false;
    }
    return sb.append("}").toString();
  }
}
