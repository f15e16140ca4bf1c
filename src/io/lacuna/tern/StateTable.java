package io.lacuna.tern;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

import java.util.Objects;

/**
 * State membership shared by all automata: every state, and which of them are accepting or initial.
 */
final class StateTable<S> {

  private final LinearSet<S> states = new LinearSet<>();
  private final LinearSet<S> accepting = new LinearSet<>();
  private final LinearSet<S> initial = new LinearSet<>();

  boolean add(S state) {
    Objects.requireNonNull(state);
    if (states.contains(state)) {
      return false;
    }
    states.add(state);
    return true;
  }

  boolean contains(S state) {
    return states.contains(state);
  }

  boolean remove(S state) {
    if (!states.contains(state)) {
      return false;
    }
    states.remove(state);
    accepting.remove(state);
    initial.remove(state);
    return true;
  }

  boolean addAccepting(S state) {
    add(state);
    if (accepting.contains(state)) {
      return false;
    }
    accepting.add(state);
    return true;
  }

  boolean removeAccepting(S state) {
    if (!accepting.contains(state)) {
      return false;
    }
    accepting.remove(state);
    return true;
  }

  boolean isAccepting(S state) {
    return accepting.contains(state);
  }

  boolean addInitial(S state) {
    add(state);
    if (initial.contains(state)) {
      return false;
    }
    initial.add(state);
    return true;
  }

  boolean removeInitial(S state) {
    if (!initial.contains(state)) {
      return false;
    }
    initial.remove(state);
    return true;
  }

  void clearInitial() {
    for (S s : Utils.copy(initial)) {
      initial.remove(s);
    }
  }

  boolean isInitial(S state) {
    return initial.contains(state);
  }

  /// live views, for iteration within the owning automaton

  ISet<S> states() {
    return states;
  }

  ISet<S> accepting() {
    return accepting;
  }

  ISet<S> initial() {
    return initial;
  }

  void clear() {
    for (S s : Utils.copy(states)) {
      remove(s);
    }
  }
}
