package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * A deterministic automaton whose transitions are labeled with individual symbols.
 *
 * @param <S> the state type
 * @param <T> the symbol type, compared using {@code equals} and {@code hashCode}
 */
public class Dfa<S, T> implements IDfa<S, T> {

  private final StateTable<S> table = new StateTable<>();
  private final LinearMap<S, LinearMap<T, S>> transitions = new LinearMap<>();
  private final LinearSet<T> alphabet = new LinearSet<>();
  private S initial;

  /// states

  @Override
  public ISet<S> states() {
    return Utils.copy(table.states());
  }

  @Override
  public ISet<S> acceptingStates() {
    return Utils.copy(table.accepting());
  }

  @Override
  public boolean containsState(S state) {
    return table.contains(state);
  }

  @Override
  public boolean isAccepting(S state) {
    return table.isAccepting(state);
  }

  @Override
  public boolean addState(S state) {
    return table.add(state);
  }

  @Override
  public boolean removeState(S state) {
    if (!table.remove(state)) {
      return false;
    }
    if (state.equals(initial)) {
      initial = null;
    }

    transitions.remove(state);
    for (S from : Utils.copy(transitions.keys())) {
      LinearMap<T, S> m = transitions.get(from).get();
      for (T symbol : Utils.copy(m.keys())) {
        if (m.get(symbol).get().equals(state)) {
          m.remove(symbol);
        }
      }
      if (m.size() == 0) {
        transitions.remove(from);
      }
    }
    return true;
  }

  @Override
  public boolean addAccepting(S state) {
    return table.addAccepting(state);
  }

  @Override
  public boolean removeAccepting(S state) {
    return table.removeAccepting(state);
  }

  @Override
  public S initialState() {
    if (initial == null) {
      throw new IllegalStateException("no initial state has been set");
    }
    return initial;
  }

  @Override
  public boolean hasInitialState() {
    return initial != null;
  }

  @Override
  public void setInitialState(S state) {
    table.clearInitial();
    table.addInitial(state);
    initial = state;
  }

  /// transitions

  @Override
  public IList<Transition<S, T>> transitions() {
    LinearList<Transition<S, T>> result = new LinearList<>();
    for (S from : transitions.keys()) {
      LinearMap<T, S> m = transitions.get(from).get();
      for (T symbol : m.keys()) {
        result.addLast(new Transition<>(from, symbol, m.get(symbol).get()));
      }
    }
    return result;
  }

  @Override
  public IList<T> alphabet() {
    LinearList<T> result = new LinearList<>();
    alphabet.forEach(result::addLast);
    return result;
  }

  /**
   * Adds a transition, replacing any existing transition from {@code from} on {@code symbol}.
   */
  @Override
  public boolean addTransition(S from, T symbol, S to) {
    Objects.requireNonNull(symbol);
    table.add(from);
    table.add(to);
    alphabet.add(symbol);

    LinearMap<T, S> m = transitions.getOrCreate(from, LinearMap::new);
    Optional<S> existing = m.get(symbol);
    if (existing.isPresent() && existing.get().equals(to)) {
      return false;
    }
    m.put(symbol, to);
    return true;
  }

  @Override
  public boolean removeTransition(S from, T symbol, S to) {
    Optional<S> existing = transition(from, symbol);
    if (!existing.isPresent() || !existing.get().equals(to)) {
      return false;
    }

    LinearMap<T, S> m = transitions.get(from).get();
    m.remove(symbol);
    if (m.size() == 0) {
      transitions.remove(from);
    }
    return true;
  }

  public Optional<S> transition(S from, T symbol) {
    return transitions.get(from).flatMap(m -> m.get(symbol));
  }

  @Override
  public IList<S> successors(S state) {
    LinearList<S> result = new LinearList<>();
    outgoing(state).values().forEach(result::addLast);
    return result;
  }

  @Override
  public IList<StatePair<S>> successors(S a, S b) {
    LinearMap<T, S> ma = outgoing(a);
    LinearMap<T, S> mb = outgoing(b);

    LinearList<StatePair<S>> result = new LinearList<>();
    for (T symbol : ma.keys()) {
      result.addLast(new StatePair<>(ma.get(symbol).get(), mb.get(symbol).orElse(null)));
    }
    for (T symbol : mb.keys()) {
      if (!ma.contains(symbol)) {
        result.addLast(new StatePair<>(null, mb.get(symbol).get()));
      }
    }
    return result;
  }

  /// execution

  /**
   * @throws IllegalStateException if no initial state has been set
   */
  public boolean accepts(Iterable<T> input) {
    S current = initialState();
    for (T symbol : input) {
      Optional<S> next = transition(current, symbol);
      if (!next.isPresent()) {
        return false;
      }
      current = next.get();
    }
    return isAccepting(current);
  }

  @Override
  public ISet<S> reachableStates() {
    return Utils.breadthFirst(LinearList.of(initialState()), s -> outgoing(s).values());
  }

  /// completion

  /**
   * @return true if every state has a transition on every symbol in {@code symbols}
   */
  public boolean isComplete(Iterable<T> symbols) {
    for (S s : table.states()) {
      LinearMap<T, S> m = outgoing(s);
      for (T symbol : symbols) {
        if (!m.contains(symbol)) {
          return false;
        }
      }
    }
    return true;
  }

  public boolean isComplete() {
    return isComplete(alphabet);
  }

  /**
   * Adds a transition to {@code trap} for every state and symbol without one.  If any were added, {@code trap} also
   * transitions to itself on every symbol it lacks.
   *
   * @return true if any transition was added
   * @throws IllegalArgumentException if {@code symbols} is empty
   */
  public boolean complete(Iterable<T> symbols, S trap) {
    Objects.requireNonNull(trap);
    ISet<T> required = Utils.copy(symbols);
    if (required.size() == 0) {
      throw new IllegalArgumentException("cannot complete over an empty alphabet");
    }

    boolean changed = false;
    for (S s : Utils.copy(table.states())) {
      if (s.equals(trap)) {
        continue;
      }
      for (T symbol : required) {
        if (!transition(s, symbol).isPresent()) {
          addTransition(s, symbol, trap);
          changed = true;
        }
      }
    }

    if (changed) {
      for (T symbol : required) {
        if (!transition(trap, symbol).isPresent()) {
          addTransition(trap, symbol, trap);
        }
      }
    }
    return changed;
  }

  /**
   * Completes the automaton over every symbol it has seen so far.
   *
   * @throws IllegalStateException if no symbols have been seen
   */
  public boolean complete(S trap) {
    if (alphabet.size() == 0) {
      throw new IllegalStateException("cannot complete an automaton with no alphabet");
    }
    return complete(Utils.copy(alphabet), trap);
  }

  /// minimization

  public Dfa<StateSet<S>, T> minimize() {
    return minimize(StateCombiners.toSet());
  }

  public <R> Dfa<R, T> minimize(IStateCombiner<S, R> combiner) {
    return minimize(combiner, Collections.emptyList());
  }

  public <R> Dfa<R, T> minimize(IStateCombiner<S, R> combiner, Iterable<StatePair<S>> differentiate) {
    return minimize(combiner, differentiate, () -> false);
  }

  /**
   * Returns the equivalent automaton with the fewest states, never merging the states of any pair in
   * {@code differentiate}.  This automaton is left unchanged.
   *
   * @see Minimizer#differentiating(IAutomaton, Iterable)
   */
  public <R> Dfa<R, T> minimize(
      IStateCombiner<S, R> combiner,
      Iterable<StatePair<S>> differentiate,
      BooleanSupplier cancelled) {
    return Minimizer.minimize(this, combiner, differentiate, Dfa::new, cancelled);
  }

  ///

  @Override
  public void clear() {
    table.clear();
    initial = null;
    for (S from : Utils.copy(transitions.keys())) {
      transitions.remove(from);
    }
    for (T symbol : Utils.copy(alphabet)) {
      alphabet.remove(symbol);
    }
  }

  private LinearMap<T, S> outgoing(S state) {
    return transitions.get(state).orElseGet(LinearMap::new);
  }

  @Override
  public String toString() {
    return "Dfa{initial=" + initial + ", accepting=" + table.accepting() + ", transitions=" + transitions() + "}";
  }
}
