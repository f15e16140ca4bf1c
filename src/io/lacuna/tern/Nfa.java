package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * A nondeterministic automaton whose transitions are labeled with individual symbols.
 *
 * @param <S> the state type
 * @param <T> the symbol type, compared using {@code equals} and {@code hashCode}
 */
public class Nfa<S, T> implements INfa<S, T> {

  private final StateTable<S> table = new StateTable<>();
  private final EpsilonTable<S> epsilon = new EpsilonTable<>();
  private final LinearMap<S, LinearMap<T, LinearSet<S>>> transitions = new LinearMap<>();
  private final LinearSet<T> alphabet = new LinearSet<>();

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
  public ISet<S> initialStates() {
    return Utils.copy(table.initial());
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

    epsilon.removeState(state);
    transitions.remove(state);
    for (S from : Utils.copy(transitions.keys())) {
      for (T symbol : Utils.copy(outgoing(from).keys())) {
        removeTransition(from, symbol, state);
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
  public boolean addInitial(S state) {
    return table.addInitial(state);
  }

  @Override
  public boolean removeInitial(S state) {
    return table.removeInitial(state);
  }

  /// transitions

  @Override
  public IList<Transition<S, T>> transitions() {
    LinearList<Transition<S, T>> result = new LinearList<>();
    for (S from : transitions.keys()) {
      LinearMap<T, LinearSet<S>> m = transitions.get(from).get();
      for (T symbol : m.keys()) {
        for (S to : m.get(symbol).get()) {
          result.addLast(new Transition<>(from, symbol, to));
        }
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

  @Override
  public boolean addTransition(S from, T symbol, S to) {
    Objects.requireNonNull(symbol);
    table.add(from);
    table.add(to);
    alphabet.add(symbol);

    LinearSet<S> dsts = transitions.getOrCreate(from, LinearMap::new).getOrCreate(symbol, LinearSet::new);
    if (dsts.contains(to)) {
      return false;
    }
    dsts.add(to);
    return true;
  }

  @Override
  public boolean removeTransition(S from, T symbol, S to) {
    Optional<LinearSet<S>> dsts = transitions.get(from).flatMap(m -> m.get(symbol));
    if (!dsts.isPresent() || !dsts.get().contains(to)) {
      return false;
    }

    dsts.get().remove(to);
    if (dsts.get().size() == 0) {
      LinearMap<T, LinearSet<S>> m = transitions.get(from).get();
      m.remove(symbol);
      if (m.size() == 0) {
        transitions.remove(from);
      }
    }
    return true;
  }

  @Override
  public boolean addEpsilonTransition(S from, S to) {
    table.add(from);
    table.add(to);
    return epsilon.add(from, to);
  }

  @Override
  public boolean removeEpsilonTransition(S from, S to) {
    return epsilon.remove(from, to);
  }

  @Override
  public ISet<S> epsilonTransitions(S from) {
    return epsilon.from(from);
  }

  @Override
  public ISet<S> epsilonClosure(Iterable<S> states) {
    return epsilon.closure(states);
  }

  /**
   * @return every state reachable from {@code from} by consuming {@code symbol}, following epsilon transitions both
   * before and after
   */
  public ISet<S> transitions(S from, T symbol) {
    return step(epsilon.closure(LinearList.of(from)), symbol);
  }

  @Override
  public IList<Move<S, T>> moves(Iterable<S> sources) {
    LinearMap<T, LinearSet<S>> grouped = new LinearMap<>();
    for (S s : sources) {
      LinearMap<T, LinearSet<S>> m = outgoing(s);
      for (T symbol : m.keys()) {
        LinearSet<S> acc = grouped.getOrCreate(symbol, LinearSet::new);
        m.get(symbol).get().forEach(acc::add);
      }
    }

    LinearList<Move<S, T>> result = new LinearList<>();
    for (T symbol : grouped.keys()) {
      result.addLast(new Move<>(symbol, grouped.get(symbol).get()));
    }
    return result;
  }

  @Override
  public boolean eliminateEpsilonTransitions() {
    if (epsilon.isEmpty()) {
      return false;
    }

    for (S s : Utils.copy(table.states())) {
      for (S t : epsilon.closure(LinearList.of(s))) {
        if (t.equals(s)) {
          continue;
        }
        for (Transition<S, T> tr : relabeled(t, s)) {
          addTransition(s, tr.label(), tr.destination());
        }
        if (table.isInitial(s)) {
          table.addInitial(t);
        }
        if (table.isAccepting(t)) {
          table.addAccepting(s);
        }
      }
    }

    epsilon.clear();
    return true;
  }

  /// execution

  /**
   * @return true if some path through the automaton consumes all of {@code input} and ends in an accepting state
   */
  public boolean accepts(Iterable<T> input) {
    ISet<S> current = epsilon.closure(table.initial());
    for (T symbol : input) {
      current = step(current, symbol);
      if (current.size() == 0) {
        return false;
      }
    }
    return current.containsAny(table.accepting());
  }

  @Override
  public ISet<S> reachableStates() {
    return Utils.breadthFirst(Utils.copy(table.initial()), s -> {
      LinearSet<S> next = Utils.copy(epsilon.neighbors(s));
      for (LinearSet<S> dsts : outgoing(s).values()) {
        dsts.forEach(next::add);
      }
      return next;
    });
  }

  /// determinization

  public Dfa<StateSet<S>, T> determinize() {
    return determinize(StateCombiners.toSet());
  }

  public <R> Dfa<R, T> determinize(IStateCombiner<S, R> combiner) {
    return determinize(combiner, () -> false);
  }

  /**
   * Returns an equivalent deterministic automaton.  This automaton is left unchanged.
   *
   * @throws IllegalStateException if there are no initial states
   */
  public <R> Dfa<R, T> determinize(IStateCombiner<S, R> combiner, BooleanSupplier cancelled) {
    return Determinizer.determinize(this, combiner, Dfa::new, cancelled);
  }

  ///

  @Override
  public void clear() {
    table.clear();
    epsilon.clear();
    for (S from : Utils.copy(transitions.keys())) {
      transitions.remove(from);
    }
    for (T symbol : Utils.copy(alphabet)) {
      alphabet.remove(symbol);
    }
  }

  // epsilon-closed successors of an epsilon-closed set
  private ISet<S> step(ISet<S> states, T symbol) {
    LinearSet<S> next = new LinearSet<>();
    for (S s : states) {
      outgoing(s).get(symbol).ifPresent(dsts -> dsts.forEach(next::add));
    }
    return epsilon.closure(next);
  }

  private LinearMap<T, LinearSet<S>> outgoing(S state) {
    return transitions.get(state).orElseGet(LinearMap::new);
  }

  // a snapshot of the transitions out of `state`, relabeled as coming from `source`
  private IList<Transition<S, T>> relabeled(S state, S source) {
    LinearList<Transition<S, T>> result = new LinearList<>();
    LinearMap<T, LinearSet<S>> m = outgoing(state);
    for (T symbol : m.keys()) {
      for (S to : m.get(symbol).get()) {
        result.addLast(new Transition<>(source, symbol, to));
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "Nfa{initial=" + table.initial() + ", accepting=" + table.accepting() + ", transitions=" + transitions() + "}";
  }
}
