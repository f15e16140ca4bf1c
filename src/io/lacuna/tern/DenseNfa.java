package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;
import io.lacuna.tern.intervals.Interval;
import io.lacuna.tern.intervals.IntervalComparator;
import io.lacuna.tern.intervals.IntervalMap;
import io.lacuna.tern.intervals.IntervalSet;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * A nondeterministic automaton whose transitions are labeled with intervals of an ordered alphabet.
 *
 * @param <S> the state type
 * @param <T> the symbol type
 */
public class DenseNfa<S, T> implements INfa<S, Interval<T>> {

  private final IntervalComparator<T> comparator;
  private final StateTable<S> table = new StateTable<>();
  private final EpsilonTable<S> epsilon = new EpsilonTable<>();
  private final LinearMap<S, IntervalMap<T, ISet<S>>> transitions = new LinearMap<>();
  private final IntervalSet<T> alphabet;

  public DenseNfa(Comparator<? super T> comparator) {
    this(new IntervalComparator<>(comparator));
  }

  public DenseNfa(IntervalComparator<T> comparator) {
    this.comparator = Objects.requireNonNull(comparator);
    this.alphabet = new IntervalSet<>(comparator);
  }

  public static <S, T extends Comparable<? super T>> DenseNfa<S, T> natural() {
    return new DenseNfa<>(IntervalComparator.<T>natural());
  }

  public IntervalComparator<T> comparator() {
    return comparator;
  }

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
      IntervalMap<T, ISet<S>> m = transitions.get(from).get();
      m.replaceValues(dsts -> remaining(dsts, state));
      if (m.isEmpty()) {
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
  public boolean addInitial(S state) {
    return table.addInitial(state);
  }

  @Override
  public boolean removeInitial(S state) {
    return table.removeInitial(state);
  }

  /// transitions

  /**
   * Lists one transition per destination for each interval in the transition table.  Intervals are split wherever
   * the set of destinations changes, so one added transition may be reported as several.
   */
  @Override
  public IList<Transition<S, Interval<T>>> transitions() {
    LinearList<Transition<S, Interval<T>>> result = new LinearList<>();
    for (S from : transitions.keys()) {
      for (IntervalMap.Entry<T, ISet<S>> e : transitions.get(from).get()) {
        for (S to : e.value()) {
          result.addLast(new Transition<>(from, e.interval(), to));
        }
      }
    }
    return result;
  }

  @Override
  public IList<Interval<T>> alphabet() {
    return alphabet.intervals();
  }

  /**
   * @throws IllegalArgumentException if {@code symbols} is empty
   */
  @Override
  public boolean addTransition(S from, Interval<T> symbols, S to) {
    Objects.requireNonNull(to);
    alphabet.add(symbols);
    table.add(from);
    table.add(to);

    IntervalMap<T, ISet<S>> m = transitions.getOrCreate(from, this::newTransitionMap);
    if (m.covers(symbols, dsts -> dsts.contains(to))) {
      return false;
    }
    m.addAndUpdate(symbols, LinearSet.of(to), Utils::union);
    return true;
  }

  /**
   * Adds a transition on the single {@code symbol}.
   */
  public boolean addSymbolTransition(S from, T symbol, S to) {
    return addTransition(from, Interval.singleton(symbol), to);
  }

  @Override
  public boolean removeTransition(S from, Interval<T> symbols, S to) {
    Optional<IntervalMap<T, ISet<S>>> m = transitions.get(from);
    if (!m.isPresent()) {
      return false;
    }

    boolean changed = m.get().update(symbols, dsts -> remaining(dsts, to));
    if (m.get().isEmpty()) {
      transitions.remove(from);
    }
    return changed;
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
  public IList<Move<S, Interval<T>>> moves(Iterable<S> sources) {
    IntervalMap<T, ISet<S>> grouped = newTransitionMap();
    for (S s : sources) {
      for (IntervalMap.Entry<T, ISet<S>> e : outgoing(s)) {
        grouped.addAndUpdate(e.interval(), e.value(), Utils::union);
      }
    }
    grouped.mergeTouching();

    LinearList<Move<S, Interval<T>>> result = new LinearList<>();
    for (IntervalMap.Entry<T, ISet<S>> e : grouped) {
      result.addLast(new Move<>(e.interval(), Utils.copy(e.value())));
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
        for (IntervalMap.Entry<T, ISet<S>> e : outgoing(t).entries()) {
          transitions.getOrCreate(s, this::newTransitionMap).addAndUpdate(e.interval(), e.value(), Utils::union);
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
      for (IntervalMap.Entry<T, ISet<S>> e : outgoing(s)) {
        e.value().forEach(next::add);
      }
      return next;
    });
  }

  /// determinization

  public DenseDfa<StateSet<S>, T> determinize() {
    return determinize(StateCombiners.toSet());
  }

  public <R> DenseDfa<R, T> determinize(IStateCombiner<S, R> combiner) {
    return determinize(combiner, () -> false);
  }

  /**
   * Returns an equivalent deterministic automaton.  This automaton is left unchanged.
   *
   * @throws IllegalStateException if there are no initial states
   */
  public <R> DenseDfa<R, T> determinize(IStateCombiner<S, R> combiner, BooleanSupplier cancelled) {
    DenseDfa<R, T> result = Determinizer.determinize(this, combiner, () -> new DenseDfa<>(comparator), cancelled);
    result.compact();
    return result;
  }

  ///

  @Override
  public void clear() {
    table.clear();
    epsilon.clear();
    for (S from : Utils.copy(transitions.keys())) {
      transitions.remove(from);
    }
    alphabet.clear();
  }

  private IntervalMap<T, ISet<S>> newTransitionMap() {
    return new IntervalMap<>(comparator, Utils::sameElements);
  }

  private IntervalMap<T, ISet<S>> outgoing(S state) {
    return transitions.get(state).orElseGet(this::newTransitionMap);
  }

  private ISet<S> step(ISet<S> states, T symbol) {
    LinearSet<S> next = new LinearSet<>();
    for (S s : states) {
      outgoing(s).get(symbol).ifPresent(dsts -> dsts.forEach(next::add));
    }
    return epsilon.closure(next);
  }

  // `dsts` without `state`, or null if nothing remains
  private static <S> ISet<S> remaining(ISet<S> dsts, S state) {
    if (!dsts.contains(state)) {
      return dsts;
    }
    return dsts.size() == 1 ? null : Utils.without(dsts, state);
  }

  @Override
  public String toString() {
    return "DenseNfa{initial=" + table.initial() + ", accepting=" + table.accepting()
        + ", transitions=" + transitions() + "}";
  }
}
