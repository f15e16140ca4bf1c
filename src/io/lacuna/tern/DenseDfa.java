package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.tern.intervals.Interval;
import io.lacuna.tern.intervals.IntervalComparator;
import io.lacuna.tern.intervals.IntervalMap;
import io.lacuna.tern.intervals.IntervalSet;

import java.util.Collections;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * A deterministic automaton whose transitions are labeled with intervals of an ordered alphabet, such as ranges of
 * code points.
 *
 * @param <S> the state type
 * @param <T> the symbol type
 */
public class DenseDfa<S, T> implements IDfa<S, Interval<T>> {

  private final IntervalComparator<T> comparator;
  private final StateTable<S> table = new StateTable<>();
  private final LinearMap<S, IntervalMap<T, S>> transitions = new LinearMap<>();
  private final IntervalSet<T> alphabet;
  private S initial;

  public DenseDfa(Comparator<? super T> comparator) {
    this(new IntervalComparator<>(comparator));
  }

  public DenseDfa(IntervalComparator<T> comparator) {
    this.comparator = Objects.requireNonNull(comparator);
    this.alphabet = new IntervalSet<>(comparator);
  }

  public static <S, T extends Comparable<? super T>> DenseDfa<S, T> natural() {
    return new DenseDfa<>(IntervalComparator.<T>natural());
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
      IntervalMap<T, S> m = transitions.get(from).get();
      m.replaceValues(to -> to.equals(state) ? null : to);
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
  public IList<Transition<S, Interval<T>>> transitions() {
    LinearList<Transition<S, Interval<T>>> result = new LinearList<>();
    for (S from : transitions.keys()) {
      for (IntervalMap.Entry<T, S> e : transitions.get(from).get()) {
        result.addLast(new Transition<>(from, e.interval(), e.value()));
      }
    }
    return result;
  }

  @Override
  public IList<Interval<T>> alphabet() {
    return alphabet.intervals();
  }

  /**
   * Adds a transition on every symbol in {@code symbols}, replacing any existing transitions from {@code from} on
   * those symbols.
   *
   * @throws IllegalArgumentException if {@code symbols} is empty
   */
  @Override
  public boolean addTransition(S from, Interval<T> symbols, S to) {
    Objects.requireNonNull(to);
    alphabet.add(symbols);
    table.add(from);
    table.add(to);

    IntervalMap<T, S> m = transitions.getOrCreate(from, () -> new IntervalMap<>(comparator));
    if (m.covers(symbols, to::equals)) {
      return false;
    }
    m.addAndUpdate(symbols, to, (existing, added) -> added);
    return true;
  }

  /**
   * Adds a transition on the single {@code symbol}.
   */
  public boolean addSymbolTransition(S from, T symbol, S to) {
    return addTransition(from, Interval.singleton(symbol), to);
  }

  /**
   * Removes the transitions to {@code to} on any of {@code symbols}.
   */
  @Override
  public boolean removeTransition(S from, Interval<T> symbols, S to) {
    Optional<IntervalMap<T, S>> m = transitions.get(from);
    if (!m.isPresent()) {
      return false;
    }

    boolean changed = m.get().update(symbols, dst -> dst.equals(to) ? null : dst);
    if (m.get().isEmpty()) {
      transitions.remove(from);
    }
    return changed;
  }

  public Optional<S> transition(S from, T symbol) {
    return transitions.get(from).flatMap(m -> m.get(symbol));
  }

  @Override
  public IList<S> successors(S state) {
    LinearList<S> result = new LinearList<>();
    for (IntervalMap.Entry<T, S> e : outgoing(state)) {
      result.addLast(e.value());
    }
    return result;
  }

  @Override
  public IList<StatePair<S>> successors(S a, S b) {
    IntervalMap<T, StatePair<S>> aligned = new IntervalMap<>(comparator);
    for (IntervalMap.Entry<T, S> e : outgoing(a)) {
      aligned.addAndUpdate(e.interval(), new StatePair<>(e.value(), null), StatePair::merge);
    }
    for (IntervalMap.Entry<T, S> e : outgoing(b)) {
      aligned.addAndUpdate(e.interval(), new StatePair<>(null, e.value()), StatePair::merge);
    }

    LinearList<StatePair<S>> result = new LinearList<>();
    for (IntervalMap.Entry<T, StatePair<S>> e : aligned) {
      result.addLast(e.value());
    }
    return result;
  }

  /**
   * Fuses touching intervals which lead to the same state.
   */
  public void compact() {
    for (IntervalMap<T, S> m : transitions.values()) {
      m.mergeTouching();
    }
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
    return Utils.breadthFirst(LinearList.of(initialState()), this::successors);
  }

  /// completion

  /**
   * @return true if every state has a transition on every value in {@code symbols}
   */
  public boolean isComplete(Iterable<Interval<T>> symbols) {
    for (S s : table.states()) {
      IntervalMap<T, S> m = outgoing(s);
      for (Interval<T> interval : symbols) {
        if (!m.covers(interval, dst -> true)) {
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
   * Fills every gap within {@code symbols} with a transition to {@code trap}, leaving existing transitions intact.  If
   * any gap was filled, the gaps in {@code trap}'s own transitions are filled with transitions to itself.
   *
   * @return true if any transition was added
   * @throws IllegalArgumentException if {@code symbols} is empty
   */
  public boolean complete(Iterable<Interval<T>> symbols, S trap) {
    Objects.requireNonNull(trap);
    LinearList<Interval<T>> required = new LinearList<>();
    symbols.forEach(required::addLast);
    if (required.size() == 0) {
      throw new IllegalArgumentException("cannot complete over an empty alphabet");
    }

    boolean changed = false;
    for (S s : Utils.copy(table.states())) {
      if (!s.equals(trap)) {
        changed |= fill(s, required, trap);
      }
    }
    if (changed) {
      fill(trap, required, trap);
    }
    return changed;
  }

  /**
   * Completes the automaton over every symbol it has seen so far.
   *
   * @throws IllegalStateException if no symbols have been seen
   */
  public boolean complete(S trap) {
    if (alphabet.isEmpty()) {
      throw new IllegalStateException("cannot complete an automaton with no alphabet");
    }
    return complete(alphabet.intervals(), trap);
  }

  private boolean fill(S state, Iterable<Interval<T>> symbols, S trap) {
    boolean changed = false;
    for (Interval<T> interval : symbols) {
      IntervalMap<T, S> m = transitions.getOrCreate(state, () -> new IntervalMap<>(comparator));
      if (!m.covers(interval, dst -> true)) {
        alphabet.add(interval);
        table.add(trap);
        m.addAndUpdate(interval, trap, (existing, added) -> existing);
        changed = true;
      }
    }
    return changed;
  }

  /// minimization

  public DenseDfa<StateSet<S>, T> minimize() {
    return minimize(StateCombiners.toSet());
  }

  public <R> DenseDfa<R, T> minimize(IStateCombiner<S, R> combiner) {
    return minimize(combiner, Collections.emptyList());
  }

  public <R> DenseDfa<R, T> minimize(IStateCombiner<S, R> combiner, Iterable<StatePair<S>> differentiate) {
    return minimize(combiner, differentiate, () -> false);
  }

  /**
   * Returns the equivalent automaton with the fewest states, never merging the states of any pair in
   * {@code differentiate}.  This automaton is left unchanged.
   *
   * @see Minimizer#differentiating(IAutomaton, Iterable)
   */
  public <R> DenseDfa<R, T> minimize(
      IStateCombiner<S, R> combiner,
      Iterable<StatePair<S>> differentiate,
      BooleanSupplier cancelled) {
    DenseDfa<R, T> result = Minimizer.minimize(this, combiner, differentiate, () -> new DenseDfa<>(comparator), cancelled);
    result.compact();
    return result;
  }

  ///

  @Override
  public void clear() {
    table.clear();
    initial = null;
    for (S from : Utils.copy(transitions.keys())) {
      transitions.remove(from);
    }
    alphabet.clear();
  }

  private IntervalMap<T, S> outgoing(S state) {
    return transitions.get(state).orElseGet(() -> new IntervalMap<>(comparator));
  }

  @Override
  public String toString() {
    return "DenseDfa{initial=" + initial + ", accepting=" + table.accepting() + ", transitions=" + transitions() + "}";
  }
}
