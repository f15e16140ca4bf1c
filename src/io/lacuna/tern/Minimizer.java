package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Table-filling minimization.  Missing transitions are treated as leading to an implicit trap state, so the input
 * does not need to be complete.
 */
public final class Minimizer {

  private static final Logger logger = Logger.getLogger(Minimizer.class.getName());

  private Minimizer() {
  }

  /**
   * @param dfa          the automaton to minimize, which is only read
   * @param combiner     names each resulting state, given the equivalent states it replaces
   * @param differentiate pairs of states which must never be merged
   * @param factory      creates the empty DFA to populate
   * @param cancelled    polled before each pass over the table
   * @throws IllegalStateException    if the DFA has no initial state
   * @throws IllegalArgumentException if {@code differentiate} names a state not in the DFA
   * @throws CancellationException    if {@code cancelled} returns true
   */
  public static <S, L, R, D extends IDfa<R, L>> D minimize(
      IDfa<S, L> dfa,
      IStateCombiner<S, R> combiner,
      Iterable<StatePair<S>> differentiate,
      Supplier<D> factory,
      BooleanSupplier cancelled) {

    Objects.requireNonNull(combiner);
    Objects.requireNonNull(cancelled);
    S initial = dfa.initialState();

    EquivalenceTable<S> table = new EquivalenceTable<>(dfa);
    table.seed(differentiate);

    int passes = 0;
    do {
      do {
        if (cancelled.getAsBoolean()) {
          int n = passes;
          logger.fine(() -> String.format("minimization cancelled after %d passes", n));
          throw new CancellationException("minimization cancelled");
        }
        passes++;
      } while (table.refine());
    } while (table.separateConflicts());

    LinearMap<S, R> classes = table.classes(combiner);

    D result = factory.get();
    result.setInitialState(classes.get(initial).get());
    for (S s : dfa.states()) {
      R r = classes.get(s).get();
      result.addState(r);
      if (dfa.isAccepting(s)) {
        result.addAccepting(r);
      }
    }
    for (Transition<S, L> t : dfa.transitions()) {
      result.addTransition(classes.get(t.source()).get(), t.label(), classes.get(t.destination()).get());
    }

    int n = passes;
    logger.fine(() -> String.format("minimized %d states into %d in %d passes",
        dfa.states().size(), result.states().size(), n));

    return result;
  }

  /**
   * @return a pair of each of {@code states} with every other state in {@code automaton}, keeping each of them
   * separate from all others
   */
  public static <S> IList<StatePair<S>> differentiating(IAutomaton<S, ?> automaton, Iterable<S> states) {
    LinearList<StatePair<S>> pairs = new LinearList<>();
    for (S s : states) {
      if (!automaton.containsState(s)) {
        throw new IllegalArgumentException("cannot differentiate unknown state " + s);
      }
      for (S t : automaton.states()) {
        if (!s.equals(t)) {
          pairs.addLast(StatePair.of(s, t));
        }
      }
    }
    return pairs;
  }
}
