package io.lacuna.tern;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearSet;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Subset construction.  Each state of the resulting DFA stands for the epsilon-closed set of NFA states reachable
 * by some input, and is named by passing that set through a {@link IStateCombiner}.
 */
public final class Determinizer {

  private static final Logger logger = Logger.getLogger(Determinizer.class.getName());

  private Determinizer() {
  }

  /**
   * @param nfa       the automaton to determinize, which is only read
   * @param combiner  names each resulting state
   * @param factory   creates the empty DFA to populate
   * @param cancelled polled before each set of states is expanded
   * @throws IllegalStateException if the NFA has no initial states
   * @throws CancellationException if {@code cancelled} returns true
   */
  public static <S, L, R, D extends IDfa<R, L>> D determinize(
      INfa<S, L> nfa,
      IStateCombiner<S, R> combiner,
      Supplier<D> factory,
      BooleanSupplier cancelled) {

    Objects.requireNonNull(combiner);
    Objects.requireNonNull(cancelled);

    ISet<S> initial = nfa.initialStates();
    if (initial.size() == 0) {
      throw new IllegalStateException("cannot determinize an automaton with no initial states");
    }

    ISet<S> accepting = nfa.acceptingStates();
    Function<StateSet<S>, R> combine = Utils.memoize(combiner::combine);

    D dfa = factory.get();
    StateSet<S> start = StateSet.from(nfa.epsilonClosure(initial));
    dfa.setInitialState(combine.apply(start));

    LinearSet<StateSet<S>> visited = new LinearSet<>();
    LinearList<StateSet<S>> stack = new LinearList<>();
    visited.add(start);
    stack.addLast(start);

    while (stack.size() > 0) {
      if (cancelled.getAsBoolean()) {
        logger.fine(() -> String.format("determinization cancelled after %d sets of states", visited.size()));
        throw new CancellationException("determinization cancelled");
      }

      StateSet<S> current = stack.popLast();
      R source = combine.apply(current);
      if (current.containsAny(accepting)) {
        dfa.addAccepting(source);
      }

      for (Move<S, L> move : nfa.moves(current)) {
        StateSet<S> next = StateSet.from(nfa.epsilonClosure(move.destinations()));
        if (!visited.contains(next)) {
          visited.add(next);
          stack.addLast(next);
        }
        dfa.addTransition(source, move.label(), combine.apply(next));
      }
    }

    logger.fine(() -> String.format("determinized %d NFA states into %d DFA states",
        nfa.states().size(), visited.size()));

    return dfa;
  }
}
