package io.lacuna.tern;

import io.lacuna.bifurcan.LinearSet;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

public final class StateCombiners {

  private StateCombiners() {
  }

  /**
   * Each set of states becomes a state of its own.
   */
  public static <S> IStateCombiner<S, StateSet<S>> toSet() {
    return states -> states;
  }

  /**
   * Flattens a set of {@link StateSet}s into one, so that minimizing a determinized automaton yields states which are
   * still sets of the original states.
   */
  public static <S> IStateCombiner<StateSet<S>, StateSet<S>> union() {
    return sets -> {
      LinearSet<S> acc = new LinearSet<>();
      for (StateSet<S> set : sets) {
        set.forEach(acc::add);
      }
      return StateSet.from(acc);
    };
  }

  /**
   * Numbers each distinct set of states from zero upwards, in the order they are first seen.  The returned combiner is
   * stateful, and should be used for a single determinization or minimization.
   */
  public static <S> IStateCombiner<S, Integer> numbering() {
    AtomicInteger counter = new AtomicInteger();
    Function<StateSet<S>, Integer> f = Utils.memoize(states -> counter.getAndIncrement());
    return f::apply;
  }
}
