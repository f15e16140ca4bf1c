package io.lacuna.tern;

/**
 * Maps a set of source states onto a single state in a derived automaton.  Implementations must depend only on the
 * contents of the set, so that equal sets always combine to equal states.
 *
 * @param <S> the source state type
 * @param <R> the resulting state type
 */
@FunctionalInterface
public interface IStateCombiner<S, R> {

  R combine(StateSet<S> states);
}
