package io.lacuna.tern;

import io.lacuna.bifurcan.IList;

/**
 * An automaton with a single initial state, and at most one transition for any state and symbol.
 */
public interface IDfa<S, L> extends IAutomaton<S, L> {

  /**
   * @throws IllegalStateException if no initial state has been set
   */
  S initialState();

  boolean hasInitialState();

  /**
   * Sets the initial state, adding it if necessary.
   */
  void setInitialState(S state);

  /**
   * @return the destination of each transition out of {@code state}
   */
  IList<S> successors(S state);

  /**
   * Aligns the outgoing transitions of two states.  For every label either state can follow, the result holds the
   * destination from each, with null where a state has no transition on that label.
   */
  IList<StatePair<S>> successors(S a, S b);
}
