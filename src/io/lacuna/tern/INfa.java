package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearSet;

/**
 * An automaton with any number of initial states, several transitions per state and label, and epsilon transitions
 * which consume no input.
 */
public interface INfa<S, L> extends IAutomaton<S, L> {

  ISet<S> initialStates();

  /**
   * Marks the state as initial, adding it if necessary.
   */
  boolean addInitial(S state);

  boolean removeInitial(S state);

  boolean addEpsilonTransition(S from, S to);

  boolean removeEpsilonTransition(S from, S to);

  ISet<S> epsilonTransitions(S from);

  default ISet<S> epsilonClosure(S state) {
    return epsilonClosure(LinearSet.of(state));
  }

  /**
   * @return every state reachable from {@code states} through epsilon transitions alone, including {@code states}
   */
  ISet<S> epsilonClosure(Iterable<S> states);

  /**
   * Groups the transitions out of {@code sources} by label.  For dense automata the labels of the result are disjoint
   * intervals.  Epsilon transitions are not followed.
   */
  IList<Move<S, L>> moves(Iterable<S> sources);

  /**
   * Rewrites the automaton to accept the same language without any epsilon transitions.
   *
   * @return true if there were epsilon transitions to remove
   */
  boolean eliminateEpsilonTransitions();
}
