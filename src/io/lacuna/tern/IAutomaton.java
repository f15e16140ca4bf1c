package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.ISet;

/**
 * The operations shared by every automaton.  Adding a transition registers both of its states and its label, and
 * removing a state removes every transition touching it.  Collections returned by these methods are copies.
 *
 * @param <S> the state type, compared using {@code equals} and {@code hashCode}
 * @param <L> the transition label type, either a symbol or an interval of symbols
 */
public interface IAutomaton<S, L> {

  ISet<S> states();

  ISet<S> acceptingStates();

  boolean containsState(S state);

  boolean isAccepting(S state);

  IList<Transition<S, L>> transitions();

  /**
   * @return every label that has been used in a transition since the automaton was last cleared
   */
  IList<L> alphabet();

  boolean addState(S state);

  /**
   * Removes the state along with every transition into or out of it.
   */
  boolean removeState(S state);

  /**
   * Marks the state as accepting, adding it if necessary.
   */
  boolean addAccepting(S state);

  boolean removeAccepting(S state);

  boolean addTransition(S from, L label, S to);

  boolean removeTransition(S from, L label, S to);

  /**
   * @return every state reachable from the initial state or states
   */
  ISet<S> reachableStates();

  default boolean removeUnreachable() {
    ISet<S> reachable = reachableStates();
    boolean changed = false;
    for (S state : states()) {
      if (!reachable.contains(state)) {
        changed |= removeState(state);
      }
    }
    return changed;
  }

  /**
   * Removes every state, transition and alphabet entry.
   */
  void clear();
}
