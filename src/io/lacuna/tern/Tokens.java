package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.IMap;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;

import java.util.Optional;

/**
 * Recovers which token each accepting state of a lexer's DFA stands for, when that DFA was derived from an NFA using
 * {@link StateCombiners#toSet()} and {@link StateCombiners#union()}.
 */
public final class Tokens {

  private Tokens() {
  }

  /**
   * @param dfa            a DFA whose states are sets of NFA states
   * @param tokens         the tokens, highest priority first
   * @param acceptingState each token, mapped onto the NFA state which accepts it
   * @return each accepting DFA state, mapped onto the highest priority token whose NFA state it contains
   * @throws IllegalArgumentException if a token has no accepting state
   */
  public static <S, K> IMap<StateSet<S>, K> acceptingTokens(
      IDfa<StateSet<S>, ?> dfa,
      IList<K> tokens,
      IMap<K, S> acceptingState) {

    LinearList<S> states = new LinearList<>();
    for (K token : tokens) {
      Optional<S> s = acceptingState.get(token);
      if (!s.isPresent()) {
        throw new IllegalArgumentException("no accepting state for token " + token);
      }
      states.addLast(s.get());
    }

    LinearMap<StateSet<S>, K> result = new LinearMap<>();
    for (StateSet<S> state : dfa.acceptingStates()) {
      for (int i = 0; i < states.size(); i++) {
        if (state.contains(states.nth(i))) {
          result.put(state, tokens.nth(i));
          break;
        }
      }
    }
    return result;
  }
}
