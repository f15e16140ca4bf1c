package io.lacuna.tern;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static io.lacuna.tern.Samples.chars;
import static org.junit.jupiter.api.Assertions.*;

class DfaTest {

  private Dfa<Integer, Character> dfa;

  // accepts "ab*"
  @BeforeEach
  void setUp() {
    dfa = new Dfa<>();
    dfa.setInitialState(0);
    dfa.addTransition(0, 'a', 1);
    dfa.addTransition(1, 'b', 1);
    dfa.addAccepting(1);
  }

  @Nested
  @DisplayName("construction")
  class Construction {

    @Test
    void transitionsReplaceEarlierOnes() {
      assertFalse(dfa.addTransition(0, 'a', 1));
      assertTrue(dfa.addTransition(0, 'a', 2));
      assertEquals(Optional.of(2), dfa.transition(0, 'a'));
      assertEquals(2, dfa.transitions().size());
    }

    @Test
    void removeTransitionRequiresMatchingDestination() {
      assertFalse(dfa.removeTransition(0, 'a', 2));
      assertTrue(dfa.removeTransition(0, 'a', 1));
      assertEquals(Optional.empty(), dfa.transition(0, 'a'));
      assertEquals(2, dfa.alphabet().size());
    }

    @Test
    void removingTheInitialState() {
      assertTrue(dfa.removeState(0));
      assertFalse(dfa.hasInitialState());
      assertThrows(IllegalStateException.class, () -> dfa.initialState());
      assertThrows(IllegalStateException.class, () -> dfa.accepts(chars("a")));
      assertEquals(1, dfa.transitions().size());
    }

    @Test
    void removingADestinationState() {
      assertTrue(dfa.removeState(1));
      assertEquals(0, dfa.transitions().size());
      assertEquals(0, dfa.acceptingStates().size());
      assertEquals(0, dfa.initialState());
    }

    @Test
    void successorPairs() {
      dfa.addTransition(0, 'c', 0);
      int both = 0;
      int onlyFirst = 0;
      int onlySecond = 0;
      for (StatePair<Integer> p : dfa.successors(0, 1)) {
        if (p.first() != null && p.second() != null) {
          both++;
        } else if (p.first() != null) {
          onlyFirst++;
        } else {
          onlySecond++;
        }
      }
      assertEquals(0, both);
      assertEquals(2, onlyFirst);
      assertEquals(1, onlySecond);
    }
  }

  @Nested
  @DisplayName("execution")
  class Execution {

    @Test
    void accepts() {
      assertAll(
          () -> assertTrue(dfa.accepts(chars("a"))),
          () -> assertTrue(dfa.accepts(chars("abbb"))),
          () -> assertFalse(dfa.accepts(chars(""))),
          () -> assertFalse(dfa.accepts(chars("ba"))),
          () -> assertFalse(dfa.accepts(chars("abc"))));
    }

    @Test
    void unreachableStates() {
      dfa.addTransition(7, 'a', 8);
      assertEquals(2, dfa.reachableStates().size());
      assertTrue(dfa.removeUnreachable());
      assertEquals(2, dfa.states().size());
    }
  }

  @Nested
  @DisplayName("completion")
  class Completion {

    @Test
    void completeOverExplicitAlphabet() {
      assertFalse(dfa.isComplete(List.of('a', 'b')));
      assertTrue(dfa.complete(List.of('a', 'b'), 9));

      assertTrue(dfa.isComplete(List.of('a', 'b')));
      assertEquals(6, dfa.transitions().size());
      assertEquals(Optional.of(9), dfa.transition(9, 'a'));
      assertTrue(dfa.accepts(chars("abb")));
      assertFalse(dfa.accepts(chars("aba")));

      assertFalse(dfa.complete(List.of('a', 'b'), 9));
    }

    @Test
    void completeOverTrackedAlphabet() {
      assertTrue(dfa.complete(9));
      assertTrue(dfa.isComplete());
    }

    @Test
    void completionNeedsAnAlphabet() {
      Dfa<Integer, Character> empty = new Dfa<>();
      empty.setInitialState(0);
      assertThrows(IllegalStateException.class, () -> empty.complete(9));
      assertThrows(IllegalArgumentException.class, () -> dfa.complete(List.of(), 9));
    }
  }
}
