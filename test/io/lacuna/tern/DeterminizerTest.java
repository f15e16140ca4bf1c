package io.lacuna.tern;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicInteger;

import static io.lacuna.tern.Samples.chars;
import static org.junit.jupiter.api.Assertions.*;

class DeterminizerTest {

  private static final List<Character> AB = List.of('a', 'b');

  // 0 --a--> 1, 0 --b--> 2, 1 --ε--> 3, 2 --ε--> 3
  private static Nfa<Integer, Character> diamond() {
    Nfa<Integer, Character> nfa = new Nfa<>();
    nfa.addInitial(0);
    nfa.addTransition(0, 'a', 1);
    nfa.addTransition(0, 'b', 2);
    nfa.addEpsilonTransition(1, 3);
    nfa.addEpsilonTransition(2, 3);
    nfa.addAccepting(3);
    return nfa;
  }

  @Test
  @DisplayName("epsilon-closed subsets become states, and minimization merges the equivalent ones")
  void diamondScenario() {
    Dfa<StateSet<Integer>, Character> dfa = diamond().determinize();

    assertEquals(StateSet.of(0), dfa.initialState());
    assertEquals(3, dfa.states().size());
    assertTrue(dfa.isAccepting(StateSet.of(1, 3)));
    assertTrue(dfa.isAccepting(StateSet.of(3, 2)));

    Dfa<StateSet<Integer>, Character> min = dfa.minimize(StateCombiners.union());
    assertEquals(2, min.states().size());
    assertEquals(1, min.acceptingStates().size());
    assertEquals(min.transition(min.initialState(), 'a'), min.transition(min.initialState(), 'b'));
    assertEquals(StateSet.of(1, 2, 3), min.transition(min.initialState(), 'a').get());

    Dfa<StateSet<Integer>, Character> again = min.minimize(StateCombiners.union());
    assertEquals(2, again.states().size());
    assertEquals(2, again.transitions().size());
  }

  @Test
  @DisplayName("the same subset reached along different paths becomes one state")
  void combinerStability() {
    Nfa<Integer, Character> nfa = new Nfa<>();
    nfa.addInitial(0);
    nfa.addTransition(0, 'a', 1);
    nfa.addTransition(0, 'a', 2);
    nfa.addTransition(0, 'b', 2);
    nfa.addTransition(0, 'b', 1);
    nfa.addAccepting(2);

    Dfa<Integer, Character> dfa = nfa.determinize(StateCombiners.numbering());
    assertEquals(2, dfa.states().size());
    assertEquals(dfa.transition(dfa.initialState(), 'a'), dfa.transition(dfa.initialState(), 'b'));
  }

  @Test
  void languageIsPreserved() {
    Random r = new Random(7);
    List<List<Character>> words = Samples.words(AB, 6);

    for (int i = 0; i < 50; i++) {
      Nfa<Integer, Character> nfa = Samples.randomNfa(r, 6, AB);
      Dfa<StateSet<Integer>, Character> dfa = nfa.determinize();

      for (List<Character> w : words) {
        assertEquals(nfa.accepts(w), dfa.accepts(w), () -> w + " in " + nfa);
      }
    }
  }

  @Test
  void inputIsLeftUntouched() {
    Nfa<Integer, Character> nfa = diamond();
    nfa.determinize();

    assertEquals(4, nfa.states().size());
    assertEquals(2, nfa.transitions().size());
    assertEquals(1, nfa.epsilonTransitions(1).size());
  }

  @Test
  void missingInitialStateFailsFast() {
    Nfa<Integer, Character> nfa = diamond();
    nfa.removeInitial(0);
    assertThrows(IllegalStateException.class, nfa::determinize);
  }

  @Test
  void cancellation() {
    Nfa<Integer, Character> nfa = diamond();
    AtomicInteger polls = new AtomicInteger();

    assertThrows(CancellationException.class,
        () -> nfa.determinize(StateCombiners.toSet(), () -> polls.incrementAndGet() > 1));
    assertEquals(2, polls.get());
    assertEquals(4, nfa.states().size());
    assertTrue(nfa.accepts(chars("a")));
  }
}
