package io.lacuna.tern;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StateSetTest {

  @Test
  void equalityIgnoresOrder() {
    StateSet<Integer> a = StateSet.of(1, 2, 3);
    StateSet<Integer> b = StateSet.of(3, 1, 2, 2);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertEquals(3, b.size());
    assertNotEquals(a, StateSet.of(1, 2));
    assertNotEquals(a, StateSet.of(1, 2, 4));
  }

  @Test
  void membership() {
    StateSet<String> s = StateSet.of("x", "y");
    assertTrue(s.contains("x"));
    assertFalse(s.contains("z"));
    assertTrue(s.containsAny(StateSet.of("z", "y")));
    assertFalse(s.containsAny(StateSet.of("z")));
    assertTrue(StateSet.<String>of().isEmpty());
  }

  @Test
  void combiners() {
    IStateCombiner<Integer, Integer> numbering = StateCombiners.numbering();
    assertEquals(0, numbering.combine(StateSet.of(1, 2)));
    assertEquals(1, numbering.combine(StateSet.of(3)));
    assertEquals(0, numbering.combine(StateSet.of(2, 1)));

    IStateCombiner<StateSet<Integer>, StateSet<Integer>> union = StateCombiners.union();
    assertEquals(StateSet.of(1, 2, 3), union.combine(StateSet.of(StateSet.of(1, 2), StateSet.of(2, 3))));

    IStateCombiner<Integer, StateSet<Integer>> toSet = StateCombiners.toSet();
    assertEquals(StateSet.of(4, 5), toSet.combine(StateSet.of(5, 4)));
  }
}
