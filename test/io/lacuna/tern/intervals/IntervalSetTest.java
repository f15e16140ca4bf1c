package io.lacuna.tern.intervals;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IntervalSetTest {

  private IntervalSet<Integer> set;

  @BeforeEach
  void setUp() {
    set = IntervalSet.natural();
    set.add(Interval.atMost(5));
    set.add(Interval.open(7, 9));
  }

  @Test
  @DisplayName("a point next to, but not touching, an interval stays separate")
  void separatePoint() {
    assertTrue(set.add(Interval.singleton(10)));
    assertEquals("[(-∞; 5], (7; 9), [10; 10]]", set.toString());
  }

  @Test
  @DisplayName("touching intervals are fused")
  void fusesTouching() {
    set.add(Interval.singleton(10));
    assertTrue(set.add(Interval.closedOpen(9, 10)));
    assertEquals("[(-∞; 5], (7; 10]]", set.toString());

    assertTrue(set.add(Interval.openClosed(5, 7)));
    assertEquals("[(-∞; 10]]", set.toString());
  }

  @Test
  void addingCoveredValuesIsANoOp() {
    assertFalse(set.add(Interval.closed(0, 1)));
    assertFalse(set.add(Interval.closedOpen(8, 9)));
    assertEquals(2, set.size());
    assertThrows(IllegalArgumentException.class, () -> set.add(Interval.open(3, 3)));
  }

  @Test
  void membership() {
    assertAll(
        () -> assertTrue(set.contains(Integer.MIN_VALUE)),
        () -> assertTrue(set.contains(5)),
        () -> assertFalse(set.contains(6)),
        () -> assertFalse(set.contains(7)),
        () -> assertTrue(set.contains(8)),
        () -> assertFalse(set.contains(9)),
        () -> assertTrue(set.contains(Interval.closed(0, 5))),
        () -> assertFalse(set.contains(Interval.closed(4, 8))),
        () -> assertTrue(set.overlaps(Interval.closed(4, 8))),
        () -> assertFalse(set.overlaps(Interval.openClosed(5, 7))));
  }

  @Test
  void removal() {
    set.add(Interval.closed(9, 10));
    assertTrue(set.remove(Interval.closed(3, 8)));
    assertEquals("[(-∞; 3), (8; 10]]", set.toString());
    assertFalse(set.remove(Interval.closed(4, 8)));
  }

  @Test
  void complement() {
    set.add(Interval.closed(9, 10));
    set.remove(Interval.closed(3, 8));

    IntervalSet<Integer> complement = set.complement();
    assertEquals("[[3; 8], (10; +∞)]", complement.toString());
    assertEquals(set, complement.complement());
    assertEquals("[(-∞; +∞)]", IntervalSet.<Integer>natural().complement().toString());
  }
}
