package io.lacuna.tern.intervals;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.BinaryOperator;

import static org.junit.jupiter.api.Assertions.*;

class IntervalMapTest {

  private static final BinaryOperator<String> CONCAT = (a, b) -> a + b;

  private static IntervalMap<Integer, String> map(Interval<Integer> interval, String value) {
    IntervalMap<Integer, String> m = IntervalMap.natural();
    m.addAndUpdate(interval, value, CONCAT);
    return m;
  }

  @Nested
  @DisplayName("inserting over a single entry")
  class SingleOverlap {

    @Test
    void intoEmptyMap() {
      IntervalMap<Integer, Set<Integer>> m = IntervalMap.natural();
      BinaryOperator<Set<Integer>> union = (a, b) -> {
        Set<Integer> s = new HashSet<>(a);
        s.addAll(b);
        return s;
      };

      m.addAndUpdate(Interval.closedOpen(2, 3), Set.of(1), union);
      assertEquals(1, m.size());

      m.addAndUpdate(Interval.closedOpen(2, 3), Set.of(1), union);
      assertEquals(1, m.size());
      assertEquals(Interval.closedOpen(2, 3), m.entries().nth(0).interval());
      assertEquals(Set.of(1), m.entries().nth(0).value());
    }

    @Test
    void contained() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 10), "a");
      m.addAndUpdate(Interval.closedOpen(3, 5), "b", CONCAT);
      assertEquals("{[0; 3) -> a, [3; 5) -> ab, [5; 10) -> a}", m.toString());
    }

    @Test
    void containing() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(3, 5), "a");
      m.addAndUpdate(Interval.closedOpen(0, 10), "b", CONCAT);
      assertEquals("{[0; 3) -> b, [3; 5) -> ab, [5; 10) -> b}", m.toString());
    }

    @Test
    void overlapping() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 5), "a");
      m.addAndUpdate(Interval.closedOpen(3, 8), "b", CONCAT);
      assertEquals("{[0; 3) -> a, [3; 5) -> ab, [5; 8) -> b}", m.toString());

      m = map(Interval.closedOpen(3, 8), "a");
      m.addAndUpdate(Interval.closedOpen(0, 5), "b", CONCAT);
      assertEquals("{[0; 3) -> b, [3; 5) -> ab, [5; 8) -> a}", m.toString());
    }

    @Test
    void startingAndFinishing() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 10), "a");
      m.addAndUpdate(Interval.closedOpen(0, 4), "b", CONCAT);
      assertEquals("{[0; 4) -> ab, [4; 10) -> a}", m.toString());

      m = map(Interval.closedOpen(0, 10), "a");
      m.addAndUpdate(Interval.closedOpen(6, 10), "b", CONCAT);
      assertEquals("{[0; 6) -> a, [6; 10) -> ab}", m.toString());
    }

    @Test
    void equal() {
      IntervalMap<Integer, String> m = map(Interval.atMost(3), "a");
      m.addAndUpdate(Interval.atMost(3), "b", CONCAT);
      assertEquals("{(-∞; 3] -> ab}", m.toString());
    }

    @Test
    void disjoint() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(5, 8), "a");
      m.addAndUpdate(Interval.closedOpen(0, 5), "b", CONCAT);
      m.addAndUpdate(Interval.atLeast(10), "c", CONCAT);
      assertEquals("{[0; 5) -> b, [5; 8) -> a, [10; +∞) -> c}", m.toString());
    }

    @Test
    void emptyIntervalsAreRejected() {
      IntervalMap<Integer, String> m = IntervalMap.natural();
      assertThrows(IllegalArgumentException.class, () -> m.addAndUpdate(Interval.open(1, 1), "a", CONCAT));
      assertTrue(m.isEmpty());
    }
  }

  @Nested
  @DisplayName("inserting over several entries")
  class MultipleOverlaps {

    @Test
    void fillsGaps() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 2), "a");
      m.addAndUpdate(Interval.closedOpen(4, 6), "c", CONCAT);
      m.addAndUpdate(Interval.closedOpen(1, 10), "b", CONCAT);
      assertEquals("{[0; 1) -> a, [1; 2) -> ab, [2; 4) -> b, [4; 6) -> cb, [6; 10) -> b}", m.toString());
    }

    @Test
    void splitsLastEntry() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 2), "a");
      m.addAndUpdate(Interval.closedOpen(3, 8), "c", CONCAT);
      m.addAndUpdate(Interval.closedOpen(1, 5), "b", CONCAT);
      assertEquals("{[0; 1) -> a, [1; 2) -> ab, [2; 3) -> b, [3; 5) -> cb, [5; 8) -> c}", m.toString());
    }

    @Test
    void touchingEntriesLeaveNoGap() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 2), "a");
      m.addAndUpdate(Interval.closedOpen(2, 4), "c", CONCAT);
      m.addAndUpdate(Interval.closedOpen(0, 4), "b", CONCAT);
      assertEquals("{[0; 2) -> ab, [2; 4) -> cb}", m.toString());
    }

    @Test
    void unboundedEntries() {
      IntervalMap<Integer, String> m = map(Interval.lessThan(0), "a");
      m.addAndUpdate(Interval.atLeast(5), "c", CONCAT);
      m.addAndUpdate(Interval.full(), "b", CONCAT);
      assertEquals("{(-∞; 0) -> ab, [0; 5) -> b, [5; +∞) -> cb}", m.toString());
    }
  }

  @Nested
  @DisplayName("queries and updates")
  class Queries {

    @Test
    void pointLookup() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 5), "a");
      m.addAndUpdate(Interval.open(5, 9), "b", CONCAT);

      assertAll(
          () -> assertEquals(Optional.of("a"), m.get(0)),
          () -> assertEquals(Optional.of("a"), m.get(4)),
          () -> assertEquals(Optional.empty(), m.get(5)),
          () -> assertEquals(Optional.of("b"), m.get(6)),
          () -> assertEquals(Optional.empty(), m.get(9)),
          () -> assertEquals(Optional.empty(), m.get(-1)));
    }

    @Test
    void intersectingEntries() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 5), "a");
      m.addAndUpdate(Interval.closedOpen(5, 9), "b", CONCAT);
      m.addAndUpdate(Interval.closedOpen(20, 30), "c", CONCAT);

      assertEquals(2, m.entries(Interval.closed(4, 10)).size());
      assertEquals(1, m.entries(Interval.closed(9, 20)).size());
      assertEquals(0, m.entries(Interval.open(9, 20)).size());
    }

    @Test
    void coverage() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 5), "a");
      m.addAndUpdate(Interval.closedOpen(5, 9), "a", CONCAT);
      m.addAndUpdate(Interval.open(9, 12), "a", CONCAT);

      assertTrue(m.covers(Interval.closedOpen(2, 9), "a"::equals));
      assertFalse(m.covers(Interval.closed(2, 9), "a"::equals));
      assertFalse(m.covers(Interval.closedOpen(-1, 3), "a"::equals));
      assertFalse(m.covers(Interval.closedOpen(2, 9), "b"::equals));
    }

    @Test
    void updateAndRemove() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 10), "a");

      assertTrue(m.update(Interval.closedOpen(2, 4), v -> v + "!"));
      assertEquals("{[0; 2) -> a, [2; 4) -> a!, [4; 10) -> a}", m.toString());

      assertFalse(m.update(Interval.closedOpen(5, 7), v -> v));
      assertEquals(3, m.size());

      assertTrue(m.remove(Interval.closed(3, 5)));
      assertEquals("{[0; 2) -> a, [2; 3) -> a!, (5; 10) -> a}", m.toString());
      assertFalse(m.remove(Interval.closed(4, 5)));
    }

    @Test
    void replaceValues() {
      IntervalMap<Integer, String> m = map(Interval.closedOpen(0, 5), "a");
      m.addAndUpdate(Interval.closedOpen(5, 9), "b", CONCAT);

      assertTrue(m.replaceValues(v -> v.equals("a") ? null : v + v));
      assertEquals("{[5; 9) -> bb}", m.toString());
      assertFalse(m.replaceValues(v -> v));
    }
  }

  @Nested
  @DisplayName("invariants")
  class Invariants {

    private Interval<Double> randomInterval(Random r) {
      double a = r.nextInt(20);
      double b = a + r.nextInt(8);
      Bound<Double> lower = r.nextInt(10) == 0
          ? Bound.unbounded()
          : r.nextBoolean() ? Bound.inclusive(a) : Bound.exclusive(a);
      Bound<Double> upper = r.nextInt(10) == 0
          ? Bound.unbounded()
          : r.nextBoolean() ? Bound.inclusive(b) : Bound.exclusive(b);
      return new Interval<>(lower, upper);
    }

    private void assertOrdered(IntervalMap<Double, Integer> m) {
      IntervalComparator<Double> cmp = m.comparator();
      IntervalMap.Entry<Double, Integer> prev = null;
      for (IntervalMap.Entry<Double, Integer> e : m) {
        assertFalse(cmp.isEmpty(e.interval()), () -> "empty entry in " + m);
        if (prev != null) {
          assertTrue(cmp.isBefore(prev.interval(), e.interval()), () -> "entries out of order in " + m);
        }
        prev = e;
      }
    }

    @Test
    void randomInsertionsMatchPointwiseModel() {
      Random r = new Random(42);
      IntervalComparator<Double> cmp = IntervalComparator.natural();

      for (int round = 0; round < 200; round++) {
        IntervalMap<Double, Integer> m = new IntervalMap<>(cmp);
        Integer[] model = new Integer[64];

        for (int i = 0; i < 8; i++) {
          Interval<Double> iv = randomInterval(r);
          if (cmp.isEmpty(iv)) {
            continue;
          }
          int value = 1 + r.nextInt(3);
          m.addAndUpdate(iv, value, Integer::sum);
          for (int k = 0; k < model.length; k++) {
            if (cmp.contains(iv, k / 2.0)) {
              model[k] = model[k] == null ? value : model[k] + value;
            }
          }
          assertOrdered(m);
        }

        for (int k = 0; k < model.length; k++) {
          assertEquals(Optional.ofNullable(model[k]), m.get(k / 2.0), "at " + (k / 2.0) + " in " + m);
        }

        int before = m.size();
        m.mergeTouching();
        String merged = m.toString();
        assertTrue(m.size() <= before);
        assertOrdered(m);

        IntervalMap.Entry<Double, Integer> prev = null;
        for (IntervalMap.Entry<Double, Integer> e : m) {
          if (prev != null && cmp.bounds().isTouching(prev.interval().upper(), e.interval().lower())) {
            assertNotEquals(prev.value(), e.value());
          }
          prev = e;
        }

        for (int k = 0; k < model.length; k++) {
          assertEquals(Optional.ofNullable(model[k]), m.get(k / 2.0));
        }

        m.mergeTouching();
        assertEquals(merged, m.toString());
      }
    }

    @Test
    void mergeTouchingUsesValueEquality() {
      IntervalMap<Integer, String> m = new IntervalMap<>(IntervalComparator.<Integer>natural(), String::equalsIgnoreCase);
      m.addAndUpdate(Interval.closedOpen(0, 5), "a", CONCAT);
      m.addAndUpdate(Interval.closedOpen(5, 9), "A", CONCAT);
      m.addAndUpdate(Interval.open(9, 12), "a", CONCAT);
      m.mergeTouching();

      assertEquals("{[0; 9) -> a, (9; 12) -> a}", m.toString());
    }
  }
}
