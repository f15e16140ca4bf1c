package io.lacuna.tern.intervals;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * A mutable set of values, stored as sorted, non-empty intervals that neither intersect nor touch each other.
 *
 * @param <T> the endpoint value type
 */
public class IntervalSet<T> implements Iterable<Interval<T>> {

  private final IntervalComparator<T> comparator;
  private final BoundComparator<T> bounds;
  private final List<Interval<T>> intervals = new ArrayList<>();

  public IntervalSet(IntervalComparator<T> comparator) {
    this.comparator = Objects.requireNonNull(comparator);
    this.bounds = comparator.bounds();
  }

  public static <T extends Comparable<? super T>> IntervalSet<T> natural() {
    return new IntervalSet<>(IntervalComparator.<T>natural());
  }

  public IntervalComparator<T> comparator() {
    return comparator;
  }

  public int size() {
    return intervals.size();
  }

  public boolean isEmpty() {
    return intervals.isEmpty();
  }

  public void clear() {
    intervals.clear();
  }

  @Override
  public Iterator<Interval<T>> iterator() {
    return Collections.unmodifiableList(intervals).iterator();
  }

  public IList<Interval<T>> intervals() {
    LinearList<Interval<T>> result = new LinearList<>();
    intervals.forEach(result::addLast);
    return result;
  }

  /**
   * Adds every value in {@code interval}, fusing it with any intervals it intersects or touches.
   *
   * @return true if the set changed
   * @throws IllegalArgumentException if {@code interval} is empty
   */
  public boolean add(Interval<T> interval) {
    comparator.requireNonEmpty(interval);

    // unlike lookups, adjacency counts here
    int from = search(i -> !isSeparate(intervals.get(i), interval));
    int to = search(i -> isSeparate(interval, intervals.get(i)));

    if (from == to) {
      intervals.add(from, interval);
      return true;
    }

    Interval<T> first = intervals.get(from);
    Interval<T> last = intervals.get(to - 1);
    if (to - from == 1 && comparator.contains(first, interval)) {
      return false;
    }

    Interval<T> merged = new Interval<>(
        bounds.minLower(first.lower(), interval.lower()),
        bounds.maxUpper(last.upper(), interval.upper()));
    intervals.subList(from, to).clear();
    intervals.add(from, merged);
    return true;
  }

  /**
   * Removes every value in {@code interval}.
   *
   * @return true if the set changed
   */
  public boolean remove(Interval<T> interval) {
    if (comparator.isEmpty(interval)) {
      return false;
    }

    int from = lowerIndex(interval);
    int to = upperIndex(interval);
    if (from == to) {
      return false;
    }

    List<Interval<T>> remainder = new ArrayList<>(2);
    Interval<T> first = intervals.get(from);
    Interval<T> last = intervals.get(to - 1);
    if (bounds.compareLower(first.lower(), interval.lower()) < 0) {
      remainder.add(new Interval<>(first.lower(), interval.lower().touching()));
    }
    if (bounds.compareUpper(last.upper(), interval.upper()) > 0) {
      remainder.add(new Interval<>(interval.upper().touching(), last.upper()));
    }

    intervals.subList(from, to).clear();
    intervals.addAll(from, remainder);
    return true;
  }

  public boolean contains(T value) {
    Interval<T> point = Interval.singleton(value);
    int idx = lowerIndex(point);
    return idx < intervals.size() && comparator.contains(intervals.get(idx), value);
  }

  /**
   * @return true if every value in {@code interval} is in the set
   */
  public boolean contains(Interval<T> interval) {
    if (comparator.isEmpty(interval)) {
      return true;
    }
    int idx = lowerIndex(interval);
    return idx < intervals.size() && comparator.contains(intervals.get(idx), interval);
  }

  /**
   * @return true if any value in {@code interval} is in the set
   */
  public boolean overlaps(Interval<T> interval) {
    return !comparator.isEmpty(interval) && lowerIndex(interval) < upperIndex(interval);
  }

  /**
   * @return a new set containing every value not in this set
   */
  public IntervalSet<T> complement() {
    IntervalSet<T> result = new IntervalSet<>(comparator);

    Bound<T> cursor = Bound.unbounded();
    for (Interval<T> i : intervals) {
      if (!i.lower().isUnbounded()) {
        result.intervals.add(new Interval<>(cursor, i.lower().touching()));
      }
      if (i.upper().isUnbounded()) {
        return result;
      }
      cursor = i.upper().touching();
    }

    result.intervals.add(new Interval<>(cursor, Bound.unbounded()));
    return result;
  }

  ///

  // true if `a` lies below `b` with a gap between them
  private boolean isSeparate(Interval<T> a, Interval<T> b) {
    return comparator.isBefore(a, b) && !bounds.isTouching(a.upper(), b.lower());
  }

  private int lowerIndex(Interval<T> interval) {
    return search(i -> !comparator.isBefore(intervals.get(i), interval));
  }

  private int upperIndex(Interval<T> interval) {
    return search(i -> comparator.isBefore(interval, intervals.get(i)));
  }

  private int search(IntPredicate p) {
    int low = 0;
    int high = intervals.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (p.test(mid)) {
        high = mid;
      } else {
        low = mid + 1;
      }
    }
    return low;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof IntervalSet)) {
      return false;
    }
    return intervals.equals(((IntervalSet<?>) obj).intervals);
  }

  @Override
  public int hashCode() {
    return intervals.hashCode();
  }

  @Override
  public String toString() {
    return intervals.toString();
  }
}
