package io.lacuna.tern.intervals;

import java.util.Comparator;
import java.util.Objects;

/**
 * Orders bounds on one side of an interval.  Lower bounds and upper bounds are ordered differently, since an
 * unbounded lower endpoint is below every value while an unbounded upper endpoint is above every value.
 *
 * @param <T> the endpoint value type
 */
public final class BoundComparator<T> {

  private final Comparator<? super T> comparator;

  public BoundComparator(Comparator<? super T> comparator) {
    this.comparator = Objects.requireNonNull(comparator);
  }

  public Comparator<? super T> valueComparator() {
    return comparator;
  }

  public int compareValues(T a, T b) {
    return comparator.compare(a, b);
  }

  public int compareLower(Bound<T> a, Bound<T> b) {
    if (a.isUnbounded() || b.isUnbounded()) {
      return Boolean.compare(!a.isUnbounded(), !b.isUnbounded());
    }

    int c = comparator.compare(a.value(), b.value());
    if (c != 0 || a.kind() == b.kind()) {
      return c;
    }

    // [5 starts before (5
    return a.isInclusive() ? -1 : 1;
  }

  public int compareUpper(Bound<T> a, Bound<T> b) {
    if (a.isUnbounded() || b.isUnbounded()) {
      return Boolean.compare(a.isUnbounded(), b.isUnbounded());
    }

    int c = comparator.compare(a.value(), b.value());
    if (c != 0 || a.kind() == b.kind()) {
      return c;
    }

    // 5) ends before 5]
    return a.isExclusive() ? -1 : 1;
  }

  /**
   * @return true if no value lies both below {@code upper} and above {@code lower}
   */
  public boolean isBefore(Bound<T> upper, Bound<T> lower) {
    if (upper.isUnbounded() || lower.isUnbounded()) {
      return false;
    }

    int c = comparator.compare(upper.value(), lower.value());
    if (c != 0) {
      return c < 0;
    }
    return !(upper.isInclusive() && lower.isInclusive());
  }

  /**
   * @return true if {@code upper} and {@code lower} meet at the same value with exactly one of them including it
   */
  public boolean isTouching(Bound<T> upper, Bound<T> lower) {
    return !upper.isUnbounded()
        && !lower.isUnbounded()
        && upper.kind() != lower.kind()
        && comparator.compare(upper.value(), lower.value()) == 0;
  }

  public Bound<T> minLower(Bound<T> a, Bound<T> b) {
    return compareLower(a, b) <= 0 ? a : b;
  }

  public Bound<T> maxLower(Bound<T> a, Bound<T> b) {
    return compareLower(a, b) >= 0 ? a : b;
  }

  public Bound<T> minUpper(Bound<T> a, Bound<T> b) {
    return compareUpper(a, b) <= 0 ? a : b;
  }

  public Bound<T> maxUpper(Bound<T> a, Bound<T> b) {
    return compareUpper(a, b) >= 0 ? a : b;
  }
}
