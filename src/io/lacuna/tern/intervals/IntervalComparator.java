package io.lacuna.tern.intervals;

import java.util.Comparator;

/**
 * All ordering-dependent operations on {@link Interval}, parameterized by a single value comparator.
 *
 * @param <T> the endpoint value type
 */
public final class IntervalComparator<T> {

  private final BoundComparator<T> bounds;

  public IntervalComparator(Comparator<? super T> comparator) {
    this.bounds = new BoundComparator<>(comparator);
  }

  public static <T extends Comparable<? super T>> IntervalComparator<T> natural() {
    return new IntervalComparator<>(Comparator.<T>naturalOrder());
  }

  public BoundComparator<T> bounds() {
    return bounds;
  }

  public Comparator<? super T> valueComparator() {
    return bounds.valueComparator();
  }

  public boolean isEmpty(Interval<T> interval) {
    Bound<T> lower = interval.lower();
    Bound<T> upper = interval.upper();
    if (lower.isUnbounded() || upper.isUnbounded()) {
      return false;
    }

    int c = bounds.compareValues(lower.value(), upper.value());
    if (c != 0) {
      return c > 0;
    }
    return !(lower.isInclusive() && upper.isInclusive());
  }

  public boolean contains(Interval<T> interval, T value) {
    Bound<T> lower = interval.lower();
    Bound<T> upper = interval.upper();

    if (!lower.isUnbounded()) {
      int c = bounds.compareValues(lower.value(), value);
      if (c > 0 || (c == 0 && lower.isExclusive())) {
        return false;
      }
    }

    if (!upper.isUnbounded()) {
      int c = bounds.compareValues(value, upper.value());
      if (c > 0 || (c == 0 && upper.isExclusive())) {
        return false;
      }
    }

    return true;
  }

  /**
   * @return true if every value in {@code inner} is also in {@code outer}
   */
  public boolean contains(Interval<T> outer, Interval<T> inner) {
    return isEmpty(inner)
        || (bounds.compareLower(outer.lower(), inner.lower()) <= 0
        && bounds.compareUpper(outer.upper(), inner.upper()) >= 0);
  }

  /**
   * @return true if every value in {@code a} is below every value in {@code b}
   */
  public boolean isBefore(Interval<T> a, Interval<T> b) {
    return bounds.isBefore(a.upper(), b.lower());
  }

  public boolean intersects(Interval<T> a, Interval<T> b) {
    return !isBefore(a, b) && !isBefore(b, a);
  }

  public boolean isDisjoint(Interval<T> a, Interval<T> b) {
    return !intersects(a, b);
  }

  /**
   * @return true if {@code a} and {@code b} share no value, but there is no value between them either
   */
  public boolean isTouching(Interval<T> a, Interval<T> b) {
    return bounds.isTouching(a.upper(), b.lower()) || bounds.isTouching(b.upper(), a.lower());
  }

  /**
   * @return the values common to both intervals, which may be an empty interval
   */
  public Interval<T> intersection(Interval<T> a, Interval<T> b) {
    return new Interval<>(bounds.maxLower(a.lower(), b.lower()), bounds.minUpper(a.upper(), b.upper()));
  }

  /**
   * @return the smallest interval containing both intervals
   */
  public Interval<T> span(Interval<T> a, Interval<T> b) {
    return new Interval<>(bounds.minLower(a.lower(), b.lower()), bounds.maxUpper(a.upper(), b.upper()));
  }

  /**
   * Classifies how {@code x} and {@code y} relate.  Intervals sharing no value are {@link IntervalRelation.Touching}
   * or {@link IntervalRelation.Disjoint}, ordered lowest first.  Otherwise the relation describes how to split the
   * two into the part covered by only one of them, the shared part, and so on.
   *
   * @throws IllegalArgumentException if either interval is empty
   */
  public IntervalRelation<T> relation(Interval<T> x, Interval<T> y) {
    requireNonEmpty(x);
    requireNonEmpty(y);

    if (isBefore(y, x)) {
      Interval<T> t = x;
      x = y;
      y = t;
    }

    if (isBefore(x, y)) {
      return bounds.isTouching(x.upper(), y.lower())
          ? new IntervalRelation.Touching<>(x, y)
          : new IntervalRelation.Disjoint<>(x, y);
    }

    int lc = bounds.compareLower(x.lower(), y.lower());
    int uc = bounds.compareUpper(x.upper(), y.upper());

    if (lc == 0 && uc == 0) {
      return new IntervalRelation.Equal<>(x);
    }

    if (lc == 0) {
      Interval<T> shorter = uc < 0 ? x : y;
      Interval<T> longer = uc < 0 ? y : x;
      return new IntervalRelation.Starting<>(shorter, new Interval<>(shorter.upper().touching(), longer.upper()));
    }

    if (uc == 0) {
      Interval<T> earlier = lc < 0 ? x : y;
      Interval<T> later = lc < 0 ? y : x;
      return new IntervalRelation.Finishing<>(new Interval<>(earlier.lower(), later.lower().touching()), later);
    }

    // make x the one that starts first
    if (lc > 0) {
      Interval<T> t = x;
      x = y;
      y = t;
      uc = -uc;
    }

    if (uc > 0) {
      return new IntervalRelation.Containing<>(
          new Interval<>(x.lower(), y.lower().touching()),
          y,
          new Interval<>(y.upper().touching(), x.upper()));
    }

    return new IntervalRelation.Overlapping<>(
        new Interval<>(x.lower(), y.lower().touching()),
        new Interval<>(y.lower(), x.upper()),
        new Interval<>(x.upper().touching(), y.upper()));
  }

  void requireNonEmpty(Interval<T> interval) {
    if (isEmpty(interval)) {
      throw new IllegalArgumentException("empty interval: " + interval);
    }
  }
}
