package io.lacuna.tern.intervals;

import java.util.Objects;

/**
 * A pair of a lower and an upper {@link Bound}.  Intervals carry no ordering of their own; every question that needs
 * one (emptiness, containment, relation to another interval) goes through an {@link IntervalComparator}.
 *
 * @param <T> the endpoint value type
 */
public final class Interval<T> {

  private final Bound<T> lower;
  private final Bound<T> upper;

  public Interval(Bound<T> lower, Bound<T> upper) {
    this.lower = Objects.requireNonNull(lower);
    this.upper = Objects.requireNonNull(upper);
  }

  /// factories

  public static <T> Interval<T> singleton(T value) {
    return new Interval<>(Bound.inclusive(value), Bound.inclusive(value));
  }

  /**
   * @return {@code [from; to]}
   */
  public static <T> Interval<T> closed(T from, T to) {
    return new Interval<>(Bound.inclusive(from), Bound.inclusive(to));
  }

  /**
   * @return {@code (from; to)}
   */
  public static <T> Interval<T> open(T from, T to) {
    return new Interval<>(Bound.exclusive(from), Bound.exclusive(to));
  }

  /**
   * @return {@code [from; to)}
   */
  public static <T> Interval<T> closedOpen(T from, T to) {
    return new Interval<>(Bound.inclusive(from), Bound.exclusive(to));
  }

  /**
   * @return {@code (from; to]}
   */
  public static <T> Interval<T> openClosed(T from, T to) {
    return new Interval<>(Bound.exclusive(from), Bound.inclusive(to));
  }

  public static <T> Interval<T> atLeast(T from) {
    return new Interval<>(Bound.inclusive(from), Bound.unbounded());
  }

  public static <T> Interval<T> greaterThan(T from) {
    return new Interval<>(Bound.exclusive(from), Bound.unbounded());
  }

  public static <T> Interval<T> atMost(T to) {
    return new Interval<>(Bound.unbounded(), Bound.inclusive(to));
  }

  public static <T> Interval<T> lessThan(T to) {
    return new Interval<>(Bound.unbounded(), Bound.exclusive(to));
  }

  public static <T> Interval<T> full() {
    return new Interval<>(Bound.unbounded(), Bound.unbounded());
  }

  ///

  public Bound<T> lower() {
    return lower;
  }

  public Bound<T> upper() {
    return upper;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Interval)) {
      return false;
    }
    Interval<?> other = (Interval<?>) obj;
    return lower.equals(other.lower) && upper.equals(other.upper);
  }

  @Override
  public int hashCode() {
    return 31 * lower.hashCode() + upper.hashCode();
  }

  @Override
  public String toString() {
    String l;
    switch (lower.kind()) {
      case INCLUSIVE:
        l = "[" + lower.value();
        break;
      case EXCLUSIVE:
        l = "(" + lower.value();
        break;
      default:
        l = "(-∞";
    }

    String u;
    switch (upper.kind()) {
      case INCLUSIVE:
        u = upper.value() + "]";
        break;
      case EXCLUSIVE:
        u = upper.value() + ")";
        break;
      default:
        u = "+∞)";
    }

    return l + "; " + u;
  }
}
