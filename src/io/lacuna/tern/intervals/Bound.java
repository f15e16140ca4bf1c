package io.lacuna.tern.intervals;

import java.util.Objects;

/**
 * One endpoint of an {@link Interval}.  Whether a bound is a lower or an upper bound is determined by its position
 * within the interval, not by the bound itself.
 *
 * @param <T> the endpoint value type
 */
public final class Bound<T> {

  public enum Kind {
    UNBOUNDED,
    INCLUSIVE,
    EXCLUSIVE
  }

  private static final Bound UNBOUNDED = new Bound<>(Kind.UNBOUNDED, null);

  private final Kind kind;
  private final T value;

  private Bound(Kind kind, T value) {
    this.kind = kind;
    this.value = value;
  }

  public static <T> Bound<T> unbounded() {
    return (Bound<T>) UNBOUNDED;
  }

  public static <T> Bound<T> inclusive(T value) {
    return new Bound<>(Kind.INCLUSIVE, Objects.requireNonNull(value));
  }

  public static <T> Bound<T> exclusive(T value) {
    return new Bound<>(Kind.EXCLUSIVE, Objects.requireNonNull(value));
  }

  public Kind kind() {
    return kind;
  }

  /**
   * @throws IllegalStateException if the bound is unbounded
   */
  public T value() {
    if (kind == Kind.UNBOUNDED) {
      throw new IllegalStateException("an unbounded endpoint has no value");
    }
    return value;
  }

  public boolean isUnbounded() {
    return kind == Kind.UNBOUNDED;
  }

  public boolean isInclusive() {
    return kind == Kind.INCLUSIVE;
  }

  public boolean isExclusive() {
    return kind == Kind.EXCLUSIVE;
  }

  /**
   * @return the bound on the other side of this endpoint, such that no value lies between the two and neither of
   * them includes a value the other does, e.g. {@code 5]} and {@code (5}
   */
  public Bound<T> touching() {
    switch (kind) {
      case INCLUSIVE:
        return exclusive(value);
      case EXCLUSIVE:
        return inclusive(value);
      default:
        throw new IllegalStateException("an unbounded endpoint has no touching bound");
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Bound)) {
      return false;
    }
    Bound<?> other = (Bound<?>) obj;
    return kind == other.kind && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + Objects.hashCode(value);
  }

  @Override
  public String toString() {
    switch (kind) {
      case INCLUSIVE:
        return "inclusive(" + value + ")";
      case EXCLUSIVE:
        return "exclusive(" + value + ")";
      default:
        return "unbounded";
    }
  }
}
