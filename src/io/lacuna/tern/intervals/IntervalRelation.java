package io.lacuna.tern.intervals;

import java.util.Objects;

/**
 * The outcome of {@link IntervalComparator#relation(Interval, Interval)}.  Each variant carries the pieces needed to
 * split the two intervals into disjoint parts; {@link #lowerPart()}, {@link #sharedPart()} and {@link #upperPart()}
 * give uniform access to those pieces, returning null where a variant has no such piece.
 *
 * @param <T> the endpoint value type
 */
public abstract class IntervalRelation<T> {

  public enum Kind {
    DISJOINT,
    TOUCHING,
    OVERLAPPING,
    CONTAINING,
    STARTING,
    FINISHING,
    EQUAL
  }

  private IntervalRelation() {
  }

  public abstract Kind kind();

  /**
   * @return the part below any shared values, or null
   */
  public abstract Interval<T> lowerPart();

  /**
   * @return the values common to both intervals, or null if there are none
   */
  public abstract Interval<T> sharedPart();

  /**
   * @return the part above any shared values, or null
   */
  public abstract Interval<T> upperPart();

  public boolean isIntersecting() {
    return sharedPart() != null;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null || obj.getClass() != getClass()) {
      return false;
    }
    IntervalRelation<?> other = (IntervalRelation<?>) obj;
    return Objects.equals(lowerPart(), other.lowerPart())
        && Objects.equals(sharedPart(), other.sharedPart())
        && Objects.equals(upperPart(), other.upperPart());
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind(), lowerPart(), sharedPart(), upperPart());
  }

  @Override
  public String toString() {
    return kind() + "{" + lowerPart() + ", " + sharedPart() + ", " + upperPart() + "}";
  }

  /// variants

  /**
   * {@code first} is entirely below {@code second}, with a gap between them.
   */
  public static final class Disjoint<T> extends IntervalRelation<T> {
    public final Interval<T> first, second;

    public Disjoint(Interval<T> first, Interval<T> second) {
      this.first = first;
      this.second = second;
    }

    public Kind kind() {
      return Kind.DISJOINT;
    }

    public Interval<T> lowerPart() {
      return first;
    }

    public Interval<T> sharedPart() {
      return null;
    }

    public Interval<T> upperPart() {
      return second;
    }
  }

  /**
   * {@code first} is entirely below {@code second}, with no value between them.
   */
  public static final class Touching<T> extends IntervalRelation<T> {
    public final Interval<T> first, second;

    public Touching(Interval<T> first, Interval<T> second) {
      this.first = first;
      this.second = second;
    }

    public Kind kind() {
      return Kind.TOUCHING;
    }

    public Interval<T> lowerPart() {
      return first;
    }

    public Interval<T> sharedPart() {
      return null;
    }

    public Interval<T> upperPart() {
      return second;
    }
  }

  /**
   * Each interval has values the other lacks, one on either side of the shared part.
   */
  public static final class Overlapping<T> extends IntervalRelation<T> {
    public final Interval<T> firstDisjoint, overlap, secondDisjoint;

    public Overlapping(Interval<T> firstDisjoint, Interval<T> overlap, Interval<T> secondDisjoint) {
      this.firstDisjoint = firstDisjoint;
      this.overlap = overlap;
      this.secondDisjoint = secondDisjoint;
    }

    public Kind kind() {
      return Kind.OVERLAPPING;
    }

    public Interval<T> lowerPart() {
      return firstDisjoint;
    }

    public Interval<T> sharedPart() {
      return overlap;
    }

    public Interval<T> upperPart() {
      return secondDisjoint;
    }
  }

  /**
   * One interval strictly contains the other, extending past it on both sides.
   */
  public static final class Containing<T> extends IntervalRelation<T> {
    public final Interval<T> firstDisjoint, contained, secondDisjoint;

    public Containing(Interval<T> firstDisjoint, Interval<T> contained, Interval<T> secondDisjoint) {
      this.firstDisjoint = firstDisjoint;
      this.contained = contained;
      this.secondDisjoint = secondDisjoint;
    }

    public Kind kind() {
      return Kind.CONTAINING;
    }

    public Interval<T> lowerPart() {
      return firstDisjoint;
    }

    public Interval<T> sharedPart() {
      return contained;
    }

    public Interval<T> upperPart() {
      return secondDisjoint;
    }
  }

  /**
   * Both intervals share a lower bound, and one extends further up.
   */
  public static final class Starting<T> extends IntervalRelation<T> {
    public final Interval<T> overlap, disjoint;

    public Starting(Interval<T> overlap, Interval<T> disjoint) {
      this.overlap = overlap;
      this.disjoint = disjoint;
    }

    public Kind kind() {
      return Kind.STARTING;
    }

    public Interval<T> lowerPart() {
      return null;
    }

    public Interval<T> sharedPart() {
      return overlap;
    }

    public Interval<T> upperPart() {
      return disjoint;
    }
  }

  /**
   * Both intervals share an upper bound, and one extends further down.
   */
  public static final class Finishing<T> extends IntervalRelation<T> {
    public final Interval<T> disjoint, overlap;

    public Finishing(Interval<T> disjoint, Interval<T> overlap) {
      this.disjoint = disjoint;
      this.overlap = overlap;
    }

    public Kind kind() {
      return Kind.FINISHING;
    }

    public Interval<T> lowerPart() {
      return disjoint;
    }

    public Interval<T> sharedPart() {
      return overlap;
    }

    public Interval<T> upperPart() {
      return null;
    }
  }

  public static final class Equal<T> extends IntervalRelation<T> {
    public final Interval<T> interval;

    public Equal(Interval<T> interval) {
      this.interval = interval;
    }

    public Kind kind() {
      return Kind.EQUAL;
    }

    public Interval<T> lowerPart() {
      return null;
    }

    public Interval<T> sharedPart() {
      return interval;
    }

    public Interval<T> upperPart() {
      return null;
    }
  }
}
