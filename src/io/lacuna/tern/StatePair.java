package io.lacuna.tern;

import java.util.Objects;

/**
 * Two states considered side by side, either of which may be absent.  Used both for pairs which must not be merged
 * during minimization, and for the successors of two states on a common symbol.
 */
public final class StatePair<S> {

  private final S first, second;

  public StatePair(S first, S second) {
    this.first = first;
    this.second = second;
  }

  public static <S> StatePair<S> of(S first, S second) {
    return new StatePair<>(Objects.requireNonNull(first), Objects.requireNonNull(second));
  }

  /**
   * @return the first state, or null
   */
  public S first() {
    return first;
  }

  /**
   * @return the second state, or null
   */
  public S second() {
    return second;
  }

  // combines two halves built up separately
  StatePair<S> merge(StatePair<S> other) {
    return new StatePair<>(
        first != null ? first : other.first,
        second != null ? second : other.second);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof StatePair)) {
      return false;
    }
    StatePair<?> other = (StatePair<?>) obj;
    return Objects.equals(first, other.first) && Objects.equals(second, other.second);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second);
  }

  @Override
  public String toString() {
    return "(" + first + ", " + second + ")";
  }
}
