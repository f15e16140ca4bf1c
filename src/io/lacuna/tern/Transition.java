package io.lacuna.tern;

import java.util.Objects;

/**
 * @param <S> the state type
 * @param <L> the label type, either a symbol or an interval of symbols
 */
public final class Transition<S, L> {

  private final S source;
  private final L label;
  private final S destination;

  public Transition(S source, L label, S destination) {
    this.source = Objects.requireNonNull(source);
    this.label = Objects.requireNonNull(label);
    this.destination = Objects.requireNonNull(destination);
  }

  public S source() {
    return source;
  }

  public L label() {
    return label;
  }

  public S destination() {
    return destination;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition<?, ?> other = (Transition<?, ?>) obj;
    return source.equals(other.source) && label.equals(other.label) && destination.equals(other.destination);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, label, destination);
  }

  @Override
  public String toString() {
    return source + " --" + label + "--> " + destination;
  }
}
