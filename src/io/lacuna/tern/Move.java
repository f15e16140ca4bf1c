package io.lacuna.tern;

import io.lacuna.bifurcan.ISet;

/**
 * Everywhere a set of NFA states can go on a single label, before any epsilon closure.
 */
public final class Move<S, L> {

  private final L label;
  private final ISet<S> destinations;

  public Move(L label, ISet<S> destinations) {
    this.label = label;
    this.destinations = destinations;
  }

  public L label() {
    return label;
  }

  public ISet<S> destinations() {
    return destinations;
  }

  @Override
  public String toString() {
    return label + " -> " + StateSet.from(destinations);
  }
}
