package io.lacuna.tern;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Collections;
import java.util.Optional;

final class EpsilonTable<S> {

  private final LinearMap<S, LinearSet<S>> edges = new LinearMap<>();

  boolean add(S from, S to) {
    LinearSet<S> dsts = edges.getOrCreate(from, LinearSet::new);
    if (dsts.contains(to)) {
      return false;
    }
    dsts.add(to);
    return true;
  }

  boolean remove(S from, S to) {
    Optional<LinearSet<S>> dsts = edges.get(from);
    if (!dsts.isPresent() || !dsts.get().contains(to)) {
      return false;
    }
    dsts.get().remove(to);
    if (dsts.get().size() == 0) {
      edges.remove(from);
    }
    return true;
  }

  ISet<S> from(S state) {
    return edges.get(state).map(Utils::<S>copy).orElseGet(LinearSet::new);
  }

  Iterable<S> neighbors(S state) {
    return edges.get(state).<Iterable<S>>map(s -> s).orElse(Collections.emptyList());
  }

  void removeState(S state) {
    edges.remove(state);
    for (S from : Utils.copy(edges.keys())) {
      remove(from, state);
    }
  }

  LinearSet<S> closure(Iterable<S> states) {
    return Utils.breadthFirst(states, this::neighbors);
  }

  boolean isEmpty() {
    return edges.size() == 0;
  }

  void clear() {
    for (S from : Utils.copy(edges.keys())) {
      edges.remove(from);
    }
  }
}
