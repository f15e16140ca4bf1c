package io.lacuna.tern;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Optional;

/**
 * The table of state pairs used by {@link Minimizer}.  A pair is marked once its states are known to behave
 * differently.  Separately, a state is marked trap-distinct once it is known to behave differently from the implicit
 * trap state that a missing transition leads to.
 */
final class EquivalenceTable<S> {

  private final IDfa<S, ?> dfa;
  private final LinearList<S> states = new LinearList<>();
  private final LinearMap<S, Integer> index = new LinearMap<>();

  // distinct[i][j] is only defined for j < i
  private final boolean[][] distinct;
  private final boolean[] trapDistinct;

  EquivalenceTable(IDfa<S, ?> dfa) {
    this.dfa = dfa;
    for (S s : dfa.states()) {
      index.put(s, (int) states.size());
      states.addLast(s);
    }

    int n = size();
    distinct = new boolean[n][];
    for (int i = 0; i < n; i++) {
      distinct[i] = new boolean[i];
    }
    trapDistinct = new boolean[n];
  }

  int size() {
    return (int) states.size();
  }

  void seed(Iterable<StatePair<S>> differentiate) {
    int n = size();
    for (int i = 0; i < n; i++) {
      boolean accepting = dfa.isAccepting(states.nth(i));
      trapDistinct[i] = accepting;
      for (int j = 0; j < i; j++) {
        if (accepting != dfa.isAccepting(states.nth(j))) {
          mark(i, j);
        }
      }
    }

    for (StatePair<S> pair : differentiate) {
      int a = indexOf(pair.first());
      int b = indexOf(pair.second());
      if (a != b) {
        mark(a, b);
      }
    }
  }

  /**
   * Performs a single pass over every unmarked pair.
   *
   * @return true if anything was marked
   */
  boolean refine() {
    boolean changed = false;
    int n = size();
    for (int i = 0; i < n; i++) {
      S s = states.nth(i);

      if (!trapDistinct[i] && leadsAwayFromTrap(s)) {
        trapDistinct[i] = true;
        changed = true;
      }

      for (int j = 0; j < i; j++) {
        if (!distinct[i][j] && differ(s, states.nth(j))) {
          distinct[i][j] = true;
          changed = true;
        }
      }
    }
    return changed;
  }

  /**
   * Equivalence is only transitive when the seeded pairs allow it.  If the unmarked pairs connect two states which
   * were marked, the connected group is split, each state joining the first subgroup it is unmarked with, and every
   * pair spanning two subgroups is marked.  Refinement should then be resumed.
   *
   * @return true if anything was marked
   */
  boolean separateConflicts() {
    boolean changed = false;
    for (IList<Integer> group : components()) {
      if (isConsistent(group)) {
        continue;
      }

      LinearList<LinearList<Integer>> subgroups = new LinearList<>();
      for (int i : group) {
        LinearList<Integer> target = null;
        for (LinearList<Integer> subgroup : subgroups) {
          if (!isDistinctFromAny(i, subgroup)) {
            target = subgroup;
            break;
          }
        }
        if (target == null) {
          target = new LinearList<>();
          subgroups.addLast(target);
        }
        target.addLast(i);
      }

      for (int x = 0; x < subgroups.size(); x++) {
        for (int y = 0; y < x; y++) {
          for (int i : subgroups.nth(x)) {
            for (int j : subgroups.nth(y)) {
              changed |= mark(i, j);
            }
          }
        }
      }
    }
    return changed;
  }

  /**
   * @return each state, mapped onto the state its equivalence class combines into
   */
  <R> LinearMap<S, R> classes(IStateCombiner<S, R> combiner) {
    LinearMap<S, R> result = new LinearMap<>();
    for (IList<Integer> group : components()) {
      LinearSet<S> members = new LinearSet<>();
      group.forEach(i -> members.add(states.nth(i)));
      R combined = combiner.combine(StateSet.from(members));
      members.forEach(s -> result.put(s, combined));
    }
    return result;
  }

  ///

  private int indexOf(S state) {
    Optional<Integer> i = index.get(state);
    if (!i.isPresent()) {
      throw new IllegalArgumentException("cannot differentiate unknown state " + state);
    }
    return i.get();
  }

  private boolean mark(int i, int j) {
    if (i < j) {
      return mark(j, i);
    }
    if (distinct[i][j]) {
      return false;
    }
    distinct[i][j] = true;
    return true;
  }

  private boolean isDistinct(int i, int j) {
    if (i == j) {
      return false;
    }
    return i > j ? distinct[i][j] : distinct[j][i];
  }

  private boolean isDistinctFromAny(int i, IList<Integer> group) {
    for (int j : group) {
      if (isDistinct(i, j)) {
        return true;
      }
    }
    return false;
  }

  private boolean isConsistent(IList<Integer> group) {
    for (int i : group) {
      if (isDistinctFromAny(i, group)) {
        return false;
      }
    }
    return true;
  }

  private boolean leadsAwayFromTrap(S state) {
    for (S next : dfa.successors(state)) {
      if (trapDistinct[index.get(next).get()]) {
        return true;
      }
    }
    return false;
  }

  private boolean differ(S a, S b) {
    for (StatePair<S> pair : dfa.successors(a, b)) {
      S x = pair.first();
      S y = pair.second();
      if (x == null) {
        if (trapDistinct[index.get(y).get()]) {
          return true;
        }
      } else if (y == null) {
        if (trapDistinct[index.get(x).get()]) {
          return true;
        }
      } else if (isDistinct(index.get(x).get(), index.get(y).get())) {
        return true;
      }
    }
    return false;
  }

  // the connected components of the graph of unmarked pairs, via union-find
  private IList<IList<Integer>> components() {
    int n = size();
    int[] parent = new int[n];
    for (int i = 0; i < n; i++) {
      parent[i] = i;
    }

    for (int i = 0; i < n; i++) {
      for (int j = 0; j < i; j++) {
        if (!distinct[i][j]) {
          int a = root(parent, i);
          int b = root(parent, j);
          if (a != b) {
            parent[Math.max(a, b)] = Math.min(a, b);
          }
        }
      }
    }

    LinearMap<Integer, LinearList<Integer>> groups = new LinearMap<>();
    LinearList<IList<Integer>> result = new LinearList<>();
    for (int i = 0; i < n; i++) {
      int r = root(parent, i);
      Optional<LinearList<Integer>> group = groups.get(r);
      if (group.isPresent()) {
        group.get().addLast(i);
      } else {
        LinearList<Integer> g = new LinearList<>();
        g.addLast(i);
        groups.put(r, g);
        result.addLast(g);
      }
    }
    return result;
  }

  private static int root(int[] parent, int i) {
    while (parent[i] != i) {
      parent[i] = parent[parent[i]];
      i = parent[i];
    }
    return i;
  }
}
