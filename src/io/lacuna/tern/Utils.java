package io.lacuna.tern;

import io.lacuna.bifurcan.ISet;
import io.lacuna.bifurcan.LinearList;
import io.lacuna.bifurcan.LinearMap;
import io.lacuna.bifurcan.LinearSet;

import java.util.Optional;
import java.util.function.Function;

class Utils {

  static <V> LinearSet<V> copy(Iterable<? extends V> vals) {
    LinearSet<V> result = new LinearSet<>();
    vals.forEach(result::add);
    return result;
  }

  static <V> ISet<V> union(ISet<V> a, ISet<V> b) {
    if (a.containsAll(b)) {
      return a;
    }
    LinearSet<V> result = copy(a);
    b.forEach(result::add);
    return result;
  }

  static <V> ISet<V> without(ISet<V> set, V val) {
    if (!set.contains(val)) {
      return set;
    }
    LinearSet<V> result = copy(set);
    result.remove(val);
    return result;
  }

  static <V> boolean sameElements(ISet<V> a, ISet<V> b) {
    return a.size() == b.size() && a.containsAll(b);
  }

  static <U, V> Function<U, V> memoize(Function<U, V> f) {
    LinearMap<U, V> cache = new LinearMap<>();
    return (U x) -> {
      Optional<V> cached = cache.get(x);
      if (cached.isPresent()) {
        return cached.get();
      }
      V y = f.apply(x);
      cache.put(x, y);
      return y;
    };
  }

  /**
   * @return every value reachable from {@code roots} through {@code neighbors}, including the roots themselves
   */
  static <V> LinearSet<V> breadthFirst(Iterable<V> roots, Function<V, Iterable<V>> neighbors) {
    LinearSet<V> visited = new LinearSet<>();
    LinearList<V> queue = new LinearList<>();
    for (V v : roots) {
      if (!visited.contains(v)) {
        visited.add(v);
        queue.addLast(v);
      }
    }

    while (queue.size() > 0) {
      for (V v : neighbors.apply(queue.popFirst())) {
        if (!visited.contains(v)) {
          visited.add(v);
          queue.addLast(v);
        }
      }
    }

    return visited;
  }
}
