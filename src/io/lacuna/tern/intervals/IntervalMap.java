package io.lacuna.tern.intervals;

import io.lacuna.bifurcan.IList;
import io.lacuna.bifurcan.LinearList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.BinaryOperator;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * A mutable mapping from pairwise-disjoint, non-empty intervals to values, kept sorted by lower bound.  Adjacent
 * entries may touch, and may even carry equal values until {@link #mergeTouching()} is called.
 *
 * @param <T> the endpoint value type
 * @param <V> the value type
 */
public class IntervalMap<T, V> implements Iterable<IntervalMap.Entry<T, V>> {

  public static final class Entry<T, V> {
    private final Interval<T> interval;
    private final V value;

    public Entry(Interval<T> interval, V value) {
      this.interval = Objects.requireNonNull(interval);
      this.value = value;
    }

    public Interval<T> interval() {
      return interval;
    }

    public V value() {
      return value;
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Entry)) {
        return false;
      }
      Entry<?, ?> other = (Entry<?, ?>) obj;
      return interval.equals(other.interval) && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return 31 * interval.hashCode() + Objects.hashCode(value);
    }

    @Override
    public String toString() {
      return interval + " -> " + value;
    }
  }

  private final IntervalComparator<T> comparator;
  private final BoundComparator<T> bounds;
  private final BiPredicate<V, V> valueEquality;
  private final List<Entry<T, V>> entries = new ArrayList<>();

  public IntervalMap(IntervalComparator<T> comparator) {
    this(comparator, Objects::equals);
  }

  public IntervalMap(IntervalComparator<T> comparator, BiPredicate<V, V> valueEquality) {
    this.comparator = Objects.requireNonNull(comparator);
    this.bounds = comparator.bounds();
    this.valueEquality = Objects.requireNonNull(valueEquality);
  }

  public static <T extends Comparable<? super T>, V> IntervalMap<T, V> natural() {
    return new IntervalMap<>(IntervalComparator.<T>natural());
  }

  public IntervalComparator<T> comparator() {
    return comparator;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public void clear() {
    entries.clear();
  }

  @Override
  public Iterator<Entry<T, V>> iterator() {
    return Collections.unmodifiableList(entries).iterator();
  }

  /**
   * @return a snapshot of every entry, in ascending order
   */
  public IList<Entry<T, V>> entries() {
    LinearList<Entry<T, V>> result = new LinearList<>();
    entries.forEach(result::addLast);
    return result;
  }

  /**
   * @return the entries intersecting {@code interval}, unclipped, in ascending order
   */
  public IList<Entry<T, V>> entries(Interval<T> interval) {
    LinearList<Entry<T, V>> result = new LinearList<>();
    if (comparator.isEmpty(interval)) {
      return result;
    }

    int from = lowerIndex(interval);
    int to = upperIndex(interval);
    for (int i = from; i < to; i++) {
      result.addLast(entries.get(i));
    }
    return result;
  }

  public Optional<V> get(T value) {
    Interval<T> point = Interval.singleton(value);
    int idx = lowerIndex(point);
    if (idx < entries.size() && comparator.contains(entries.get(idx).interval, value)) {
      return Optional.ofNullable(entries.get(idx).value);
    }
    return Optional.empty();
  }

  /**
   * @return true if every value in {@code interval} is mapped, and every value it maps to satisfies {@code predicate}
   */
  public boolean covers(Interval<T> interval, Predicate<V> predicate) {
    if (comparator.isEmpty(interval)) {
      return true;
    }

    int from = lowerIndex(interval);
    int to = upperIndex(interval);
    if (from == to
        || bounds.compareLower(entries.get(from).interval.lower(), interval.lower()) > 0
        || bounds.compareUpper(entries.get(to - 1).interval.upper(), interval.upper()) < 0) {
      return false;
    }

    for (int i = from; i < to; i++) {
      Entry<T, V> e = entries.get(i);
      if (i > from && !bounds.isTouching(entries.get(i - 1).interval.upper(), e.interval.lower())) {
        return false;
      }
      if (!predicate.test(e.value)) {
        return false;
      }
    }
    return true;
  }

  /// updates

  /**
   * Maps every value in {@code interval} to {@code value}.  Wherever an existing entry already covers part of
   * {@code interval}, that part is instead mapped to {@code merge(existing, value)}, and the remainder of the
   * existing entry keeps its old value.
   *
   * @throws IllegalArgumentException if {@code interval} is empty
   */
  public void addAndUpdate(Interval<T> interval, V value, BinaryOperator<V> merge) {
    comparator.requireNonEmpty(interval);

    int from = lowerIndex(interval);
    int to = upperIndex(interval);

    if (from == to) {
      entries.add(from, new Entry<>(interval, value));
    } else if (to - from == 1) {
      replace(from, to, splitOne(entries.get(from), interval, value, merge));
    } else {
      replace(from, to, splitMany(from, to, interval, value, merge));
    }
  }

  /**
   * Applies {@code f} to the values of every mapped part of {@code interval}.  Where {@code f} returns null, that part
   * is removed.
   *
   * @return true if any value was changed or removed
   */
  public boolean update(Interval<T> interval, UnaryOperator<V> f) {
    if (comparator.isEmpty(interval)) {
      return false;
    }

    int from = lowerIndex(interval);
    int to = upperIndex(interval);
    boolean changed = false;
    List<Entry<T, V>> result = new ArrayList<>();

    for (int i = from; i < to; i++) {
      Entry<T, V> e = entries.get(i);
      Interval<T> key = e.interval;

      if (bounds.compareLower(key.lower(), interval.lower()) < 0) {
        result.add(new Entry<>(new Interval<>(key.lower(), interval.lower().touching()), e.value));
      }

      V updated = f.apply(e.value);
      if (isChanged(e.value, updated)) {
        changed = true;
      }
      if (updated != null) {
        result.add(new Entry<>(comparator.intersection(key, interval), updated));
      }

      if (bounds.compareUpper(key.upper(), interval.upper()) > 0) {
        result.add(new Entry<>(new Interval<>(interval.upper().touching(), key.upper()), e.value));
      }
    }

    if (changed) {
      replace(from, to, result);
    }
    return changed;
  }

  /**
   * Unmaps every value in {@code interval}.
   *
   * @return true if anything was unmapped
   */
  public boolean remove(Interval<T> interval) {
    return update(interval, v -> null);
  }

  /**
   * Applies {@code f} to every value, removing entries for which it returns null.
   *
   * @return true if any value was changed or removed
   */
  public boolean replaceValues(UnaryOperator<V> f) {
    boolean changed = false;
    for (int i = entries.size() - 1; i >= 0; i--) {
      Entry<T, V> e = entries.get(i);
      V updated = f.apply(e.value);
      if (!isChanged(e.value, updated)) {
        continue;
      }
      changed = true;
      if (updated == null) {
        entries.remove(i);
      } else {
        entries.set(i, new Entry<>(e.interval, updated));
      }
    }
    return changed;
  }

  /**
   * Fuses every run of touching entries with equal values into a single entry.
   */
  public void mergeTouching() {
    if (entries.size() < 2) {
      return;
    }

    List<Entry<T, V>> result = new ArrayList<>(entries.size());
    Entry<T, V> acc = entries.get(0);
    for (int i = 1; i < entries.size(); i++) {
      Entry<T, V> e = entries.get(i);
      if (bounds.isTouching(acc.interval.upper(), e.interval.lower()) && valueEquality.test(acc.value, e.value)) {
        acc = new Entry<>(new Interval<>(acc.interval.lower(), e.interval.upper()), acc.value);
      } else {
        result.add(acc);
        acc = e;
      }
    }
    result.add(acc);

    entries.clear();
    entries.addAll(result);
  }

  ///

  private boolean isChanged(V original, V updated) {
    return original != updated && (updated == null || !valueEquality.test(original, updated));
  }

  private List<Entry<T, V>> splitOne(Entry<T, V> existing, Interval<T> interval, V value, BinaryOperator<V> merge) {
    IntervalRelation<T> relation = comparator.relation(existing.interval, interval);
    List<Entry<T, V>> result = new ArrayList<>(3);

    switch (relation.kind()) {
      case EQUAL:
        result.add(new Entry<>(existing.interval, merge.apply(existing.value, value)));
        break;

      case STARTING:
      case FINISHING:
      case OVERLAPPING:
      case CONTAINING:
        Interval<T> lower = relation.lowerPart();
        Interval<T> upper = relation.upperPart();
        if (lower != null) {
          result.add(new Entry<>(lower, owner(existing, lower, value)));
        }
        result.add(new Entry<>(relation.sharedPart(), merge.apply(existing.value, value)));
        if (upper != null) {
          result.add(new Entry<>(upper, owner(existing, upper, value)));
        }
        break;

      default:
        throw new IllegalStateException(existing.interval + " does not intersect " + interval);
    }

    return result;
  }

  // the disjoint parts of a relation belong to exactly one of the two intervals
  private V owner(Entry<T, V> existing, Interval<T> part, V value) {
    return comparator.contains(existing.interval, part) ? existing.value : value;
  }

  private List<Entry<T, V>> splitMany(int from, int to, Interval<T> interval, V value, BinaryOperator<V> merge) {
    List<Entry<T, V>> result = new ArrayList<>();

    // the lower bound of the part of `interval` not yet accounted for
    Bound<T> cursor = interval.lower();

    for (int i = from; i < to; i++) {
      Entry<T, V> e = entries.get(i);
      Interval<T> key = e.interval;

      int c = bounds.compareLower(key.lower(), cursor);
      if (c < 0) {
        result.add(new Entry<>(new Interval<>(key.lower(), cursor.touching()), e.value));
      } else if (c > 0) {
        Interval<T> gap = new Interval<>(cursor, key.lower().touching());
        if (!comparator.isEmpty(gap)) {
          result.add(new Entry<>(gap, value));
        }
      }

      boolean extendsPast = bounds.compareUpper(key.upper(), interval.upper()) > 0;
      Interval<T> overlap = new Interval<>(c < 0 ? cursor : key.lower(), extendsPast ? interval.upper() : key.upper());
      result.add(new Entry<>(overlap, merge.apply(e.value, value)));

      if (extendsPast) {
        result.add(new Entry<>(new Interval<>(interval.upper().touching(), key.upper()), e.value));
      }

      cursor = key.upper().isUnbounded() ? null : key.upper().touching();
    }

    if (cursor != null && bounds.compareUpper(entries.get(to - 1).interval.upper(), interval.upper()) < 0) {
      result.add(new Entry<>(new Interval<>(cursor, interval.upper()), value));
    }

    return result;
  }

  private void replace(int from, int to, List<Entry<T, V>> replacement) {
    entries.subList(from, to).clear();
    entries.addAll(from, replacement);
  }

  // the first index of an entry that isn't entirely below `interval`
  private int lowerIndex(Interval<T> interval) {
    return search(i -> !bounds.isBefore(entries.get(i).interval.upper(), interval.lower()));
  }

  // the first index of an entry that is entirely above `interval`
  private int upperIndex(Interval<T> interval) {
    return search(i -> bounds.isBefore(interval.upper(), entries.get(i).interval.lower()));
  }

  // `p` must be monotone over the entries, false and then true
  private int search(IntPredicate p) {
    int low = 0;
    int high = entries.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (p.test(mid)) {
        high = mid;
      } else {
        low = mid + 1;
      }
    }
    return low;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof IntervalMap)) {
      return false;
    }
    return entries.equals(((IntervalMap<?, ?>) obj).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < entries.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(entries.get(i));
    }
    return sb.append("}").toString();
  }
}
