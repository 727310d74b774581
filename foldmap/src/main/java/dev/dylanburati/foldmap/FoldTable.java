package dev.dylanburati.foldmap;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The pair of tables behind a {@link FoldingMap}. All mutation goes through this class.
 *
 * Every update is fully decided (policy consulted, chosen key validated) before either
 * table is written, and the writes themselves can't fail part way.
 */
/* package-private */ class FoldTable<K, V> {
  final KeyFolder<K> folder;
  final Retention retention;
  // INVARIANT 1: preserved.size() == values.size(), and values.keySet() is exactly preserved.values()
  // INVARIANT 2: for each (c, p) in preserved, fold(p) == c
  private final HashMap<K, K> preserved;
  private final LinkedHashMap<K, V> values;

  FoldTable(final KeyFolder<K> folder, final Retention retention) {
    this.folder = Objects.requireNonNull(folder);
    this.retention = Objects.requireNonNull(retention);
    this.preserved = new HashMap<>();
    this.values = new LinkedHashMap<>();
  }

  private FoldTable(final FoldTable<K, V> source) {
    this.folder = source.folder;
    this.retention = source.retention;
    this.preserved = new HashMap<>(source.preserved);
    this.values = new LinkedHashMap<>(source.values);
  }

  @SuppressWarnings("unchecked")
  K fold(Object key) {
    return this.folder.fold((K) key);
  }

  int size() {
    return this.values.size();
  }

  boolean hasClass(K canonical) {
    return this.preserved.containsKey(canonical);
  }

  /** Precondition: {@code hasClass(canonical)} */
  K preservedKeyOf(K canonical) {
    return this.preserved.get(canonical);
  }

  /** Precondition: {@code hasClass(canonical)} */
  V valueOf(K canonical) {
    return this.values.get(this.preserved.get(canonical));
  }

  boolean containsValue(Object value) {
    return this.values.containsValue(value);
  }

  /** Returns the previous value of the key's class, or null if it had none. */
  V store(K key, V value) {
    K canonical = this.fold(key);
    boolean present = this.preserved.containsKey(canonical);
    K existing = present ? this.preserved.get(canonical) : null;
    K chosen = this.retention.preservedKey(key, canonical, present, existing);
    boolean keepsExisting = present && Objects.equals(chosen, existing);
    if (!keepsExisting && !Objects.equals(chosen, key) && !Objects.equals(this.fold(chosen), canonical)) {
      // INVARIANT 2 would break, and chosen might already belong to another class
      throw new IllegalStateException("Retention " + this.retention + " chose key " + chosen
          + " which is not equivalent to " + key);
    }

    if (keepsExisting && !this.retention.reinserts()) {
      return this.values.put(existing, value);
    }
    V prev = present ? this.values.remove(existing) : null;
    this.preserved.put(canonical, chosen);
    this.values.put(chosen, value);
    return prev;
  }

  /** Precondition: {@code hasClass(canonical)} */
  V removeClass(K canonical) {
    K p = this.preserved.remove(canonical);
    return this.values.remove(p);
  }

  void clear() {
    this.preserved.clear();
    this.values.clear();
  }

  /**
   * Iterates the value table in insertion order. {@link Iterator#remove()} drops the
   * class from both tables.
   */
  Iterator<Map.Entry<K, V>> entryIterator() {
    final Iterator<Map.Entry<K, V>> inner = this.values.entrySet().iterator();
    return new Iterator<>() {
      private K lastKey;

      @Override
      public boolean hasNext() {
        return inner.hasNext();
      }

      @Override
      public Map.Entry<K, V> next() {
        Map.Entry<K, V> e = inner.next();
        this.lastKey = e.getKey();
        return e;
      }

      @Override
      public void remove() {
        inner.remove();
        // INVARIANT 2 makes the class of a preserved key recoverable by folding it
        preserved.remove(fold(this.lastKey));
      }
    };
  }

  /** Maps each class's canonical key to its value. */
  Map<K, V> byCanonicalKey() {
    Map<K, V> result = new HashMap<>();
    for (Map.Entry<K, K> e : this.preserved.entrySet()) {
      result.put(e.getKey(), this.values.get(e.getValue()));
    }
    return result;
  }

  /** Same as {@code byCanonicalKey().hashCode()}. */
  int canonicalHashCode() {
    int h = 0;
    for (Map.Entry<K, K> e : this.preserved.entrySet()) {
      h += Objects.hashCode(e.getKey()) ^ Objects.hashCode(this.values.get(e.getValue()));
    }
    return h;
  }

  boolean valuesEqual(Map<?, ?> other) {
    return this.values.equals(other);
  }

  FoldTable<K, V> copy() {
    return new FoldTable<>(this);
  }
}
