package dev.dylanburati.foldmap;

import java.util.AbstractCollection;
import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Collection;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Consumer;

/**
 * Map where keys that fold to the same canonical key refer to the same entry.
 *
 * The default {@link KeyFolder#lowerCase()} folder makes {@code String} keys
 * case-insensitive and leaves other keys (including {@code null}) as exact-match keys:
 * <pre>{@code
 * FoldingMap<String, String> m = new FoldingMap<>();
 * m.put("Clown", "Bozo");
 * m.put("clown", "Krusty");
 * m.get("CLOWN");  // "Krusty"
 * m.keySet();      // ["Clown"]
 * }</pre>
 *
 * Each equivalence class is enumerated under a single preserved key, picked by the
 * map's {@link Retention}. Iteration follows the order in which classes were first
 * populated; updating an existing class doesn't move it unless the retention replaces
 * its entry.
 *
 * Two folding maps are equal when they hold the same values under the same folded keys,
 * whatever their preserved keys. Compared with any other map, the preserved keys are
 * compared as-is. This makes equality non-transitive across the two kinds of map, and
 * {@link #hashCode()}, which is computed over folded keys, only agrees with {@code equals}
 * between folding maps.
 *
 * Not thread-safe. Wrap with {@link java.util.Collections#synchronizedMap} for shared use.
 */
public class FoldingMap<K, V> extends AbstractMap<K, V> {
  private final FoldTable<K, V> table;

  public FoldingMap() {
    this(KeyFolder.lowerCase(), Retention.FIRST_SEEN);
  }

  public FoldingMap(final KeyFolder<K> folder) {
    this(folder, Retention.FIRST_SEEN);
  }

  public FoldingMap(final KeyFolder<K> folder, final Retention retention) {
    this.table = new FoldTable<>(folder, retention);
  }

  /**
   * Copies {@code source} in its iteration order. Keys of {@code source} which fold
   * together collapse into one entry, holding the last of their values.
   */
  public FoldingMap(final Map<? extends K, ? extends V> source) {
    this(KeyFolder.lowerCase(), Retention.FIRST_SEEN, source);
  }

  public FoldingMap(final KeyFolder<K> folder, final Retention retention, final Map<? extends K, ? extends V> source) {
    this(folder, retention);
    this.putAll(source);
  }

  private FoldingMap(final FoldTable<K, V> table) {
    this.table = table;
  }

  /** Builds a map by putting each pair in order, so later equivalent keys win. */
  public static <K, V> FoldingMap<K, V> ofEntries(final KeyFolder<K> folder, final Retention retention,
      final Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
    FoldingMap<K, V> result = new FoldingMap<>(folder, retention);
    for (Map.Entry<? extends K, ? extends V> e : entries) {
      result.put(e.getKey(), e.getValue());
    }
    return result;
  }

  public static <K, V> FoldingMap<K, V> caseInsensitive() {
    return new FoldingMap<>(KeyFolder.lowerCase(), Retention.FIRST_SEEN);
  }

  /** Case-insensitive, with each class enumerated under its lower-cased key. */
  public static <K, V> FoldingMap<K, V> canonical() {
    return new FoldingMap<>(KeyFolder.lowerCase(), Retention.CANONICAL);
  }

  /** Case-insensitive, with each class enumerated under the key it was last put with. */
  public static <K, V> FoldingMap<K, V> mostRecent() {
    return new FoldingMap<>(KeyFolder.lowerCase(), Retention.MOST_RECENT);
  }

  public static <K, V> FoldingMap<K, V> strippedWhitespace() {
    return new FoldingMap<>(KeyFolder.strippedWhitespace(), Retention.FIRST_SEEN);
  }

  public static <K, V> FoldingMap<K, V> sortedElements() {
    return new FoldingMap<>(KeyFolder.sortedElements(), Retention.FIRST_SEEN);
  }

  public KeyFolder<K> folder() {
    return this.table.folder;
  }

  public Retention retention() {
    return this.table.retention;
  }

  public K canonicalKey(K key) {
    return this.table.fold(key);
  }

  /** Returns the key under which {@code key}'s class is enumerated, or null if absent. */
  public K preservedKey(Object key) {
    K canonical = this.table.fold(key);
    return this.table.hasClass(canonical) ? this.table.preservedKeyOf(canonical) : null;
  }

  @Override
  public int size() {
    return this.table.size();
  }

  @Override
  public boolean isEmpty() {
    return this.table.size() == 0;
  }

  @Override
  public boolean containsKey(Object key) {
    return this.table.hasClass(this.table.fold(key));
  }

  @Override
  public boolean containsValue(Object value) {
    return this.table.containsValue(value);
  }

  @Override
  public V get(Object key) {
    return this.getOrDefault(key, null);
  }

  @Override
  public V getOrDefault(Object key, V defaultValue) {
    K canonical = this.table.fold(key);
    if (!this.table.hasClass(canonical)) {
      return defaultValue;
    }
    return this.table.valueOf(canonical);
  }

  /**
   * Like {@link #get}, but distinguishes a missing key from a null value.
   *
   * @throws NoSuchElementException if no key equivalent to {@code key} is present
   */
  public V fetch(Object key) {
    K canonical = this.table.fold(key);
    if (!this.table.hasClass(canonical)) {
      throw new NoSuchElementException("Key not found: " + key);
    }
    return this.table.valueOf(canonical);
  }

  /**
   * @throws IllegalStateException if the retention picks a key that doesn't fold like
   *   {@code key}; the map is left unchanged
   */
  @Override
  public V put(K key, V value) {
    return this.table.store(key, value);
  }

  @Override
  public V putIfAbsent(K key, V value) {
    K canonical = this.table.fold(key);
    if (this.table.hasClass(canonical)) {
      V prev = this.table.valueOf(canonical);
      if (prev != null) {
        return prev;
      }
    }
    return this.table.store(key, value);
  }

  @Override
  public V remove(Object key) {
    K canonical = this.table.fold(key);
    if (!this.table.hasClass(canonical)) {
      return null;
    }
    return this.table.removeClass(canonical);
  }

  /**
   * Removes the class of {@code key}, returning its value.
   *
   * @throws NoSuchElementException if no key equivalent to {@code key} is present; the
   *   map is left unchanged
   */
  public V delete(Object key) {
    K canonical = this.table.fold(key);
    if (!this.table.hasClass(canonical)) {
      throw new NoSuchElementException("Key not found: " + key);
    }
    return this.table.removeClass(canonical);
  }

  @Override
  public void replaceAll(BiFunction<? super K, ? super V, ? extends V> function) {
    Objects.requireNonNull(function);
    for (Iterator<Map.Entry<K, V>> it = this.table.entryIterator(); it.hasNext(); ) {
      Map.Entry<K, V> e = it.next();
      e.setValue(function.apply(e.getKey(), e.getValue()));
    }
  }

  @Override
  public void clear() {
    this.table.clear();
  }

  @Override
  public Set<K> keySet() {
    return new KeySet<>(this);
  }

  @Override
  public Collection<V> values() {
    return new Values<>(this);
  }

  @Override
  public Set<Entry<K, V>> entrySet() {
    return new EntrySet<>(this);
  }

  /**
   * Creates a shallow copy of this map, with the same folder and retention and separate
   * tables. Values are shared.
   */
  public FoldingMap<K, V> copy() {
    return new FoldingMap<>(this.table.copy());
  }

  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (o instanceof FoldingMap<?, ?>) {
      FoldingMap<?, ?> other = (FoldingMap<?, ?>) o;
      return this.size() == other.size() && this.table.byCanonicalKey().equals(other.table.byCanonicalKey());
    }
    if (o instanceof Map<?, ?>) {
      return this.table.valuesEqual((Map<?, ?>) o);
    }
    return false;
  }

  @Override
  public int hashCode() {
    return this.table.canonicalHashCode();
  }

  @Override
  public String toString() {
    return "FoldingMap" + super.toString();
  }

  protected static class KeySet<K> extends AbstractSet<K> {
    private final FoldingMap<K, ?> owner;
    protected KeySet(final FoldingMap<K, ?> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<K> iterator() {
      return new KeyIterator<>(owner);
    }
    // folded membership, so "CLOWN" is in a key set holding "Clown"
    public final boolean contains(Object o) {
      return owner.containsKey(o);
    }
    public final boolean remove(Object key) {
      K canonical = owner.table.fold(key);
      if (!owner.table.hasClass(canonical)) {
        return false;
      }
      owner.table.removeClass(canonical);
      return true;
    }
  }

  protected static class Values<V> extends AbstractCollection<V> {
    private final FoldingMap<?, V> owner;
    protected Values(final FoldingMap<?, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<V> iterator() {
      return new ValueIterator<>(owner);
    }
    public final boolean contains(Object o) {
      return owner.containsValue(o);
    }
  }

  protected static class EntrySet<K, V> extends AbstractSet<Map.Entry<K, V>> {
    private final FoldingMap<K, V> owner;
    protected EntrySet(final FoldingMap<K, V> owner) {
      this.owner = owner;
    }

    public final int size() {
      return owner.size();
    }
    public final void clear() {
      owner.clear();
    }
    public final Iterator<Map.Entry<K, V>> iterator() {
      return new EntryIterator<>(owner);
    }

    // only the preserved key of a class matches, as in keySet().iterator()
    public final boolean contains(Object o) {
      if (!(o instanceof Map.Entry<?, ?>)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      K canonical = owner.table.fold(e.getKey());
      return owner.table.hasClass(canonical)
          && Objects.equals(owner.table.preservedKeyOf(canonical), e.getKey())
          && Objects.equals(owner.table.valueOf(canonical), e.getValue());
    }
    public final boolean remove(Object o) {
      if (!this.contains(o)) {
        return false;
      }
      Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
      owner.table.removeClass(owner.table.fold(e.getKey()));
      return true;
    }
    public final void forEach(Consumer<? super Map.Entry<K, V>> action) {
      if (action == null) {
        throw new NullPointerException();
      }
      for (Iterator<Map.Entry<K, V>> it = owner.table.entryIterator(); it.hasNext(); ) {
        action.accept(it.next());
      }
    }
  }

  protected static abstract class FoldIterator<K, V> {
    private final Iterator<Map.Entry<K, V>> inner;

    protected FoldIterator(final FoldingMap<K, V> owner) {
      this.inner = owner.table.entryIterator();
    }

    public final boolean hasNext() {
      return inner.hasNext();
    }

    public final void remove() {
      inner.remove();
    }

    protected Map.Entry<K, V> advance() {
      return inner.next();
    }
  }

  protected static class KeyIterator<K> extends FoldIterator<K, Object> implements Iterator<K> {
    @SuppressWarnings("unchecked")
    protected KeyIterator(final FoldingMap<K, ?> owner) {
      super((FoldingMap<K, Object>) owner);
    }
    public final K next() {
      return this.advance().getKey();
    }
  }

  protected static class ValueIterator<V> extends FoldIterator<Object, V> implements Iterator<V> {
    @SuppressWarnings("unchecked")
    protected ValueIterator(final FoldingMap<?, V> owner) {
      super((FoldingMap<Object, V>) owner);
    }
    public final V next() {
      return this.advance().getValue();
    }
  }

  protected static class EntryIterator<K, V> extends FoldIterator<K, V> implements Iterator<Map.Entry<K, V>> {
    protected EntryIterator(final FoldingMap<K, V> owner) {
      super(owner);
    }
    public final Map.Entry<K, V> next() {
      return this.advance();
    }
  }
}
