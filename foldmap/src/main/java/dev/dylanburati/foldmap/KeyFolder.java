package dev.dylanburati.foldmap;

import java.util.Locale;
import java.util.Objects;

/**
 * Maps a key to the canonical key of its equivalence class. Two keys refer to the
 * same {@link FoldingMap} entry iff their folded forms are equal.
 *
 * A folder must be total: it may not throw for any key the map can receive, including
 * {@code null}. It should also be idempotent, and it must return an object of the same
 * type family as its input, since {@link Retention#CANONICAL} stores the folded key as
 * the preserved key.
 */
@FunctionalInterface
public interface KeyFolder<K> {
  K fold(K key);

  /** Applies this folder, then {@code after}. */
  default KeyFolder<K> andThen(final KeyFolder<K> after) {
    Objects.requireNonNull(after);
    return key -> after.fold(this.fold(key));
  }

  /** Exact-match keys, i.e. a plain map. */
  static <K> KeyFolder<K> identity() {
    return castUnsafe(Folders.IDENTITY);
  }

  /** Strings are lower-cased with {@link Locale#ROOT}; other keys are unchanged. */
  static <K> KeyFolder<K> lowerCase() {
    return castUnsafe(Folders.LOWER_CASE);
  }

  /** Strings have all whitespace removed (case is kept); other keys are unchanged. */
  static <K> KeyFolder<K> strippedWhitespace() {
    return castUnsafe(Folders.STRIPPED_WHITESPACE);
  }

  /**
   * Lists of mutually comparable elements are replaced by an unmodifiable sorted copy,
   * and strings by their sorted characters. Anything else is unchanged.
   *
   * Note that this makes {@code "abc"} and {@code "bca"} the same key.
   */
  static <K> KeyFolder<K> sortedElements() {
    return castUnsafe(Folders.SORTED_ELEMENTS);
  }

  @SuppressWarnings("unchecked")
  private static <K> KeyFolder<K> castUnsafe(KeyFolder<Object> folder) {
    return (KeyFolder<K>) folder;
  }
}
