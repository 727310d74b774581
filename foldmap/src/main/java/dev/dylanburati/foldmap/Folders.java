package dev.dylanburati.foldmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/* package-private */ final class Folders {
  private Folders() {}

  static final KeyFolder<Object> IDENTITY = key -> key;

  static final KeyFolder<Object> LOWER_CASE = key -> {
    if (key instanceof String) {
      return ((String) key).toLowerCase(Locale.ROOT);
    }
    return key;
  };

  static final KeyFolder<Object> STRIPPED_WHITESPACE = key -> {
    if (!(key instanceof String)) {
      return key;
    }
    String s = (String) key;
    StringBuilder bldr = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); ) {
      int cp = s.codePointAt(i);
      if (!Character.isWhitespace(cp)) {
        bldr.appendCodePoint(cp);
      }
      i += Character.charCount(cp);
    }
    return bldr.toString();
  };

  static final KeyFolder<Object> SORTED_ELEMENTS = key -> {
    if (key instanceof String) {
      // by code point, so surrogate pairs stay together
      StringBuilder bldr = new StringBuilder();
      ((String) key).codePoints().sorted().forEach(bldr::appendCodePoint);
      return bldr.toString();
    }
    if (key instanceof List<?> && isMutuallyComparable((List<?>) key)) {
      return sortedCopy((List<?>) key);
    }
    return key;
  };

  // Sorting is only attempted when every element is a Comparable of one class, so
  // the fold can't fail part way through.
  private static boolean isMutuallyComparable(List<?> elements) {
    Class<?> first = null;
    for (Object e : elements) {
      if (!(e instanceof Comparable<?>)) {
        return false;
      }
      if (first == null) {
        first = e.getClass();
      } else if (first != e.getClass()) {
        return false;
      }
    }
    return true;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static List<?> sortedCopy(List<?> elements) {
    List copy = new ArrayList<>(elements);
    Collections.sort(copy);
    return Collections.unmodifiableList(copy);
  }
}
