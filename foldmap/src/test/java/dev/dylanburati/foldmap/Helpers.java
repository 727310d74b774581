package dev.dylanburati.foldmap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class Helpers {
  public static <T> List<T> reversed(List<T> original) {
    List<T> result = new ArrayList<>(original);
    Collections.reverse(result);
    return result;
  }

  /** Snapshot of the key set, in iteration order. */
  public static <K> List<K> keyList(Map<K, ?> m) {
    return new ArrayList<>(m.keySet());
  }
}
