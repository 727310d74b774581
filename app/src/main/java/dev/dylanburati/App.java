package dev.dylanburati;

import dev.dylanburati.foldmap.FoldingMap;
import dev.dylanburati.foldmap.KeyFolder;
import dev.dylanburati.foldmap.Retention;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.regex.Pattern;

public class App {
  private static final Pattern RE_SPACE = Pattern.compile("\\s+");
  private static final Pattern RE_NON_WORD = Pattern.compile("[^\\p{L}\\p{N}'&-]");
  private static final int TOP_N = 10;

  static class UsageException extends Exception {
    UsageException(String message) {
      super(message);
    }
  }

  // fastutil maps are exact-match, so words are folded before they reach it
  static class LowerCasedCounter extends AbstractMap<String, Integer> {
    private final Object2IntLinkedOpenHashMap<String> inner = new Object2IntLinkedOpenHashMap<>();

    @Override
    public Integer merge(String key, Integer value, BiFunction<? super Integer, ? super Integer, ? extends Integer> remappingFunction) {
      return inner.merge(key.toLowerCase(Locale.ROOT), value, remappingFunction);
    }

    @Override
    public Set<Entry<String, Integer>> entrySet() {
      return inner.entrySet();
    }
  }

  static Retention parseRetention(String name) throws UsageException {
    switch (name) {
      case "first-seen":
        return Retention.FIRST_SEEN;
      case "canonical":
        return Retention.CANONICAL;
      case "most-recent":
        return Retention.MOST_RECENT;
      default:
        throw new UsageException("unknown retention: " + name);
    }
  }

  static Map<String, Integer> newCounter(String impl, Retention retention) throws UsageException {
    switch (impl) {
      case "foldmap":
        return new FoldingMap<>(KeyFolder.lowerCase(), retention);
      case "java.util":
        return new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
      case "fastutil":
        return new LowerCasedCounter();
      default:
        throw new UsageException("unknown map implementation: " + impl);
    }
  }

  public static int wordcount(Reader input, Map<String, Integer> m) throws IOException {
    BufferedReader r = new BufferedReader(input);
    String line;
    while ((line = r.readLine()) != null) {
      for (String w : RE_SPACE.split(RE_NON_WORD.matcher(line).replaceAll(" "))) {
        if (!w.isEmpty()) {
          m.merge(w, 1, (v1, v2) -> v1 + v2);
        }
      }
    }
    return m.size();
  }

  static List<Map.Entry<String, Integer>> mostFrequent(Map<String, Integer> m, int limit) {
    List<Map.Entry<String, Integer>> entries = new ArrayList<>(m.entrySet());
    // stable sort keeps insertion order among ties
    entries.sort(Comparator.comparing((Map.Entry<String, Integer> e) -> e.getValue()).reversed());
    return entries.subList(0, Math.min(limit, entries.size()));
  }

  static int run(String[] args) throws IOException {
    Map<String, Integer> m;
    List<String> files;
    try {
      String impl = args.length > 0 ? args[0] : "foldmap";
      Retention retention = parseRetention(args.length > 1 ? args[1] : "first-seen");
      m = newCounter(impl, retention);
      files = args.length > 2 ? List.of(args).subList(2, args.length) : List.of();
    } catch (UsageException e) {
      System.err.println(e.getMessage());
      System.err.println("usage: App [foldmap|java.util|fastutil] [first-seen|canonical|most-recent] [file...]");
      return 2;
    }

    if (files.isEmpty()) {
      wordcount(new InputStreamReader(System.in, StandardCharsets.UTF_8), m);
    }
    for (String f : files) {
      try (Reader r = Files.newBufferedReader(Paths.get(f), StandardCharsets.UTF_8)) {
        wordcount(r, m);
      }
    }
    System.out.println("Size: " + m.size());
    for (Map.Entry<String, Integer> e : mostFrequent(m, TOP_N)) {
      System.out.println(e.getValue() + "\t" + e.getKey());
    }
    return 0;
  }

  public static void main(String[] args) throws IOException {
    int status = run(args);
    if (status != 0) {
      System.exit(status);
    }
  }
}
