package dev.dylanburati.foldmap;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Counts words case-insensitively. The exact-match maps are given lower-cased words,
 * the others the words as generated.
 */
@State(Scope.Benchmark)
public class CaseInsensitiveCountBenchmark {
  @Param({"1000000"})
  public int wordCount;

  private String[] words;

  @Setup(Level.Trial)
  public void generate() {
    this.words = generateWords(this.wordCount, new Random(0L));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void countFoldingMapFirstSeen(Blackhole bh) {
    bh.consume(count(new FoldingMap<>(KeyFolder.lowerCase(), Retention.FIRST_SEEN), false));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void countFoldingMapMostRecent(Blackhole bh) {
    bh.consume(count(new FoldingMap<>(KeyFolder.lowerCase(), Retention.MOST_RECENT), false));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void countCaseInsensitiveTreeMap(Blackhole bh) {
    bh.consume(count(new TreeMap<>(String.CASE_INSENSITIVE_ORDER), false));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void countLowerCasedHashMap(Blackhole bh) {
    bh.consume(count(new HashMap<>(), true));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void countLowerCasedObject2IntMap(Blackhole bh) {
    bh.consume(count(new Object2IntOpenHashMap<>(), true));
  }

  private int count(Map<String, Integer> m, boolean lowerCase) {
    for (String w : this.words) {
      m.merge(lowerCase ? w.toLowerCase(Locale.ROOT) : w, 1, (v1, v2) -> v1 + v2);
    }
    return m.size();
  }

  private static int genWordId(double uniform) {
    // Zipf-like: P(x) proportional to (x+3.7) ** -1.01, with x capped at 2**27
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01
  };

  private static int genWordLen(double uniform) {
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    return Math.min(i >= 0 ? i : -i - 1, LENGTH_CDF.length);
  }

  // Same word ids get the same letters, but each occurrence has its own capitalization
  static String[] generateWords(int n, Random r) {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[LENGTH_CDF.length];
    String[] result = new String[n];
    for (int i = 0; i < n; i++) {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      int upperMask = r.nextInt(4) == 0 ? r.nextInt() : 0;
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        byte c = alph[(wid >> (3 * (j%9))) & 7];
        wbuf[j] = ((upperMask >> j) & 1) == 1 ? (byte) (c - 'a' + 'A') : c;
      }
      result[i] = new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
    }
    return result;
  }
}
