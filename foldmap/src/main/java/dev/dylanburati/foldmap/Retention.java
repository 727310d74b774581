package dev.dylanburati.foldmap;

/**
 * Decides which literal key represents an equivalence class of a {@link FoldingMap}.
 * The chosen key (the preserved key) is what {@code keySet()} and {@code entrySet()}
 * return for the class.
 *
 * Consulted on every {@code put}. If the returned key differs from the current preserved
 * key, or {@link #reinserts()} is true, the class's entry is replaced by one appended to
 * the end of the iteration order.
 */
public interface Retention {
  /**
   * @param incoming the key passed to {@code put}
   * @param canonical {@code incoming} after folding
   * @param present whether the class already has an entry
   * @param existing the current preserved key of the class, only meaningful if {@code present}
   * @return the preserved key to store; must fold to {@code canonical}
   */
  <K> K preservedKey(K incoming, K canonical, boolean present, K existing);

  /** Whether a {@code put} to a populated class moves it to the end of the iteration order. */
  default boolean reinserts() {
    return false;
  }

  /** Keeps the first key seen for each class. */
  Retention FIRST_SEEN = new Retention() {
    @Override
    public <K> K preservedKey(K incoming, K canonical, boolean present, K existing) {
      return present ? existing : incoming;
    }

    @Override
    public String toString() {
      return "FIRST_SEEN";
    }
  };

  /** Always stores the folded key, so the preserved key does not depend on insertion history. */
  Retention CANONICAL = new Retention() {
    @Override
    public <K> K preservedKey(K incoming, K canonical, boolean present, K existing) {
      return present ? existing : canonical;
    }

    @Override
    public String toString() {
      return "CANONICAL";
    }
  };

  /**
   * Keeps the key most recently passed to {@code put}. Each put behaves like removing the
   * class and inserting it again, applied as a single update.
   */
  Retention MOST_RECENT = new Retention() {
    @Override
    public <K> K preservedKey(K incoming, K canonical, boolean present, K existing) {
      return incoming;
    }

    @Override
    public boolean reinserts() {
      return true;
    }

    @Override
    public String toString() {
      return "MOST_RECENT";
    }
  };
}
