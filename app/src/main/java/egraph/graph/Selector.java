package egraph.graph;

import java.util.Objects;

/**
 * Tagged form of one combined path step. Cuts occupy the low indices of an enclosure and atoms the
 * high ones; a selector names which list the step refers to and the position inside that list.
 */
public record Selector(Kind kind, int index) {

  public enum Kind {
    CUT,
    ATOM
  }

  public Selector {
    Objects.requireNonNull(kind, "kind");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative: " + index);
    }
  }

  public static Selector cut(int index) {
    return new Selector(Kind.CUT, index);
  }

  public static Selector atom(int index) {
    return new Selector(Kind.ATOM, index);
  }

  /** Combined index of this selector inside {@code enclosure}. */
  public int combinedIndex(Graph enclosure) {
    return kind == Kind.CUT ? index : enclosure.cutCount() + index;
  }

  public static Selector resolve(Graph enclosure, int combinedIndex) {
    return resolve(enclosure, combinedIndex, null);
  }

  static Selector resolve(Graph enclosure, int combinedIndex, GraphPath path) {
    if (combinedIndex < 0 || combinedIndex >= enclosure.size()) {
      throw new InvalidPathException(
          path,
          "index " + combinedIndex + " out of range for " + enclosure + " (size " + enclosure.size()
              + ")");
    }
    if (combinedIndex < enclosure.cutCount()) {
      return cut(combinedIndex);
    }
    return atom(combinedIndex - enclosure.cutCount());
  }
}
