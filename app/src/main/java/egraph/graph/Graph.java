package egraph.graph;

import java.util.List;
import java.util.Objects;

/**
 * One enclosure of an existential graph: either the sheet of assertion ({@code root == true}) or a
 * cut. The record is immutable; every transformation builds a new tree.
 *
 * <p>Elements of an enclosure share one address space: indices {@code 0 .. cutCount()-1} select
 * nested cuts, indices {@code cutCount() .. size()-1} select atoms. See {@link Selector}.
 */
public record Graph(boolean root, List<String> atoms, List<Graph> children)
    implements Comparable<Graph> {

  public Graph {
    Objects.requireNonNull(atoms, "atoms");
    Objects.requireNonNull(children, "children");
    atoms = List.copyOf(atoms);
    children = List.copyOf(children);
    for (Graph child : children) {
      if (child.root()) {
        throw new IllegalArgumentException("A sheet of assertion cannot be nested: " + child);
      }
    }
  }

  public static Graph sheet(List<String> atoms, List<Graph> children) {
    return new Graph(true, atoms, children);
  }

  public static Graph cut(List<String> atoms, List<Graph> children) {
    return new Graph(false, atoms, children);
  }

  public static Graph emptySheet() {
    return sheet(List.of(), List.of());
  }

  public int atomCount() {
    return atoms.size();
  }

  public int cutCount() {
    return children.size();
  }

  public int size() {
    return atoms.size() + children.size();
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /** True for a cut whose whole content is one bare cut. */
  public boolean isDoubleCut() {
    return !root && atoms.isEmpty() && children.size() == 1;
  }

  /** Same enclosure kind with the given content. */
  public Graph withContent(List<String> newAtoms, List<Graph> newChildren) {
    return new Graph(root, newAtoms, newChildren);
  }

  /**
   * Returns the element at a combined index: the nested cut itself, or a sheet holding just the
   * atom.
   */
  public Graph elementAt(int combinedIndex) {
    Selector selector = Selector.resolve(this, combinedIndex);
    return switch (selector.kind()) {
      case CUT -> children.get(selector.index());
      case ATOM -> sheet(List.of(atoms.get(selector.index())), List.of());
    };
  }

  /** Follows {@code path} from this enclosure and returns the addressed element. */
  public Graph at(GraphPath path) {
    Objects.requireNonNull(path, "path");
    if (path.isEmpty()) {
      throw new InvalidPathException(path, "empty path addresses no element");
    }
    Graph current = this;
    List<Integer> steps = path.steps();
    for (int i = 0; i < steps.size() - 1; i++) {
      Selector step = Selector.resolve(current, steps.get(i), path);
      if (step.kind() != Selector.Kind.CUT) {
        throw new InvalidPathException(path, "step " + i + " descends into an atom");
      }
      current = current.children().get(step.index());
    }
    Selector.resolve(current, path.last(), path);
    return current.elementAt(path.last());
  }

  /** Order-insensitive equality: both graphs have the same canonical form. */
  public static boolean sameStructure(Graph left, Graph right) {
    return canonicalKey(left).equals(canonicalKey(right));
  }

  static String canonicalKey(Graph graph) {
    return NotationCodec.serialize(GraphCanonicalizer.canonicalize(graph));
  }

  @Override
  public int compareTo(Graph other) {
    return canonicalKey(this).compareTo(canonicalKey(other));
  }

  @Override
  public String toString() {
    return NotationCodec.serialize(this);
  }
}
