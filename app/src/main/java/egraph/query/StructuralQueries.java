package egraph.query;

import egraph.graph.Graph;
import egraph.graph.GraphCanonicalizer;
import egraph.graph.GraphPath;
import egraph.graph.NotationCodec;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Containment tests and occurrence search. Paths use the combined index convention of {@link
 * egraph.graph.Selector}: each parent prefixes the index of the cut it descended into.
 *
 * <p>An element that is the sole content of the enclosure being searched is never reported at
 * that position; it has no occurrence distinct from the enclosure itself.
 */
public final class StructuralQueries {
  private StructuralQueries() {}

  /** True if {@code atom} occurs directly in {@code graph} or in any nested cut. */
  public static boolean contains(Graph graph, String atom) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(atom, "atom");
    if (graph.atoms().contains(atom)) {
      return true;
    }
    for (Graph child : graph.children()) {
      if (contains(child, atom)) {
        return true;
      }
    }
    return false;
  }

  /** True if a cut structurally equal to {@code subGraph} is nested anywhere in {@code graph}. */
  public static boolean contains(Graph graph, Graph subGraph) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(subGraph, "subGraph");
    return containsKey(graph, canonicalKey(subGraph));
  }

  private static boolean containsKey(Graph graph, String key) {
    for (Graph child : graph.children()) {
      if (canonicalKey(child).equals(key) || containsKey(child, key)) {
        return true;
      }
    }
    return false;
  }

  /** Every path to an occurrence of {@code atom} at or below {@code graph}. */
  public static Set<GraphPath> findPaths(Graph graph, String atom) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(atom, "atom");
    Set<GraphPath> paths = new LinkedHashSet<>();
    collectAtomPaths(graph, atom, paths);
    return Collections.unmodifiableSet(paths);
  }

  private static void collectAtomPaths(Graph graph, String atom, Set<GraphPath> paths) {
    if (graph.size() > 1) {
      for (int i = 0; i < graph.atomCount(); i++) {
        if (graph.atoms().get(i).equals(atom)) {
          paths.add(GraphPath.of(graph.cutCount() + i));
        }
      }
    }
    for (int i = 0; i < graph.cutCount(); i++) {
      Graph child = graph.children().get(i);
      if (!contains(child, atom)) {
        continue;
      }
      Set<GraphPath> nested = new LinkedHashSet<>();
      collectAtomPaths(child, atom, nested);
      for (GraphPath path : nested) {
        paths.add(path.prepend(i));
      }
    }
  }

  /** Every path to a nested cut structurally equal to {@code target}. */
  public static Set<GraphPath> findPaths(Graph graph, Graph target) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(target, "target");
    Set<GraphPath> paths = new LinkedHashSet<>();
    collectGraphPaths(graph, canonicalKey(target), paths);
    return Collections.unmodifiableSet(paths);
  }

  private static void collectGraphPaths(Graph graph, String targetKey, Set<GraphPath> paths) {
    for (int i = 0; i < graph.cutCount(); i++) {
      Graph child = graph.children().get(i);
      if (graph.size() > 1 && canonicalKey(child).equals(targetKey)) {
        paths.add(GraphPath.of(i));
        continue;
      }
      Set<GraphPath> nested = new LinkedHashSet<>();
      collectGraphPaths(child, targetKey, nested);
      for (GraphPath path : nested) {
        paths.add(path.prepend(i));
      }
    }
  }

  private static String canonicalKey(Graph graph) {
    // Sheet and cut framing differ; compare content as cuts.
    Graph asCut = graph.root() ? Graph.cut(graph.atoms(), graph.children()) : graph;
    return NotationCodec.serialize(GraphCanonicalizer.canonicalize(asCut));
  }
}
