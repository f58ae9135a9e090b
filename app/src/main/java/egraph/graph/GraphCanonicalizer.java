package egraph.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Puts a graph into canonical order so structurally identical graphs share one serialized form:
 * atoms sort lexicographically and cuts sort by their own canonical notation, innermost first.
 * Juxtaposition is conjunction, so sibling order never carries meaning.
 */
public final class GraphCanonicalizer {
  private GraphCanonicalizer() {}

  public static Graph canonicalize(Graph graph) {
    List<Graph> children = new ArrayList<>(graph.cutCount());
    for (Graph child : graph.children()) {
      children.add(canonicalize(child));
    }
    children.sort(Comparator.comparing(NotationCodec::serialize));

    List<String> atoms = new ArrayList<>(graph.atoms());
    atoms.sort(String::compareTo);
    return graph.withContent(atoms, children);
  }

  public static boolean isCanonical(Graph graph) {
    return canonicalize(graph).equals(graph);
  }
}
