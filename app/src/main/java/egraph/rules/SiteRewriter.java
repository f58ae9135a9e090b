package egraph.rules;

import egraph.graph.Graph;
import egraph.graph.GraphCanonicalizer;
import egraph.graph.GraphPath;
import egraph.graph.InvalidPathException;
import egraph.graph.Selector;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;

/**
 * Rebuilds a graph along a path: every ancestor of the edited enclosure is copied, everything off
 * the path is shared unchanged.
 */
final class SiteRewriter {
  private SiteRewriter() {}

  /**
   * Rejects {@code path} unless it is one of {@code sites}. The structural walk runs first so
   * out-of-range paths report the failing step.
   */
  static void requireSite(Graph graph, GraphPath path, Set<GraphPath> sites, RuleKind kind) {
    graph.at(path);
    if (!sites.contains(path)) {
      throw new InvalidPathException(path, "not a " + kind.displayName() + " site in " + graph);
    }
  }

  /**
   * Replaces the enclosure that holds the element at {@code path} with {@code edit(enclosure,
   * selector)} and returns the canonical result.
   */
  static Graph rewriteEnclosure(
      Graph graph, GraphPath path, BiFunction<Graph, Selector, Graph> edit) {
    return GraphCanonicalizer.canonicalize(rewrite(graph, path, 0, edit));
  }

  private static Graph rewrite(
      Graph node, GraphPath path, int depth, BiFunction<Graph, Selector, Graph> edit) {
    int step = path.steps().get(depth);
    if (depth == path.depth() - 1) {
      return edit.apply(node, Selector.resolve(node, step));
    }
    Selector selector = Selector.resolve(node, step);
    if (selector.kind() != Selector.Kind.CUT) {
      throw new InvalidPathException(path, "step " + depth + " descends into an atom");
    }
    List<Graph> children = new ArrayList<>(node.children());
    children.set(selector.index(), rewrite(children.get(selector.index()), path, depth + 1, edit));
    return node.withContent(node.atoms(), children);
  }

  /** Removes the atom or cut at {@code path}. */
  static Graph removeElement(Graph graph, GraphPath path) {
    return rewriteEnclosure(
        graph,
        path,
        (enclosure, selector) -> {
          List<String> atoms = new ArrayList<>(enclosure.atoms());
          List<Graph> children = new ArrayList<>(enclosure.children());
          switch (selector.kind()) {
            case CUT -> children.remove(selector.index());
            case ATOM -> atoms.remove(selector.index());
          }
          return enclosure.withContent(atoms, children);
        });
  }
}
