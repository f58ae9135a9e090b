package egraph.rules;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Erasure of an element from a positive context.
 *
 * <p>The depth of an element is the number of cuts around it; elements written directly on the
 * sheet have depth 0. Only elements at even depth may be erased. The sole element of a nested cut
 * is not offered; the sole element of the sheet is.
 */
public final class ErasureRule implements InferenceRule {
  private static final Logger LOG = LoggerFactory.getLogger(ErasureRule.class);

  @Override
  public RuleKind kind() {
    return RuleKind.ERASURE;
  }

  @Override
  public Set<GraphPath> findSites(Graph graph) {
    return findSites(graph, 0);
  }

  /** Sites below {@code graph}, which is itself enclosed by {@code depth} cuts. */
  public Set<GraphPath> findSites(Graph graph, int depth) {
    Objects.requireNonNull(graph, "graph");
    if (depth < 0) {
      throw new IllegalArgumentException("depth must be non-negative: " + depth);
    }
    Set<GraphPath> sites = new LinkedHashSet<>();
    collect(graph, depth, sites);
    LOG.debug("Found {} erasure site(s) in {} at depth {}", sites.size(), graph, depth);
    return Collections.unmodifiableSet(sites);
  }

  private static void collect(Graph graph, int depth, Set<GraphPath> sites) {
    boolean positive = depth % 2 == 0;
    boolean singletonCut = !graph.root() && graph.size() == 1;
    for (int i = 0; i < graph.size(); i++) {
      if (positive && !singletonCut) {
        sites.add(GraphPath.of(i));
      }
      if (i < graph.cutCount()) {
        Set<GraphPath> nested = new LinkedHashSet<>();
        collect(graph.children().get(i), depth + 1, nested);
        for (GraphPath path : nested) {
          sites.add(path.prepend(i));
        }
      }
    }
  }

  @Override
  public Graph apply(Graph graph, GraphPath path) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(path, "path");
    SiteRewriter.requireSite(graph, path, findSites(graph), kind());
    Graph result = SiteRewriter.removeElement(graph, path);
    LOG.debug("Erased {} at {}: {} -> {}", graph.at(path), path, graph, result);
    return result;
  }
}
