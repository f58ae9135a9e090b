package egraph.rules;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.query.StructuralQueries;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deiteration: a copy of a sheet-level cut or atom found inside a sibling cut is redundant and may
 * be removed. Only the top level of the graph is scanned for originals.
 */
public final class DeiterationRule implements InferenceRule {
  private static final Logger LOG = LoggerFactory.getLogger(DeiterationRule.class);

  @Override
  public RuleKind kind() {
    return RuleKind.DEITERATION;
  }

  @Override
  public Set<GraphPath> findSites(Graph graph) {
    Objects.requireNonNull(graph, "graph");
    Set<GraphPath> sites = new LinkedHashSet<>();
    for (int i = 0; i < graph.cutCount(); i++) {
      for (int j = 0; j < graph.cutCount(); j++) {
        if (i == j) {
          continue;
        }
        Graph original = graph.children().get(i);
        for (GraphPath path : StructuralQueries.findPaths(graph.children().get(j), original)) {
          sites.add(path.prepend(j));
        }
      }
    }
    for (String atom : graph.atoms()) {
      for (int j = 0; j < graph.cutCount(); j++) {
        for (GraphPath path : StructuralQueries.findPaths(graph.children().get(j), atom)) {
          sites.add(path.prepend(j));
        }
      }
    }
    LOG.debug("Found {} deiteration site(s) in {}", sites.size(), graph);
    return Collections.unmodifiableSet(sites);
  }

  @Override
  public Graph apply(Graph graph, GraphPath path) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(path, "path");
    SiteRewriter.requireSite(graph, path, findSites(graph), kind());
    Graph result = SiteRewriter.removeElement(graph, path);
    LOG.debug("Deiterated {} at {}: {} -> {}", graph.at(path), path, graph, result);
    return result;
  }
}
