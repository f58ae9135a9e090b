package egraph.rules;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.graph.InvalidPathException;
import egraph.graph.Selector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Double-cut removal. A cut whose only content is another cut is collapsed: both enclosures
 * disappear and the inner cut's atoms and cuts move into the enclosure that held the outer one.
 */
public final class DoubleCutRule implements InferenceRule {
  private static final Logger LOG = LoggerFactory.getLogger(DoubleCutRule.class);

  @Override
  public RuleKind kind() {
    return RuleKind.DOUBLE_CUT;
  }

  @Override
  public Set<GraphPath> findSites(Graph graph) {
    Objects.requireNonNull(graph, "graph");
    Set<GraphPath> sites = new LinkedHashSet<>();
    collect(graph, sites);
    LOG.debug("Found {} double-cut site(s) in {}", sites.size(), graph);
    return Collections.unmodifiableSet(sites);
  }

  private static void collect(Graph graph, Set<GraphPath> sites) {
    for (int i = 0; i < graph.cutCount(); i++) {
      Graph child = graph.children().get(i);
      if (child.isDoubleCut()) {
        sites.add(GraphPath.of(i));
      }
      Set<GraphPath> nested = new LinkedHashSet<>();
      collect(child, nested);
      for (GraphPath path : nested) {
        sites.add(path.prepend(i));
      }
    }
  }

  @Override
  public Graph apply(Graph graph, GraphPath path) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(path, "path");
    SiteRewriter.requireSite(graph, path, findSites(graph), kind());
    Graph result = SiteRewriter.rewriteEnclosure(graph, path, DoubleCutRule::collapse);
    LOG.debug("Collapsed double cut at {}: {} -> {}", path, graph, result);
    return result;
  }

  private static Graph collapse(Graph enclosure, Selector selector) {
    if (selector.kind() != Selector.Kind.CUT) {
      throw new InvalidPathException(null, "double cut must address a cut, not an atom");
    }
    Graph outer = enclosure.children().get(selector.index());
    Graph inner = outer.children().get(0);

    List<Graph> children = new ArrayList<>(enclosure.cutCount() + inner.cutCount());
    children.addAll(enclosure.children().subList(0, selector.index()));
    children.addAll(inner.children());
    children.addAll(enclosure.children().subList(selector.index() + 1, enclosure.cutCount()));

    List<String> atoms = new ArrayList<>(enclosure.atoms());
    atoms.addAll(inner.atoms());
    return enclosure.withContent(atoms, children);
  }
}
