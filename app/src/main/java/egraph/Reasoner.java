package egraph;

import egraph.graph.Graph;
import egraph.graph.GraphCanonicalizer;
import egraph.graph.GraphPath;
import egraph.graph.NotationCodec;
import egraph.query.StructuralQueries;
import egraph.rules.DeiterationRule;
import egraph.rules.DoubleCutRule;
import egraph.rules.ErasureRule;
import egraph.rules.InferenceRule;
import egraph.rules.RuleKind;
import java.util.Objects;
import java.util.Set;

/** Entry point to the notation codec, the structural queries and the rules of inference. */
public final class Reasoner {
  private static final DoubleCutRule DOUBLE_CUT = new DoubleCutRule();
  private static final ErasureRule ERASURE = new ErasureRule();
  private static final DeiterationRule DEITERATION = new DeiterationRule();

  private Reasoner() {}

  public static Graph parse(String text) {
    return NotationCodec.parse(text);
  }

  public static String serialize(Graph graph) {
    return NotationCodec.serialize(graph);
  }

  public static Graph canonicalize(Graph graph) {
    return GraphCanonicalizer.canonicalize(graph);
  }

  public static boolean contains(Graph graph, String atom) {
    return StructuralQueries.contains(graph, atom);
  }

  public static boolean contains(Graph graph, Graph subGraph) {
    return StructuralQueries.contains(graph, subGraph);
  }

  public static Set<GraphPath> findPaths(Graph graph, String atom) {
    return StructuralQueries.findPaths(graph, atom);
  }

  public static Set<GraphPath> findPaths(Graph graph, Graph target) {
    return StructuralQueries.findPaths(graph, target);
  }

  public static Set<GraphPath> findDoubleCuts(Graph graph) {
    return DOUBLE_CUT.findSites(graph);
  }

  public static Graph applyDoubleCut(Graph graph, GraphPath path) {
    return DOUBLE_CUT.apply(graph, path);
  }

  public static Set<GraphPath> findErasureSites(Graph graph) {
    return ERASURE.findSites(graph);
  }

  public static Set<GraphPath> findErasureSites(Graph graph, int depth) {
    return ERASURE.findSites(graph, depth);
  }

  public static Graph applyErasure(Graph graph, GraphPath path) {
    return ERASURE.apply(graph, path);
  }

  public static Set<GraphPath> findDeiterationSites(Graph graph) {
    return DEITERATION.findSites(graph);
  }

  public static Graph applyDeiteration(Graph graph, GraphPath path) {
    return DEITERATION.apply(graph, path);
  }

  public static InferenceRule rule(RuleKind kind) {
    Objects.requireNonNull(kind, "kind");
    return switch (kind) {
      case DOUBLE_CUT -> DOUBLE_CUT;
      case ERASURE -> ERASURE;
      case DEITERATION -> DEITERATION;
    };
  }
}
