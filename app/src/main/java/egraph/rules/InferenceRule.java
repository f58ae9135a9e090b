package egraph.rules;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import java.util.Set;

/** One structural rule of inference: enumerate the legal sites, then rewrite at one of them. */
public interface InferenceRule {

  RuleKind kind();

  /** Every path at which the rule may be applied to {@code graph}, in depth-first order. */
  Set<GraphPath> findSites(Graph graph);

  /**
   * Applies the rule at {@code path} and returns the new canonical graph. {@code graph} is left
   * untouched.
   *
   * @throws egraph.graph.InvalidPathException if {@code path} is not one of {@link
   *     #findSites(Graph)}
   */
  Graph apply(Graph graph, GraphPath path);
}
