package egraph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.graph.MalformedInputException;
import egraph.rules.RuleKind;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ReasonerTest {

  @Test
  void parseFindAndCollapseDoubleCut() {
    Graph graph = Reasoner.parse("(a, [b], [[c]])");

    Set<GraphPath> sites = Reasoner.findDoubleCuts(graph);
    assertEquals(Set.of(GraphPath.of(0)), sites);
    assertEquals("[[c]]", graph.at(GraphPath.of(0)).toString());

    Graph result = Reasoner.applyDoubleCut(graph, GraphPath.of(0));
    assertEquals(Reasoner.parse("(a, [b], c)"), result);
    assertEquals("([b], a, c)", Reasoner.serialize(result));
  }

  @Test
  void chainsRulesOnReturnedGraphs() {
    Graph graph = Reasoner.parse("(p, [[q]], [p, r])");

    Graph collapsed = Reasoner.applyDoubleCut(graph, GraphPath.of(0));
    assertEquals(Reasoner.parse("(p, q, [p, r])"), collapsed);

    GraphPath copy = Reasoner.findDeiterationSites(collapsed).iterator().next();
    Graph deiterated = Reasoner.applyDeiteration(collapsed, copy);
    assertEquals(Reasoner.parse("(p, q, [r])"), deiterated);

    Graph erased = Reasoner.applyErasure(deiterated, GraphPath.of(2));
    assertEquals(Reasoner.parse("(p, [r])"), erased);
  }

  @Test
  void canonicalizeIsIdempotent() {
    Graph graph = Reasoner.parse("([z, [y, x]], b, a)");

    Graph once = Reasoner.canonicalize(graph);
    assertEquals(once, Reasoner.canonicalize(once));
    assertEquals(graph, Reasoner.canonicalize(graph), "Parsing already yields canonical form");
  }

  @Test
  void queriesDelegate() {
    Graph graph = Reasoner.parse("(a, [b, c])");

    assertTrue(Reasoner.contains(graph, "c"));
    assertTrue(Reasoner.contains(graph, Reasoner.parse("[c, b]")));
    assertEquals(Set.of(GraphPath.of(0, 0)), Reasoner.findPaths(graph, "b"));
    assertEquals(Set.of(GraphPath.of(0)), Reasoner.findPaths(graph, Reasoner.parse("[b, c]")));
    assertEquals(
        Set.of(GraphPath.of(0, 0), GraphPath.of(0, 1)), Reasoner.findErasureSites(graph, 1));
  }

  @Test
  void ruleLookupMatchesKind() {
    for (RuleKind kind : RuleKind.values()) {
      assertEquals(kind, Reasoner.rule(kind).kind());
      assertSame(Reasoner.rule(kind), Reasoner.rule(kind));
    }
  }

  @Test
  void malformedInputPropagates() {
    assertThrows(MalformedInputException.class, () -> Reasoner.parse("a, b"));
  }
}
