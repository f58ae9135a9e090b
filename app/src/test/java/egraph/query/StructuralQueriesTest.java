package egraph.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.graph.NotationCodec;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class StructuralQueriesTest {

  private static final Graph SAMPLE = NotationCodec.parse("(a, [a, b], [[a]])");

  @Test
  void containsAtomAtAnyDepth() {
    assertTrue(StructuralQueries.contains(SAMPLE, "a"));
    assertTrue(StructuralQueries.contains(SAMPLE, "b"), "b sits inside a cut");
    assertFalse(StructuralQueries.contains(SAMPLE, "z"));
  }

  @Test
  void containsSubGraphIgnoringSiblingOrder() {
    assertTrue(StructuralQueries.contains(SAMPLE, NotationCodec.parse("[a]")));
    assertTrue(StructuralQueries.contains(SAMPLE, NotationCodec.parse("[b, a]")));
    assertFalse(StructuralQueries.contains(SAMPLE, NotationCodec.parse("[b]")));
  }

  @Test
  void subGraphLookupUsesCanonicalOrder() {
    Graph raw = Graph.sheet(List.of(), List.of(Graph.cut(List.of("y", "x"), List.of())));

    assertTrue(StructuralQueries.contains(raw, Graph.cut(List.of("x", "y"), List.of())));
  }

  @Test
  void atomPathsUseCombinedIndices() {
    // Canonical SAMPLE: ([[a]], [a, b], a)
    Set<GraphPath> paths = StructuralQueries.findPaths(SAMPLE, "a");

    assertEquals(Set.of(GraphPath.of(2), GraphPath.of(1, 0)), paths);
  }

  @Test
  void soleAtomOfAnEnclosureIsNotReported() {
    assertEquals(Set.of(), StructuralQueries.findPaths(NotationCodec.parse("([[a]])"), "a"));
    assertEquals(Set.of(), StructuralQueries.findPaths(NotationCodec.parse("(a)"), "a"));
    assertEquals(
        Set.of(GraphPath.of(0, 1)),
        StructuralQueries.findPaths(NotationCodec.parse("([a, [a]])"), "a"),
        "[a] inside the cut is a singleton, the outer a is not");
  }

  @Test
  void subGraphPathsSkipSingletonEnclosures() {
    assertEquals(Set.of(), StructuralQueries.findPaths(SAMPLE, NotationCodec.parse("[a]")));
  }

  @Test
  void subGraphPathsReportEveryOccurrence() {
    // Canonical form: ([[a], b], [a])
    Graph graph = NotationCodec.parse("([a], [b, [a]])");

    Set<GraphPath> paths = StructuralQueries.findPaths(graph, NotationCodec.parse("[a]"));

    assertEquals(Set.of(GraphPath.of(0, 0), GraphPath.of(1)), paths);
    assertEquals(List.of(GraphPath.of(0, 0), GraphPath.of(1)), List.copyOf(paths), "Depth first");
  }

  @Test
  void resultsAreUnmodifiable() {
    Set<GraphPath> paths = StructuralQueries.findPaths(SAMPLE, "a");

    assertThrows(UnsupportedOperationException.class, () -> paths.add(GraphPath.of(9)));
  }
}
