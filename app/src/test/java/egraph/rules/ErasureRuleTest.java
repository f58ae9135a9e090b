package egraph.rules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.graph.InvalidPathException;
import egraph.graph.NotationCodec;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class ErasureRuleTest {
  private final ErasureRule rule = new ErasureRule();

  // Canonical form: ([[c, d], b], a)
  private static final Graph SAMPLE = NotationCodec.parse("(a, [b, [c, d]])");

  @Test
  void offersOnlyEvenlyEnclosedElements() {
    assertEquals(
        List.of(GraphPath.of(0), GraphPath.of(0, 0, 0), GraphPath.of(0, 0, 1), GraphPath.of(1)),
        List.copyOf(rule.findSites(SAMPLE)));
  }

  @Test
  void erasesAtomInPositiveContext() {
    assertEquals(NotationCodec.parse("(a, [b, [c]])"), rule.apply(SAMPLE, GraphPath.of(0, 0, 1)));
    assertEquals(NotationCodec.parse("([b, [c, d]])"), rule.apply(SAMPLE, GraphPath.of(1)));
  }

  @Test
  void erasesWholeCut() {
    assertEquals(NotationCodec.parse("(a)"), rule.apply(SAMPLE, GraphPath.of(0)));
  }

  @Test
  void refusesNegativeContext() {
    assertThrows(InvalidPathException.class, () -> rule.apply(SAMPLE, GraphPath.of(0, 1)));
    assertThrows(InvalidPathException.class, () -> rule.apply(SAMPLE, GraphPath.of(0, 0)));
  }

  @Test
  void singletonCutContentIsNotOffered() {
    assertEquals(Set.of(GraphPath.of(0)), rule.findSites(NotationCodec.parse("([[x]])")));
    assertEquals(
        Set.of(GraphPath.of(0), GraphPath.of(0, 0, 0), GraphPath.of(0, 0, 1)),
        rule.findSites(NotationCodec.parse("([[x, y]])")));
  }

  @Test
  void soleElementOfSheetIsOffered() {
    Graph graph = NotationCodec.parse("(a)");

    assertEquals(Set.of(GraphPath.of(0)), rule.findSites(graph));
    assertEquals("()", rule.apply(graph, GraphPath.of(0)).toString());
  }

  @Test
  void startingDepthShiftsParity() {
    Graph graph = NotationCodec.parse("([a, b], c)");

    assertEquals(Set.of(GraphPath.of(0, 0), GraphPath.of(0, 1)), rule.findSites(graph, 1));
    assertThrows(IllegalArgumentException.class, () -> rule.findSites(graph, -1));
  }

  @Test
  void eachErasureRemovesExactlyOneElement() {
    Graph graph = NotationCodec.parse("(a, b, [c], [[d], e])");

    for (GraphPath site : rule.findSites(graph)) {
      if (site.depth() != 1) {
        continue;
      }
      Graph result = rule.apply(graph, site);
      assertEquals(graph.size() - 1, result.size(), "Erasing " + site);
    }
  }

  @Test
  void rejectsStructurallyInvalidPaths() {
    assertThrows(InvalidPathException.class, () -> rule.apply(SAMPLE, GraphPath.of(2)));
    assertThrows(InvalidPathException.class, () -> rule.apply(SAMPLE, GraphPath.of(1, 0)));
  }
}
