package egraph.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.rules.RuleKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Renders site and path listings as JSON. */
final class JsonReportBuilder {
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String sites(Graph graph, RuleKind rule, Set<GraphPath> sites) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("graph", graph.toString());
    root.put("rule", rule.displayName());
    root.put("count", sites.size());
    root.put("sites", entries(graph, sites));
    return gson.toJson(root);
  }

  String paths(Graph graph, String target, Set<GraphPath> paths) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("graph", graph.toString());
    root.put("target", target);
    root.put("count", paths.size());
    root.put("sites", entries(graph, paths));
    return gson.toJson(root);
  }

  private List<Map<String, Object>> entries(Graph graph, Set<GraphPath> paths) {
    List<Map<String, Object>> list = new ArrayList<>(paths.size());
    for (GraphPath path : paths) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("path", new ArrayList<>(path.steps()));
      entry.put("element", graph.at(path).toString());
      list.add(entry);
    }
    return list;
  }
}
