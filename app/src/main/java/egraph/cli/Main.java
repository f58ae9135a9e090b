package egraph.cli;

import egraph.Reasoner;
import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.graph.InvalidPathException;
import egraph.graph.MalformedInputException;
import egraph.graph.NotationCodec;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line driver.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code canonical --graph "(b, a)"} prints the canonical notation
 *   <li>{@code sites --rule erasure --graph "(a, [b])"} lists the legal sites
 *   <li>{@code apply --rule dc --path 0 --graph "([[c]])"} prints the rewritten graph
 *   <li>{@code paths --target b --file graph.eg} locates an atom or a cut
 * </ul>
 *
 * <p>Add {@code --json} to {@code sites} and {@code paths} for a JSON report.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_IO = 1;
  static final int EXIT_USAGE = 2;

  private final PrintStream out;
  private final JsonReportBuilder reports = new JsonReportBuilder();

  Main(PrintStream out) {
    this.out = out;
  }

  public static void main(String[] args) {
    int exit = new Main(System.out).execute(args);
    if (exit != EXIT_OK) {
      System.exit(exit);
    }
  }

  int execute(String[] args) {
    CliOptions options;
    try {
      options = CliParsers.parse(args);
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      LOG.info(
          "Commands: canonical | sites --rule <r> | apply --rule <r> --path <i,j>"
              + " | paths --target <t>");
      return EXIT_USAGE;
    }

    try {
      Graph graph = CliParsers.loadGraph(options);
      run(options, graph);
      return EXIT_OK;
    } catch (MalformedInputException ex) {
      LOG.error("Malformed graph: {}", ex.getMessage());
      return EXIT_USAGE;
    } catch (InvalidPathException ex) {
      LOG.error("Rejected path: {}", ex.getMessage());
      return EXIT_USAGE;
    } catch (IOException ex) {
      LOG.error("Unable to read graph file {}", options.graphFile(), ex);
      return EXIT_IO;
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      return EXIT_USAGE;
    }
  }

  private void run(CliOptions options, Graph graph) {
    switch (options.command()) {
      case CANONICAL -> out.println(graph);
      case SITES -> printSites(options, graph);
      case APPLY -> {
        Graph result = Reasoner.rule(options.rule()).apply(graph, options.path());
        LOG.info("Applied {} at {}", options.rule().displayName(), options.path());
        out.println(result);
      }
      case PATHS -> printPaths(options, graph);
    }
  }

  private void printSites(CliOptions options, Graph graph) {
    Set<GraphPath> sites = Reasoner.rule(options.rule()).findSites(graph);
    LOG.info("{} {} site(s) in {}", sites.size(), options.rule().displayName(), graph);
    if (options.json()) {
      out.println(reports.sites(graph, options.rule(), sites));
      return;
    }
    for (GraphPath site : sites) {
      out.println(site + "\t" + graph.at(site));
    }
  }

  private void printPaths(CliOptions options, Graph graph) {
    String target = options.target().trim();
    Set<GraphPath> paths =
        target.startsWith("[")
            ? Reasoner.findPaths(graph, NotationCodec.parse(target))
            : Reasoner.findPaths(graph, target);
    LOG.info("{} occurrence(s) of {} in {}", paths.size(), target, graph);
    if (options.json()) {
      out.println(reports.paths(graph, target, paths));
      return;
    }
    for (GraphPath path : paths) {
      out.println(path);
    }
  }
}
