package egraph.cli;

import egraph.graph.GraphPath;
import egraph.rules.RuleKind;
import java.util.Locale;
import java.util.Objects;

record CliOptions(
    Command command,
    String graphText,
    String graphFile,
    RuleKind rule,
    GraphPath path,
    String target,
    boolean json) {

  CliOptions {
    Objects.requireNonNull(command, "command");
  }

  boolean hasGraphFile() {
    return graphFile != null && !graphFile.isBlank();
  }

  static Builder builder(Command command) {
    return new Builder(command);
  }

  static final class Builder {
    private final Command command;
    private String graphText;
    private String graphFile;
    private RuleKind rule;
    private GraphPath path;
    private String target;
    private boolean json;

    private Builder(Command command) {
      this.command = Objects.requireNonNull(command, "command");
    }

    Builder graphText(String graphText) {
      this.graphText = graphText;
      return this;
    }

    Builder graphFile(String graphFile) {
      this.graphFile = graphFile;
      return this;
    }

    Builder rule(RuleKind rule) {
      this.rule = rule;
      return this;
    }

    Builder path(GraphPath path) {
      this.path = path;
      return this;
    }

    Builder target(String target) {
      this.target = target;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    CliOptions build() {
      int sources = 0;
      if (graphText != null && !graphText.isBlank()) sources++;
      if (graphFile != null && !graphFile.isBlank()) sources++;
      if (sources != 1) {
        throw new IllegalArgumentException("Provide exactly one of --graph or --file");
      }
      if ((command == Command.SITES || command == Command.APPLY) && rule == null) {
        throw new IllegalArgumentException("--rule is required for " + name());
      }
      if (command == Command.APPLY && (path == null || path.isEmpty())) {
        throw new IllegalArgumentException("--path is required for " + name());
      }
      if (command == Command.PATHS && (target == null || target.isBlank())) {
        throw new IllegalArgumentException("--target is required for " + name());
      }
      return new CliOptions(command, graphText, graphFile, rule, path, target, json);
    }

    private String name() {
      return command.name().toLowerCase(Locale.ROOT);
    }
  }
}
