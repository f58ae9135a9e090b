package egraph.cli;

import egraph.graph.Graph;
import egraph.graph.GraphPath;
import egraph.graph.NotationCodec;
import egraph.rules.RuleKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Argument parsing and graph loading for the command line. */
final class CliParsers {
  private CliParsers() {}

  static CliOptions parse(String[] args) {
    if (args == null || args.length == 0) {
      throw new IllegalArgumentException("Missing command");
    }
    CliOptions.Builder builder = CliOptions.builder(Command.parse(args[0]));
    String[] optionArgs = Arrays.copyOfRange(args, 1, args.length);
    Map<String, OptionSpec> specs = optionSpecs();

    for (int i = 0; i < optionArgs.length; i++) {
      ParsedArg parsed = ParsedArg.parse(optionArgs[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + optionArgs[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        value = nextValue(optionArgs, ++i, parsed.option());
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  static String nextValue(String[] args, int index, String option) {
    if (index >= args.length) {
      throw new IllegalArgumentException("Missing value for " + option);
    }
    return args[index];
  }

  static Graph loadGraph(CliOptions options) throws IOException {
    if (options.hasGraphFile()) {
      return loadGraphFromFile(options.graphFile());
    }
    return NotationCodec.parse(options.graphText());
  }

  static Graph loadGraphFromFile(String graphFile) throws IOException {
    Path path = Path.of(graphFile);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Graph file not found: " + path);
    }
    return NotationCodec.parse(Files.readString(path, StandardCharsets.UTF_8));
  }

  private static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--graph", OptionSpec.withValue(CliOptions.Builder::graphText));
    specs.put("--file", OptionSpec.withValue(CliOptions.Builder::graphFile));
    specs.put("--rule", OptionSpec.withValue((b, raw) -> b.rule(RuleKind.parse(raw))));
    specs.put(
        "--path", OptionSpec.withValue((b, raw) -> b.path(GraphPath.parse(raw))));
    specs.put("--target", OptionSpec.withValue(CliOptions.Builder::target));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    return specs;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
