package egraph.graph;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Sequence of combined indices addressing one element inside a graph. */
public record GraphPath(List<Integer> steps) {
  private static final Splitter STEP_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  public GraphPath {
    Objects.requireNonNull(steps, "steps");
    steps = List.copyOf(steps);
  }

  public static GraphPath of(int... steps) {
    List<Integer> list = new ArrayList<>(steps.length);
    for (int step : steps) {
      list.add(step);
    }
    return new GraphPath(list);
  }

  /** Parses {@code "0, 2"} or {@code "[0, 2]"}. */
  public static GraphPath parse(String raw) {
    Objects.requireNonNull(raw, "raw");
    String trimmed = raw.trim();
    if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    List<Integer> steps = new ArrayList<>();
    for (String part : STEP_SPLITTER.split(trimmed)) {
      try {
        steps.add(Integer.parseInt(part));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid path step '" + part + "' in: " + raw, ex);
      }
    }
    return new GraphPath(steps);
  }

  public boolean isEmpty() {
    return steps.isEmpty();
  }

  public int depth() {
    return steps.size();
  }

  public int first() {
    return steps.get(0);
  }

  public int last() {
    return steps.get(steps.size() - 1);
  }

  /** Path with {@code step} in front, as a parent prefixes its own index onto a child's result. */
  public GraphPath prepend(int step) {
    List<Integer> prefixed = new ArrayList<>(steps.size() + 1);
    prefixed.add(step);
    prefixed.addAll(steps);
    return new GraphPath(prefixed);
  }

  /** Steps leading to the enclosure that holds the addressed element. */
  public GraphPath parent() {
    if (steps.isEmpty()) {
      throw new IllegalStateException("Empty path has no parent");
    }
    return new GraphPath(steps.subList(0, steps.size() - 1));
  }

  public GraphPath tail() {
    if (steps.isEmpty()) {
      throw new IllegalStateException("Empty path has no tail");
    }
    return new GraphPath(steps.subList(1, steps.size()));
  }

  @Override
  public String toString() {
    return steps.toString();
  }
}
