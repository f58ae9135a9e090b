package egraph.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Converts between the bracket notation and {@link Graph} trees.
 *
 * <pre>
 * graph   := "(" content ")"
 * cut     := "[" content "]"
 * content := "" | element ("," element)*
 * element := atom | cut
 * </pre>
 *
 * <p>{@code (...)} frames the sheet of assertion and {@code [...]} a cut. Commas only separate
 * elements at the current bracket depth.
 */
public final class NotationCodec {
  private static final String SEPARATOR = ", ";

  private NotationCodec() {}

  /** Parses notation into a canonical graph. */
  public static Graph parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    checkBalanced(trimmed, text);
    return GraphCanonicalizer.canonicalize(parseEnclosure(trimmed, text));
  }

  /** Emits the notation of {@code graph} in its current storage order. */
  public static String serialize(Graph graph) {
    Objects.requireNonNull(graph, "graph");
    StringBuilder sb = new StringBuilder();
    appendTo(sb, graph);
    return sb.toString();
  }

  private static void appendTo(StringBuilder sb, Graph graph) {
    sb.append(graph.root() ? '(' : '[');
    boolean first = true;
    for (Graph child : graph.children()) {
      if (!first) {
        sb.append(SEPARATOR);
      }
      appendTo(sb, child);
      first = false;
    }
    for (String atom : graph.atoms()) {
      if (!first) {
        sb.append(SEPARATOR);
      }
      sb.append(atom);
      first = false;
    }
    sb.append(graph.root() ? ')' : ']');
  }

  private static Graph parseEnclosure(String fragment, String original) {
    if (fragment.length() < 2) {
      throw new MalformedInputException(original, "Expected an enclosure, found '" + fragment + "'");
    }
    char open = fragment.charAt(0);
    char close = fragment.charAt(fragment.length() - 1);
    boolean root;
    if (open == '(' && close == ')') {
      root = true;
    } else if (open == '[' && close == ']') {
      root = false;
    } else {
      throw new MalformedInputException(
          original, "Enclosure must be framed by () or [], found '" + fragment + "'");
    }

    List<String> atoms = new ArrayList<>();
    List<Graph> children = new ArrayList<>();
    String content = fragment.substring(1, fragment.length() - 1).trim();
    if (content.isEmpty()) {
      return new Graph(root, atoms, children);
    }
    for (String element : splitTopLevel(content)) {
      if (element.isEmpty()) {
        throw new MalformedInputException(original, "Empty element in '" + fragment + "'");
      }
      if (element.charAt(0) == '[') {
        children.add(parseEnclosure(element, original));
      } else if (element.indexOf('[') >= 0 || element.indexOf(']') >= 0) {
        throw new MalformedInputException(original, "Stray bracket in atom '" + element + "'");
      } else {
        atoms.add(element);
      }
    }
    return new Graph(root, atoms, children);
  }

  /** Splits at commas outside any nested cut; each fragment is trimmed. */
  static List<String> splitTopLevel(String content) {
    List<String> elements = new ArrayList<>();
    int depth = 0;
    int start = 0;
    for (int i = 0; i < content.length(); i++) {
      char c = content.charAt(i);
      if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth--;
      } else if (depth == 0 && c == ',') {
        elements.add(content.substring(start, i).trim());
        start = i + 1;
      }
    }
    elements.add(content.substring(start).trim());
    return elements;
  }

  /**
   * Verifies that the outer pair encloses the whole text, that brackets nest properly and that
   * parentheses only frame the sheet.
   */
  private static void checkBalanced(String text, String original) {
    if (text.isEmpty()) {
      throw new MalformedInputException(original, "Empty input");
    }
    char open = text.charAt(0);
    if (open != '(' && open != '[') {
      throw new MalformedInputException(original, "Input must start with '(' or '['");
    }
    Deque<Character> stack = new ArrayDeque<>();
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c == '(' || c == '[') {
        if (c == '(' && i > 0) {
          throw new MalformedInputException(original, "Sheet of assertion cannot be nested");
        }
        stack.push(c);
      } else if (c == ')' || c == ']') {
        if (stack.isEmpty()) {
          throw new MalformedInputException(original, "Unbalanced '" + c + "' at " + i);
        }
        char expected = stack.pop() == '(' ? ')' : ']';
        if (c != expected) {
          throw new MalformedInputException(
              original, "Expected '" + expected + "' but found '" + c + "' at " + i);
        }
        if (stack.isEmpty() && i != text.length() - 1) {
          throw new MalformedInputException(
              original, "Content after the closing delimiter at " + i);
        }
      }
    }
    if (!stack.isEmpty()) {
      throw new MalformedInputException(original, "Unclosed '" + stack.peek() + "'");
    }
  }
}
