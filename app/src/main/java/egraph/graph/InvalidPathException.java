package egraph.graph;

/**
 * Raised when a path does not address an element, or the addressed element does not satisfy the
 * precondition of the requested rule.
 */
public class InvalidPathException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final transient GraphPath path;

  public InvalidPathException(GraphPath path, String reason) {
    super(path == null ? reason : "Invalid path " + path + ": " + reason);
    this.path = path;
  }

  /** The rejected path, or {@code null} when the failure was detected outside a path walk. */
  public GraphPath path() {
    return path;
  }
}
