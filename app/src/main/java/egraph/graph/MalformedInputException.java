package egraph.graph;

/** Raised when notation text is not a well-formed, bracket-balanced graph. */
public class MalformedInputException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String input;

  public MalformedInputException(String input, String reason) {
    super(reason + ": " + input);
    this.input = input;
  }

  public String input() {
    return input;
  }
}
