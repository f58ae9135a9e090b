package egraph.rules;

import java.util.Locale;

/** The rules of inference supported by the reasoner. */
public enum RuleKind {
  DOUBLE_CUT("double-cut"),
  ERASURE("erasure"),
  DEITERATION("deiteration");

  private final String displayName;

  RuleKind(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  public static RuleKind parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing rule name");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "dc", "double-cut", "doublecut", "double_cut" -> DOUBLE_CUT;
      case "erase", "erasure" -> ERASURE;
      case "deit", "deiterate", "deiteration" -> DEITERATION;
      default -> throw new IllegalArgumentException("Invalid rule: " + raw);
    };
  }
}
