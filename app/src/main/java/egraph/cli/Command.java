package egraph.cli;

import java.util.Locale;

/** Sub-commands understood by {@link Main}. */
enum Command {
  CANONICAL,
  SITES,
  APPLY,
  PATHS;

  static Command parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Missing command");
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "canonical", "canon", "normalize" -> CANONICAL;
      case "sites", "find" -> SITES;
      case "apply" -> APPLY;
      case "paths", "locate" -> PATHS;
      default -> throw new IllegalArgumentException("Unknown command: " + raw);
    };
  }
}
