package com.gentoro.kerai.suggest;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The advisory line emitted above a node with a pending suggestion:
 * {@code <indent>// kerai: <message> (<rule_id>)}. The trailing rule id is what re-associates the
 * line with its suggestion on the next parse.
 */
public record AdvisoryMarker(String ruleId, String message) {
  private static final String PREFIX = "// kerai: ";
  private static final Pattern LINE =
      Pattern.compile("^\\s*// kerai: (.*) \\(([A-Za-z0-9_.-]+)\\)$");

  public String render(String indent) {
    return indent + PREFIX + message + " (" + ruleId + ")";
  }

  public static Optional<AdvisoryMarker> parse(String line) {
    if (line == null || !line.contains(PREFIX)) return Optional.empty();
    Matcher m = LINE.matcher(line);
    return m.matches() ? Optional.of(new AdvisoryMarker(m.group(2), m.group(1))) : Optional.empty();
  }

  public static boolean isMarker(String line) {
    return parse(line).isPresent();
  }
}
