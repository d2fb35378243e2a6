package com.gentoro.kerai.suggest;

import com.gentoro.kerai.normalize.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Removes advisory marker lines from normalized text before it is parsed, remembering for each
 * marker the line (in the stripped text) of the code it annotated. When dropping a marker would
 * leave two blank lines in a row, one of them goes too.
 *
 * <p>A line is only a marker when it is a line comment standing alone on its line and its rule id
 * has an outstanding suggestion in the file. Anything else with the same shape, inside a string
 * literal or written by hand, is ordinary text and stays.
 */
public final class MarkerStripper {

  /** A marker and the stripped-text line number of the first line after it. */
  public record Hit(String ruleId, int annotatedLine) {}

  public record Stripped(String text, List<Hit> hits) {}

  private MarkerStripper() {}

  /**
   * @param commentLines 1-based lines whose first non-blank characters open a line comment
   * @param ruleIds rules with an emitted suggestion for this file
   */
  public static Stripped strip(String normalized, Set<Integer> commentLines, Set<String> ruleIds) {
    if (ruleIds.isEmpty()) return new Stripped(normalized, List.of());
    List<String> in = TextNormalizer.lines(normalized);
    List<String> out = new ArrayList<>(in.size());
    List<String> pendingRules = new ArrayList<>();
    List<Hit> hits = new ArrayList<>();
    boolean droppedAny = false;

    for (int i = 0; i < in.size(); i++) {
      String line = in.get(i);
      Optional<AdvisoryMarker> marker =
          commentLines.contains(i + 1) ? AdvisoryMarker.parse(line) : Optional.empty();
      if (marker.isPresent() && ruleIds.contains(marker.get().ruleId())) {
        pendingRules.add(marker.get().ruleId());
        droppedAny = true;
        continue;
      }
      boolean blankAfterBlank =
          line.isEmpty() && !out.isEmpty() && out.get(out.size() - 1).isEmpty();
      if (blankAfterBlank || (line.isEmpty() && out.isEmpty())) continue;
      out.add(line);
      if (!line.isEmpty() && !pendingRules.isEmpty()) {
        for (String rule : pendingRules) hits.add(new Hit(rule, out.size()));
        pendingRules.clear();
      }
    }
    if (!droppedAny) return new Stripped(normalized, List.of());
    while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) out.remove(out.size() - 1);
    return new Stripped(TextNormalizer.join(out), hits);
  }
}
