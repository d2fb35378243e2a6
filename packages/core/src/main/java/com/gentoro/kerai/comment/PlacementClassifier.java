package com.gentoro.kerai.comment;

import com.gentoro.kerai.graph.Placement;
import java.util.List;

/**
 * Classifies a standalone comment group against the structural units of its region.
 *
 * <p>{@code above}: the next unit follows without a blank line. {@code between}: a blank line
 * separates it from the next unit and a previous unit exists. {@code eof}: nothing follows. A
 * group separated by a blank line from the next unit with nothing before it is ambiguous and falls
 * back to {@code eof}.
 */
public class PlacementClassifier {

  /** A structural neighbor, reduced to what classification looks at. */
  public record Span(String nodeId, int startLine, int endLine) {}

  public record Classification(Placement placement, String targetId, boolean ambiguous) {}

  /** Blank-line counter over the region's text. */
  @FunctionalInterface
  public interface BlankLines {
    int between(int afterLine, int beforeLine);
  }

  /**
   * @param units structural units of the region, ordered by start line
   */
  public Classification classify(
      CommentGroup group, List<Span> units, BlankLines blanks) {
    Span previous = null;
    Span next = null;
    for (Span u : units) {
      if (u.endLine() < group.startLine()) previous = u;
      if (u.startLine() > group.endLine()) {
        next = u;
        break;
      }
    }
    if (next == null) {
      return new Classification(Placement.EOF, null, false);
    }
    if (blanks.between(group.endLine(), next.startLine()) == 0) {
      return new Classification(Placement.ABOVE, next.nodeId(), false);
    }
    if (previous != null) {
      return new Classification(Placement.BETWEEN, next.nodeId(), false);
    }
    return new Classification(Placement.EOF, null, true);
  }
}
