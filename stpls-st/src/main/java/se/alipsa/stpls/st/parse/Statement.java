package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;

/**
 * Text of one {@code ;}-terminated statement, possibly gathered from several physical lines.
 * Comments are blanked, line breaks become spaces, and every character keeps a pointer back to
 * its source position.
 */
public final class Statement {
  private final String text;
  private final int[] lines;
  private final int[] columns;
  private final String marker;   // breaker keyword, null for ordinary statements

  Statement(String text, int[] lines, int[] columns, String marker) {
    this.text = text;
    this.lines = lines;
    this.columns = columns;
    this.marker = marker;
  }

  public String getText() { return text; }

  /** The breaker keyword this statement stands for, e.g. {@code STRUCT}; null for ordinary text. */
  public String getMarker() { return marker; }

  public boolean isMarker() { return marker != null; }

  public boolean isBlank() { return marker == null && text.isBlank(); }

  public Position positionOf(int offset) {
    if (text.isEmpty()) throw new IllegalStateException("Empty statement has no positions");
    int i = Math.max(0, Math.min(offset, text.length() - 1));
    int col = columns[i] + (offset > i ? offset - i : 0);
    return new Position(lines[i], col);
  }

  /** Range of {@code length} characters from {@code offset}; assumes they sit on one line. */
  public Range rangeOf(int offset, int length) {
    Position start = positionOf(offset);
    return new Range(start, new Position(start.line, start.column + length));
  }

  @Override
  public String toString() {
    return marker != null ? "<" + marker + ">" : text.strip();
  }
}
