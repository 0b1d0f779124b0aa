package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Range;

/** A block that was closed without being opened, or opened and never closed. */
public final class StructureIssue {
  private final Range range;
  private final String message;

  public StructureIssue(Range range, String message) {
    this.range = range;
    this.message = message;
  }

  public Range getRange() { return range; }
  public String getMessage() { return message; }

  @Override
  public String toString() { return message + " " + range; }
}
