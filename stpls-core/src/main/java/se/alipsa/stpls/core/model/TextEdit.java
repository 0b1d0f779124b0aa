package se.alipsa.stpls.core.model;

import java.util.Objects;

public final class TextEdit {
  private final Range range;
  private final String newText;
  public TextEdit(Range range, String newText) {
    this.range = Objects.requireNonNull(range, "range");
    this.newText = Objects.requireNonNull(newText, "newText");
  }
  public Range getRange() { return range; }
  public String getNewText() { return newText; }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TextEdit that)) return false;
    return range.equals(that.range) && newText.equals(that.newText);
  }

  @Override
  public int hashCode() { return Objects.hash(range, newText); }

  @Override
  public String toString() { return range + " -> '" + newText + "'"; }
}
