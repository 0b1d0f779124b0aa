package se.alipsa.stpls.core.model;

public class Position {
  public final int line;   // zero-based line number
  public final int column; // zero-based column offset

  public Position(int line, int column) {
    this.line = line;
    this.column = column;
  }

  /** True if this position comes before {@code other} in document order. */
  public boolean isBefore(Position other) {
    return line < other.line || (line == other.line && column < other.column);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Position that)) return false;
    return line == that.line && column == that.column;
  }

  @Override
  public int hashCode() {
    return 31 * line + column;
  }

  @Override
  public String toString() {
    return line + ":" + column;
  }
}
