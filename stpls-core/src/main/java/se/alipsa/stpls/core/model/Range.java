package se.alipsa.stpls.core.model;

import java.util.Objects;

public class Range {
  public final Position start;
  public final Position end;

  public Range(Position start, Position end) {
    this.start = Objects.requireNonNull(start, "start");
    this.end = Objects.requireNonNull(end, "end");
  }

  /** Single-line range covering {@code length} characters from {@code column}. */
  public static Range of(int line, int column, int length) {
    return new Range(new Position(line, column), new Position(line, column + length));
  }

  /** Inclusive start, exclusive end. */
  public boolean contains(Position p) {
    return !p.isBefore(start) && p.isBefore(end);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Range that)) return false;
    return start.equals(that.start) && end.equals(that.end);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end);
  }

  @Override
  public String toString() {
    return "[" + start + "-" + end + "]";
  }
}
