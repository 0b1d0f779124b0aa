package se.alipsa.stpls.st.lex;

import java.util.Objects;

/** A half-open column range {@code [start, end)} of one line, classified by {@link SegmentKind}. */
public final class Segment {
  private final int start;
  private final int end;
  private final SegmentKind kind;
  private final boolean terminated;

  public Segment(int start, int end, SegmentKind kind, boolean terminated) {
    if (start < 0 || end < start) throw new IllegalArgumentException("Bad segment [" + start + "," + end + ")");
    this.start = start;
    this.end = end;
    this.kind = Objects.requireNonNull(kind);
    this.terminated = terminated;
  }

  public int getStart() { return start; }
  public int getEnd() { return end; }
  public SegmentKind getKind() { return kind; }

  public boolean isCode() { return kind.isCode(); }

  /** False for a string literal whose closing quote is missing, or a block comment running past the line. */
  public boolean isTerminated() { return terminated; }

  public boolean contains(int column) {
    return column >= start && column < end;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Segment that)) return false;
    return start == that.start && end == that.end && kind == that.kind && terminated == that.terminated;
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, end, kind, terminated);
  }

  @Override
  public String toString() {
    return kind + "[" + start + "," + end + ")" + (terminated ? "" : "!");
  }
}
