package se.alipsa.stpls.st.lex;

import java.util.List;

/** Segments of one line plus whether a block comment is still open at its end. */
public final class LineSegments {
  private final List<Segment> segments;
  private final boolean inBlockComment;

  public LineSegments(List<Segment> segments, boolean inBlockComment) {
    this.segments = List.copyOf(segments);
    this.inBlockComment = inBlockComment;
  }

  public List<Segment> getSegments() { return segments; }

  public boolean isInBlockComment() { return inBlockComment; }
}
