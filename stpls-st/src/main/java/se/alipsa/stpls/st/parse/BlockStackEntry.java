package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;

import java.util.Objects;

/** An open block waiting for its closer. */
public final class BlockStackEntry {
  private final String keyword;
  private final BlockKind kind;
  private final String expectedCloser;
  private final Position position;

  public BlockStackEntry(String keyword, BlockKind kind, String expectedCloser, Position position) {
    this.keyword = Objects.requireNonNull(keyword);
    this.kind = Objects.requireNonNull(kind);
    this.expectedCloser = Objects.requireNonNull(expectedCloser);
    this.position = Objects.requireNonNull(position);
  }

  public String getKeyword() { return keyword; }
  public BlockKind getKind() { return kind; }
  public String getExpectedCloser() { return expectedCloser; }
  public Position getPosition() { return position; }

  public Range keywordRange() {
    return Range.of(position.line, position.column, keyword.length());
  }

  @Override
  public String toString() {
    return keyword + "@" + position + " -> " + expectedCloser;
  }
}
