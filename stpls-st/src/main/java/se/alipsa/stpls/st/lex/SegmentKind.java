package se.alipsa.stpls.st.lex;

public enum SegmentKind {
  CODE,
  LINE_COMMENT,
  BLOCK_COMMENT,
  PRAGMA,
  STRING;

  public boolean isCode() {
    return this == CODE;
  }

  public boolean isComment() {
    return this == LINE_COMMENT || this == BLOCK_COMMENT;
  }
}
