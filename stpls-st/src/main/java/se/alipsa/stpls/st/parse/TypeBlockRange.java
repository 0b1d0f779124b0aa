package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Position;

/** One TYPE ... END_TYPE block. */
public final class TypeBlockRange {
  private final int startLine;
  private final int endLine;
  private final Position innerStart;
  private final Position innerEnd;
  private final boolean closed;

  public TypeBlockRange(int startLine, int endLine, Position innerStart, Position innerEnd, boolean closed) {
    this.startLine = startLine;
    this.endLine = endLine;
    this.innerStart = innerStart;
    this.innerEnd = innerEnd;
    this.closed = closed;
  }

  public int getStartLine() { return startLine; }
  public int getEndLine() { return endLine; }
  public Position getInnerStart() { return innerStart; }
  public Position getInnerEnd() { return innerEnd; }
  public boolean isClosed() { return closed; }

  public boolean containsLine(int line) {
    return line >= startLine && line <= endLine;
  }

  @Override
  public String toString() {
    return "TYPE [" + startLine + "," + endLine + "]";
  }
}
