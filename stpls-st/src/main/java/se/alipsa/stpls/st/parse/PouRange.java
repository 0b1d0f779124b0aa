package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.SymbolKind;

import java.util.Objects;

/**
 * Line span of a PROGRAM, FUNCTION or FUNCTION_BLOCK, from the opener line to the closer line.
 * An unclosed POU runs to the last line of the document.
 */
public final class PouRange {
  private final String name;          // null when the opener has no name
  private final SymbolKind kind;
  private final Position keywordPosition;
  private final Position namePosition;
  private final String returnType;
  private final int startLine;
  private final int endLine;
  private final boolean closed;

  public PouRange(String name, SymbolKind kind, Position keywordPosition, Position namePosition,
                  String returnType, int startLine, int endLine, boolean closed) {
    this.name = name;
    this.kind = Objects.requireNonNull(kind);
    this.keywordPosition = Objects.requireNonNull(keywordPosition);
    this.namePosition = namePosition;
    this.returnType = returnType;
    this.startLine = startLine;
    this.endLine = endLine;
    this.closed = closed;
  }

  public String getName() { return name; }
  public boolean hasName() { return name != null; }
  public SymbolKind getKind() { return kind; }
  public Position getKeywordPosition() { return keywordPosition; }
  public Position getNamePosition() { return namePosition; }
  public String getReturnType() { return returnType; }
  public int getStartLine() { return startLine; }
  public int getEndLine() { return endLine; }
  public boolean isClosed() { return closed; }

  public boolean containsLine(int line) {
    return line >= startLine && line <= endLine;
  }

  /** True for lines strictly between the opener and the closer. */
  public boolean isInterior(int line) {
    return line > startLine && (closed ? line < endLine : line <= endLine);
  }

  @Override
  public String toString() {
    return kind + " " + name + " [" + startLine + "," + endLine + "]" + (closed ? "" : " (unclosed)");
  }
}
