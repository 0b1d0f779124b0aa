package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Scope;

import java.util.Locale;
import java.util.Set;

/** One VAR_xxx ... END_VAR block. The inner span excludes the opener, its qualifiers and END_VAR. */
public final class VarSectionRange {
  private final String keyword;
  private final Set<String> qualifiers;
  private final String owner;        // enclosing POU name, null at file level
  private final String member;       // enclosing METHOD, PROPERTY or ACTION, null when none
  private final int startLine;
  private final int endLine;
  private final Position innerStart;
  private final Position innerEnd;
  private final boolean closed;

  public VarSectionRange(String keyword, Set<String> qualifiers, String owner, String member,
                         int startLine, int endLine, Position innerStart, Position innerEnd, boolean closed) {
    this.keyword = keyword;
    this.qualifiers = Set.copyOf(qualifiers);
    this.owner = owner;
    this.member = member;
    this.startLine = startLine;
    this.endLine = endLine;
    this.innerStart = innerStart;
    this.innerEnd = innerEnd;
    this.closed = closed;
  }

  public String getKeyword() { return keyword; }
  public Set<String> getQualifiers() { return qualifiers; }
  public String getOwner() { return owner; }
  public String getMember() { return member; }
  public int getStartLine() { return startLine; }
  public int getEndLine() { return endLine; }
  public Position getInnerStart() { return innerStart; }
  public Position getInnerEnd() { return innerEnd; }
  public boolean isClosed() { return closed; }

  public boolean isConstant() {
    return qualifiers.contains("CONSTANT");
  }

  public boolean containsLine(int line) {
    return line >= startLine && line <= endLine;
  }

  public Scope scope() {
    return scopeOf(keyword);
  }

  public static Scope scopeOf(String keyword) {
    switch (keyword.toUpperCase(Locale.ROOT)) {
      case "VAR_INPUT": return Scope.INPUT;
      case "VAR_OUTPUT": return Scope.OUTPUT;
      case "VAR_IN_OUT": return Scope.IN_OUT;
      case "VAR_GLOBAL":
      case "VAR_CONFIG":
      case "VAR_ACCESS": return Scope.GLOBAL;
      case "VAR_TEMP": return Scope.TEMP;
      case "VAR_EXTERNAL": return Scope.EXTERNAL;
      default: return Scope.LOCAL;
    }
  }

  @Override
  public String toString() {
    return keyword + qualifiers + " [" + startLine + "," + endLine + "]" + (owner == null ? "" : " in " + owner)
        + (member == null ? "" : "." + member);
  }
}
