package se.alipsa.stpls.st.lex;

import java.util.ArrayList;
import java.util.List;

/**
 * A segmented document. Every rendering keeps the column positions of the raw text: regions
 * that are filtered out are replaced by spaces, never removed.
 */
public final class CodeView {

  private final List<String> rawLines;
  private final List<List<Segment>> segments;
  private final List<String> codeLines;
  private final List<String> noCommentLines;

  CodeView(List<String> rawLines, List<List<Segment>> segments) {
    this.rawLines = List.copyOf(rawLines);
    this.segments = List.copyOf(segments);
    List<String> code = new ArrayList<>(rawLines.size());
    List<String> noComments = new ArrayList<>(rawLines.size());
    for (int i = 0; i < rawLines.size(); i++) {
      code.add(render(rawLines.get(i), segments.get(i), false));
      noComments.add(render(rawLines.get(i), segments.get(i), true));
    }
    this.codeLines = List.copyOf(code);
    this.noCommentLines = List.copyOf(noComments);
  }

  public int lineCount() {
    return rawLines.size();
  }

  public String raw(int line) {
    return rawLines.get(line);
  }

  /** The line with comments, pragmas and string literals blanked. */
  public String code(int line) {
    return codeLines.get(line);
  }

  /** The line with comments and pragmas blanked but string literals kept. */
  public String withoutComments(int line) {
    return noCommentLines.get(line);
  }

  public List<Segment> segments(int line) {
    return segments.get(line);
  }

  public SegmentKind kindAt(int line, int column) {
    if (line < 0 || line >= rawLines.size()) return SegmentKind.CODE;
    for (Segment s : segments.get(line)) {
      if (s.contains(column)) return s.getKind();
    }
    return SegmentKind.CODE;
  }

  public boolean isInComment(int line, int column) {
    return kindAt(line, column).isComment();
  }

  public boolean isInPragma(int line, int column) {
    return kindAt(line, column) == SegmentKind.PRAGMA;
  }

  public boolean isInString(int line, int column) {
    return kindAt(line, column) == SegmentKind.STRING;
  }

  public int lastLine() {
    return rawLines.size() - 1;
  }

  private static String render(String raw, List<Segment> segs, boolean keepStrings) {
    char[] chars = raw.toCharArray();
    for (Segment s : segs) {
      if (s.isCode() || (keepStrings && s.getKind() == SegmentKind.STRING)) continue;
      for (int i = s.getStart(); i < s.getEnd(); i++) chars[i] = ' ';
    }
    return new String(chars);
  }
}
