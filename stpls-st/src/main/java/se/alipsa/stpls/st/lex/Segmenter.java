package se.alipsa.stpls.st.lex;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Structured Text into code, comment, pragma and string regions.
 * <p>
 * Block comments {@code (* *)} may span lines and do not nest. String literals use {@code '}
 * or {@code "} and escape the quote by doubling it; they never span lines, so an unterminated
 * literal ends at the end of its line. Pragmas {@code { }} are single-line as well.
 */
public final class Segmenter {

  private Segmenter() {}

  public static LineSegments segmentLine(String line, boolean inBlockComment) {
    List<Segment> out = new ArrayList<>();
    int n = line.length();
    int i = 0;

    if (inBlockComment) {
      int close = line.indexOf("*)");
      if (close < 0) {
        add(out, 0, n, SegmentKind.BLOCK_COMMENT, false);
        return new LineSegments(out, true);
      }
      add(out, 0, close + 2, SegmentKind.BLOCK_COMMENT, true);
      i = close + 2;
    }

    int codeStart = i;
    while (i < n) {
      char c = line.charAt(i);
      char next = i + 1 < n ? line.charAt(i + 1) : '\0';
      if (c == '/' && next == '/') {
        add(out, codeStart, i, SegmentKind.CODE, true);
        add(out, i, n, SegmentKind.LINE_COMMENT, true);
        return new LineSegments(out, false);
      }
      if (c == '(' && next == '*') {
        add(out, codeStart, i, SegmentKind.CODE, true);
        int close = line.indexOf("*)", i + 2);
        if (close < 0) {
          add(out, i, n, SegmentKind.BLOCK_COMMENT, false);
          return new LineSegments(out, true);
        }
        add(out, i, close + 2, SegmentKind.BLOCK_COMMENT, true);
        i = close + 2;
        codeStart = i;
        continue;
      }
      if (c == '{') {
        add(out, codeStart, i, SegmentKind.CODE, true);
        int close = line.indexOf('}', i + 1);
        int end = close < 0 ? n : close + 1;
        add(out, i, end, SegmentKind.PRAGMA, close >= 0);
        i = end;
        codeStart = i;
        continue;
      }
      if (c == '\'' || c == '"') {
        add(out, codeStart, i, SegmentKind.CODE, true);
        int j = i + 1;
        boolean terminated = false;
        while (j < n) {
          if (line.charAt(j) == c) {
            if (j + 1 < n && line.charAt(j + 1) == c) {
              j += 2; // doubled quote
              continue;
            }
            j++;
            terminated = true;
            break;
          }
          j++;
        }
        add(out, i, j, SegmentKind.STRING, terminated);
        i = j;
        codeStart = i;
        continue;
      }
      i++;
    }
    add(out, codeStart, n, SegmentKind.CODE, true);
    return new LineSegments(out, false);
  }

  /** Segment a whole document. Carriage returns of CRLF line ends are dropped. */
  public static CodeView segment(String text) {
    String[] lines = text.split("\n", -1);
    List<String> raw = new ArrayList<>(lines.length);
    List<List<Segment>> segments = new ArrayList<>(lines.length);
    boolean inBlock = false;
    for (String l : lines) {
      String line = l.endsWith("\r") ? l.substring(0, l.length() - 1) : l;
      LineSegments ls = segmentLine(line, inBlock);
      raw.add(line);
      segments.add(ls.getSegments());
      inBlock = ls.isInBlockComment();
    }
    return new CodeView(raw, segments);
  }

  private static void add(List<Segment> out, int start, int end, SegmentKind kind, boolean terminated) {
    if (end > start) out.add(new Segment(start, end, kind, terminated));
  }
}
