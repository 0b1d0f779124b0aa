package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.lex.Segment;
import se.alipsa.stpls.st.lex.SegmentKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Gathers text between two positions into statements, splitting on {@code ;} outside string
 * literals. Optional breaker keywords (e.g. STRUCT inside a TYPE block) end the current
 * statement and are emitted as marker statements of their own.
 */
public final class StatementSplitter {

  private final CodeView view;
  private final Set<String> breakers;

  private final List<Statement> out = new ArrayList<>();
  private final StringBuilder text = new StringBuilder();
  private int[] lines = new int[64];
  private int[] columns = new int[64];

  public StatementSplitter(CodeView view) {
    this(view, Set.of());
  }

  public StatementSplitter(CodeView view, Set<String> breakers) {
    this.view = view;
    this.breakers = Set.copyOf(breakers);
  }

  /** Split {@code [from, to)}. A trailing statement without {@code ;} is still returned. */
  public List<Statement> split(Position from, Position to) {
    out.clear();
    text.setLength(0);
    for (int line = from.line; line <= to.line && line < view.lineCount(); line++) {
      String raw = view.raw(line);
      int start = line == from.line ? Math.min(from.column, raw.length()) : 0;
      int end = line == to.line ? Math.min(to.column, raw.length()) : raw.length();
      for (Segment seg : view.segments(line)) {
        int s = Math.max(seg.getStart(), start);
        int e = Math.min(seg.getEnd(), end);
        if (s >= e) continue;
        if (seg.getKind() == SegmentKind.STRING) {
          for (int c = s; c < e; c++) append(raw.charAt(c), line, c);
        } else if (seg.isCode()) {
          code(raw, line, s, e);
        } else {
          for (int c = s; c < e; c++) append(' ', line, c);
        }
      }
      if (line < to.line) append(' ', line, raw.length());
    }
    flush(null);
    return List.copyOf(out);
  }

  private void code(String raw, int line, int s, int e) {
    int c = s;
    while (c < e) {
      char ch = raw.charAt(c);
      if (ch == ';') {
        flush(null);
        c++;
        continue;
      }
      if (!breakers.isEmpty() && isWordStart(raw, c)) {
        int w = c;
        while (w < e && isWordChar(raw.charAt(w))) w++;
        String word = raw.substring(c, w);
        if (breakers.contains(Keywords.upper(word))) {
          flush(null);
          for (int k = c; k < w; k++) append(raw.charAt(k), line, k);
          flush(Keywords.upper(word));
        } else {
          for (int k = c; k < w; k++) append(raw.charAt(k), line, k);
        }
        c = w;
        continue;
      }
      append(ch, line, c);
      c++;
    }
  }

  private void append(char ch, int line, int column) {
    int n = text.length();
    if (n == lines.length) {
      lines = Arrays.copyOf(lines, n * 2);
      columns = Arrays.copyOf(columns, n * 2);
    }
    text.append(ch);
    lines[n] = line;
    columns[n] = column;
  }

  private void flush(String marker) {
    int n = text.length();
    if (marker != null || !text.toString().isBlank()) {
      out.add(new Statement(text.toString(), Arrays.copyOf(lines, n),
          Arrays.copyOf(columns, n), marker));
    }
    text.setLength(0);
  }

  private static boolean isWordStart(String raw, int c) {
    return isWordChar(raw.charAt(c)) && (c == 0 || !isWordChar(raw.charAt(c - 1)));
  }

  private static boolean isWordChar(char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_';
  }
}
