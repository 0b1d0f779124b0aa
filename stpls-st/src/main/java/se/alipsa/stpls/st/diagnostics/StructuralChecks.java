package se.alipsa.stpls.st.diagnostics;

import se.alipsa.stpls.core.model.Diagnostic;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Segment;
import se.alipsa.stpls.st.lex.SegmentKind;
import se.alipsa.stpls.st.lex.Word;
import se.alipsa.stpls.st.parse.PouRange;
import se.alipsa.stpls.st.parse.StructuralModel;
import se.alipsa.stpls.st.parse.StructureIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Well-formedness checks that only need the segmented text and its block structure: block
 * pairing, string literals, parentheses, ELSE IF and missing THEN/DO.
 */
public final class StructuralChecks {

  private static final Pattern ELSE_IF = Pattern.compile("(?i)\\bELSE\\s+IF\\b");

  private StructuralChecks() {}

  public static List<Diagnostic> check(StructuralModel model) {
    List<Diagnostic> out = new ArrayList<>();
    for (StructureIssue issue : model.getIssues()) {
      out.add(DiagnosticCode.UNMATCHED_BLOCK.at(issue.getRange(), issue.getMessage()));
    }
    CodeView view = model.getView();
    unclosedStrings(view, out);
    parentheses(view, out);
    elseIf(view, out);
    missingThenDo(model, out);
    return out;
  }

  static void unclosedStrings(CodeView view, List<Diagnostic> out) {
    for (int line = 0; line < view.lineCount(); line++) {
      for (Segment s : view.segments(line)) {
        if (s.getKind() != SegmentKind.STRING || s.isTerminated()) continue;
        boolean single = view.raw(line).charAt(s.getStart()) == '\'';
        out.add(DiagnosticCode.UNCLOSED_STRING.at(
            new Range(new Position(line, s.getStart()),
                new Position(line, view.raw(line).length())),
            "Unclosed string literal (" + (single ? "single" : "double") + " quote)"));
      }
    }
  }

  static void parentheses(CodeView view, List<Diagnostic> out) {
    for (int line = 0; line < view.lineCount(); line++) {
      String code = view.code(line);
      int depth = 0;
      int firstOpen = -1;
      for (int i = 0; i < code.length(); i++) {
        char c = code.charAt(i);
        if (c == '(') {
          if (depth == 0) firstOpen = i;
          depth++;
        } else if (c == ')') {
          depth--;
          if (depth < 0) {
            out.add(DiagnosticCode.UNMATCHED_PAREN.at(Range.of(line, i, 1), "Unmatched closing parenthesis"));
            depth = 0;
          }
        }
      }
      // multi-line call argument lists do not end in ';' so only statement lines are judged
      if (depth > 0 && code.stripTrailing().endsWith(";")) {
        out.add(DiagnosticCode.UNMATCHED_PAREN.at(Range.of(line, Math.max(firstOpen, 0), 1),
            "Unmatched opening parenthesis (" + depth + " unclosed)"));
      }
    }
  }

  static void elseIf(CodeView view, List<Diagnostic> out) {
    for (int line = 0; line < view.lineCount(); line++) {
      Matcher m = ELSE_IF.matcher(view.code(line));
      if (m.find()) {
        out.add(DiagnosticCode.ELSE_IF.at(Range.of(line, m.start(), m.end() - m.start()),
            "'ELSE IF' is not valid IEC 61131-3 syntax; use 'ELSIF'"));
      }
    }
  }

  /**
   * IF/ELSIF headers need THEN, FOR/WHILE headers need DO. A header is gathered over several
   * lines while parentheses are open or a line ends in an operator.
   */
  static void missingThenDo(StructuralModel model, List<Diagnostic> out) {
    CodeView view = model.getView();
    for (PouRange pou : model.getPous()) {
      String header = null;     // IF / ELSIF / FOR / WHILE while accumulating
      StringBuilder text = new StringBuilder();
      int depth = 0;
      for (int line : model.bodyLines(pou)) {
        String code = view.code(line);
        String trimmed = code.trim();
        if (trimmed.isEmpty()) continue;

        if (header == null) {
          String first = LineShapes.firstWord(code);
          if (!"IF".equals(first) && !"ELSIF".equals(first) && !"FOR".equals(first) && !"WHILE".equals(first)) {
            continue;
          }
          header = first;
          text.setLength(0);
          text.append(trimmed.substring(first.length()));
          depth = LineShapes.parenDepth(trimmed, 0);
          if (depth > 0 || LineShapes.endsWithOperator(trimmed)) continue;
          judge(header, text.toString(), line, code, false, out);
          header = null;
          continue;
        }

        text.append(' ').append(trimmed);
        depth = LineShapes.parenDepth(trimmed, depth);
        if (depth > 0 || LineShapes.endsWithOperator(trimmed)) continue;
        judge(header, text.toString(), line, code, true, out);
        header = null;
      }
    }
  }

  private static void judge(String header, String afterKeyword, int line, String code, boolean multiLine,
                            List<Diagnostic> out) {
    String expected = "FOR".equals(header) || "WHILE".equals(header) ? "DO" : "THEN";
    if (hasTopLevelWord(afterKeyword, expected)) return;
    String message = multiLine
        ? "'" + ("ELSIF".equals(header) ? "IF" : header) + "' condition is missing '" + expected + "'"
        : "'" + header + "' is missing '" + expected + "'";
    out.add(DiagnosticCode.MISSING_THEN_DO.at(Range.of(line, LineShapes.trimmedEnd(code), 0), message));
  }

  private static boolean hasTopLevelWord(String text, String keyword) {
    int depth = 0;
    int pos = 0;
    for (Word w : Word.keywordCandidates(text)) {
      depth = LineShapes.parenDepth(text.substring(pos, w.getStart()), depth);
      pos = w.getStart();
      if (depth == 0 && w.is(keyword)) return true;
    }
    return false;
  }
}
