package se.alipsa.stpls.st.diagnostics;

import se.alipsa.stpls.st.lex.Word;

import java.util.List;
import java.util.regex.Pattern;

/** Shape tests on a single code-only line. */
public final class LineShapes {

  private LineShapes() {}

  private static final Pattern NUMERIC_LABEL = Pattern.compile("^[-+]?[0-9].*:$");
  private static final Pattern IDENT_LABEL = Pattern.compile("^[A-Za-z_]\\w*\\s*:$");
  private static final Pattern STRING_LABEL = Pattern.compile("^'[^']*'\\s*:$");
  private static final Pattern RANGE_LABEL = Pattern.compile("^[-+]?[\\w#]+\\s*\\.\\.\\s*[-+]?[\\w#]+\\s*:$");
  private static final Pattern LIST_LABEL = Pattern.compile("^[-+]?[\\w#'.]+(\\s*,\\s*[-+]?[\\w#'.]+)*\\s*:$");
  private static final Pattern TRAILING_OPERATOR = Pattern.compile(
      "(?i)(?:\\b(?:AND|OR|XOR|NOT|MOD|AND_THEN|OR_ELSE)|[-+*/=<>,(&])$");

  /** {@code 1:}, {@code 1..10:}, {@code RUNNING:}, {@code 'a':} or {@code 1, 2, 3:}. */
  static boolean isCaseLabel(String trimmed) {
    if (trimmed.isEmpty() || trimmed.endsWith(":=") || !trimmed.endsWith(":")) return false;
    return NUMERIC_LABEL.matcher(trimmed).matches()
        || IDENT_LABEL.matcher(trimmed).matches()
        || STRING_LABEL.matcher(trimmed).matches()
        || RANGE_LABEL.matcher(trimmed).matches()
        || LIST_LABEL.matcher(trimmed).matches();
  }

  /**
   * Column of the colon ending a CASE label at the start of the line, e.g. {@code RED: x := 1;},
   * or -1. The colon of {@code :=} does not count.
   */
  public static int caseLabelEnd(String code) {
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c == ':') {
        boolean assign = i + 1 < code.length() && code.charAt(i + 1) == '=';
        if (assign) return -1;
        String label = code.substring(0, i + 1).trim();
        return isCaseLabel(label) ? i : -1;
      }
      if (c == ';' || c == '(') return -1;
    }
    return -1;
  }

  /** The line continues on the next one: it ends in a binary operator, a comma or an open paren. */
  static boolean endsWithOperator(String trimmed) {
    return !trimmed.isEmpty() && TRAILING_OPERATOR.matcher(trimmed).find();
  }

  static String firstWord(String code) {
    List<Word> words = Word.scan(code);
    if (words.isEmpty()) return null;
    Word w = words.get(0);
    return code.substring(0, w.getStart()).isBlank() ? w.upper() : null;
  }

  static String lastWord(String code) {
    List<Word> words = Word.scan(code);
    if (words.isEmpty()) return null;
    Word w = words.get(words.size() - 1);
    return code.substring(w.getEnd()).isBlank() ? w.upper() : null;
  }

  /** Net change of paren depth over the line; never lets depth go below zero. */
  static int parenDepth(String code, int depth) {
    for (int i = 0; i < code.length(); i++) {
      char c = code.charAt(i);
      if (c == '(') depth++;
      else if (c == ')') depth = Math.max(0, depth - 1);
    }
    return depth;
  }

  static int trimmedEnd(String line) {
    return line.stripTrailing().length();
  }
}
