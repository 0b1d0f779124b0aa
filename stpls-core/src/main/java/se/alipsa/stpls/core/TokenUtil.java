package se.alipsa.stpls.core;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;

/** Tiny helpers for token/position math that don't depend on any language-specific lexer. */
public final class TokenUtil {
  private TokenUtil() {}

  public static int positionToOffset(String text, int line, int column) {
    int curLine = 0, idx = 0, n = text.length();
    while (curLine < line && idx < n) {
      int nl = text.indexOf('\n', idx);
      if (nl < 0) return n;
      idx = nl + 1;
      curLine++;
    }
    return Math.min(idx + column, n);
  }

  public static Position offsetToPosition(String text, int offset) {
    int line = 0, col = 0;
    for (int i = 0; i < offset && i < text.length(); i++) {
      if (text.charAt(i) == '\n') { line++; col = 0; } else { col++; }
    }
    return new Position(line, col);
  }

  public static String tokenAt(String text, int offset) {
    if (text == null || text.isEmpty()) return "";
    int n = text.length();
    int i = Math.max(0, Math.min(offset, n - 1));
    if (!isWord(text.charAt(i)) && i > 0 && isWord(text.charAt(i - 1))) i--;
    if (!isWord(text.charAt(i))) return "";

    int s = i, e = i + 1;
    while (s > 0 && isWord(text.charAt(s - 1))) s--;
    while (e < n && isWord(text.charAt(e))) e++;
    return text.substring(s, e);
  }

  /**
   * Range of the word touching {@code column} on a single line, or null when the column is not
   * on or directly after a word.
   */
  public static Range wordRange(String lineText, int lineNo, int column) {
    int n = lineText.length();
    if (n == 0) return null;
    int i = Math.max(0, Math.min(column, n - 1));
    if (!isWord(lineText.charAt(i)) && i > 0 && isWord(lineText.charAt(i - 1))) i--;
    if (!isWord(lineText.charAt(i))) return null;
    int s = i, e = i + 1;
    while (s > 0 && isWord(lineText.charAt(s - 1))) s--;
    while (e < n && isWord(lineText.charAt(e))) e++;
    return new Range(new Position(lineNo, s), new Position(lineNo, e));
  }

  public static CharSequence preview(String text) {
    int n = Math.min(text == null ? 0 : text.length(), 1024);
    return text == null ? "" : text.subSequence(0, n);
  }

  public static boolean isWord(char c) {
    // no '.' so tokens stop at member access
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
