package se.alipsa.stpls.st.lex;

import java.util.ArrayList;
import java.util.List;

/** An identifier-shaped token of one line and its starting column. */
public final class Word {
  private final String text;
  private final int start;

  public Word(String text, int start) {
    this.text = text;
    this.start = start;
  }

  public String getText() { return text; }
  public int getStart() { return start; }
  public int getEnd() { return start + text.length(); }

  public String upper() {
    return Keywords.upper(text);
  }

  public boolean is(String keyword) {
    return text.equalsIgnoreCase(keyword);
  }

  /** Char directly before the word, or {@code '\0'}. */
  public char before(String line) {
    return start > 0 ? line.charAt(start - 1) : '\0';
  }

  /** Char directly after the word, or {@code '\0'}. */
  public char after(String line) {
    int e = getEnd();
    return e < line.length() ? line.charAt(e) : '\0';
  }

  /** First non-blank text after the word. */
  public String rest(String line) {
    return line.substring(getEnd()).stripLeading();
  }

  /**
   * All identifiers {@code [A-Za-z_][A-Za-z0-9_]*} on a line. A word never starts in the middle of
   * another word or number, so {@code 1E5} and {@code 16#FF} yield no {@code E}.
   */
  public static List<Word> scan(String line) {
    List<Word> out = new ArrayList<>();
    int n = line.length();
    int i = 0;
    while (i < n) {
      char c = line.charAt(i);
      if (Character.isLetterOrDigit(c) || c == '_') {
        int s = i;
        while (i < n && (Character.isLetterOrDigit(line.charAt(i)) || line.charAt(i) == '_')) i++;
        char first = line.charAt(s);
        if (first == '_' || (first < 128 && Character.isLetter(first))) {
          out.add(new Word(line.substring(s, i), s));
        }
        continue;
      }
      i++;
    }
    return out;
  }

  /**
   * Identifiers that can be keywords: skips member names after {@code .} and the parts of typed
   * literals such as {@code T#5s} or {@code 16#FF}.
   */
  public static List<Word> keywordCandidates(String line) {
    List<Word> out = new ArrayList<>();
    for (Word w : scan(line)) {
      char b = w.before(line);
      if (b == '.' || b == '#' || b == '%' || w.after(line) == '#') continue;
      out.add(w);
    }
    return out;
  }

  @Override
  public String toString() {
    return text + "@" + start;
  }
}
