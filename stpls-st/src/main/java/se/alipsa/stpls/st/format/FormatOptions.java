package se.alipsa.stpls.st.format;

import java.util.Locale;

/** Settings of {@link StFormatter}. Instances are immutable; the {@code with} methods return copies. */
public final class FormatOptions {

  public enum KeywordCase {
    UPPER, LOWER, PRESERVE;

    /** Case-insensitive lookup; {@code null} or an unknown name gives {@code fallback}. */
    public static KeywordCase parse(String name, KeywordCase fallback) {
      if (name == null) return fallback;
      try {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        return fallback;
      }
    }
  }

  private static final FormatOptions DEFAULTS = new FormatOptions(4, true, KeywordCase.UPPER, true, true);

  private final int tabSize;
  private final boolean insertSpaces;
  private final KeywordCase keywordCase;
  private final boolean trimTrailingWhitespace;
  private final boolean insertFinalNewline;

  private FormatOptions(int tabSize, boolean insertSpaces, KeywordCase keywordCase,
                        boolean trimTrailingWhitespace, boolean insertFinalNewline) {
    if (tabSize < 1) throw new IllegalArgumentException("tabSize must be positive: " + tabSize);
    this.tabSize = tabSize;
    this.insertSpaces = insertSpaces;
    this.keywordCase = keywordCase == null ? KeywordCase.UPPER : keywordCase;
    this.trimTrailingWhitespace = trimTrailingWhitespace;
    this.insertFinalNewline = insertFinalNewline;
  }

  /** Four spaces, upper-case keywords, trailing whitespace trimmed, final newline. */
  public static FormatOptions defaults() {
    return DEFAULTS;
  }

  public FormatOptions withTabSize(int size) {
    return new FormatOptions(size, insertSpaces, keywordCase, trimTrailingWhitespace, insertFinalNewline);
  }

  public FormatOptions withInsertSpaces(boolean spaces) {
    return new FormatOptions(tabSize, spaces, keywordCase, trimTrailingWhitespace, insertFinalNewline);
  }

  public FormatOptions withKeywordCase(KeywordCase kc) {
    return new FormatOptions(tabSize, insertSpaces, kc, trimTrailingWhitespace, insertFinalNewline);
  }

  public FormatOptions withTrimTrailingWhitespace(boolean trim) {
    return new FormatOptions(tabSize, insertSpaces, keywordCase, trim, insertFinalNewline);
  }

  public FormatOptions withInsertFinalNewline(boolean newline) {
    return new FormatOptions(tabSize, insertSpaces, keywordCase, trimTrailingWhitespace, newline);
  }

  public int getTabSize() { return tabSize; }
  public boolean isInsertSpaces() { return insertSpaces; }
  public KeywordCase getKeywordCase() { return keywordCase; }
  public boolean isTrimTrailingWhitespace() { return trimTrailingWhitespace; }
  public boolean isInsertFinalNewline() { return insertFinalNewline; }

  /** One level of indentation. */
  String indentUnit() {
    return insertSpaces ? " ".repeat(tabSize) : "\t";
  }

  @Override
  public String toString() {
    return "FormatOptions{tabSize=" + tabSize + ", insertSpaces=" + insertSpaces + ", keywordCase=" + keywordCase
        + ", trimTrailingWhitespace=" + trimTrailingWhitespace + ", insertFinalNewline=" + insertFinalNewline + "}";
  }
}
