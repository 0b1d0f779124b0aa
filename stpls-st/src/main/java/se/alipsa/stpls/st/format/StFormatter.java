package se.alipsa.stpls.st.format;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;
import se.alipsa.stpls.core.model.TextEdit;
import se.alipsa.stpls.st.diagnostics.LineShapes;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.lex.LineSegments;
import se.alipsa.stpls.st.lex.Segment;
import se.alipsa.stpls.st.lex.Segmenter;
import se.alipsa.stpls.st.lex.Word;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Whole-document formatter: re-indents by block depth, normalizes keyword case in code and
 * trims trailing whitespace. Comments, pragmas and string literals are never changed, and the
 * continuation lines of a block comment keep their own indentation.
 */
public final class StFormatter {

  private static final String VAR_BLOCK = "VAR";

  /** Closer to the opener it ends; every VAR section opener counts as {@link #VAR_BLOCK}. */
  private static final Map<String, String> CLOSERS = new HashMap<>();
  private static final Set<String> OPENERS = Set.of(
      "PROGRAM", "FUNCTION_BLOCK", "FUNCTION", "METHOD", "PROPERTY", "ACTION", "INTERFACE",
      "IF", "CASE", "FOR", "WHILE", "REPEAT", "TYPE", "STRUCT", VAR_BLOCK);
  private static final Set<String> VAR_OPENERS = Set.of(
      "VAR", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_TEMP",
      "VAR_GLOBAL", "VAR_ACCESS", "VAR_CONFIG", "VAR_EXTERNAL");

  /** Out-dented one level themselves; the lines after them stay at block depth. */
  private static final Set<String> DEDENT_SELF = Set.of("ELSIF", "ELSE", "UNTIL");

  static {
    for (String o : OPENERS) CLOSERS.put("END_" + o, o);
  }

  private final FormatOptions options;

  public StFormatter(FormatOptions options) {
    this.options = options == null ? FormatOptions.defaults() : options;
  }

  public FormatOptions getOptions() {
    return options;
  }

  /** Edits turning {@code text} into its formatted form; empty when it is formatted already. */
  public List<TextEdit> edits(String text) {
    String formatted = format(text);
    if (formatted.equals(text)) return List.of();
    String[] lines = text.split("\n", -1);
    int last = lines.length - 1;
    Range whole = new Range(new Position(0, 0), new Position(last, lines[last].length()));
    return List.of(new TextEdit(whole, formatted));
  }

  public String format(String text) {
    if (text.isEmpty()) return text;
    String eol = text.contains("\r\n") ? "\r\n" : "\n";
    String[] rawLines = text.split("\n", -1);
    String unit = options.indentUnit();

    List<String> out = new ArrayList<>(rawLines.length);
    Deque<String> blocks = new ArrayDeque<>();
    boolean inBlockComment = false;
    for (String l : rawLines) {
      String line = l.endsWith("\r") ? l.substring(0, l.length() - 1) : l;
      boolean startsInComment = inBlockComment;
      LineSegments ls = Segmenter.segmentLine(line, inBlockComment);
      inBlockComment = ls.isInBlockComment();
      List<Segment> segments = ls.getSegments();

      if (line.isBlank()) {
        out.add(options.isTrimTrailingWhitespace() ? "" : line);
        continue;
      }
      String code = codeOnly(line, segments);
      String cased = applyKeywordCase(line, code);
      if (startsInComment && code.isBlank()) {
        out.add(trimEnd(cased));
        continue;
      }
      int level = indentLevel(code, blocks);
      out.add(trimEnd(unit.repeat(level) + cased.stripLeading()));
    }

    String result = String.join(eol, out);
    if (options.isInsertFinalNewline() && !out.get(out.size() - 1).isEmpty()) {
      result += eol;
    }
    return result;
  }

  /** Indent level of a line, then the effect of its block keywords on {@code blocks}. */
  private int indentLevel(String code, Deque<String> blocks) {
    List<Word> words = Word.keywordCandidates(code);
    String first = words.isEmpty() ? null : words.get(0).upper();

    int level = depth(blocks);
    if (first != null && CLOSERS.containsKey(first)) {
      close(blocks, CLOSERS.get(first));
      level = depth(blocks);
      words = words.subList(1, words.size());
    } else if (first != null && DEDENT_SELF.contains(first) && !blocks.isEmpty()) {
      level = Math.max(0, level - 1);
    } else if ("CASE".equals(blocks.peek()) && LineShapes.caseLabelEnd(code) >= 0) {
      level = Math.max(0, level - 1);
    }

    for (Word w : words) {
      String kw = blockKey(w.upper());
      if (OPENERS.contains(kw)) {
        blocks.push(kw);
      } else if (CLOSERS.containsKey(kw)) {
        close(blocks, CLOSERS.get(kw));
      }
    }
    return level;
  }

  private static String blockKey(String word) {
    return VAR_OPENERS.contains(word) ? VAR_BLOCK : word;
  }

  /** Pops up to and including the innermost {@code opener}; a closer without one is ignored. */
  private static void close(Deque<String> blocks, String opener) {
    if (!blocks.contains(opener)) return;
    while (!blocks.isEmpty()) {
      if (blocks.pop().equals(opener)) return;
    }
  }

  /** A CASE body sits two levels in: one for the CASE, one below its labels. */
  private static int depth(Deque<String> blocks) {
    int d = 0;
    for (String b : blocks) d += "CASE".equals(b) ? 2 : 1;
    return d;
  }

  private String applyKeywordCase(String line, String code) {
    FormatOptions.KeywordCase kc = options.getKeywordCase();
    if (kc == FormatOptions.KeywordCase.PRESERVE) return line;
    char[] chars = line.toCharArray();
    for (Word w : Word.keywordCandidates(code)) {
      String text = w.getText();
      if (!Keywords.isKeyword(text) && !Keywords.isDataType(text)) continue;
      String replacement = kc == FormatOptions.KeywordCase.UPPER ? w.upper() : w.upper().toLowerCase(Locale.ROOT);
      replacement.getChars(0, replacement.length(), chars, w.getStart());
    }
    return new String(chars);
  }

  private String trimEnd(String line) {
    return options.isTrimTrailingWhitespace() ? line.stripTrailing() : line;
  }

  private static String codeOnly(String line, List<Segment> segments) {
    char[] chars = line.toCharArray();
    for (Segment s : segments) {
      if (s.isCode()) continue;
      for (int i = s.getStart(); i < s.getEnd(); i++) chars[i] = ' ';
    }
    return new String(chars);
  }
}
