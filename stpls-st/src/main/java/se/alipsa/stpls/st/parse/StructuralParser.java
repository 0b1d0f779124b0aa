package se.alipsa.stpls.st.parse;

import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;
import se.alipsa.stpls.core.model.SymbolKind;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.lex.Word;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stack automaton over block keywords. Openers push, closers pop; every block family shares
 * the one stack so a mismatch anywhere is reported exactly once.
 */
public final class StructuralParser {

  private static final Map<String, String> OPENERS = new HashMap<>();
  private static final Map<String, BlockKind> KINDS = new HashMap<>();
  private static final Map<String, String> CLOSERS = new HashMap<>();

  static final List<String> VAR_OPENERS = List.of(
      "VAR_GLOBAL", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_TEMP",
      "VAR_CONFIG", "VAR_ACCESS", "VAR_EXTERNAL", "VAR");

  static final Set<String> VAR_QUALIFIERS = Set.of("CONSTANT", "RETAIN", "PERSISTENT", "NON_RETAIN");

  private static final Set<String> POU_MODIFIERS =
      Set.of("PUBLIC", "PRIVATE", "PROTECTED", "INTERNAL", "ABSTRACT", "FINAL");

  private static final Set<String> MEMBER_OPENERS = Set.of("METHOD", "PROPERTY", "ACTION");
  private static final Set<String> MEMBER_CLOSERS = Set.of("END_METHOD", "END_PROPERTY", "END_ACTION");

  private static final Pattern RETURN_TYPE =
      Pattern.compile("^\\s*:\\s*([A-Za-z_]\\w*(?:\\s*[\\[(][^\\])]*[\\])])?)");

  static {
    pair("PROGRAM", "END_PROGRAM", BlockKind.POU);
    pair("FUNCTION_BLOCK", "END_FUNCTION_BLOCK", BlockKind.POU);
    pair("FUNCTION", "END_FUNCTION", BlockKind.POU);
    pair("IF", "END_IF", BlockKind.CONTROL_FLOW);
    pair("CASE", "END_CASE", BlockKind.CONTROL_FLOW);
    pair("FOR", "END_FOR", BlockKind.CONTROL_FLOW);
    pair("WHILE", "END_WHILE", BlockKind.CONTROL_FLOW);
    pair("REPEAT", "END_REPEAT", BlockKind.CONTROL_FLOW);
    pair("TYPE", "END_TYPE", BlockKind.DATA_TYPE);
    pair("STRUCT", "END_STRUCT", BlockKind.DATA_TYPE);
    for (String v : VAR_OPENERS) {
      OPENERS.put(v, "END_VAR");
      KINDS.put(v, BlockKind.VAR_SECTION);
    }
  }

  private static void pair(String open, String close, BlockKind kind) {
    OPENERS.put(open, close);
    KINDS.put(open, kind);
    CLOSERS.put(close, open);
  }

  public static boolean isBlockOpener(String keyword) {
    return OPENERS.containsKey(Keywords.upper(keyword));
  }

  /** An open block plus what we learned about it at the opener. */
  private static final class Frame {
    final BlockStackEntry entry;
    String pouName;
    Position namePosition;
    String returnType;
    Set<String> qualifiers = Set.of();
    Position innerStart;
    String owner;
    String member;

    Frame(BlockStackEntry entry) {
      this.entry = entry;
    }
  }

  private final CodeView view;
  private final List<Frame> stack = new ArrayList<>();
  private final List<StructureIssue> issues = new ArrayList<>();
  private final List<PouRange> pous = new ArrayList<>();
  private final List<VarSectionRange> varSections = new ArrayList<>();
  private final List<TypeBlockRange> typeBlocks = new ArrayList<>();
  private String currentMember;

  private StructuralParser(CodeView view) {
    this.view = view;
  }

  public static StructuralModel parse(CodeView view) {
    return new StructuralParser(view).run();
  }

  private StructuralModel run() {
    for (int line = 0; line < view.lineCount(); line++) {
      String code = view.code(line);
      List<Word> words = Word.keywordCandidates(code);
      for (int i = 0; i < words.size(); i++) {
        Word w = words.get(i);
        String kw = w.upper();
        if (i == 0 && MEMBER_OPENERS.contains(kw) && enclosingPouName() != null) {
          currentMember = memberName(words.subList(1, words.size()));
        } else if (MEMBER_CLOSERS.contains(kw)) {
          currentMember = null;
        } else if ("END_VAR".equals(kw)) {
          closeVar(line, w);
        } else if (CLOSERS.containsKey(kw)) {
          close(kw, line, w);
        } else if (OPENERS.containsKey(kw)) {
          open(kw, line, w, words.subList(i + 1, words.size()), code);
        }
      }
    }

    int last = view.lastLine();
    Position eof = new Position(last, view.raw(last).length());
    for (Frame f : stack) {
      missingCloser(f);
      finish(f, eof, false);
    }
    stack.clear();

    pous.sort(Comparator.comparingInt(PouRange::getStartLine));
    varSections.sort(Comparator.comparingInt(VarSectionRange::getStartLine));
    typeBlocks.sort(Comparator.comparingInt(TypeBlockRange::getStartLine));
    return new StructuralModel(view, issues, pous, varSections, typeBlocks);
  }

  private void open(String kw, int line, Word w, List<Word> following, String code) {
    BlockKind kind = KINDS.get(kw);
    Frame f = new Frame(new BlockStackEntry(kw, kind, OPENERS.get(kw), new Position(line, w.getStart())));
    Position afterKeyword = new Position(line, w.getEnd());
    f.innerStart = afterKeyword;

    if (kind == BlockKind.POU) {
      currentMember = null;
      for (Word next : following) {
        if (POU_MODIFIERS.contains(next.upper())) continue;
        if (!Keywords.isKeyword(next.getText())) {
          f.pouName = next.getText();
          f.namePosition = new Position(line, next.getStart());
          Matcher m = RETURN_TYPE.matcher(code.substring(next.getEnd()));
          if ("FUNCTION".equals(kw) && m.find()) {
            f.returnType = m.group(1).replaceAll("\\s+", "");
          }
        }
        break;
      }
    } else if (kind == BlockKind.VAR_SECTION) {
      Set<String> quals = new LinkedHashSet<>();
      for (Word next : following) {
        if (!VAR_QUALIFIERS.contains(next.upper())) break;
        quals.add(next.upper());
        f.innerStart = new Position(line, next.getEnd());
      }
      f.qualifiers = quals;
      f.owner = enclosingPouName();
      f.member = currentMember;
    }
    stack.add(f);
  }

  private void closeVar(int line, Word w) {
    for (int i = stack.size() - 1; i >= 0; i--) {
      Frame f = stack.get(i);
      if (f.entry.getKind() == BlockKind.VAR_SECTION) {
        stack.remove(i);
        finish(f, new Position(line, w.getStart()), true);
        return;
      }
    }
    issues.add(new StructureIssue(Range.of(line, w.getStart(), w.getText().length()),
        "'END_VAR' without matching VAR section opener"));
  }

  private void close(String kw, int line, Word w) {
    Position at = new Position(line, w.getStart());
    int match = -1;
    for (int i = stack.size() - 1; i >= 0; i--) {
      if (stack.get(i).entry.getExpectedCloser().equals(kw)) {
        match = i;
        break;
      }
    }
    if (match < 0) {
      issues.add(new StructureIssue(Range.of(line, w.getStart(), w.getText().length()),
          "'" + kw + "' without matching '" + CLOSERS.get(kw) + "'"));
      return;
    }
    // anything above the match was never closed
    while (stack.size() - 1 > match) {
      Frame dangling = stack.remove(stack.size() - 1);
      missingCloser(dangling);
      finish(dangling, at, false);
    }
    Frame matched = stack.remove(match);
    if (matched.entry.getKind() == BlockKind.POU) currentMember = null;
    finish(matched, at, true);
  }

  private void missingCloser(Frame f) {
    BlockStackEntry e = f.entry;
    issues.add(new StructureIssue(e.keywordRange(),
        "'" + e.getKeyword() + "' is missing closing '" + e.getExpectedCloser() + "'"));
  }

  private void finish(Frame f, Position end, boolean closed) {
    BlockStackEntry e = f.entry;
    int startLine = e.getPosition().line;
    switch (e.getKind()) {
      case POU -> pous.add(new PouRange(f.pouName, pouKind(e.getKeyword()), e.getPosition(), f.namePosition,
          f.returnType, startLine, end.line, closed));
      case VAR_SECTION -> varSections.add(new VarSectionRange(e.getKeyword(), f.qualifiers, f.owner, f.member,
          startLine, end.line, f.innerStart, end, closed));
      case DATA_TYPE -> {
        if ("TYPE".equals(e.getKeyword())) {
          typeBlocks.add(new TypeBlockRange(startLine, end.line, f.innerStart, end, closed));
        }
      }
      default -> {
        // control flow blocks carry no range
      }
    }
  }

  private static String memberName(List<Word> following) {
    for (Word next : following) {
      if (POU_MODIFIERS.contains(next.upper())) continue;
      return next.getText();
    }
    return "";
  }

  private String enclosingPouName() {
    for (int i = stack.size() - 1; i >= 0; i--) {
      Frame f = stack.get(i);
      if (f.entry.getKind() == BlockKind.POU) return f.pouName;
    }
    return null;
  }

  private static SymbolKind pouKind(String keyword) {
    switch (keyword) {
      case "PROGRAM": return SymbolKind.PROGRAM;
      case "FUNCTION": return SymbolKind.FUNCTION;
      default: return SymbolKind.FUNCTION_BLOCK;
    }
  }
}
