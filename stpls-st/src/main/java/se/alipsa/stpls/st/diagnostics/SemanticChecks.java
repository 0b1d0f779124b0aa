package se.alipsa.stpls.st.diagnostics;

import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.model.*;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.lex.Word;
import se.alipsa.stpls.st.parse.PouRange;
import se.alipsa.stpls.st.parse.StructuralModel;
import se.alipsa.stpls.st.parse.VarSectionRange;
import se.alipsa.stpls.st.symbols.StDocument;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that need declarations: missing semicolons, duplicate and undefined identifiers,
 * unused locals and assignment type mismatches. They only look at POU bodies, never at
 * declaration sections. When in doubt a check stays silent.
 */
public final class SemanticChecks {

  /** Lines led by these words do not end in ';'. */
  static final Set<String> NO_SEMICOLON_KEYWORDS = Set.of(
      "PROGRAM", "END_PROGRAM", "FUNCTION", "END_FUNCTION",
      "FUNCTION_BLOCK", "END_FUNCTION_BLOCK",
      "TYPE", "END_TYPE", "STRUCT", "END_STRUCT",
      "CLASS", "END_CLASS", "METHOD", "END_METHOD",
      "INTERFACE", "END_INTERFACE", "NAMESPACE", "END_NAMESPACE",
      "PROPERTY", "END_PROPERTY", "ACTION", "END_ACTION",
      "CONFIGURATION", "END_CONFIGURATION", "RESOURCE", "END_RESOURCE",
      "VAR", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_TEMP",
      "VAR_GLOBAL", "VAR_CONFIG", "VAR_ACCESS", "VAR_EXTERNAL", "END_VAR",
      "IF", "ELSIF", "ELSE", "END_IF",
      "CASE", "END_CASE",
      "FOR", "END_FOR",
      "WHILE", "END_WHILE",
      "REPEAT", "END_REPEAT",
      "UNTIL");

  /** Nested declarations inside a FUNCTION_BLOCK whose names are visible in its body. */
  private static final Set<String> MEMBER_HEADERS = Set.of(
      "METHOD", "END_METHOD", "PROPERTY", "END_PROPERTY", "ACTION", "END_ACTION");

  private static final Pattern ASSIGNMENT = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*:=\\s*(.+?)\\s*;\\s*$");
  private static final Pattern REAL_LITERAL = Pattern.compile("^[+-]?[0-9][0-9_]*\\.[0-9_]+(?:[eE][+-]?[0-9]+)?$");
  private static final Pattern INT_LITERAL = Pattern.compile("^[+-]?[0-9][0-9_]*$");
  private static final Pattern BASED_LITERAL = Pattern.compile("^(?:16#[0-9A-Fa-f_]+|8#[0-7_]+|2#[01_]+)$");
  private static final Pattern TYPED_LITERAL = Pattern.compile("^([A-Za-z_]+)#.+$");
  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_]\\w*$");

  private final StDocument doc;
  private final StructuralModel model;
  private final CodeView view;
  private final CoreQuery core;
  private final List<Diagnostic> out = new ArrayList<>();

  private SemanticChecks(StDocument doc, CoreQuery core) {
    this.doc = doc;
    this.model = doc.getModel();
    this.view = doc.getView();
    this.core = core;
  }

  public static List<Diagnostic> check(StDocument doc, CoreQuery core) {
    SemanticChecks checks = new SemanticChecks(doc, core);
    checks.missingSemicolons();
    checks.duplicates();
    checks.undefinedIdentifiers();
    checks.unusedVariables();
    checks.typeMismatches();
    return checks.out;
  }

  // --- missing semicolon -------------------------------------------------------------------------

  private void missingSemicolons() {
    for (PouRange pou : model.getPous()) {
      int depth = 0;
      for (int line : model.bodyLines(pou)) {
        String code = view.code(line);
        String trimmed = code.trim();
        if (trimmed.isEmpty()) continue;

        depth = LineShapes.parenDepth(trimmed, depth);
        if (depth > 0) continue;

        String first = LineShapes.firstWord(code);
        if (first != null && NO_SEMICOLON_KEYWORDS.contains(first)) continue;
        if (LineShapes.isCaseLabel(trimmed)) continue;
        String last = LineShapes.lastWord(code);
        if ("THEN".equals(last) || "DO".equals(last) || "OF".equals(last)) continue;
        if (LineShapes.endsWithOperator(trimmed)) continue;

        if (!trimmed.endsWith(";")) {
          out.add(DiagnosticCode.MISSING_SEMICOLON.at(Range.of(line, LineShapes.trimmedEnd(code), 0),
              "Missing semicolon at end of statement"));
        }
      }
    }
  }

  // --- duplicate declaration ---------------------------------------------------------------------

  private void duplicates() {
    Map<String, Map<String, Symbol>> seenByOwner = new HashMap<>();
    for (Symbol s : doc.getSymbols()) {
      if (s.getKind().isPou() || s.getKind() == SymbolKind.TYPE) continue;
      Map<String, Symbol> seen = seenByOwner.computeIfAbsent(declarationOwner(s), k -> new HashMap<>());
      Symbol first = seen.putIfAbsent(s.getNormalizedName(), s);
      if (first != null) {
        out.add(DiagnosticCode.DUPLICATE_DECLARATION.at(s.getLocation().getRange(),
            "Duplicate declaration '" + s.getName() + "' (already declared as '" + first.getName() + "')"));
      }
    }
  }

  /** The POU, or the METHOD, PROPERTY or ACTION inside it, that a declaration belongs to. */
  private String declarationOwner(Symbol s) {
    String owner = Symbol.normalize(s.getParentSymbol());
    int line = s.getLocation().getRange().start.line;
    for (VarSectionRange v : model.getVarSections()) {
      if (v.containsLine(line) && v.getMember() != null) return owner + "." + Symbol.normalize(v.getMember());
    }
    return owner;
  }

  // --- undefined identifier ----------------------------------------------------------------------

  private void undefinedIdentifiers() {
    Set<String> workspaceNames = workspaceNames();
    for (PouRange pou : model.getPous()) {
      if (!pou.hasName()) continue;
      // inherited members are invisible to us
      if (Keywords.upper(view.code(pou.getStartLine())).matches(".*\\bEXTENDS\\b.*")) continue;

      Set<String> declared = new HashSet<>();
      declared.add(Keywords.upper(pou.getName()));
      for (Symbol s : doc.declarationsOf(pou)) declared.add(Keywords.upper(s.getName()));

      List<Integer> body = model.bodyLines(pou);
      for (int line : body) {
        List<Word> words = Word.scan(view.code(line));
        if (words.size() > 1 && MEMBER_HEADERS.contains(words.get(0).upper())) declared.add(words.get(1).upper());
      }

      int caseDepth = 0;
      for (int line : body) {
        String code = view.code(line);
        String trimmed = code.trim();
        if (trimmed.isEmpty()) continue;
        String first = LineShapes.firstWord(code);
        if (first != null && MEMBER_HEADERS.contains(first)) continue;
        if ("CASE".equals(first)) caseDepth++;
        if ("END_CASE".equals(first)) caseDepth = Math.max(0, caseDepth - 1);

        int labelEnd = -1;
        if (caseDepth > 0) {
          if (LineShapes.isCaseLabel(trimmed)) continue;
          labelEnd = LineShapes.caseLabelEnd(code);
        }

        for (Word w : Word.scan(code)) {
          if (w.getStart() < labelEnd) continue;
          char before = w.before(code);
          if (before == '.' || before == '#' || before == '%' || w.after(code) == '#') continue;
          String rest = w.rest(code);
          if (rest.startsWith(":=") || rest.startsWith("=>")) continue;
          String upper = w.upper();
          if (Keywords.isKnown(upper) || declared.contains(upper) || workspaceNames.contains(upper)) continue;
          out.add(DiagnosticCode.UNDEFINED_IDENTIFIER.at(Range.of(line, w.getStart(), w.getText().length()),
              "Undefined identifier '" + w.getText() + "'"));
        }
      }
    }
  }

  /** Upper-cased names visible from every POU: POUs, globals, user types and enum values. */
  private Set<String> workspaceNames() {
    Set<String> names = new HashSet<>();
    List<Symbol> all = new ArrayList<>(core.allSymbols());
    all.addAll(doc.getSymbols());
    for (Symbol s : all) {
      if (s.getKind().isPou() || s.getScope() == Scope.GLOBAL || !s.hasParent()) {
        names.add(Keywords.upper(s.getName()));
      }
      if (s.getKind() == SymbolKind.TYPE) {
        for (Symbol m : s.getMembers()) {
          if (m.getKind() == SymbolKind.CONSTANT) names.add(Keywords.upper(m.getName()));
        }
      }
    }
    return names;
  }

  // --- unused local ------------------------------------------------------------------------------

  private void unusedVariables() {
    for (PouRange pou : model.getPous()) {
      List<Symbol> locals = new ArrayList<>();
      for (Symbol s : doc.declarationsOf(pou)) {
        if (s.getScope() == Scope.LOCAL
            && (s.getKind() == SymbolKind.VARIABLE || s.getKind() == SymbolKind.FUNCTION_BLOCK_INSTANCE)) {
          locals.add(s);
        }
      }
      if (locals.isEmpty()) continue;

      StringBuilder body = new StringBuilder();
      for (int line : model.bodyLines(pou)) body.append(' ').append(view.code(line));
      String text = body.toString();

      for (Symbol v : locals) {
        Pattern word = Pattern.compile("\\b" + Pattern.quote(v.getName()) + "\\b", Pattern.CASE_INSENSITIVE);
        if (!word.matcher(text).find()) {
          out.add(DiagnosticCode.UNUSED_VARIABLE.at(v.getLocation().getRange(),
              "Variable '" + v.getName() + "' is declared but never used"));
        }
      }
    }
  }

  // --- type mismatch -----------------------------------------------------------------------------

  private void typeMismatches() {
    for (PouRange pou : model.getPous()) {
      Map<String, Symbol> scope = visibleSymbols(pou);
      for (int line : model.bodyLines(pou)) {
        String text = view.withoutComments(line);
        Matcher m = ASSIGNMENT.matcher(text);
        if (!m.matches()) continue;

        Symbol lhs = scope.get(Symbol.normalize(m.group(1)));
        if (lhs == null || lhs.getDataType() == null) continue;
        String lhsType = Keywords.upper(lhs.getDataType());

        String rhsExpr = m.group(2);
        String rhsType = inferType(rhsExpr, scope);
        if (rhsType == null) continue;

        if (!TypeFamily.isAssignable(lhsType, rhsType)) {
          out.add(DiagnosticCode.TYPE_MISMATCH.at(Range.of(line, m.start(2), rhsExpr.length()),
              "Type mismatch: cannot assign '" + rhsType + "' to '" + lhsType + "'"));
        }
      }
    }
  }

  /** Names visible in a POU body, innermost first: own declarations, own name, file globals, workspace globals. */
  private Map<String, Symbol> visibleSymbols(PouRange pou) {
    Map<String, Symbol> scope = new HashMap<>();
    for (Symbol s : doc.declarationsOf(pou)) scope.putIfAbsent(s.getNormalizedName(), s);
    doc.pouSymbol(pou).ifPresent(p -> {
      if (p.getKind() == SymbolKind.FUNCTION) scope.putIfAbsent(p.getNormalizedName(), p);
    });
    for (Symbol s : doc.globals()) scope.putIfAbsent(s.getNormalizedName(), s);
    for (Symbol s : core.allSymbols()) {
      if (s.getScope() == Scope.GLOBAL && !s.getKind().isPou() && s.getKind() != SymbolKind.TYPE) {
        scope.putIfAbsent(s.getNormalizedName(), s);
      }
    }
    return scope;
  }

  /** Static type of a literal or a lone identifier; null when it cannot be told without evaluating. */
  static String inferType(String expr, Map<String, Symbol> scope) {
    String e = expr.trim();
    String upper = Keywords.upper(e);

    if ("TRUE".equals(upper) || "FALSE".equals(upper)) return "BOOL";
    if (e.length() >= 2 && e.startsWith("'") && e.endsWith("'")) return e.length() == 3 ? "CHAR" : "STRING";
    if (e.length() >= 2 && e.startsWith("\"") && e.endsWith("\"")) return "WSTRING";

    if (upper.startsWith("LTIME#") || upper.startsWith("LT#")) return "LTIME";
    if (upper.startsWith("TIME#") || upper.startsWith("T#")) return "TIME";
    if (upper.startsWith("LDATE#") || upper.startsWith("LD#")) return "LDATE";
    if (upper.startsWith("DATE#") || upper.startsWith("D#")) return "DATE";
    if (upper.startsWith("DT#") || upper.startsWith("DATE_AND_TIME#")) return "DATE_AND_TIME";
    if (upper.startsWith("TOD#") || upper.startsWith("TIME_OF_DAY#")) return "TIME_OF_DAY";

    if (REAL_LITERAL.matcher(e).matches()) return "REAL";
    if (INT_LITERAL.matcher(e).matches()) return "INT";
    if (BASED_LITERAL.matcher(e).matches()) return "INT";

    Matcher typed = TYPED_LITERAL.matcher(e);
    if (typed.matches() && TypeFamily.of(typed.group(1)) != null) return Keywords.upper(typed.group(1));

    if (IDENTIFIER.matcher(e).matches()) {
      Symbol s = scope.get(Symbol.normalize(e));
      if (s != null && s.getDataType() != null && !s.getKind().isPou()) return Keywords.upper(s.getDataType());
      return null;
    }

    if (upper.startsWith("NOT ")) return "BOOL";
    return null;
  }
}
