package se.alipsa.stpls.st.rename;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.DocumentStore;
import se.alipsa.stpls.core.RenameException;
import se.alipsa.stpls.core.TokenUtil;
import se.alipsa.stpls.core.model.*;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.lex.Segmenter;
import se.alipsa.stpls.st.lex.Word;
import se.alipsa.stpls.st.symbols.StDocument;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Workspace-wide rename by name. Every whole-word, case-insensitive occurrence outside comments
 * and string literals is replaced, in the current document and in every indexed file. Every indexed
 * file must have its text in the document store; otherwise the rename fails as a whole.
 */
public final class RenameEngine {

  private static final Logger log = LoggerFactory.getLogger(RenameEngine.class);
  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

  private final CoreQuery core;

  public RenameEngine(CoreQuery core) {
    this.core = core;
  }

  public RenameTarget prepare(StDocument doc, Position position) throws RenameException {
    CodeView view = doc.getView();
    if (position.line < 0 || position.line >= view.lineCount()) {
      throw new RenameException("Cannot rename at this position");
    }
    String raw = view.raw(position.line);
    Range range = TokenUtil.wordRange(raw, position.line, position.column);
    if (range == null) throw new RenameException("Cannot rename at this position");
    String word = raw.substring(range.start.column, range.end.column);
    if (!IDENTIFIER.matcher(word).matches()) throw new RenameException("Cannot rename at this position");

    if (Keywords.isBuiltIn(word)) throw new RenameException("Cannot rename built-in \"" + word + "\"");
    if (view.isInComment(position.line, range.start.column)) {
      throw new RenameException("Cannot rename inside a comment");
    }
    if (view.isInString(position.line, range.start.column)) {
      throw new RenameException("Cannot rename inside a string literal");
    }
    if (view.isInPragma(position.line, range.start.column)) {
      throw new RenameException("Cannot rename inside a pragma");
    }
    if (!isDeclared(doc, word)) throw new RenameException("Symbol \"" + word + "\" not found");
    return new RenameTarget(range, word);
  }

  public WorkspaceEdit rename(StDocument doc, Position position, String newName, DocumentStore documents)
      throws RenameException {
    RenameTarget target = prepare(doc, position);
    String oldName = target.getPlaceholder();
    validate(newName);
    if (oldName.equalsIgnoreCase(newName)) return WorkspaceEdit.empty();

    Map<String, String> texts = new LinkedHashMap<>();
    texts.put(doc.getUri(), doc.getText());
    for (String uri : core.fileUris()) {
      if (!texts.containsKey(uri)) texts.put(uri, textOf(uri, documents));
    }

    WorkspaceEdit edit = new WorkspaceEdit();
    for (Map.Entry<String, String> e : texts.entrySet()) {
      CodeView view = e.getKey().equals(doc.getUri()) ? doc.getView() : Segmenter.segment(e.getValue());
      for (Range r : occurrences(view, oldName)) edit.add(e.getKey(), new TextEdit(r, newName));
    }
    log.debug("Rename {} -> {}: {} edits in {} files", oldName, newName, edit.editCount(), edit.getChanges().size());
    return edit;
  }

  static void validate(String newName) throws RenameException {
    if (newName == null || !IDENTIFIER.matcher(newName).matches()) {
      throw new RenameException("\"" + newName + "\" is not a valid IEC 61131-3 identifier");
    }
    if (Keywords.isKeyword(newName)) throw new RenameException("\"" + newName + "\" is a reserved keyword");
    if (Keywords.isDataType(newName)) throw new RenameException("\"" + newName + "\" is a reserved data type");
    if (Keywords.isStandardFunction(newName)) {
      throw new RenameException("\"" + newName + "\" is a standard function name");
    }
  }

  /** Whole-word matches in code, skipping typed literal parts such as the {@code T} of {@code T#5s}. */
  static List<Range> occurrences(CodeView view, String name) {
    List<Range> out = new ArrayList<>();
    for (int line = 0; line < view.lineCount(); line++) {
      String code = view.code(line);
      for (Word w : Word.scan(code)) {
        if (!w.is(name)) continue;
        if (w.after(code) == '#' || w.before(code) == '#' || w.before(code) == '%') continue;
        out.add(Range.of(line, w.getStart(), w.getText().length()));
      }
    }
    return out;
  }

  private boolean isDeclared(StDocument doc, String word) {
    if (!core.findByName(word).isEmpty()) return true;
    List<Symbol> all = new ArrayList<>(doc.getSymbols());
    all.addAll(core.allSymbols());
    for (Symbol s : all) {
      if (s.isNamed(word)) return true;
      if (s.getKind() == SymbolKind.TYPE) {
        for (Symbol m : s.getMembers()) {
          if (m.isNamed(word)) return true;
        }
      }
    }
    return false;
  }

  private static String textOf(String uri, DocumentStore documents) throws RenameException {
    String text = documents == null ? null : documents.get(uri);
    if (text == null) {
      log.warn("No open text for indexed file {}; rejecting rename", uri);
      throw new RenameException("Cannot read " + uri + "; rename aborted");
    }
    return text;
  }
}
