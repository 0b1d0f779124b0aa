package se.alipsa.stpls.st.symbols;

import se.alipsa.stpls.core.model.Scope;
import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.core.model.SymbolKind;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Segmenter;
import se.alipsa.stpls.st.parse.PouRange;
import se.alipsa.stpls.st.parse.StructuralModel;
import se.alipsa.stpls.st.parse.StructuralParser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** One analyzed Structured Text file: segments, block structure and symbols. */
public final class StDocument {

  private final String uri;
  private final String text;
  private final StructuralModel model;
  private final List<Symbol> symbols;

  private StDocument(String uri, String text, StructuralModel model, List<Symbol> symbols) {
    this.uri = uri;
    this.text = text;
    this.model = model;
    this.symbols = symbols;
  }

  public static StDocument parse(String uri, String text) {
    Objects.requireNonNull(uri, "uri");
    Objects.requireNonNull(text, "text");
    CodeView view = Segmenter.segment(text);
    StructuralModel model = StructuralParser.parse(view);
    return new StDocument(uri, text, model, SymbolExtractor.extract(uri, model));
  }

  public String getUri() { return uri; }
  public String getText() { return text; }
  public StructuralModel getModel() { return model; }
  public CodeView getView() { return model.getView(); }

  /** Flat symbols in source order. */
  public List<Symbol> getSymbols() { return symbols; }

  public Optional<Symbol> pouSymbol(PouRange pou) {
    if (!pou.hasName()) return Optional.empty();
    return symbols.stream()
        .filter(s -> s.getKind() == pou.getKind() && s.isNamed(pou.getName())
            && s.getLocation().getRange().start.line == pou.getStartLine())
        .findFirst();
  }

  /** Declarations owned by a POU, in source order. */
  public List<Symbol> declarationsOf(PouRange pou) {
    List<Symbol> out = new ArrayList<>();
    if (!pou.hasName()) return out;
    for (Symbol s : symbols) {
      if (!s.getKind().isPou() && pou.getName().equalsIgnoreCase(s.getParentSymbol())
          && pou.containsLine(s.getLocation().getRange().start.line)) {
        out.add(s);
      }
    }
    return out;
  }

  /** Variables declared in VAR_GLOBAL sections or outside any POU. */
  public List<Symbol> globals() {
    List<Symbol> out = new ArrayList<>();
    for (Symbol s : symbols) {
      if (s.getKind().isPou() || s.getKind() == SymbolKind.TYPE) continue;
      if (s.getScope() == Scope.GLOBAL || !s.hasParent()) out.add(s);
    }
    return out;
  }

  public Optional<PouRange> pouAt(int line) {
    return model.pouAt(line);
  }
}
