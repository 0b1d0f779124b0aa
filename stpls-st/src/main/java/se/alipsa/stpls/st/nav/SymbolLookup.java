package se.alipsa.stpls.st.nav;

import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.model.Scope;
import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.core.model.SymbolKind;
import se.alipsa.stpls.st.parse.PouRange;
import se.alipsa.stpls.st.symbols.StDocument;

import java.util.List;
import java.util.Optional;

/** Scope-aware name lookup shared by definition and hover. */
final class SymbolLookup {

  private final CoreQuery core;
  private final StDocument doc;

  SymbolLookup(CoreQuery core, StDocument doc) {
    this.core = core;
    this.doc = doc;
  }

  /**
   * Declaration of {@code name} as seen from {@code line}: the enclosing POU's own declarations,
   * then POUs, types and globals of this file, then the same in the index, then anything with the
   * name, and finally enum values and STRUCT fields.
   */
  Optional<Symbol> lookup(String name, int line) {
    Optional<PouRange> pou = doc.pouAt(line);
    if (pou.isPresent()) {
      for (Symbol s : doc.declarationsOf(pou.get())) {
        if (s.isNamed(name)) return Optional.of(s);
      }
    }
    for (Symbol s : doc.getSymbols()) {
      if (s.isNamed(name) && isVisibleEverywhere(s)) return Optional.of(s);
    }
    List<Symbol> indexed = core.findByName(name);
    for (Symbol s : indexed) {
      if (isVisibleEverywhere(s)) return Optional.of(s);
    }
    if (!indexed.isEmpty()) return Optional.of(indexed.get(0));
    for (Symbol s : doc.getSymbols()) {
      if (s.isNamed(name)) return Optional.of(s);
    }
    return typeMember(doc.getSymbols(), name).or(() -> typeMember(core.allSymbols(), name));
  }

  private static boolean isVisibleEverywhere(Symbol s) {
    return s.getKind().isPou() || s.getKind() == SymbolKind.TYPE || s.getScope() == Scope.GLOBAL || !s.hasParent();
  }

  private static Optional<Symbol> typeMember(List<Symbol> symbols, String name) {
    for (Symbol s : symbols) {
      if (s.getKind() != SymbolKind.TYPE) continue;
      for (Symbol m : s.getMembers()) {
        if (m.isNamed(name)) return Optional.of(m);
      }
    }
    return Optional.empty();
  }
}
