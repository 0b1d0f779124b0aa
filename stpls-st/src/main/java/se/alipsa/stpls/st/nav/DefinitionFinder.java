package se.alipsa.stpls.st.nav;

import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.lex.Word;
import se.alipsa.stpls.st.symbols.StDocument;
import se.alipsa.stpls.st.xref.MemberHit;
import se.alipsa.stpls.st.xref.MemberResolver;

import java.util.Optional;

/**
 * Go to definition. On {@code inst.member} the member's declaration (or the instance's, for the
 * standard function blocks which have no source); elsewhere the identifier under the cursor, or
 * failing that the closest one on the line within {@code maxDistance} columns.
 */
public final class DefinitionFinder {

  private final StDocument doc;
  private final MemberResolver members;
  private final SymbolLookup lookup;
  private final int maxDistance;

  public DefinitionFinder(CoreQuery core, StDocument doc, int maxDistance) {
    this.doc = doc;
    this.members = new MemberResolver(core, doc);
    this.lookup = new SymbolLookup(core, doc);
    this.maxDistance = maxDistance;
  }

  public Optional<Symbol> find(Position position) {
    CodeView view = doc.getView();
    if (position.line < 0 || position.line >= view.lineCount()) return Optional.empty();

    Optional<MemberHit> hit = members.resolveAt(position);
    if (hit.isPresent()) {
      MemberHit h = hit.get();
      if (h.getMember().isPresent()) {
        Optional<Symbol> declared = h.getMember().get().getDeclaration();
        if (declared.isPresent()) return declared;
        String owner = doc.pouAt(position.line).map(p -> p.getName()).orElse(null);
        return members.bindInstance(h.getAccess().getInstance(), owner).map(b -> b.getSymbol());
      }
      if (h.getBinding().isPresent()) return Optional.of(h.getBinding().get().getSymbol());
    }

    Word word = wordAt(view.code(position.line), position.column);
    if (word == null || Keywords.isKnown(word.getText())) return Optional.empty();
    return lookup.lookup(word.getText(), position.line);
  }

  /** The identifier touching {@code column}, else the nearest within range; ties go left. */
  Word wordAt(String code, int column) {
    Word best = null;
    int bestDistance = Integer.MAX_VALUE;
    for (Word w : Word.scan(code)) {
      int distance;
      if (column < w.getStart()) distance = w.getStart() - column;
      else if (column > w.getEnd()) distance = column - w.getEnd();
      else distance = 0;
      if (distance < bestDistance) {
        best = w;
        bestDistance = distance;
      }
    }
    return bestDistance <= maxDistance ? best : null;
  }
}
