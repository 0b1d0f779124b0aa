package se.alipsa.stpls.st.nav;

import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.TokenUtil;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Range;
import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.core.model.SymbolKind;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.symbols.StDocument;
import se.alipsa.stpls.st.xref.FbMember;
import se.alipsa.stpls.st.xref.FbMemberSchema;
import se.alipsa.stpls.st.xref.InstanceBinding;
import se.alipsa.stpls.st.xref.MemberHit;
import se.alipsa.stpls.st.xref.MemberResolver;

import java.util.Optional;

/** Markdown hover text for symbols, function block members and standard library names. */
public final class HoverBuilder {

  private final StDocument doc;
  private final MemberResolver members;
  private final SymbolLookup lookup;

  public HoverBuilder(CoreQuery core, StDocument doc) {
    this.doc = doc;
    this.members = new MemberResolver(core, doc);
    this.lookup = new SymbolLookup(core, doc);
  }

  public Optional<String> hover(Position position) {
    CodeView view = doc.getView();
    if (position.line < 0 || position.line >= view.lineCount()) return Optional.empty();
    String code = view.code(position.line);
    Range range = TokenUtil.wordRange(code, position.line, position.column);
    if (range == null) return Optional.empty();
    String word = code.substring(range.start.column, range.end.column);

    Optional<MemberHit> hit = members.resolveAt(position);
    if (hit.isPresent()) {
      MemberHit h = hit.get();
      if (h.getMember().isPresent()) return Optional.of(member(h.getMember().get()));
      if (h.getBinding().isPresent()) return Optional.of(instance(h.getBinding().get()));
    }

    if (FbMemberSchema.isStandard(word)) return Optional.of(standardBlock(word));
    if (Keywords.isStandardFunction(word)) return Optional.of("**" + Keywords.upper(word) + "**: standard function");
    if (Keywords.isKnown(word)) return Optional.empty();
    return lookup.lookup(word, position.line).map(HoverBuilder::symbol);
  }

  static String member(FbMember m) {
    StringBuilder sb = new StringBuilder();
    sb.append('(').append(m.getDirection().label()).append(") **").append(m.getName()).append("**");
    if (m.getDataType() != null) sb.append(": `").append(m.getDataType()).append('`');
    if (m.getDescription() != null) sb.append("\n\n").append(m.getDescription());
    sb.append("\n\n*Member of `").append(m.getFbType()).append("`*");
    return sb.toString();
  }

  private static String instance(InstanceBinding b) {
    StringBuilder sb = new StringBuilder(symbol(b.getSymbol()));
    FbMemberSchema.title(b.getFbType()).ifPresent(t -> sb.append("\n\n").append(b.getFbType()).append(": ").append(t));
    return sb.toString();
  }

  private static String standardBlock(String type) {
    String upper = Keywords.upper(type);
    StringBuilder sb = new StringBuilder("**").append(upper).append("**");
    FbMemberSchema.title(upper).ifPresent(t -> sb.append(": ").append(t));
    sb.append("\n");
    for (FbMember m : FbMemberSchema.members(upper)) {
      sb.append("\n- `").append(m.getName()).append("`: `").append(m.getDataType()).append("` (")
          .append(m.getDirection().label()).append(") ").append(m.getDescription());
    }
    return sb.toString();
  }

  static String symbol(Symbol s) {
    StringBuilder sb = new StringBuilder();
    if (s.getKind().isPou()) {
      sb.append('(').append(s.getKind().displayName()).append(") **").append(s.getName()).append("**");
      if (s.getDataType() != null) sb.append(": `").append(s.getDataType()).append('`');
      if (!s.getParameters().isEmpty()) {
        sb.append('\n');
        for (Symbol p : s.getParameters()) {
          sb.append("\n- `").append(p.getName()).append("`: `").append(p.getDataType()).append("` (")
              .append(p.getScope().name().toLowerCase(java.util.Locale.ROOT).replace('_', '-')).append(')');
        }
      }
      return sb.toString();
    }
    sb.append('(').append(s.getKind().displayName()).append(") **").append(s.getName()).append("**");
    if (s.getDataType() != null) sb.append(": `").append(s.getDataType()).append('`');
    if (s.getKind() == SymbolKind.TYPE && s.getDataType() == null && s.getDescription() != null) {
      sb.append(": ").append(s.getDescription());
    } else if (s.getDescription() != null) {
      sb.append("\n\n").append(s.getDescription());
    }
    if (s.hasParent()) sb.append("\n\n*Declared in `").append(s.getParentSymbol()).append("`*");
    return sb.toString();
  }
}
