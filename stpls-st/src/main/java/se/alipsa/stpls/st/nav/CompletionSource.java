package se.alipsa.stpls.st.nav;

import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.model.CompletionItem;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Scope;
import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.parse.PouRange;
import se.alipsa.stpls.st.symbols.StDocument;
import se.alipsa.stpls.st.xref.FbMember;
import se.alipsa.stpls.st.xref.FbMemberSchema;
import se.alipsa.stpls.st.xref.InstanceBinding;
import se.alipsa.stpls.st.xref.MemberResolver;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Completion: the members of the instance after {@code inst.}, otherwise visible symbols,
 * standard types and functions and keywords that start with the typed prefix.
 */
public final class CompletionSource {

  private static final Pattern MEMBER_PREFIX = Pattern.compile("([A-Za-z_]\\w*)\\.(\\w*)$");
  private static final Pattern WORD_PREFIX = Pattern.compile("(\\w*)$");

  private final CoreQuery core;
  private final StDocument doc;
  private final MemberResolver members;

  public CompletionSource(CoreQuery core, StDocument doc) {
    this.core = core;
    this.doc = doc;
    this.members = new MemberResolver(core, doc);
  }

  public List<CompletionItem> complete(Position position) {
    CodeView view = doc.getView();
    if (position.line < 0 || position.line >= view.lineCount()) return List.of();
    String code = view.code(position.line);
    String before = code.substring(0, Math.min(Math.max(position.column, 0), code.length()));
    Optional<PouRange> pou = doc.pouAt(position.line).filter(PouRange::hasName);
    String owner = pou.map(PouRange::getName).orElse(null);

    Matcher m = MEMBER_PREFIX.matcher(before);
    if (m.find()) return memberItems(m.group(1), m.group(2), owner);

    Matcher w = WORD_PREFIX.matcher(before);
    String prefix = w.find() ? w.group(1) : "";
    if (!prefix.isEmpty() && Character.isDigit(prefix.charAt(0))) return List.of();
    return globalItems(prefix, pou);
  }

  private List<CompletionItem> memberItems(String instance, String prefix, String owner) {
    String type = members.bindInstance(instance, owner).map(InstanceBinding::getFbType)
        .or(() -> members.typeOf(instance, owner))
        .orElse(null);
    List<CompletionItem> out = new ArrayList<>();
    for (FbMember fm : members.availableMembers(type)) {
      if (!startsWith(fm.getName(), prefix)) continue;
      out.add(new CompletionItem(fm.getName(), CompletionItem.Kind.FIELD,
          fm.getDirection().label() + ": " + fm.getDataType(), fm.getDescription(),
          fm.getDeclaration().map(Symbol::getLocation).orElse(null)));
    }
    return out;
  }

  private List<CompletionItem> globalItems(String prefix, Optional<PouRange> pou) {
    Map<String, CompletionItem> byName = new LinkedHashMap<>();
    pou.ifPresent(p -> doc.declarationsOf(p).forEach(s -> addSymbol(byName, s, prefix)));
    for (Symbol s : doc.getSymbols()) {
      if (isGlobal(s)) addSymbol(byName, s, prefix);
    }
    for (Symbol s : core.allSymbols()) {
      if (isGlobal(s)) addSymbol(byName, s, prefix);
    }

    for (String t : FbMemberSchema.types()) {
      add(byName, new CompletionItem(t, CompletionItem.Kind.FUNCTION_BLOCK,
          FbMemberSchema.title(t).orElse("function block")), prefix);
    }
    for (String t : new TreeSet<>(Keywords.DATA_TYPES)) {
      add(byName, new CompletionItem(t, CompletionItem.Kind.TYPE, "data type"), prefix);
    }
    for (String f : new TreeSet<>(Keywords.STANDARD_FUNCTIONS)) {
      add(byName, new CompletionItem(f, CompletionItem.Kind.FUNCTION, "standard function"), prefix);
    }
    for (String k : Keywords.completionKeywords()) {
      add(byName, new CompletionItem(k, CompletionItem.Kind.KEYWORD, "keyword"), prefix);
    }
    return List.copyOf(byName.values());
  }

  private static boolean isGlobal(Symbol s) {
    return s.getKind().isPou() || s.getScope() == Scope.GLOBAL || !s.hasParent();
  }

  private static void addSymbol(Map<String, CompletionItem> byName, Symbol s, String prefix) {
    CompletionItem.Kind kind;
    switch (s.getKind()) {
      case PROGRAM: kind = CompletionItem.Kind.PROGRAM; break;
      case FUNCTION: kind = CompletionItem.Kind.FUNCTION; break;
      case FUNCTION_BLOCK: kind = CompletionItem.Kind.FUNCTION_BLOCK; break;
      case TYPE: kind = CompletionItem.Kind.TYPE; break;
      default: kind = CompletionItem.Kind.VARIABLE;
    }
    String detail = s.getDataType() == null ? s.getKind().displayName() : s.getDataType();
    add(byName, new CompletionItem(s.getName(), kind, detail, HoverBuilder.symbol(s), s.getLocation()), prefix);
  }

  private static void add(Map<String, CompletionItem> byName, CompletionItem item, String prefix) {
    if (startsWith(item.getLabel(), prefix)) byName.putIfAbsent(Keywords.upper(item.getLabel()), item);
  }

  private static boolean startsWith(String label, String prefix) {
    return label.regionMatches(true, 0, prefix, 0, prefix.length());
  }
}
