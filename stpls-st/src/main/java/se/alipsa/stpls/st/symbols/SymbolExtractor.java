package se.alipsa.stpls.st.symbols;

import se.alipsa.stpls.core.model.*;
import se.alipsa.stpls.st.lex.CodeView;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.parse.*;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the declaration sections of a parsed document into symbols. Output is a pure function
 * of the text: POUs, TYPE definitions and declared variables in source order.
 */
public final class SymbolExtractor {

  private static final Pattern STRUCT_HEAD = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*:\\s*$");
  private static final Pattern ENUM = Pattern.compile(
      "^\\s*([A-Za-z_]\\w*)\\s*:\\s*\\((.*)\\)\\s*(?:[A-Za-z_]\\w*)?\\s*(?::=.*)?$", Pattern.DOTALL);
  private static final Pattern ENUM_VALUE = Pattern.compile("([A-Za-z_]\\w*)\\s*(?::=\\s*[^,]*)?");

  static final Comparator<Symbol> BY_POSITION = Comparator
      .<Symbol>comparingInt(s -> s.getLocation().getRange().start.line)
      .thenComparingInt(s -> s.getLocation().getRange().start.column);

  private final String uri;
  private final StructuralModel model;
  private final CodeView view;
  private final Set<String> localFbTypes = new HashSet<>();

  private SymbolExtractor(String uri, StructuralModel model) {
    this.uri = uri;
    this.model = model;
    this.view = model.getView();
    for (PouRange p : model.getPous()) {
      if (p.hasName() && p.getKind() == SymbolKind.FUNCTION_BLOCK) localFbTypes.add(Keywords.upper(p.getName()));
    }
  }

  public static List<Symbol> extract(String uri, StructuralModel model) {
    return new SymbolExtractor(uri, model).run();
  }

  private List<Symbol> run() {
    List<Symbol> flat = new ArrayList<>();
    Map<VarSectionRange, List<Symbol>> bySection = new LinkedHashMap<>();
    for (VarSectionRange section : model.getVarSections()) {
      List<Symbol> decls = declarations(section);
      bySection.put(section, decls);
      flat.addAll(decls);
    }

    for (PouRange pou : model.getPous()) {
      if (!pou.hasName()) continue;
      List<Symbol> members = new ArrayList<>();
      for (VarSectionRange section : model.varSectionsOf(pou)) {
        members.addAll(bySection.getOrDefault(section, List.of()));
      }
      members.sort(BY_POSITION);
      List<Symbol> params = new ArrayList<>();
      for (Symbol m : members) {
        if (m.getScope().isParameter()) params.add(m);
      }
      Range nameRange = Range.of(pou.getNamePosition().line, pou.getNamePosition().column, pou.getName().length());
      flat.add(new Symbol(pou.getName(), pou.getKind(), Scope.GLOBAL, pou.getReturnType(),
          new Location(uri, nameRange), "", params, members, null));
    }

    for (TypeBlockRange block : model.getTypeBlocks()) {
      flat.addAll(types(block));
    }

    flat.sort(BY_POSITION);
    return List.copyOf(flat);
  }

  private List<Symbol> declarations(VarSectionRange section) {
    List<Symbol> out = new ArrayList<>();
    String parent = section.getOwner() == null ? "" : section.getOwner();
    List<Statement> statements = new StatementSplitter(view).split(section.getInnerStart(), section.getInnerEnd());
    for (Statement st : statements) {
      Declaration d = Declaration.parse(st);
      if (d == null) continue;
      SymbolKind kind = kindOf(section, d);
      String description = d.initialValue == null ? null : "Initial value: " + d.initialValue;
      for (Declaration.Name n : d.names) {
        if (Keywords.isKeyword(n.text)) continue;
        out.add(new Symbol(n.text, kind, section.scope(), d.dataType, new Location(uri, n.range), parent,
            List.of(), List.of(), description));
      }
    }
    return out;
  }

  private SymbolKind kindOf(VarSectionRange section, Declaration d) {
    if (section.isConstant()) return SymbolKind.CONSTANT;
    String base = d.baseType();
    if (base != null && (Keywords.isStandardFunctionBlock(base) || localFbTypes.contains(Keywords.upper(base)))) {
      return SymbolKind.FUNCTION_BLOCK_INSTANCE;
    }
    if (section.scope().isParameter()) return SymbolKind.PARAMETER;
    return SymbolKind.VARIABLE;
  }

  private List<Symbol> types(TypeBlockRange block) {
    List<Symbol> out = new ArrayList<>();
    List<Statement> statements = new StatementSplitter(view, Set.of("STRUCT", "END_STRUCT"))
        .split(block.getInnerStart(), block.getInnerEnd());

    Statement pendingHead = null;
    String structName = null;
    Range structRange = null;
    List<Symbol> fields = new ArrayList<>();

    for (Statement st : statements) {
      if (st.isMarker()) {
        if ("STRUCT".equals(st.getMarker()) && pendingHead != null && structName == null) {
          Matcher m = STRUCT_HEAD.matcher(pendingHead.getText());
          if (m.matches()) {
            structName = m.group(1);
            structRange = pendingHead.rangeOf(m.start(1), structName.length());
            fields = new ArrayList<>();
          }
        } else if ("END_STRUCT".equals(st.getMarker()) && structName != null) {
          out.add(new Symbol(structName, SymbolKind.TYPE, Scope.GLOBAL, "STRUCT", new Location(uri, structRange),
              "", List.of(), fields, null));
          structName = null;
        }
        pendingHead = null;
        continue;
      }

      if (structName != null) {
        Declaration d = Declaration.parse(st);
        if (d == null) continue;
        for (Declaration.Name n : d.names) {
          fields.add(new Symbol(n.text, SymbolKind.VARIABLE, Scope.LOCAL, d.dataType, new Location(uri, n.range),
              structName, List.of(), List.of(), d.initialValue == null ? null : "Initial value: " + d.initialValue));
        }
        continue;
      }

      if (STRUCT_HEAD.matcher(st.getText()).matches()) {
        pendingHead = st;
        continue;
      }

      Matcher e = ENUM.matcher(st.getText());
      if (e.matches()) {
        String name = e.group(1);
        List<Symbol> values = new ArrayList<>();
        Matcher v = ENUM_VALUE.matcher(st.getText());
        v.region(e.start(2), e.end(2));
        while (v.find()) {
          values.add(new Symbol(v.group(1), SymbolKind.CONSTANT, Scope.GLOBAL, name,
              new Location(uri, st.rangeOf(v.start(1), v.group(1).length())), name));
        }
        out.add(new Symbol(name, SymbolKind.TYPE, Scope.GLOBAL, null,
            new Location(uri, st.rangeOf(e.start(1), name.length())), "", List.of(), values, "Enumeration"));
        continue;
      }

      Declaration alias = Declaration.parse(st);
      if (alias != null && alias.names.size() == 1) {
        Declaration.Name n = alias.names.get(0);
        out.add(new Symbol(n.text, SymbolKind.TYPE, Scope.GLOBAL, alias.dataType, new Location(uri, n.range),
            "", List.of(), List.of(), null));
      }
    }
    return out;
  }

}
