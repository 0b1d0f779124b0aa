package se.alipsa.stpls.st.xref;

import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.core.model.SymbolKind;
import se.alipsa.stpls.st.lex.Keywords;
import se.alipsa.stpls.st.parse.PouRange;
import se.alipsa.stpls.st.symbols.StDocument;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code instance.member} against the standard function block schema, the user function
 * blocks and STRUCT types of the workspace. Names declared in the current document win over the
 * index, and inside a POU its own declarations win over everything else.
 */
public final class MemberResolver {

  private static final Pattern LEADING_TYPE = Pattern.compile("^\\s*([A-Za-z_]\\w*)");

  private final CoreQuery core;
  private final StDocument doc;

  public MemberResolver(CoreQuery core, StDocument doc) {
    this.core = core;
    this.doc = doc;
  }

  public Optional<InstanceBinding> bindInstance(String name) {
    return bindInstance(name, null);
  }

  /** Binds {@code name} as seen from inside {@code owner} (a POU name, may be null). */
  public Optional<InstanceBinding> bindInstance(String name, String owner) {
    for (Symbol s : candidates(name, owner)) {
      String type = baseType(s.getDataType());
      if (type == null) continue;
      if (s.getKind() == SymbolKind.FUNCTION_BLOCK_INSTANCE) {
        return Optional.of(new InstanceBinding(InstanceBinding.Strength.STRICT, s, type));
      }
      if ((s.getKind() == SymbolKind.VARIABLE || s.getKind() == SymbolKind.PARAMETER)
          && (FbMemberSchema.isStandard(type) || functionBlock(type).isPresent())) {
        return Optional.of(new InstanceBinding(InstanceBinding.Strength.INFERRED, s, type));
      }
    }
    return Optional.empty();
  }

  public Optional<FbMember> resolve(String instance, String member) {
    return resolve(instance, member, null);
  }

  public Optional<FbMember> resolve(String instance, String member, String owner) {
    Optional<InstanceBinding> binding = bindInstance(instance, owner);
    if (binding.isPresent()) return resolveMember(binding.get().getFbType(), member);

    for (Symbol s : candidates(instance, owner)) {
      if (s.getKind().isPou() || s.getKind() == SymbolKind.TYPE) continue;
      String type = baseType(s.getDataType());
      if (type != null && struct(type).isPresent()) return resolveMember(type, member);
    }
    return Optional.empty();
  }

  /** Member {@code member} of a standard FB, user FB or STRUCT type. */
  public Optional<FbMember> resolveMember(String type, String member) {
    return availableMembers(type).stream().filter(m -> m.isNamed(member)).findFirst();
  }

  /** Everything reachable after {@code <instance of type>.}; parameters first for user FBs. */
  public List<FbMember> availableMembers(String type) {
    if (type == null) return List.of();
    if (FbMemberSchema.isStandard(type)) return FbMemberSchema.members(type);

    List<FbMember> out = new ArrayList<>();
    Optional<Symbol> fb = functionBlock(type);
    if (fb.isPresent()) {
      Symbol block = fb.get();
      for (Symbol p : block.getParameters()) out.add(FbMember.declared(p, block.getName(), false));
      for (Symbol m : block.getMembers()) {
        if (!m.getScope().isParameter()) out.add(FbMember.declared(m, block.getName(), false));
      }
      return out;
    }
    struct(type).ifPresent(st -> {
      for (Symbol f : st.getMembers()) out.add(FbMember.declared(f, st.getName(), true));
    });
    return out;
  }

  /** Member access under the cursor, resolved against the part the cursor is on. */
  public Optional<MemberHit> resolveAt(Position position) {
    Optional<MemberAccess> found = MemberAccessScanner.at(doc.getView(), position);
    if (found.isEmpty()) return Optional.empty();
    MemberAccess access = found.get();
    String owner = doc.pouAt(position.line).filter(PouRange::hasName).map(PouRange::getName).orElse(null);
    if (access.onMember(position)) {
      return resolve(access.getInstance(), access.getMember(), owner)
          .map(m -> new MemberHit(access, null, m));
    }
    return bindInstance(access.getInstance(), owner).map(b -> new MemberHit(access, b, null));
  }

  /** Declared type of a variable, as seen from inside {@code owner}. */
  public Optional<String> typeOf(String name, String owner) {
    for (Symbol s : candidates(name, owner)) {
      if (s.getKind().isPou() || s.getKind() == SymbolKind.TYPE) continue;
      String type = baseType(s.getDataType());
      if (type != null) return Optional.of(type);
    }
    return Optional.empty();
  }

  Optional<Symbol> functionBlock(String type) {
    for (Symbol s : doc.getSymbols()) {
      if (s.getKind() == SymbolKind.FUNCTION_BLOCK && s.isNamed(type)) return Optional.of(s);
    }
    return core.findFirst(type, SymbolKind.FUNCTION_BLOCK);
  }

  Optional<Symbol> struct(String type) {
    for (Symbol s : doc.getSymbols()) {
      if (isStruct(s) && s.isNamed(type)) return Optional.of(s);
    }
    return core.findByName(type).stream().filter(MemberResolver::isStruct).findFirst();
  }

  private static boolean isStruct(Symbol s) {
    return s.getKind() == SymbolKind.TYPE && "STRUCT".equalsIgnoreCase(s.getDataType());
  }

  /** Declarations named {@code name}: the owner's first, then the rest of the document, then the index. */
  private List<Symbol> candidates(String name, String owner) {
    List<Symbol> own = new ArrayList<>();
    List<Symbol> other = new ArrayList<>();
    for (Symbol s : doc.getSymbols()) {
      if (!s.isNamed(name)) continue;
      if (owner != null && owner.equalsIgnoreCase(s.getParentSymbol())) own.add(s);
      else other.add(s);
    }
    own.addAll(other);
    for (Symbol s : core.findByName(name)) {
      if (!own.contains(s)) own.add(s);
    }
    return own;
  }

  /** {@code TON} for {@code TON}, {@code ton := ...} or {@code STRING(20)}; null for ARRAY, POINTER and REFERENCE types. */
  static String baseType(String dataType) {
    if (dataType == null) return null;
    Matcher m = LEADING_TYPE.matcher(dataType);
    if (!m.find()) return null;
    String t = m.group(1);
    String u = Keywords.upper(t);
    if (u.equals("ARRAY") || u.equals("POINTER") || u.equals("REFERENCE") || u.equals("REF_TO")) return null;
    return t;
  }
}
