package se.alipsa.stpls.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A named declaration in a Structured Text document: a POU, a variable, a parameter, an
 * instance of a function block or a user data type.
 * <p>
 * Identifiers are case-insensitive, so lookups go through {@link #getNormalizedName()} which is
 * always derived from the display name and never supplied by callers.
 */
public final class Symbol {

  private final String name;
  private final String normalizedName;
  private final SymbolKind kind;
  private final Scope scope;
  private final String dataType;       // may name another symbol (FB type, struct, alias)
  private final Location location;     // range of the name token
  private final String parentSymbol;   // owning POU, "" when global
  private final List<Symbol> parameters;
  private final List<Symbol> members;
  private final String description;

  public Symbol(String name, SymbolKind kind, Scope scope, String dataType, Location location,
                String parentSymbol) {
    this(name, kind, scope, dataType, location, parentSymbol, List.of(), List.of(), null);
  }

  public Symbol(String name, SymbolKind kind, Scope scope, String dataType, Location location,
                String parentSymbol, List<Symbol> parameters, List<Symbol> members, String description) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("Symbol name must not be blank");
    this.normalizedName = normalize(name);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.scope = Objects.requireNonNull(scope, "scope");
    this.dataType = dataType == null || dataType.isBlank() ? null : dataType.trim();
    if (kind == SymbolKind.FUNCTION_BLOCK_INSTANCE && this.dataType == null) {
      throw new IllegalArgumentException("Function block instance '" + name + "' has no data type");
    }
    this.location = Objects.requireNonNull(location, "location");
    this.parentSymbol = parentSymbol == null ? "" : parentSymbol;
    this.parameters = List.copyOf(parameters);
    this.members = List.copyOf(members);
    this.description = description;
  }

  public static String normalize(String identifier) {
    return identifier.toLowerCase(Locale.ROOT);
  }

  /** Copy of this symbol with the given parameter and member lists. */
  public Symbol withChildren(List<Symbol> newParameters, List<Symbol> newMembers) {
    return new Symbol(name, kind, scope, dataType, location, parentSymbol, newParameters, newMembers, description);
  }

  public String getName() { return name; }
  public String getNormalizedName() { return normalizedName; }
  public SymbolKind getKind() { return kind; }
  public Scope getScope() { return scope; }
  public String getDataType() { return dataType; }
  public Location getLocation() { return location; }
  public String getParentSymbol() { return parentSymbol; }
  public boolean hasParent() { return !parentSymbol.isEmpty(); }
  public List<Symbol> getParameters() { return parameters; }
  public List<Symbol> getMembers() { return members; }
  public String getDescription() { return description; }

  public boolean isNamed(String other) {
    return other != null && name.equalsIgnoreCase(other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Symbol that)) return false;
    return normalizedName.equals(that.normalizedName)
        && name.equals(that.name)
        && kind == that.kind
        && scope == that.scope
        && Objects.equals(dataType, that.dataType)
        && location.equals(that.location)
        && parentSymbol.equals(that.parentSymbol)
        && parameters.equals(that.parameters)
        && members.equals(that.members)
        && Objects.equals(description, that.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(normalizedName, kind, scope, dataType, location, parentSymbol);
  }

  @Override
  public String toString() {
    return kind + " " + (parentSymbol.isEmpty() ? "" : parentSymbol + ".") + name
        + (dataType == null ? "" : " : " + dataType) + " @" + location;
  }
}
