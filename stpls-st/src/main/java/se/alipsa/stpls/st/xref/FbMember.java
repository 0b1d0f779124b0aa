package se.alipsa.stpls.st.xref;

import se.alipsa.stpls.core.model.Scope;
import se.alipsa.stpls.core.model.Symbol;

import java.util.Objects;
import java.util.Optional;

/**
 * A member reachable with {@code instance.member}: an input, output or in-out of a function block,
 * one of its internal variables, or a field of a user STRUCT.
 */
public final class FbMember {

  public enum Direction {
    INPUT, OUTPUT, IN_OUT, VAR, FIELD;

    static Direction of(Scope scope) {
      switch (scope) {
        case INPUT: return INPUT;
        case OUTPUT: return OUTPUT;
        case IN_OUT: return IN_OUT;
        default: return VAR;
      }
    }

    public String label() {
      return name().toLowerCase(java.util.Locale.ROOT).replace('_', '-');
    }
  }

  private final String name;
  private final String dataType;
  private final Direction direction;
  private final String description;
  private final String fbType;
  private final Symbol declaration;

  public FbMember(String name, String dataType, Direction direction, String description, String fbType) {
    this(name, dataType, direction, description, fbType, null);
  }

  FbMember(String name, String dataType, Direction direction, String description, String fbType, Symbol declaration) {
    this.name = Objects.requireNonNull(name, "name");
    this.dataType = dataType;
    this.direction = Objects.requireNonNull(direction, "direction");
    this.description = description;
    this.fbType = Objects.requireNonNull(fbType, "fbType");
    this.declaration = declaration;
  }

  /** A member of a user function block or STRUCT, backed by its declaration. */
  static FbMember declared(Symbol s, String ownerType, boolean structField) {
    Direction d = structField ? Direction.FIELD : Direction.of(s.getScope());
    return new FbMember(s.getName(), s.getDataType(), d, s.getDescription(), ownerType, s);
  }

  public String getName() { return name; }
  public String getDataType() { return dataType; }
  public Direction getDirection() { return direction; }
  public String getDescription() { return description; }
  public String getFbType() { return fbType; }

  /** The source declaration; empty for members of the standard function blocks. */
  public Optional<Symbol> getDeclaration() { return Optional.ofNullable(declaration); }

  public boolean isNamed(String other) {
    return name.equalsIgnoreCase(other);
  }

  @Override
  public String toString() {
    return fbType + "." + name + " : " + dataType + " (" + direction + ")";
  }
}
