package se.alipsa.stpls.st.xref;

import se.alipsa.stpls.core.model.Symbol;

import java.util.Objects;

/**
 * A name bound to a function block type. STRICT when the declaration is a function block
 * instance; INFERRED when a plain variable or parameter happens to be typed as a function block.
 */
public final class InstanceBinding {

  public enum Strength { STRICT, INFERRED }

  private final Strength strength;
  private final Symbol symbol;
  private final String fbType;

  InstanceBinding(Strength strength, Symbol symbol, String fbType) {
    this.strength = Objects.requireNonNull(strength, "strength");
    this.symbol = Objects.requireNonNull(symbol, "symbol");
    this.fbType = Objects.requireNonNull(fbType, "fbType");
  }

  public Strength getStrength() { return strength; }
  public Symbol getSymbol() { return symbol; }
  public String getFbType() { return fbType; }

  public boolean isStandard() {
    return FbMemberSchema.isStandard(fbType);
  }

  @Override
  public String toString() {
    return symbol.getName() + " : " + fbType + " (" + strength + ")";
  }
}
