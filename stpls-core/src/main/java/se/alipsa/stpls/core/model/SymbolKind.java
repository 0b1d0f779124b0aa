package se.alipsa.stpls.core.model;

public enum SymbolKind {
  PROGRAM,
  FUNCTION,
  FUNCTION_BLOCK,
  VARIABLE,
  FUNCTION_BLOCK_INSTANCE,
  PARAMETER,
  CONSTANT,
  TYPE;

  /** Program organization units: the blocks that own VAR sections and a body. */
  public boolean isPou() {
    return this == PROGRAM || this == FUNCTION || this == FUNCTION_BLOCK;
  }

  public String displayName() {
    return name().toLowerCase(java.util.Locale.ROOT).replace('_', ' ');
  }
}
