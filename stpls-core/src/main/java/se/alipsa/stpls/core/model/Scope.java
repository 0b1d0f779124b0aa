package se.alipsa.stpls.core.model;

/** Where a declaration lives, derived from the VAR section keyword that holds it. */
public enum Scope {
  LOCAL,
  INPUT,
  OUTPUT,
  IN_OUT,
  GLOBAL,
  TEMP,
  EXTERNAL;

  public boolean isParameter() {
    return this == INPUT || this == OUTPUT || this == IN_OUT;
  }
}
