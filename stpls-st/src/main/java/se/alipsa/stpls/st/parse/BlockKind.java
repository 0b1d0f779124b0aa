package se.alipsa.stpls.st.parse;

/** Families of block constructs that share the one block stack. */
public enum BlockKind {
  POU,
  CONTROL_FLOW,
  VAR_SECTION,
  DATA_TYPE
}
