package se.alipsa.stpls.st.diagnostics;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/** Assignment compatibility of elementary types, grouped in families. */
public enum TypeFamily {
  BOOL, INT, REAL, STRING, TIME, DATE;

  private static final Map<String, TypeFamily> BY_TYPE = new HashMap<>();

  static {
    BY_TYPE.put("BOOL", BOOL);
    for (String t : new String[]{"SINT", "USINT", "INT", "UINT", "DINT", "UDINT", "LINT", "ULINT",
        "BYTE", "WORD", "DWORD", "LWORD"}) {
      BY_TYPE.put(t, INT);
    }
    BY_TYPE.put("REAL", REAL);
    BY_TYPE.put("LREAL", REAL);
    for (String t : new String[]{"STRING", "WSTRING", "CHAR", "WCHAR"}) BY_TYPE.put(t, STRING);
    BY_TYPE.put("TIME", TIME);
    BY_TYPE.put("LTIME", TIME);
    for (String t : new String[]{"DATE", "LDATE", "TIME_OF_DAY", "TOD", "DATE_AND_TIME", "DT", "LDT", "LTOD"}) {
      BY_TYPE.put(t, DATE);
    }
  }

  /** Family of a declared type such as {@code INT} or {@code STRING(20)}; null for user and complex types. */
  public static TypeFamily of(String dataType) {
    if (dataType == null) return null;
    String t = dataType.trim().toUpperCase(Locale.ROOT);
    int end = 0;
    while (end < t.length() && (Character.isLetterOrDigit(t.charAt(end)) || t.charAt(end) == '_')) end++;
    return BY_TYPE.get(t.substring(0, end));
  }

  /** Whether a value of {@code rhsType} may be assigned to {@code lhsType}. Unknown types always pass. */
  public static boolean isAssignable(String lhsType, String rhsType) {
    if (lhsType.equalsIgnoreCase(rhsType)) return true;
    TypeFamily lhs = of(lhsType);
    TypeFamily rhs = of(rhsType);
    if (lhs == null || rhs == null) return true;
    if (lhs == rhs) return true;
    return lhs == REAL && rhs == INT;
  }
}
