package se.alipsa.stpls.st.lex;

import java.util.*;

/** IEC 61131-3 reserved words, elementary types and the standard library names. */
public final class Keywords {

  private Keywords() {}

  public static final Set<String> CONTROL = Set.of(
      "IF", "THEN", "ELSE", "ELSIF", "END_IF",
      "CASE", "OF", "END_CASE",
      "FOR", "TO", "BY", "DO", "END_FOR",
      "WHILE", "END_WHILE",
      "REPEAT", "UNTIL", "END_REPEAT",
      "EXIT", "RETURN", "CONTINUE");

  public static final Set<String> DECLARATION = Set.of(
      "VAR", "VAR_INPUT", "VAR_OUTPUT", "VAR_IN_OUT", "VAR_TEMP",
      "VAR_GLOBAL", "VAR_ACCESS", "VAR_CONFIG", "VAR_EXTERNAL", "END_VAR",
      "CONSTANT", "RETAIN", "NON_RETAIN", "PERSISTENT", "AT",
      "PROGRAM", "END_PROGRAM",
      "FUNCTION", "END_FUNCTION",
      "FUNCTION_BLOCK", "END_FUNCTION_BLOCK",
      "TYPE", "END_TYPE",
      "STRUCT", "END_STRUCT",
      "ARRAY", "STRING", "WSTRING",
      "CONFIGURATION", "END_CONFIGURATION",
      "RESOURCE", "END_RESOURCE",
      "TASK");

  public static final Set<String> OTHER = Set.of(
      "TRUE", "FALSE", "NULL",
      "THIS", "SUPER",
      "ABSTRACT", "FINAL", "IMPLEMENTS", "EXTENDS",
      "INTERFACE", "METHOD", "PROPERTY",
      "NAMESPACE", "USING", "WITH",
      "RESOURCE", "ON", "PRIORITY", "SINGLE", "INTERVAL",
      "PROGRAM",
      "VAR_GLOBAL", "VAR_ACCESS",
      "READ_WRITE", "READ_ONLY", "WRITE_ONLY");

  public static final Set<String> LOGICAL = Set.of("AND", "OR", "XOR", "NOT", "MOD");

  public static final Set<String> DATA_TYPES = Set.of(
      "BOOL", "BYTE", "WORD", "DWORD", "LWORD",
      "SINT", "USINT", "INT", "UINT", "DINT", "UDINT", "LINT", "ULINT",
      "REAL", "LREAL",
      "TIME", "LTIME", "DATE", "LDATE", "TIME_OF_DAY", "TOD", "DATE_AND_TIME", "DT",
      "STRING", "WSTRING", "CHAR", "WCHAR",
      "POINTER", "REFERENCE",
      "ANY", "ANY_DERIVED", "ANY_ELEMENTARY", "ANY_MAGNITUDE", "ANY_NUM",
      "ANY_REAL", "ANY_INT", "ANY_BIT", "ANY_STRING", "ANY_DATE");

  public static final Set<String> STANDARD_FUNCTION_BLOCKS = Set.of(
      "TON", "TOF", "TP",
      "CTU", "CTD", "CTUD",
      "R_TRIG", "F_TRIG",
      "RS", "SR");

  public static final Set<String> STANDARD_FUNCTIONS = Set.of(
      "BOOL_TO_INT", "BOOL_TO_DINT", "BOOL_TO_REAL", "BOOL_TO_STRING",
      "INT_TO_BOOL", "INT_TO_DINT", "INT_TO_REAL", "INT_TO_STRING",
      "DINT_TO_BOOL", "DINT_TO_INT", "DINT_TO_REAL", "DINT_TO_STRING",
      "REAL_TO_BOOL", "REAL_TO_INT", "REAL_TO_DINT", "REAL_TO_STRING",
      "STRING_TO_BOOL", "STRING_TO_INT", "STRING_TO_DINT", "STRING_TO_REAL",
      "ABS", "SQRT", "LN", "LOG", "EXP",
      "SIN", "COS", "TAN", "ASIN", "ACOS", "ATAN",
      "TRUNC", "ROUND", "CEIL", "FLOOR",
      "LEN", "LEFT", "RIGHT", "MID", "CONCAT", "INSERT", "DELETE", "REPLACE", "FIND",
      "ADD_TIME", "SUB_TIME", "CONCAT_DATE_TOD");

  /** Operators and pragmas that look like identifiers in a body. */
  private static final Set<String> EXTRA = Set.of(
      "REF", "ADR", "SIZEOF", "OF", "TO", "BY", "DO", "THEN", "ON", "WITH",
      "INTERVAL", "PRIORITY", "SINGLE");

  private static final Set<String> ALL_KNOWN;
  private static final Set<String> RESERVED;

  static {
    Set<String> reserved = new HashSet<>();
    reserved.addAll(CONTROL);
    reserved.addAll(DECLARATION);
    reserved.addAll(OTHER);
    reserved.addAll(LOGICAL);
    RESERVED = Set.copyOf(reserved);

    Set<String> all = new HashSet<>(reserved);
    all.addAll(DATA_TYPES);
    all.addAll(STANDARD_FUNCTION_BLOCKS);
    all.addAll(STANDARD_FUNCTIONS);
    all.addAll(EXTRA);
    ALL_KNOWN = Set.copyOf(all);
  }

  public static String upper(String word) {
    return word.toUpperCase(Locale.ROOT);
  }

  /** Control, declaration and operator keywords. */
  public static boolean isKeyword(String word) {
    return RESERVED.contains(upper(word));
  }

  /** Elementary and generic types, plus the standard function block types. */
  public static boolean isDataType(String word) {
    String u = upper(word);
    return DATA_TYPES.contains(u) || STANDARD_FUNCTION_BLOCKS.contains(u);
  }

  public static boolean isStandardFunction(String word) {
    return STANDARD_FUNCTIONS.contains(upper(word));
  }

  public static boolean isStandardFunctionBlock(String word) {
    return word != null && STANDARD_FUNCTION_BLOCKS.contains(upper(word));
  }

  /** Anything the language or its standard library defines; never a user symbol. */
  public static boolean isBuiltIn(String word) {
    return isKeyword(word) || isDataType(word) || isStandardFunction(word);
  }

  /** Every non-user identifier that may appear in a body. */
  public static boolean isKnown(String word) {
    return ALL_KNOWN.contains(upper(word));
  }

  /** Keywords offered by completion, sorted. */
  public static List<String> completionKeywords() {
    Set<String> kws = new TreeSet<>(CONTROL);
    kws.addAll(DECLARATION);
    kws.addAll(LOGICAL);
    kws.addAll(List.of("TRUE", "FALSE"));
    kws.removeAll(DATA_TYPES);
    return List.copyOf(kws);
  }
}
