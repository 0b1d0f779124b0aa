package se.alipsa.stpls.core.model;

public final class CompletionItem {
  public enum Kind { KEYWORD, TYPE, FUNCTION, FUNCTION_BLOCK, VARIABLE, FIELD, PROGRAM }

  private final String label;         // what the user sees in the list
  private final Kind kind;
  private final String detail;        // e.g. "INPUT: BOOL" or the declared type
  private final String documentation; // optional markdown
  private final Location location;    // optional: where the symbol is declared

  public CompletionItem(String label, Kind kind, String detail) {
    this(label, kind, detail, null, null);
  }

  public CompletionItem(String label, Kind kind, String detail, String documentation, Location loc) {
    this.label = label;
    this.kind = kind;
    this.detail = detail;
    this.documentation = documentation;
    this.location = loc;
  }

  public String getLabel() {
    return label;
  }

  public Kind getKind() {
    return kind;
  }

  public String getDetail() {
    return detail;
  }

  public String getDocumentation() {
    return documentation;
  }

  public Location getLocation() {
    return location;
  }

  @Override
  public String toString() {
    return label + " (" + kind + (detail == null ? "" : ", " + detail) + ")";
  }
}
