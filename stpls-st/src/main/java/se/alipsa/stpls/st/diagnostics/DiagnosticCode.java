package se.alipsa.stpls.st.diagnostics;

import se.alipsa.stpls.core.model.Diagnostic;
import se.alipsa.stpls.core.model.Range;

/** Stable codes of the diagnostics this plugin reports; a quick-fix layer keys on these. */
public enum DiagnosticCode {
  UNMATCHED_BLOCK("unmatched-block", Diagnostic.Severity.ERROR),
  UNCLOSED_STRING("unclosed-string", Diagnostic.Severity.ERROR),
  UNMATCHED_PAREN("unmatched-paren", Diagnostic.Severity.ERROR),
  ELSE_IF("else-if", Diagnostic.Severity.ERROR),
  MISSING_THEN_DO("missing-then-do", Diagnostic.Severity.ERROR),
  MISSING_SEMICOLON("missing-semicolon", Diagnostic.Severity.ERROR),
  DUPLICATE_DECLARATION("duplicate-declaration", Diagnostic.Severity.ERROR),
  UNDEFINED_IDENTIFIER("undefined-identifier", Diagnostic.Severity.WARNING),
  UNUSED_VARIABLE("unused-variable", Diagnostic.Severity.WARNING),
  TYPE_MISMATCH("type-mismatch", Diagnostic.Severity.ERROR);

  /** Source tag of every diagnostic; equals the plugin id. */
  public static final String SOURCE = "structured-text";

  private final String code;
  private final Diagnostic.Severity severity;

  DiagnosticCode(String code, Diagnostic.Severity severity) {
    this.code = code;
    this.severity = severity;
  }

  public String code() { return code; }

  public Diagnostic.Severity severity() { return severity; }

  public Diagnostic at(Range range, String message) {
    return new Diagnostic(range, message, severity, SOURCE, code);
  }

  public static DiagnosticCode fromCode(String code) {
    for (DiagnosticCode c : values()) {
      if (c.code.equals(code)) return c;
    }
    throw new IllegalArgumentException("Unknown diagnostic code " + code);
  }
}
