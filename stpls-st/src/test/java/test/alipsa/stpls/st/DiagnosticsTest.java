package test.alipsa.stpls.st;

import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.SymbolIndex;
import se.alipsa.stpls.core.model.Diagnostic;
import se.alipsa.stpls.core.model.Range;
import se.alipsa.stpls.st.diagnostics.DiagnosticCode;
import se.alipsa.stpls.st.diagnostics.SemanticChecks;
import se.alipsa.stpls.st.diagnostics.StructuralChecks;
import se.alipsa.stpls.st.symbols.StDocument;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {

  private static final String URI = "file:///work/main.st";

  private static final String CLEAN = """
      PROGRAM Main
      VAR
          counter : INT := 0;
          myTimer : TON;
          running : BOOL;
      END_VAR

      myTimer(IN := running, PT := T#5s);
      IF myTimer.Q THEN
          counter := counter + 1;
      END_IF;
      END_PROGRAM
      """;

  private static List<Diagnostic> diagnose(String text) {
    return diagnose(new SymbolIndex(), text);
  }

  private static List<Diagnostic> diagnose(SymbolIndex index, String text) {
    StDocument doc = StDocument.parse(URI, text);
    index.upsertFile(URI, doc.getSymbols());
    List<Diagnostic> out = new ArrayList<>(StructuralChecks.check(doc.getModel()));
    out.addAll(SemanticChecks.check(doc, index));
    return out;
  }

  private static List<Diagnostic> withCode(List<Diagnostic> diags, DiagnosticCode code) {
    return diags.stream().filter(d -> code.code().equals(d.getCode())).toList();
  }

  @Test
  void well_formed_program_has_no_diagnostics() {
    assertEquals(List.of(), diagnose(CLEAN));
  }

  @Test
  void deleting_end_program_reports_once_at_opener() {
    List<Diagnostic> diags = diagnose(CLEAN.replace("END_PROGRAM\n", ""));
    List<Diagnostic> unmatched = withCode(diags, DiagnosticCode.UNMATCHED_BLOCK);

    assertEquals(1, unmatched.size(), diags.toString());
    assertEquals(Range.of(0, 0, 7), unmatched.get(0).getRange());
    assertEquals(Diagnostic.Severity.ERROR, unmatched.get(0).getSeverity());
    assertEquals("structured-text", unmatched.get(0).getSource());
  }

  @Test
  void identifiers_are_case_insensitive() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM CaseTest
        VAR
            myVar : INT;
            x : INT;
        END_VAR
        MYVAR := 1;
        x := myvar + 1;
        END_PROGRAM
        """);
    assertEquals(List.of(), diags);
  }

  @Test
  void duplicate_declaration_is_reported_on_the_second() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Dup
        VAR
            x : INT;
            x : BOOL;
            y : INT;
        END_VAR
        y := x;
        END_PROGRAM
        """);
    List<Diagnostic> dups = withCode(diags, DiagnosticCode.DUPLICATE_DECLARATION);

    assertEquals(1, dups.size(), diags.toString());
    assertEquals(Range.of(3, 4, 1), dups.get(0).getRange());
    assertEquals("Duplicate declaration 'x' (already declared as 'x')", dups.get(0).getMessage());
  }

  @Test
  void same_name_in_different_pous_is_no_duplicate() {
    List<Diagnostic> diags = diagnose("""
        FUNCTION_BLOCK A
        VAR_INPUT
            x : INT;
        END_VAR
        END_FUNCTION_BLOCK
        FUNCTION_BLOCK B
        VAR_INPUT
            x : INT;
        END_VAR
        END_FUNCTION_BLOCK
        """);
    assertTrue(withCode(diags, DiagnosticCode.DUPLICATE_DECLARATION).isEmpty(), diags.toString());
  }

  @Test
  void unused_local_is_reported_once_until_referenced() {
    String unused = """
        PROGRAM Unused
        VAR
            spare : INT;
            used : INT;
        END_VAR
        used := 1;
        END_PROGRAM
        """;
    List<Diagnostic> warnings = withCode(diagnose(unused), DiagnosticCode.UNUSED_VARIABLE);
    assertEquals(1, warnings.size());
    assertEquals("Variable 'spare' is declared but never used", warnings.get(0).getMessage());
    assertEquals(Diagnostic.Severity.WARNING, warnings.get(0).getSeverity());
    assertEquals(Range.of(2, 4, 5), warnings.get(0).getRange());

    String referenced = unused.replace("used := 1;", "used := SPARE;");
    assertTrue(withCode(diagnose(referenced), DiagnosticCode.UNUSED_VARIABLE).isEmpty());
  }

  @Test
  void parameters_are_never_unused() {
    List<Diagnostic> diags = diagnose("""
        FUNCTION_BLOCK Fb
        VAR_INPUT
            ignored : BOOL;
        END_VAR
        END_FUNCTION_BLOCK
        """);
    assertTrue(withCode(diags, DiagnosticCode.UNUSED_VARIABLE).isEmpty());
  }

  @Test
  void type_mismatch_follows_families() {
    String program = """
        PROGRAM Types
        VAR
            r : REAL;
            i : INT;
            b : BOOL;
            s : STRING;
        END_VAR
        r := 5;
        i := 5.0;
        i := SomeUnknownType;
        b := NOT b;
        s := 'hello';
        i := 16#FF;
        b := r;
        END_PROGRAM
        """;
    List<Diagnostic> mismatches = withCode(diagnose(program), DiagnosticCode.TYPE_MISMATCH);

    assertEquals(2, mismatches.size(), mismatches.toString());
    assertEquals("Type mismatch: cannot assign 'REAL' to 'INT'", mismatches.get(0).getMessage());
    assertEquals(Range.of(8, 5, 3), mismatches.get(0).getRange());
    assertEquals("Type mismatch: cannot assign 'REAL' to 'BOOL'", mismatches.get(1).getMessage());
  }

  @Test
  void time_literal_into_int_is_a_mismatch() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Timing
        VAR
            delay : TIME;
            n : DINT;
        END_VAR
        delay := T#2s;
        n := T#2s;
        END_PROGRAM
        """);
    List<Diagnostic> mismatches = withCode(diags, DiagnosticCode.TYPE_MISMATCH);
    assertEquals(1, mismatches.size(), diags.toString());
    assertEquals("Type mismatch: cannot assign 'TIME' to 'DINT'", mismatches.get(0).getMessage());
  }

  @Test
  void function_return_variable_is_typed() {
    List<Diagnostic> diags = diagnose("""
        FUNCTION IsReady : BOOL
        VAR_INPUT
            level : INT;
        END_VAR
        IsReady := 3.5;
        END_FUNCTION
        """);
    List<Diagnostic> mismatches = withCode(diags, DiagnosticCode.TYPE_MISMATCH);
    assertEquals(1, mismatches.size(), diags.toString());
    assertEquals("Type mismatch: cannot assign 'REAL' to 'BOOL'", mismatches.get(0).getMessage());
  }

  @Test
  void missing_semicolon() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Semi
        VAR
            x : INT;
        END_VAR
        x := 1
        IF x > 0 THEN
            x := x +
                1;
        END_IF;
        END_PROGRAM
        """);
    List<Diagnostic> semis = withCode(diags, DiagnosticCode.MISSING_SEMICOLON);

    assertEquals(1, semis.size(), diags.toString());
    assertEquals(Range.of(4, 6, 0), semis.get(0).getRange());
    assertEquals("Missing semicolon at end of statement", semis.get(0).getMessage());
  }

  @Test
  void else_if_and_missing_then() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Cond
        VAR
            a : BOOL;
            b : BOOL;
        END_VAR
        IF a
            a := FALSE;
        ELSE IF b THEN
            b := FALSE;
        END_IF;
        WHILE a AND
              b DO
            a := FALSE;
        END_WHILE;
        END_PROGRAM
        """);

    List<Diagnostic> elseIf = withCode(diags, DiagnosticCode.ELSE_IF);
    assertEquals(1, elseIf.size());
    assertEquals("'ELSE IF' is not valid IEC 61131-3 syntax; use 'ELSIF'", elseIf.get(0).getMessage());

    List<Diagnostic> then = withCode(diags, DiagnosticCode.MISSING_THEN_DO);
    assertEquals(1, then.size(), then.toString());
    assertEquals("'IF' is missing 'THEN'", then.get(0).getMessage());
    assertEquals(5, then.get(0).getRange().start.line);
  }

  @Test
  void multi_line_condition_missing_do() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Loop
        VAR
            a : BOOL;
            b : BOOL;
        END_VAR
        WHILE a AND
              b
            a := FALSE;
        END_WHILE;
        END_PROGRAM
        """);
    List<Diagnostic> missing = withCode(diags, DiagnosticCode.MISSING_THEN_DO);
    assertEquals(1, missing.size(), diags.toString());
    assertEquals("'WHILE' condition is missing 'DO'", missing.get(0).getMessage());
    assertEquals(6, missing.get(0).getRange().start.line);
  }

  @Test
  void unclosed_string_and_parenthesis() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Lits
        VAR
            s : STRING;
            n : INT;
        END_VAR
        s := 'open;
        n := (1 + 2;
        n := 1 + 2);
        END_PROGRAM
        """);

    List<Diagnostic> strings = withCode(diags, DiagnosticCode.UNCLOSED_STRING);
    assertEquals(1, strings.size());
    assertEquals("Unclosed string literal (single quote)", strings.get(0).getMessage());
    assertEquals(5, strings.get(0).getRange().start.line);

    List<Diagnostic> parens = withCode(diags, DiagnosticCode.UNMATCHED_PAREN);
    assertEquals(2, parens.size(), parens.toString());
    assertEquals("Unmatched opening parenthesis (1 unclosed)", parens.get(0).getMessage());
    assertEquals("Unmatched closing parenthesis", parens.get(1).getMessage());
  }

  @Test
  void undefined_identifier_is_a_warning() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Undef
        VAR
            x : INT;
        END_VAR
        x := unknownThing + ABS(x);
        END_PROGRAM
        """);
    List<Diagnostic> undefined = withCode(diags, DiagnosticCode.UNDEFINED_IDENTIFIER);

    assertEquals(1, undefined.size(), diags.toString());
    assertEquals("Undefined identifier 'unknownThing'", undefined.get(0).getMessage());
    assertEquals(Diagnostic.Severity.WARNING, undefined.get(0).getSeverity());
    assertEquals(Range.of(4, 5, 12), undefined.get(0).getRange());
  }

  @Test
  void globals_enum_values_and_case_labels_are_known() {
    SymbolIndex index = new SymbolIndex();
    StDocument globals = StDocument.parse("file:///work/globals.st", """
        TYPE
            E_State : (IDLE, BUSY);
        END_TYPE
        VAR_GLOBAL
            gSpeed : INT;
        END_VAR
        """);
    index.upsertFile(globals.getUri(), globals.getSymbols());

    List<Diagnostic> diags = diagnose(index, """
        PROGRAM Main
        VAR
            state : E_State;
            x : INT;
        END_VAR
        CASE state OF
            IDLE: x := gSpeed;
            1, 2:
                x := 0;
            UNKNOWN_LABEL: x := 3;
        END_CASE;
        state := BUSY;
        END_PROGRAM
        """);
    assertTrue(withCode(diags, DiagnosticCode.UNDEFINED_IDENTIFIER).isEmpty(), diags.toString());
    assertTrue(withCode(diags, DiagnosticCode.MISSING_SEMICOLON).isEmpty(), diags.toString());
  }

  @Test
  void named_arguments_and_members_are_not_undefined() {
    List<Diagnostic> diags = diagnose(CLEAN.replace("IF myTimer.Q THEN", "IF myTimer.Q AND myTimer.ET > T#1s THEN"));
    assertEquals(List.of(), diags);
  }

  @Test
  void pragmas_are_neither_code_nor_declarations() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Prag
        VAR
            {attribute 'hide'}
            x : INT;
        END_VAR
        {warning 'check this'}
        x := x + 1;
        END_PROGRAM
        """);
    assertEquals(List.of(), diags);
  }

  @Test
  void method_parameters_are_scoped_to_their_method() {
    List<Diagnostic> diags = diagnose("""
        FUNCTION_BLOCK Calc
        VAR
            total : INT;
        END_VAR
        METHOD Add : INT
        VAR_INPUT
            value : INT;
        END_VAR
        total := total + value;
        END_METHOD
        METHOD Sub : INT
        VAR_INPUT
            value : INT;
            value : INT;
        END_VAR
        total := total - value;
        END_METHOD
        END_FUNCTION_BLOCK
        """);
    List<Diagnostic> dups = withCode(diags, DiagnosticCode.DUPLICATE_DECLARATION);

    assertEquals(1, dups.size(), diags.toString());
    assertEquals(Range.of(13, 4, 5), dups.get(0).getRange());
  }

  @Test
  void negative_case_labels_need_no_semicolon() {
    List<Diagnostic> diags = diagnose("""
        PROGRAM Neg
        VAR
            x : INT;
            y : INT;
        END_VAR
        CASE x OF
        -1:
            y := 0;
        -5..-2:
            y := 1;
        END_CASE;
        END_PROGRAM
        """);
    assertTrue(withCode(diags, DiagnosticCode.MISSING_SEMICOLON).isEmpty(), diags.toString());
  }
}
