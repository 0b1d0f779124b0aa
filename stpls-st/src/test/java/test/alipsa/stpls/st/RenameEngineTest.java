package test.alipsa.stpls.st;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.DocumentStore;
import se.alipsa.stpls.core.RenameException;
import se.alipsa.stpls.core.SymbolIndex;
import se.alipsa.stpls.core.model.*;
import se.alipsa.stpls.st.rename.RenameEngine;
import se.alipsa.stpls.st.symbols.StDocument;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenameEngineTest {

  private static final String MAIN_URI = "mem://main.st";
  private static final String OTHER_URI = "mem://other.st";

  private static final String MAIN = """
      PROGRAM Main
      VAR
          myTimer : TON;  // myTimer drives the lamp
          lamp : BOOL;
          msg : STRING := 'myTimer';
      END_VAR
      myTimer(IN := TRUE, PT := T#5s);
      lamp := myTimer.Q;
      IF lamp THEN
          lamp := FALSE;
      END_IF;
      END_PROGRAM
      """;

  private static final String OTHER = """
      PROGRAM Other
      VAR
          myTimer : TOF;
      END_VAR
      MYTIMER(IN := FALSE);
      END_PROGRAM
      """;

  private SymbolIndex index;
  private DocumentStore documents;
  private StDocument main;
  private RenameEngine engine;

  @BeforeEach
  void setUp() {
    index = new SymbolIndex();
    documents = new DocumentStore();
    main = StDocument.parse(MAIN_URI, MAIN);
    index.upsertFile(MAIN_URI, main.getSymbols());
    index.upsertFile(OTHER_URI, StDocument.parse(OTHER_URI, OTHER).getSymbols());
    documents.put(MAIN_URI, MAIN);
    documents.put(OTHER_URI, OTHER);
    engine = new RenameEngine(index);
  }

  @Test
  void prepare_returns_the_word_under_the_cursor() throws RenameException {
    RenameTarget target = engine.prepare(main, new Position(7, 10));

    assertEquals("myTimer", target.getPlaceholder());
    assertEquals(Range.of(7, 8, 7), target.getRange());
  }

  @Test
  void renames_code_occurrences_in_every_indexed_file() throws RenameException {
    WorkspaceEdit edit = engine.rename(main, new Position(2, 6), "timer1", documents);

    assertEquals(List.of(
        new TextEdit(Range.of(2, 4, 7), "timer1"),
        new TextEdit(Range.of(6, 0, 7), "timer1"),
        new TextEdit(Range.of(7, 8, 7), "timer1")), edit.editsFor(MAIN_URI));
    assertEquals(List.of(
        new TextEdit(Range.of(2, 4, 7), "timer1"),
        new TextEdit(Range.of(4, 0, 7), "timer1")), edit.editsFor(OTHER_URI));
    assertEquals(5, edit.editCount());
  }

  @Test
  void prepare_rejects_positions_that_are_not_user_symbols() {
    assertPrepareFails(new Position(8, 0), "Cannot rename built-in \"IF\"");
    assertPrepareFails(new Position(2, 25), "Cannot rename inside a comment");
    assertPrepareFails(new Position(4, 23), "Cannot rename inside a string literal");
    assertPrepareFails(new Position(3, 1), "Cannot rename at this position");
    assertPrepareFails(new Position(40, 0), "Cannot rename at this position");

    StDocument ghost = StDocument.parse("mem://ghost.st", """
        PROGRAM P
        ghost := 1;
        END_PROGRAM
        """);
    RenameException e = assertThrows(RenameException.class, () -> engine.prepare(ghost, new Position(1, 2)));
    assertEquals("Symbol \"ghost\" not found", e.getMessage());
  }

  @Test
  void new_name_is_validated() {
    assertRenameFails("1abc", "\"1abc\" is not a valid IEC 61131-3 identifier");
    assertRenameFails("my timer", "\"my timer\" is not a valid IEC 61131-3 identifier");
    assertRenameFails("END_IF", "\"END_IF\" is a reserved keyword");
    assertRenameFails("int", "\"int\" is a reserved data type");
    assertRenameFails("TON", "\"TON\" is a reserved data type");
    assertRenameFails("ABS", "\"ABS\" is a standard function name");
  }

  @Test
  void case_only_change_yields_no_edits() throws RenameException {
    assertTrue(engine.rename(main, new Position(2, 4), "MYTIMER", documents).isEmpty());
  }

  @Test
  void unreadable_file_aborts_the_whole_rename() {
    index.upsertFile("mem://gone.st", StDocument.parse("mem://gone.st", OTHER).getSymbols());

    RenameException e = assertThrows(RenameException.class,
        () -> engine.rename(main, new Position(2, 4), "timer1", documents));
    assertEquals("Cannot read mem://gone.st; rename aborted", e.getMessage());
  }

  @Test
  void indexed_file_without_open_text_is_not_read_from_disk() {
    String uri = "file:///nowhere/other.st";
    index.removeFile(OTHER_URI);
    index.upsertFile(uri, StDocument.parse(uri, OTHER).getSymbols());

    RenameException e = assertThrows(RenameException.class,
        () -> engine.rename(main, new Position(2, 4), "timer1", documents));
    assertEquals("Cannot read " + uri + "; rename aborted", e.getMessage());
  }

  private void assertPrepareFails(Position position, String message) {
    RenameException e = assertThrows(RenameException.class, () -> engine.prepare(main, position));
    assertEquals(message, e.getMessage());
  }

  private void assertRenameFails(String newName, String message) {
    RenameException e = assertThrows(RenameException.class,
        () -> engine.rename(main, new Position(2, 4), newName, documents));
    assertEquals(message, e.getMessage());
  }

  @Test
  void pragma_text_is_neither_renamed_nor_a_rename_target() throws RenameException {
    StDocument doc = StDocument.parse("mem://pragma.st", """
        PROGRAM P
        VAR
            lamp : BOOL;
        END_VAR
        {info 'lamp'} lamp := TRUE;
        END_PROGRAM
        """);
    RenameEngine local = new RenameEngine(new SymbolIndex());

    RenameException e = assertThrows(RenameException.class, () -> local.prepare(doc, new Position(4, 1)));
    assertEquals("Cannot rename inside a pragma", e.getMessage());

    WorkspaceEdit edit = local.rename(doc, new Position(2, 4), "light", new DocumentStore());
    assertEquals(List.of(new TextEdit(Range.of(2, 4, 4), "light"), new TextEdit(Range.of(4, 14, 4), "light")),
        edit.editsFor("mem://pragma.st"));
  }
}
