package test.alipsa.stpls.it;

import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.model.CompletionItem;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.server.CoreServer;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceCompletionsTest {

  private static final String CARET = "/*caret*/";

  @Test
  void members_of_a_block_declared_in_another_file() throws Exception {
    Workspace ws = Workspace.create("stpls-it-members");
    String withMarker = """
        PROGRAM Edit
        VAR
            drive : Motor;
        END_VAR
        drive./*caret*/
        END_PROGRAM
        """;
    String code = withMarker.replace(CARET, "");
    String uri = ws.uri("edit.st");

    try (CoreServer server = CoreServer.createDefault((u, d) -> {})) {
      server.indexWorkspace(ws.root);
      server.openFile(uri, code);

      List<CompletionItem> items = server.completions(uri, positionAtMarker(withMarker, CARET));

      assertEquals(List.of("setpoint", "running"), items.stream().map(CompletionItem::getLabel).toList());
      CompletionItem setpoint = items.get(0);
      assertEquals("input: INT", setpoint.getDetail());
      assertEquals(ws.uri("lib/motor.st"), setpoint.getLocation().getUri());
    }
  }

  @Test
  void globals_of_other_files_complete_by_prefix() throws Exception {
    Workspace ws = Workspace.create("stpls-it-globals");
    String withMarker = """
        PROGRAM Edit
        gR/*caret*/
        END_PROGRAM
        """;
    String code = withMarker.replace(CARET, "");
    String uri = ws.uri("edit.st");

    try (CoreServer server = CoreServer.createDefault((u, d) -> {})) {
      server.indexWorkspace(ws.root);
      server.openFile(uri, code);

      List<CompletionItem> items = server.completions(uri, positionAtMarker(withMarker, CARET));

      CompletionItem running = byLabel(items, "gRunning");
      assertNotNull(running, items.toString());
      assertEquals(CompletionItem.Kind.VARIABLE, running.getKind());
      assertEquals("BOOL", running.getDetail());
      assertNull(byLabel(items, "gSpeed"));
    }
  }

  private static Position positionAtMarker(String text, String marker) {
    int idx = text.indexOf(marker);
    assertTrue(idx >= 0, "Marker not found in text");
    int line = 0, col = 0;
    for (int i = 0; i < idx; i++) {
      char c = text.charAt(i);
      if (c == '\n') { line++; col = 0; }
      else { col++; }
    }
    return new Position(line, col);
  }

  private static CompletionItem byLabel(List<CompletionItem> items, String label) {
    for (var it : items) {
      if (label.equals(it.getLabel())) return it;
    }
    return null;
  }
}
