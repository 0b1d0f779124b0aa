package test.alipsa.stpls.it;

import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.model.Diagnostic;
import se.alipsa.stpls.core.model.IndexStats;
import se.alipsa.stpls.core.model.Location;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.server.CoreServer;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static test.alipsa.stpls.it.Workspace.firstWholeWord;

class WorkspaceDefinitionTest {

  @Test
  void indexed_workspace_is_clean_and_counted() throws Exception {
    Workspace ws = Workspace.create("stpls-it-index");

    try (CoreServer server = CoreServer.createDefault((u, d) -> {})) {
      Map<String, List<Diagnostic>> diags = server.indexWorkspace(ws.root);

      assertEquals(3, diags.size(), diags.keySet().toString());
      diags.forEach((uri, list) -> assertTrue(list.isEmpty(), uri + ": " + list));

      IndexStats stats = server.indexStats();
      assertEquals(3, stats.getFiles());
      assertEquals(1, stats.getPrograms());
      assertEquals(1, stats.getFunctionBlocks());
      assertEquals(0, stats.getFunctions());
      assertEquals(2, stats.getGlobalVariables());
    }
  }

  @Test
  void definitions_cross_file_boundaries() throws Exception {
    Workspace ws = Workspace.create("stpls-it-def");
    String mainUri = ws.uri("main.st");
    String motorUri = ws.uri("lib/motor.st");

    try (CoreServer server = CoreServer.createDefault((u, d) -> {})) {
      server.indexWorkspace(ws.root);

      // type name in a declaration
      Location fb = server.definition(mainUri, firstWholeWord(Workspace.MAIN, "Motor")).orElseThrow();
      assertEquals(motorUri, fb.getUri());
      assertEquals(8, fb.getRange().start.line);

      // output of a user function block
      Location running = server.definition(mainUri, new Position(6, 19)).orElseThrow();
      assertEquals(motorUri, running.getUri());
      assertEquals(13, running.getRange().start.line);

      // struct field
      Location x = server.definition(mainUri, new Position(7, 7)).orElseThrow();
      assertEquals(motorUri, x.getUri());
      assertEquals(3, x.getRange().start.line);

      // global variable
      Location speed = server.definition(mainUri, firstWholeWord(Workspace.MAIN, "gSpeed")).orElseThrow();
      assertEquals(ws.uri("globals.st"), speed.getUri());
      assertEquals(1, speed.getRange().start.line);
    }
  }

  @Test
  void closing_a_file_removes_its_declarations() throws Exception {
    Workspace ws = Workspace.create("stpls-it-close");

    try (CoreServer server = CoreServer.createDefault((u, d) -> {})) {
      server.indexWorkspace(ws.root);
      server.closeFile(ws.uri("globals.st"));

      assertTrue(server.findByName("gSpeed").isEmpty());
      List<Diagnostic> diags = server.analyze(ws.uri("main.st"));
      assertTrue(diags.stream().anyMatch(d -> d.getMessage().equals("Undefined identifier 'gSpeed'")), diags.toString());
    }
  }
}
