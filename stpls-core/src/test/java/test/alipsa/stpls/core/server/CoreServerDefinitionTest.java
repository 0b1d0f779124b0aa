package test.alipsa.stpls.core.server;

import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.model.Diagnostic;
import se.alipsa.stpls.core.model.Location;
import se.alipsa.stpls.core.model.Position;
import se.alipsa.stpls.core.server.CoreServer;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CoreServerDefinitionTest {

  @Test
  void definition_acrossFiles_findsDeclaration() throws Exception {
    Path dir = Files.createTempDirectory("stpls-def");
    Path decl = dir.resolve("globals.decl");
    String declCode = """
      speed : INT
      limit : INT
      """;
    Files.writeString(decl, declCode, StandardCharsets.UTF_8);
    String declUri = decl.toUri().toString();

    Path use = dir.resolve("use.decl");
    String useCode = """
      local : BOOL
      undefined limit
      """;
    Files.writeString(use, useCode, StandardCharsets.UTF_8);
    String useUri = use.toUri().toString();

    try (CoreServer server = CoreServer.createDefault(CoreServerDefinitionTest::noop)) {
      server.openFile(declUri, declCode);
      server.openFile(useUri, useCode);

      Optional<Location> def = server.definition(useUri, firstOccurrencePosition(useCode, "limit"));

      assertTrue(def.isPresent(), "definition should be found");
      assertEquals(declUri, def.get().getUri(), "definition should jump to globals.decl");
      assertEquals(1, def.get().getRange().start.line);
    }
  }

  @Test
  void openFiles_sees_symbols_of_the_whole_batch() throws Exception {
    try (CoreServer server = CoreServer.createDefault(CoreServerDefinitionTest::noop)) {
      // the user comes first, so its analysis only passes because indexing finishes before analysis
      Map<String, String> batch = new java.util.LinkedHashMap<>();
      batch.put("file:///batch/use.decl", "undefined limit\n");
      batch.put("file:///batch/globals.decl", "limit : INT\n");

      Map<String, List<Diagnostic>> diags = server.openFiles(batch);

      assertTrue(diags.get("file:///batch/use.decl").isEmpty(), diags.toString());
      assertEquals(2, server.indexStats().getFiles());
    }
  }

  @Test
  void indexWorkspace_skips_excluded_directories() throws Exception {
    Path dir = Files.createTempDirectory("stpls-ws");
    Files.writeString(dir.resolve("a.decl"), "alpha : INT\n", StandardCharsets.UTF_8);
    Files.createDirectories(dir.resolve("sub"));
    Files.writeString(dir.resolve("sub").resolve("b.decl"), "beta : INT\n", StandardCharsets.UTF_8);
    Files.createDirectories(dir.resolve("node_modules"));
    Files.writeString(dir.resolve("node_modules").resolve("c.decl"), "gamma : INT\n", StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("notes.txt"), "delta : INT\n", StandardCharsets.UTF_8);

    try (CoreServer server = CoreServer.createDefault(CoreServerDefinitionTest::noop)) {
      Map<String, List<Diagnostic>> diags = server.indexWorkspace(dir);

      assertEquals(2, diags.size());
      assertEquals(1, server.findByName("alpha").size());
      assertEquals(1, server.findByName("beta").size());
      assertTrue(server.findByName("gamma").isEmpty());
      assertTrue(server.findByName("delta").isEmpty());
    }
  }

  private static void noop(String uri, List<Diagnostic> diags) {
    // no-op publisher
  }

  private static Position firstOccurrencePosition(String text, String needle) {
    int idx = text.indexOf(needle);
    assertTrue(idx >= 0, "needle not found in text");
    int line = 0, col = 0;
    for (int i = 0; i < idx; i++) {
      char c = text.charAt(i);
      if (c == '\n') { line++; col = 0; } else { col++; }
    }
    return new Position(line, col);
  }
}
