package test.alipsa.stpls.core.server;

import org.junit.jupiter.api.Test;
import se.alipsa.stpls.core.model.Diagnostic;
import se.alipsa.stpls.core.server.CoreServer;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class CoreServerSmokeTest {

  @Test
  void openFile_indexes_and_publishes() {
    Map<String, List<Diagnostic>> published = new ConcurrentHashMap<>();
    try (CoreServer server = CoreServer.createDefault(published::put)) {
      String uri = "file:///tmp/smoke/one.decl";
      List<Diagnostic> diags = server.openFile(uri, "alpha : INT\nundefined beta\n");

      assertEquals(1, diags.size());
      assertEquals("undefined", diags.get(0).getCode());
      assertEquals(diags, published.get(uri));
      assertEquals(1, server.findByName("ALPHA").size());
    }
  }

  @Test
  void unknown_extension_gets_no_plugin_information() {
    try (CoreServer server = CoreServer.createDefault((u, d) -> {})) {
      List<Diagnostic> diags = server.openFile("file:///tmp/smoke/readme.txt", "hello");

      assertEquals(1, diags.size());
      assertEquals("no-plugin", diags.get(0).getCode());
      assertEquals(Diagnostic.Severity.INFORMATION, diags.get(0).getSeverity());
    }
  }

  @Test
  void plugin_exception_becomes_diagnostic() {
    try (CoreServer server = CoreServer.createDefault((u, d) -> {})) {
      String uri = "file:///tmp/smoke/bad.decl";
      List<Diagnostic> diags = server.openFile(uri, "alpha : INT\nboom\n");

      assertTrue(diags.stream().anyMatch(d -> "plugin-exception".equals(d.getCode())
          && d.getSeverity() == Diagnostic.Severity.ERROR), "expected plugin-exception in " + diags);
      assertTrue(server.findByName("alpha").isEmpty(), "a failed parse contributes no symbols");
    }
  }

  @Test
  void stale_version_is_not_published() {
    Map<String, List<Diagnostic>> published = new ConcurrentHashMap<>();
    try (CoreServer server = CoreServer.createDefault(published::put)) {
      String uri = "file:///tmp/smoke/versions.decl";
      server.changeFile(uri, 3, "fresh : INT\nundefined missing\n");
      List<Diagnostic> stale = server.changeFile(uri, 2, "stale : INT\n");

      assertTrue(stale.isEmpty());
      assertEquals(1, published.get(uri).size());
      assertEquals(1, server.findByName("fresh").size());
      assertTrue(server.findByName("stale").isEmpty());
    }
  }

  @Test
  void closeFile_clears_index_and_diagnostics() {
    Map<String, List<Diagnostic>> published = new ConcurrentHashMap<>();
    try (CoreServer server = CoreServer.createDefault(published::put)) {
      String uri = "file:///tmp/smoke/close.decl";
      server.openFile(uri, "alpha : INT\nundefined beta\n");
      server.closeFile(uri);

      assertTrue(published.get(uri).isEmpty());
      assertTrue(server.allSymbols().isEmpty());
      assertEquals(0, server.indexStats().getFiles());
    }
  }

  @Test
  void settings_reach_the_plugin() {
    try (CoreServer server = CoreServer.create(Map.of("decl.maxSymbols", "1"), (u, d) -> {})) {
      server.openFile("file:///tmp/smoke/limit.decl", "a : INT\nb : INT\n");
      assertEquals(1, server.allSymbols().size());
    }
  }
}
