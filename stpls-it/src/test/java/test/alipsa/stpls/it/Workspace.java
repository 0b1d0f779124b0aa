package test.alipsa.stpls.it;

import se.alipsa.stpls.core.model.Position;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A small plant project on disk shared by the integration tests. */
final class Workspace {

  static final String GLOBALS = """
      VAR_GLOBAL
          gSpeed : INT;
          gRunning : BOOL;
      END_VAR
      """;

  static final String MOTOR = """
      TYPE
          Point :
          STRUCT
              x : REAL;
              y : REAL;
          END_STRUCT
      END_TYPE

      FUNCTION_BLOCK Motor
      VAR_INPUT
          setpoint : INT;
      END_VAR
      VAR_OUTPUT
          running : BOOL;
      END_VAR
      running := setpoint > 0;
      END_FUNCTION_BLOCK
      """;

  static final String MAIN = """
      PROGRAM Main
      VAR
          pump : Motor;
          target : Point;
      END_VAR
      pump(setpoint := gSpeed);
      gRunning := pump.running;
      target.x := 1.5;
      END_PROGRAM
      """;

  final Path root;

  private Workspace(Path root) {
    this.root = root;
  }

  static Workspace create(String prefix) throws IOException {
    Path dir = Files.createTempDirectory(prefix);
    Files.createDirectories(dir.resolve("lib"));
    Files.writeString(dir.resolve("globals.st"), GLOBALS, StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("lib").resolve("motor.st"), MOTOR, StandardCharsets.UTF_8);
    Files.writeString(dir.resolve("main.st"), MAIN, StandardCharsets.UTF_8);
    return new Workspace(dir);
  }

  String uri(String relative) {
    return root.resolve(relative).toUri().toString();
  }

  /** Position of the first whole-word occurrence of {@code word}. */
  static Position firstWholeWord(String text, String word) {
    Matcher m = Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(text);
    if (!m.find()) throw new AssertionError("word not found: " + word);
    int idx = m.start();
    int line = 0, col = 0;
    for (int i = 0; i < idx; i++) {
      char c = text.charAt(i);
      if (c == '\n') { line++; col = 0; } else { col++; }
    }
    return new Position(line, col);
  }
}
