package se.alipsa.stpls.core.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;

/** Finds source files below a workspace folder and loads their text. */
public final class WorkspaceScanner {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceScanner.class);

  public static final Set<String> EXCLUDED_DIRS =
      Set.of(".git", "node_modules", "target", "out", "dist", ".vscode");

  private final Set<String> extensions;

  /** @param extensions lowercase, no dot, e.g. "st" */
  public WorkspaceScanner(Set<String> extensions) {
    this.extensions = Set.copyOf(extensions);
  }

  public List<Path> scan(Path root) throws IOException {
    List<Path> found = new ArrayList<>();
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        Path name = dir.getFileName();
        if (!dir.equals(root) && name != null && EXCLUDED_DIRS.contains(name.toString())) {
          return FileVisitResult.SKIP_SUBTREE;
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile() && matches(file)) found.add(file);
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) {
        log.warn("Skipping unreadable path {}", file, exc);
        return FileVisitResult.CONTINUE;
      }
    });
    Collections.sort(found);
    log.debug("Found {} source files below {}", found.size(), root);
    return found;
  }

  /** Scan and read every file; keys are file uris in path order. */
  public Map<String, String> load(Path root) throws IOException {
    Map<String, String> out = new LinkedHashMap<>();
    for (Path p : scan(root)) {
      try {
        out.put(p.toUri().toString(), Files.readString(p, StandardCharsets.UTF_8));
      } catch (IOException | UncheckedIOException e) {
        log.warn("Could not read {}, skipping", p, e);
      }
    }
    return out;
  }

  private boolean matches(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot >= 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
  }
}
