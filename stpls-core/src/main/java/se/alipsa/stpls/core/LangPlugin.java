package se.alipsa.stpls.core;

import se.alipsa.stpls.core.model.*;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public interface LangPlugin {

  /** Unique, stable identifier, also used as the diagnostic source tag. */
  String id();

  /** Human-friendly name. */
  default String displayName() { return id(); }

  /** File extensions (lowercase, no dot), e.g. ["st"]. */
  Set<String> fileExtensions();

  /**
   * Claim how confident you are that you handle this file. 0.0 = not mine, 1.0 = certainly mine.
   * Core calls this when it needs to choose a plugin. Use URI and a cheap content peek.
   */
  default double claim(String fileUri, Supplier<CharSequence> contentPreview) {
    String ext = fileUri.contains(".") ? fileUri.substring(fileUri.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT) : "";
    return fileExtensions().contains(ext) ? 0.9 : 0.0; // extensions win by default
  }

  /** Called once after registration; plugins can cache references to core services. */
  default void configure(PluginEnvironment env) {}

  /**
   * Phase 1: parse the file, report its declarations and return the diagnostics that need
   * nothing but the file itself.
   */
  List<Diagnostic> index(String fileUri, String content, SymbolReporter reporter);

  /** Phase 2: diagnostics that need the workspace index. Runs after the file's symbols are committed. */
  default List<Diagnostic> analyze(String fileUri, String content, CoreQuery core) { return List.of(); }

  /** Resolve the identifier at a position to its declaration. */
  default Optional<Symbol> resolveSymbol(String fileUri, String content, Position position, CoreQuery core) {
    return Optional.empty();
  }

  default List<CompletionItem> completions(String fileUri, String content, Position position, CoreQuery core) {
    return List.of();
  }

  /** Markdown hover text for the identifier at a position. */
  default Optional<String> hover(String fileUri, String content, Position position, CoreQuery core) {
    return Optional.empty();
  }

  default RenameTarget prepareRename(String fileUri, String content, Position position, CoreQuery core)
      throws RenameException {
    throw new RenameException("Rename is not supported for " + displayName());
  }

  default WorkspaceEdit rename(String fileUri, String content, Position position, String newName,
                               CoreQuery core, DocumentStore documents) throws RenameException {
    throw new RenameException("Rename is not supported for " + displayName());
  }

  /** Edits that format the whole file; empty when it needs none. */
  default List<TextEdit> format(String fileUri, String content) {
    return List.of();
  }

  /** Forget any cached state for file. */
  default void forget(String fileUri) {}

}
