package se.alipsa.stpls.core;

import se.alipsa.stpls.core.model.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Transport-agnostic API that both the in-proc server and an editor adapter call. */
public interface CoreFacade {

  /** Open (or replace) a file’s content. Triggers (re)indexing. */
  List<Diagnostic> openFile(String uri, String text);

  /** Open many files at once; symbols of all of them are indexed before any is analyzed. */
  Map<String, List<Diagnostic>> openFiles(Map<String, String> textByUri);

  /** Update a file’s content. Triggers (re)indexing. */
  List<Diagnostic> changeFile(String uri, String text);

  /**
   * Update a file’s content at an editor version. Returns an empty list if a newer version was
   * already processed.
   */
  List<Diagnostic> changeFile(String uri, int version, String text);

  /** Close a file and discard caches and diagnostics. */
  void closeFile(String uri);

  /** (Re)analyze the current content of a file. */
  List<Diagnostic> analyze(String uri);

  /** Language-specific completions at a position. */
  List<CompletionItem> completions(String uri, Position position);

  /** Go to definition for the token at a position. */
  Optional<Location> definition(String uri, Position position);

  /** Markdown hover text for the token at a position. */
  Optional<String> hover(String uri, Position position);

  /** Edits that format the current content of a file; empty when it is not open or needs none. */
  List<TextEdit> format(String uri);

  RenameTarget prepareRename(String uri, Position position) throws RenameException;

  WorkspaceEdit rename(String uri, Position position, String newName) throws RenameException;

  List<Symbol> findByName(String name);

  List<Symbol> allSymbols();

  IndexStats indexStats();
}
