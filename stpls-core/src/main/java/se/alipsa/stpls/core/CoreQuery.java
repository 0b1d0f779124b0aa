package se.alipsa.stpls.core;

import se.alipsa.stpls.core.model.Symbol;
import se.alipsa.stpls.core.model.SymbolKind;

import java.util.List;
import java.util.Optional;

/** Read-only view of the workspace index handed to plugins. */
public interface CoreQuery {

  /** Case-insensitive lookup; file-insertion order then declaration order. */
  List<Symbol> findByName(String name);

  List<Symbol> allSymbols();

  List<Symbol> symbolsInFile(String fileUri);

  List<String> fileUris();

  /** First indexed symbol with the given name and kind. */
  default Optional<Symbol> findFirst(String name, SymbolKind kind) {
    return findByName(name).stream().filter(s -> s.getKind() == kind).findFirst();
  }
}
