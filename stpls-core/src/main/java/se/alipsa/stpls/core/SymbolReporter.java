package se.alipsa.stpls.core;

import se.alipsa.stpls.core.model.Symbol;

/** Callback used by plugins to hand declarations to the core while indexing a file. */
@FunctionalInterface
public interface SymbolReporter {
  void report(Symbol symbol);
}
