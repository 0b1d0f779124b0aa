package se.alipsa.stpls.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.stpls.core.model.*;

import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/** Default implementation of CoreFacade. */
public final class CoreEngine implements CoreFacade {

  private static final Logger log = LoggerFactory.getLogger(CoreEngine.class);

  private final PluginRegistry plugins;
  private final SymbolIndex index;
  private final DocumentStore docs;
  private final Executor executor;

  /** Track which plugin currently owns a given URI. */
  private final Map<String, LangPlugin> pluginByUri = new ConcurrentHashMap<>();

  public CoreEngine(PluginRegistry plugins,
                    SymbolIndex index,
                    DocumentStore docs,
                    Executor executor) {
    this.plugins = Objects.requireNonNull(plugins);
    this.index = Objects.requireNonNull(index);
    this.docs = Objects.requireNonNull(docs);
    this.executor = Objects.requireNonNull(executor);
  }

  @Override
  public List<Diagnostic> openFile(String uri, String text) {
    int version = docs.put(uri, text);
    return reindex(uri, text, version);
  }

  @Override
  public Map<String, List<Diagnostic>> openFiles(Map<String, String> textByUri) {
    Map<String, Integer> versions = new LinkedHashMap<>();
    textByUri.forEach((uri, text) -> versions.put(uri, docs.put(uri, text)));

    // phase 1 for every file, then phase 2 once the whole batch is in the index
    Map<String, CompletableFuture<List<Diagnostic>>> indexing = new LinkedHashMap<>();
    textByUri.forEach((uri, text) -> indexing.put(uri,
        CompletableFuture.supplyAsync(() -> indexPhase(uri, text, versions.get(uri)), executor)));
    Map<String, List<Diagnostic>> phase1 = join(indexing);

    Map<String, CompletableFuture<List<Diagnostic>>> analysis = new LinkedHashMap<>();
    phase1.forEach((uri, diags) -> {
      if (diags == null) return; // stale
      analysis.put(uri, CompletableFuture.supplyAsync(
          () -> analyzePhase(uri, textByUri.get(uri), versions.get(uri), diags), executor));
    });
    Map<String, List<Diagnostic>> out = new LinkedHashMap<>();
    join(analysis).forEach((uri, diags) -> out.put(uri, diags == null ? List.of() : diags));
    log.debug("Indexed {} files in bulk", out.size());
    return out;
  }

  @Override
  public List<Diagnostic> changeFile(String uri, String text) {
    int version = docs.put(uri, text);
    return reindex(uri, text, version);
  }

  @Override
  public List<Diagnostic> changeFile(String uri, int version, String text) {
    if (!docs.put(uri, version, text)) {
      log.debug("Ignoring stale change of {} at version {}", uri, version);
      return List.of();
    }
    return reindex(uri, text, version);
  }

  @Override
  public void closeFile(String uri) {
    docs.remove(uri);
    index.removeFile(uri);
    var pl = pluginByUri.remove(uri);
    if (pl != null) {
      try {
        pl.forget(uri);
      } catch (RuntimeException e) {
        log.warn("Plugin {} failed to forget {}", pl.id(), uri, e);
      }
    }
  }

  @Override
  public List<Diagnostic> analyze(String uri) {
    String text = docs.get(uri);
    if (text == null) return List.of();
    return reindex(uri, text, docs.version(uri));
  }

  /** True if {@code version} is still the newest text held for {@code uri}. */
  public boolean isCurrent(String uri, int version) {
    return docs.version(uri) == version;
  }

  @Override
  public List<CompletionItem> completions(String uri, Position position) {
    var pl = pluginByUri.get(uri);
    String text = docs.get(uri);
    if (pl == null || text == null) return List.of();
    try {
      return pl.completions(uri, text, position, index);
    } catch (RuntimeException e) {
      log.warn("Completion failed in {} at {}", uri, position, e);
      return List.of();
    }
  }

  @Override
  public Optional<Location> definition(String uri, Position position) {
    var pl = pluginByUri.get(uri);
    String text = docs.get(uri);
    if (pl == null || text == null) return Optional.empty();
    try {
      return pl.resolveSymbol(uri, text, position, index).map(Symbol::getLocation);
    } catch (RuntimeException e) {
      log.warn("Definition lookup failed in {} at {}", uri, position, e);
      return Optional.empty();
    }
  }

  @Override
  public Optional<String> hover(String uri, Position position) {
    var pl = pluginByUri.get(uri);
    String text = docs.get(uri);
    if (pl == null || text == null) return Optional.empty();
    try {
      return pl.hover(uri, text, position, index);
    } catch (RuntimeException e) {
      log.warn("Hover failed in {} at {}", uri, position, e);
      return Optional.empty();
    }
  }

  @Override
  public List<TextEdit> format(String uri) {
    var pl = pluginByUri.get(uri);
    String text = docs.get(uri);
    if (pl == null || text == null) return List.of();
    try {
      return pl.format(uri, text);
    } catch (RuntimeException e) {
      log.warn("Formatting failed in {}", uri, e);
      return List.of();
    }
  }

  @Override
  public RenameTarget prepareRename(String uri, Position position) throws RenameException {
    return pluginFor(uri).prepareRename(uri, docs.get(uri), position, index);
  }

  @Override
  public WorkspaceEdit rename(String uri, Position position, String newName) throws RenameException {
    return pluginFor(uri).rename(uri, docs.get(uri), position, newName, index, docs);
  }

  @Override
  public List<Symbol> findByName(String name) {
    return index.findByName(name);
  }

  @Override
  public List<Symbol> allSymbols() {
    return index.allSymbols();
  }

  @Override
  public IndexStats indexStats() {
    return index.stats();
  }

  // --- internals --------------------------------------------------------------------------------

  private LangPlugin pluginFor(String uri) throws RenameException {
    var pl = pluginByUri.get(uri);
    if (pl == null || docs.get(uri) == null) {
      throw new RenameException("Document " + uri + " is not open");
    }
    return pl;
  }

  private List<Diagnostic> reindex(String uri, String text, int version) {
    List<Diagnostic> phase1 = indexPhase(uri, text, version);
    if (phase1 == null) return List.of();
    List<Diagnostic> all = analyzePhase(uri, text, version, phase1);
    return all == null ? List.of() : all;
  }

  /** Extract and commit the file's symbols. Null when the text is stale. */
  private List<Diagnostic> indexPhase(String uri, String text, int version) {
    var pluginOpt = plugins.forFile(uri, () -> TokenUtil.preview(text));
    if (pluginOpt.isEmpty()) {
      // Clear any stale symbols for this file and report info diagnostic
      index.removeFile(uri);
      return List.of(new Diagnostic(
          new Range(new Position(0,0), new Position(0,1)),
          "No plugin registered to handle " + uri,
          Diagnostic.Severity.INFORMATION,
          "core",
          "no-plugin"));
    }

    LangPlugin plugin = pluginOpt.get();
    pluginByUri.put(uri, plugin);

    List<Symbol> batch = new ArrayList<>();
    List<Diagnostic> diags;
    try {
      diags = plugin.index(uri, text, batch::add);
    } catch (RuntimeException e) {
      log.error("Plugin {} failed to index {}", plugin.id(), uri, e);
      batch.clear();
      diags = List.of(pluginError(plugin, e));
    }

    if (!isCurrent(uri, version) || !index.upsertFile(uri, version, batch)) {
      log.debug("Discarding stale parse of {} at version {}", uri, version);
      return null;
    }
    return diags;
  }

  /** Run the index-dependent checks and merge them after the phase 1 diagnostics. */
  private List<Diagnostic> analyzePhase(String uri, String text, int version, List<Diagnostic> phase1) {
    LangPlugin plugin = pluginByUri.get(uri);
    List<Diagnostic> out = new ArrayList<>(phase1);
    if (plugin != null) {
      try {
        out.addAll(plugin.analyze(uri, text, index));
      } catch (RuntimeException e) {
        log.error("Plugin {} failed to analyze {}", plugin.id(), uri, e);
        out.add(pluginError(plugin, e));
      }
    }
    return isCurrent(uri, version) ? List.copyOf(out) : null;
  }

  private static Diagnostic pluginError(LangPlugin plugin, Exception e) {
    return new Diagnostic(
        new Range(new Position(0,0), new Position(0,1)),
        "Plugin error: " + e.getMessage(),
        Diagnostic.Severity.ERROR,
        plugin.id(),
        "plugin-exception");
  }

  private static Map<String, List<Diagnostic>> join(Map<String, CompletableFuture<List<Diagnostic>>> futures) {
    Map<String, List<Diagnostic>> out = new LinkedHashMap<>();
    futures.forEach((uri, f) -> {
      try {
        out.put(uri, f.join());
      } catch (CompletionException e) {
        throw new IllegalStateException("Indexing " + uri + " failed", e.getCause());
      }
    });
    return out;
  }
}
