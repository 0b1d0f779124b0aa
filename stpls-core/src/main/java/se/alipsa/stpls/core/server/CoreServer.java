package se.alipsa.stpls.core.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.stpls.core.*;
import se.alipsa.stpls.core.model.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process server façade for fast local usage.
 * - Delegates to CoreEngine
 * - Publishes diagnostics via DiagnosticsPublisher
 */
public final class CoreServer implements CoreFacade, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(CoreServer.class);

  private final CoreEngine engine;
  private final PluginRegistry registry;
  private final DiagnosticsPublisher publisher;

  // for lifecycle management if we created the executor
  private final ExecutorService executor;
  private final boolean ownsExecutor;

  private CoreServer(CoreEngine engine, PluginRegistry registry, DiagnosticsPublisher publisher,
                     ExecutorService executor, boolean ownsExecutor) {
    this.engine = Objects.requireNonNull(engine);
    this.registry = Objects.requireNonNull(registry);
    this.publisher = Objects.requireNonNullElse(publisher, DiagnosticsPublisher.NO_OP);
    this.executor = executor;
    this.ownsExecutor = ownsExecutor;
  }

  /** Build a CoreServer with sensible defaults and plugins discovered via ServiceLoader. */
  public static CoreServer createDefault(DiagnosticsPublisher publisher) {
    return create(Map.of(), publisher);
  }

  /** Like {@link #createDefault} but with explicit plugin settings (override system properties). */
  public static CoreServer create(Map<String, String> settings, DiagnosticsPublisher publisher) {
    ExecutorService executor = Executors.newFixedThreadPool(
        Math.max(2, Runtime.getRuntime().availableProcessors()), daemonThreads());
    return assemble(new SymbolIndex(), new DocumentStore(), executor, true, settings, publisher);
  }

  /** Advanced factory in case you want to supply your own pieces (tests, custom exec, etc.). */
  public static CoreServer create(SymbolIndex index,
                                  DocumentStore docs,
                                  ExecutorService executor,
                                  Map<String, String> settings,
                                  DiagnosticsPublisher publisher) {
    return assemble(index, docs, executor, false, settings, publisher);
  }

  private static CoreServer assemble(SymbolIndex index, DocumentStore docs, ExecutorService executor,
                                     boolean owns, Map<String, String> settings,
                                     DiagnosticsPublisher publisher) {
    PluginEnvironment env = new DefaultPluginEnvironment(index, executor, settings);
    PluginRegistry registry = new PluginRegistry(env);
    CoreEngine engine = new CoreEngine(registry, index, docs, executor);
    return new CoreServer(engine, registry, publisher, executor, owns);
  }

  public PluginRegistry plugins() {
    return registry;
  }

  /** Load and index every source file below {@code root} that some plugin handles. */
  public Map<String, List<Diagnostic>> indexWorkspace(Path root) throws IOException {
    Map<String, String> files = new WorkspaceScanner(registry.fileExtensions()).load(root);
    log.info("Indexing {} files from {}", files.size(), root);
    return openFiles(files);
  }

  // --- CoreFacade (delegates + publishes diagnostics) -------------------------------------------

  @Override
  public List<Diagnostic> openFile(String uri, String text) {
    List<Diagnostic> diags = engine.openFile(uri, text);
    publisher.publish(uri, diags);
    return diags;
  }

  @Override
  public Map<String, List<Diagnostic>> openFiles(Map<String, String> textByUri) {
    Map<String, List<Diagnostic>> diags = engine.openFiles(textByUri);
    diags.forEach(publisher::publish);
    return diags;
  }

  @Override
  public List<Diagnostic> changeFile(String uri, String text) {
    List<Diagnostic> diags = engine.changeFile(uri, text);
    publisher.publish(uri, diags);
    return diags;
  }

  @Override
  public List<Diagnostic> changeFile(String uri, int version, String text) {
    List<Diagnostic> diags = engine.changeFile(uri, version, text);
    // a stale version yields nothing and must not wipe what the newer version published
    if (engine.isCurrent(uri, version)) publisher.publish(uri, diags);
    return diags;
  }

  @Override
  public void closeFile(String uri) {
    engine.closeFile(uri);
    publisher.publish(uri, List.of()); // clear diagnostics
  }

  @Override
  public List<Diagnostic> analyze(String uri) {
    List<Diagnostic> diags = engine.analyze(uri);
    publisher.publish(uri, diags);
    return diags;
  }

  @Override
  public List<CompletionItem> completions(String uri, Position position) {
    return engine.completions(uri, position);
  }

  @Override
  public Optional<Location> definition(String uri, Position position) {
    return engine.definition(uri, position);
  }

  @Override
  public Optional<String> hover(String uri, Position position) {
    return engine.hover(uri, position);
  }

  @Override
  public List<TextEdit> format(String uri) {
    return engine.format(uri);
  }

  @Override
  public RenameTarget prepareRename(String uri, Position position) throws RenameException {
    return engine.prepareRename(uri, position);
  }

  @Override
  public WorkspaceEdit rename(String uri, Position position, String newName) throws RenameException {
    return engine.rename(uri, position, newName);
  }

  @Override
  public List<Symbol> findByName(String name) {
    return engine.findByName(name);
  }

  @Override
  public List<Symbol> allSymbols() {
    return engine.allSymbols();
  }

  @Override
  public IndexStats indexStats() {
    return engine.indexStats();
  }

  // --- Lifecycle --------------------------------------------------------------------------------

  @Override
  public void close() {
    if (ownsExecutor) {
      executor.shutdown();
    }
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "stpls-worker-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
