package se.alipsa.stpls.st;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.stpls.core.*;
import se.alipsa.stpls.core.model.*;
import se.alipsa.stpls.st.diagnostics.DiagnosticCode;
import se.alipsa.stpls.st.diagnostics.SemanticChecks;
import se.alipsa.stpls.st.diagnostics.StructuralChecks;
import se.alipsa.stpls.st.format.FormatOptions;
import se.alipsa.stpls.st.format.StFormatter;
import se.alipsa.stpls.st.nav.CompletionSource;
import se.alipsa.stpls.st.nav.DefinitionFinder;
import se.alipsa.stpls.st.nav.HoverBuilder;
import se.alipsa.stpls.st.rename.RenameEngine;
import se.alipsa.stpls.st.symbols.StDocument;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/** IEC 61131-3 Structured Text support. */
public final class StPlugin implements LangPlugin {

  private static final Logger log = LoggerFactory.getLogger(StPlugin.class);

  public static final String ID = DiagnosticCode.SOURCE;
  public static final String MAX_DISTANCE_SETTING = "st.definition.maxDistance";
  public static final String TAB_SIZE_SETTING = "st.format.tabSize";
  public static final String INSERT_SPACES_SETTING = "st.format.insertSpaces";
  public static final String KEYWORD_CASE_SETTING = "st.format.keywordCase";
  static final int DEFAULT_MAX_DISTANCE = 5;

  private final Map<String, StDocument> documents = new ConcurrentHashMap<>();
  private volatile int maxDistance = DEFAULT_MAX_DISTANCE;
  private volatile FormatOptions formatOptions = FormatOptions.defaults();

  @Override public String id() { return ID; }
  @Override public String displayName() { return "Structured Text"; }
  @Override public Set<String> fileExtensions() { return Set.of("st", "iecst"); }

  @Override
  public void configure(PluginEnvironment env) {
    maxDistance = Math.max(0, env.intSetting(MAX_DISTANCE_SETTING, DEFAULT_MAX_DISTANCE));
    FormatOptions defaults = FormatOptions.defaults();
    formatOptions = defaults
        .withTabSize(Math.max(1, env.intSetting(TAB_SIZE_SETTING, defaults.getTabSize())))
        .withInsertSpaces(env.setting(INSERT_SPACES_SETTING).map(v -> !"false".equalsIgnoreCase(v.trim())).orElse(true))
        .withKeywordCase(FormatOptions.KeywordCase.parse(env.setting(KEYWORD_CASE_SETTING).orElse(null),
            defaults.getKeywordCase()));
    log.debug("Configured {} with {}={}, {}", ID, MAX_DISTANCE_SETTING, maxDistance, formatOptions);
  }

  @Override
  public List<Diagnostic> index(String fileUri, String content, SymbolReporter reporter) {
    StDocument doc = StDocument.parse(fileUri, content);
    documents.put(fileUri, doc);
    doc.getSymbols().forEach(reporter::report);
    List<Diagnostic> diagnostics = StructuralChecks.check(doc.getModel());
    log.debug("Indexed {}: {} symbols, {} structural diagnostics", fileUri, doc.getSymbols().size(), diagnostics.size());
    return diagnostics;
  }

  @Override
  public List<Diagnostic> analyze(String fileUri, String content, CoreQuery core) {
    return SemanticChecks.check(document(fileUri, content), core);
  }

  @Override
  public Optional<Symbol> resolveSymbol(String fileUri, String content, Position position, CoreQuery core) {
    return new DefinitionFinder(core, document(fileUri, content), maxDistance).find(position);
  }

  @Override
  public List<CompletionItem> completions(String fileUri, String content, Position position, CoreQuery core) {
    return new CompletionSource(core, document(fileUri, content)).complete(position);
  }

  @Override
  public Optional<String> hover(String fileUri, String content, Position position, CoreQuery core) {
    return new HoverBuilder(core, document(fileUri, content)).hover(position);
  }

  @Override
  public RenameTarget prepareRename(String fileUri, String content, Position position, CoreQuery core)
      throws RenameException {
    return new RenameEngine(core).prepare(document(fileUri, content), position);
  }

  @Override
  public WorkspaceEdit rename(String fileUri, String content, Position position, String newName,
                             CoreQuery core, DocumentStore store) throws RenameException {
    return new RenameEngine(core).rename(document(fileUri, content), position, newName, store);
  }

  @Override
  public List<TextEdit> format(String fileUri, String content) {
    return new StFormatter(formatOptions).edits(content);
  }

  @Override
  public void forget(String fileUri) {
    documents.remove(fileUri);
  }

  /** The parsed document for exactly this text; re-parses when the cached one is stale. */
  StDocument document(String fileUri, String content) {
    StDocument cached = documents.get(fileUri);
    if (cached != null && cached.getText().equals(content)) return cached;
    StDocument doc = StDocument.parse(fileUri, content);
    documents.put(fileUri, doc);
    return doc;
  }
}
