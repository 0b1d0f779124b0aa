package test.alipsa.stpls.plugins;

import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.LangPlugin;
import se.alipsa.stpls.core.PluginEnvironment;
import se.alipsa.stpls.core.SymbolReporter;
import se.alipsa.stpls.core.TokenUtil;
import se.alipsa.stpls.core.model.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Test plugin for {@code .decl} files holding one {@code name : TYPE} per line. A line reading
 * {@code boom} makes indexing fail; {@code undefined <name>} reports a warning when the name is not
 * in the index.
 */
public final class TrivialDeclPlugin implements LangPlugin {

  private static final Pattern DECL = Pattern.compile("^\\s*([A-Za-z_]\\w*)\\s*:\\s*([A-Za-z_]\\w*)\\s*$");
  private static final Pattern USE = Pattern.compile("^\\s*undefined\\s+([A-Za-z_]\\w*)\\s*$");

  private volatile int maxSymbols = Integer.MAX_VALUE;

  @Override public String id() { return "trivial-decl"; }
  @Override public Set<String> fileExtensions() { return Set.of("decl"); }

  @Override
  public void configure(PluginEnvironment env) {
    maxSymbols = env.intSetting("decl.maxSymbols", Integer.MAX_VALUE);
  }

  @Override
  public List<Diagnostic> index(String fileUri, String content, SymbolReporter reporter) {
    String[] lines = content.split("\n", -1);
    int reported = 0;
    for (int i = 0; i < lines.length; i++) {
      if (lines[i].trim().equals("boom")) throw new IllegalStateException("boom at line " + i);
      Matcher m = DECL.matcher(lines[i]);
      if (m.matches() && reported < maxSymbols) {
        Range r = Range.of(i, m.start(1), m.group(1).length());
        reporter.report(new Symbol(m.group(1), SymbolKind.VARIABLE, Scope.GLOBAL, m.group(2),
            new Location(fileUri, r), ""));
        reported++;
      }
    }
    return List.of();
  }

  @Override
  public List<Diagnostic> analyze(String fileUri, String content, CoreQuery core) {
    List<Diagnostic> out = new ArrayList<>();
    String[] lines = content.split("\n", -1);
    for (int i = 0; i < lines.length; i++) {
      Matcher m = USE.matcher(lines[i]);
      if (m.matches() && core.findByName(m.group(1)).isEmpty()) {
        out.add(new Diagnostic(Range.of(i, m.start(1), m.group(1).length()), "Undefined " + m.group(1),
            Diagnostic.Severity.WARNING, id(), "undefined"));
      }
    }
    return out;
  }

  @Override
  public Optional<Symbol> resolveSymbol(String fileUri, String content, Position position, CoreQuery core) {
    String token = TokenUtil.tokenAt(content, TokenUtil.positionToOffset(content, position.line, position.column));
    return core.findByName(token).stream().findFirst();
  }
}
