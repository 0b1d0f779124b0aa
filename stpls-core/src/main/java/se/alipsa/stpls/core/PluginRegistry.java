package se.alipsa.stpls.core;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public final class PluginRegistry {

  private final Map<String, LangPlugin> byId = new ConcurrentHashMap<>();
  private final List<LangPlugin> all = Collections.synchronizedList(new ArrayList<>());
  private final PluginEnvironment env;

  public PluginRegistry(PluginEnvironment env) {
    this(env, true);
  }

  public PluginRegistry(PluginEnvironment env, boolean discover) {
    this.env = Objects.requireNonNull(env);
    if (discover) loadViaServiceLoader();
  }

  public void register(LangPlugin plugin) {
    Objects.requireNonNull(plugin);
    if (byId.putIfAbsent(plugin.id(), plugin) != null) {
      env.log("WARN", "Plugin with id=" + plugin.id() + " already registered; ignoring duplicate.", null);
      return;
    }
    plugin.configure(env);
    all.add(plugin);
    env.log("INFO", "Registered plugin " + plugin.displayName() + " (" + plugin.id() + ")", null);
  }

  public Optional<LangPlugin> byId(String id) { return Optional.ofNullable(byId.get(id)); }

  /** Choose a plugin by asking each one to claim the file; highest score wins. */
  public Optional<LangPlugin> forFile(String fileUri, Supplier<CharSequence> preview) {
    double best = 0.0; LangPlugin winner = null;
    synchronized (all) {
      for (LangPlugin p : all) {
        double score = p.claim(fileUri, preview);
        if (score > best) { best = score; winner = p; }
      }
    }
    return Optional.ofNullable(winner);
  }

  /** Union of the extensions every registered plugin handles. */
  public Set<String> fileExtensions() {
    Set<String> exts = new TreeSet<>();
    synchronized (all) {
      for (LangPlugin p : all) exts.addAll(p.fileExtensions());
    }
    return exts;
  }

  private void loadViaServiceLoader() {
    ServiceLoader<LangPlugin> sl = ServiceLoader.load(LangPlugin.class);
    for (LangPlugin p : sl) register(p);
  }

  public List<LangPlugin> all() { synchronized (all) { return List.copyOf(all); } }
}
