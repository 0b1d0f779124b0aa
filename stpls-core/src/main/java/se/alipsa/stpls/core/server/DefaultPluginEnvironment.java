package se.alipsa.stpls.core.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import se.alipsa.stpls.core.CoreQuery;
import se.alipsa.stpls.core.PluginEnvironment;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * PluginEnvironment used by the in-proc server bootstrap. Settings come from the map given at
 * construction, falling back to system properties prefixed with {@code stpls.}.
 */
final class DefaultPluginEnvironment implements PluginEnvironment {

  static final String PROPERTY_PREFIX = "stpls.";

  private static final Logger log = LoggerFactory.getLogger("se.alipsa.stpls.plugin");

  private final CoreQuery core;
  private final Executor executor;
  private final Map<String, String> settings;

  DefaultPluginEnvironment(CoreQuery core, Executor executor, Map<String, String> settings) {
    this.core = Objects.requireNonNull(core);
    this.executor = Objects.requireNonNull(executor);
    this.settings = Map.copyOf(settings);
  }

  @Override public CoreQuery core() { return core; }

  @Override public Executor executor() { return executor; }

  @Override public Optional<String> setting(String key) {
    String value = settings.get(key);
    if (value == null) value = System.getProperty(PROPERTY_PREFIX + key);
    return Optional.ofNullable(value);
  }

  @Override public void log(String level, String message, Throwable t) {
    switch (level == null ? "INFO" : level.toUpperCase(Locale.ROOT)) {
      case "ERROR" -> log.error(message, t);
      case "WARN", "WARNING" -> log.warn(message, t);
      case "DEBUG" -> log.debug(message, t);
      case "TRACE" -> log.trace(message, t);
      default -> log.info(message, t);
    }
  }
}
