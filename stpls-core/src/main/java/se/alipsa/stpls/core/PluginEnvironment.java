package se.alipsa.stpls.core;

import java.util.Optional;
import java.util.concurrent.Executor;

public interface PluginEnvironment {
  CoreQuery core();           // query global index
  Executor executor();        // background tasks if needed
  Optional<String> setting(String key);
  void log(String level, String message, Throwable t);

  default int intSetting(String key, int defaultValue) {
    return setting(key).map(String::trim).map(v -> {
      try {
        return Integer.parseInt(v);
      } catch (NumberFormatException e) {
        log("WARN", "Setting " + key + "=" + v + " is not an integer, using " + defaultValue, null);
        return defaultValue;
      }
    }).orElse(defaultValue);
  }
}
