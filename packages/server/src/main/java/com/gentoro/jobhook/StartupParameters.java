package com.gentoro.jobhook;

import java.util.HashMap;
import java.util.Map;

/** Command-line arguments of the form {@code --key=value} (or bare {@code --flag}). */
public final class StartupParameters {
  private final Map<String, String> values = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || !arg.startsWith("--") || arg.length() == 2) continue;
      String body = arg.substring(2);
      int eq = body.indexOf('=');
      if (eq < 0) {
        values.put(body, "true");
      } else {
        values.put(body.substring(0, eq), body.substring(eq + 1));
      }
    }
  }

  public String getParameter(String name) {
    return values.get(name);
  }

  public String getParameter(String name, String defaultValue) {
    return values.getOrDefault(name, defaultValue);
  }

  /** Path of an explicit configuration file, or {@code null} to use the bundled one. */
  public String configFile() {
    return values.get("config");
  }
}
