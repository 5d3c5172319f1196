package com.gentoro.metabasemcp;

import com.gentoro.metabasemcp.exception.ConfigException;
import java.util.HashMap;
import java.util.Map;

/**
 * Command line arguments.
 *
 * <p>Accepts {@code --name value} pairs plus the transport shorthands {@code --stdio}, {@code
 * --http} and {@code --sse} (an alias of {@code --http}).
 */
public class StartupParameters {
  private final Map<String, String> parameters = new HashMap<>();

  public StartupParameters(String[] args) {
    if (args == null) {
      return;
    }
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        throw new ConfigException("Unexpected argument: " + arg);
      }
      String name = arg.substring(2);
      switch (name) {
        case "stdio" -> parameters.put("transport", "stdio");
        case "http", "sse" -> parameters.put("transport", "http");
        default -> {
          if (i + 1 >= args.length || args[i + 1].startsWith("--")) {
            throw new ConfigException("Missing value for argument: " + arg);
          }
          parameters.put(name, args[++i]);
        }
      }
    }
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public String getParameter(String name, String defaultValue) {
    return parameters.getOrDefault(name, defaultValue);
  }

  public String configFile() {
    return getParameter("config-file", ConfigurationProvider.DEFAULT_LOCATION);
  }

  /** Transport from the command line, or {@code null} when the configuration should decide. */
  public String transport() {
    return getParameter("transport");
  }
}
