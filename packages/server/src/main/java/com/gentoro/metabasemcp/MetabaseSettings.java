package com.gentoro.metabasemcp;

import com.gentoro.metabasemcp.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;

/** Connection settings for the Metabase instance, read from the {@code metabase.*} keys. */
public record MetabaseSettings(
    String url, String apiKey, String userEmail, String password, Duration timeout) {

  public MetabaseSettings {
    url = blankToNull(url);
    apiKey = blankToNull(apiKey);
    userEmail = blankToNull(userEmail);
    password = blankToNull(password);
    if (url == null || (apiKey == null && (userEmail == null || password == null))) {
      throw new ConfigException(
          "metabase.url is required, and either metabase.api-key or both metabase.user-email and"
              + " metabase.password must be provided");
    }
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    if (timeout == null) {
      timeout = Duration.ofSeconds(30);
    }
  }

  public static MetabaseSettings from(Configuration configuration) {
    return new MetabaseSettings(
        configuration.getString("metabase.url", null),
        configuration.getString("metabase.api-key", null),
        configuration.getString("metabase.user-email", null),
        configuration.getString("metabase.password", null),
        Duration.ofSeconds(configuration.getLong("metabase.timeout-seconds", 30L)));
  }

  public boolean usesApiKey() {
    return apiKey != null;
  }

  @Override
  public String toString() {
    return "MetabaseSettings[url=" + url + ", auth=" + (usesApiKey() ? "api_key" : "session") + "]";
  }

  // Unresolved ${env:...} placeholders count as absent.
  private static String blankToNull(String value) {
    if (value == null) return null;
    String trimmed = value.trim();
    if (trimmed.isEmpty() || trimmed.startsWith("${")) return null;
    return trimmed;
  }
}
