package com.gentoro.metabasemcp;

import com.gentoro.metabasemcp.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the YAML application configuration.
 *
 * <p>The location may be a {@code classpath:} resource, a {@code file:} URI or a plain file path.
 * Values support {@code ${env:NAME:-default}} interpolation.
 */
public class ConfigurationProvider {
  public static final String DEFAULT_LOCATION = "classpath:application.yaml";

  private static final org.slf4j.Logger log =
      com.gentoro.metabasemcp.logging.LoggingService.getLogger(ConfigurationProvider.class);

  private final Configuration config;

  public ConfigurationProvider(String location) {
    String resolved = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    this.config = load(resolved);
    log.debug("Loaded configuration from {}", resolved);
  }

  public Configuration config() {
    return config;
  }

  private static Configuration load(String location) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try (InputStream in = open(location);
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      yaml.read(reader);
      return yaml;
    } catch (ConfigException e) {
      throw e;
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration from " + location, e);
    }
  }

  private static InputStream open(String location) throws Exception {
    if (location.startsWith("classpath:")) {
      String resource = location.substring("classpath:".length());
      if (resource.startsWith("/")) resource = resource.substring(1);
      InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
      if (in == null) {
        throw new ConfigException("Configuration resource not found on classpath: " + resource);
      }
      return in;
    }
    Path path = location.startsWith("file:") ? Paths.get(URI.create(location)) : Paths.get(location);
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    return Files.newInputStream(path);
  }
}
