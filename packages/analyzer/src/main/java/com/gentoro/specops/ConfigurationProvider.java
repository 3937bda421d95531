package com.gentoro.specops;

import com.gentoro.specops.exception.ConfigException;
import com.gentoro.specops.exception.SerializationException;
import com.gentoro.specops.logging.LoggingService;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.InputStream;
import java.io.StringReader;
import java.net.URI;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads YAML configuration and exposes an Apache Commons Configuration instance.
 *
 * <p>Location formats supported: "classpath:some/path.yaml" (loaded from the classpath) or an
 * absolute or relative filesystem path. A blank location means "classpath:application.yaml".
 * Values may reference environment variables through {@code ${env:NAME}}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.specops.logging.LoggingService.getLogger(ConfigurationProvider.class);

  public static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration configuration;

  public ConfigurationProvider() {
    this(null);
  }

  public ConfigurationProvider(String location) {
    this.configuration = loadYamlFromLocation(location);
    LoggingService.applyConfiguration(configuration);
  }

  /** Access to raw Commons Configuration object. */
  public Configuration config() {
    return configuration;
  }

  /** Typed analyzer settings derived from the loaded configuration. */
  public AnalyzerSettings settings() {
    return AnalyzerSettings.from(configuration);
  }

  private static Configuration loadYamlFromClasspath(String resourceName) {
    URL resourceUrl = Thread.currentThread().getContextClassLoader().getResource(resourceName);
    if (resourceUrl == null) {
      // Missing resource yields an empty configuration so compiled-in defaults apply.
      log.debug("Configuration resource {} not found on classpath; using defaults", resourceName);
      return new YAMLConfiguration();
    }
    log.info("Loading configuration from classpath resource: {}", resourceName);
    try (InputStream input =
        Thread.currentThread().getContextClassLoader().getResourceAsStream(resourceName)) {
      if (input == null) {
        throw new FileNotFoundException("Resource not found: %s".formatted(resourceName));
      }
      String yamlContent = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      YAMLConfiguration config = new YAMLConfiguration();
      config.read(new StringReader(yamlContent));
      return config;
    } catch (Exception e) {
      throw new SerializationException(
          "Failed to read YAML from classpath resource: " + resourceName, e);
    }
  }

  private static Configuration loadYamlFromFile(File file) {
    if (!file.isFile()) {
      throw new ConfigException("Configuration file does not exist: " + file);
    }
    try {
      Parameters params = new Parameters();
      FileBasedConfigurationBuilder<YAMLConfiguration> builder =
          new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
              .configure(params.fileBased().setFile(file));
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load YAML file: " + file, e);
    }
  }

  private static Configuration loadYamlFromLocation(String location) {
    if (location == null || location.isBlank()) {
      return loadYamlFromClasspath(DEFAULT_RESOURCE);
    }
    String loc = location.trim();
    if (loc.startsWith("classpath:")) {
      return loadYamlFromClasspath(loc.substring("classpath:".length()));
    }
    try {
      URI uri = URI.create(loc);
      if (uri.getScheme() != null && uri.getScheme().equalsIgnoreCase("file")) {
        return loadYamlFromFile(new File(uri));
      }
    } catch (IllegalArgumentException ignored) {
      // not a URI, treated as a plain path below
    }
    return loadYamlFromFile(new File(loc));
  }
}
