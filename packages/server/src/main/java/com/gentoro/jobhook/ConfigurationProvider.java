package com.gentoro.jobhook;

import com.gentoro.jobhook.exception.ConfigException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Loads the YAML application configuration, either from an explicit file or from {@code
 * application.yaml} on the classpath. Values may reference the environment with {@code
 * ${env:NAME}}.
 */
public final class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final Configuration config;

  public ConfigurationProvider(String configFile) {
    this.config =
        configFile == null ? loadResource(DEFAULT_RESOURCE) : loadFile(Path.of(configFile));
  }

  public Configuration config() {
    return config;
  }

  private static Configuration loadFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file not found: " + path.toAbsolutePath());
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration file " + path, e);
    }
  }

  private static Configuration loadResource(String name) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(name);
    if (in == null) {
      throw new ConfigException("Configuration resource not found on classpath: " + name);
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (Exception e) {
      throw new ConfigException("Failed to read configuration resource " + name, e);
    }
  }

  private static Configuration read(Reader reader) throws Exception {
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.read(reader);
    return yaml;
  }
}
