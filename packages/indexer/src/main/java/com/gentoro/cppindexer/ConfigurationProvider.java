package com.gentoro.cppindexer;

import com.gentoro.cppindexer.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;

/**
 * Layers the application configuration. Precedence, highest first: command line overrides, the
 * YAML file given with {@code --config}, the bundled {@code application.yaml}.
 */
public class ConfigurationProvider {
  static final String DEFAULT_RESOURCE = "application.yaml";

  private final CompositeConfiguration config = new CompositeConfiguration();

  public ConfigurationProvider(Path configFile, Map<String, Object> overrides) {
    BaseConfiguration cli = new BaseConfiguration();
    if (overrides != null) {
      overrides.forEach(cli::setProperty);
    }
    config.addConfiguration(cli);

    if (configFile != null) {
      if (!Files.isRegularFile(configFile)) {
        throw new ConfigurationException("Configuration file not found: " + configFile);
      }
      try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
        config.addConfiguration(readYaml(reader, configFile.toString()));
      } catch (IOException e) {
        throw new ConfigurationException("Failed reading configuration file: " + configFile, e);
      }
    }

    try (InputStream in =
        ConfigurationProvider.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in != null) {
        config.addConfiguration(
            readYaml(new InputStreamReader(in, StandardCharsets.UTF_8), DEFAULT_RESOURCE));
      }
    } catch (IOException e) {
      throw new ConfigurationException("Failed reading bundled " + DEFAULT_RESOURCE, e);
    }
  }

  private static YAMLConfiguration readYaml(Reader reader, String origin) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Invalid YAML configuration in " + origin, e);
    }
    return yaml;
  }

  public Configuration config() {
    return config;
  }
}
