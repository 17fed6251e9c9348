package com.gentoro.cppindexer;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.cppindexer.exception.ConfigurationException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndexerOptionsTest {

  @Test
  @DisplayName("Bundled defaults apply when nothing is overridden")
  void defaults() {
    IndexerOptions options =
        IndexerOptions.from(new ConfigurationProvider(null, Map.of()).config());
    assertTrue(options.inputs().isEmpty());
    assertEquals(Runtime.getRuntime().availableProcessors(), options.jobs());
    assertFalse(options.incremental());
    assertFalse(options.skipDocComments());
  }

  @Test
  @DisplayName("Command line beats the --config file, which beats the bundled defaults")
  void precedence(@TempDir Path dir) throws Exception {
    Path yaml = dir.resolve("indexer.yaml");
    Files.writeString(
        yaml,
        """
        indexer:
          jobs: 3
          incremental: true
          input:
            - from-file.json
        store:
          driver: in-memory
        """);

    ConfigurationProvider fileOnly = new ConfigurationProvider(yaml, Map.of());
    IndexerOptions fromFile = IndexerOptions.from(fileOnly.config());
    assertEquals(3, fromFile.jobs());
    assertTrue(fromFile.incremental());
    assertEquals(List.of(Path.of("from-file.json")), fromFile.inputs());
    assertEquals("in-memory", fileOnly.config().getString("store.driver"));
    assertEquals("include-scanner", fileOnly.config().getString("parser.provider"));

    ConfigurationProvider withCli =
        new ConfigurationProvider(
            yaml, Map.of("indexer.jobs", "5", "indexer.input", List.of("a.json", "b.json")));
    IndexerOptions fromCli = IndexerOptions.from(withCli.config());
    assertEquals(5, fromCli.jobs());
    assertEquals(List.of(Path.of("a.json"), Path.of("b.json")), fromCli.inputs());
    assertTrue(fromCli.incremental());
  }

  @Test
  @DisplayName("jobs below one or not a number are rejected")
  void invalidJobs() {
    BaseConfiguration config = new BaseConfiguration();
    config.setProperty("indexer.jobs", "0");
    assertThrows(ConfigurationException.class, () -> IndexerOptions.from(config));
    config.setProperty("indexer.jobs", "lots");
    assertThrows(ConfigurationException.class, () -> IndexerOptions.from(config));
  }

  @Test
  @DisplayName("A missing --config file is a configuration error")
  void missingConfigFile(@TempDir Path dir) {
    assertThrows(
        ConfigurationException.class,
        () -> new ConfigurationProvider(dir.resolve("none.yaml"), Map.of()));
  }
}
