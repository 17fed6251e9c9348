package com.gentoro.cppindexer;

import com.gentoro.cppindexer.exception.ConfigurationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;

/**
 * Options of one indexing run.
 *
 * @param inputs compilation databases to parse; entries that are not regular files are skipped
 * @param jobs number of parser threads, at least 1
 * @param incremental clean up records of changed or removed files before parsing
 * @param skipDocComments tell the translation unit parser not to collect documentation comments
 */
public record IndexerOptions(
    List<Path> inputs, int jobs, boolean incremental, boolean skipDocComments) {

  public IndexerOptions {
    inputs = List.copyOf(inputs);
    if (jobs < 1) {
      throw new ConfigurationException("jobs must be at least 1, got " + jobs);
    }
  }

  public static IndexerOptions from(Configuration configuration) {
    List<Path> inputs = new ArrayList<>();
    for (String input : configuration.getList(String.class, "indexer.input", List.of())) {
      if (StringUtils.isNotBlank(input)) {
        inputs.add(Path.of(input.trim()));
      }
    }
    int jobs;
    try {
      jobs =
          configuration.getInt("indexer.jobs", Runtime.getRuntime().availableProcessors());
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigurationException(
          "indexer.jobs must be an integer: " + configuration.getString("indexer.jobs"), e);
    }
    return new IndexerOptions(
        inputs,
        jobs,
        configuration.getBoolean("indexer.incremental", false),
        configuration.getBoolean("indexer.skip-doc-comments", false));
  }
}
