package com.gentoro.cppindexer;

import com.gentoro.cppindexer.exception.ConfigurationException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line parameters.
 *
 * <p>Accepted forms: {@code --name=value}, {@code --name value} and bare flags {@code --name}
 * (value {@code true}). Parameters may repeat. Arguments not starting with {@code --} are
 * collected as {@code input}.
 */
public class StartupParameters {
  /** Parameter name to configuration key. */
  private static final Map<String, String> CONFIG_KEYS =
      Map.of(
          "input", "indexer.input",
          "jobs", "indexer.jobs",
          "incremental", "indexer.incremental",
          "skip-doc-comments", "indexer.skip-doc-comments",
          "store", "store.json.location",
          "store-driver", "store.driver",
          "parser", "parser.provider");

  private static final List<String> FLAGS =
      List.of("incremental", "skip-doc-comments", "help");

  private final Map<String, List<String>> parameters = new LinkedHashMap<>();

  public StartupParameters(String[] args) {
    parse(args == null ? new String[0] : args);
  }

  private void parse(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (!arg.startsWith("--")) {
        add("input", arg);
        continue;
      }
      String body = arg.substring(2);
      if (body.isEmpty()) {
        throw new ConfigurationException("Empty parameter name in '" + arg + "'");
      }
      int eq = body.indexOf('=');
      if (eq >= 0) {
        add(body.substring(0, eq), body.substring(eq + 1));
      } else if (FLAGS.contains(body) || i + 1 >= args.length || args[i + 1].startsWith("--")) {
        add(body, "true");
      } else {
        add(body, args[++i]);
      }
    }
  }

  private void add(String name, String value) {
    parameters.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
  }

  public boolean hasParameter(String name) {
    return parameters.containsKey(name);
  }

  /** All values given for {@code name}, in command line order. */
  public List<String> getParameters(String name) {
    return Collections.unmodifiableList(parameters.getOrDefault(name, List.of()));
  }

  /** Last value given for {@code name}, converted to {@code type}, or null when absent. */
  public <T> T getParameter(String name, Class<T> type) {
    List<String> values = parameters.get(name);
    if (values == null || values.isEmpty()) return null;
    String value = values.get(values.size() - 1);
    try {
      if (type == String.class) return type.cast(value);
      if (type == Integer.class) return type.cast(Integer.valueOf(value.trim()));
      if (type == Boolean.class) return type.cast(Boolean.valueOf(value.trim()));
      if (type == Path.class) return type.cast(Path.of(value));
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
          "Parameter --" + name + " expects " + type.getSimpleName() + ", got '" + value + "'", e);
    }
    throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
  }

  public Path configFile() {
    return getParameter("config", Path.class);
  }

  public boolean isHelpRequested() {
    return hasParameter("help");
  }

  /** Parameters that map onto configuration keys, ready to override the YAML configuration. */
  public Map<String, Object> configurationOverrides() {
    Map<String, Object> overrides = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : CONFIG_KEYS.entrySet()) {
      List<String> values = parameters.get(e.getKey());
      if (values == null) continue;
      if ("input".equals(e.getKey())) {
        overrides.put(e.getValue(), new ArrayList<>(values));
      } else {
        overrides.put(e.getValue(), values.get(values.size() - 1));
      }
    }
    return overrides;
  }

  public static String usage() {
    return String.join(
        System.lineSeparator(),
        "Usage: cpp-indexer [options] <compile_commands.json>...",
        "  --input <path>          compilation database to parse (repeatable)",
        "  --jobs <n>              number of parser threads",
        "  --incremental           clean up records of changed/removed files first",
        "  --skip-doc-comments     do not extract documentation comments",
        "  --store <path>          location of the JSON index snapshot",
        "  --store-driver <id>     index store driver (json-file, in-memory)",
        "  --parser <id>           translation unit parser provider",
        "  --config <file>         YAML configuration file",
        "  --help                  print this message");
  }
}
