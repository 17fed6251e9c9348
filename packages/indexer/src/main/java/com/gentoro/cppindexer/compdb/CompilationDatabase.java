package com.gentoro.cppindexer.compdb;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.cppindexer.exception.DatabaseLoadException;
import com.gentoro.cppindexer.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A JSON compilation database ({@code compile_commands.json}). Entries use either the {@code
 * arguments} array or the {@code command} string form; {@code arguments} wins when both exist.
 */
public class CompilationDatabase {
  private final Path source;
  private final List<CompileCommand> commands;

  private CompilationDatabase(Path source, List<CompileCommand> commands) {
    this.source = source;
    this.commands = Collections.unmodifiableList(commands);
  }

  public static CompilationDatabase load(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new DatabaseLoadException("Compilation database not found: " + file);
    }
    JsonNode root;
    try {
      root = JacksonUtility.getJsonMapper().readTree(file.toFile());
    } catch (JsonProcessingException e) {
      throw new DatabaseLoadException(
          "Invalid JSON in compilation database " + file + ": " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new DatabaseLoadException("Failed to read compilation database " + file, e);
    }
    if (root == null || !root.isArray()) {
      throw new DatabaseLoadException(
          "Compilation database " + file + " must contain a JSON array of entries");
    }

    List<CompileCommand> commands = new ArrayList<>();
    int index = 0;
    for (JsonNode entry : root) {
      commands.add(toCommand(file, index++, entry));
    }
    return new CompilationDatabase(file, commands);
  }

  private static CompileCommand toCommand(Path file, int index, JsonNode entry) {
    if (!entry.isObject()) {
      throw invalidEntry(file, index, "entry is not an object");
    }
    String directory = text(entry, "directory");
    String filename = text(entry, "file");
    if (directory == null) throw invalidEntry(file, index, "missing 'directory'");
    if (filename == null) throw invalidEntry(file, index, "missing 'file'");

    List<String> commandLine;
    JsonNode arguments = entry.get("arguments");
    if (arguments != null && arguments.isArray()) {
      commandLine = new ArrayList<>();
      for (JsonNode arg : arguments) {
        commandLine.add(arg.asText());
      }
    } else if (text(entry, "command") != null) {
      commandLine = CommandLineTokenizer.tokenize(text(entry, "command"));
    } else {
      throw invalidEntry(file, index, "missing both 'arguments' and 'command'");
    }
    return new CompileCommand(directory, commandLine, filename, text(entry, "output"));
  }

  private static String text(JsonNode entry, String field) {
    JsonNode value = entry.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static DatabaseLoadException invalidEntry(Path file, int index, String reason) {
    return (DatabaseLoadException)
        new DatabaseLoadException(
                "Invalid entry #" + index + " in compilation database " + file + ": " + reason)
            .withContext("entry", index);
  }

  public List<CompileCommand> getAllCompileCommands() {
    return commands;
  }

  public int size() {
    return commands.size();
  }

  public Path getSource() {
    return source;
  }
}
