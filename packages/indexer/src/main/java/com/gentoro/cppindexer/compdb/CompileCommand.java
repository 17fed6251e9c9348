package com.gentoro.cppindexer.compdb;

import java.util.List;

/**
 * One entry of a compilation database.
 *
 * @param directory working directory of the compiler invocation
 * @param commandLine full argument list, compiler first
 * @param filename primary source file, possibly relative to {@code directory}
 * @param output declared output file, or null when the entry has none
 */
public record CompileCommand(
    String directory, List<String> commandLine, String filename, String output) {

  public CompileCommand {
    commandLine = List.copyOf(commandLine);
  }

  public CompileCommand(String directory, List<String> commandLine, String filename) {
    this(directory, commandLine, filename, null);
  }

  /** Arguments joined by single spaces; the identity of the command for deduplication. */
  public String commandLineString() {
    return String.join(" ", commandLine);
  }
}
