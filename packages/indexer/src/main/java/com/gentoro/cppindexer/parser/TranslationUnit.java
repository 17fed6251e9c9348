package com.gentoro.cppindexer.parser;

import com.gentoro.cppindexer.compdb.CompileCommand;
import com.gentoro.cppindexer.exception.CompilationDatabaseException;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Compiler invocation handed to a {@link TranslationUnitParser}.
 *
 * @param workingDirectory directory the compiler would run in
 * @param arguments compiler arguments, without the compiler itself
 * @param filename main source file as written in the compilation database
 * @param skipDocComments whether documentation comments should be ignored
 */
public record TranslationUnit(
    Path workingDirectory, List<String> arguments, String filename, boolean skipDocComments) {

  public TranslationUnit {
    arguments = List.copyOf(arguments);
  }

  /**
   * Builds the invocation of {@code command}, dropping the compiler name.
   *
   * @throws CompilationDatabaseException when the command has no compiler or no main file
   */
  public static TranslationUnit fromCompileCommand(
      CompileCommand command, boolean skipDocComments) {
    List<String> commandLine = command.commandLine();
    if (commandLine.isEmpty() || StringUtils.isBlank(commandLine.get(0))) {
      throw (CompilationDatabaseException)
          new CompilationDatabaseException("Empty command line for " + command.filename())
              .withContext("file", command.filename());
    }
    if (StringUtils.isBlank(command.filename())) {
      throw new CompilationDatabaseException(
          "No main file in command: " + command.commandLineString());
    }
    Path directory =
        StringUtils.isBlank(command.directory()) ? Path.of("") : Path.of(command.directory());
    return new TranslationUnit(
        directory,
        commandLine.subList(1, commandLine.size()),
        command.filename(),
        skipDocComments);
  }

  /** Absolute, normalized path of the main file. */
  public Path mainFile() {
    return workingDirectory.resolve(filename).toAbsolutePath().normalize();
  }
}
