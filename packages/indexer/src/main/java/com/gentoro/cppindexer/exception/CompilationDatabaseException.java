package com.gentoro.cppindexer.exception;

/** A compile command could not be turned into a compiler invocation. The job is skipped. */
public class CompilationDatabaseException extends CppIndexerException {
  public CompilationDatabaseException(String message) {
    super(ErrorCode.COMPILATION_DATABASE_ERROR, message);
  }

  public CompilationDatabaseException(String message, Throwable cause) {
    super(ErrorCode.COMPILATION_DATABASE_ERROR, message, cause);
  }
}
