package com.gentoro.cppindexer.exception;

/** A compilation database file could not be read or is malformed. */
public class DatabaseLoadException extends CppIndexerException {
  public DatabaseLoadException(String message) {
    super(ErrorCode.DATABASE_LOAD_ERROR, message);
  }

  public DatabaseLoadException(String message, Throwable cause) {
    super(ErrorCode.DATABASE_LOAD_ERROR, message, cause);
  }
}
