package com.gentoro.cppindexer.exception;

/** Stable error categories attached to every {@link CppIndexerException}. */
public enum ErrorCode {
  UNKNOWN,
  /** Invalid or missing configuration. */
  CONFIGURATION_ERROR,
  /** A single compile command could not be assembled into a compiler invocation. */
  COMPILATION_DATABASE_ERROR,
  /** A compilation database file could not be loaded. */
  DATABASE_LOAD_ERROR,
  /** A store transaction failed and was rolled back. */
  STORE_ERROR,
  /** A translation unit collaborator failed unexpectedly. */
  PARSE_ERROR,
  /** A component was used in an invalid lifecycle state. */
  STATE_ERROR
}
