package com.gentoro.cppindexer.model;

public enum FileType {
  DIRECTORY,
  /** Produced as the target of a build action. */
  BINARY,
  OTHER
}
