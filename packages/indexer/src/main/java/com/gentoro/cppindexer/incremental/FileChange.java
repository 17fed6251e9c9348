package com.gentoro.cppindexer.incremental;

/** How a previously indexed file differs from the disk. */
public enum FileChange {
  MODIFIED,
  DELETED
}
