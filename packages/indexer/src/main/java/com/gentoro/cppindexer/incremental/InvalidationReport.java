package com.gentoro.cppindexer.incremental;

import java.util.List;

/**
 * Result of an incremental cleanup.
 *
 * @param modified files found changed on disk or reached through inclusion
 * @param deleted files no longer on disk
 * @param cleaned files whose records were removed
 * @param failed files whose cleanup was rolled back
 */
public record InvalidationReport(
    List<String> modified, List<String> deleted, int cleaned, int failed) {

  public InvalidationReport {
    modified = List.copyOf(modified);
    deleted = List.copyOf(deleted);
  }

  @Override
  public String toString() {
    return modified.size()
        + " modified, "
        + deleted.size()
        + " deleted, "
        + cleaned
        + " cleaned up, "
        + failed
        + " failed";
  }
}
