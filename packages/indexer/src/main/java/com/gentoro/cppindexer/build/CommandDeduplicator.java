package com.gentoro.cppindexer.build;

import com.gentoro.cppindexer.utility.HashUtility;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which command lines were already executed during a run. A command is identified by
 * the 64-bit FNV-1a hash of its arguments joined by single spaces, so matching is exact: the same
 * arguments in another order make another command. Hash collisions are accepted.
 */
public class CommandDeduplicator {
  private final Set<Long> seen = ConcurrentHashMap.newKeySet();

  /** Marks previously recorded commands as already parsed. */
  public void seed(Iterable<String> commandLines) {
    for (String commandLine : commandLines) {
      seen.add(HashUtility.fnv1a64(commandLine));
    }
  }

  public boolean tryClaim(List<String> commandLine) {
    return tryClaim(String.join(" ", commandLine));
  }

  /**
   * @return true exactly once per distinct command line; false when it was seeded or claimed
   *     before
   */
  public boolean tryClaim(String commandLine) {
    return seen.add(HashUtility.fnv1a64(commandLine));
  }

  public int size() {
    return seen.size();
  }
}
