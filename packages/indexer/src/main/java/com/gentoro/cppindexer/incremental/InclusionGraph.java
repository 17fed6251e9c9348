package com.gentoro.cppindexer.incremental;

import com.gentoro.cppindexer.model.HeaderInclusion;
import com.gentoro.cppindexer.store.IndexStore;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/** Snapshot of the stored header inclusions, indexed from included file to includers. */
public class InclusionGraph {
  private final Map<Long, Set<Long>> includers = new HashMap<>();

  private InclusionGraph() {}

  public static InclusionGraph load(IndexStore store) {
    InclusionGraph graph = new InclusionGraph();
    for (HeaderInclusion inclusion : store.queryAll(HeaderInclusion.class)) {
      if (inclusion.getIncluderId() == inclusion.getIncludedId()) continue;
      graph
          .includers
          .computeIfAbsent(inclusion.getIncludedId(), k -> new LinkedHashSet<>())
          .add(inclusion.getIncluderId());
    }
    return graph;
  }

  /** Files that directly include {@code fileId}, across all translation units. */
  public Set<Long> includersOf(long fileId) {
    return Collections.unmodifiableSet(includers.getOrDefault(fileId, Set.of()));
  }
}
