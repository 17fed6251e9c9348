package com.gentoro.cppindexer.incremental;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Change status of files during one incremental run, keyed by path. A path is classified at most
 * once; later classifications of the same path are ignored.
 */
public class FileClassification {
  private final Map<String, FileChange> changes = new LinkedHashMap<>();

  /** @return true if {@code path} was unclassified and now carries {@code change} */
  public boolean classify(String path, FileChange change) {
    return changes.putIfAbsent(path, change) == null;
  }

  public boolean isClassified(String path) {
    return changes.containsKey(path);
  }

  public Optional<FileChange> get(String path) {
    return Optional.ofNullable(changes.get(path));
  }

  public List<String> paths(FileChange change) {
    List<String> paths = new ArrayList<>();
    changes.forEach(
        (path, c) -> {
          if (c == change) paths.add(path);
        });
    return paths;
  }

  public Map<String, FileChange> asMap() {
    return Collections.unmodifiableMap(changes);
  }

  public int size() {
    return changes.size();
  }
}
