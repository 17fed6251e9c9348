package com.gentoro.cppindexer.incremental;

import com.gentoro.cppindexer.build.BuildActionLedger;
import com.gentoro.cppindexer.exception.ExceptionUtil;
import com.gentoro.cppindexer.graph.GraphRepository;
import com.gentoro.cppindexer.model.AstNode;
import com.gentoro.cppindexer.model.AstType;
import com.gentoro.cppindexer.model.BuildAction;
import com.gentoro.cppindexer.model.BuildSource;
import com.gentoro.cppindexer.model.Entity;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.Friendship;
import com.gentoro.cppindexer.model.HeaderInclusion;
import com.gentoro.cppindexer.model.Inheritance;
import com.gentoro.cppindexer.model.NodeDomain;
import com.gentoro.cppindexer.source.SourceManager;
import com.gentoro.cppindexer.store.IndexStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Removes everything derived from files that changed since the previous run, so that their
 * compile commands are no longer known and get parsed again.
 *
 * <p>A changed header also invalidates every file including it, transitively. Each affected file
 * is cleaned up in its own transaction, includers before the files they include. A failing file
 * is rolled back and skipped, and so is every file it includes, so that the next run finds the
 * same inclusion chain again.
 */
public class GraphInvalidator {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(GraphInvalidator.class);

  private final IndexStore store;
  private final SourceManager sourceManager;
  private final GraphRepository graphRepository;
  private final BuildActionLedger ledger;
  private final ContentChangeDetector detector;

  public GraphInvalidator(
      IndexStore store,
      SourceManager sourceManager,
      GraphRepository graphRepository,
      BuildActionLedger ledger) {
    this.store = store;
    this.sourceManager = sourceManager;
    this.graphRepository = graphRepository;
    this.ledger = ledger;
    this.detector = new ContentChangeDetector(store);
  }

  public InvalidationReport invalidate() {
    FileClassification classification = new FileClassification();
    detector.detect(classification);

    Map<String, FileRecord> filesByPath = new HashMap<>();
    Map<Long, FileRecord> filesById = new HashMap<>();
    InclusionGraph inclusions =
        store.callInTransaction(
            () -> {
              for (FileRecord file : store.queryAll(FileRecord.class)) {
                filesByPath.put(file.getPath(), file);
                filesById.put(file.getId(), file);
              }
              return InclusionGraph.load(store);
            });

    cascade(classification, inclusions, filesByPath, filesById);

    int cleaned = 0;
    int failed = 0;
    Set<Long> notCleaned = new HashSet<>();
    for (FileRecord file : cleanupOrder(classification, inclusions, filesByPath, filesById)) {
      Optional<Long> blocking =
          inclusions.includersOf(file.getId()).stream().filter(notCleaned::contains).findFirst();
      if (blocking.isPresent()) {
        // Keeping the file keeps its inclusion edges, so the next run reaches the includer again.
        failed++;
        notCleaned.add(file.getId());
        log.warn(
            "Database cleanup of {} postponed, includer {} was not cleaned up",
            file.getPath(),
            filesById.get(blocking.get()).getPath());
        continue;
      }
      try {
        store.runInTransaction(() -> cleanUp(file));
        cleaned++;
      } catch (RuntimeException e) {
        failed++;
        notCleaned.add(file.getId());
        log.error(
            "Database cleanup of {} failed: {}",
            file.getPath(),
            ExceptionUtil.extractErrorMessage(e));
        log.debug("Cleanup failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      }
    }
    return new InvalidationReport(
        classification.paths(FileChange.MODIFIED),
        classification.paths(FileChange.DELETED),
        cleaned,
        failed);
  }

  /** Marks every file including a changed file as modified, following inclusion chains. */
  static void cascade(
      FileClassification classification,
      InclusionGraph inclusions,
      Map<String, FileRecord> filesByPath,
      Map<Long, FileRecord> filesById) {
    Deque<String> work = new ArrayDeque<>(classification.asMap().keySet());
    while (!work.isEmpty()) {
      FileRecord changed = filesByPath.get(work.poll());
      if (changed == null) continue;
      for (long includerId : inclusions.includersOf(changed.getId())) {
        FileRecord includer = filesById.get(includerId);
        if (includer != null && classification.classify(includer.getPath(), FileChange.MODIFIED)) {
          log.debug("File modified by inclusion: {}", includer.getPath());
          work.add(includer.getPath());
        }
      }
    }
  }

  /**
   * Classified files ordered so that every file comes after the classified files including it.
   * Inclusion cycles are broken at the first file visited.
   */
  static List<FileRecord> cleanupOrder(
      FileClassification classification,
      InclusionGraph inclusions,
      Map<String, FileRecord> filesByPath,
      Map<Long, FileRecord> filesById) {
    List<FileRecord> ordered = new ArrayList<>();
    Set<Long> visited = new HashSet<>();
    for (String path : classification.asMap().keySet()) {
      FileRecord file = filesByPath.get(path);
      if (file != null) {
        visitIncludersFirst(file, classification, inclusions, filesById, visited, ordered);
      }
    }
    return ordered;
  }

  private static void visitIncludersFirst(
      FileRecord file,
      FileClassification classification,
      InclusionGraph inclusions,
      Map<Long, FileRecord> filesById,
      Set<Long> visited,
      List<FileRecord> ordered) {
    if (!visited.add(file.getId())) return;
    for (long includerId : inclusions.includersOf(file.getId())) {
      FileRecord includer = filesById.get(includerId);
      if (includer != null && classification.isClassified(includer.getPath())) {
        visitIncludersFirst(includer, classification, inclusions, filesById, visited, ordered);
      }
    }
    ordered.add(file);
  }

  private void cleanUp(FileRecord file) {
    long fileId = file.getId();
    log.info("Database cleanup: {}", file.getPath());

    List<Long> definitionIds = new ArrayList<>();
    for (AstNode definition :
        store.query(
            AstNode.class,
            n -> n.getFileId() == fileId && n.getAstType() == AstType.DEFINITION)) {
      long hash = definition.getMangledNameHash();
      for (Entity entity : store.query(Entity.class, e -> e.getMangledNameHash() == hash)) {
        store.erase(Entity.class, entity.getId());
      }
      for (Inheritance inheritance :
          store.query(Inheritance.class, i -> i.getDerived() == hash)) {
        store.erase(Inheritance.class, inheritance.getId());
      }
      for (Friendship friendship : store.query(Friendship.class, f -> f.getTarget() == hash)) {
        store.erase(Friendship.class, friendship.getId());
      }
      definitionIds.add(definition.getId());
    }
    graphRepository.deleteNodesOf(NodeDomain.AST_NODE, definitionIds);

    for (BuildSource source : store.query(BuildSource.class, s -> s.getFileId() == fileId)) {
      if (store.find(BuildAction.class, source.getActionId()).isPresent()) {
        ledger.deleteAction(source.getActionId());
      } else {
        store.erase(BuildSource.class, source.getId());
      }
    }

    graphRepository.deleteNodesOf(NodeDomain.FILE, fileId);

    for (AstNode node : store.query(AstNode.class, n -> n.getFileId() == fileId)) {
      store.erase(AstNode.class, node.getId());
    }
    for (HeaderInclusion inclusion :
        store.query(
            HeaderInclusion.class,
            h ->
                h.getIncluderId() == fileId
                    || h.getIncludedId() == fileId
                    || h.getContextId() == fileId)) {
      store.erase(HeaderInclusion.class, inclusion.getId());
    }

    sourceManager.removeFile(file);
  }
}
