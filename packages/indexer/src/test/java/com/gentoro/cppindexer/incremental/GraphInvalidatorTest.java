package com.gentoro.cppindexer.incremental;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.cppindexer.build.BuildActionLedger;
import com.gentoro.cppindexer.compdb.CompileCommand;
import com.gentoro.cppindexer.exception.StoreException;
import com.gentoro.cppindexer.graph.GraphRepository;
import com.gentoro.cppindexer.model.AstNode;
import com.gentoro.cppindexer.model.AstType;
import com.gentoro.cppindexer.model.BuildAction;
import com.gentoro.cppindexer.model.BuildSource;
import com.gentoro.cppindexer.model.Entity;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.Friendship;
import com.gentoro.cppindexer.model.GraphEdge;
import com.gentoro.cppindexer.model.GraphNode;
import com.gentoro.cppindexer.model.HeaderInclusion;
import com.gentoro.cppindexer.model.IndexRecord;
import com.gentoro.cppindexer.model.Inheritance;
import com.gentoro.cppindexer.model.NodeDomain;
import com.gentoro.cppindexer.source.SourceManager;
import com.gentoro.cppindexer.store.driver.memory.InMemoryIndexStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GraphInvalidatorTest {

  @TempDir Path dir;

  InMemoryIndexStore store;
  SourceManager sources;
  GraphRepository graph;
  BuildActionLedger ledger;

  FileRecord main;
  FileRecord other;
  FileRecord a;
  FileRecord b;
  FileRecord unrelated;
  long unrelatedNode;

  /**
   * main.cpp and other.cpp include a.h, which includes b.h. b.h holds a definition with entity,
   * inheritance, friendship and a diagram node attached to main.cpp's file node.
   */
  private void build(InMemoryIndexStore indexStore) throws Exception {
    store = indexStore;
    store.initialize();
    sources = new SourceManager(store, 1 << 20);
    graph = new GraphRepository(store);
    ledger = new BuildActionLedger(store, sources);

    main = file("main.cpp", "#include \"a.h\"\n");
    other = file("other.cpp", "#include \"a.h\"\n");
    a = file("a.h", "#include \"b.h\"\n");
    b = file("b.h", "struct B {};\n");
    unrelated = file("unrelated.cpp", "int u;\n");

    include(main, a, main);
    include(other, a, other);
    include(a, b, main);
    include(a, b, other);

    for (String source : List.of("main.cpp", "other.cpp", "unrelated.cpp")) {
      CompileCommand cmd =
          new CompileCommand(dir.toString(), List.of("gcc", "-c", source), source);
      ledger.recordOutcome(cmd, ledger.recordAction(cmd), true);
    }

    AstNode definition =
        store.persist(new AstNode(b.getId(), AstType.DEFINITION, 100L).setAstValue("B"));
    store.persist(new AstNode(b.getId(), AstType.USAGE, 200L));
    store.persist(new Entity(definition.getId(), 100L, "B", "B"));
    store.persist(new Inheritance(100L, 300L, false));
    store.persist(new Friendship(100L, 400L));
    long astNode = graph.addNode(NodeDomain.AST_NODE, definition.getId()).getId();
    long fileNode = graph.addNode(NodeDomain.FILE, main.getId()).getId();
    graph.connect(fileNode, astNode, "contains");
    unrelatedNode = graph.addNode(NodeDomain.FILE, unrelated.getId()).getId();
  }

  private FileRecord file(String name, String text) throws Exception {
    Path path = dir.resolve(name);
    Files.writeString(path, text);
    return sources.getFile(path.toString());
  }

  private void include(FileRecord includer, FileRecord included, FileRecord context) {
    store.persist(new HeaderInclusion(includer.getId(), included.getId(), context.getId()));
  }

  private GraphInvalidator invalidator() {
    return new GraphInvalidator(store, sources, graph, ledger);
  }

  @Test
  @DisplayName("Nothing changed: nothing is invalidated")
  void noChanges() throws Exception {
    build(new InMemoryIndexStore());
    InvalidationReport report = invalidator().invalidate();
    assertTrue(report.modified().isEmpty());
    assertTrue(report.deleted().isEmpty());
    assertEquals(3, store.queryAll(BuildAction.class).size());
  }

  @Test
  @DisplayName("A modified header invalidates itself and every transitive includer completely")
  void modifiedHeaderCascades() throws Exception {
    build(new InMemoryIndexStore());
    Files.writeString(dir.resolve("b.h"), "struct B { int x; };\n");

    InvalidationReport report = invalidator().invalidate();

    assertEquals(
        Set.of(b.getPath(), a.getPath(), main.getPath(), other.getPath()),
        Set.copyOf(report.modified()));
    assertTrue(report.deleted().isEmpty());
    assertEquals(4, report.cleaned());
    assertEquals(0, report.failed());

    assertEquals(List.of("gcc -c unrelated.cpp"), ledger.recordedCommands());
    for (FileRecord gone : List.of(main, other, a, b)) {
      assertTrue(sources.findFile(gone.getPath()).isEmpty(), gone.getPath());
      long id = gone.getId();
      assertTrue(store.query(BuildSource.class, s -> s.getFileId() == id).isEmpty());
      assertTrue(store.query(AstNode.class, n -> n.getFileId() == id).isEmpty());
      assertTrue(
          store
              .query(
                  HeaderInclusion.class,
                  h -> h.getIncluderId() == id || h.getIncludedId() == id || h.getContextId() == id)
              .isEmpty());
    }
    assertTrue(store.queryAll(Entity.class).isEmpty());
    assertTrue(store.queryAll(Inheritance.class).isEmpty());
    assertTrue(store.queryAll(Friendship.class).isEmpty());
    assertEquals(
        List.of(unrelatedNode),
        store.queryAll(GraphNode.class).stream().map(GraphNode::getId).toList());
    assertTrue(store.queryAll(GraphEdge.class).isEmpty());
    assertTrue(sources.findFile(unrelated.getPath()).isPresent());
  }

  @Test
  @DisplayName("Deleting a header included by two files marks both as modified")
  void deletedHeaderCascades() throws Exception {
    build(new InMemoryIndexStore());
    Files.delete(dir.resolve("a.h"));

    InvalidationReport report = invalidator().invalidate();

    assertEquals(List.of(a.getPath()), report.deleted());
    assertEquals(Set.of(main.getPath(), other.getPath()), Set.copyOf(report.modified()));
    assertTrue(sources.findFile(b.getPath()).isPresent());
    long bId = b.getId();
    assertEquals(2, store.query(AstNode.class, n -> n.getFileId() == bId).size());
  }

  /** Store whose erase of one file record fails a given number of times. */
  static class FailingStore extends InMemoryIndexStore {
    long fileId = -1;
    int remaining;
    RuntimeException failure;

    void failErasing(FileRecord file, int times, RuntimeException failure) {
      this.fileId = file.getId();
      this.remaining = times;
      this.failure = failure;
    }

    @Override
    public <T extends IndexRecord<T>> boolean erase(Class<T> type, long id) {
      if (type == FileRecord.class && id == fileId && remaining > 0) {
        remaining--;
        throw failure;
      }
      return super.erase(type, id);
    }
  }

  @Test
  @DisplayName("A failing includer is rolled back and the header it includes is kept for later")
  void failureIsIsolated() throws Exception {
    FailingStore failing = new FailingStore();
    build(failing);
    failing.failErasing(other, 1, new StoreException("cannot erase other.cpp"));
    Files.writeString(dir.resolve("a.h"), "// changed\n");

    InvalidationReport report = invalidator().invalidate();

    assertEquals(1, report.cleaned());
    assertEquals(2, report.failed());
    assertTrue(sources.findFile(main.getPath()).isEmpty());
    assertTrue(sources.findFile(other.getPath()).isPresent());
    assertTrue(sources.findFile(a.getPath()).isPresent());
    long otherId = other.getId();
    long aId = a.getId();
    assertEquals(
        1,
        store
            .query(
                HeaderInclusion.class,
                h -> h.getIncluderId() == otherId && h.getIncludedId() == aId)
            .size());
    assertEquals(
        Set.of("gcc -c other.cpp", "gcc -c unrelated.cpp"), Set.copyOf(ledger.recordedCommands()));
  }

  @Test
  @DisplayName("The next run cleans up an includer whose cleanup failed before")
  void failedIncluderIsRetried() throws Exception {
    FailingStore failing = new FailingStore();
    build(failing);
    failing.failErasing(main, 1, new StoreException("cannot erase main.cpp"));
    Files.writeString(dir.resolve("a.h"), "// changed\n");

    InvalidationReport first = invalidator().invalidate();
    assertEquals(2, first.failed());
    assertEquals(
        Set.of("gcc -c main.cpp", "gcc -c unrelated.cpp"), Set.copyOf(ledger.recordedCommands()));

    InvalidationReport second = invalidator().invalidate();

    assertEquals(Set.of(a.getPath(), main.getPath()), Set.copyOf(second.modified()));
    assertEquals(2, second.cleaned());
    assertEquals(0, second.failed());
    assertEquals(List.of("gcc -c unrelated.cpp"), ledger.recordedCommands());
    assertTrue(sources.findFile(a.getPath()).isEmpty());
    assertTrue(sources.findFile(main.getPath()).isEmpty());
  }

  @Test
  @DisplayName("An unexpected runtime failure only fails its own file")
  void runtimeFailureIsIsolated() throws Exception {
    FailingStore failing = new FailingStore();
    build(failing);
    failing.failErasing(unrelated, 1, new IllegalStateException("boom"));
    Files.writeString(dir.resolve("a.h"), "// changed\n");
    Files.writeString(dir.resolve("unrelated.cpp"), "int u = 1;\n");

    InvalidationReport report = assertDoesNotThrow(() -> invalidator().invalidate());

    assertEquals(1, report.failed());
    assertEquals(3, report.cleaned());
    assertTrue(sources.findFile(unrelated.getPath()).isPresent());
    assertEquals(List.of("gcc -c unrelated.cpp"), ledger.recordedCommands());
  }

  @Test
  @DisplayName("Includers are ordered before the files they include")
  void cleanupOrderPutsIncludersFirst() throws Exception {
    build(new InMemoryIndexStore());
    Files.writeString(dir.resolve("b.h"), "struct B { int y; };\n");
    FileClassification classification = new FileClassification();
    new ContentChangeDetector(store).detect(classification);
    Map<String, FileRecord> byPath = new HashMap<>();
    Map<Long, FileRecord> byId = new HashMap<>();
    for (FileRecord f : store.queryAll(FileRecord.class)) {
      byPath.put(f.getPath(), f);
      byId.put(f.getId(), f);
    }
    InclusionGraph inclusions = InclusionGraph.load(store);
    GraphInvalidator.cascade(classification, inclusions, byPath, byId);

    List<String> order =
        GraphInvalidator.cleanupOrder(classification, inclusions, byPath, byId).stream()
            .map(FileRecord::getPath)
            .toList();

    assertEquals(4, order.size());
    assertTrue(order.indexOf(main.getPath()) < order.indexOf(a.getPath()));
    assertTrue(order.indexOf(other.getPath()) < order.indexOf(a.getPath()));
    assertTrue(order.indexOf(a.getPath()) < order.indexOf(b.getPath()));
  }
}
