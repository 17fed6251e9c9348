package com.gentoro.cppindexer.source;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.cppindexer.model.FileContent;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.FileType;
import com.gentoro.cppindexer.model.ParseStatus;
import com.gentoro.cppindexer.store.driver.memory.InMemoryIndexStore;
import com.gentoro.cppindexer.utility.HashUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceManagerTest {

  @TempDir Path dir;

  InMemoryIndexStore store;
  SourceManager sources;

  @BeforeEach
  void setUp() {
    store = new InMemoryIndexStore();
    store.initialize();
    sources = new SourceManager(store, 64);
  }

  @Test
  @DisplayName("getFile creates the file, its parent directories and its content once")
  void createsOnce() throws Exception {
    Path file = dir.resolve("src/a.cpp");
    Files.createDirectories(file.getParent());
    Files.writeString(file, "int a;\n");

    FileRecord first = sources.getFile(file.toString());
    FileRecord again = sources.getFile(dir.resolve("src/../src/a.cpp").toString());

    assertEquals(first.getId(), again.getId());
    assertEquals(FileType.OTHER, first.getType());
    assertEquals(ParseStatus.NOT_PARSED, first.getParseStatus());
    FileRecord parent = store.find(FileRecord.class, first.getParentId()).orElseThrow();
    assertEquals(file.getParent().toString(), parent.getPath());
    assertEquals(FileType.DIRECTORY, parent.getType());

    FileContent content = sources.getContent(first).orElseThrow();
    assertEquals(HashUtility.sha256Hex("int a;\n"), content.getHash());
    assertEquals("int a;\n", content.getContent());
  }

  @Test
  @DisplayName("Content is shared by hash and removed with its last file")
  void sharedContent() throws Exception {
    Files.writeString(dir.resolve("a.h"), "#pragma once\n");
    Files.writeString(dir.resolve("b.h"), "#pragma once\n");
    FileRecord a = sources.getFile(dir.resolve("a.h").toString());
    FileRecord b = sources.getFile(dir.resolve("b.h").toString());
    assertEquals(a.getContentId(), b.getContentId());
    assertEquals(1, store.queryAll(FileContent.class).size());

    sources.removeFile(a);
    assertEquals(1, store.queryAll(FileContent.class).size());
    assertTrue(sources.findFile(dir.resolve("a.h").toString()).isEmpty());

    sources.removeFile(b);
    assertTrue(store.queryAll(FileContent.class).isEmpty());
  }

  @Test
  @DisplayName("Objects, oversized files and missing files carry no content")
  void noContent() throws Exception {
    Files.write(dir.resolve("a.o"), new byte[] {1, 2, 3});
    Files.writeString(dir.resolve("big.cpp"), "x".repeat(65));

    assertFalse(sources.getFile(dir.resolve("a.o").toString()).hasContent());
    assertFalse(sources.getFile(dir.resolve("big.cpp").toString()).hasContent());
    assertFalse(sources.getFile(dir.resolve("gone.cpp").toString()).hasContent());
    assertFalse(sources.getFile(dir.resolve("later.cpp").toString(), false).hasContent());
  }

  @Test
  @DisplayName("A file first seen without content gets it when requested later")
  void attachesContentLater() throws Exception {
    Path file = dir.resolve("late.cpp");
    Files.writeString(file, "int x;\n");
    FileRecord bare = sources.getFile(file.toString(), false);
    assertFalse(bare.hasContent());

    FileRecord full = sources.getFile(file.toString(), true);
    assertEquals(bare.getId(), full.getId());
    assertTrue(full.hasContent());
  }

  @Test
  @DisplayName("Concurrent getFile of one path yields a single record")
  void concurrentGetFile() throws Exception {
    Path file = dir.resolve("c.cpp");
    Files.writeString(file, "int c;\n");
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Callable<FileRecord>> calls = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        calls.add(() -> sources.getFile(file.toString()));
      }
      long expected = -1;
      for (Future<FileRecord> f : pool.invokeAll(calls)) {
        long id = f.get().getId();
        if (expected < 0) expected = id;
        assertEquals(expected, id);
      }
    } finally {
      pool.shutdown();
    }
    assertEquals(
        1, store.query(FileRecord.class, f -> f.getPath().equals(file.toString())).size());
  }
}
