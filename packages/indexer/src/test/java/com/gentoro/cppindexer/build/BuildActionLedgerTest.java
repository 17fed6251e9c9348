package com.gentoro.cppindexer.build;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.cppindexer.compdb.CompileCommand;
import com.gentoro.cppindexer.model.BuildAction;
import com.gentoro.cppindexer.model.BuildActionType;
import com.gentoro.cppindexer.model.BuildSource;
import com.gentoro.cppindexer.model.BuildTarget;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.FileType;
import com.gentoro.cppindexer.model.ParseStatus;
import com.gentoro.cppindexer.source.SourceManager;
import com.gentoro.cppindexer.store.driver.memory.InMemoryIndexStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BuildActionLedgerTest {

  @TempDir Path dir;

  InMemoryIndexStore store;
  SourceManager sourceManager;
  BuildActionLedger ledger;

  @BeforeEach
  void setUp() {
    store = new InMemoryIndexStore();
    store.initialize();
    sourceManager = new SourceManager(store, 1 << 20);
    ledger = new BuildActionLedger(store, sourceManager);
  }

  private String abs(String name) {
    return dir.resolve(name).toAbsolutePath().normalize().toString();
  }

  private CompileCommand command(String... args) {
    return new CompileCommand(dir.toString(), List.of(args), "a.cpp");
  }

  @Test
  @DisplayName("-c with -o maps the source to the explicit output")
  void compileWithOutput() {
    SortedMap<String, String> io =
        BuildActionLedger.extractInputOutputs(command("gcc", "-c", "a.cpp", "-o", "a.o"));
    assertEquals(Map.of(abs("a.cpp"), abs("a.o")), io);
  }

  @Test
  @DisplayName("-c without -o derives the object file from the source")
  void compileOnly() {
    SortedMap<String, String> io =
        BuildActionLedger.extractInputOutputs(command("gcc", "-c", "a.cpp"));
    assertEquals(Map.of(abs("a.cpp"), abs("a.o")), io);
  }

  @Test
  @DisplayName("The declared output stands in for a missing -o, but never overrides it")
  void declaredOutput() {
    CompileCommand declared =
        new CompileCommand(dir.toString(), List.of("gcc", "-c", "a.cpp"), "a.cpp", "obj/a.o");
    assertEquals(
        Map.of(abs("a.cpp"), abs("obj/a.o")), BuildActionLedger.extractInputOutputs(declared));

    CompileCommand both =
        new CompileCommand(
            dir.toString(), List.of("gcc", "-c", "a.cpp", "-o", "a.o"), "a.cpp", "obj/a.o");
    assertEquals(Map.of(abs("a.cpp"), abs("a.o")), BuildActionLedger.extractInputOutputs(both));
  }

  @Test
  @DisplayName("Several sources linked into one program")
  void linkToProgram() {
    SortedMap<String, String> io =
        BuildActionLedger.extractInputOutputs(command("gcc", "a.cpp", "b.cpp", "-o", "prog"));
    assertEquals(Map.of(abs("a.cpp"), abs("prog"), abs("b.cpp"), abs("prog")), io);
    assertEquals(List.of(abs("a.cpp"), abs("b.cpp")), List.copyOf(io.keySet()));
  }

  @Test
  @DisplayName("No -c and no -o produces a.out in the working directory")
  void defaultOutput() {
    SortedMap<String, String> io = BuildActionLedger.extractInputOutputs(command("gcc", "a.cpp"));
    assertEquals(Map.of(abs("a.cpp"), abs("a.out")), io);
  }

  @Test
  @DisplayName("Linker pass-through flags and other arguments are not inputs")
  void ignoresNonSources() {
    SortedMap<String, String> io =
        BuildActionLedger.extractInputOutputs(
            command("g++", "-Wl,--whole-archive,libx.a", "-Iinclude", "-DX=1", "m.CXX", "lib.a"));
    assertEquals(Map.of(abs("m.CXX"), abs("a.out"), abs("lib.a"), abs("a.out")), io);
  }

  @Test
  @DisplayName("Action type is LINK when the main file is an object or archive")
  void actionType() {
    long compile = ledger.recordAction(command("gcc", "-c", "a.cpp"));
    long link =
        ledger.recordAction(
            new CompileCommand(dir.toString(), List.of("gcc", "a.o", "-o", "prog"), "a.o"));

    assertEquals(BuildActionType.COMPILE, store.find(BuildAction.class, compile).get().getType());
    assertEquals(BuildActionType.LINK, store.find(BuildAction.class, link).get().getType());
    assertEquals("gcc -c a.cpp", store.find(BuildAction.class, compile).get().getCommand());
  }

  @Test
  @DisplayName("recordOutcome updates file state and links sources and targets")
  void recordOutcome() throws Exception {
    Files.writeString(dir.resolve("a.cpp"), "int a;\n");
    Files.writeString(dir.resolve("b.cpp"), "int b;\n");
    CompileCommand cmd = command("gcc", "a.cpp", "b.cpp", "-o", "prog");
    long actionId = ledger.recordAction(cmd);

    ledger.recordOutcome(cmd, actionId, false);

    FileRecord a = sourceManager.findFile(abs("a.cpp")).orElseThrow();
    FileRecord prog = sourceManager.findFile(abs("prog")).orElseThrow();
    assertEquals(ParseStatus.PARTIALLY_PARSED, a.getParseStatus());
    assertTrue(a.hasContent());
    assertEquals(FileType.BINARY, prog.getType());
    assertFalse(prog.hasContent());

    List<BuildSource> sources = store.queryAll(BuildSource.class);
    assertEquals(2, sources.size());
    assertTrue(sources.stream().allMatch(s -> s.getActionId() == actionId));
    assertTrue(sources.stream().allMatch(s -> s.getParseStatus() == ParseStatus.PARTIALLY_PARSED));
    List<BuildTarget> targets = store.queryAll(BuildTarget.class);
    assertEquals(2, targets.size());
    assertTrue(targets.stream().allMatch(t -> t.getFileId() == prog.getId()));
  }

  @Test
  @DisplayName("recordedCommands lists stored actions and deleteAction cascades")
  void historyAndDelete() {
    CompileCommand cmd = command("gcc", "-c", "a.cpp");
    long actionId = ledger.recordAction(cmd);
    ledger.recordOutcome(cmd, actionId, true);
    assertEquals(List.of("gcc -c a.cpp"), ledger.recordedCommands());

    ledger.deleteAction(actionId);

    assertTrue(ledger.recordedCommands().isEmpty());
    assertTrue(store.queryAll(BuildSource.class).isEmpty());
    assertTrue(store.queryAll(BuildTarget.class).isEmpty());
    assertEquals(
        ParseStatus.FULLY_PARSED,
        sourceManager.findFile(abs("a.cpp")).orElseThrow().getParseStatus());
  }
}
