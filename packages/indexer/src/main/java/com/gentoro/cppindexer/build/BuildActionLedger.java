package com.gentoro.cppindexer.build;

import com.gentoro.cppindexer.compdb.CompileCommand;
import com.gentoro.cppindexer.model.BuildAction;
import com.gentoro.cppindexer.model.BuildActionType;
import com.gentoro.cppindexer.model.BuildSource;
import com.gentoro.cppindexer.model.BuildTarget;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.FileType;
import com.gentoro.cppindexer.model.ParseStatus;
import com.gentoro.cppindexer.source.SourceManager;
import com.gentoro.cppindexer.store.IndexStore;
import com.gentoro.cppindexer.utility.FileUtility;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import org.apache.commons.lang3.StringUtils;

/**
 * Persistent history of executed compile commands. Every dispatched command gets a {@link
 * BuildAction} before it runs; once it finished, its inputs and outputs are linked to the action
 * through {@link BuildSource} and {@link BuildTarget} rows.
 */
public class BuildActionLedger {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(BuildActionLedger.class);

  static final Set<String> SOURCE_EXTENSIONS =
      Set.of(".c", ".cc", ".cpp", ".cxx", ".o", ".so", ".a");
  private static final Set<String> LINK_EXTENSIONS = Set.of(".o", ".so", ".a");

  private final IndexStore store;
  private final SourceManager sourceManager;

  public BuildActionLedger(IndexStore store, SourceManager sourceManager) {
    this.store = store;
    this.sourceManager = sourceManager;
  }

  /** Persists the action of {@code command} and returns its id. */
  public long recordAction(CompileCommand command) {
    BuildActionType type =
        LINK_EXTENSIONS.contains(FileUtility.extension(command.filename()))
            ? BuildActionType.LINK
            : BuildActionType.COMPILE;
    BuildAction action = new BuildAction(command.commandLineString(), type);
    store.runInTransaction(() -> store.persist(action));
    return action.getId();
  }

  /**
   * Maps every input of {@code command} to the file it produces, both absolute.
   *
   * <p>{@code -o} names the output. Arguments with a C/C++ source, object or archive extension are
   * inputs, except linker pass-through flags ({@code -Wl,...}). Without {@code -o} the entry's
   * declared output is used when it has one. Failing both, {@code -c} gives each input its own
   * {@code .o}; otherwise everything goes to {@code a.out} in the working directory.
   */
  public static SortedMap<String, String> extractInputOutputs(CompileCommand command) {
    String directory = command.directory();
    Set<String> sources = new LinkedHashSet<>();
    String output = null;
    boolean compileOnly = false;
    boolean expectOutput = false;

    for (String arg : command.commandLine()) {
      if (expectOutput) {
        output = FileUtility.absolute(arg, directory);
        expectOutput = false;
      } else if (SOURCE_EXTENSIONS.contains(FileUtility.extension(arg))
          && !arg.startsWith("-Wl,")) {
        sources.add(FileUtility.absolute(arg, directory));
      } else if ("-c".equals(arg)) {
        compileOnly = true;
      } else if ("-o".equals(arg)) {
        expectOutput = true;
      }
    }

    if (output == null && StringUtils.isNotBlank(command.output())) {
      output = FileUtility.absolute(command.output(), directory);
    }

    SortedMap<String, String> inToOut = new TreeMap<>();
    if (output == null && compileOnly) {
      for (String source : sources) {
        inToOut.put(source, FileUtility.replaceExtension(source, ".o"));
      }
    } else {
      String target = output != null ? output : FileUtility.absolute("a.out", directory);
      for (String source : sources) {
        inToOut.put(source, target);
      }
    }
    return inToOut;
  }

  /**
   * Stores the outcome of the action: inputs become fully or partially parsed, outputs become
   * binaries, and the source/target rows are created. One transaction for the whole command.
   */
  public void recordOutcome(CompileCommand command, long actionId, boolean succeeded) {
    ParseStatus status = succeeded ? ParseStatus.FULLY_PARSED : ParseStatus.PARTIALLY_PARSED;
    Map<String, String> inToOut = extractInputOutputs(command);
    store.runInTransaction(
        () -> {
          for (Map.Entry<String, String> pair : inToOut.entrySet()) {
            FileRecord input = sourceManager.getFile(pair.getKey(), true);
            input.setParseStatus(status);
            sourceManager.updateFile(input);
            store.persist(new BuildSource(input.getId(), actionId, status));

            FileRecord output = sourceManager.getFile(pair.getValue(), false);
            if (output.getType() != FileType.BINARY) {
              output.setType(FileType.BINARY);
              sourceManager.updateFile(output);
            }
            store.persist(new BuildTarget(output.getId(), actionId));
          }
        });
    log.debug(
        "Recorded action {} for {} ({} inputs, {})",
        actionId,
        command.filename(),
        inToOut.size(),
        status);
  }

  /** Command lines of every stored action. */
  public List<String> recordedCommands() {
    List<String> commands = new ArrayList<>();
    for (BuildAction action : store.queryAll(BuildAction.class)) {
      commands.add(action.getCommand());
    }
    return commands;
  }

  /** Erases an action together with its source and target rows. */
  public void deleteAction(long actionId) {
    store.runInTransaction(
        () -> {
          for (BuildSource source :
              store.query(BuildSource.class, s -> s.getActionId() == actionId)) {
            store.erase(BuildSource.class, source.getId());
          }
          for (BuildTarget target :
              store.query(BuildTarget.class, t -> t.getActionId() == actionId)) {
            store.erase(BuildTarget.class, target.getId());
          }
          store.erase(BuildAction.class, actionId);
        });
  }
}
