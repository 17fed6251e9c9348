package com.gentoro.cppindexer.orchestrator;

import com.gentoro.cppindexer.IndexerOptions;
import com.gentoro.cppindexer.build.BuildActionLedger;
import com.gentoro.cppindexer.build.CommandDeduplicator;
import com.gentoro.cppindexer.compdb.CompilationDatabase;
import com.gentoro.cppindexer.compdb.CompileCommand;
import com.gentoro.cppindexer.exception.CompilationDatabaseException;
import com.gentoro.cppindexer.exception.DatabaseLoadException;
import com.gentoro.cppindexer.exception.ExceptionUtil;
import com.gentoro.cppindexer.graph.GraphRepository;
import com.gentoro.cppindexer.incremental.GraphInvalidator;
import com.gentoro.cppindexer.incremental.InvalidationReport;
import com.gentoro.cppindexer.jobs.JobQueueThreadPool;
import com.gentoro.cppindexer.parser.ParseContext;
import com.gentoro.cppindexer.parser.TranslationUnit;
import com.gentoro.cppindexer.parser.TranslationUnitParser;
import com.gentoro.cppindexer.source.SourceManager;
import com.gentoro.cppindexer.store.IndexStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives one indexing run: optional incremental cleanup, then every compilation database in turn,
 * each command parsed at most once per run and never again once recorded.
 */
public class ParseOrchestrator {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(ParseOrchestrator.class);

  private final IndexStore store;
  private final SourceManager sourceManager;
  private final GraphRepository graphRepository;
  private final TranslationUnitParser parser;
  private final IndexerOptions options;
  private final BuildActionLedger ledger;
  private final CommandDeduplicator deduplicator = new CommandDeduplicator();
  private final ParseContext parseContext;

  private final AtomicInteger parsed = new AtomicInteger();
  private final AtomicInteger failed = new AtomicInteger();
  private final AtomicInteger skipped = new AtomicInteger();
  private final AtomicInteger rejected = new AtomicInteger();

  public ParseOrchestrator(
      IndexStore store,
      SourceManager sourceManager,
      GraphRepository graphRepository,
      TranslationUnitParser parser,
      IndexerOptions options) {
    this.store = store;
    this.sourceManager = sourceManager;
    this.graphRepository = graphRepository;
    this.parser = parser;
    this.options = options;
    this.ledger = new BuildActionLedger(store, sourceManager);
    this.parseContext = new ParseContext(store, sourceManager, graphRepository);
  }

  /**
   * Runs the whole pipeline over {@link IndexerOptions#inputs()}.
   *
   * @return false when at least one compilation database could not be loaded
   */
  public boolean parse() {
    if (options.skipDocComments()) {
      log.info("C++ documentation parser has been skipped.");
    }
    if (options.incremental()) {
      InvalidationReport report =
          new GraphInvalidator(store, sourceManager, graphRepository, ledger).invalidate();
      log.info("Incremental cleanup: {}", report);
    }

    deduplicator.seed(ledger.recordedCommands());

    boolean success = true;
    for (Path input : options.inputs()) {
      if (!Files.isRegularFile(input)) {
        log.debug("Skipping input {}: not a regular file", input);
        continue;
      }
      // Every input runs even after a failure.
      success &= parseByJson(input, options.jobs());
    }
    log.info(
        "Parsing finished: {} parsed, {} failed, {} already parsed, {} rejected",
        parsed.get(),
        failed.get(),
        skipped.get(),
        rejected.get());
    return success;
  }

  /**
   * Parses every not yet seen command of one compilation database on {@code workers} threads and
   * waits for all of them.
   *
   * @return false when the database could not be loaded
   */
  public boolean parseByJson(Path database, int workers) {
    CompilationDatabase compilationDb;
    try {
      compilationDb = CompilationDatabase.load(database);
    } catch (DatabaseLoadException e) {
      log.error("Failed to load compilation database {}: {}", database, e.getMessage());
      return false;
    }

    List<CompileCommand> commands = compilationDb.getAllCompileCommands();
    int total = commands.size();
    log.info("Parsing {} ({} compile commands)", database, total);

    JobQueueThreadPool<ParseJob> pool =
        new JobQueueThreadPool<>("cpp-parser", workers, this::worker);
    try {
      for (int i = 0; i < total; i++) {
        CompileCommand command = commands.get(i);
        if (deduplicator.tryClaim(command.commandLine())) {
          pool.enqueue(new ParseJob(command, i + 1, total));
        } else {
          skipped.incrementAndGet();
          log.info("({}/{}) Already parsed {}", i + 1, total, command.filename());
        }
      }
      pool.awaitCompletion();
    } finally {
      pool.shutdown();
    }
    return true;
  }

  void worker(ParseJob job) {
    CompileCommand command = job.command();
    TranslationUnit unit;
    try {
      unit = TranslationUnit.fromCompileCommand(command, options.skipDocComments());
    } catch (CompilationDatabaseException e) {
      rejected.incrementAndGet();
      log.error(
          "({}/{}) Failed to create compiler invocation for {}: {}",
          job.index(),
          job.total(),
          command.filename(),
          e.getMessage());
      return;
    }

    long actionId = ledger.recordAction(command);
    log.info("({}/{}) Parsing {}", job.index(), job.total(), command.filename());
    parsed.incrementAndGet();

    boolean succeeded;
    try {
      succeeded = parser.parse(unit, parseContext);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      succeeded = false;
    } catch (Exception e) {
      log.warn(
          "Parser '{}' threw on {}: {}",
          parser.name(),
          command.filename(),
          ExceptionUtil.extractErrorMessage(e));
      log.debug("Parser failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      succeeded = false;
    }
    if (!succeeded) {
      failed.incrementAndGet();
      log.warn("({}/{}) Parsing {} has failed.", job.index(), job.total(), command.filename());
    }

    ledger.recordOutcome(command, actionId, succeeded);
  }

  public ParseStatistics statistics() {
    return new ParseStatistics(parsed.get(), failed.get(), skipped.get(), rejected.get());
  }
}
