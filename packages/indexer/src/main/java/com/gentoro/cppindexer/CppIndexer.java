package com.gentoro.cppindexer;

import com.gentoro.cppindexer.exception.ExceptionUtil;
import com.gentoro.cppindexer.exception.StateException;
import com.gentoro.cppindexer.exception.StoreException;
import com.gentoro.cppindexer.graph.GraphRepository;
import com.gentoro.cppindexer.orchestrator.ParseOrchestrator;
import com.gentoro.cppindexer.parser.TranslationUnitParser;
import com.gentoro.cppindexer.parser.TranslationUnitParserFactory;
import com.gentoro.cppindexer.source.SourceManager;
import com.gentoro.cppindexer.store.IndexStore;
import com.gentoro.cppindexer.store.IndexStoreFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires the indexer together: configuration, index store, source manager and translation unit
 * parser. One instance serves one indexing run.
 */
public class CppIndexer {

  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(CppIndexer.class);

  static final long DEFAULT_MAX_CONTENT_SIZE = 4L * 1024 * 1024;

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private IndexStore store;
  private SourceManager sourceManager;
  private GraphRepository graphRepository;
  private TranslationUnitParser parser;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  public CppIndexer(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider =
        new ConfigurationProvider(
            startupParameters.configFile(), startupParameters.configurationOverrides());
    // Apply logging levels before anything else logs.
    com.gentoro.cppindexer.logging.LoggingService.applyConfiguration(configuration());

    this.store = IndexStoreFactory.create(this);
    try {
      store.initialize();
    } catch (RuntimeException e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, t -> new StoreException("Failed to initialize index store", t));
    }
    this.sourceManager =
        new SourceManager(
            store, configuration().getLong("store.content.max-size", DEFAULT_MAX_CONTENT_SIZE));
    this.graphRepository = new GraphRepository(store);
    this.parser = TranslationUnitParserFactory.create(this);
    log.debug("Indexer initialized with store '{}'", store.getDriverName());
  }

  /**
   * Runs the parse over every configured compilation database.
   *
   * @return true when every input was parsed without failure
   */
  public boolean run() {
    if (store == null) {
      throw new StateException("Indexer was not initialized");
    }
    IndexerOptions options = IndexerOptions.from(configuration());
    return new ParseOrchestrator(store, sourceManager, graphRepository, parser, options).parse();
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) {
      return;
    }
    if (store != null && store.isInitialized()) {
      try {
        store.shutdown();
      } catch (RuntimeException e) {
        log.error("Failed to shut down index store '{}'", store.getDriverName(), e);
      }
    }
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("Configuration is not loaded; call initialize() first");
    }
    return configurationProvider.config();
  }

  public IndexStore store() {
    return store;
  }

  public SourceManager sourceManager() {
    return sourceManager;
  }

  public GraphRepository graphRepository() {
    return graphRepository;
  }

  public TranslationUnitParser parser() {
    return parser;
  }
}
