package com.gentoro.cppindexer.store;

import com.gentoro.cppindexer.CppIndexer;
import com.gentoro.cppindexer.store.driver.memory.InMemoryIndexStore;
import com.gentoro.cppindexer.store.driver.spi.IndexStoreProvider;
import java.util.ServiceLoader;

/**
 * Resolves the {@link IndexStore} named by {@code store.driver} among the registered {@link
 * IndexStoreProvider}s. Falls back to the in-memory driver when the requested one is missing or
 * unavailable.
 */
public final class IndexStoreFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(IndexStoreFactory.class);

  private IndexStoreFactory() {}

  public static IndexStore create(CppIndexer indexer) {
    String desired = indexer.configuration().getString("store.driver", "json-file");
    for (IndexStoreProvider provider : ServiceLoader.load(IndexStoreProvider.class)) {
      if (provider.id().equalsIgnoreCase(desired)) {
        if (provider.isAvailable(indexer)) {
          IndexStore store = provider.create(indexer);
          log.info("Using index store driver '{}'", provider.id());
          return store;
        }
        log.warn("Index store driver '{}' is not available in this runtime", desired);
        break;
      }
    }
    log.warn("Index store driver '{}' not found, falling back to in-memory", desired);
    return new InMemoryIndexStore();
  }
}
