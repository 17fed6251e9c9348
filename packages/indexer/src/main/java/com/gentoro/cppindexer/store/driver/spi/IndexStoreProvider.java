package com.gentoro.cppindexer.store.driver.spi;

import com.gentoro.cppindexer.CppIndexer;
import com.gentoro.cppindexer.store.IndexStore;

/**
 * Service Provider Interface for pluggable IndexStore backends.
 *
 * <p>Implementations must register using ServiceLoader by adding their fully qualified class name
 * to: META-INF/services/com.gentoro.cppindexer.store.driver.spi.IndexStoreProvider
 */
public interface IndexStoreProvider {
  /** Unique driver id used in configuration, e.g., "in-memory", "json-file". */
  String id();

  /** Whether the provider can operate in the current runtime. */
  default boolean isAvailable(CppIndexer indexer) {
    return true;
  }

  /** Create a new, not yet initialized, IndexStore bound to this indexer's configuration. */
  IndexStore create(CppIndexer indexer);
}
