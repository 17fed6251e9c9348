package com.gentoro.cppindexer.store.driver.providers;

import com.gentoro.cppindexer.CppIndexer;
import com.gentoro.cppindexer.store.IndexStore;
import com.gentoro.cppindexer.store.driver.memory.InMemoryIndexStore;
import com.gentoro.cppindexer.store.driver.spi.IndexStoreProvider;

public class InMemoryIndexStoreProvider implements IndexStoreProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public IndexStore create(CppIndexer indexer) {
    return new InMemoryIndexStore();
  }
}
