package com.gentoro.cppindexer.store.driver.providers;

import com.gentoro.cppindexer.CppIndexer;
import com.gentoro.cppindexer.store.IndexStore;
import com.gentoro.cppindexer.store.driver.json.JsonFileIndexStore;
import com.gentoro.cppindexer.store.driver.spi.IndexStoreProvider;
import java.nio.file.Path;

/** Service provider for the JSON snapshot store. */
public class JsonFileIndexStoreProvider implements IndexStoreProvider {
  static final String DEFAULT_LOCATION = ".cpp-indexer/index.json";

  @Override
  public String id() {
    return "json-file";
  }

  @Override
  public IndexStore create(CppIndexer indexer) {
    String location =
        indexer.configuration().getString("store.json.location", DEFAULT_LOCATION);
    boolean syncOnCommit = indexer.configuration().getBoolean("store.json.sync-on-commit", true);
    return new JsonFileIndexStore(Path.of(location), syncOnCommit);
  }
}
