package com.gentoro.cppindexer.store.driver.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.cppindexer.exception.StoreException;
import com.gentoro.cppindexer.model.AstNode;
import com.gentoro.cppindexer.model.BuildAction;
import com.gentoro.cppindexer.model.BuildSource;
import com.gentoro.cppindexer.model.BuildTarget;
import com.gentoro.cppindexer.model.Entity;
import com.gentoro.cppindexer.model.FileContent;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.Friendship;
import com.gentoro.cppindexer.model.GraphEdge;
import com.gentoro.cppindexer.model.GraphNode;
import com.gentoro.cppindexer.model.HeaderInclusion;
import com.gentoro.cppindexer.model.IndexRecord;
import com.gentoro.cppindexer.model.Inheritance;
import com.gentoro.cppindexer.store.driver.memory.InMemoryIndexStore;
import com.gentoro.cppindexer.utility.JacksonUtility;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * {@link InMemoryIndexStore} backed by a JSON snapshot file, so that an incremental run sees what
 * the previous run recorded.
 *
 * <p>The snapshot is read on {@link #initialize()} and written on {@link #flush()} and {@link
 * #shutdown()}. With {@code syncOnCommit} every committed transaction that changed something is
 * written through immediately. Writes go to a sibling temp file which then replaces the snapshot.
 *
 * <pre>
 * {
 *   "version": 1,
 *   "tables": {
 *     "FileRecord": { "sequence": 12, "records": [ ... ] },
 *     ...
 *   }
 * }
 * </pre>
 */
public class JsonFileIndexStore extends InMemoryIndexStore {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(JsonFileIndexStore.class);

  static final int FORMAT_VERSION = 1;

  static final List<Class<? extends IndexRecord<?>>> RECORD_TYPES =
      List.of(
          FileRecord.class,
          FileContent.class,
          BuildAction.class,
          BuildSource.class,
          BuildTarget.class,
          AstNode.class,
          Entity.class,
          Inheritance.class,
          Friendship.class,
          HeaderInclusion.class,
          GraphNode.class,
          GraphEdge.class);

  private final Path location;
  private final boolean syncOnCommit;
  private final ObjectMapper mapper = JacksonUtility.getRecordMapper();
  private long savedModifications = 0;

  public JsonFileIndexStore(Path location, boolean syncOnCommit) {
    this.location = location.toAbsolutePath().normalize();
    this.syncOnCommit = syncOnCommit;
  }

  public Path getLocation() {
    return location;
  }

  public boolean isSyncOnCommit() {
    return syncOnCommit;
  }

  @Override
  public void initialize() {
    if (Files.isRegularFile(location)) {
      readSnapshot();
    } else {
      log.info("No index snapshot at {}, starting with an empty index", location);
    }
    super.initialize();
  }

  @Override
  protected void onCommit() {
    if (syncOnCommit) {
      writeIfModified();
    }
  }

  /** Writes the snapshot if anything changed since the last write. */
  public void flush() {
    lock().lock();
    try {
      writeIfModified();
    } finally {
      lock().unlock();
    }
  }

  @Override
  public String getDriverName() {
    return "json-file";
  }

  @Override
  public void shutdown() {
    if (isInitialized()) {
      flush();
    }
    super.shutdown();
  }

  private void writeIfModified() {
    if (modificationCount() == savedModifications) return;
    ObjectNode root = mapper.createObjectNode();
    root.put("version", FORMAT_VERSION);
    ObjectNode tables = root.putObject("tables");
    for (Class<? extends IndexRecord<?>> type : RECORD_TYPES) {
      ObjectNode table = tables.putObject(type.getSimpleName());
      table.put("sequence", sequenceOf(type));
      table.set("records", mapper.valueToTree(dump(type)));
    }

    try {
      Path parent = location.getParent();
      if (parent != null) Files.createDirectories(parent);
      Path temp = location.resolveSibling(location.getFileName() + ".tmp");
      mapper.writeValue(temp.toFile(), root);
      Files.move(temp, location, StandardCopyOption.REPLACE_EXISTING);
      savedModifications = modificationCount();
      log.debug("Index snapshot written to {}", location);
    } catch (IOException e) {
      throw new StoreException("Failed writing index snapshot: " + location, e);
    }
  }

  private void readSnapshot() {
    try {
      JsonNode root = mapper.readTree(location.toFile());
      int version = root.path("version").asInt(-1);
      if (version != FORMAT_VERSION) {
        throw new StoreException(
            "Unsupported index snapshot version " + version + " in " + location);
      }
      JsonNode tables = root.path("tables");
      int total = 0;
      for (Class<? extends IndexRecord<?>> type : RECORD_TYPES) {
        JsonNode table = tables.path(type.getSimpleName());
        if (table.isMissingNode()) continue;
        List<? extends IndexRecord<?>> records =
            mapper.convertValue(
                table.path("records"),
                mapper.getTypeFactory().constructCollectionType(List.class, type));
        load(type, records, table.path("sequence").asLong(0));
        total += records.size();
      }
      log.info("Loaded {} records from index snapshot {}", total, location);
    } catch (IOException | IllegalArgumentException e) {
      throw new StoreException("Failed reading index snapshot: " + location, e);
    }
  }
}
