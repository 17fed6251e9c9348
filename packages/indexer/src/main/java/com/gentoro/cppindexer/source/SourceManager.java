package com.gentoro.cppindexer.source;

import com.gentoro.cppindexer.model.FileContent;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.FileType;
import com.gentoro.cppindexer.model.ParseStatus;
import com.gentoro.cppindexer.store.IndexStore;
import com.gentoro.cppindexer.utility.FileUtility;
import com.gentoro.cppindexer.utility.HashUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns {@link FileRecord} rows. Every path is stored once, normalized and absolute; parent
 * directories get their own records. Regular files may carry a {@link FileContent} record which is
 * shared between files with identical bytes.
 *
 * <p>All methods are safe to call from worker threads.
 */
public class SourceManager {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(SourceManager.class);

  /** Build products whose bytes are never stored. */
  private static final Set<String> BINARY_EXTENSIONS = Set.of(".o", ".so", ".a");

  private final IndexStore store;
  private final long maxContentSize;
  private final Map<String, Long> idByPath = new ConcurrentHashMap<>();

  public SourceManager(IndexStore store, long maxContentSize) {
    this.store = store;
    this.maxContentSize = maxContentSize;
  }

  public FileRecord getFile(String path) {
    return getFile(path, true);
  }

  /**
   * Returns the record of {@code path}, creating it (and the records of its parent directories)
   * when missing.
   *
   * @param withContent also store the file's content when it is a readable regular file that is
   *     not an object file or archive
   */
  public FileRecord getFile(String path, boolean withContent) {
    String normalized = FileUtility.absolute(path, null);
    return store.callInTransaction(() -> getOrCreate(normalized, withContent, false));
  }

  private FileRecord getOrCreate(String path, boolean withContent, boolean directory) {
    Optional<FileRecord> existing = findFile(path);
    if (existing.isPresent()) {
      FileRecord file = existing.get();
      if (withContent && !file.hasContent() && file.getType() == FileType.OTHER) {
        long contentId = contentIdFor(Path.of(path));
        if (contentId != 0) {
          file.setContentId(contentId);
          store.update(file);
        }
      }
      return file;
    }

    Path p = Path.of(path);
    FileType type = directory || Files.isDirectory(p) ? FileType.DIRECTORY : FileType.OTHER;
    long parentId = 0;
    if (p.getParent() != null) {
      parentId = getOrCreate(p.getParent().toString(), false, true).getId();
    }

    FileRecord file =
        new FileRecord(path, type)
            .setParseStatus(ParseStatus.NOT_PARSED)
            .setParentId(parentId)
            .setTimestamp(lastModified(p));
    if (withContent && type == FileType.OTHER) {
      file.setContentId(contentIdFor(p));
    }
    store.persist(file);
    idByPath.put(path, file.getId());
    return file;
  }

  /** Looks up the record of an already known path. */
  public Optional<FileRecord> findFile(String path) {
    String normalized = FileUtility.absolute(path, null);
    Long cached = idByPath.get(normalized);
    if (cached != null) {
      Optional<FileRecord> hit =
          store.find(FileRecord.class, cached).filter(f -> normalized.equals(f.getPath()));
      if (hit.isPresent()) {
        return hit;
      }
      // Stale after a rollback or removal.
      idByPath.remove(normalized, cached);
    }
    Optional<FileRecord> found =
        store.queryOne(FileRecord.class, f -> normalized.equals(f.getPath()));
    found.ifPresent(f -> idByPath.put(normalized, f.getId()));
    return found;
  }

  public Optional<FileContent> getContent(FileRecord file) {
    if (!file.hasContent()) return Optional.empty();
    return store.find(FileContent.class, file.getContentId());
  }

  public void updateFile(FileRecord file) {
    store.update(file);
  }

  /** Erases {@code file}; its content goes too unless another file shares it. */
  public void removeFile(FileRecord file) {
    store.runInTransaction(
        () -> {
          store.erase(FileRecord.class, file.getId());
          idByPath.remove(file.getPath());
          long contentId = file.getContentId();
          if (contentId != 0
              && store.queryOne(FileRecord.class, f -> f.getContentId() == contentId).isEmpty()) {
            store.erase(FileContent.class, contentId);
          }
        });
  }

  private long contentIdFor(Path p) {
    if (!Files.isRegularFile(p)
        || BINARY_EXTENSIONS.contains(FileUtility.extension(p.toString()))) {
      return 0;
    }
    byte[] bytes;
    try {
      if (Files.size(p) > maxContentSize) {
        log.debug("Not storing content of {}: larger than {} bytes", p, maxContentSize);
        return 0;
      }
      bytes = Files.readAllBytes(p);
    } catch (IOException e) {
      log.warn("Could not read content of {}: {}", p, e.getMessage());
      return 0;
    }
    String hash = HashUtility.sha256Hex(bytes);
    Optional<FileContent> shared =
        store.queryOne(FileContent.class, c -> hash.equals(c.getHash()));
    if (shared.isPresent()) {
      return shared.get().getId();
    }
    return store
        .persist(new FileContent(hash, new String(bytes, StandardCharsets.UTF_8)))
        .getId();
  }

  private static long lastModified(Path p) {
    try {
      return Files.exists(p) ? Files.getLastModifiedTime(p).toMillis() : 0L;
    } catch (IOException e) {
      return 0L;
    }
  }
}
