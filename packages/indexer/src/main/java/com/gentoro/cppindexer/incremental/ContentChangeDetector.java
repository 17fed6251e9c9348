package com.gentoro.cppindexer.incremental;

import com.gentoro.cppindexer.model.FileContent;
import com.gentoro.cppindexer.model.FileRecord;
import com.gentoro.cppindexer.model.FileType;
import com.gentoro.cppindexer.store.IndexStore;
import com.gentoro.cppindexer.utility.HashUtility;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Compares stored files with the disk. Directories and build products are never checked. A
 * missing file is DELETED; a file whose current SHA-256 differs from the stored content hash is
 * MODIFIED. Files without stored content cannot be compared and count as unchanged.
 *
 * <p>Files that appeared since the last run are not detected; they are picked up when a compile
 * command references them.
 */
public class ContentChangeDetector {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(ContentChangeDetector.class);

  private final IndexStore store;

  public ContentChangeDetector(IndexStore store) {
    this.store = store;
  }

  /** Classifies every stored file that changed; already classified paths are left alone. */
  public void detect(FileClassification classification) {
    store.runInTransaction(
        () -> {
          for (FileRecord file :
              store.query(
                  FileRecord.class,
                  f -> f.getType() != FileType.DIRECTORY && f.getType() != FileType.BINARY)) {
            if (classification.isClassified(file.getPath())) continue;
            detect(file)
                .ifPresent(
                    change -> {
                      classification.classify(file.getPath(), change);
                      log.debug("File {}: {}", change, file.getPath());
                    });
          }
        });
  }

  /** Change of a single file, empty when unchanged or not comparable. */
  public Optional<FileChange> detect(FileRecord file) {
    Path path = Path.of(file.getPath());
    if (!Files.exists(path)) {
      return Optional.of(FileChange.DELETED);
    }
    if (!file.hasContent()) {
      return Optional.empty();
    }
    Optional<FileContent> content = store.find(FileContent.class, file.getContentId());
    if (content.isEmpty()) {
      return Optional.empty();
    }
    String current;
    try {
      current = HashUtility.sha256Hex(path);
    } catch (UncheckedIOException e) {
      log.warn("Treating {} as modified: {}", path, e.getMessage());
      return Optional.of(FileChange.MODIFIED);
    }
    return current.equals(content.get().getHash())
        ? Optional.empty()
        : Optional.of(FileChange.MODIFIED);
  }
}
