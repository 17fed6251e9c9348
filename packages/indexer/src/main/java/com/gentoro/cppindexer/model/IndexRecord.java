package com.gentoro.cppindexer.model;

/**
 * Common contract of every record held by an {@link com.gentoro.cppindexer.store.IndexStore}.
 *
 * <p>An id of {@code 0} means the record has not been persisted yet; stores assign ids on
 * {@code persist}. Records refer to each other by id or by hash only.
 */
public interface IndexRecord<T extends IndexRecord<T>> {
  long getId();

  T setId(long id);

  /** Detached copy of this record. */
  T copy();
}
