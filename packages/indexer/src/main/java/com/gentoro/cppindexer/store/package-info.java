/**
 * Store package: the transactional record store every other component reads and writes.
 *
 * <h2>Key components</h2>
 *
 * <ul>
 *   <li>{@link com.gentoro.cppindexer.store.IndexStore}: query by predicate, persist, update,
 *       erase, and transactions joining nested calls.
 *   <li>{@link com.gentoro.cppindexer.store.driver.memory.InMemoryIndexStore}: reference
 *       implementation with an undo journal per transaction.
 *   <li>{@link com.gentoro.cppindexer.store.driver.json.JsonFileIndexStore}: the in-memory store
 *       persisted as a JSON snapshot between runs.
 * </ul>
 *
 * <h2>Driver SPI</h2>
 *
 * Backends register via {@link com.gentoro.cppindexer.store.driver.spi.IndexStoreProvider} using
 * Java ServiceLoader. {@link com.gentoro.cppindexer.store.IndexStoreFactory} resolves a driver by
 * configuration key {@code store.driver}. If unavailable, it falls back to the in-memory driver.
 */
package com.gentoro.cppindexer.store;
