package com.gentoro.cppindexer.store.driver.memory;

import com.gentoro.cppindexer.exception.StateException;
import com.gentoro.cppindexer.exception.StoreException;
import com.gentoro.cppindexer.model.IndexRecord;
import com.gentoro.cppindexer.store.IndexStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory {@link IndexStore}. Transactions are serialized by a reentrant lock and every write
 * pushes an undo entry, so a failing transaction restores the exact state it started from.
 * Nested transactions join the outermost one; a failure inside a nested transaction marks the
 * outer one rollback-only.
 */
public class InMemoryIndexStore implements IndexStore {
  private static final org.slf4j.Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(InMemoryIndexStore.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Class<?>, NavigableMap<Long, IndexRecord<?>>> tables = new HashMap<>();
  private final Map<Class<?>, Long> sequences = new HashMap<>();

  // guarded by lock
  private Deque<Runnable> undo;
  private int depth;
  private boolean rollbackOnly;
  private long modifications;

  private volatile boolean initialized = false;

  @Override
  public void initialize() {
    initialized = true;
  }

  @Override
  public boolean isInitialized() {
    return initialized;
  }

  @Override
  public void clearAll() {
    runInTransaction(
        () -> {
          for (Map.Entry<Class<?>, NavigableMap<Long, IndexRecord<?>>> e : tables.entrySet()) {
            NavigableMap<Long, IndexRecord<?>> table = e.getValue();
            for (Long id : new ArrayList<>(table.keySet())) {
              write(table, id, null);
            }
          }
        });
  }

  @Override
  public <T extends IndexRecord<T>> List<T> query(Class<T> type, Predicate<? super T> predicate) {
    Objects.requireNonNull(predicate, "predicate");
    return callInTransaction(
        () -> {
          List<T> result = new ArrayList<>();
          for (IndexRecord<?> r : table(type).values()) {
            T typed = type.cast(r);
            if (predicate.test(typed)) {
              result.add(typed.copy());
            }
          }
          return result;
        });
  }

  @Override
  public <T extends IndexRecord<T>> Optional<T> find(Class<T> type, long id) {
    return callInTransaction(
        () -> {
          IndexRecord<?> r = table(type).get(id);
          return r == null ? Optional.<T>empty() : Optional.of(type.cast(r).copy());
        });
  }

  @Override
  public <T extends IndexRecord<T>> T persist(T record) {
    Objects.requireNonNull(record, "record");
    runInTransaction(
        () -> {
          if (record.getId() != 0) {
            throw new StoreException(
                "Record already persisted: "
                    + record.getClass().getSimpleName()
                    + "#"
                    + record.getId());
          }
          Class<?> type = record.getClass();
          long id = sequences.merge(type, 1L, Long::sum);
          record.setId(id);
          write(table(type), id, record.copy());
        });
    return record;
  }

  @Override
  public <T extends IndexRecord<T>> void update(T record) {
    Objects.requireNonNull(record, "record");
    runInTransaction(
        () -> {
          NavigableMap<Long, IndexRecord<?>> table = table(record.getClass());
          if (!table.containsKey(record.getId())) {
            throw new StoreException(
                "No such record: " + record.getClass().getSimpleName() + "#" + record.getId());
          }
          write(table, record.getId(), record.copy());
        });
  }

  @Override
  public <T extends IndexRecord<T>> boolean erase(Class<T> type, long id) {
    return callInTransaction(
        () -> {
          NavigableMap<Long, IndexRecord<?>> table = table(type);
          if (!table.containsKey(id)) return false;
          write(table, id, null);
          return true;
        });
  }

  @Override
  public <R> R callInTransaction(Work<R> work) {
    ensureInitialized();
    lock.lock();
    boolean outermost = depth == 0;
    if (outermost) {
      undo = new ArrayDeque<>();
      rollbackOnly = false;
    }
    depth++;
    try {
      R result;
      try {
        result = work.execute();
      } catch (Exception e) {
        if (!outermost) {
          rollbackOnly = true;
          throw e;
        }
        rollback();
        throw e;
      }
      if (outermost) {
        if (rollbackOnly) {
          rollback();
          throw new StoreException("Transaction was marked rollback-only by a nested failure");
        }
        undo.clear();
        onCommit();
      }
      return result;
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new StoreException("Transaction failed: " + e.getMessage(), e);
    } finally {
      depth--;
      if (outermost) {
        undo = null;
      }
      lock.unlock();
    }
  }

  @Override
  public String getDriverName() {
    return "in-memory";
  }

  @Override
  public void shutdown() {
    lock.lock();
    try {
      initialized = false;
      tables.clear();
      sequences.clear();
    } finally {
      lock.unlock();
    }
  }

  /** Invoked while still holding the lock, after an outermost transaction committed. */
  protected void onCommit() {}

  /** Number of writes committed or pending since the store was created. */
  protected final long modificationCount() {
    return modifications;
  }

  /** Copies of every record of {@code type}, in id order. Caller must hold a transaction. */
  protected final List<IndexRecord<?>> dump(Class<?> type) {
    List<IndexRecord<?>> result = new ArrayList<>();
    for (IndexRecord<?> r : table(type).values()) {
      result.add(r.copy());
    }
    return result;
  }

  protected final long sequenceOf(Class<?> type) {
    return sequences.getOrDefault(type, 0L);
  }

  /**
   * Bulk-loads records with their ids untouched, bypassing the undo journal. Used by drivers
   * restoring a snapshot before the store is initialized.
   */
  protected final void load(Class<?> type, Collection<? extends IndexRecord<?>> records, long seq) {
    lock.lock();
    try {
      NavigableMap<Long, IndexRecord<?>> table = table(type);
      long max = seq;
      for (IndexRecord<?> r : records) {
        table.put(r.getId(), r);
        max = Math.max(max, r.getId());
      }
      sequences.put(type, max);
    } finally {
      lock.unlock();
    }
  }

  protected final ReentrantLock lock() {
    return lock;
  }

  private void write(NavigableMap<Long, IndexRecord<?>> table, long id, IndexRecord<?> value) {
    IndexRecord<?> previous = value == null ? table.remove(id) : table.put(id, value);
    modifications++;
    undo.push(
        () -> {
          if (previous == null) table.remove(id);
          else table.put(id, previous);
        });
  }

  private void rollback() {
    int entries = undo.size();
    while (!undo.isEmpty()) {
      undo.pop().run();
    }
    log.debug("Rolled back transaction ({} writes undone)", entries);
  }

  private NavigableMap<Long, IndexRecord<?>> table(Class<?> type) {
    return tables.computeIfAbsent(type, k -> new TreeMap<>());
  }

  private void ensureInitialized() {
    if (!initialized) {
      throw new StateException("Index store '" + getDriverName() + "' is not initialized");
    }
  }
}
