package com.gentoro.cppindexer.store;

import com.gentoro.cppindexer.model.IndexRecord;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Transactional record store holding the whole index: files, build actions, AST facts and the
 * generic relationship graph.
 *
 * <p>Every operation runs inside a transaction. Operations issued inside {@link
 * #callInTransaction} or {@link #runInTransaction} join that transaction; operations issued
 * outside open a transaction of their own. A transaction either commits all of its writes or, when
 * its unit of work throws, none of them.
 *
 * <p>Records handed out by the store are detached copies; changes become visible only through
 * {@link #update}.
 */
public interface IndexStore extends AutoCloseable {
  void initialize();

  boolean isInitialized();

  /** Removes every record of every type. */
  void clearAll();

  <T extends IndexRecord<T>> List<T> query(Class<T> type, Predicate<? super T> predicate);

  default <T extends IndexRecord<T>> List<T> queryAll(Class<T> type) {
    return query(type, r -> true);
  }

  default <T extends IndexRecord<T>> Optional<T> queryOne(
      Class<T> type, Predicate<? super T> predicate) {
    List<T> found = query(type, predicate);
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
  }

  <T extends IndexRecord<T>> Optional<T> find(Class<T> type, long id);

  /** Assigns a fresh id to {@code record}, stores it and returns the same instance. */
  <T extends IndexRecord<T>> T persist(T record);

  /** Replaces the stored record with the same id. Fails if there is none. */
  <T extends IndexRecord<T>> void update(T record);

  /** @return true if a record was removed */
  <T extends IndexRecord<T>> boolean erase(Class<T> type, long id);

  <R> R callInTransaction(Work<R> work);

  default void runInTransaction(VoidWork work) {
    callInTransaction(
        () -> {
          work.execute();
          return null;
        });
  }

  /** Logical backend/driver name. */
  String getDriverName();

  void shutdown();

  @Override
  default void close() {
    shutdown();
  }

  @FunctionalInterface
  interface Work<R> {
    R execute() throws Exception;
  }

  @FunctionalInterface
  interface VoidWork {
    void execute() throws Exception;
  }
}
