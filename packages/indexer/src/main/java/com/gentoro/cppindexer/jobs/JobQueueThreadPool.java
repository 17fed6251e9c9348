package com.gentoro.cppindexer.jobs;

import com.gentoro.cppindexer.exception.StateException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;

/**
 * Fixed set of worker threads draining one shared job queue. Jobs complete in any order; a job
 * that throws is logged and does not affect the others. {@link #awaitCompletion()} blocks until
 * the queue is empty and no job is running.
 *
 * @param <J> job type
 */
public final class JobQueueThreadPool<J> implements AutoCloseable {
  private static final Logger log =
      com.gentoro.cppindexer.logging.LoggingService.getLogger(JobQueueThreadPool.class);

  private final ExecutorService executor;
  private final JobHandler<J> handler;
  private final Object monitor = new Object();
  private int pending;

  public JobQueueThreadPool(String name, int threads, JobHandler<J> handler) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be at least 1, got " + threads);
    }
    this.handler = handler;
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newFixedThreadPool(
            threads,
            r -> {
              Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
  }

  public void enqueue(J job) {
    synchronized (monitor) {
      pending++;
    }
    try {
      executor.execute(() -> run(job));
    } catch (RejectedExecutionException e) {
      finished();
      throw new StateException("Job queue has been shut down");
    }
  }

  private void run(J job) {
    try {
      handler.handle(job);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.warn("Job {} interrupted", job);
    } catch (Exception e) {
      log.error("Job {} failed: {}", job, e.toString(), e);
    } finally {
      finished();
    }
  }

  private void finished() {
    synchronized (monitor) {
      pending--;
      if (pending == 0) {
        monitor.notifyAll();
      }
    }
  }

  /** Blocks until every enqueued job has finished. */
  public void awaitCompletion() {
    synchronized (monitor) {
      while (pending > 0) {
        try {
          monitor.wait();
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          log.warn("Interrupted while waiting for {} pending jobs", pending);
          return;
        }
      }
    }
  }

  public int pendingJobs() {
    synchronized (monitor) {
      return pending;
    }
  }

  /** Stops accepting jobs and waits for the running ones. */
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Worker threads did not stop in time");
        executor.shutdownNow();
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  @FunctionalInterface
  public interface JobHandler<J> {
    void handle(J job) throws Exception;
  }
}
