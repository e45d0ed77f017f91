/*
 * Copyright 2025 Inyo Contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.inyo.occurrence.ingestor;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs {@link PartitionTask}s over a fixed worker pool, one task per partition, and hands the
 * results back in partition order. Cross-partition reductions are left to the caller.
 */
public final class PartitionScheduler implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(PartitionScheduler.class);

  private final ExecutorService executor;
  private final int threads;

  public PartitionScheduler(int threads) {
    if (threads < 1) {
      throw new IllegalArgumentException("threads must be positive: " + threads);
    }
    this.threads = threads;
    this.executor = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
  }

  public int threads() {
    return threads;
  }

  /**
   * Applies {@code task} to every partition of {@code table} and waits for all of them.
   *
   * @param stage stage name used in logs
   * @return one result per partition, in partition order
   */
  public <T> List<T> map(PartitionedTable table, String stage, PartitionTask<T> task) {
    long start = System.nanoTime();
    List<Future<T>> futures = new ArrayList<>(table.partitionCount());
    for (TablePartition partition : table.partitions()) {
      futures.add(executor.submit(() -> task.apply(partition)));
    }
    List<T> results = new ArrayList<>(futures.size());
    try {
      for (Future<T> future : futures) {
        results.add(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(f -> f.cancel(true));
      throw new IllegalStateException("Interrupted while running stage " + stage, e);
    } catch (ExecutionException e) {
      // Remaining tasks may still hold partition vectors; let them finish before returning
      awaitAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new IllegalStateException("Stage " + stage + " failed", cause);
    }
    LOG.debug(
        "Stage {} finished {} partitions in {} ms",
        stage,
        results.size(),
        TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    return results;
  }

  private static void awaitAll(List<? extends Future<?>> futures) {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (ExecutionException e) {
        LOG.debug("Sibling task failed as well: {}", e.getCause().getMessage());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        LOG.warn("Worker pool did not terminate in time, forcing shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      var thread = new Thread(runnable, "partition-worker-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
