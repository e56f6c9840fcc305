package io.nosqlbench.scandata.parallel;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


import io.nosqlbench.scandata.errors.CoordinationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Function;

/// A group of workers running as threads of one process.
///
/// Each rank has a mailbox queue; [CoordinationContext#send(Object)] delivers to the
/// coordinator's mailbox. Barriers are a shared [CyclicBarrier]. This is the substrate used by
/// the command line tools to spread a scan over several workers, and by tests to exercise the
/// collective protocols.
///
/// When one worker of [#run(Function)] fails, the barrier is broken and the remaining workers
/// are interrupted, so that the group ends instead of waiting forever.
public class LocalCoordinationGroup {

  private static final Logger logger = LogManager.getLogger(LocalCoordinationGroup.class);

  private final int size;
  private final CyclicBarrier barrier;
  private final List<BlockingQueue<Envelope>> mailboxes;
  private final List<CoordinationContext> contexts;

  /// create a group
  /// @param size the number of workers
  public LocalCoordinationGroup(int size) {
    if (size < 1) {
      throw new IllegalArgumentException("a group needs at least one worker, not " + size);
    }
    this.size = size;
    this.barrier = new CyclicBarrier(size);
    this.mailboxes = new ArrayList<>(size);
    this.contexts = new ArrayList<>(size);
    for (int rank = 0; rank < size; rank++) {
      mailboxes.add(new LinkedBlockingQueue<>());
      contexts.add(new Member(rank));
    }
  }

  /// @return the number of workers
  public int size() {
    return size;
  }

  /// @param rank a worker rank
  /// @return the context of that worker
  public CoordinationContext context(int rank) {
    return contexts.get(rank);
  }

  /// Run the same work on every rank, each on its own thread, and wait for all of them.
  /// @param work the per-worker control flow
  /// @param <T> the per-worker result type
  /// @return the results, in rank order
  public <T> List<T> run(Function<CoordinationContext, T> work) {
    ExecutorService executor = Executors.newFixedThreadPool(size, runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName("scan-worker-" + thread.getId());
      thread.setDaemon(true);
      return thread;
    });
    try {
      List<Future<T>> futures = new ArrayList<>(size);
      for (CoordinationContext context : contexts) {
        futures.add(executor.submit(() -> {
          try {
            return work.apply(context);
          } catch (RuntimeException e) {
            logger.error("worker {} failed: {}", context.rank(), e.getMessage());
            barrier.reset();
            executor.shutdownNow();
            throw e;
          }
        }));
      }
      List<T> results = new ArrayList<>(size);
      RuntimeException failure = null;
      for (Future<T> future : futures) {
        try {
          results.add(future.get());
        } catch (ExecutionException e) {
          RuntimeException cause = e.getCause() instanceof RuntimeException re ? re
              : new RuntimeException(e.getCause());
          if (failure == null || failure instanceof CoordinationException) {
            failure = cause;
          }
          results.add(null);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new CoordinationException("interrupted while waiting for workers", e);
        }
      }
      if (failure != null) {
        throw failure;
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  private record Envelope(int source, Object value) {
  }

  private final class Member implements CoordinationContext {
    private final int rank;

    private Member(int rank) {
      this.rank = rank;
    }

    @Override
    public int rank() {
      return rank;
    }

    @Override
    public int size() {
      return size;
    }

    @Override
    public void send(Object value) {
      mailboxes.get(COORDINATOR).add(new Envelope(rank, value));
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T receive() {
      try {
        Envelope envelope = mailboxes.get(rank).take();
        logger.trace("rank {} received from rank {}", rank, envelope.source());
        return (T) envelope.value();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CoordinationException("rank " + rank + " interrupted while receiving", e);
      }
    }

    @Override
    public void barrier() {
      try {
        barrier.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CoordinationException("rank " + rank + " interrupted at barrier", e);
      } catch (BrokenBarrierException e) {
        throw new CoordinationException("barrier broken while rank " + rank + " was waiting", e);
      }
    }

    @Override
    public String toString() {
      return "LocalCoordinationGroup.Member{rank=" + rank + "/" + size + "}";
    }
  }
}
