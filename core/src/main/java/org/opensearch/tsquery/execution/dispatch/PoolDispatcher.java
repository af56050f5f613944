/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.dispatch;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.execution.PipelineContext;

/**
 * Dispatcher over a fixed-size worker pool shared by all queries. Recording the first error
 * cancels the query's pipeline context, which makes every source stop and finish with that
 * error, and notifies the abort listeners.
 */
@Log4j2
public class PoolDispatcher implements Dispatcher {

  private final ExecutorService pool;
  private final PipelineContext context;
  private final AtomicReference<Throwable> error = new AtomicReference<>();
  private final List<Consumer<Throwable>> abortListeners = new CopyOnWriteArrayList<>();
  private volatile boolean stopped;

  public PoolDispatcher(ExecutorService pool, PipelineContext context) {
    this.pool = pool;
    this.context = context;
  }

  @Override
  public void schedule(Runnable task) {
    if (stopped) {
      throw new IllegalStateException("dispatcher has been stopped");
    }
    pool.execute(
        () -> {
          try {
            task.run();
          } catch (RuntimeException e) {
            setError(e);
          }
        });
  }

  @Override
  public void setError(Throwable e) {
    if (error.compareAndSet(null, e)) {
      log.error("Aborting query", e);
      context.setFailed(e.getMessage());
      context.cancel(e);
      abortListeners.forEach(listener -> listener.accept(e));
    } else if (e != error.get()) {
      log.warn("Ignoring error after query abort: {}", e.toString());
    }
  }

  /** Registers a callback run once with the first recorded error. */
  public void addAbortListener(Consumer<Throwable> listener) {
    abortListeners.add(listener);
  }

  @Override
  public Throwable getError() {
    return error.get();
  }

  @Override
  public void stop() {
    stopped = true;
  }
}
