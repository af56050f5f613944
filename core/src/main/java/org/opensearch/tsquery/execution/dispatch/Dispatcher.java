/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.dispatch;

/**
 * Schedules the work of one query on a shared worker pool and records the error that aborts the
 * query. The top-level pipeline and every nested pipeline of a query share one dispatcher.
 */
public interface Dispatcher {

  /**
   * Runs {@code task} asynchronously. An exception thrown by the task aborts the query.
   *
   * @throws IllegalStateException if the dispatcher has been stopped
   */
  void schedule(Runnable task);

  /** Aborts the query with {@code error}. Only the first error is kept. */
  void setError(Throwable error);

  /** Returns the error that aborted the query, or null. */
  Throwable getError();

  /** Stops accepting new tasks. Tasks already scheduled still run. */
  void stop();
}
