/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runtime state for a pipeline execution. Tracks status and provides cancellation. A child
 * context, created for every nested pipeline, is cancelled together with its parent.
 */
public class PipelineContext {

  /** Pipeline execution status. */
  public enum Status {
    CREATED,
    RUNNING,
    FINISHED,
    FAILED,
    CANCELLED
  }

  private volatile Status status;
  private final AtomicReference<Throwable> cancelCause;
  private final List<PipelineContext> children;
  private volatile String failureMessage;

  public PipelineContext() {
    this.status = Status.CREATED;
    this.cancelCause = new AtomicReference<>();
    this.children = new CopyOnWriteArrayList<>();
  }

  /** Creates a context that is cancelled whenever this one is. */
  public PipelineContext createChild() {
    PipelineContext child = new PipelineContext();
    children.add(child);
    Throwable cause = cancelCause.get();
    if (cause != null) {
      child.cancel(cause);
    }
    return child;
  }

  public Status getStatus() {
    return status;
  }

  public void setRunning() {
    this.status = Status.RUNNING;
  }

  public void setFinished() {
    this.status = Status.FINISHED;
  }

  public void setFailed(String message) {
    this.status = Status.FAILED;
    this.failureMessage = message;
  }

  /**
   * Requests cancellation. Only the first cause is kept; later calls have no effect.
   *
   * @param cause why the pipeline is cancelled
   */
  public void cancel(Throwable cause) {
    if (cancelCause.compareAndSet(null, cause)) {
      this.status = Status.CANCELLED;
      for (PipelineContext child : children) {
        child.cancel(cause);
      }
    }
  }

  public boolean isCancelled() {
    return cancelCause.get() != null;
  }

  /** Returns the cause passed to the first {@link #cancel(Throwable)}, or null. */
  public Throwable getCause() {
    return cancelCause.get();
  }

  public String getFailureMessage() {
    return failureMessage;
  }
}
