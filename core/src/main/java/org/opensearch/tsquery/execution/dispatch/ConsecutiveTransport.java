/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.dispatch;

import java.util.HashSet;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.Transformation;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Message-passing adapter placed in front of every transformation. Calls are queued and return
 * immediately; the queue is drained on the dispatcher by at most one task at a time, so signals
 * addressed to one transformation are delivered in production order while different
 * transformations progress in parallel.
 *
 * <p>A transport serves every parent of its transformation. Once {@code finish} has been queued
 * for an upstream dataset, any further signal from that dataset is rejected with {@link
 * IllegalStateException}. If the wrapped transformation throws, it is finished with that error,
 * the query is aborted through the dispatcher, and later messages are discarded.
 */
@Log4j2
public class ConsecutiveTransport implements Transformation {

  private final Dispatcher dispatcher;
  private final Transformation transformation;
  private final Queue<Message> queue = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean scheduled = new AtomicBoolean(false);
  private final Object lock = new Object();
  private final Set<DatasetId> finishedRoutes = new HashSet<>();
  private volatile boolean failed;

  public ConsecutiveTransport(Dispatcher dispatcher, Transformation transformation) {
    this.dispatcher = dispatcher;
    this.transformation = transformation;
  }

  @Override
  public void process(DatasetId id, Table table) {
    push(new ProcessMessage(id, table));
  }

  @Override
  public void retractTable(DatasetId id, GroupKey key) {
    push(new RetractTableMessage(id, key));
  }

  @Override
  public void updateWatermark(DatasetId id, long time) {
    push(new WatermarkMessage(id, time));
  }

  @Override
  public void updateProcessingTime(DatasetId id, long time) {
    push(new ProcessingTimeMessage(id, time));
  }

  @Override
  public void finish(DatasetId id, Throwable error) {
    push(new FinishMessage(id, error));
  }

  /** Returns true once the wrapped transformation has failed and stopped receiving messages. */
  public boolean isFailed() {
    return failed;
  }

  private void push(Message message) {
    synchronized (lock) {
      if (finishedRoutes.contains(message.getId())) {
        message.discard();
        throw new IllegalStateException(
            "dataset "
                + message.getId()
                + " already finished its route to "
                + transformation.getClass().getSimpleName());
      }
      if (message instanceof FinishMessage) {
        finishedRoutes.add(message.getId());
      }
      queue.add(message);
    }
    scheduleDrain();
  }

  private void scheduleDrain() {
    if (scheduled.compareAndSet(false, true)) {
      dispatcher.schedule(this::drain);
    }
  }

  private void drain() {
    try {
      Message message;
      while ((message = queue.poll()) != null) {
        if (failed) {
          message.discard();
        } else {
          deliver(message);
        }
      }
    } finally {
      scheduled.set(false);
    }
    if (!queue.isEmpty()) {
      scheduleDrain();
    }
  }

  private void deliver(Message message) {
    if (message instanceof FinishMessage) {
      try {
        message.deliver(transformation);
      } catch (RuntimeException e) {
        dispatcher.setError(e);
      }
      return;
    }
    try {
      message.deliver(transformation);
    } catch (RuntimeException e) {
      failed = true;
      log.debug("Transformation {} failed", transformation.getClass().getSimpleName(), e);
      dispatcher.setError(e);
      try {
        transformation.finish(message.getId(), e);
      } catch (RuntimeException finishError) {
        dispatcher.setError(finishError);
      }
    }
  }

  private abstract static class Message {
    private final DatasetId id;

    Message(DatasetId id) {
      this.id = id;
    }

    DatasetId getId() {
      return id;
    }

    abstract void deliver(Transformation t);

    /** Releases resources held by a message that will never be delivered. */
    void discard() {}
  }

  private static final class ProcessMessage extends Message {
    private final Table table;

    ProcessMessage(DatasetId id, Table table) {
      super(id);
      this.table = table;
    }

    @Override
    void deliver(Transformation t) {
      t.process(getId(), table);
    }

    @Override
    void discard() {
      table.done();
    }
  }

  private static final class RetractTableMessage extends Message {
    private final GroupKey key;

    RetractTableMessage(DatasetId id, GroupKey key) {
      super(id);
      this.key = key;
    }

    @Override
    void deliver(Transformation t) {
      t.retractTable(getId(), key);
    }
  }

  private static final class WatermarkMessage extends Message {
    private final long time;

    WatermarkMessage(DatasetId id, long time) {
      super(id);
      this.time = time;
    }

    @Override
    void deliver(Transformation t) {
      t.updateWatermark(getId(), time);
    }
  }

  private static final class ProcessingTimeMessage extends Message {
    private final long time;

    ProcessingTimeMessage(DatasetId id, long time) {
      super(id);
      this.time = time;
    }

    @Override
    void deliver(Transformation t) {
      t.updateProcessingTime(getId(), time);
    }
  }

  private static final class FinishMessage extends Message {
    private final Throwable error;

    FinishMessage(DatasetId id, Throwable error) {
      super(id);
      this.error = error;
    }

    @Override
    void deliver(Transformation t) {
      t.finish(getId(), error);
    }
  }
}
