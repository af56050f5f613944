/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import lombok.Getter;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.Transformation;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Collects the tables produced by one leaf of the query. Retracted keys are dropped from the
 * collected output. The completion callback runs once, on finish.
 */
public class ResultCollector implements Transformation {

  @Getter private final String nodeId;
  private final Consumer<ResultCollector> onFinish;
  private final List<Table> tables = new ArrayList<>();
  @Getter private volatile boolean finished;
  @Getter private volatile Throwable error;
  private boolean released;

  public ResultCollector(String nodeId, Consumer<ResultCollector> onFinish) {
    this.nodeId = nodeId;
    this.onFinish = onFinish;
  }

  @Override
  public synchronized void process(DatasetId id, Table table) {
    if (released) {
      table.done();
      return;
    }
    tables.add(table);
  }

  @Override
  public synchronized void retractTable(DatasetId id, GroupKey key) {
    tables.removeIf(
        table -> {
          if (table.getKey().equals(key)) {
            table.done();
            return true;
          }
          return false;
        });
  }

  @Override
  public void updateWatermark(DatasetId id, long time) {}

  @Override
  public void updateProcessingTime(DatasetId id, long time) {}

  @Override
  public void finish(DatasetId id, Throwable error) {
    synchronized (this) {
      if (finished) {
        return;
      }
      this.error = error;
      this.finished = true;
    }
    onFinish.accept(this);
  }

  /** Returns the collected tables. */
  public synchronized List<Table> getTables() {
    return new ArrayList<>(tables);
  }

  /** Releases the collected tables and any that arrive later, used when the query fails. */
  public synchronized void release() {
    released = true;
    tables.forEach(Table::done);
    tables.clear();
  }
}
