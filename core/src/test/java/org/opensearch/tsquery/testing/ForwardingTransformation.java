/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.testing;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;
import org.opensearch.tsquery.exception.QueryEngineException;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.PassthroughDataset;
import org.opensearch.tsquery.execution.Transformation;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Transformation forwarding its input to its dataset. Finishes once every parent has finished, or
 * on the first error. With {@code failOnProcess} every table is rejected instead.
 */
public class ForwardingTransformation implements Transformation {

  @Getter private final PassthroughDataset dataset;
  private final Set<DatasetId> parents;
  private final Set<DatasetId> finishedParents = new HashSet<>();
  private final boolean failOnProcess;
  private boolean finished;

  public ForwardingTransformation(DatasetId id, List<DatasetId> parents, boolean failOnProcess) {
    this.dataset = new PassthroughDataset(id);
    this.parents = new HashSet<>(parents);
    this.failOnProcess = failOnProcess;
  }

  @Override
  public void process(DatasetId id, Table table) {
    if (failOnProcess) {
      table.done();
      throw new QueryEngineException("failed to process " + dataset.getId());
    }
    dataset.process(table);
  }

  @Override
  public void retractTable(DatasetId id, GroupKey key) {
    dataset.retractTable(key);
  }

  @Override
  public void updateWatermark(DatasetId id, long time) {
    dataset.updateWatermark(time);
  }

  @Override
  public void updateProcessingTime(DatasetId id, long time) {
    dataset.updateProcessingTime(time);
  }

  @Override
  public void finish(DatasetId id, Throwable error) {
    if (finished) {
      return;
    }
    finishedParents.add(id);
    if (error == null && !finishedParents.containsAll(parents)) {
      return;
    }
    finished = true;
    dataset.finish(error);
  }
}
