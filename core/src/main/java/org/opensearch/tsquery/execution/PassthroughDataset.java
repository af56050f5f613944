/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import lombok.Getter;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Dataset that forwards everything it receives to its transformations unchanged. Watermarks and
 * processing times lower than the last forwarded value are dropped.
 */
public class PassthroughDataset implements Dataset {

  @Getter private final DatasetId id;
  private final TransformationSet transformations = new TransformationSet();
  private long watermark = Long.MIN_VALUE;
  private long processingTime = Long.MIN_VALUE;

  public PassthroughDataset(DatasetId id) {
    this.id = id;
  }

  @Override
  public void addTransformation(Transformation transformation) {
    transformations.add(transformation);
  }

  @Override
  public void process(Table table) {
    transformations.process(id, table);
  }

  @Override
  public void retractTable(GroupKey key) {
    transformations.retractTable(id, key);
  }

  @Override
  public void updateWatermark(long time) {
    if (time < watermark) {
      return;
    }
    watermark = time;
    transformations.updateWatermark(id, time);
  }

  @Override
  public void updateProcessingTime(long time) {
    if (time < processingTime) {
      return;
    }
    processingTime = time;
    transformations.updateProcessingTime(id, time);
  }

  @Override
  public void finish(Throwable error) {
    transformations.finish(id, error);
  }
}
