/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.stage;

import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.execution.Dataset;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.Transformation;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Merge point between the leaves of all nested pipelines of a stage and the stage's own dataset.
 *
 * <p>Tables and retractions pass straight through. Watermarks and processing times are forwarded
 * as the minimum over the leaves that have not finished yet. A single {@code finish} is forwarded
 * once the stage has received its own and every registered leaf has finished; the first error
 * seen wins. Leaves run on different dispatcher tasks, so every method is synchronized.
 */
@Log4j2
@RequiredArgsConstructor
public class StageOutput implements Transformation {

  private final Dataset successor;
  private final Map<DatasetId, Long> watermarks = new HashMap<>();
  private final Map<DatasetId, Long> processingTimes = new HashMap<>();
  private long forwardedWatermark = Long.MIN_VALUE;
  private long forwardedProcessingTime = Long.MIN_VALUE;
  private boolean inputFinished;
  private boolean finished;
  private Throwable error;

  /** Registers a nested leaf and returns the transformation it must feed. */
  public synchronized Transformation leaf(DatasetId leafId) {
    if (finished) {
      throw new IllegalStateException("stage output already finished, cannot add leaf " + leafId);
    }
    watermarks.put(leafId, Long.MIN_VALUE);
    processingTimes.put(leafId, Long.MIN_VALUE);
    return this;
  }

  /** Returns the number of leaves that have not finished yet. */
  public synchronized int getLiveLeaves() {
    return watermarks.size();
  }

  @Override
  public synchronized void process(DatasetId id, Table table) {
    successor.process(table);
  }

  @Override
  public synchronized void retractTable(DatasetId id, GroupKey key) {
    successor.retractTable(key);
  }

  @Override
  public synchronized void updateWatermark(DatasetId id, long time) {
    if (watermarks.computeIfPresent(id, (leaf, current) -> Math.max(current, time)) != null) {
      forwardWatermark();
    }
  }

  @Override
  public synchronized void updateProcessingTime(DatasetId id, long time) {
    if (processingTimes.computeIfPresent(id, (leaf, current) -> Math.max(current, time)) != null) {
      forwardProcessingTime();
    }
  }

  /** Finish of one nested leaf. */
  @Override
  public synchronized void finish(DatasetId id, Throwable leafError) {
    watermarks.remove(id);
    processingTimes.remove(id);
    recordError(leafError);
    forwardWatermark();
    forwardProcessingTime();
    finishIfComplete();
  }

  /** Finish of the stage input; nested pipelines may still be draining. */
  public synchronized void inputFinished(Throwable inputError) {
    inputFinished = true;
    recordError(inputError);
    finishIfComplete();
  }

  private void recordError(Throwable e) {
    if (e == null) {
      return;
    }
    if (error == null) {
      error = e;
    } else if (e != error) {
      log.debug("Dropping secondary stage error: {}", e.toString());
    }
  }

  private void forwardWatermark() {
    long min = min(watermarks);
    if (min > forwardedWatermark) {
      forwardedWatermark = min;
      successor.updateWatermark(min);
    }
  }

  private void forwardProcessingTime() {
    long min = min(processingTimes);
    if (min > forwardedProcessingTime) {
      forwardedProcessingTime = min;
      successor.updateProcessingTime(min);
    }
  }

  private static long min(Map<DatasetId, Long> times) {
    if (times.isEmpty()) {
      return Long.MIN_VALUE;
    }
    long min = Long.MAX_VALUE;
    for (long time : times.values()) {
      min = Math.min(min, time);
    }
    return min;
  }

  private void finishIfComplete() {
    if (finished || !inputFinished || !watermarks.isEmpty()) {
      return;
    }
    finished = true;
    successor.finish(error);
  }
}
