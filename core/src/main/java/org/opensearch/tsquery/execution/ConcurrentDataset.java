/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import lombok.Getter;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Bounded fan-out dataset whose transformations are parallel slots rather than independent
 * consumers.
 *
 * <p>{@link #process} sends each table to exactly one slot, chosen strictly round robin: the
 * call with index {@code i} goes to slot {@code i mod size()}. For a full dataset of capacity C,
 * slot k therefore receives calls k, k+C, k+2C, ... Control signals are broadcast to every slot,
 * since each parallel worker must observe them.
 *
 * <p>Not thread safe. Callers serialize access, normally through the transport of the owning
 * transformation.
 */
public class ConcurrentDataset implements Dataset {

  @Getter private final DatasetId id;
  private final int capacity;
  private final TransformationSet slots = new TransformationSet();
  private long callIndex;

  public ConcurrentDataset(DatasetId id, int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.id = id;
    this.capacity = capacity;
  }

  /**
   * Adds a slot.
   *
   * @throws IllegalStateException if the dataset is already at capacity
   */
  @Override
  public void addTransformation(Transformation transformation) {
    if (slots.size() >= capacity) {
      throw new IllegalStateException(
          "concurrent dataset " + id + " is at capacity " + capacity);
    }
    slots.add(transformation);
  }

  /** Returns the current number of slots. */
  public int size() {
    return slots.size();
  }

  /** Returns the maximum number of slots. */
  public int cap() {
    return capacity;
  }

  @Override
  public void process(Table table) {
    if (slots.isEmpty()) {
      table.done();
      throw new IllegalStateException("concurrent dataset " + id + " has no slot to process into");
    }
    int slot = (int) (callIndex % slots.size());
    callIndex++;
    slots.asList().get(slot).process(id, table);
  }

  @Override
  public void retractTable(GroupKey key) {
    slots.retractTable(id, key);
  }

  @Override
  public void updateWatermark(long time) {
    slots.updateWatermark(id, time);
  }

  @Override
  public void updateProcessingTime(long time) {
    slots.updateProcessingTime(id, time);
  }

  @Override
  public void finish(Throwable error) {
    slots.finish(id, error);
  }
}
