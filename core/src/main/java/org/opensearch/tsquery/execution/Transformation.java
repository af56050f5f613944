/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Consumer side of a dataflow edge. Every operation kind implements this interface; the {@code
 * id} argument of each call identifies the upstream dataset that produced the signal.
 *
 * <p>Lifecycle of one route:
 *
 * <ol>
 *   <li>Any number of {@link #process}, {@link #retractTable}, {@link #updateWatermark} and {@link
 *       #updateProcessingTime} calls, in production order
 *   <li>Exactly one {@link #finish}; no signal for the route is valid afterwards
 * </ol>
 *
 * <p>An exception thrown by any non-terminal call aborts the whole query.
 */
public interface Transformation {

  /**
   * Consumes one table. Ownership of the table passes to the transformation.
   *
   * @param id the upstream dataset
   * @param table the table, owned by the callee from now on
   */
  void process(DatasetId id, Table table);

  /** Invalidates everything previously emitted for {@code key}. */
  void retractTable(DatasetId id, GroupKey key);

  /** Promises that no data at or before {@code time} will arrive any more. Never decreases. */
  void updateWatermark(DatasetId id, long time);

  /** Advances the processing time. Never decreases. */
  void updateProcessingTime(DatasetId id, long time);

  /**
   * Terminal signal.
   *
   * @param id the upstream dataset
   * @param error the reason the upstream stopped, or null on success
   */
  void finish(DatasetId id, Throwable error);
}
