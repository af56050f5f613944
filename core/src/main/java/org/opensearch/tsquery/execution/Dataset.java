/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;

/**
 * Producer side of a transformation: owns the ordered list of downstream transformations and
 * forwards every signal to each of them. Forwarding stops at the first exception, which
 * propagates to the caller.
 */
public interface Dataset extends Node {

  void process(Table table);

  void retractTable(GroupKey key);

  void updateWatermark(long time);

  void updateProcessingTime(long time);

  void finish(Throwable error);
}
