/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.stage;

import org.opensearch.tsquery.execution.ExecutionContext;
import org.opensearch.tsquery.execution.MemoryAccount;
import org.opensearch.tsquery.execution.table.TableIterator;
import org.opensearch.tsquery.spec.QuerySpec;

/**
 * Storage side of a stage at the root of a query: evaluates the staged operations next to the
 * data and returns the resulting tables.
 */
@FunctionalInterface
public interface TableReaderFactory {

  /**
   * Opens a reader for the staged operations.
   *
   * @param spec the operations of the stage
   * @param context construction context of the stage node, carrying its bounds
   * @param account account the produced tables are charged to
   * @return an iterator the caller closes
   */
  TableIterator read(QuerySpec spec, ExecutionContext context, MemoryAccount account);
}
