/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.table;

import java.util.Iterator;

/**
 * Iterator over the tables produced by the storage layer. The caller owns every table returned by
 * {@link #next()} and must close the iterator when done, also after a failure.
 */
public interface TableIterator extends Iterator<Table>, AutoCloseable {

  @Override
  void close();
}
