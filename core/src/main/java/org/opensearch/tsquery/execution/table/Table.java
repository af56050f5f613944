/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.table;

import java.util.List;

/**
 * A batch of rows sharing one {@link GroupKey}.
 *
 * <p>A table has exactly one owner. Handing a table to {@code Transformation.process} transfers
 * ownership; delivering the same batch to a second consumer requires {@link #copy()}. The owner
 * calls {@link #done()} once it no longer needs the rows, after which every accessor throws.
 */
public interface Table {

  /** Returns the partition key shared by all rows. */
  GroupKey getKey();

  /** Returns the column layout. */
  List<ColumnMeta> getColumns();

  /** Returns the number of rows in this table. */
  int getRowCount();

  /**
   * Returns the value at the given row and column position.
   *
   * @param row the row index (0-based)
   * @param column the column index (0-based)
   * @return the value, or null if the cell is null
   */
  Object getValue(int row, int column);

  /** Returns true if the table has no rows. */
  default boolean isEmpty() {
    return getRowCount() == 0;
  }

  /**
   * Returns an independent copy owned by the caller. The copy is charged to the memory account
   * of this table.
   */
  Table copy();

  /** Releases the rows. Idempotent. */
  void done();

  /** Returns true once {@link #done()} has been called. */
  boolean isDone();

  /**
   * Returns the estimated memory retained by this table in bytes, based on row count, column
   * count and 8 bytes per value.
   */
  default long getRetainedSizeBytes() {
    return (long) getRowCount() * getColumns().size() * 8L;
  }
}
