/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.table;

import java.util.ArrayList;
import java.util.List;
import org.opensearch.tsquery.execution.MemoryAccount;

/**
 * Builds a {@link Table} row by row. Call {@link #beginRow()}, set values via {@link
 * #setValue(int, Object)}, then {@link #endRow()} to commit. Call {@link #build()} to produce the
 * final Table.
 */
public class TableBuilder {

  private final GroupKey key;
  private final List<ColumnMeta> columns;
  private final MemoryAccount account;
  private final List<Object[]> rows;
  private Object[] currentRow;

  public TableBuilder(GroupKey key, List<ColumnMeta> columns) {
    this(key, columns, MemoryAccount.UNBOUNDED);
  }

  /** Creates a builder whose tables are charged to {@code account} when built. */
  public TableBuilder(GroupKey key, List<ColumnMeta> columns, MemoryAccount account) {
    this.key = key;
    this.columns = List.copyOf(columns);
    this.account = account;
    this.rows = new ArrayList<>();
  }

  /** Starts a new row. Values default to null. */
  public TableBuilder beginRow() {
    currentRow = new Object[columns.size()];
    return this;
  }

  /**
   * Sets a value in the current row.
   *
   * @param column the column index (0-based)
   * @param value the value to set
   */
  public TableBuilder setValue(int column, Object value) {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before setValue()");
    }
    if (column < 0 || column >= columns.size()) {
      throw new IndexOutOfBoundsException(
          "Column " + column + " out of range [0, " + columns.size() + ")");
    }
    currentRow[column] = value;
    return this;
  }

  /** Commits the current row to the table. */
  public TableBuilder endRow() {
    if (currentRow == null) {
      throw new IllegalStateException("beginRow() must be called before endRow()");
    }
    rows.add(currentRow);
    currentRow = null;
    return this;
  }

  /** Appends a complete row. */
  public TableBuilder addRow(Object... values) {
    if (values.length != columns.size()) {
      throw new IllegalArgumentException(
          "Expected " + columns.size() + " values but got " + values.length);
    }
    beginRow();
    for (int i = 0; i < values.length; i++) {
      setValue(i, values[i]);
    }
    return endRow();
  }

  /** Returns the number of rows added so far. */
  public int getRowCount() {
    return rows.size();
  }

  /** Builds the final Table from all committed rows and resets the builder. */
  public Table build() {
    if (currentRow != null) {
      throw new IllegalStateException("endRow() must be called before build()");
    }
    Object[][] data = rows.toArray(new Object[0][]);
    rows.clear();
    long bytes = (long) data.length * columns.size() * 8L;
    account.allocate(bytes);
    return new RowTable(key, columns, data, account, bytes);
  }
}
