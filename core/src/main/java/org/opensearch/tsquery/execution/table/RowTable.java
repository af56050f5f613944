/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.table;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.opensearch.tsquery.execution.MemoryAccount;

/**
 * Simple row-based {@link Table} implementation. Each row is an Object array where the index
 * corresponds to the column position.
 */
public class RowTable implements Table {

  private final GroupKey key;
  private final List<ColumnMeta> columns;
  private final Object[][] rows;
  private final MemoryAccount account;
  private final long chargedBytes;
  private final AtomicBoolean released = new AtomicBoolean(false);

  /**
   * Creates an unaccounted RowTable from pre-built row data.
   *
   * @param key the group key shared by all rows
   * @param columns the column layout
   * @param rows 2D array where rows[i][j] is the value at row i, column j
   */
  public RowTable(GroupKey key, List<ColumnMeta> columns, Object[][] rows) {
    this(key, columns, rows, MemoryAccount.UNBOUNDED, 0L);
  }

  RowTable(
      GroupKey key,
      List<ColumnMeta> columns,
      Object[][] rows,
      MemoryAccount account,
      long chargedBytes) {
    this.key = key;
    this.columns = ImmutableList.copyOf(columns);
    this.rows = rows;
    this.account = account;
    this.chargedBytes = chargedBytes;
  }

  @Override
  public GroupKey getKey() {
    checkNotDone();
    return key;
  }

  @Override
  public List<ColumnMeta> getColumns() {
    checkNotDone();
    return columns;
  }

  @Override
  public int getRowCount() {
    checkNotDone();
    return rows.length;
  }

  @Override
  public Object getValue(int row, int column) {
    checkNotDone();
    if (row < 0 || row >= rows.length) {
      throw new IndexOutOfBoundsException(
          "Row " + row + " out of range [0, " + rows.length + ")");
    }
    if (column < 0 || column >= columns.size()) {
      throw new IndexOutOfBoundsException(
          "Column " + column + " out of range [0, " + columns.size() + ")");
    }
    return rows[row][column];
  }

  @Override
  public Table copy() {
    checkNotDone();
    long bytes = getRetainedSizeBytes();
    account.allocate(bytes);
    Object[][] data = new Object[rows.length][];
    for (int i = 0; i < rows.length; i++) {
      data[i] = Arrays.copyOf(rows[i], rows[i].length);
    }
    return new RowTable(key, columns, data, account, bytes);
  }

  @Override
  public void done() {
    if (released.compareAndSet(false, true)) {
      account.free(chargedBytes);
    }
  }

  @Override
  public boolean isDone() {
    return released.get();
  }

  private void checkNotDone() {
    if (released.get()) {
      throw new IllegalStateException("table " + key + " has already been released");
    }
  }

  @Override
  public String toString() {
    return "RowTable{key=" + key + ", rows=" + rows.length + ", done=" + released.get() + '}';
  }
}
