/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.table;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Immutable set of column/value pairs identifying a partition. Column order is significant and
 * part of the key identity.
 */
@Getter
@EqualsAndHashCode
public final class GroupKey {

  public static final GroupKey EMPTY = new GroupKey(List.of(), List.of());

  private final List<ColumnMeta> columns;
  private final List<Object> values;

  public GroupKey(List<ColumnMeta> columns, List<?> values) {
    if (columns.size() != values.size()) {
      throw new IllegalArgumentException(
          "Group key has " + columns.size() + " columns but " + values.size() + " values");
    }
    this.columns = ImmutableList.copyOf(columns);
    this.values = Collections.unmodifiableList(new ArrayList<>(values));
  }

  /** Builds a key of string columns from alternating label and value arguments. */
  public static GroupKey of(String... labelsAndValues) {
    if (labelsAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected label/value pairs");
    }
    List<ColumnMeta> columns = new ArrayList<>();
    List<Object> values = new ArrayList<>();
    for (int i = 0; i < labelsAndValues.length; i += 2) {
      columns.add(new ColumnMeta(labelsAndValues[i], ColumnType.STRING));
      values.add(labelsAndValues[i + 1]);
    }
    return new GroupKey(columns, values);
  }

  public int size() {
    return columns.size();
  }

  /** Returns the value of the column with the given label, or null if it is not in the key. */
  public Object getValue(String label) {
    for (int i = 0; i < columns.size(); i++) {
      if (columns.get(i).getLabel().equals(label)) {
        return values.get(i);
      }
    }
    return null;
  }

  /**
   * Returns a binary form of this key in which every label, column type and value is length
   * prefixed and typed, so keys that are not {@link #equals(Object) equal} never encode alike.
   * Stable across processes; used to derive IDs.
   */
  public byte[] encode() {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    out.writeInt(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      ColumnMeta column = columns.get(i);
      writeString(out, column.getLabel());
      writeString(out, column.getType().name());
      Object value = values.get(i);
      if (value == null) {
        out.writeBoolean(false);
      } else {
        out.writeBoolean(true);
        writeString(out, value.getClass().getName());
        writeString(out, value.toString());
      }
    }
    return out.toByteArray();
  }

  private static void writeString(ByteArrayDataOutput out, String text) {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  /** Display form {@code {label=value,...}}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) {
        sb.append(',');
      }
      sb.append(columns.get(i).getLabel()).append('=').append(values.get(i));
    }
    return sb.append('}').toString();
  }
}
