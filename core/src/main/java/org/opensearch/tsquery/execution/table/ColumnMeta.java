/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.table;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Label and type of one table column. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public final class ColumnMeta {

  private final String label;
  private final ColumnType type;

  @Override
  public String toString() {
    return label + ":" + type;
  }
}
