/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.table;

/** Value types a table column can hold. */
public enum ColumnType {
  TIME,
  INT,
  FLOAT,
  STRING,
  BOOL
}
