/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.executor;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.tsquery.execution.table.Table;

/** Output of a query: the tables produced by each leaf plan node. The caller owns the tables. */
@Getter
@ToString
public class QueryResult {

  private final String queryId;
  private final Map<String, List<Table>> tables;

  public QueryResult(String queryId, Map<String, List<Table>> tables) {
    this.queryId = queryId;
    ImmutableMap.Builder<String, List<Table>> copy = ImmutableMap.builder();
    tables.forEach((leaf, list) -> copy.put(leaf, ImmutableList.copyOf(list)));
    this.tables = copy.build();
  }

  /** Returns the tables of leaf {@code nodeId}, empty if it produced none. */
  public List<Table> getTables(String nodeId) {
    return tables.getOrDefault(nodeId, List.of());
  }

  /** Releases every table of the result. */
  public void release() {
    tables.values().forEach(list -> list.forEach(Table::done));
  }
}
