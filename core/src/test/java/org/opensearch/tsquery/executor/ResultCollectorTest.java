/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;
import org.opensearch.tsquery.testing.Tables;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ResultCollectorTest {

  private static final DatasetId LEAF = DatasetId.fromNodeId("sum");

  @Test
  void should_collect_tables_and_drop_retracted_keys() {
    ResultCollector collector = new ResultCollector("sum", c -> {});
    Table retracted = Tables.hostTable("a", 1);

    collector.process(LEAF, retracted);
    collector.process(LEAF, Tables.hostTable("b", 2));
    collector.retractTable(LEAF, GroupKey.of("host", "a"));

    assertEquals(1, collector.getTables().size());
    assertEquals(GroupKey.of("host", "b"), collector.getTables().get(0).getKey());
    assertTrue(retracted.isDone());
  }

  @Test
  void should_notify_completion_once() {
    List<ResultCollector> completed = new ArrayList<>();
    ResultCollector collector = new ResultCollector("sum", completed::add);
    RuntimeException error = new RuntimeException("failed");

    collector.finish(LEAF, error);
    collector.finish(LEAF, null);

    assertEquals(1, completed.size());
    assertTrue(collector.isFinished());
    assertSame(error, collector.getError());
  }

  @Test
  void should_release_tables_arriving_after_release() {
    ResultCollector collector = new ResultCollector("sum", c -> {});
    Table late = Tables.hostTable("a", 1);

    collector.release();
    collector.process(LEAF, late);

    assertTrue(collector.getTables().isEmpty());
    assertTrue(late.isDone());
  }
}
