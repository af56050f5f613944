/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.exception.QueryEngineException;
import org.opensearch.tsquery.execution.AccumulationMode;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.ExecutionContext;
import org.opensearch.tsquery.execution.ExecutionState;
import org.opensearch.tsquery.execution.registry.TransformationNode;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;
import org.opensearch.tsquery.executor.OperationCatalog;
import org.opensearch.tsquery.planner.PhysicalPlanner;
import org.opensearch.tsquery.planner.stage.StageProcedureSpec;
import org.opensearch.tsquery.spec.OperationKinds;
import org.opensearch.tsquery.spec.QuerySpec;
import org.opensearch.tsquery.testing.ForwardingTransformation;
import org.opensearch.tsquery.testing.InlineDispatcher;
import org.opensearch.tsquery.testing.RecordingTransformation;
import org.opensearch.tsquery.testing.TestCatalog;
import org.opensearch.tsquery.testing.TestOperationSpec;
import org.opensearch.tsquery.testing.TestProcedureSpec;
import org.opensearch.tsquery.testing.TestStates;
import org.opensearch.tsquery.testing.Tables;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StageTransformerTest {

  private static final DatasetId ID = DatasetId.fromNodeId("stage0");
  private static final DatasetId PARENT = DatasetId.fromNodeId("from");
  private static final String TAG = "tag";

  private InlineDispatcher dispatcher;
  private ExecutionState state;
  private StageProcedureSpec spec;
  private RecordingTransformation downstream;
  private final List<DatasetId> pipelines = new ArrayList<>();
  private final List<String> routed = new ArrayList<>();

  @BeforeEach
  void setUp() {
    OperationCatalog catalog = TestCatalog.create(() -> List.of(), null);
    QuerySpec payload =
        QuerySpec.builder()
            .operation("m", TestOperationSpec.of(TestCatalog.MAP))
            .operation("s", TestOperationSpec.of(OperationKinds.SUM))
            .edge("m", "s")
            .build();
    spec =
        new StageProcedureSpec(
            payload, new PhysicalPlanner(catalog.getProcedureRegistry()).plan(payload));
    dispatcher = new InlineDispatcher();
    state = TestStates.state(dispatcher, catalog.getNodeRegistry(), 2);
    downstream = new RecordingTransformation();
  }

  @Test
  void should_start_one_nested_pipeline_per_new_key_up_to_the_concurrency() {
    // Given
    StageTransformer stage = stage(PARENT);

    // When: three keys for a concurrency of two, then a repeated key
    stage.process(PARENT, Tables.hostTable("a", 1));
    stage.process(PARENT, Tables.hostTable("b", 2));
    stage.process(PARENT, Tables.hostTable("c", 3));
    stage.process(PARENT, Tables.hostTable("a", 4));

    // Then: every table still reaches the output
    assertEquals(2, stage.getPipelineCount());
    assertEquals(
        List.of(
            "process {host=a}", "process {host=b}", "process {host=c}", "process {host=a}"),
        downstream.getEvents());
    assertTrue(dispatcher.getErrors().isEmpty());
  }

  @Test
  void should_spread_keys_over_the_nested_pipelines_round_robin() {
    // Given: five keys for a concurrency of two
    StageTransformer stage = taggedStage();

    // When
    for (int i = 0; i < 5; i++) {
      stage.process(PARENT, Tables.hostTable("h" + i, i));
    }

    // Then: pipelines 0 and 1 are started by h0 and h1, later keys reuse them in turn
    assertEquals(2, pipelines.size());
    assertEquals(
        List.of(
            "0 process {host=h0}",
            "1 process {host=h1}",
            "0 process {host=h2}",
            "1 process {host=h3}",
            "0 process {host=h4}"),
        routed);
    assertEquals(5, downstream.getTables().size());
  }

  @Test
  void should_broadcast_retractions_to_every_nested_pipeline() {
    // Given
    StageTransformer stage = taggedStage();
    stage.process(PARENT, Tables.hostTable("a", 1));
    stage.process(PARENT, Tables.hostTable("b", 2));

    // When
    stage.retractTable(PARENT, GroupKey.of("host", "a"));
    stage.process(PARENT, Tables.hostTable("a", 3));

    // Then: both pipelines see the retraction before the next table for the key
    assertEquals(
        List.of(
            "0 process {host=a}",
            "1 process {host=b}",
            "0 retract {host=a}",
            "1 retract {host=a}",
            "0 process {host=a}"),
        routed);
    assertEquals(
        List.of(
            "process {host=a}",
            "process {host=b}",
            "retract {host=a}",
            "retract {host=a}",
            "process {host=a}"),
        downstream.getEvents());
  }

  @Test
  void should_finish_once_after_every_nested_pipeline() {
    StageTransformer stage = stage(PARENT);
    stage.process(PARENT, Tables.hostTable("a", 1));
    stage.process(PARENT, Tables.hostTable("b", 2));

    stage.finish(PARENT, null);

    assertEquals(
        List.of("process {host=a}", "process {host=b}", "finish"), downstream.getEvents());
    assertEquals(0, stage.getOutput().getLiveLeaves());
  }

  @Test
  void should_finish_without_any_table() {
    StageTransformer stage = stage(PARENT);

    stage.finish(PARENT, null);

    assertEquals(0, stage.getPipelineCount());
    assertEquals(List.of("finish"), downstream.getEvents());
  }

  @Test
  void should_propagate_an_upstream_error() {
    StageTransformer stage = stage(PARENT);
    stage.process(PARENT, Tables.hostTable("a", 1));

    stage.finish(PARENT, new IllegalStateException("upstream failed"));

    assertEquals(List.of("process {host=a}", "finish upstream failed"), downstream.getEvents());
  }

  @Test
  void should_forward_the_watermark_once_all_nested_pipelines_reached_it() {
    StageTransformer stage = stage(PARENT);
    stage.process(PARENT, Tables.hostTable("a", 1));
    stage.process(PARENT, Tables.hostTable("b", 2));

    stage.updateWatermark(PARENT, 10L);

    assertEquals(
        List.of("process {host=a}", "process {host=b}", "watermark 10"), downstream.getEvents());
  }

  @Test
  void should_wait_for_every_parent_before_finishing() {
    DatasetId other = DatasetId.fromNodeId("other");
    StageTransformer stage = stage(PARENT, other);
    stage.process(PARENT, Tables.hostTable("a", 1));

    stage.finish(PARENT, null);
    assertEquals(List.of("process {host=a}"), downstream.getEvents());

    stage.finish(other, null);
    assertEquals(List.of("process {host=a}", "finish"), downstream.getEvents());
  }

  @Test
  void should_reject_procedures_of_another_type() {
    assertThrows(
        QueryEngineException.class,
        () ->
            StageTransformer.FACTORY.create(
                ID,
                state,
                AccumulationMode.DISCARDING,
                new TestProcedureSpec(OperationKinds.STAGE, null),
                new ExecutionContext(state.getPipelineContext(), List.of(PARENT), null)));
  }

  private StageTransformer stage(DatasetId... parents) {
    return stage(spec, parents);
  }

  private StageTransformer stage(StageProcedureSpec procedure, DatasetId... parents) {
    StageTransformer stage =
        new StageTransformer(
            ID,
            state,
            procedure,
            new ExecutionContext(state.getPipelineContext(), List.of(parents), null));
    stage.getDataset().addTransformation(downstream);
    return stage;
  }

  /** Stage over a single {@code tag} operation that reports which pipeline saw each signal. */
  private StageTransformer taggedStage() {
    OperationCatalog catalog =
        TestCatalog.builder(() -> List.of(), null)
            .registerProcedureSpec(TAG, TestProcedureSpec.FACTORY, TAG)
            .registerTransformation(
                TAG,
                (id, nested, mode, procedure, context) -> {
                  TaggingTransformation t =
                      new TaggingTransformation(id, context.getParents(), pipelines.size());
                  pipelines.add(nested.getId());
                  return new TransformationNode(t, t.getDataset());
                })
            .build();
    QuerySpec payload = QuerySpec.builder().operation("t", TestOperationSpec.of(TAG)).build();
    state = TestStates.state(dispatcher, catalog.getNodeRegistry(), 2);
    return stage(
        new StageProcedureSpec(
            payload, new PhysicalPlanner(catalog.getProcedureRegistry()).plan(payload)),
        PARENT);
  }

  private class TaggingTransformation extends ForwardingTransformation {
    private final int pipeline;

    TaggingTransformation(DatasetId id, List<DatasetId> parents, int pipeline) {
      super(id, parents, false);
      this.pipeline = pipeline;
    }

    @Override
    public void process(DatasetId id, Table table) {
      routed.add(pipeline + " process " + table.getKey());
      super.process(id, table);
    }

    @Override
    public void retractTable(DatasetId id, GroupKey key) {
      routed.add(pipeline + " retract " + key);
      super.retractTable(id, key);
    }
  }
}
