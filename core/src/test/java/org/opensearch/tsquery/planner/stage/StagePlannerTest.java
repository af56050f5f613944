/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner.stage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.opensearch.tsquery.spec.OperationKinds.FILTER;
import static org.opensearch.tsquery.spec.OperationKinds.FIRST;
import static org.opensearch.tsquery.spec.OperationKinds.FROM;
import static org.opensearch.tsquery.spec.OperationKinds.GROUP;
import static org.opensearch.tsquery.spec.OperationKinds.RANGE;
import static org.opensearch.tsquery.spec.OperationKinds.STAGE;
import static org.opensearch.tsquery.spec.OperationKinds.SUM;
import static org.opensearch.tsquery.spec.OperationKinds.WINDOW;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.tsquery.exception.PlanValidationException;
import org.opensearch.tsquery.planner.PushDownClassifier;
import org.opensearch.tsquery.spec.Bounds;
import org.opensearch.tsquery.spec.Edge;
import org.opensearch.tsquery.spec.Operation;
import org.opensearch.tsquery.spec.QuerySpec;
import org.opensearch.tsquery.spec.ResourceManagement;
import org.opensearch.tsquery.testing.TestOperationSpec;
import org.opensearch.tsquery.testing.TestRangeSpec;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StagePlannerTest {

  private static final String MAP = "map";

  private final StagePlanner planner = new StagePlanner(PushDownClassifier.defaults());

  @Test
  void should_hand_back_the_group_ending_the_staged_chain() {
    // Given: from -> range -> filter -> group -> sum, with sum evaluated outside the storage
    StagePlanner withoutSum =
        new StagePlanner(PushDownClassifier.builder().exclude(SUM).build());
    QuerySpec spec =
        chain(FROM, RANGE, FILTER, GROUP, SUM)
            .now(42L)
            .resources(new ResourceManagement(3, 1024L))
            .build();

    // When
    QuerySpec staged = withoutSum.plan(spec);

    // Then: the group skip point and everything after it stay outside
    assertEquals(List.of("stage0", GROUP, SUM), ids(staged.getOperations()));
    assertEquals(List.of(new Edge("stage0", GROUP), new Edge(GROUP, SUM)), staged.getEdges());

    QuerySpec payload = payload(staged, "stage0");
    assertEquals(List.of(FROM, RANGE, FILTER), ids(payload.getOperations()));
    assertEquals(List.of(new Edge(FROM, RANGE), new Edge(RANGE, FILTER)), payload.getEdges());
    assertEquals(42L, payload.getNow());
    assertEquals(new ResourceManagement(3, 1024L), payload.getResources());
  }

  @Test
  void should_leave_graphs_without_eligible_roots_unchanged() {
    QuerySpec spec = chain(MAP, SUM).build();

    assertSame(spec, planner.plan(spec));
  }

  @Test
  void should_be_idempotent() {
    QuerySpec once = planner.plan(chain(FROM, RANGE, FILTER, GROUP, SUM).build());

    assertEquals(once, planner.plan(once));
  }

  @Test
  void should_stop_at_ineligible_children() {
    QuerySpec staged = planner.plan(chain(FROM, RANGE, MAP, SUM).build());

    assertEquals(List.of("stage0", MAP, SUM), ids(staged.getOperations()));
    assertEquals(List.of(FROM, RANGE), ids(payload(staged, "stage0").getOperations()));
  }

  @Test
  void should_not_claim_children_with_several_parents() {
    // Given: two sources joined by one sum
    QuerySpec spec =
        QuerySpec.builder()
            .operation("a", TestOperationSpec.of(FROM))
            .operation("b", TestOperationSpec.of(FROM))
            .operation("s", TestOperationSpec.of(SUM))
            .edge("a", "s")
            .edge("b", "s")
            .build();

    // When
    QuerySpec staged = planner.plan(spec);

    // Then
    assertEquals(List.of("stage0", "stage1", "s"), ids(staged.getOperations()));
    assertEquals(List.of(new Edge("stage0", "s"), new Edge("stage1", "s")), staged.getEdges());
    assertEquals(List.of("a"), ids(payload(staged, "stage0").getOperations()));
    assertEquals(List.of("b"), ids(payload(staged, "stage1").getOperations()));
  }

  @Test
  void should_stage_whole_eligible_fan_outs() {
    // Given: from -> range -> {sum, first}
    QuerySpec spec =
        chain(FROM, RANGE, SUM)
            .operation(FIRST, TestOperationSpec.of(FIRST))
            .edge(RANGE, FIRST)
            .build();

    QuerySpec staged = planner.plan(spec);

    assertEquals(List.of("stage0"), ids(staged.getOperations()));
    assertEquals(List.of(), staged.getEdges());
    assertEquals(
        List.of(FROM, RANGE, SUM, FIRST), ids(payload(staged, "stage0").getOperations()));
  }

  @Test
  void should_remove_skip_points_only_once() {
    // Given: from -> f1 -> f2, both filters
    QuerySpec spec =
        QuerySpec.builder()
            .operation(FROM, TestOperationSpec.of(FROM))
            .operation("f1", TestOperationSpec.of(FILTER))
            .operation("f2", TestOperationSpec.of(FILTER))
            .edge(FROM, "f1")
            .edge("f1", "f2")
            .build();

    QuerySpec staged = planner.plan(spec);

    // Then: f2 is handed back, the exposed leaf f1 stays staged
    assertEquals(List.of("stage0", "f2"), ids(staged.getOperations()));
    assertEquals(List.of(FROM, "f1"), ids(payload(staged, "stage0").getOperations()));
    assertEquals(List.of(new Edge("stage0", "f2")), staged.getEdges());
  }

  @Test
  void should_stage_past_a_window_inside_the_chain() {
    QuerySpec staged = planner.plan(chain(FROM, FIRST, WINDOW, SUM).build());

    assertEquals(List.of("stage0"), ids(staged.getOperations()));
    assertEquals(List.of(), staged.getEdges());
    assertEquals(
        List.of(FROM, FIRST, WINDOW, SUM), ids(payload(staged, "stage0").getOperations()));
  }

  @Test
  void should_stage_the_maximal_eligible_prefix() {
    // Given: from -> range -> group -> sum -> map
    QuerySpec staged = planner.plan(chain(FROM, RANGE, GROUP, SUM, MAP).build());

    // Then: group is not terminal, so it stays staged
    assertEquals(List.of("stage0", MAP), ids(staged.getOperations()));
    assertEquals(List.of(new Edge("stage0", MAP)), staged.getEdges());
    QuerySpec payload = payload(staged, "stage0");
    assertEquals(List.of(FROM, RANGE, GROUP, SUM), ids(payload.getOperations()));
    assertEquals(
        List.of(new Edge(FROM, RANGE), new Edge(RANGE, GROUP), new Edge(GROUP, SUM)),
        payload.getEdges());
  }

  @Test
  void should_hand_back_a_window_ending_the_prefix() {
    QuerySpec staged = planner.plan(chain(FROM, RANGE, WINDOW, MAP).build());

    assertEquals(List.of("stage0", WINDOW, MAP), ids(staged.getOperations()));
    assertEquals(
        List.of(new Edge("stage0", WINDOW), new Edge(WINDOW, MAP)), staged.getEdges());
    assertEquals(List.of(FROM, RANGE), ids(payload(staged, "stage0").getOperations()));
  }

  @Test
  void should_keep_a_skip_point_root_staged() {
    QuerySpec staged = planner.plan(chain(FILTER, MAP).build());

    assertEquals(List.of("stage0", MAP), ids(staged.getOperations()));
    assertEquals(List.of(FILTER), ids(payload(staged, "stage0").getOperations()));
  }

  @Test
  void should_pick_a_free_stage_id() {
    QuerySpec spec =
        QuerySpec.builder()
            .operation(FROM, TestOperationSpec.of(FROM))
            .operation("stage0", TestOperationSpec.of(MAP))
            .edge(FROM, "stage0")
            .build();

    QuerySpec staged = planner.plan(spec);

    assertEquals(List.of("stage1", "stage0"), ids(staged.getOperations()));
    assertEquals(List.of(new Edge("stage1", "stage0")), staged.getEdges());
  }

  @Test
  void should_merge_duplicate_outgoing_edges() {
    // Given: from -> range, from -> map, range -> map
    QuerySpec spec =
        QuerySpec.builder()
            .operation(FROM, TestOperationSpec.of(FROM))
            .operation(RANGE, TestOperationSpec.of(RANGE))
            .operation(MAP, TestOperationSpec.of(MAP))
            .edge(FROM, RANGE)
            .edge(FROM, MAP)
            .edge(RANGE, MAP)
            .build();

    QuerySpec staged = planner.plan(spec);

    assertEquals(List.of(new Edge("stage0", MAP)), staged.getEdges());
  }

  @Test
  void should_expose_the_bounds_of_the_staged_range() {
    QuerySpec spec =
        QuerySpec.builder()
            .operation(FROM, TestOperationSpec.of(FROM))
            .operation(RANGE, new TestRangeSpec(new Bounds(5, 50)))
            .operation(MAP, TestOperationSpec.of(MAP))
            .edge(FROM, RANGE)
            .edge(RANGE, MAP)
            .build();

    Operation stage = planner.plan(spec).getOperation("stage0");

    assertEquals(STAGE, stage.getKind());
    assertEquals(
        new Bounds(5, 50), ((StageOperationSpec) stage.getSpec()).getBounds(0L).orElseThrow());
  }

  @Test
  void should_reject_malformed_graphs() {
    QuerySpec spec = chain(FROM).edge(FROM, "ghost").build();

    assertThrows(PlanValidationException.class, () -> planner.plan(spec));
  }

  /** Builds a chain whose operation IDs are their kinds. */
  private static QuerySpec.Builder chain(String... kinds) {
    QuerySpec.Builder builder = QuerySpec.builder();
    for (int i = 0; i < kinds.length; i++) {
      builder.operation(kinds[i], TestOperationSpec.of(kinds[i]));
      if (i > 0) {
        builder.edge(kinds[i - 1], kinds[i]);
      }
    }
    return builder;
  }

  private static QuerySpec payload(QuerySpec staged, String stageId) {
    Operation stage = staged.getOperation(stageId);
    assertInstanceOf(StageOperationSpec.class, stage.getSpec());
    return ((StageOperationSpec) stage.getSpec()).getSpec();
  }

  private static List<String> ids(List<Operation> operations) {
    return operations.stream().map(Operation::getId).collect(Collectors.toList());
  }
}
