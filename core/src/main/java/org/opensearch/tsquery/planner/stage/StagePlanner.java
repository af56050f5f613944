/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner.stage;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.planner.PushDownClassifier;
import org.opensearch.tsquery.spec.Edge;
import org.opensearch.tsquery.spec.Operation;
import org.opensearch.tsquery.spec.OperationKinds;
import org.opensearch.tsquery.spec.QuerySpec;

/**
 * Rewrites a query graph so that chains of push-down operations starting at a source become one
 * {@code stage} operation.
 *
 * <p>For every push-down eligible root, in operation order, the planner walks depth first into
 * children that are eligible, have exactly one parent and belong to no other stage, so the stage
 * holds the maximal eligible prefix and ends at the first ineligible children. Afterwards each
 * terminal operation of that prefix that is a skip point ({@code group}, {@code filter}, {@code
 * window}) is handed back to the outer graph unless it is the root; this happens once and is not
 * repeated for the operations it exposes.
 *
 * <p>In the rewritten graph the stage takes the place of its root. Edges between staged
 * operations disappear, edges leaving the stage start at the stage operation. Planning an
 * already staged graph is a no-op since {@code stage} is never eligible.
 */
@Log4j2
@RequiredArgsConstructor
public class StagePlanner {

  static final String STAGE_ID_PREFIX = "stage";

  /** Kinds that are left to the outer graph when they end a stage. */
  static final Set<String> SKIP_POINT_KINDS =
      ImmutableSet.of(OperationKinds.GROUP, OperationKinds.FILTER, OperationKinds.WINDOW);

  private final PushDownClassifier classifier;

  /**
   * Returns the rewritten graph, or {@code spec} itself if nothing could be staged.
   *
   * @throws org.opensearch.tsquery.exception.PlanValidationException if {@code spec} is malformed
   */
  public QuerySpec plan(QuerySpec spec) {
    spec.validate();
    Map<String, List<Operation>> parents = spec.parents();
    Map<String, List<Operation>> children = spec.children();

    Set<String> claimed = new HashSet<>();
    List<Set<String>> stages = new ArrayList<>();
    for (Operation root : spec.roots()) {
      if (!classifier.isPushDownOp(root)) {
        continue;
      }
      Set<String> members = new LinkedHashSet<>();
      walk(root, parents, children, claimed, members);
      removeSkipPoints(spec, root, children, members);
      claimed.addAll(members);
      stages.add(members);
    }
    if (stages.isEmpty()) {
      log.debug("No push-down root found, query graph left unchanged");
      return spec;
    }
    QuerySpec rewritten = rewrite(spec, stages);
    rewritten.validate();
    return rewritten;
  }

  private void walk(
      Operation op,
      Map<String, List<Operation>> parents,
      Map<String, List<Operation>> children,
      Set<String> claimed,
      Set<String> members) {
    members.add(op.getId());
    for (Operation child : children.get(op.getId())) {
      if (classifier.isPushDownOp(child)
          && parents.get(child.getId()).size() == 1
          && !claimed.contains(child.getId())
          && !members.contains(child.getId())) {
        walk(child, parents, children, claimed, members);
      }
    }
  }

  private static void removeSkipPoints(
      QuerySpec spec, Operation root, Map<String, List<Operation>> children, Set<String> members) {
    List<String> skipped = new ArrayList<>();
    for (String id : members) {
      if (id.equals(root.getId())
          || !SKIP_POINT_KINDS.contains(spec.getOperation(id).getKind())) {
        continue;
      }
      boolean leaf =
          children.get(id).stream().noneMatch(child -> members.contains(child.getId()));
      if (leaf) {
        skipped.add(id);
      }
    }
    if (!skipped.isEmpty()) {
      log.debug("Leaving skip points {} out of the stage rooted at {}", skipped, root.getId());
      skipped.forEach(members::remove);
    }
  }

  private QuerySpec rewrite(QuerySpec spec, List<Set<String>> stages) {
    Set<String> usedIds = new HashSet<>();
    spec.getOperations().forEach(op -> usedIds.add(op.getId()));

    Map<String, String> stageOf = new HashMap<>();
    Map<String, Operation> stageByRoot = new HashMap<>();
    int next = 0;
    for (Set<String> members : stages) {
      while (usedIds.contains(STAGE_ID_PREFIX + next)) {
        next++;
      }
      String stageId = STAGE_ID_PREFIX + next;
      usedIds.add(stageId);
      QuerySpec.Builder payload =
          QuerySpec.builder().now(spec.getNow()).resources(spec.getResources());
      for (Operation op : spec.getOperations()) {
        if (members.contains(op.getId())) {
          payload.operation(op);
          stageOf.put(op.getId(), stageId);
        }
      }
      for (Edge edge : spec.getEdges()) {
        if (members.contains(edge.getParent()) && members.contains(edge.getChild())) {
          payload.edge(edge);
        }
      }
      String rootId = members.iterator().next();
      stageByRoot.put(rootId, new Operation(stageId, new StageOperationSpec(payload.build())));
      log.debug("Staged operations {} as {}", members, stageId);
    }

    QuerySpec.Builder outer = QuerySpec.builder().now(spec.getNow()).resources(spec.getResources());
    for (Operation op : spec.getOperations()) {
      if (stageByRoot.containsKey(op.getId())) {
        outer.operation(stageByRoot.get(op.getId()));
      } else if (!stageOf.containsKey(op.getId())) {
        outer.operation(op);
      }
    }
    Set<Edge> edges = new LinkedHashSet<>();
    for (Edge edge : spec.getEdges()) {
      String parent = stageOf.getOrDefault(edge.getParent(), edge.getParent());
      String child = stageOf.getOrDefault(edge.getChild(), edge.getChild());
      if (!parent.equals(child)) {
        edges.add(new Edge(parent, child));
      }
    }
    edges.forEach(outer::edge);
    return outer.build();
  }
}
