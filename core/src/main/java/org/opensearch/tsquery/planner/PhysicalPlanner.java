/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.spec.Bounded;
import org.opensearch.tsquery.spec.Bounds;
import org.opensearch.tsquery.spec.Operation;
import org.opensearch.tsquery.spec.QuerySpec;
import org.opensearch.tsquery.spec.ResourceManagement;

/**
 * Turns a validated query graph into a {@link PhysicalPlan}.
 *
 * <p>Every operation becomes one {@link PlanNode} carrying the procedure spec produced by the
 * {@link ProcedureRegistry}. Time bounds come from operations that declare them ({@link Bounded});
 * any other node inherits the intersection of the bounds of its parents.
 */
@Log4j2
@RequiredArgsConstructor
public class PhysicalPlanner {

  private final ProcedureRegistry registry;

  /**
   * Plans {@code spec}.
   *
   * @throws org.opensearch.tsquery.exception.PlanValidationException if the graph is malformed
   * @throws org.opensearch.tsquery.exception.PlanningException if an operation cannot be planned
   */
  public PhysicalPlan plan(QuerySpec spec) {
    spec.validate();
    PlannerAdministration administration = new Administration(spec);
    Map<String, List<Operation>> parents = spec.parents();
    Map<String, List<Operation>> children = spec.children();
    Map<String, Bounds> bounds = new HashMap<>();

    List<PlanNode> nodes = new ArrayList<>();
    for (Operation op : spec.topologicalOrder()) {
      ProcedureSpec procedure = registry.create(op.getSpec(), administration);
      List<String> predecessors = ids(parents.get(op.getId()));
      Bounds nodeBounds = boundsOf(op, predecessors, bounds, spec.getNow());
      if (nodeBounds != null) {
        bounds.put(op.getId(), nodeBounds);
      }
      nodes.add(
          new PlanNode(
              op.getId(), procedure, predecessors, ids(children.get(op.getId())), nodeBounds));
    }
    log.debug("Planned {} operations into {} nodes", spec.getOperations().size(), nodes.size());
    return new PhysicalPlan(nodes, spec.getNow());
  }

  private static Bounds boundsOf(
      Operation op, List<String> predecessors, Map<String, Bounds> planned, long now) {
    if (op.getSpec() instanceof Bounded) {
      Bounds own = ((Bounded) op.getSpec()).getBounds(now).orElse(null);
      if (own != null) {
        return own;
      }
    }
    Bounds inherited = null;
    for (String parent : predecessors) {
      Bounds parentBounds = planned.get(parent);
      if (parentBounds == null) {
        continue;
      }
      if (inherited == null) {
        inherited = parentBounds;
      } else {
        Bounds overlap = inherited.intersect(parentBounds);
        if (overlap == null) {
          // disjoint inputs: empty range at the later start
          long start = Math.max(inherited.getStart(), parentBounds.getStart());
          return new Bounds(start, start);
        }
        inherited = overlap;
      }
    }
    return inherited;
  }

  private static List<String> ids(List<Operation> operations) {
    List<String> ids = new ArrayList<>();
    if (operations != null) {
      for (Operation op : operations) {
        ids.add(op.getId());
      }
    }
    return ids;
  }

  @RequiredArgsConstructor
  private class Administration implements PlannerAdministration {
    private final QuerySpec spec;

    @Override
    public long getNow() {
      return spec.getNow();
    }

    @Override
    public ResourceManagement getResources() {
      return spec.getResources();
    }

    @Override
    public PhysicalPlan planNested(QuerySpec nested) {
      return plan(nested);
    }
  }
}
