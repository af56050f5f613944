/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import org.opensearch.tsquery.spec.Bounds;

/** One node of a {@link PhysicalPlan}. */
public class PlanNode {

  @Getter private final String id;
  @Getter private final ProcedureSpec procedureSpec;
  @Getter private final List<String> predecessors;
  @Getter private final List<String> successors;
  private final Bounds bounds;

  public PlanNode(
      String id,
      ProcedureSpec procedureSpec,
      List<String> predecessors,
      List<String> successors,
      Bounds bounds) {
    this.id = id;
    this.procedureSpec = procedureSpec;
    this.predecessors = ImmutableList.copyOf(predecessors);
    this.successors = ImmutableList.copyOf(successors);
    this.bounds = bounds;
  }

  public String getKind() {
    return procedureSpec.getKind();
  }

  /** Returns the time bounds of the data this node produces, if known. */
  public Optional<Bounds> getBounds() {
    return Optional.ofNullable(bounds);
  }

  public boolean isRoot() {
    return predecessors.isEmpty();
  }

  public boolean isLeaf() {
    return successors.isEmpty();
  }

  @Override
  public String toString() {
    return "PlanNode{id='" + id + "', kind=" + getKind() + ", predecessors=" + predecessors + '}';
  }
}
