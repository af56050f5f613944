/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/** Executable form of a query graph. Nodes are kept in topological order. */
public class PhysicalPlan {

  private final Map<String, PlanNode> nodes;
  @Getter private final long now;

  public PhysicalPlan(List<PlanNode> nodesInTopologicalOrder, long now) {
    Map<String, PlanNode> byId = new LinkedHashMap<>();
    for (PlanNode node : nodesInTopologicalOrder) {
      byId.put(node.getId(), node);
    }
    this.nodes = Collections.unmodifiableMap(byId);
    this.now = now;
  }

  /** Returns all nodes, parents before children. */
  public List<PlanNode> getNodes() {
    return List.copyOf(nodes.values());
  }

  /** Returns a node by its ID. */
  public PlanNode getNode(String id) {
    PlanNode node = nodes.get(id);
    if (node == null) {
      throw new IllegalArgumentException("Plan node not found: " + id);
    }
    return node;
  }

  public List<PlanNode> getRoots() {
    return nodes.values().stream().filter(PlanNode::isRoot).collect(Collectors.toList());
  }

  public List<PlanNode> getLeaves() {
    return nodes.values().stream().filter(PlanNode::isLeaf).collect(Collectors.toList());
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    return "PhysicalPlan{nodes=" + nodes.keySet() + '}';
  }
}
