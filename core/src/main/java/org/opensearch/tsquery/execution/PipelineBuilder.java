/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.execution.dispatch.ConsecutiveTransport;
import org.opensearch.tsquery.execution.registry.TransformationNode;
import org.opensearch.tsquery.planner.PhysicalPlan;
import org.opensearch.tsquery.planner.PlanNode;

/**
 * Instantiates a {@link PhysicalPlan} into an {@link ExecutionState}.
 *
 * <p>Nodes are built parents first. Every transformation sits behind its own {@link
 * ConsecutiveTransport}, which is attached to the dataset of each of its parents. The dataset of
 * each leaf is attached to the sink the caller supplies for it.
 */
@Log4j2
@RequiredArgsConstructor
public class PipelineBuilder {

  private final ExecutionState state;

  /**
   * Builds a top-level pipeline: root nodes become sources, registered with the state for the
   * caller to run.
   *
   * @throws IllegalStateException if the state belongs to a nested pipeline
   */
  public void build(PhysicalPlan plan, Function<PlanNode, Transformation> sinks) {
    if (state.isNested()) {
      throw new IllegalStateException(
          "nested pipeline " + state.getId() + " has no sources, build it with buildNested");
    }
    instantiate(plan, null, sinks);
    log.debug("Built pipeline {} with {} sources", state.getId(), state.getSources().size());
  }

  /**
   * Builds a nested pipeline whose root nodes are transformations fed by the returned entry
   * dataset.
   *
   * @throws IllegalStateException if the state is not the state of a nested pipeline
   */
  public Dataset buildNested(PhysicalPlan plan, Function<PlanNode, Transformation> sinks) {
    if (!state.isNested()) {
      throw new IllegalStateException(
          "state " + state.getId() + " is not nested, top-level pipelines are built with build");
    }
    PassthroughDataset entry = new PassthroughDataset(state.getId());
    instantiate(plan, entry, sinks);
    log.debug("Built nested pipeline {} with {} nodes", state.getId(), plan.size());
    return entry;
  }

  private void instantiate(
      PhysicalPlan plan, Dataset entry, Function<PlanNode, Transformation> sinks) {
    Map<String, Node> outputs = new HashMap<>();
    for (PlanNode node : plan.getNodes()) {
      DatasetId id = state.datasetIdOf(node.getId());
      List<Node> upstream = new ArrayList<>();
      List<DatasetId> parentIds = new ArrayList<>();
      if (node.isRoot()) {
        if (entry != null) {
          upstream.add(entry);
          parentIds.add(state.getId());
        }
      } else {
        for (String parent : node.getPredecessors()) {
          upstream.add(outputs.get(parent));
          parentIds.add(state.datasetIdOf(parent));
        }
      }
      ExecutionContext context =
          new ExecutionContext(
              state.getPipelineContext(), parentIds, node.getBounds().orElse(null));

      Node output;
      if (upstream.isEmpty()) {
        Source source =
            state
                .getRegistry()
                .getSourceFactory(node.getKind())
                .create(node.getProcedureSpec(), id, state, context);
        state.addSource(source);
        output = source;
      } else {
        TransformationNode created =
            state
                .getRegistry()
                .getTransformationFactory(node.getKind())
                .create(
                    id, state, state.getAccumulationMode(), node.getProcedureSpec(), context);
        ConsecutiveTransport transport =
            new ConsecutiveTransport(state.getDispatcher(), created.getTransformation());
        for (Node parent : upstream) {
          parent.addTransformation(transport);
        }
        output = created.getDataset();
      }
      state.registerNode(node.getId(), id);
      outputs.put(node.getId(), output);
      if (node.isLeaf()) {
        output.addTransformation(sinks.apply(node));
      }
    }
  }
}
