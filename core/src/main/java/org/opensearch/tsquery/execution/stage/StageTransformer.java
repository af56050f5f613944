/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.stage;

import com.google.common.annotations.VisibleForTesting;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.exception.QueryEngineException;
import org.opensearch.tsquery.execution.AccumulationMode;
import org.opensearch.tsquery.execution.ConcurrentDataset;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.ExecutionContext;
import org.opensearch.tsquery.execution.ExecutionState;
import org.opensearch.tsquery.execution.PassthroughDataset;
import org.opensearch.tsquery.execution.Transformation;
import org.opensearch.tsquery.execution.registry.TransformationFactory;
import org.opensearch.tsquery.execution.registry.TransformationNode;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;
import org.opensearch.tsquery.planner.ProcedureSpec;
import org.opensearch.tsquery.planner.stage.StageProcedureSpec;

/**
 * Stage in the middle of a query. Runs the staged plan once per group key, up to the stage
 * concurrency, as {@link NestedPipeline} slots of a {@link ConcurrentDataset}.
 *
 * <p>A table whose key has no pipeline yet creates one while the dataset has room. The table is
 * then dispatched round robin over the existing slots, so once the dataset is full, keys share
 * pipelines. Control signals reach every slot. Output of all nested pipelines is merged by a
 * {@link StageOutput} into the dataset returned to the successors.
 */
@Log4j2
public class StageTransformer implements Transformation {

  /** Builds a stage transformer for a {@link StageProcedureSpec} plan node. */
  public static final TransformationFactory FACTORY = StageTransformer::create;

  @Getter private final DatasetId id;
  private final ExecutionState state;
  private final StageProcedureSpec spec;
  private final ConcurrentDataset slots;
  @Getter private final PassthroughDataset dataset;
  private final StageOutput output;
  private final Set<DatasetId> parents;
  private final Set<DatasetId> finishedParents = new HashSet<>();
  private final Map<DatasetId, NestedPipeline> pipelines = new HashMap<>();
  private boolean finished;

  public StageTransformer(
      DatasetId id, ExecutionState state, StageProcedureSpec spec, ExecutionContext context) {
    this.id = id;
    this.state = state;
    this.spec = spec;
    this.slots = new ConcurrentDataset(id, state.getStageConcurrency());
    this.dataset = new PassthroughDataset(id);
    this.output = new StageOutput(dataset);
    this.parents = new HashSet<>(context.getParents());
  }

  private static TransformationNode create(
      DatasetId id,
      ExecutionState state,
      AccumulationMode mode,
      ProcedureSpec spec,
      ExecutionContext context) {
    if (!(spec instanceof StageProcedureSpec)) {
      throw new QueryEngineException(
          "invalid spec type for stage transformation: " + spec.getClass().getSimpleName());
    }
    StageTransformer transformer =
        new StageTransformer(id, state, (StageProcedureSpec) spec, context);
    return new TransformationNode(transformer, transformer.getDataset());
  }

  @Override
  public void process(DatasetId parent, Table table) {
    DatasetId nestedId = id.derive(table.getKey());
    if (!pipelines.containsKey(nestedId) && slots.size() < slots.cap()) {
      try {
        startPipeline(nestedId, table.getKey());
      } catch (RuntimeException e) {
        table.done();
        throw e;
      }
    }
    slots.process(table);
  }

  @Override
  public void retractTable(DatasetId parent, GroupKey key) {
    slots.retractTable(key);
  }

  @Override
  public void updateWatermark(DatasetId parent, long time) {
    slots.updateWatermark(time);
  }

  @Override
  public void updateProcessingTime(DatasetId parent, long time) {
    slots.updateProcessingTime(time);
  }

  /**
   * Finishes the nested pipelines once every parent has finished, or immediately when a parent
   * reports an error.
   */
  @Override
  public void finish(DatasetId parent, Throwable error) {
    if (finished) {
      return;
    }
    finishedParents.add(parent);
    if (error == null && !finishedParents.containsAll(parents)) {
      return;
    }
    finished = true;
    log.debug("Stage {} finished with {} nested pipelines", id, pipelines.size());
    try {
      slots.finish(error);
    } finally {
      output.inputFinished(error);
    }
  }

  @VisibleForTesting
  int getPipelineCount() {
    return pipelines.size();
  }

  @VisibleForTesting
  StageOutput getOutput() {
    return output;
  }

  private void startPipeline(DatasetId nestedId, GroupKey key) {
    ExecutionState nestedState = state.createNested(nestedId);
    NestedPipeline pipeline =
        new NestedPipeline(
            nestedState,
            spec.getPlan(),
            leaf -> output.leaf(nestedState.datasetIdOf(leaf.getId())));
    pipeline.start();
    slots.addTransformation(pipeline);
    pipelines.put(nestedId, pipeline);
    log.debug("Stage {} started nested pipeline {} for key {}", id, nestedId, key);
  }
}
