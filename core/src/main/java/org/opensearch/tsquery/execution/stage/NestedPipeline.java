/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.stage;

import java.util.function.Function;
import lombok.Getter;
import org.opensearch.tsquery.execution.Dataset;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.ExecutionState;
import org.opensearch.tsquery.execution.PipelineBuilder;
import org.opensearch.tsquery.execution.Transformation;
import org.opensearch.tsquery.execution.table.GroupKey;
import org.opensearch.tsquery.execution.table.Table;
import org.opensearch.tsquery.planner.PhysicalPlan;
import org.opensearch.tsquery.planner.PlanNode;

/**
 * One slot of a stage transformer: a private instance of the staged plan. Signals received while
 * running are fed to the roots of the nested plan.
 *
 * <p>Lifecycle: {@code UNCREATED} until {@link #start()} builds the pipeline, {@code RUNNING}
 * until {@code finish}, then {@code FINISHED}. Signals outside {@code RUNNING} are rejected.
 */
public class NestedPipeline implements Transformation {

  public enum State {
    UNCREATED,
    RUNNING,
    FINISHED
  }

  @Getter private final DatasetId id;
  private final ExecutionState state;
  private final PhysicalPlan plan;
  private final Function<PlanNode, Transformation> sinks;
  @Getter private volatile State status = State.UNCREATED;
  private Dataset entry;

  public NestedPipeline(
      ExecutionState state, PhysicalPlan plan, Function<PlanNode, Transformation> sinks) {
    this.id = state.getId();
    this.state = state;
    this.plan = plan;
    this.sinks = sinks;
  }

  /** Instantiates the nested plan. */
  public void start() {
    if (status != State.UNCREATED) {
      throw new IllegalStateException("nested pipeline " + id + " already started");
    }
    entry = new PipelineBuilder(state).buildNested(plan, sinks);
    status = State.RUNNING;
  }

  @Override
  public void process(DatasetId parent, Table table) {
    if (status != State.RUNNING) {
      table.done();
      throw notRunning("process");
    }
    entry.process(table);
  }

  @Override
  public void retractTable(DatasetId parent, GroupKey key) {
    checkRunning("retractTable");
    entry.retractTable(key);
  }

  @Override
  public void updateWatermark(DatasetId parent, long time) {
    checkRunning("updateWatermark");
    entry.updateWatermark(time);
  }

  @Override
  public void updateProcessingTime(DatasetId parent, long time) {
    checkRunning("updateProcessingTime");
    entry.updateProcessingTime(time);
  }

  @Override
  public void finish(DatasetId parent, Throwable error) {
    checkRunning("finish");
    status = State.FINISHED;
    entry.finish(error);
  }

  private void checkRunning(String signal) {
    if (status != State.RUNNING) {
      throw notRunning(signal);
    }
  }

  private IllegalStateException notRunning(String signal) {
    return new IllegalStateException(signal + " on nested pipeline " + id + " in state " + status);
  }
}
