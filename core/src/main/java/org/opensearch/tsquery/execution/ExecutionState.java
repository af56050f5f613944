/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.Getter;
import org.opensearch.tsquery.execution.dispatch.Dispatcher;
import org.opensearch.tsquery.execution.registry.NodeRegistry;
import org.opensearch.tsquery.spec.ResourceManagement;

/**
 * Runtime state of one query or of one nested pipeline: the collaborators every node is built
 * with plus the nodes and sources created so far.
 *
 * <p>Runtime IDs are derived from the state ID, so the same plan node gets a distinct dataset ID
 * in every nested pipeline.
 */
@Getter
public class ExecutionState {

  private final DatasetId id;
  private final Dispatcher dispatcher;
  private final NodeRegistry registry;
  private final MemoryAccount memoryAccount;
  private final PipelineContext pipelineContext;
  private final ResourceManagement resources;

  /** Maximum number of nested pipelines one stage node of this state runs in parallel. */
  private final int stageConcurrency;

  private final AccumulationMode accumulationMode;
  private final boolean nested;

  @Getter(AccessLevel.NONE)
  private final Map<String, DatasetId> nodes = new LinkedHashMap<>();

  @Getter(AccessLevel.NONE)
  private final List<Source> sources = new ArrayList<>();

  public ExecutionState(
      DatasetId id,
      Dispatcher dispatcher,
      NodeRegistry registry,
      MemoryAccount memoryAccount,
      PipelineContext pipelineContext,
      ResourceManagement resources,
      int stageConcurrency,
      AccumulationMode accumulationMode) {
    this(
        id,
        dispatcher,
        registry,
        memoryAccount,
        pipelineContext,
        resources,
        stageConcurrency,
        accumulationMode,
        false);
  }

  private ExecutionState(
      DatasetId id,
      Dispatcher dispatcher,
      NodeRegistry registry,
      MemoryAccount memoryAccount,
      PipelineContext pipelineContext,
      ResourceManagement resources,
      int stageConcurrency,
      AccumulationMode accumulationMode,
      boolean nested) {
    if (stageConcurrency <= 0) {
      throw new IllegalArgumentException("stage concurrency must be positive: " + stageConcurrency);
    }
    this.id = id;
    this.dispatcher = dispatcher;
    this.registry = registry;
    this.memoryAccount = memoryAccount;
    this.pipelineContext = pipelineContext;
    this.resources = resources;
    this.stageConcurrency = stageConcurrency;
    this.accumulationMode = accumulationMode;
    this.nested = nested;
  }

  /**
   * Returns the state of a nested pipeline. It shares the dispatcher, the registry and the memory
   * budget of this state, and its pipeline context is cancelled together with this one.
   */
  public ExecutionState createNested(DatasetId nestedId) {
    return new ExecutionState(
        nestedId,
        dispatcher,
        registry,
        memoryAccount.child(),
        pipelineContext.createChild(),
        resources,
        stageConcurrency,
        accumulationMode,
        true);
  }

  /** Returns the runtime ID of the plan node {@code nodeId} within this state. */
  public DatasetId datasetIdOf(String nodeId) {
    return id.derive(nodeId);
  }

  void registerNode(String nodeId, DatasetId datasetId) {
    if (nodes.putIfAbsent(nodeId, datasetId) != null) {
      throw new IllegalStateException("plan node " + nodeId + " is already instantiated");
    }
  }

  void addSource(Source source) {
    sources.add(source);
  }

  /** Returns the plan-node ID to runtime ID mapping of the nodes built so far. */
  public Map<String, DatasetId> getNodes() {
    return Collections.unmodifiableMap(nodes);
  }

  public List<Source> getSources() {
    return Collections.unmodifiableList(sources);
  }
}
