/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.Getter;
import org.opensearch.tsquery.spec.Bounds;

/**
 * Context a runtime node is constructed with: the cancellable pipeline context, the datasets
 * feeding the node and the time bounds of its input.
 */
public class ExecutionContext {

  @Getter private final PipelineContext pipelineContext;
  @Getter private final List<DatasetId> parents;
  private final Bounds bounds;

  public ExecutionContext(PipelineContext pipelineContext, List<DatasetId> parents, Bounds bounds) {
    this.pipelineContext = pipelineContext;
    this.parents = ImmutableList.copyOf(parents);
    this.bounds = bounds;
  }

  public Optional<Bounds> getBounds() {
    return Optional.ofNullable(bounds);
  }
}
