/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.stage;

import lombok.Getter;
import org.opensearch.tsquery.exception.QueryEngineException;
import org.opensearch.tsquery.execution.registry.SourceFactory;
import org.opensearch.tsquery.executor.OperationCatalog;
import org.opensearch.tsquery.planner.stage.StageProcedureSpec;
import org.opensearch.tsquery.spec.OperationKinds;

/**
 * Registers the {@code stage} kind: its procedure spec, its source form for stages at the root
 * of a query and its transformation form for stages further down. Calling {@link #register}
 * more than once on the same catalog builder is harmless.
 */
public class StageOperations {

  @Getter private final SourceFactory sourceFactory;

  public StageOperations(TableReaderFactory readers) {
    this.sourceFactory =
        (spec, id, state, context) -> {
          if (!(spec instanceof StageProcedureSpec)) {
            throw new QueryEngineException(
                "invalid spec type for stage source: " + spec.getClass().getSimpleName());
          }
          return new StageSource(
              id, (StageProcedureSpec) spec, readers, context, state.getMemoryAccount());
        };
  }

  public OperationCatalog.Builder register(OperationCatalog.Builder catalog) {
    return catalog
        .registerProcedureSpec(
            OperationKinds.STAGE, StageProcedureSpec.FACTORY, OperationKinds.STAGE)
        .registerSource(OperationKinds.STAGE, sourceFactory)
        .registerTransformation(OperationKinds.STAGE, StageTransformer.FACTORY)
        .excludeFromPushDown(OperationKinds.STAGE);
  }
}
