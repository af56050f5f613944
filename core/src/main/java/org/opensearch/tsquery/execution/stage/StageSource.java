/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.stage;

import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.opensearch.tsquery.exception.QueryCancelledException;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.ExecutionContext;
import org.opensearch.tsquery.execution.MemoryAccount;
import org.opensearch.tsquery.execution.PipelineContext;
import org.opensearch.tsquery.execution.Source;
import org.opensearch.tsquery.execution.Transformation;
import org.opensearch.tsquery.execution.TransformationSet;
import org.opensearch.tsquery.execution.table.TableIterator;
import org.opensearch.tsquery.planner.stage.StageProcedureSpec;

/**
 * Source of a stage at the root of a query. Reads the tables produced by the storage layer for
 * the staged operations and pushes them to every attached transformation.
 *
 * <p>After a complete pass the watermark advances to the stop of the node bounds, if any. Exactly
 * one {@code finish} follows, carrying the read failure or the cancellation cause.
 */
@Log4j2
public class StageSource implements Source {

  @Getter private final DatasetId id;
  private final StageProcedureSpec spec;
  private final TableReaderFactory readers;
  private final ExecutionContext context;
  private final MemoryAccount account;
  private final TransformationSet transformations = new TransformationSet();

  public StageSource(
      DatasetId id,
      StageProcedureSpec spec,
      TableReaderFactory readers,
      ExecutionContext context,
      MemoryAccount account) {
    this.id = id;
    this.spec = spec;
    this.readers = readers;
    this.context = context;
    this.account = account;
  }

  @Override
  public void addTransformation(Transformation transformation) {
    transformations.add(transformation);
  }

  @Override
  public void run(PipelineContext pipelineContext) {
    Throwable error = null;
    long tables = 0;
    try (TableIterator iterator = readers.read(spec.getSpec(), context, account)) {
      while (true) {
        if (pipelineContext.isCancelled()) {
          throw new QueryCancelledException(
              "stage source " + id + " cancelled", pipelineContext.getCause());
        }
        if (!iterator.hasNext()) {
          break;
        }
        transformations.process(id, iterator.next());
        tables++;
      }
      if (context.getBounds().isPresent()) {
        transformations.updateWatermark(id, context.getBounds().get().getStop());
      }
    } catch (RuntimeException e) {
      error = e;
    }
    if (error == null) {
      log.debug("Stage source {} read {} tables", id, tables);
    } else {
      log.debug("Stage source {} stopped after {} tables: {}", id, tables, error.toString());
    }
    transformations.finish(id, error);
  }
}
