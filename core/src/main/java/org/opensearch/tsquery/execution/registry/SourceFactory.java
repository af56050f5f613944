/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.registry;

import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.ExecutionContext;
import org.opensearch.tsquery.execution.ExecutionState;
import org.opensearch.tsquery.execution.Source;
import org.opensearch.tsquery.planner.ProcedureSpec;

/** Constructs the runtime source of a root plan node of one procedure kind. */
@FunctionalInterface
public interface SourceFactory {

  Source create(
      ProcedureSpec spec, DatasetId id, ExecutionState state, ExecutionContext context);
}
