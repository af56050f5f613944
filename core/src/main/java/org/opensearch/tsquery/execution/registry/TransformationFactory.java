/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.registry;

import org.opensearch.tsquery.execution.AccumulationMode;
import org.opensearch.tsquery.execution.DatasetId;
import org.opensearch.tsquery.execution.ExecutionContext;
import org.opensearch.tsquery.execution.ExecutionState;
import org.opensearch.tsquery.planner.ProcedureSpec;

/** Constructs the runtime transformation of a non-root plan node of one procedure kind. */
@FunctionalInterface
public interface TransformationFactory {

  TransformationNode create(
      DatasetId id,
      ExecutionState state,
      AccumulationMode mode,
      ProcedureSpec spec,
      ExecutionContext context);
}
