/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner.stage;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.tsquery.exception.PlanningException;
import org.opensearch.tsquery.planner.PhysicalPlan;
import org.opensearch.tsquery.planner.ProcedureSpec;
import org.opensearch.tsquery.planner.ProcedureSpecFactory;
import org.opensearch.tsquery.spec.OperationKinds;
import org.opensearch.tsquery.spec.QuerySpec;

/** Procedure spec of a stage node: the embedded graph together with its physical plan. */
@Getter
@RequiredArgsConstructor
public class StageProcedureSpec implements ProcedureSpec {

  /** Converts a {@link StageOperationSpec}, planning its payload with the same registry. */
  public static final ProcedureSpecFactory FACTORY =
      (spec, administration) -> {
        if (!(spec instanceof StageOperationSpec)) {
          throw new PlanningException(
              "invalid spec type for stage procedure: " + spec.getClass().getSimpleName());
        }
        QuerySpec payload = ((StageOperationSpec) spec).getSpec();
        return new StageProcedureSpec(payload, administration.planNested(payload));
      };

  private final QuerySpec spec;
  private final PhysicalPlan plan;

  @Override
  public String getKind() {
    return OperationKinds.STAGE;
  }
}
