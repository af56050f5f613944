/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import org.opensearch.tsquery.spec.OperationSpec;

/** Converts the operation spec of one kind into its procedure spec. */
@FunctionalInterface
public interface ProcedureSpecFactory {

  /**
   * Creates the procedure spec.
   *
   * @param spec the operation spec, of a kind the factory is registered for
   * @param administration opaque planner metadata
   * @return the procedure spec
   */
  ProcedureSpec create(OperationSpec spec, PlannerAdministration administration);
}
