/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

/** Runtime payload of a {@link PlanNode}, produced from an operation spec at planning time. */
public interface ProcedureSpec {

  /** Returns the procedure kind used to look up the runtime constructor. */
  String getKind();
}
