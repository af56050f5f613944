/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import org.opensearch.tsquery.spec.QuerySpec;
import org.opensearch.tsquery.spec.ResourceManagement;

/** Planner metadata handed to every {@link ProcedureSpecFactory}. */
public interface PlannerAdministration {

  /** Returns the logical "now" of the query, in epoch nanoseconds. */
  long getNow();

  /** Returns the resource quotas of the query. */
  ResourceManagement getResources();

  /** Plans an embedded query graph with the same registry, e.g. the payload of a stage. */
  PhysicalPlan planNested(QuerySpec spec);
}
