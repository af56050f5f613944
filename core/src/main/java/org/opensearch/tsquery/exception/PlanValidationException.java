/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.exception;

import java.util.List;
import lombok.Getter;

/**
 * Thrown when a query graph is malformed: duplicate operation IDs, edges referencing unknown
 * operations, or cycles. Raised before execution begins, so the query never runs.
 */
@Getter
public class PlanValidationException extends QueryEngineException {

  private final List<String> errors;

  public PlanValidationException(List<String> errors) {
    super("Plan validation failed: " + String.join(", ", errors));
    this.errors = List.copyOf(errors);
  }
}
