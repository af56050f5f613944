/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.exception;

/** Thrown when an operation cannot be turned into a plan node. */
public class PlanningException extends QueryEngineException {

  public PlanningException(String message) {
    super(message);
  }
}
