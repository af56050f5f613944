/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.exception;

/** A query tried to allocate more memory than its budget allows. */
public class ResourceExhaustedException extends QueryEngineException {

  public ResourceExhaustedException(String message) {
    super(message);
  }
}
