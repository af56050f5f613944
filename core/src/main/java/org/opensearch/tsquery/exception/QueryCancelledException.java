/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.exception;

/** Delivered through the terminal finish signal of every node when a query is cancelled. */
public class QueryCancelledException extends QueryEngineException {

  public QueryCancelledException(String message) {
    super(message);
  }

  public QueryCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
