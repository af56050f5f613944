/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.exception;

/** No runtime constructor is registered for an operation kind. */
public class UnsupportedOperationKindException extends QueryEngineException {

  public UnsupportedOperationKindException(String kind) {
    super("unsupported procedure kind: " + kind);
  }
}
