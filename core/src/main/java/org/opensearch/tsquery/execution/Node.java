/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution;

/** A runtime node with downstream fan-out. */
public interface Node {

  /** Appends a consumer to the fan-out. */
  void addTransformation(Transformation transformation);
}
