/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.execution.registry;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.tsquery.execution.Dataset;
import org.opensearch.tsquery.execution.Transformation;

/** A constructed runtime node: the consumer side and the dataset its output goes to. */
@Getter
@RequiredArgsConstructor
public class TransformationNode {

  private final Transformation transformation;
  private final Dataset dataset;
}
