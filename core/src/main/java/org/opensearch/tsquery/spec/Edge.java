/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.spec;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Directed parent to child edge between two operations. */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public final class Edge {

  private final String parent;
  private final String child;

  @Override
  public String toString() {
    return parent + "->" + child;
  }
}
