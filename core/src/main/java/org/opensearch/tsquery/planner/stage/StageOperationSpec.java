/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner.stage;

import java.util.Optional;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.tsquery.spec.Bounded;
import org.opensearch.tsquery.spec.Bounds;
import org.opensearch.tsquery.spec.Operation;
import org.opensearch.tsquery.spec.OperationKinds;
import org.opensearch.tsquery.spec.OperationSpec;
import org.opensearch.tsquery.spec.QuerySpec;

/**
 * Operation spec of a stage: a sub-graph of push-down operations that runs as one unit next to
 * the data. The embedded graph keeps the original operation IDs.
 */
@Getter
@EqualsAndHashCode
@RequiredArgsConstructor
public class StageOperationSpec implements OperationSpec, Bounded {

  private final QuerySpec spec;

  @Override
  public String getKind() {
    return OperationKinds.STAGE;
  }

  /** Returns the bounds of the first embedded operation that declares any. */
  @Override
  public Optional<Bounds> getBounds(long now) {
    for (Operation op : spec.getOperations()) {
      if (op.getSpec() instanceof Bounded) {
        Optional<Bounds> bounds = ((Bounded) op.getSpec()).getBounds(now);
        if (bounds.isPresent()) {
          return bounds;
        }
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "stage"
        + spec.getOperations().stream().map(Operation::getId).collect(Collectors.toList());
  }
}
