/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import org.opensearch.tsquery.spec.Operation;
import org.opensearch.tsquery.spec.OperationKinds;

/**
 * Decides which operations may be relocated next to the data source. Classification is keyed by
 * operation kind; each kind of the operation catalog may register its own predicate, which
 * replaces the default. Kinds without a predicate are not push-down eligible.
 */
public class PushDownClassifier {

  /** Kinds that are eligible unless the catalog registers otherwise. */
  public static final Set<String> DEFAULT_PUSH_DOWN_KINDS =
      ImmutableSet.of(
          OperationKinds.FROM,
          OperationKinds.RANGE,
          OperationKinds.FILTER,
          OperationKinds.GROUP,
          OperationKinds.WINDOW,
          OperationKinds.FIRST,
          OperationKinds.LAST,
          OperationKinds.SUM,
          OperationKinds.SAMPLE);

  private static final Predicate<Operation> ALWAYS = op -> true;

  private final Map<String, Predicate<Operation>> predicates;

  private PushDownClassifier(Map<String, Predicate<Operation>> predicates) {
    this.predicates = ImmutableMap.copyOf(predicates);
  }

  /** Returns a classifier with only the default kinds. */
  public static PushDownClassifier defaults() {
    return builder().build();
  }

  /** Returns a builder pre-populated with {@link #DEFAULT_PUSH_DOWN_KINDS}. */
  public static Builder builder() {
    return new Builder();
  }

  public boolean isPushDownOp(Operation operation) {
    Predicate<Operation> predicate = predicates.get(operation.getKind());
    return predicate != null && predicate.test(operation);
  }

  public static class Builder {
    private final Map<String, Predicate<Operation>> predicates = new LinkedHashMap<>();

    private Builder() {
      for (String kind : DEFAULT_PUSH_DOWN_KINDS) {
        predicates.put(kind, ALWAYS);
      }
    }

    /** Sets the classification of {@code kind}, replacing any earlier one. */
    public Builder register(String kind, Predicate<Operation> predicate) {
      predicates.put(kind, predicate);
      return this;
    }

    /** Marks {@code kind} as never eligible. */
    public Builder exclude(String kind) {
      predicates.remove(kind);
      return this;
    }

    public PushDownClassifier build() {
      return new PushDownClassifier(predicates);
    }
  }
}
