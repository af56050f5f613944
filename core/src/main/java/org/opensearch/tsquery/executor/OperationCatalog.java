/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.executor;

import java.util.function.Predicate;
import lombok.Getter;
import org.opensearch.tsquery.execution.registry.NodeRegistry;
import org.opensearch.tsquery.execution.registry.SourceFactory;
import org.opensearch.tsquery.execution.registry.TransformationFactory;
import org.opensearch.tsquery.planner.ProcedureRegistry;
import org.opensearch.tsquery.planner.ProcedureSpecFactory;
import org.opensearch.tsquery.planner.PushDownClassifier;
import org.opensearch.tsquery.spec.Operation;

/**
 * Everything the engine knows about operation kinds: how to plan them, whether they may be
 * pushed down, and how to construct them at runtime.
 *
 * <p>The catalog is assembled once at startup through {@link Builder} and never changes
 * afterwards. Registering the same factory for a kind again is a no-op, a different factory for
 * an already registered kind fails with {@link IllegalStateException}.
 */
@Getter
public class OperationCatalog {

  private final ProcedureRegistry procedureRegistry;
  private final PushDownClassifier pushDownClassifier;
  private final NodeRegistry nodeRegistry;

  private OperationCatalog(
      ProcedureRegistry procedureRegistry,
      PushDownClassifier pushDownClassifier,
      NodeRegistry nodeRegistry) {
    this.procedureRegistry = procedureRegistry;
    this.pushDownClassifier = pushDownClassifier;
    this.nodeRegistry = nodeRegistry;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final ProcedureRegistry.Builder procedures = ProcedureRegistry.builder();
    private final PushDownClassifier.Builder pushDown = PushDownClassifier.builder();
    private final NodeRegistry.Builder nodes = NodeRegistry.builder();

    private Builder() {}

    /** Plans operations of {@code operationKinds} into procedures of {@code procedureKind}. */
    public Builder registerProcedureSpec(
        String procedureKind, ProcedureSpecFactory factory, String... operationKinds) {
      procedures.registerProcedureSpec(procedureKind, factory, operationKinds);
      return this;
    }

    public Builder registerSource(String procedureKind, SourceFactory factory) {
      nodes.registerSource(procedureKind, factory);
      return this;
    }

    public Builder registerTransformation(String procedureKind, TransformationFactory factory) {
      nodes.registerTransformation(procedureKind, factory);
      return this;
    }

    /** Overrides whether operations of {@code kind} may be pushed down. */
    public Builder registerPushDown(String kind, Predicate<Operation> predicate) {
      pushDown.register(kind, predicate);
      return this;
    }

    /** Marks {@code kind} as never eligible for push down. */
    public Builder excludeFromPushDown(String kind) {
      pushDown.exclude(kind);
      return this;
    }

    public OperationCatalog build() {
      return new OperationCatalog(procedures.build(), pushDown.build(), nodes.build());
    }
  }
}
