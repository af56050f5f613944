/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.opensearch.tsquery.exception.PlanningException;
import org.opensearch.tsquery.spec.OperationSpec;

/** Maps operation kinds to the factories that turn them into procedure specs. */
public class ProcedureRegistry {

  private final Map<String, Registration> registrations;

  private ProcedureRegistry(Map<String, Registration> registrations) {
    this.registrations = ImmutableMap.copyOf(registrations);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates the procedure spec of {@code spec}.
   *
   * @throws PlanningException if the kind is unknown or the factory returns a spec of another
   *     procedure kind than it was registered with
   */
  public ProcedureSpec create(OperationSpec spec, PlannerAdministration administration) {
    Registration registration = registrations.get(spec.getKind());
    if (registration == null) {
      throw new PlanningException("unsupported operation kind: " + spec.getKind());
    }
    ProcedureSpec procedure = registration.factory.create(spec, administration);
    if (procedure == null || !registration.procedureKind.equals(procedure.getKind())) {
      throw new PlanningException(
          "operation kind "
              + spec.getKind()
              + " produced "
              + (procedure == null ? "no procedure" : "procedure kind " + procedure.getKind())
              + ", expected "
              + registration.procedureKind);
    }
    return procedure;
  }

  public boolean isRegistered(String operationKind) {
    return registrations.containsKey(operationKind);
  }

  @RequiredArgsConstructor
  private static class Registration {
    private final String procedureKind;
    private final ProcedureSpecFactory factory;
  }

  /** Collects registrations; re-registering the same factory for a kind is a no-op. */
  public static class Builder {
    private final Map<String, Registration> registrations = new LinkedHashMap<>();

    /**
     * Registers {@code factory} as the producer of {@code procedureKind} procedures for the given
     * operation kinds.
     */
    public Builder registerProcedureSpec(
        String procedureKind, ProcedureSpecFactory factory, String... operationKinds) {
      for (String operationKind : operationKinds) {
        Registration existing = registrations.get(operationKind);
        if (existing != null) {
          if (existing.factory != factory || !existing.procedureKind.equals(procedureKind)) {
            throw new IllegalStateException(
                "duplicate procedure registration for operation kind " + operationKind);
          }
          continue;
        }
        registrations.put(operationKind, new Registration(procedureKind, factory));
      }
      return this;
    }

    public ProcedureRegistry build() {
      return new ProcedureRegistry(registrations);
    }
  }
}
