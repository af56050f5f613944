/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.tsquery.planner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.tsquery.exception.PlanningException;
import org.opensearch.tsquery.testing.TestOperationSpec;
import org.opensearch.tsquery.testing.TestProcedureSpec;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ProcedureRegistryTest {

  @Mock private PlannerAdministration administration;

  @Test
  void should_create_procedures_of_registered_kinds() {
    ProcedureRegistry registry =
        ProcedureRegistry.builder()
            .registerProcedureSpec("sum", TestProcedureSpec.FACTORY, "sum")
            .build();

    ProcedureSpec procedure = registry.create(TestOperationSpec.of("sum"), administration);

    assertEquals("sum", procedure.getKind());
  }

  @Test
  void should_fail_planning_of_unknown_kinds() {
    ProcedureRegistry registry = ProcedureRegistry.builder().build();

    PlanningException e =
        assertThrows(
            PlanningException.class,
            () -> registry.create(TestOperationSpec.of("mystery"), administration));
    assertEquals("unsupported operation kind: mystery", e.getMessage());
  }

  @Test
  void should_fail_planning_when_the_factory_returns_another_procedure_kind() {
    ProcedureRegistry registry =
        ProcedureRegistry.builder()
            .registerProcedureSpec("aggregate", TestProcedureSpec.FACTORY, "sum")
            .build();

    assertThrows(
        PlanningException.class,
        () -> registry.create(TestOperationSpec.of("sum"), administration));
  }

  @Test
  void should_ignore_repeated_registration_and_reject_conflicts() {
    ProcedureRegistry.Builder builder =
        ProcedureRegistry.builder()
            .registerProcedureSpec("sum", TestProcedureSpec.FACTORY, "sum")
            .registerProcedureSpec("sum", TestProcedureSpec.FACTORY, "sum");

    assertThrows(
        IllegalStateException.class,
        () -> builder.registerProcedureSpec("sum", (spec, admin) -> null, "sum"));
  }
}
