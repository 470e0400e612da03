/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package dev.mars.tessera.workflow;

import dev.mars.tessera.workflow.exceptions.WorkflowValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for WorkflowDefinition.
 */
class WorkflowDefinitionTest {

    private static Step step(String name, List<String> inputs, List<String> outputs) {
        return Step.builder(name).agentType("agent").requiredInputs(inputs).outputs(outputs).build();
    }

    private static WorkflowDefinition chain() {
        return WorkflowDefinition.builder("chain")
                .initialInputs("seed")
                .step(step("first", List.of("seed"), List.of("x")))
                .step(step("second", List.of("x"), List.of("y")))
                .step(step("third", List.of("y"), List.of("z")))
                .dependency("second", "first")
                .dependency("third", "second")
                .build();
    }

    @Test
    void testBuilderDefaults() {
        WorkflowDefinition definition = WorkflowDefinition.builder("wf")
                .step(step("only", List.of(), List.of()))
                .build();

        assertEquals("wf", definition.getName());
        assertEquals("1.0.0", definition.getVersion());
        assertEquals(ExecutionStrategy.SEQUENTIAL, definition.getStrategy());
        assertNull(definition.getMaxExecutionTime());
        assertFalse(definition.isFrozen());
    }

    @Test
    void testInvalidBuilderArguments() {
        assertThrows(IllegalArgumentException.class, () -> WorkflowDefinition.builder(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> WorkflowDefinition.builder("wf").maxExecutionTime(Duration.ZERO).build());
    }

    @Test
    void testLookups() {
        WorkflowDefinition definition = chain();

        assertEquals(List.of("first", "second", "third"), definition.getStepNames());
        assertTrue(definition.getStep("second").isPresent());
        assertTrue(definition.getStep("missing").isEmpty());
        assertEquals(List.of("first"), definition.getStepDependencies("second"));
        assertEquals(List.of(), definition.getStepDependencies("first"));
        assertEquals(List.of("second"), definition.getDependentSteps("first"));
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        void testValidChain() {
            ValidationResult result = chain().validate();

            assertTrue(result.isValid(), result.getErrors().toString());
            assertFalse(result.hasWarnings());
        }

        @Test
        void testEmptyWorkflow() {
            ValidationResult result = WorkflowDefinition.builder("empty").build().validate();

            assertTrue(result.hasError(ValidationCode.EMPTY_WORKFLOW));
        }

        @Test
        void testDuplicateStepReportedOnce() {
            ValidationResult result = WorkflowDefinition.builder("dup")
                    .step(step("a", List.of(), List.of()))
                    .step(step("a", List.of(), List.of()))
                    .step(step("a", List.of(), List.of()))
                    .build()
                    .validate();

            assertEquals(1, result.getErrorCount());
            assertTrue(result.hasError(ValidationCode.DUPLICATE_STEP));
        }

        @Test
        void testUnknownAndSelfDependencies() {
            ValidationResult result = WorkflowDefinition.builder("refs")
                    .step(step("a", List.of(), List.of()))
                    .dependency("a", "a")
                    .dependency("a", "ghost")
                    .dependency("phantom", "a")
                    .build()
                    .validate();

            assertTrue(result.hasError(ValidationCode.SELF_DEPENDENCY));
            assertTrue(result.hasError(ValidationCode.UNKNOWN_STEP));
            assertEquals(3, result.getErrorCount());
        }

        @Test
        void testCycle() {
            ValidationResult result = WorkflowDefinition.builder("loop")
                    .step(step("a", List.of(), List.of()))
                    .step(step("b", List.of(), List.of()))
                    .dependency("a", "b")
                    .dependency("b", "a")
                    .build()
                    .validate();

            assertEquals(1, result.getErrorCount());
            assertTrue(result.hasError(ValidationCode.CYCLE));
            assertThat(result.getErrors().get(0).getMessage()).contains("a -> b -> a");
        }

        @Test
        void testInputProducedByLaterStepIsUnsatisfied() {
            // "reader" needs "x", which "writer" produces, but nothing orders writer first
            ValidationResult result = WorkflowDefinition.builder("order")
                    .step(step("reader", List.of("x"), List.of()))
                    .step(step("writer", List.of(), List.of("x")))
                    .build()
                    .validate();

            assertTrue(result.hasError(ValidationCode.UNSATISFIED_INPUT));
            assertEquals("steps.reader.requiredInputs", result.getErrors().get(0).getFieldPath());
        }

        @Test
        void testInitialInputsSatisfyRequirements() {
            WorkflowDefinition definition = WorkflowDefinition.builder("seeded")
                    .step(step("reader", List.of("x"), List.of()))
                    .build();
            assertFalse(definition.validate().isValid());

            definition.addInitialInput("x");

            assertTrue(definition.validate().isValid());
        }

        @Test
        void testWarnings() {
            ValidationResult result = WorkflowDefinition.builder("warn")
                    .step(step("a", List.of(), List.of("x")))
                    .step(Step.builder("b").agentType("agent").optionalInputs("never").outputs("x").build())
                    .dependency("b", "a")
                    .build()
                    .validate();

            assertTrue(result.isValid());
            assertEquals(2, result.getWarningCount());
            assertThat(result.getWarnings())
                    .extracting(ValidationResult.ValidationIssue::getCode)
                    .containsExactlyInAnyOrder(ValidationCode.DUPLICATE_OUTPUT, ValidationCode.UNSUPPLIED_OPTIONAL_INPUT);
        }

        @Test
        void testValidateOrThrow() {
            WorkflowDefinition broken = WorkflowDefinition.builder("broken").build();

            WorkflowValidationException exception =
                    assertThrows(WorkflowValidationException.class, broken::validateOrThrow);
            assertEquals("broken", exception.getWorkflowId());
            assertTrue(exception.getValidationResult().hasError(ValidationCode.EMPTY_WORKFLOW));
        }
    }

    @Test
    void testExecutionOrderAndBatches() throws WorkflowValidationException {
        WorkflowDefinition definition = WorkflowDefinition.builder("fan")
                .step(step("root", List.of(), List.of("r")))
                .step(step("left", List.of("r"), List.of("l")))
                .step(step("right", List.of("r"), List.of("rr")))
                .step(step("join", List.of("l", "rr"), List.of()))
                .dependency("left", "root")
                .dependency("right", "root")
                .dependency("join", "left", "right")
                .build();

        assertEquals(List.of("root", "left", "right", "join"), definition.getExecutionOrder());
        assertEquals(List.of(List.of("root"), List.of("left", "right"), List.of("join")),
                definition.getParallelBatches());
        assertEquals(List.of("left", "right"), definition.getParallelSteps(Set.of("root")));
        assertEquals(List.of("root"), definition.getNextSteps(null, Set.of()));
        assertEquals(List.of("join"), definition.getNextSteps("right", Set.of("root", "left", "right")));
    }

    @Test
    void testExecutionOrderFailsOnCycle() {
        WorkflowDefinition definition = WorkflowDefinition.builder("loop")
                .step(step("a", List.of(), List.of()))
                .step(step("b", List.of(), List.of()))
                .dependency("a", "b")
                .dependency("b", "a")
                .build();

        assertThrows(WorkflowValidationException.class, definition::getExecutionOrder);
        assertThrows(WorkflowValidationException.class, definition::getParallelBatches);
    }

    @Test
    void testExecutionOrderFailsOnSelfDependency() {
        WorkflowDefinition definition = WorkflowDefinition.builder("self")
                .step(step("a", List.of(), List.of()))
                .dependency("a", "a")
                .build();

        WorkflowValidationException e = assertThrows(WorkflowValidationException.class,
                definition::getExecutionOrder);
        assertTrue(e.getValidationResult().hasError(ValidationCode.CYCLE));
        assertTrue(e.getMessage().contains("a -> a"), e.getMessage());
        assertThrows(WorkflowValidationException.class, definition::getParallelBatches);
        assertTrue(definition.validate().hasError(ValidationCode.SELF_DEPENDENCY));
    }

    @Test
    void testFrozenDefinitionRejectsMutation() {
        WorkflowDefinition definition = chain();
        definition.freeze();

        assertTrue(definition.isFrozen());
        assertThrows(IllegalStateException.class, () -> definition.addStep(step("extra", List.of(), List.of())));
        assertThrows(IllegalStateException.class, () -> definition.addDependency("first", "third"));
        assertThrows(IllegalStateException.class, () -> definition.addInitialInput("more"));
        assertEquals(List.of("second"), definition.getDependentSteps("first"));
    }

    @Test
    void testAddDependencyBeforeFreeze() {
        WorkflowDefinition definition = WorkflowDefinition.builder("late")
                .step(step("a", List.of(), List.of()))
                .build();
        definition.addStep(step("b", List.of(), List.of()));
        definition.addDependency("a", "b");
        definition.addDependency("a", "b");

        assertEquals(List.of("a"), definition.getStepDependencies("b"));
    }
}
