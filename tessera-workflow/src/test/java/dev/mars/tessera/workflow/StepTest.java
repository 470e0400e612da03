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

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for Step.
 */
class StepTest {

    @Test
    void testBuilderKeepsDeclarationOrder() {
        Step step = Step.builder("review")
                .description("Review the order")
                .agentType("reviewer")
                .requiredInputs("order", "customer")
                .optionalInputs("notes")
                .outputs("verdict", "comments")
                .timeout(Duration.ofSeconds(30))
                .retryPolicy(RetryPolicy.noRetry())
                .metadata("team", "ops")
                .build();

        assertEquals("review", step.getName());
        assertEquals("reviewer", step.getAgentType());
        assertEquals(List.of("order", "customer"), List.copyOf(step.getRequiredInputs()));
        assertEquals(List.of("verdict", "comments"), List.copyOf(step.getOutputs()));
        assertEquals(List.of("order", "customer", "notes"), List.copyOf(step.allInputs()));
        assertEquals(Duration.ofSeconds(30), step.getTimeout());
        assertEquals(RetryPolicy.noRetry(), step.getRetryPolicy());
        assertEquals(Map.of("team", "ops"), step.getMetadata());
    }

    @Test
    void testDefaultsMeanEngineDefaults() {
        Step step = Step.builder("a").agentType("x").build();

        assertNull(step.getTimeout());
        assertNull(step.getRetryPolicy());
        assertTrue(step.getRequiredInputs().isEmpty());
        assertTrue(step.getOutputs().isEmpty());
    }

    @Test
    void testOptionalInputsExcludeRequiredOnes() {
        Step step = Step.builder("a").agentType("x")
                .requiredInputs("order")
                .optionalInputs("order", "notes")
                .build();

        assertEquals(Set.of("notes"), step.getOptionalInputs());
    }

    @Test
    void testValidateInputsReportsMissingInOrder() {
        Step step = Step.builder("a").agentType("x")
                .requiredInputs("first", "second", "third")
                .optionalInputs("extra")
                .build();

        assertEquals(List.of("first", "third"), step.validateInputs(List.of("second", "extra")));
        assertEquals(List.of(), step.validateInputs(Map.of("first", 1, "second", 2, "third", 3)));
        assertEquals(List.of("first", "second", "third"), step.validateInputs((Map<String, ?>) null));
    }

    @Test
    void testInvalidStepsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Step.builder("").agentType("x").build());
        assertThrows(IllegalArgumentException.class, () -> Step.builder("a").build());
        assertThrows(IllegalArgumentException.class,
                () -> Step.builder("a").agentType("x").timeout(Duration.ZERO).build());
    }

    @Test
    void testStepIsImmutable() {
        Step step = Step.builder("a").agentType("x").requiredInputs("in").build();

        assertThrows(UnsupportedOperationException.class, () -> step.getRequiredInputs().add("other"));
        assertThrows(UnsupportedOperationException.class, () -> step.getMetadata().put("k", "v"));
    }
}
