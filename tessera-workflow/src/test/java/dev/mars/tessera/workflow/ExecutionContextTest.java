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

import dev.mars.tessera.core.ExecutionStatus;
import dev.mars.tessera.core.exceptions.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ExecutionContext.
 */
class ExecutionContextTest {

    @Test
    void testNewContextIsPending() {
        ExecutionContext context = ExecutionContext.builder("wf").data(Map.of("seed", 1)).build();

        assertEquals(ExecutionStatus.PENDING, context.getStatus());
        assertNotNull(context.getExecutionId());
        assertNull(context.getStartTime());
        assertEquals(Map.of("seed", 1), context.getData());
    }

    @Test
    void testLifecycleTimestamps() throws InvalidTransitionException {
        ExecutionContext context = ExecutionContext.builder("wf").executionId("exec-1").build();

        context.transitionTo(ExecutionStatus.RUNNING);
        assertNotNull(context.getStartTime());
        assertNull(context.getEndTime());

        context.transitionTo(ExecutionStatus.COMPLETED);
        assertNotNull(context.getEndTime());
        assertThrows(InvalidTransitionException.class, () -> context.transitionTo(ExecutionStatus.RUNNING));
    }

    @Test
    void testFailAndTerminateOnlyFromActiveStates() {
        ExecutionContext context = ExecutionContext.builder("wf").build();

        assertTrue(context.terminate("stop"));
        assertFalse(context.fail("late failure"));
        assertFalse(context.terminate("again"));
        assertEquals("stop", context.getTerminationReason());
        assertNull(context.getError());
        assertTrue(context.isTerminated());
    }

    @Test
    void testResolveInputsOnlyReturnsPresentKeys() {
        ExecutionContext context = ExecutionContext.builder("wf").build();
        context.seed(Map.of("a", 1, "b", 2));

        assertEquals(Map.of("a", 1), context.resolveInputs(List.of("a", "missing")));
    }

    @Test
    void testCompleteStepMergesDeclaredOutputsOnly() {
        ExecutionContext context = ExecutionContext.builder("wf").build();

        assertTrue(context.completeStep("s1", Map.of("x", 1, "scratch", 2), Set.of("x")));

        assertEquals(Map.of("x", 1), context.getData());
        assertEquals(Set.of("s1"), context.getCompletedSteps());
    }

    @Test
    void testCompleteStepIsDiscardedAfterTermination() {
        ExecutionContext context = ExecutionContext.builder("wf").build();
        context.terminate("stop");

        assertFalse(context.completeStep("s1", Map.of("x", 1), Set.of("x")));
        assertTrue(context.getData().isEmpty());
        assertTrue(context.getCompletedSteps().isEmpty());
    }

    @Test
    void testSnapshotIsDetached() {
        ExecutionContext context = ExecutionContext.builder("wf").build();
        context.completeStep("s1", Map.of("x", 1), Set.of("x"));

        ExecutionContext snapshot = context.snapshot();
        context.completeStep("s2", Map.of("y", 2), Set.of("y"));

        assertEquals(context.getExecutionId(), snapshot.getExecutionId());
        assertEquals(Set.of("s1"), snapshot.getCompletedSteps());
        assertEquals(Map.of("x", 1), snapshot.getData());
    }

    @Test
    void testAccessorsReturnReadOnlyCopies() {
        ExecutionContext context = ExecutionContext.builder("wf").metadata(Map.of("k", "v")).build();

        assertThrows(UnsupportedOperationException.class, () -> context.getData().put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> context.getMetadata().put("k", "w"));
    }
}
