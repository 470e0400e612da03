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


package dev.mars.tessera.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for ExecutionStatus.
 */
class ExecutionStatusTest {

    @Test
    void testTerminalStates() {
        assertTrue(ExecutionStatus.COMPLETED.isTerminal());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertTrue(ExecutionStatus.TERMINATED.isTerminal());
        assertFalse(ExecutionStatus.PENDING.isTerminal());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
        assertFalse(ExecutionStatus.WAITING.isTerminal());
    }

    @Test
    void testActiveStates() {
        assertTrue(ExecutionStatus.RUNNING.isActive());
        assertTrue(ExecutionStatus.WAITING.isActive());
        assertFalse(ExecutionStatus.PENDING.isActive());
        assertFalse(ExecutionStatus.COMPLETED.isActive());
    }

    @Test
    void testValidTransitions() {
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.TERMINATED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.WAITING));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.WAITING.canTransitionTo(ExecutionStatus.RUNNING));
        assertTrue(ExecutionStatus.WAITING.canTransitionTo(ExecutionStatus.TERMINATED));
    }

    @Test
    void testInvalidTransitions() {
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.WAITING));
        assertFalse(ExecutionStatus.WAITING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PENDING));
        assertFalse(ExecutionStatus.RUNNING.canTransitionTo(null));
    }

    @ParameterizedTest
    @EnumSource(value = ExecutionStatus.class, names = {"COMPLETED", "FAILED", "TERMINATED"})
    void testTerminalStatesHaveNoTransitions(ExecutionStatus status) {
        assertEquals(0, status.getValidTransitions().length);
        for (ExecutionStatus target : ExecutionStatus.values()) {
            assertFalse(status.canTransitionTo(target), status + " -> " + target);
        }
    }

    @ParameterizedTest
    @EnumSource(ExecutionStatus.class)
    void testSelfTransitionIsInvalid(ExecutionStatus status) {
        assertFalse(status.canTransitionTo(status));
    }

    @Test
    void testWireNameRoundTrip() {
        assertEquals("running", ExecutionStatus.RUNNING.wireName());
        assertEquals(ExecutionStatus.TERMINATED, ExecutionStatus.fromWireName("terminated"));
        assertEquals(ExecutionStatus.FAILED, ExecutionStatus.fromWireName(" FAILED "));
        assertThrows(IllegalArgumentException.class, () -> ExecutionStatus.fromWireName("paused"));
        assertThrows(IllegalArgumentException.class, () -> ExecutionStatus.fromWireName(null));
    }
}
