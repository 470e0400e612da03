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


package dev.mars.tessera.workflow.exceptions;

import dev.mars.tessera.workflow.StepFailureKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for the workflow exception messages.
 */
class WorkflowExceptionsTest {

    @Test
    void testMessageWithAllContext() {
        WorkflowParseException exception = new WorkflowParseException("orders", 12, "steps[1].timeout",
                "Invalid duration", null);

        assertEquals("Workflow 'orders': Line 12: Field 'steps[1].timeout': Invalid duration", exception.getMessage());
        assertEquals(12, exception.getLineNumber());
    }

    @Test
    void testMessageWithoutContext() {
        WorkflowParseException exception = new WorkflowParseException("Empty or invalid YAML content");

        assertEquals("Empty or invalid YAML content", exception.getMessage());
        assertEquals(-1, exception.getLineNumber());
        assertNull(exception.getFieldPath());
        assertNull(exception.getWorkflowId());
    }

    @Test
    void testStepExceptionsCarryKind() {
        StepTimeoutException timeout = new StepTimeoutException("wf", "fetch", Duration.ofMillis(250));
        assertEquals(StepFailureKind.TIMEOUT, timeout.getKind());
        assertEquals("Timed out after 250 ms", timeout.getMessage());

        StepExecutionException failure = new StepExecutionException("wf", "fetch", StepFailureKind.IO, 1,
                "connection reset", new IOException("connection reset"));
        StepExecutionException finalFailure = failure.withAttempts(4);
        assertEquals(4, finalFailure.getAttempts());
        assertEquals("connection reset", finalFailure.getMessage());
        assertSame(failure.getCause(), finalFailure.getCause());
    }

    @Test
    void testMissingInputMessage() {
        MissingInputException exception = new MissingInputException("wf", "report", List.of("price"));

        assertEquals("Step 'report' is missing required inputs: [price]", exception.getMessage());
        assertEquals("report", exception.getStepName());
    }
}
