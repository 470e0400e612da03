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


package dev.mars.tessera.workflow.observability;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for WorkflowMetrics. Without an installed SDK the global meter is a no-op,
 * so only the locally tracked gauge value is observable.
 */
class WorkflowMetricsTest {

    @Test
    void testSingleton() {
        assertSame(WorkflowMetrics.getInstance(), WorkflowMetrics.getInstance());
    }

    @Test
    void testActiveWorkflowsFollowLifecycle() {
        WorkflowMetrics metrics = WorkflowMetrics.getInstance();
        long before = metrics.getActiveWorkflows();

        metrics.recordWorkflowStarted("wf", "SEQUENTIAL");
        metrics.recordWorkflowStarted("wf", "SEQUENTIAL");
        metrics.recordWorkflowStarted("wf", "PARALLEL");
        assertEquals(before + 3, metrics.getActiveWorkflows());

        metrics.recordStepExecuted("wf", "checker");
        metrics.recordStepFailed("wf", "checker", null);
        metrics.recordStepRetried("wf", "checker");
        metrics.recordWorkflowCompleted("wf", "SEQUENTIAL", 0.25, 2);
        metrics.recordWorkflowFailed("wf", "SEQUENTIAL", null);
        metrics.recordWorkflowTerminated("wf", "PARALLEL");

        assertEquals(before, metrics.getActiveWorkflows());
    }
}
