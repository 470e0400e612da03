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


package dev.mars.tessera.workflow.executor;

import dev.mars.tessera.workflow.Step;

import java.util.Objects;

/**
 * Identifies one attempt at running a step, handed to a {@link StepExecutorFactory}.
 */
public final class StepInvocation {

    private final String workflowId;
    private final String executionId;
    private final Step step;
    private final int attempt;

    public StepInvocation(String workflowId, String executionId, Step step, int attempt) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.step = Objects.requireNonNull(step, "Step cannot be null");
        this.attempt = attempt;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Step getStep() {
        return step;
    }

    /**
     * @return one-based attempt number
     */
    public int getAttempt() {
        return attempt;
    }

    @Override
    public String toString() {
        return "StepInvocation{" +
               "workflowId='" + workflowId + '\'' +
               ", executionId='" + executionId + '\'' +
               ", step='" + step.getName() + '\'' +
               ", attempt=" + attempt +
               '}';
    }
}
