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

import java.time.Duration;

/**
 * Thrown when an execution exceeds its definition's maximum execution time.
 */
public class WorkflowTimeoutException extends WorkflowException {

    private final String executionId;
    private final Duration maxExecutionTime;

    public WorkflowTimeoutException(String workflowId, String executionId, Duration maxExecutionTime) {
        super(workflowId, String.format("Execution %s of workflow '%s' exceeded max execution time of %d ms",
                executionId, workflowId, maxExecutionTime.toMillis()));
        this.executionId = executionId;
        this.maxExecutionTime = maxExecutionTime;
    }

    public String getExecutionId() {
        return executionId;
    }

    public Duration getMaxExecutionTime() {
        return maxExecutionTime;
    }
}
