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

/**
 * Thrown when an executor fails, breaks its output contract, or cannot be resolved.
 */
public class StepExecutionException extends StepException {

    private final int attempts;

    public StepExecutionException(String workflowId, String stepName, StepFailureKind kind, String message) {
        this(workflowId, stepName, kind, 1, message, null);
    }

    public StepExecutionException(String workflowId, String stepName, StepFailureKind kind, int attempts,
                                  String message, Throwable cause) {
        super(workflowId, stepName, kind, message, cause);
        this.attempts = attempts;
    }

    /**
     * @return the number of attempts made when this failure was raised
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Returns a copy of this failure recording the final attempt count.
     */
    public StepExecutionException withAttempts(int totalAttempts) {
        StepExecutionException copy = new StepExecutionException(getWorkflowId(), getStepName(), getKind(),
                totalAttempts, super.getMessage(), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
