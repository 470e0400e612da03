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
 * Failure of a single step invocation, tagged with the step name and a failure kind
 * so the engine can apply the step's retry policy.
 */
public abstract class StepException extends WorkflowException {

    private final String stepName;
    private final StepFailureKind kind;

    protected StepException(String workflowId, String stepName, StepFailureKind kind, String message) {
        super(workflowId, message);
        this.stepName = stepName;
        this.kind = kind;
    }

    protected StepException(String workflowId, String stepName, StepFailureKind kind, String message,
                            Throwable cause) {
        super(workflowId, message, cause);
        this.stepName = stepName;
        this.kind = kind;
    }

    public String getStepName() {
        return stepName;
    }

    public StepFailureKind getKind() {
        return kind;
    }
}
