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

import dev.mars.tessera.workflow.ValidationResult;

/**
 * Thrown when a workflow definition fails structural or connectivity validation.
 * The full {@link ValidationResult} is available to callers.
 */
public class WorkflowValidationException extends WorkflowException {

    private final ValidationResult validationResult;

    public WorkflowValidationException(String workflowId, ValidationResult validationResult) {
        super(workflowId, buildMessage(workflowId, validationResult));
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }

    private static String buildMessage(String workflowId, ValidationResult result) {
        StringBuilder sb = new StringBuilder("Workflow '").append(workflowId).append("' is invalid");
        if (result != null && !result.getErrors().isEmpty()) {
            sb.append(": ").append(result.getErrors().get(0).getMessage());
            int more = result.getErrorCount() - 1;
            if (more > 0) {
                sb.append(" (and ").append(more).append(" more)");
            }
        }
        return sb.toString();
    }
}
