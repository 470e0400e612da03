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

import java.util.List;

/**
 * Thrown when a step is reached but some of its required inputs are absent from the
 * execution data. This is never retried.
 */
public class MissingInputException extends WorkflowException {

    private final String stepName;
    private final List<String> missingInputs;

    public MissingInputException(String workflowId, String stepName, List<String> missingInputs) {
        super(workflowId, String.format("Step '%s' is missing required inputs: %s", stepName, missingInputs));
        this.stepName = stepName;
        this.missingInputs = List.copyOf(missingInputs);
    }

    public String getStepName() {
        return stepName;
    }

    public List<String> getMissingInputs() {
        return missingInputs;
    }
}
