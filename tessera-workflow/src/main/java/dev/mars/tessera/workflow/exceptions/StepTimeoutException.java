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

import java.time.Duration;

/**
 * Thrown when an executor does not complete within the step timeout.
 */
public class StepTimeoutException extends StepException {

    private final Duration timeout;

    public StepTimeoutException(String workflowId, String stepName, Duration timeout) {
        super(workflowId, stepName, StepFailureKind.TIMEOUT,
                String.format("Timed out after %d ms", timeout.toMillis()));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
