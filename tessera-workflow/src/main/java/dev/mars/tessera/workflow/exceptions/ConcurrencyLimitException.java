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

/**
 * Thrown at admission when the engine is already running its maximum number of executions.
 */
public class ConcurrencyLimitException extends WorkflowException {

    private final int limit;
    private final int running;

    public ConcurrencyLimitException(String workflowId, int limit, int running) {
        super(workflowId, String.format("Cannot start workflow '%s': %d of %d concurrent executions in use",
                workflowId, running, limit));
        this.limit = limit;
        this.running = running;
    }

    public int getLimit() {
        return limit;
    }

    public int getRunning() {
        return running;
    }
}
