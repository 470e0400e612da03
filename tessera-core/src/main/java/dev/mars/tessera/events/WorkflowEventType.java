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

package dev.mars.tessera.events;

/**
 * Lifecycle event types published by the engine. The bus itself accepts any string type;
 * these are the ones the engine emits.
 */
public enum WorkflowEventType {
    WORKFLOW_STARTED("workflow_started"),
    STEP_STARTED("step_started"),
    STEP_COMPLETED("step_completed"),
    STEP_RETRYING("step_retrying"),
    STEP_FAILED("step_failed"),
    WORKFLOW_COMPLETED("workflow_completed"),
    WORKFLOW_FAILED("workflow_failed"),
    WORKFLOW_TERMINATED("workflow_terminated");

    private final String wireName;

    WorkflowEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
