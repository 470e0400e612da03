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

package dev.mars.tessera.core.exceptions;

import dev.mars.tessera.core.ExecutionStatus;

/**
 * Thrown when an execution is asked to move to a status that is not reachable
 * from its current one.
 */
public class InvalidTransitionException extends StateException {

    private final ExecutionStatus currentStatus;
    private final ExecutionStatus requestedStatus;

    /**
     * @param entityId        the workflow or execution whose transition was rejected
     * @param currentStatus   the status the entity is in
     * @param requestedStatus the status that was requested
     */
    public InvalidTransitionException(String entityId, ExecutionStatus currentStatus,
                                      ExecutionStatus requestedStatus) {
        super(entityId, String.format("Invalid transition for '%s': %s → %s. Valid targets: %s",
                entityId, currentStatus, requestedStatus,
                formatTransitions(currentStatus != null ? currentStatus.getValidTransitions() : null)));
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }

    public ExecutionStatus getCurrentStatus() {
        return currentStatus;
    }

    public ExecutionStatus getRequestedStatus() {
        return requestedStatus;
    }

    private static String formatTransitions(ExecutionStatus[] transitions) {
        if (transitions == null || transitions.length == 0) {
            return "[]";
        }
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < transitions.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(transitions[i].name());
        }
        sb.append("]");
        return sb.toString();
    }
}
