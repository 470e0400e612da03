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

package dev.mars.tessera.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of a single workflow execution.
 *
 * <h3>State Transition Flow:</h3>
 * <pre>
 * PENDING → RUNNING → {COMPLETED | FAILED}
 *    ↓         ↕  ↘
 * TERMINATED  WAITING → TERMINATED
 * </pre>
 *
 * <h3>State Transition Rules:</h3>
 * <ul>
 *   <li>Every execution starts in PENDING</li>
 *   <li>PENDING can transition to RUNNING or TERMINATED</li>
 *   <li>RUNNING can transition to WAITING, COMPLETED, FAILED or TERMINATED</li>
 *   <li>WAITING can transition back to RUNNING, or to FAILED or TERMINATED</li>
 *   <li>COMPLETED, FAILED and TERMINATED are terminal; a terminated execution cannot be resumed</li>
 * </ul>
 *
 * <p>The wire form used by the state store schema is the lowercase constant name
 * ({@code "running"}, {@code "completed"}, ...).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ExecutionStatus {

    /**
     * Execution has been admitted but no step has been dispatched yet.
     *
     * <p><strong>Next States:</strong> RUNNING, TERMINATED</p>
     */
    PENDING,

    /**
     * Steps are being dispatched and executed.
     *
     * <p><strong>Next States:</strong> WAITING, COMPLETED, FAILED, TERMINATED</p>
     */
    RUNNING,

    /**
     * Execution is suspended waiting for external input.
     *
     * <p><strong>Next States:</strong> RUNNING, FAILED, TERMINATED</p>
     */
    WAITING,

    /**
     * Every step completed and all declared outputs were produced.
     *
     * <p><strong>Terminal State</strong></p>
     */
    COMPLETED,

    /**
     * A step failed after exhausting its retry policy, or the execution could not proceed.
     *
     * <p><strong>Terminal State</strong></p>
     */
    FAILED,

    /**
     * Execution was stopped by an explicit external terminate request.
     *
     * <p><strong>Terminal State:</strong> resuming a terminated execution is unsupported.</p>
     */
    TERMINATED;

    /**
     * Checks whether this status is terminal (COMPLETED, FAILED or TERMINATED).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TERMINATED;
    }

    /**
     * Checks whether the execution currently holds a concurrency slot.
     */
    public boolean isActive() {
        return this == RUNNING || this == WAITING;
    }

    /**
     * Checks whether a transition from this status to {@code target} is allowed.
     * Self-transitions are never valid.
     *
     * @param target the requested next status
     * @return {@code true} if the transition is permitted
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == RUNNING || target == TERMINATED;
            case RUNNING -> target == WAITING || target == COMPLETED
                    || target == FAILED || target == TERMINATED;
            case WAITING -> target == RUNNING || target == FAILED || target == TERMINATED;
            case COMPLETED, FAILED, TERMINATED -> false;
        };
    }

    /**
     * Returns every status reachable from this one in a single transition.
     */
    public ExecutionStatus[] getValidTransitions() {
        return java.util.Arrays.stream(values())
                .filter(this::canTransitionTo)
                .toArray(ExecutionStatus[]::new);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses the wire form, accepting any case.
     *
     * @throws IllegalArgumentException if the value names no status
     */
    @JsonCreator
    public static ExecutionStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Execution status cannot be null");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
