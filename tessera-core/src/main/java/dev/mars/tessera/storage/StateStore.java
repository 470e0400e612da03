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

package dev.mars.tessera.storage;

import dev.mars.tessera.core.ExecutionStatus;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.StateException;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Storage contract for per-execution workflow state.
 * <p>
 * Records are keyed by workflow id; saving a record for an id replaces whatever was stored
 * before. Implementations must serialize every read-modify-write sequence so concurrent
 * callers never observe a torn update, and must never let {@code updated_at} move backwards.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface StateStore {

    /**
     * Stores {@code record} under {@code workflowId}, replacing any previous record.
     *
     * @throws IllegalArgumentException if the record belongs to a different workflow
     * @throws StateException           if the backend cannot persist the record
     */
    void save(String workflowId, WorkflowStateRecord record) throws StateException;

    Optional<WorkflowStateRecord> get(String workflowId);

    /**
     * @return {@code true} if a record was removed
     * @throws StateException if the backend cannot remove the persisted record
     */
    boolean delete(String workflowId) throws StateException;

    /**
     * Sets progress and, when given, the current step.
     *
     * @param progress    the new progress, within {@code [0, 1]}
     * @param currentStep the step now executing, or {@code null} to leave it unchanged
     * @throws StateException    if progress is out of range; the stored record is left unchanged
     * @throws NotFoundException if no record exists for {@code workflowId}
     */
    WorkflowStateRecord updateProgress(String workflowId, double progress, String currentStep)
            throws StateException, NotFoundException;

    /**
     * Records a completed step. Idempotent on {@code steps_completed}; the step is always
     * removed from {@code steps_remaining}. A non-null {@code stepOutput} is stored in the
     * record data under {@code step_<stepName>}.
     */
    WorkflowStateRecord markStepCompleted(String workflowId, String stepName, Map<String, Object> stepOutput)
            throws StateException, NotFoundException;

    /**
     * Moves the record to {@code status}, validating the transition.
     *
     * @param error error message to record, or {@code null} to leave the existing one
     * @throws dev.mars.tessera.core.exceptions.InvalidTransitionException if the transition is not allowed
     */
    WorkflowStateRecord updateStatus(String workflowId, ExecutionStatus status, String error)
            throws StateException, NotFoundException;

    // Execution-guarded variants. Each applies only while the stored record still belongs to
    // executionId; the ownership check and the write happen under the same lock.

    /**
     * @return the updated record, or empty if there is no record or it belongs to another execution
     * @throws StateException if progress is out of range
     */
    Optional<WorkflowStateRecord> updateProgress(String workflowId, String executionId, double progress,
                                                 String currentStep) throws StateException;

    /**
     * @return the updated record, or empty if there is no record or it belongs to another execution
     */
    Optional<WorkflowStateRecord> markStepCompleted(String workflowId, String executionId, String stepName,
                                                    Map<String, Object> stepOutput) throws StateException;

    /**
     * @return the updated record, or empty if there is no record or it belongs to another execution
     * @throws dev.mars.tessera.core.exceptions.InvalidTransitionException if the transition is not allowed
     */
    Optional<WorkflowStateRecord> updateStatus(String workflowId, String executionId, ExecutionStatus status,
                                               String error) throws StateException;

    /**
     * Removes every record whose age, measured from {@code created_at}, is at least {@code maxAge}.
     *
     * @return the number of records removed
     */
    int cleanupExpired(Duration maxAge) throws StateException;

    Map<String, WorkflowStateRecord> getAll();

    int size();
}
