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


package dev.mars.tessera.workflow;

import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.StateException;
import dev.mars.tessera.storage.WorkflowStateRecord;
import dev.mars.tessera.workflow.exceptions.ConcurrencyLimitException;
import dev.mars.tessera.workflow.exceptions.DuplicateDefinitionException;
import dev.mars.tessera.workflow.exceptions.WorkflowValidationException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Registers workflow definitions and drives their executions.
 */
public interface WorkflowEngine {

    /**
     * Validates and registers a definition. On success the definition is frozen.
     *
     * @return the validation result, which may carry warnings
     * @throws WorkflowValidationException  if the definition is invalid; nothing is registered
     * @throws DuplicateDefinitionException if a definition with the same id is already registered
     */
    ValidationResult register(WorkflowDefinition definition)
            throws WorkflowValidationException, DuplicateDefinitionException;

    /**
     * Starts an execution of a registered workflow with a fresh context.
     *
     * @param workflowId the registered workflow id
     * @param inputData  initial execution data
     * @return a future completing with the result once the execution finishes; it never
     *         completes exceptionally for step or workflow failures
     * @throws NotFoundException         if the workflow is not registered
     * @throws ConcurrencyLimitException if the engine is at its concurrent execution limit
     */
    CompletableFuture<WorkflowResult> execute(String workflowId, Map<String, Object> inputData)
            throws NotFoundException, StateException, ConcurrencyLimitException;

    /**
     * Starts an execution using a caller-created context, which must be pending and belong to
     * {@code workflowId}. {@code inputData} is merged into the context data.
     *
     * @throws StateException if the context is not pending or belongs to another workflow
     */
    CompletableFuture<WorkflowResult> execute(String workflowId, Map<String, Object> inputData,
                                              ExecutionContext context)
            throws NotFoundException, StateException, ConcurrencyLimitException;

    /**
     * Requests cooperative termination: the execution stops before its next step or frontier.
     *
     * @return {@code true} if the execution was terminated, {@code false} if it had already finished
     * @throws NotFoundException if the execution is unknown
     */
    boolean terminate(String executionId, String reason) throws NotFoundException;

    Optional<WorkflowStateRecord> getState(String workflowId);

    void updateState(String workflowId, WorkflowStateRecord record) throws StateException;

    Optional<WorkflowDefinition> getDefinition(String workflowId);

    /**
     * @return a snapshot of a live or recently finished execution
     */
    Optional<ExecutionContext> getExecution(String executionId);

    int getRunningCount();

    void shutdown();
}
