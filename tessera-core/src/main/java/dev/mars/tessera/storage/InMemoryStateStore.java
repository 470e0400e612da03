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
import dev.mars.tessera.core.exceptions.InvalidTransitionException;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.StateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link StateStore} keeping records in a map guarded by a single store-wide lock.
 * <p>
 * Subclasses can make the store durable by overriding {@link #persist(WorkflowStateRecord)}
 * and {@link #erase(String)}, which are called while the lock is held.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryStateStore implements StateStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryStateStore.class);

    static final String STEP_OUTPUT_PREFIX = "step_";

    private final Map<String, WorkflowStateRecord> records = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;

    public InMemoryStateStore() {
        this(Clock.systemUTC());
    }

    public InMemoryStateStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(String workflowId, WorkflowStateRecord record) throws StateException {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
        if (!record.getWorkflowId().equals(workflowId)) {
            throw new IllegalArgumentException("Record workflow ID '" + record.getWorkflowId()
                    + "' does not match key '" + workflowId + "'");
        }
        lock.lock();
        try {
            WorkflowStateRecord previous = records.get(workflowId);
            WorkflowStateRecord toStore = record;
            if (previous != null && record.getUpdatedAt().isBefore(previous.getUpdatedAt())) {
                toStore = record.toBuilder().updatedAt(previous.getUpdatedAt()).build();
            }
            persist(toStore);
            records.put(workflowId, toStore);
            logger.debug("Saved workflow state {}", toStore);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<WorkflowStateRecord> get(String workflowId) {
        lock.lock();
        try {
            return Optional.ofNullable(records.get(workflowId));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String workflowId) throws StateException {
        lock.lock();
        try {
            if (!records.containsKey(workflowId)) {
                return false;
            }
            erase(workflowId);
            records.remove(workflowId);
            logger.debug("Deleted workflow state {}", workflowId);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WorkflowStateRecord updateProgress(String workflowId, double progress, String currentStep)
            throws StateException, NotFoundException {
        checkProgress(workflowId, progress);
        lock.lock();
        try {
            return withProgress(require(workflowId), progress, currentStep);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<WorkflowStateRecord> updateProgress(String workflowId, String executionId, double progress,
                                                        String currentStep) throws StateException {
        checkProgress(workflowId, progress);
        lock.lock();
        try {
            WorkflowStateRecord current = owned(workflowId, executionId);
            return current == null ? Optional.empty() : Optional.of(withProgress(current, progress, currentStep));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WorkflowStateRecord markStepCompleted(String workflowId, String stepName, Map<String, Object> stepOutput)
            throws StateException, NotFoundException {
        checkStepName(stepName);
        lock.lock();
        try {
            return withStepCompleted(require(workflowId), stepName, stepOutput);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<WorkflowStateRecord> markStepCompleted(String workflowId, String executionId, String stepName,
                                                           Map<String, Object> stepOutput) throws StateException {
        checkStepName(stepName);
        lock.lock();
        try {
            WorkflowStateRecord current = owned(workflowId, executionId);
            return current == null ? Optional.empty() : Optional.of(withStepCompleted(current, stepName, stepOutput));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public WorkflowStateRecord updateStatus(String workflowId, ExecutionStatus status, String error)
            throws StateException, NotFoundException {
        checkStatus(status);
        lock.lock();
        try {
            return withStatus(require(workflowId), status, error);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<WorkflowStateRecord> updateStatus(String workflowId, String executionId, ExecutionStatus status,
                                                      String error) throws StateException {
        checkStatus(status);
        lock.lock();
        try {
            WorkflowStateRecord current = owned(workflowId, executionId);
            return current == null ? Optional.empty() : Optional.of(withStatus(current, status, error));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanupExpired(Duration maxAge) throws StateException {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("Max age must be a non-negative duration");
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            List<String> expired = new ArrayList<>();
            for (Map.Entry<String, WorkflowStateRecord> entry : records.entrySet()) {
                Duration age = Duration.between(entry.getValue().getCreatedAt(), now);
                if (age.compareTo(maxAge) >= 0) {
                    expired.add(entry.getKey());
                }
            }
            for (String workflowId : expired) {
                erase(workflowId);
                records.remove(workflowId);
            }
            if (!expired.isEmpty()) {
                logger.info("Cleaned up {} expired workflow states", expired.size());
            }
            return expired.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, WorkflowStateRecord> getAll() {
        lock.lock();
        try {
            return Map.copyOf(records);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    protected Clock getClock() {
        return clock;
    }

    /**
     * Called under the store lock before a record is placed in the map.
     */
    protected void persist(WorkflowStateRecord record) throws StateException {
    }

    /**
     * Called under the store lock before a record is removed from the map.
     */
    protected void erase(String workflowId) throws StateException {
    }

    /**
     * Loads a record without persisting it again; used by subclasses on start-up.
     */
    protected void restore(WorkflowStateRecord record) {
        lock.lock();
        try {
            records.put(record.getWorkflowId(), record);
        } finally {
            lock.unlock();
        }
    }

    private static void checkProgress(String workflowId, double progress) throws StateException {
        if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
            throw new StateException(workflowId, "Progress must be between 0 and 1, got: " + progress);
        }
    }

    private static void checkStepName(String stepName) {
        if (stepName == null || stepName.isBlank()) {
            throw new IllegalArgumentException("Step name cannot be null or empty");
        }
    }

    private static void checkStatus(ExecutionStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
    }

    private WorkflowStateRecord withProgress(WorkflowStateRecord current, double progress, String currentStep)
            throws StateException {
        WorkflowStateRecord.Builder builder = current.toBuilder().progress(progress);
        if (currentStep != null) {
            builder.currentStep(currentStep);
        }
        return replace(builder, current);
    }

    private WorkflowStateRecord withStepCompleted(WorkflowStateRecord current, String stepName,
                                                  Map<String, Object> stepOutput) throws StateException {
        WorkflowStateRecord.Builder builder = current.toBuilder().addStepCompleted(stepName);
        if (stepOutput != null) {
            builder.putData(STEP_OUTPUT_PREFIX + stepName, new LinkedHashMap<>(stepOutput));
        }
        return replace(builder, current);
    }

    private WorkflowStateRecord withStatus(WorkflowStateRecord current, ExecutionStatus status, String error)
            throws StateException {
        if (!current.getStatus().canTransitionTo(status)) {
            throw new InvalidTransitionException(current.getWorkflowId(), current.getStatus(), status);
        }
        WorkflowStateRecord.Builder builder = current.toBuilder().status(status);
        if (error != null) {
            builder.error(error);
        }
        return replace(builder, current);
    }

    /**
     * @return the stored record if it belongs to {@code executionId}, otherwise {@code null}
     */
    private WorkflowStateRecord owned(String workflowId, String executionId) {
        WorkflowStateRecord current = records.get(workflowId);
        if (current == null || !Objects.equals(executionId, current.getExecutionId())) {
            return null;
        }
        return current;
    }

    private WorkflowStateRecord require(String workflowId) throws NotFoundException {
        WorkflowStateRecord current = records.get(workflowId);
        if (current == null) {
            throw new NotFoundException(NotFoundException.STATE, workflowId);
        }
        return current;
    }

    private WorkflowStateRecord replace(WorkflowStateRecord.Builder builder, WorkflowStateRecord current)
            throws StateException {
        Instant now = clock.instant();
        Instant updatedAt = now.isBefore(current.getUpdatedAt()) ? current.getUpdatedAt() : now;
        WorkflowStateRecord updated = builder.updatedAt(updatedAt).build();
        persist(updated);
        records.put(updated.getWorkflowId(), updated);
        return updated;
    }
}
