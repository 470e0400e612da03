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

import dev.mars.tessera.core.ExecutionStatus;
import dev.mars.tessera.core.exceptions.InvalidTransitionException;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable state of one workflow execution.
 * <p>
 * Only the engine mutates a context, through package-private methods that all take the
 * context's lock. Public accessors return copies, so callers always see a consistent view.
 * A context may be created by a caller and handed to the engine while it is still
 * {@link ExecutionStatus#PENDING}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class ExecutionContext {

    private final String workflowId;
    private final String executionId;
    private final ReentrantLock lock = new ReentrantLock();

    private ExecutionStatus status;
    private Instant startTime;
    private Instant endTime;
    private String currentStep;
    private final Map<String, Object> data;
    private final Map<String, Object> metadata;
    private final Set<String> completedSteps;
    private String error;
    private String terminationReason;

    private ExecutionContext(String workflowId, String executionId, Map<String, Object> data,
                             Map<String, Object> metadata) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.status = ExecutionStatus.PENDING;
        this.data = new LinkedHashMap<>(data != null ? data : Map.of());
        this.metadata = new LinkedHashMap<>(metadata != null ? metadata : Map.of());
        this.completedSteps = new LinkedHashSet<>();
    }

    public static Builder builder(String workflowId) {
        return new Builder(workflowId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public Instant getStartTime() {
        lock.lock();
        try {
            return startTime;
        } finally {
            lock.unlock();
        }
    }

    public Instant getEndTime() {
        lock.lock();
        try {
            return endTime;
        } finally {
            lock.unlock();
        }
    }

    public String getCurrentStep() {
        lock.lock();
        try {
            return currentStep;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getData() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(data));
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getMetadata() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> getCompletedSteps() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(completedSteps));
        } finally {
            lock.unlock();
        }
    }

    public String getError() {
        lock.lock();
        try {
            return error;
        } finally {
            lock.unlock();
        }
    }

    public String getTerminationReason() {
        lock.lock();
        try {
            return terminationReason;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a detached copy of this context.
     */
    public ExecutionContext snapshot() {
        lock.lock();
        try {
            ExecutionContext copy = new ExecutionContext(workflowId, executionId, data, metadata);
            copy.status = status;
            copy.startTime = startTime;
            copy.endTime = endTime;
            copy.currentStep = currentStep;
            copy.completedSteps.addAll(completedSteps);
            copy.error = error;
            copy.terminationReason = terminationReason;
            return copy;
        } finally {
            lock.unlock();
        }
    }

    // Engine-mediated mutators

    void transitionTo(ExecutionStatus target) throws InvalidTransitionException {
        lock.lock();
        try {
            if (!status.canTransitionTo(target)) {
                throw new InvalidTransitionException(executionId, status, target);
            }
            status = target;
            Instant now = Instant.now();
            if (target == ExecutionStatus.RUNNING && startTime == null) {
                startTime = now;
            }
            if (target.isTerminal()) {
                endTime = now;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to FAILED unless already terminal.
     *
     * @return {@code true} if the status changed
     */
    boolean fail(String message) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            status = ExecutionStatus.FAILED;
            error = message;
            endTime = Instant.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves to TERMINATED unless already terminal.
     *
     * @return {@code true} if the status changed
     */
    boolean terminate(String reason) {
        lock.lock();
        try {
            if (status.isTerminal()) {
                return false;
            }
            status = ExecutionStatus.TERMINATED;
            terminationReason = reason;
            endTime = Instant.now();
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean isTerminated() {
        return getStatus() == ExecutionStatus.TERMINATED;
    }

    void setCurrentStep(String stepName) {
        lock.lock();
        try {
            currentStep = stepName;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves the named inputs that are present in the data map.
     */
    Map<String, Object> resolveInputs(Collection<String> names) {
        lock.lock();
        try {
            Map<String, Object> inputs = new LinkedHashMap<>();
            for (String name : names) {
                if (data.containsKey(name)) {
                    inputs.put(name, data.get(name));
                }
            }
            return inputs;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Merges the declared outputs of a completed step and records it as completed, unless the
     * execution has been terminated meanwhile.
     *
     * @return {@code false} if the outputs were discarded because the execution was terminated
     */
    boolean completeStep(String stepName, Map<String, Object> output, Collection<String> declaredOutputs) {
        lock.lock();
        try {
            if (status == ExecutionStatus.TERMINATED) {
                return false;
            }
            for (String key : declaredOutputs) {
                data.put(key, output.get(key));
            }
            completedSteps.add(stepName);
            return true;
        } finally {
            lock.unlock();
        }
    }

    void seed(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            data.putAll(input);
        } finally {
            lock.unlock();
        }
    }

    void putMetadata(String key, Object value) {
        lock.lock();
        try {
            metadata.put(key, value);
        } finally {
            lock.unlock();
        }
    }

    List<String> completedStepList() {
        lock.lock();
        try {
            return List.copyOf(completedSteps);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "ExecutionContext{" +
               "workflowId='" + workflowId + '\'' +
               ", executionId='" + executionId + '\'' +
               ", status=" + getStatus() +
               ", currentStep='" + getCurrentStep() + '\'' +
               '}';
    }

    /**
     * Builder for ExecutionContext.
     */
    public static class Builder {
        private final String workflowId;
        private String executionId;
        private Map<String, Object> data = Map.of();
        private Map<String, Object> metadata = Map.of();

        private Builder(String workflowId) {
            this.workflowId = workflowId;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public ExecutionContext build() {
            if (executionId == null) {
                executionId = UUID.randomUUID().toString();
            }
            return new ExecutionContext(workflowId, executionId, data, metadata);
        }
    }
}
