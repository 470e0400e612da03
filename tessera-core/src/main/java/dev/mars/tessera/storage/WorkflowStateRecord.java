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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.mars.tessera.core.ExecutionStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of the persisted progress of one workflow execution.
 * <p>
 * Serialized with snake_case keys; a step name never appears in both
 * {@code steps_completed} and {@code steps_remaining}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"workflow_id", "execution_id", "status", "current_step", "steps_completed",
        "steps_remaining", "progress", "data", "error", "created_at", "updated_at", "metadata"})
public final class WorkflowStateRecord {

    private final String workflowId;
    private final String executionId;
    private final ExecutionStatus status;
    private final String currentStep;
    private final Set<String> stepsCompleted;
    private final Set<String> stepsRemaining;
    private final double progress;
    private final Map<String, Object> data;
    private final String error;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Map<String, Object> metadata;

    @JsonCreator
    WorkflowStateRecord(@JsonProperty("workflow_id") String workflowId,
                        @JsonProperty("execution_id") String executionId,
                        @JsonProperty("status") ExecutionStatus status,
                        @JsonProperty("current_step") String currentStep,
                        @JsonProperty("steps_completed") Collection<String> stepsCompleted,
                        @JsonProperty("steps_remaining") Collection<String> stepsRemaining,
                        @JsonProperty("progress") double progress,
                        @JsonProperty("data") Map<String, Object> data,
                        @JsonProperty("error") String error,
                        @JsonProperty("created_at") Instant createdAt,
                        @JsonProperty("updated_at") Instant updatedAt,
                        @JsonProperty("metadata") Map<String, Object> metadata) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("Workflow ID cannot be null or empty");
        }
        if (progress < 0.0 || progress > 1.0 || Double.isNaN(progress)) {
            throw new IllegalArgumentException("Progress must be between 0 and 1: " + progress);
        }
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.status = status != null ? status : ExecutionStatus.PENDING;
        this.currentStep = currentStep;

        LinkedHashSet<String> completed = stepsCompleted != null
                ? new LinkedHashSet<>(stepsCompleted) : new LinkedHashSet<>();
        LinkedHashSet<String> remaining = stepsRemaining != null
                ? new LinkedHashSet<>(stepsRemaining) : new LinkedHashSet<>();
        remaining.removeAll(completed);
        this.stepsCompleted = Collections.unmodifiableSet(completed);
        this.stepsRemaining = Collections.unmodifiableSet(remaining);

        this.progress = progress;
        this.data = data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Collections.emptyMap();
        this.error = error;
        Instant now = Instant.now();
        this.createdAt = createdAt != null ? createdAt : now;
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Collections.emptyMap();
    }

    public static Builder builder(String workflowId) {
        return new Builder(workflowId);
    }

    public Builder toBuilder() {
        return new Builder(workflowId)
                .executionId(executionId)
                .status(status)
                .currentStep(currentStep)
                .stepsCompleted(stepsCompleted)
                .stepsRemaining(stepsRemaining)
                .progress(progress)
                .data(data)
                .error(error)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .metadata(metadata);
    }

    @JsonProperty("workflow_id")
    public String getWorkflowId() { return workflowId; }

    @JsonProperty("execution_id")
    public String getExecutionId() { return executionId; }

    @JsonProperty("status")
    public ExecutionStatus getStatus() { return status; }

    @JsonProperty("current_step")
    public String getCurrentStep() { return currentStep; }

    @JsonProperty("steps_completed")
    public Set<String> getStepsCompleted() { return stepsCompleted; }

    @JsonProperty("steps_remaining")
    public Set<String> getStepsRemaining() { return stepsRemaining; }

    @JsonProperty("progress")
    public double getProgress() { return progress; }

    @JsonProperty("data")
    public Map<String, Object> getData() { return data; }

    @JsonProperty("error")
    public String getError() { return error; }

    @JsonProperty("created_at")
    public Instant getCreatedAt() { return createdAt; }

    @JsonProperty("updated_at")
    public Instant getUpdatedAt() { return updatedAt; }

    @JsonProperty("metadata")
    public Map<String, Object> getMetadata() { return metadata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStateRecord that = (WorkflowStateRecord) o;
        return Double.compare(that.progress, progress) == 0
                && workflowId.equals(that.workflowId)
                && Objects.equals(executionId, that.executionId)
                && status == that.status
                && Objects.equals(currentStep, that.currentStep)
                && stepsCompleted.equals(that.stepsCompleted)
                && stepsRemaining.equals(that.stepsRemaining)
                && data.equals(that.data)
                && Objects.equals(error, that.error)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workflowId, executionId, status, currentStep, stepsCompleted, progress, updatedAt);
    }

    @Override
    public String toString() {
        return "WorkflowStateRecord{" +
                "workflowId='" + workflowId + '\'' +
                ", executionId='" + executionId + '\'' +
                ", status=" + status +
                ", currentStep='" + currentStep + '\'' +
                ", progress=" + String.format("%.1f%%", progress * 100) +
                ", stepsCompleted=" + stepsCompleted +
                '}';
    }

    public static final class Builder {
        private final String workflowId;
        private String executionId;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private String currentStep;
        private final LinkedHashSet<String> stepsCompleted = new LinkedHashSet<>();
        private final LinkedHashSet<String> stepsRemaining = new LinkedHashSet<>();
        private double progress;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private String error;
        private Instant createdAt;
        private Instant updatedAt;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String workflowId) {
            this.workflowId = workflowId;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder currentStep(String currentStep) {
            this.currentStep = currentStep;
            return this;
        }

        public Builder stepsCompleted(Collection<String> steps) {
            this.stepsCompleted.clear();
            if (steps != null) {
                this.stepsCompleted.addAll(steps);
            }
            return this;
        }

        public Builder addStepCompleted(String step) {
            this.stepsCompleted.add(step);
            this.stepsRemaining.remove(step);
            return this;
        }

        public Builder stepsRemaining(Collection<String> steps) {
            this.stepsRemaining.clear();
            if (steps != null) {
                this.stepsRemaining.addAll(steps);
            }
            return this;
        }

        public Builder progress(double progress) {
            this.progress = progress;
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data.clear();
            if (data != null) {
                this.data.putAll(data);
            }
            return this;
        }

        public Builder putData(String key, Object value) {
            this.data.put(key, value);
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.clear();
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public WorkflowStateRecord build() {
            return new WorkflowStateRecord(workflowId, executionId, status, currentStep, stepsCompleted,
                    stepsRemaining, progress, data, error, createdAt, updatedAt, metadata);
        }
    }
}
