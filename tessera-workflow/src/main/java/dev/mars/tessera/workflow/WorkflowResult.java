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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of a finished workflow execution.
 * <p>
 * Step results are kept in completion order. A failed result always names the failed step
 * (when the failure was step-level) and carries at least one error message.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class WorkflowResult {

    private final String workflowId;
    private final String executionId;
    private final ExecutionStatus status;
    private final Map<String, Map<String, Object>> stepResults;
    private final Instant startTime;
    private final Instant endTime;
    private final List<String> errors;
    private final List<String> warnings;
    private final Map<String, Object> metadata;
    private final Map<String, Object> data;
    private final String failedStep;
    private final Throwable cause;

    private WorkflowResult(Builder builder) {
        this.workflowId = Objects.requireNonNull(builder.workflowId, "Workflow ID cannot be null");
        this.executionId = Objects.requireNonNull(builder.executionId, "Execution ID cannot be null");
        this.status = Objects.requireNonNull(builder.status, "Status cannot be null");
        Map<String, Map<String, Object>> results = new LinkedHashMap<>();
        builder.stepResults.forEach((step, output) ->
                results.put(step, Collections.unmodifiableMap(new LinkedHashMap<>(output))));
        this.stepResults = Collections.unmodifiableMap(results);
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.errors = List.copyOf(builder.errors);
        this.warnings = List.copyOf(builder.warnings);
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.data = Collections.unmodifiableMap(new LinkedHashMap<>(builder.data));
        this.failedStep = builder.failedStep;
        this.cause = builder.cause;
    }

    public static Builder builder(String workflowId, String executionId) {
        return new Builder(workflowId, executionId);
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == ExecutionStatus.COMPLETED;
    }

    /**
     * @return the full executor output of each completed step, keyed by step name in completion order
     */
    public Map<String, Map<String, Object>> getStepResults() {
        return stepResults;
    }

    public List<String> getCompletedSteps() {
        return new ArrayList<>(stepResults.keySet());
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return the execution data at the time the execution finished
     */
    public Map<String, Object> getData() {
        return data;
    }

    /**
     * @return the step whose failure ended the execution, or {@code null}
     */
    public String getFailedStep() {
        return failedStep;
    }

    public Throwable getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "WorkflowResult{" +
               "workflowId='" + workflowId + '\'' +
               ", executionId='" + executionId + '\'' +
               ", status=" + status +
               ", completedSteps=" + stepResults.keySet() +
               ", duration=" + getDuration().toMillis() + "ms" +
               (failedStep != null ? ", failedStep='" + failedStep + '\'' : "") +
               (errors.isEmpty() ? "" : ", errors=" + errors) +
               '}';
    }

    public static final class Builder {
        private final String workflowId;
        private final String executionId;
        private ExecutionStatus status;
        private final Map<String, Map<String, Object>> stepResults = new LinkedHashMap<>();
        private Instant startTime;
        private Instant endTime;
        private final List<String> errors = new ArrayList<>();
        private final List<String> warnings = new ArrayList<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final Map<String, Object> data = new LinkedHashMap<>();
        private String failedStep;
        private Throwable cause;

        private Builder(String workflowId, String executionId) {
            this.workflowId = workflowId;
            this.executionId = executionId;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder stepResult(String stepName, Map<String, Object> output) {
            this.stepResults.put(stepName, output != null ? output : Map.of());
            return this;
        }

        public Builder stepResults(Map<String, Map<String, Object>> results) {
            results.forEach(this::stepResult);
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder error(String error) {
            this.errors.add(error);
            return this;
        }

        public Builder warning(String warning) {
            this.warnings.add(warning);
            return this;
        }

        public Builder warnings(List<String> warnings) {
            this.warnings.addAll(warnings);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }

        public Builder data(Map<String, Object> data) {
            this.data.putAll(data);
            return this;
        }

        public Builder failedStep(String failedStep) {
            this.failedStep = failedStep;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public WorkflowResult build() {
            return new WorkflowResult(this);
        }
    }
}
