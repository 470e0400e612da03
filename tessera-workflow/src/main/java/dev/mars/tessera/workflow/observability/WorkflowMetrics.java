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


package dev.mars.tessera.workflow.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the Tessera workflow engine.
 *
 * Provides the following metrics:
 * - tessera.workflow.active (gauge) - Currently running workflow executions
 * - tessera.workflow.total (counter) - Total workflows started
 * - tessera.workflow.completed (counter) - Successfully completed workflows
 * - tessera.workflow.failed (counter) - Failed workflows
 * - tessera.workflow.terminated (counter) - Terminated workflows
 * - tessera.workflow.steps.total (counter) - Total workflow steps executed
 * - tessera.workflow.steps.failed (counter) - Failed workflow steps
 * - tessera.workflow.steps.retried (counter) - Step retries
 * - tessera.workflow.duration.seconds (histogram) - Workflow duration distribution
 * - tessera.workflow.steps.per_workflow (histogram) - Completed steps per workflow
 *
 * The meter comes from {@link GlobalOpenTelemetry}, which is a no-op unless an SDK is installed.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowMetrics {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowMetrics.class);
    private static final String METER_NAME = "tessera-workflow";

    private static WorkflowMetrics instance;

    // Counters
    private final LongCounter workflowsTotal;
    private final LongCounter workflowsCompleted;
    private final LongCounter workflowsFailed;
    private final LongCounter workflowsTerminated;
    private final LongCounter stepsTotal;
    private final LongCounter stepsFailed;
    private final LongCounter stepsRetried;

    // Histograms
    private final DoubleHistogram workflowDuration;
    private final DoubleHistogram stepsPerWorkflow;

    private final AtomicLong activeWorkflows = new AtomicLong(0);

    private static final AttributeKey<String> WORKFLOW_ID_KEY = AttributeKey.stringKey("workflow.id");
    private static final AttributeKey<String> STRATEGY_KEY = AttributeKey.stringKey("execution.strategy");
    private static final AttributeKey<String> AGENT_TYPE_KEY = AttributeKey.stringKey("step.agent_type");
    private static final AttributeKey<String> FAILURE_REASON_KEY = AttributeKey.stringKey("failure.reason");

    private WorkflowMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowsTotal = meter.counterBuilder("tessera.workflow.total")
                .setDescription("Total number of workflows started")
                .setUnit("1")
                .build();

        workflowsCompleted = meter.counterBuilder("tessera.workflow.completed")
                .setDescription("Number of successfully completed workflows")
                .setUnit("1")
                .build();

        workflowsFailed = meter.counterBuilder("tessera.workflow.failed")
                .setDescription("Number of failed workflows")
                .setUnit("1")
                .build();

        workflowsTerminated = meter.counterBuilder("tessera.workflow.terminated")
                .setDescription("Number of terminated workflows")
                .setUnit("1")
                .build();

        stepsTotal = meter.counterBuilder("tessera.workflow.steps.total")
                .setDescription("Total number of workflow steps executed")
                .setUnit("1")
                .build();

        stepsFailed = meter.counterBuilder("tessera.workflow.steps.failed")
                .setDescription("Number of failed workflow steps")
                .setUnit("1")
                .build();

        stepsRetried = meter.counterBuilder("tessera.workflow.steps.retried")
                .setDescription("Number of step retries")
                .setUnit("1")
                .build();

        workflowDuration = meter.histogramBuilder("tessera.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        stepsPerWorkflow = meter.histogramBuilder("tessera.workflow.steps.per_workflow")
                .setDescription("Number of completed steps per workflow")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("tessera.workflow.active")
                .setDescription("Number of currently running workflow executions")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeWorkflows.get()));

        logger.info("WorkflowMetrics initialized");
    }

    public static synchronized WorkflowMetrics getInstance() {
        if (instance == null) {
            instance = new WorkflowMetrics();
        }
        return instance;
    }

    public void recordWorkflowStarted(String workflowId, String strategy) {
        workflowsTotal.add(1, workflowAttributes(workflowId, strategy));
        activeWorkflows.incrementAndGet();
    }

    public void recordWorkflowCompleted(String workflowId, String strategy, double durationSeconds, int stepCount) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = workflowAttributes(workflowId, strategy);
        workflowsCompleted.add(1, attrs);
        workflowDuration.record(durationSeconds, attrs);
        stepsPerWorkflow.record(stepCount, attrs);
    }

    public void recordWorkflowFailed(String workflowId, String strategy, String failureReason) {
        activeWorkflows.decrementAndGet();
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STRATEGY_KEY, strategy)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        workflowsFailed.add(1, attrs);
    }

    public void recordWorkflowTerminated(String workflowId, String strategy) {
        activeWorkflows.decrementAndGet();
        workflowsTerminated.add(1, workflowAttributes(workflowId, strategy));
    }

    public void recordStepExecuted(String workflowId, String agentType) {
        stepsTotal.add(1, stepAttributes(workflowId, agentType));
    }

    public void recordStepFailed(String workflowId, String agentType, String failureReason) {
        Attributes attrs = Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(AGENT_TYPE_KEY, agentType)
                .put(FAILURE_REASON_KEY, failureReason != null ? failureReason : "unknown")
                .build();
        stepsFailed.add(1, attrs);
    }

    public void recordStepRetried(String workflowId, String agentType) {
        stepsRetried.add(1, stepAttributes(workflowId, agentType));
    }

    public long getActiveWorkflows() {
        return activeWorkflows.get();
    }

    private static Attributes workflowAttributes(String workflowId, String strategy) {
        return Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(STRATEGY_KEY, strategy)
                .build();
    }

    private static Attributes stepAttributes(String workflowId, String agentType) {
        return Attributes.builder()
                .put(WORKFLOW_ID_KEY, workflowId)
                .put(AGENT_TYPE_KEY, agentType)
                .build();
    }
}
