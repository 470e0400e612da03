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


package dev.mars.tessera.examples;

import dev.mars.tessera.config.TesseraConfiguration;
import dev.mars.tessera.events.EventHandler;
import dev.mars.tessera.events.WorkflowEventBus;
import dev.mars.tessera.events.WorkflowEventType;
import dev.mars.tessera.examples.util.ExampleLogger;
import dev.mars.tessera.workflow.DagWorkflowEngine;
import dev.mars.tessera.workflow.ValidationResult;
import dev.mars.tessera.workflow.WorkflowDefinition;
import dev.mars.tessera.workflow.WorkflowDefinitionParser;
import dev.mars.tessera.workflow.WorkflowResult;
import dev.mars.tessera.workflow.YamlWorkflowDefinitionParser;
import dev.mars.tessera.workflow.exceptions.WorkflowParseException;
import dev.mars.tessera.workflow.executor.StepExecutorRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the requirements-analysis workflow end to end with stub agents.
 * This example shows how to:
 * 1. Load a YAML workflow definition from the classpath
 * 2. Register stub executors and the workflow with the engine
 * 3. Follow execution through lifecycle events
 * 4. Recover from a transient agent failure through the step retry policy
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class RequirementsAnalysisExample {

    static final String WORKFLOW_RESOURCE = "/workflows/requirements-analysis-workflow.yaml";

    private static final ExampleLogger log = ExampleLogger.getLogger(RequirementsAnalysisExample.class);

    public static void main(String[] args) {
        log.header("Tessera Requirements Analysis Example");
        try {
            WorkflowResult result = new RequirementsAnalysisExample().runExample(new TesseraConfiguration());
            if (!result.isSuccess()) {
                log.failure("Workflow finished with status " + result.getStatus() + ": " + result.getErrors());
                System.exit(1);
            }
            log.completion("Requirements Analysis Example");
        } catch (Exception e) {
            log.failure("Unexpected error during example execution", e);
            System.exit(1);
        }
    }

    public WorkflowResult runExample(TesseraConfiguration configuration) throws Exception {
        log.step(1, "Registering stub agents...");
        StepExecutorRegistry registry = RequirementsAgents.registerAll(new StepExecutorRegistry());
        // the technical analyst is briefly unreachable; its retry policy covers I/O failures
        registry.register(RequirementsAgents.TECHNICAL_ANALYST, RequirementsAgents.failingFirst(1,
                new IOException("technical analysis service unavailable"),
                RequirementsAgents::analyzeTechnology));

        DagWorkflowEngine engine = DagWorkflowEngine.fromConfiguration(registry, configuration);
        try {
            log.step(2, "Loading workflow definition...");
            WorkflowDefinition definition = loadDefinition();
            log.detail("Workflow: " + definition.getName() + " v" + definition.getVersion());
            log.detail("Steps: " + definition.getStepNames());
            log.detail("Execution order: " + definition.getExecutionOrder());

            log.step(3, "Registering workflow...");
            ValidationResult validation = engine.register(definition);
            validation.getWarnings().forEach(issue -> log.warning(issue.getMessage()));
            log.success("Workflow '" + definition.getId() + "' registered");

            log.step(4, "Subscribing to lifecycle events...");
            subscribe(engine.getEventBus());

            log.step(5, "Executing workflow...");
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("initial_requirements", "Customers place orders online. Orders are approved by a manager. "
                    + "Every change is audited. Reports are exported monthly");
            input.put("project_context", "order management platform");
            WorkflowResult result = engine.execute(definition.getId(), input).get(5, TimeUnit.MINUTES);

            log.step(6, "Results");
            log.detail("Status: " + result.getStatus());
            log.detail("Completed steps: " + result.getCompletedSteps());
            log.detail("Duration: " + result.getDuration().toMillis() + " ms");
            if (result.isSuccess()) {
                log.success("Requirements document produced");
                log.detail(String.valueOf(result.getData().get("requirements_document")));
            } else {
                log.failure("Failed step: " + result.getFailedStep());
            }
            engine.getState(definition.getId()).ifPresent(state ->
                    log.detail("Stored state: " + state.getStatus() + ", progress " + state.getProgress()));
            return result;
        } finally {
            engine.shutdown();
        }
    }

    static WorkflowDefinition loadDefinition() throws IOException, WorkflowParseException {
        try (InputStream in = RequirementsAnalysisExample.class.getResourceAsStream(WORKFLOW_RESOURCE)) {
            if (in == null) {
                throw new IOException("Workflow resource not found: " + WORKFLOW_RESOURCE);
            }
            WorkflowDefinitionParser parser = new YamlWorkflowDefinitionParser();
            return parser.parseFromString(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    private static void subscribe(WorkflowEventBus eventBus) {
        EventHandler stepHandler = payload -> log.event(payload.get("step") + " "
                + (payload.containsKey("output") ? "completed" : "started (attempt " + payload.get("attempt") + ")"));
        eventBus.subscribe(WorkflowEventType.STEP_STARTED, stepHandler);
        eventBus.subscribe(WorkflowEventType.STEP_COMPLETED, stepHandler);
        eventBus.subscribe(WorkflowEventType.STEP_RETRYING, payload -> log.warning(payload.get("step")
                + " failed (" + payload.get("error") + "), retrying in " + payload.get("delay_ms") + " ms"));
        eventBus.subscribe(WorkflowEventType.WORKFLOW_COMPLETED, payload ->
                log.event("workflow " + payload.get(WorkflowEventBus.WORKFLOW_ID_KEY) + " completed"));
        eventBus.subscribe(WorkflowEventType.WORKFLOW_FAILED, payload ->
                log.failure("workflow failed: " + payload.get("error")));
    }
}
