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

import dev.mars.tessera.config.TesseraConfiguration;
import dev.mars.tessera.core.ExecutionStatus;
import dev.mars.tessera.core.exceptions.InvalidTransitionException;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.StateException;
import dev.mars.tessera.core.exceptions.TesseraException;
import dev.mars.tessera.events.WorkflowEventBus;
import dev.mars.tessera.events.WorkflowEventType;
import dev.mars.tessera.storage.FileStateStore;
import dev.mars.tessera.storage.InMemoryStateStore;
import dev.mars.tessera.storage.StateCleanupScheduler;
import dev.mars.tessera.storage.StateStore;
import dev.mars.tessera.storage.WorkflowStateRecord;
import dev.mars.tessera.workflow.exceptions.ConcurrencyLimitException;
import dev.mars.tessera.workflow.exceptions.DuplicateDefinitionException;
import dev.mars.tessera.workflow.exceptions.MissingInputException;
import dev.mars.tessera.workflow.exceptions.StepException;
import dev.mars.tessera.workflow.exceptions.StepExecutionException;
import dev.mars.tessera.workflow.exceptions.StepTimeoutException;
import dev.mars.tessera.workflow.exceptions.WorkflowException;
import dev.mars.tessera.workflow.exceptions.WorkflowTimeoutException;
import dev.mars.tessera.workflow.exceptions.WorkflowValidationException;
import dev.mars.tessera.workflow.executor.StepExecutorFactory;
import dev.mars.tessera.workflow.executor.StepExecutorRegistry;
import dev.mars.tessera.workflow.executor.StepInvocation;
import dev.mars.tessera.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link WorkflowEngine} that walks a workflow's dependency graph, either one step at a time
 * or frontier by frontier.
 *
 * <p><strong>Execution model:</strong></p>
 * <ul>
 *   <li>Admission is synchronous: unknown workflows, unusable contexts and a full concurrency
 *       cap are reported by {@code execute} itself</li>
 *   <li>Each admitted execution runs on the engine's execution pool; frontier steps are
 *       dispatched to a bounded step pool</li>
 *   <li>Step inputs are read from, and declared outputs merged into, the execution data under
 *       the execution's lock</li>
 *   <li>Retryable step failures are retried with exponential backoff; any other failure fails
 *       the whole execution</li>
 *   <li>Executors are called on a separate invocation pool, so the step timeout also bounds
 *       executors that block before returning</li>
 *   <li>Termination is cooperative and observed between steps, between frontiers and after
 *       each retry backoff</li>
 * </ul>
 *
 * <p>State records are keyed by workflow id, so when the same workflow runs concurrently
 * the record reflects the most recently started execution.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class DagWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(DagWorkflowEngine.class);

    private static final int FINISHED_EXECUTION_RETENTION = 1000;

    private final StepExecutorRegistry executorRegistry;
    private final WorkflowEventBus eventBus;
    private final StateStore stateStore;
    private final WorkflowMetrics metrics;

    private final int maxConcurrentWorkflows;
    private final Duration defaultStepTimeout;
    private final RetryPolicy defaultRetryPolicy;

    private final Map<String, WorkflowDefinition> definitions = new ConcurrentHashMap<>();
    private final Map<String, List<String>> registrationWarnings = new ConcurrentHashMap<>();
    private final Map<String, ExecutionContext> activeExecutions = new ConcurrentHashMap<>();
    private final Map<String, ExecutionContext> finishedExecutions = Collections.synchronizedMap(
            new LinkedHashMap<String, ExecutionContext>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, ExecutionContext> eldest) {
                    return size() > FINISHED_EXECUTION_RETENTION;
                }
            });
    private final Semaphore executionSlots;
    private final ExecutorService executionPool;
    private final ExecutorService stepPool;
    private final ExecutorService invocationPool;

    private boolean ownsEventBus;
    private StateCleanupScheduler cleanupScheduler;
    private volatile boolean shutdown = false;

    public DagWorkflowEngine(StepExecutorRegistry executorRegistry, WorkflowEventBus eventBus,
                             StateStore stateStore, TesseraConfiguration configuration) {
        this.executorRegistry = Objects.requireNonNull(executorRegistry, "Executor registry cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.stateStore = Objects.requireNonNull(stateStore, "State store cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");

        this.maxConcurrentWorkflows = configuration.getMaxConcurrentWorkflows();
        if (maxConcurrentWorkflows < 1) {
            throw new IllegalArgumentException("Max concurrent workflows must be at least 1: " + maxConcurrentWorkflows);
        }
        this.defaultStepTimeout = configuration.getDefaultStepTimeout();
        this.defaultRetryPolicy = RetryPolicy.fromConfiguration(configuration);
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;

        this.executionSlots = new Semaphore(maxConcurrentWorkflows);
        this.executionPool = Executors.newCachedThreadPool(new NamedThreadFactory("tessera-engine"));
        this.stepPool = Executors.newFixedThreadPool(Math.max(1, configuration.getStepWorkers()),
                new NamedThreadFactory("tessera-step"));
        this.invocationPool = Executors.newCachedThreadPool(new NamedThreadFactory("tessera-invoke"));

        logger.info("DagWorkflowEngine started: maxConcurrentWorkflows={}, stepWorkers={}, defaultStepTimeout={}ms",
                maxConcurrentWorkflows, configuration.getStepWorkers(), defaultStepTimeout.toMillis());
    }

    /**
     * Creates an engine with its own event bus and state store built from {@code configuration}.
     * A file-backed store is used when {@code tessera.state.directory} is set, and expired
     * state is cleaned up periodically until {@link #shutdown()}.
     *
     * @throws StateException if the state directory cannot be opened
     */
    public static DagWorkflowEngine fromConfiguration(StepExecutorRegistry executorRegistry,
                                                      TesseraConfiguration configuration) throws StateException {
        StateStore store = configuration.getStateDirectory() != null
                ? new FileStateStore(configuration.getStateDirectory())
                : new InMemoryStateStore();
        DagWorkflowEngine engine = new DagWorkflowEngine(executorRegistry, new WorkflowEventBus(configuration),
                store, configuration);
        engine.ownsEventBus = true;
        engine.cleanupScheduler = new StateCleanupScheduler(store, configuration);
        engine.cleanupScheduler.start();
        return engine;
    }

    public WorkflowEventBus getEventBus() {
        return eventBus;
    }

    public StateStore getStateStore() {
        return stateStore;
    }

    @Override
    public ValidationResult register(WorkflowDefinition definition)
            throws WorkflowValidationException, DuplicateDefinitionException {
        Objects.requireNonNull(definition, "Workflow definition cannot be null");
        ValidationResult result;
        try {
            result = definition.validateOrThrow();
        } catch (WorkflowValidationException e) {
            logger.warn("Rejected workflow {}: {}", definition.getId(), e.getMessage());
            throw e;
        }

        synchronized (definitions) {
            if (definitions.containsKey(definition.getId())) {
                throw new DuplicateDefinitionException(definition.getId());
            }
            definition.freeze();
            definitions.put(definition.getId(), definition);
        }

        List<String> warnings = new ArrayList<>();
        result.getWarnings().forEach(issue -> warnings.add(issue.getMessage()));
        for (Step step : definition.getSteps()) {
            if (!executorRegistry.isRegistered(step.getAgentType())) {
                String warning = "No executor registered for agent type '" + step.getAgentType()
                        + "' used by step '" + step.getName() + "'";
                warnings.add(warning);
                logger.warn("Workflow {}: {}", definition.getId(), warning);
            }
        }
        registrationWarnings.put(definition.getId(), List.copyOf(warnings));
        logger.info("Registered workflow {} ({} steps, strategy {})",
                definition.getId(), definition.getSteps().size(), definition.getStrategy());
        return result;
    }

    @Override
    public CompletableFuture<WorkflowResult> execute(String workflowId, Map<String, Object> inputData)
            throws NotFoundException, StateException, ConcurrencyLimitException {
        return execute(workflowId, inputData, null);
    }

    @Override
    public CompletableFuture<WorkflowResult> execute(String workflowId, Map<String, Object> inputData,
                                                     ExecutionContext context)
            throws NotFoundException, StateException, ConcurrencyLimitException {
        if (shutdown) {
            throw new IllegalStateException("Workflow engine is shut down");
        }
        WorkflowDefinition definition = definitions.get(workflowId);
        if (definition == null) {
            throw new NotFoundException(NotFoundException.WORKFLOW, workflowId);
        }

        ExecutionContext executionContext;
        if (context != null) {
            if (!workflowId.equals(context.getWorkflowId())) {
                throw new StateException(workflowId, "Execution context " + context.getExecutionId()
                        + " belongs to workflow '" + context.getWorkflowId() + "'");
            }
            if (context.getStatus() != ExecutionStatus.PENDING || activeExecutions.containsKey(context.getExecutionId())
                    || finishedExecutions.containsKey(context.getExecutionId())) {
                throw new StateException(workflowId, "Execution context " + context.getExecutionId()
                        + " is " + context.getStatus().wireName() + " and cannot be reused");
            }
            executionContext = context;
        } else {
            executionContext = ExecutionContext.builder(workflowId).build();
        }

        if (!executionSlots.tryAcquire()) {
            int running = activeExecutions.size();
            logger.warn("Rejected execution of workflow {}: {} of {} slots in use",
                    workflowId, running, maxConcurrentWorkflows);
            throw new ConcurrencyLimitException(workflowId, maxConcurrentWorkflows, running);
        }

        executionContext.seed(inputData);
        activeExecutions.put(executionContext.getExecutionId(), executionContext);
        try {
            return CompletableFuture.supplyAsync(() -> run(definition, executionContext), executionPool);
        } catch (RejectedExecutionException e) {
            activeExecutions.remove(executionContext.getExecutionId());
            executionSlots.release();
            throw new IllegalStateException("Workflow engine is shut down", e);
        }
    }

    @Override
    public boolean terminate(String executionId, String reason) throws NotFoundException {
        ExecutionContext context = activeExecutions.get(executionId);
        if (context == null) {
            if (finishedExecutions.containsKey(executionId)) {
                return false;
            }
            throw new NotFoundException(NotFoundException.EXECUTION, executionId);
        }
        if (!context.terminate(reason)) {
            return false;
        }
        logger.info("Terminating execution {} of workflow {}: {}", executionId, context.getWorkflowId(), reason);
        syncStoreStatus(context, ExecutionStatus.TERMINATED, null);
        Map<String, Object> payload = basePayload(context);
        payload.put("reason", reason);
        publish(WorkflowEventType.WORKFLOW_TERMINATED, payload);
        return true;
    }

    @Override
    public Optional<WorkflowStateRecord> getState(String workflowId) {
        return stateStore.get(workflowId);
    }

    @Override
    public void updateState(String workflowId, WorkflowStateRecord record) throws StateException {
        stateStore.save(workflowId, record);
    }

    @Override
    public Optional<WorkflowDefinition> getDefinition(String workflowId) {
        return Optional.ofNullable(definitions.get(workflowId));
    }

    @Override
    public Optional<ExecutionContext> getExecution(String executionId) {
        ExecutionContext context = activeExecutions.get(executionId);
        if (context == null) {
            context = finishedExecutions.get(executionId);
        }
        return context != null ? Optional.of(context.snapshot()) : Optional.empty();
    }

    @Override
    public int getRunningCount() {
        return activeExecutions.size();
    }

    @Override
    public void shutdown() {
        shutdown = true;
        if (cleanupScheduler != null) {
            cleanupScheduler.stop();
        }
        executionPool.shutdown();
        stepPool.shutdown();
        invocationPool.shutdown();
        try {
            if (!executionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                executionPool.shutdownNow();
            }
            if (!stepPool.awaitTermination(5, TimeUnit.SECONDS)) {
                stepPool.shutdownNow();
            }
            if (!invocationPool.awaitTermination(5, TimeUnit.SECONDS)) {
                invocationPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            executionPool.shutdownNow();
            stepPool.shutdownNow();
            invocationPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        if (ownsEventBus) {
            eventBus.shutdown();
        }
        logger.info("DagWorkflowEngine shut down");
    }

    // Execution

    private WorkflowResult run(WorkflowDefinition definition, ExecutionContext context) {
        String workflowId = definition.getId();
        String executionId = context.getExecutionId();
        String strategy = definition.getStrategy().name();
        Map<String, Map<String, Object>> stepResults = Collections.synchronizedMap(new LinkedHashMap<>());
        boolean started = false;
        try {
            try {
                context.transitionTo(ExecutionStatus.RUNNING);
            } catch (InvalidTransitionException e) {
                logger.info("Execution {} of workflow {} was terminated before it started", executionId, workflowId);
                return buildResult(definition, context, stepResults, ExecutionStatus.TERMINATED, null, null);
            }
            started = true;
            if (metrics != null) {
                metrics.recordWorkflowStarted(workflowId, strategy);
            }
            saveInitialState(definition, context);
            logger.info("Starting execution {} of workflow {} ({})", executionId, workflowId, strategy);
            Map<String, Object> startedPayload = basePayload(context);
            startedPayload.put("strategy", strategy.toLowerCase());
            startedPayload.put("input_keys", new ArrayList<>(context.getData().keySet()));
            publish(WorkflowEventType.WORKFLOW_STARTED, startedPayload);

            Instant deadline = definition.getMaxExecutionTime() != null
                    ? context.getStartTime().plus(definition.getMaxExecutionTime())
                    : null;

            if (usesFrontiers(definition)) {
                runFrontiers(definition, context, deadline, stepResults);
            } else {
                runSequential(definition, context, deadline, stepResults);
            }

            if (context.isTerminated()) {
                return finishTerminated(definition, context, stepResults);
            }
            try {
                context.transitionTo(ExecutionStatus.COMPLETED);
            } catch (InvalidTransitionException e) {
                return finishTerminated(definition, context, stepResults);
            }
            updateProgress(context, 1.0, null);
            syncStoreStatus(context, ExecutionStatus.COMPLETED, null);
            Map<String, Object> completedPayload = basePayload(context);
            completedPayload.put("steps_completed", context.completedStepList());
            publish(WorkflowEventType.WORKFLOW_COMPLETED, completedPayload);

            WorkflowResult result = buildResult(definition, context, stepResults, ExecutionStatus.COMPLETED, null, null);
            if (metrics != null) {
                metrics.recordWorkflowCompleted(workflowId, strategy,
                        result.getDuration().toMillis() / 1000.0, stepResults.size());
            }
            logger.info("Execution {} of workflow {} completed in {} ms",
                    executionId, workflowId, result.getDuration().toMillis());
            return result;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return finishFailed(definition, context, stepResults,
                    new WorkflowException(workflowId, "Execution interrupted", e), started);
        } catch (TesseraException e) {
            if (context.isTerminated()) {
                return finishTerminated(definition, context, stepResults);
            }
            return finishFailed(definition, context, stepResults, e, started);
        } catch (RuntimeException e) {
            logger.error("Unexpected error in execution {} of workflow {}", executionId, workflowId, e);
            return finishFailed(definition, context, stepResults,
                    new WorkflowException(workflowId, "Unexpected error: " + e.getMessage(), e), started);
        } finally {
            activeExecutions.remove(executionId);
            finishedExecutions.put(executionId, context);
            executionSlots.release();
        }
    }

    private boolean usesFrontiers(WorkflowDefinition definition) throws WorkflowValidationException {
        switch (definition.getStrategy()) {
            case PARALLEL:
                return true;
            case ADAPTIVE:
                for (List<String> batch : definition.getParallelBatches()) {
                    if (batch.size() > 1) {
                        return true;
                    }
                }
                return false;
            default:
                return false;
        }
    }

    private void runSequential(WorkflowDefinition definition, ExecutionContext context, Instant deadline,
                               Map<String, Map<String, Object>> stepResults)
            throws TesseraException, InterruptedException {
        for (String stepName : definition.getExecutionOrder()) {
            if (!shouldContinue(definition, context, deadline)) {
                return;
            }
            Step step = definition.getStep(stepName).orElseThrow();
            Map<String, Object> output = runStep(definition, context, step, deadline);
            recordStepCompletion(definition, context, step, output, stepResults);
        }
    }

    private void runFrontiers(WorkflowDefinition definition, ExecutionContext context, Instant deadline,
                              Map<String, Map<String, Object>> stepResults)
            throws TesseraException, InterruptedException {
        int total = definition.getSteps().size();
        Set<String> completed = new HashSet<>();
        while (completed.size() < total) {
            if (!shouldContinue(definition, context, deadline)) {
                return;
            }
            List<String> frontier = definition.getParallelSteps(completed);
            if (frontier.isEmpty()) {
                throw new WorkflowException(definition.getId(), "No runnable steps remain; completed " + completed);
            }
            logger.debug("Execution {} dispatching frontier {}", context.getExecutionId(), frontier);

            if (frontier.size() == 1) {
                Step step = definition.getStep(frontier.get(0)).orElseThrow();
                Map<String, Object> output = runStep(definition, context, step, deadline);
                recordStepCompletion(definition, context, step, output, stepResults);
            } else {
                runFrontier(definition, context, frontier, deadline, stepResults);
            }
            completed.addAll(frontier);
        }
    }

    private void runFrontier(WorkflowDefinition definition, ExecutionContext context, List<String> frontier,
                             Instant deadline, Map<String, Map<String, Object>> stepResults)
            throws TesseraException, InterruptedException {
        List<Step> steps = new ArrayList<>(frontier.size());
        List<Future<Map<String, Object>>> futures = new ArrayList<>(frontier.size());
        for (String stepName : frontier) {
            Step step = definition.getStep(stepName).orElseThrow();
            steps.add(step);
            futures.add(stepPool.submit(() -> runStep(definition, context, step, deadline)));
        }

        TesseraException firstFailure = null;
        for (int i = 0; i < steps.size(); i++) {
            Map<String, Object> output;
            try {
                output = futures.get(i).get();
            } catch (InterruptedException e) {
                futures.forEach(future -> future.cancel(true));
                throw e;
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (firstFailure == null) {
                    firstFailure = cause instanceof TesseraException
                            ? (TesseraException) cause
                            : new StepExecutionException(definition.getId(), steps.get(i).getName(),
                                    StepFailureKind.EXECUTION, 1, describe(cause), cause);
                } else {
                    logger.warn("Step {} of execution {} also failed: {}",
                            steps.get(i).getName(), context.getExecutionId(), describe(cause));
                }
                continue;
            }
            recordStepCompletion(definition, context, steps.get(i), output, stepResults);
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    private boolean shouldContinue(WorkflowDefinition definition, ExecutionContext context, Instant deadline)
            throws WorkflowTimeoutException, InterruptedException {
        if (context.isTerminated()) {
            return false;
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Execution " + context.getExecutionId() + " interrupted");
        }
        if (deadline != null && !Instant.now().isBefore(deadline)) {
            throw new WorkflowTimeoutException(definition.getId(), context.getExecutionId(),
                    definition.getMaxExecutionTime());
        }
        return true;
    }

    /**
     * Runs one step to completion, applying its retry policy.
     */
    private Map<String, Object> runStep(WorkflowDefinition definition, ExecutionContext context, Step step,
                                        Instant deadline) throws TesseraException, InterruptedException {
        RetryPolicy policy = step.getRetryPolicy() != null ? step.getRetryPolicy() : defaultRetryPolicy;
        Duration stepTimeout = step.getTimeout() != null ? step.getTimeout() : defaultStepTimeout;
        int retries = 0;
        while (true) {
            int attempt = retries + 1;
            Map<String, Object> inputs = context.resolveInputs(step.allInputs());
            List<String> missing = step.validateInputs(inputs.keySet());
            if (!missing.isEmpty()) {
                throw new MissingInputException(definition.getId(), step.getName(), missing);
            }

            context.setCurrentStep(step.getName());
            updateProgress(context, progressOf(definition, context), step.getName());
            Map<String, Object> startedPayload = stepPayload(context, step);
            startedPayload.put("attempt", attempt);
            publish(WorkflowEventType.STEP_STARTED, startedPayload);
            logger.debug("Execution {} starting step {} (attempt {})", context.getExecutionId(), step.getName(), attempt);

            try {
                Map<String, Object> output = invoke(definition, context, step, inputs, attempt,
                        effectiveTimeout(definition, context, stepTimeout, deadline));
                if (metrics != null) {
                    metrics.recordStepExecuted(definition.getId(), step.getAgentType());
                }
                return output;
            } catch (StepException e) {
                if (metrics != null) {
                    metrics.recordStepFailed(definition.getId(), step.getAgentType(), e.getKind().name());
                }
                if (e instanceof StepTimeoutException && deadline != null && !Instant.now().isBefore(deadline)) {
                    throw new WorkflowTimeoutException(definition.getId(), context.getExecutionId(),
                            definition.getMaxExecutionTime());
                }
                if (context.isTerminated() || !policy.shouldRetry(e.getKind(), retries)) {
                    throw e instanceof StepExecutionException
                            ? ((StepExecutionException) e).withAttempts(attempt)
                            : e;
                }
                Duration delay = policy.computeDelay(retries);
                logger.warn("Step {} of execution {} failed ({}), retrying in {} ms: {}",
                        step.getName(), context.getExecutionId(), e.getKind(), delay.toMillis(), e.getMessage());
                Map<String, Object> retryPayload = stepPayload(context, step);
                retryPayload.put("attempt", attempt);
                retryPayload.put("next_attempt", attempt + 1);
                retryPayload.put("delay_ms", delay.toMillis());
                retryPayload.put("kind", e.getKind().name());
                retryPayload.put("error", e.getMessage());
                publish(WorkflowEventType.STEP_RETRYING, retryPayload);
                if (metrics != null) {
                    metrics.recordStepRetried(definition.getId(), step.getAgentType());
                }
                if (!delay.isZero()) {
                    Thread.sleep(delay.toMillis());
                }
                if (context.isTerminated()) {
                    logger.debug("Execution {} terminated during backoff of step {}",
                            context.getExecutionId(), step.getName());
                    throw e;
                }
                retries++;
            }
        }
    }

    private Map<String, Object> invoke(WorkflowDefinition definition, ExecutionContext context, Step step,
                                       Map<String, Object> inputs, int attempt, Duration timeout)
            throws StepException, InterruptedException {
        String workflowId = definition.getId();
        StepExecutorFactory factory = executorRegistry.lookup(step.getAgentType())
                .orElseThrow(() -> new StepExecutionException(workflowId, step.getName(),
                        StepFailureKind.EXECUTOR_NOT_FOUND,
                        "No executor registered for agent type '" + step.getAgentType() + "'"));

        long deadlineNanos = System.nanoTime() + timeout.toNanos();
        StepInvocation invocation = new StepInvocation(workflowId, context.getExecutionId(), step, attempt);
        Map<String, Object> stepInputs = Collections.unmodifiableMap(inputs);
        Future<CompletableFuture<Map<String, Object>>> dispatch;
        try {
            dispatch = invocationPool.submit(() -> factory.create(invocation).execute(stepInputs));
        } catch (RejectedExecutionException e) {
            throw new StepExecutionException(workflowId, step.getName(), StepFailureKind.EXECUTION, attempt,
                    "Workflow engine is shut down", e);
        }

        // Executors that do their work before returning are bounded by the same timeout
        CompletableFuture<Map<String, Object>> future;
        try {
            future = dispatch.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            dispatch.cancel(true);
            throw new StepTimeoutException(workflowId, step.getName(), timeout);
        } catch (ExecutionException e) {
            throw classify(workflowId, step, attempt, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            dispatch.cancel(true);
            throw e;
        }
        if (future == null) {
            throw new StepExecutionException(workflowId, step.getName(), StepFailureKind.EXECUTION, attempt,
                    "Executor returned no result", null);
        }

        Map<String, Object> output;
        try {
            output = future.get(Math.max(0L, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StepTimeoutException(workflowId, step.getName(), timeout);
        } catch (ExecutionException | CompletionException e) {
            throw classify(workflowId, step, attempt, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            throw new StepExecutionException(workflowId, step.getName(), StepFailureKind.EXECUTION, attempt,
                    "Executor was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }

        if (output == null) {
            output = Map.of();
        }
        List<String> missingOutputs = new ArrayList<>();
        for (String declared : step.getOutputs()) {
            if (!output.containsKey(declared)) {
                missingOutputs.add(declared);
            }
        }
        if (!missingOutputs.isEmpty()) {
            throw new StepExecutionException(workflowId, step.getName(), StepFailureKind.CONTRACT_VIOLATION, attempt,
                    "Declared outputs not produced: " + missingOutputs, null);
        }
        return output;
    }

    private StepException classify(String workflowId, Step step, int attempt, Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof StepException) {
            return (StepException) cause;
        }
        StepFailureKind kind;
        if (cause instanceof TimeoutException) {
            kind = StepFailureKind.TIMEOUT;
        } else if (cause instanceof IOException || cause instanceof UncheckedIOException) {
            kind = StepFailureKind.IO;
        } else {
            kind = StepFailureKind.EXECUTION;
        }
        return new StepExecutionException(workflowId, step.getName(), kind, attempt, describe(cause), cause);
    }

    private Duration effectiveTimeout(WorkflowDefinition definition, ExecutionContext context, Duration stepTimeout,
                                      Instant deadline) throws WorkflowTimeoutException {
        if (deadline == null) {
            return stepTimeout;
        }
        Duration remaining = Duration.between(Instant.now(), deadline);
        if (remaining.isZero() || remaining.isNegative()) {
            throw new WorkflowTimeoutException(definition.getId(), context.getExecutionId(),
                    definition.getMaxExecutionTime());
        }
        return remaining.compareTo(stepTimeout) < 0 ? remaining : stepTimeout;
    }

    private void recordStepCompletion(WorkflowDefinition definition, ExecutionContext context, Step step,
                                      Map<String, Object> output, Map<String, Map<String, Object>> stepResults)
            throws TesseraException {
        if (!context.completeStep(step.getName(), output, step.getOutputs())) {
            logger.debug("Discarding output of step {}: execution {} was terminated",
                    step.getName(), context.getExecutionId());
            return;
        }
        stepResults.put(step.getName(), output);
        stateStore.markStepCompleted(definition.getId(), context.getExecutionId(), step.getName(), output);
        updateProgress(context, progressOf(definition, context), step.getName());

        Map<String, Object> payload = stepPayload(context, step);
        payload.put("output", new LinkedHashMap<>(output));
        payload.put("progress", progressOf(definition, context));
        publish(WorkflowEventType.STEP_COMPLETED, payload);
        logger.debug("Execution {} completed step {}", context.getExecutionId(), step.getName());
    }

    private WorkflowResult finishFailed(WorkflowDefinition definition, ExecutionContext context,
                                        Map<String, Map<String, Object>> stepResults, TesseraException error,
                                        boolean started) {
        String failedStep = failedStepOf(error, context);
        String message = failedStep != null
                ? "Step '" + failedStep + "' failed: " + error.getMessage()
                : error.getMessage();
        if (!context.fail(message)) {
            return finishTerminated(definition, context, stepResults);
        }
        logger.error("Execution {} of workflow {} failed: {}", context.getExecutionId(), definition.getId(), message);

        syncStoreStatus(context, ExecutionStatus.FAILED, message);
        if (failedStep != null) {
            Map<String, Object> stepPayload = basePayload(context);
            stepPayload.put("step", failedStep);
            stepPayload.put("error", error.getMessage());
            if (error instanceof StepException) {
                stepPayload.put("kind", ((StepException) error).getKind().name());
            }
            publish(WorkflowEventType.STEP_FAILED, stepPayload);
        }
        Map<String, Object> payload = basePayload(context);
        payload.put("error", message);
        payload.put("failed_step", failedStep);
        publish(WorkflowEventType.WORKFLOW_FAILED, payload);

        if (metrics != null && started) {
            metrics.recordWorkflowFailed(definition.getId(), definition.getStrategy().name(),
                    error.getClass().getSimpleName());
        }
        return buildResult(definition, context, stepResults, ExecutionStatus.FAILED, failedStep, error);
    }

    private WorkflowResult finishTerminated(WorkflowDefinition definition, ExecutionContext context,
                                            Map<String, Map<String, Object>> stepResults) {
        syncStoreStatus(context, ExecutionStatus.TERMINATED, null);
        if (metrics != null) {
            metrics.recordWorkflowTerminated(definition.getId(), definition.getStrategy().name());
        }
        logger.info("Execution {} of workflow {} terminated: {}",
                context.getExecutionId(), definition.getId(), context.getTerminationReason());
        return buildResult(definition, context, stepResults, ExecutionStatus.TERMINATED, null, null);
    }

    private WorkflowResult buildResult(WorkflowDefinition definition, ExecutionContext context,
                                       Map<String, Map<String, Object>> stepResults, ExecutionStatus status,
                                       String failedStep, Throwable cause) {
        WorkflowResult.Builder builder = WorkflowResult.builder(definition.getId(), context.getExecutionId())
                .status(status)
                .startTime(context.getStartTime() != null ? context.getStartTime() : Instant.now())
                .endTime(context.getEndTime() != null ? context.getEndTime() : Instant.now())
                .data(context.getData())
                .metadata(context.getMetadata())
                .warnings(registrationWarnings.getOrDefault(definition.getId(), List.of()))
                .failedStep(failedStep)
                .cause(cause);
        synchronized (stepResults) {
            builder.stepResults(stepResults);
        }
        if (status == ExecutionStatus.FAILED && context.getError() != null) {
            builder.error(context.getError());
        } else if (status == ExecutionStatus.TERMINATED) {
            String reason = context.getTerminationReason();
            builder.error("Execution terminated" + (reason != null ? ": " + reason : ""));
        }
        return builder.build();
    }

    private String failedStepOf(TesseraException error, ExecutionContext context) {
        if (error instanceof StepException) {
            return ((StepException) error).getStepName();
        }
        if (error instanceof MissingInputException) {
            return ((MissingInputException) error).getStepName();
        }
        if (error instanceof WorkflowTimeoutException) {
            return null;
        }
        return context.getCurrentStep();
    }

    // State store helpers

    private void saveInitialState(WorkflowDefinition definition, ExecutionContext context) throws StateException {
        WorkflowStateRecord record = WorkflowStateRecord.builder(definition.getId())
                .executionId(context.getExecutionId())
                .status(ExecutionStatus.RUNNING)
                .stepsRemaining(definition.getStepNames())
                .progress(0.0)
                .data(context.getData())
                .metadata(context.getMetadata())
                .createdAt(context.getStartTime())
                .updatedAt(context.getStartTime())
                .build();
        stateStore.save(definition.getId(), record);
    }

    private void updateProgress(ExecutionContext context, double progress, String currentStep) throws StateException {
        stateStore.updateProgress(context.getWorkflowId(), context.getExecutionId(), progress, currentStep);
    }

    /**
     * Moves this execution's state record to {@code status} when the record still belongs to
     * it and the transition is allowed. Store failures are logged; the execution outcome stands.
     */
    private void syncStoreStatus(ExecutionContext context, ExecutionStatus status, String error) {
        try {
            stateStore.updateStatus(context.getWorkflowId(), context.getExecutionId(), status, error);
        } catch (InvalidTransitionException e) {
            logger.debug("State record of execution {} already settled: {}", context.getExecutionId(), e.getMessage());
        } catch (StateException e) {
            logger.warn("Could not record status {} for execution {}: {}",
                    status, context.getExecutionId(), e.getMessage());
        }
    }

    private static double progressOf(WorkflowDefinition definition, ExecutionContext context) {
        int total = definition.getSteps().size();
        return total == 0 ? 1.0 : Math.min(1.0, (double) context.getCompletedSteps().size() / total);
    }

    // Events

    private void publish(WorkflowEventType type, Map<String, Object> payload) {
        try {
            eventBus.publish(type, payload).join();
        } catch (CompletionException e) {
            logger.warn("Delivery of event {} failed: {}", type, describe(e.getCause()));
        }
    }

    private static Map<String, Object> basePayload(ExecutionContext context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(WorkflowEventBus.WORKFLOW_ID_KEY, context.getWorkflowId());
        payload.put("execution_id", context.getExecutionId());
        return payload;
    }

    private static Map<String, Object> stepPayload(ExecutionContext context, Step step) {
        Map<String, Object> payload = basePayload(context);
        payload.put("step", step.getName());
        payload.put("agent_type", step.getAgentType());
        return payload;
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
