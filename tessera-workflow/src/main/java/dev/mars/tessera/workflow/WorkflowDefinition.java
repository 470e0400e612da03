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

import dev.mars.tessera.workflow.exceptions.WorkflowValidationException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A workflow: an ordered list of {@link Step}s plus the dependencies between them.
 * <p>
 * Dependencies are keyed by the dependent step; each value lists the steps it requires.
 * A definition may be built up with {@link #addStep(Step)} and {@link #addDependency(String, String)}
 * until it is registered with an engine, at which point it is frozen and every structural
 * mutator throws {@link IllegalStateException}. Definitions are not thread-safe until frozen.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowDefinition {

    private final String id;
    private final String name;
    private final String description;
    private final String version;
    private final ExecutionStrategy strategy;
    private final Duration maxExecutionTime;
    private final Map<String, Object> metadata;

    private final List<Step> steps = new ArrayList<>();
    private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
    private final Set<String> initialInputs = new LinkedHashSet<>();

    private volatile boolean frozen;
    private volatile DependencyGraph frozenGraph;

    private WorkflowDefinition(Builder builder) {
        if (builder.id == null || builder.id.isBlank()) {
            throw new IllegalArgumentException("Workflow ID cannot be null or empty");
        }
        if (builder.maxExecutionTime != null
                && (builder.maxExecutionTime.isZero() || builder.maxExecutionTime.isNegative())) {
            throw new IllegalArgumentException("Max execution time must be positive");
        }
        this.id = builder.id;
        this.name = builder.name != null ? builder.name : builder.id;
        this.description = builder.description;
        this.version = builder.version;
        this.strategy = Objects.requireNonNull(builder.strategy, "Execution strategy cannot be null");
        this.maxExecutionTime = builder.maxExecutionTime;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.steps.addAll(builder.steps);
        builder.dependencies.forEach((step, required) -> dependencies.put(step, new ArrayList<>(required)));
        this.initialInputs.addAll(builder.initialInputs);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getVersion() {
        return version;
    }

    public ExecutionStrategy getStrategy() {
        return strategy;
    }

    /**
     * @return the maximum wall-clock time of one execution, or {@code null} for no limit
     */
    public Duration getMaxExecutionTime() {
        return maxExecutionTime;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public List<Step> getSteps() {
        return List.copyOf(steps);
    }

    public List<String> getStepNames() {
        List<String> names = new ArrayList<>(steps.size());
        for (Step step : steps) {
            names.add(step.getName());
        }
        return names;
    }

    public Map<String, List<String>> getDependencies() {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        dependencies.forEach((step, required) -> copy.put(step, List.copyOf(required)));
        return Collections.unmodifiableMap(copy);
    }

    public Set<String> getInitialInputs() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(initialInputs));
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<Step> getStep(String stepName) {
        for (Step step : steps) {
            if (step.getName().equals(stepName)) {
                return Optional.of(step);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the steps {@code stepName} requires, in declaration order of the dependency list
     */
    public List<String> getStepDependencies(String stepName) {
        List<String> required = dependencies.get(stepName);
        return required != null ? List.copyOf(required) : List.of();
    }

    /**
     * @return the steps that directly require {@code stepName}
     */
    public List<String> getDependentSteps(String stepName) {
        return graph().getDependents(stepName);
    }

    public void addStep(Step step) {
        checkMutable();
        steps.add(Objects.requireNonNull(step, "Step cannot be null"));
    }

    /**
     * Records that {@code to} cannot start until {@code from} has completed.
     */
    public void addDependency(String from, String to) {
        checkMutable();
        Objects.requireNonNull(from, "Dependency source cannot be null");
        Objects.requireNonNull(to, "Dependency target cannot be null");
        List<String> required = dependencies.computeIfAbsent(to, key -> new ArrayList<>());
        if (!required.contains(from)) {
            required.add(from);
        }
    }

    public void addInitialInput(String input) {
        checkMutable();
        initialInputs.add(Objects.requireNonNull(input, "Input name cannot be null"));
    }

    /**
     * Validates structure, then input/output connectivity. Connectivity is only checked when
     * the structure is sound.
     */
    public ValidationResult validate() {
        ValidationResult result = new ValidationResult();

        if (steps.isEmpty()) {
            result.addError(ValidationCode.EMPTY_WORKFLOW, "steps", "Workflow '" + id + "' has no steps");
            return result;
        }

        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (Step step : steps) {
            if (!seen.add(step.getName()) && reported.add(step.getName())) {
                result.addError(ValidationCode.DUPLICATE_STEP, "steps." + step.getName(),
                        "Duplicate step name: " + step.getName());
            }
        }

        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            String dependent = entry.getKey();
            String path = "dependencies." + dependent;
            if (!seen.contains(dependent)) {
                result.addError(ValidationCode.UNKNOWN_STEP, path,
                        "Dependency declared for unknown step: " + dependent);
            }
            for (String required : entry.getValue()) {
                if (required.equals(dependent)) {
                    result.addError(ValidationCode.SELF_DEPENDENCY, path,
                            "Step '" + dependent + "' cannot depend on itself");
                } else if (!seen.contains(required)) {
                    result.addError(ValidationCode.UNKNOWN_STEP, path,
                            "Step '" + dependent + "' depends on unknown step: " + required);
                }
            }
        }

        if (!result.isValid()) {
            return result;
        }

        DependencyGraph graph = graph();
        List<String> cycle = graph.findCycle();
        if (!cycle.isEmpty()) {
            result.addError(ValidationCode.CYCLE, "dependencies." + cycle.get(0),
                    "Circular dependency detected at step '" + cycle.get(0) + "': " + String.join(" -> ", cycle));
            return result;
        }

        checkConnectivity(graph.topologicalOrder().orElseThrow(), result);
        return result;
    }

    private void checkConnectivity(List<String> order, ValidationResult result) {
        Set<String> available = new LinkedHashSet<>(initialInputs);
        Map<String, String> producers = new LinkedHashMap<>();
        Set<String> everything = new HashSet<>(initialInputs);
        for (Step step : steps) {
            everything.addAll(step.getOutputs());
        }

        for (String stepName : order) {
            Step step = getStep(stepName).orElseThrow();
            List<String> missing = step.validateInputs(available);
            if (!missing.isEmpty()) {
                result.addError(ValidationCode.UNSATISFIED_INPUT, "steps." + stepName + ".requiredInputs",
                        "Step '" + stepName + "' requires inputs that no earlier step or initial input provides: "
                                + missing);
            }
            for (String optional : step.getOptionalInputs()) {
                if (!everything.contains(optional)) {
                    result.addWarning(ValidationCode.UNSUPPLIED_OPTIONAL_INPUT, "steps." + stepName + ".optionalInputs",
                            "Optional input '" + optional + "' of step '" + stepName + "' is never produced");
                }
            }
            for (String output : step.getOutputs()) {
                String previous = producers.putIfAbsent(output, stepName);
                if (previous != null) {
                    result.addWarning(ValidationCode.DUPLICATE_OUTPUT, "steps." + stepName + ".outputs",
                            "Output '" + output + "' is produced by both '" + previous + "' and '" + stepName + "'");
                }
            }
            available.addAll(step.getOutputs());
        }
    }

    /**
     * @return the validation result, which may carry warnings
     * @throws WorkflowValidationException if validation produced any error
     */
    public ValidationResult validateOrThrow() throws WorkflowValidationException {
        ValidationResult result = validate();
        if (!result.isValid()) {
            throw new WorkflowValidationException(id, result);
        }
        return result;
    }

    /**
     * Topological order of the steps, with ties broken by declaration order.
     *
     * @throws WorkflowValidationException if the dependencies contain a cycle
     */
    public List<String> getExecutionOrder() throws WorkflowValidationException {
        Optional<List<String>> order = graph().topologicalOrder();
        if (order.isEmpty()) {
            throw cycleError();
        }
        return order.get();
    }

    /**
     * Frontier decomposition of the graph: each batch may run concurrently once all earlier
     * batches are complete.
     *
     * @throws WorkflowValidationException if the dependencies contain a cycle
     */
    public List<List<String>> getParallelBatches() throws WorkflowValidationException {
        Optional<List<List<String>>> batches = graph().parallelBatches();
        if (batches.isEmpty()) {
            throw cycleError();
        }
        return batches.get();
    }

    /**
     * Steps not yet completed whose dependencies are all in {@code completed}.
     */
    public List<String> getParallelSteps(Set<String> completed) {
        return graph().readyNodes(completed != null ? completed : Set.of());
    }

    /**
     * Steps directly gated by {@code currentStep} that became ready; with {@code null},
     * the root steps not yet completed.
     */
    public List<String> getNextSteps(String currentStep, Set<String> completed) {
        return graph().nextNodes(currentStep, completed != null ? completed : Set.of());
    }

    void freeze() {
        if (!frozen) {
            frozenGraph = buildGraph();
            frozen = true;
        }
    }

    DependencyGraph graph() {
        DependencyGraph graph = frozenGraph;
        return graph != null ? graph : buildGraph();
    }

    private DependencyGraph buildGraph() {
        return new DependencyGraph(getStepNames(), dependencies);
    }

    private WorkflowValidationException cycleError() {
        ValidationResult result = new ValidationResult();
        List<String> cycle = graph().findCycle();
        String at = cycle.isEmpty() ? "" : " at step '" + cycle.get(0) + "'";
        result.addError(ValidationCode.CYCLE, "dependencies",
                "Circular dependency detected" + at + ": " + String.join(" -> ", cycle));
        return new WorkflowValidationException(id, result);
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Workflow '" + id + "' is registered and can no longer be modified");
        }
    }

    @Override
    public String toString() {
        return "WorkflowDefinition{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", strategy=" + strategy +
               ", steps=" + getStepNames() +
               ", dependencies=" + dependencies +
               '}';
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private String version = "1.0.0";
        private ExecutionStrategy strategy = ExecutionStrategy.SEQUENTIAL;
        private Duration maxExecutionTime;
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final List<Step> steps = new ArrayList<>();
        private final Map<String, List<String>> dependencies = new LinkedHashMap<>();
        private final Set<String> initialInputs = new LinkedHashSet<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder strategy(ExecutionStrategy strategy) {
            this.strategy = strategy;
            return this;
        }

        public Builder maxExecutionTime(Duration maxExecutionTime) {
            this.maxExecutionTime = maxExecutionTime;
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder step(Step step) {
            this.steps.add(Objects.requireNonNull(step, "Step cannot be null"));
            return this;
        }

        /**
         * Declares that {@code stepName} requires every step in {@code requiredSteps}.
         */
        public Builder dependency(String stepName, String... requiredSteps) {
            return dependency(stepName, List.of(requiredSteps));
        }

        public Builder dependency(String stepName, Collection<String> requiredSteps) {
            List<String> required = this.dependencies.computeIfAbsent(stepName, key -> new ArrayList<>());
            for (String step : requiredSteps) {
                if (!required.contains(step)) {
                    required.add(step);
                }
            }
            return this;
        }

        public Builder initialInputs(String... inputs) {
            return initialInputs(List.of(inputs));
        }

        public Builder initialInputs(Collection<String> inputs) {
            this.initialInputs.addAll(inputs);
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(this);
        }
    }
}
