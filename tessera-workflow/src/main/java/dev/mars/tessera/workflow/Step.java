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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative contract for one unit of work in a workflow.
 * <p>
 * A step names the executor that performs it ({@code agentType}), the inputs it needs and
 * the outputs it promises. Input and output sets keep declaration order. Instances are
 * immutable.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Step {

    private final String name;
    private final String description;
    private final String agentType;
    private final Set<String> requiredInputs;
    private final Set<String> optionalInputs;
    private final Set<String> outputs;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Map<String, Object> metadata;

    private Step(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Step name cannot be null or empty");
        }
        if (builder.agentType == null || builder.agentType.isBlank()) {
            throw new IllegalArgumentException("Agent type cannot be null or empty for step: " + builder.name);
        }
        if (builder.timeout != null && (builder.timeout.isZero() || builder.timeout.isNegative())) {
            throw new IllegalArgumentException("Timeout must be positive for step: " + builder.name);
        }
        this.name = builder.name;
        this.description = builder.description;
        this.agentType = builder.agentType;
        this.requiredInputs = Collections.unmodifiableSet(new LinkedHashSet<>(builder.requiredInputs));
        LinkedHashSet<String> optional = new LinkedHashSet<>(builder.optionalInputs);
        optional.removeAll(builder.requiredInputs);
        this.optionalInputs = Collections.unmodifiableSet(optional);
        this.outputs = Collections.unmodifiableSet(new LinkedHashSet<>(builder.outputs));
        this.timeout = builder.timeout;
        this.retryPolicy = builder.retryPolicy;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getAgentType() {
        return agentType;
    }

    public Set<String> getRequiredInputs() {
        return requiredInputs;
    }

    public Set<String> getOptionalInputs() {
        return optionalInputs;
    }

    public Set<String> getOutputs() {
        return outputs;
    }

    /**
     * @return the step timeout, or {@code null} to use the engine default
     */
    public Duration getTimeout() {
        return timeout;
    }

    /**
     * @return the step retry policy, or {@code null} to use the engine default
     */
    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Returns the required inputs absent from {@code provided}, in declaration order.
     */
    public List<String> validateInputs(Collection<String> provided) {
        List<String> missing = new ArrayList<>();
        for (String input : requiredInputs) {
            if (provided == null || !provided.contains(input)) {
                missing.add(input);
            }
        }
        return missing;
    }

    public List<String> validateInputs(Map<String, ?> provided) {
        return validateInputs(provided != null ? provided.keySet() : null);
    }

    /**
     * Required inputs followed by optional inputs.
     */
    public Set<String> allInputs() {
        LinkedHashSet<String> all = new LinkedHashSet<>(requiredInputs);
        all.addAll(optionalInputs);
        return Collections.unmodifiableSet(all);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Step step = (Step) o;
        return name.equals(step.name) &&
               Objects.equals(description, step.description) &&
               agentType.equals(step.agentType) &&
               requiredInputs.equals(step.requiredInputs) &&
               optionalInputs.equals(step.optionalInputs) &&
               outputs.equals(step.outputs) &&
               Objects.equals(timeout, step.timeout) &&
               Objects.equals(retryPolicy, step.retryPolicy) &&
               metadata.equals(step.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, agentType, requiredInputs, optionalInputs, outputs, timeout, retryPolicy);
    }

    @Override
    public String toString() {
        return "Step{" +
               "name='" + name + '\'' +
               ", agentType='" + agentType + '\'' +
               ", requiredInputs=" + requiredInputs +
               ", optionalInputs=" + optionalInputs +
               ", outputs=" + outputs +
               ", timeout=" + timeout +
               '}';
    }

    public static final class Builder {
        private final String name;
        private String description;
        private String agentType;
        private final List<String> requiredInputs = new ArrayList<>();
        private final List<String> optionalInputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();
        private Duration timeout;
        private RetryPolicy retryPolicy;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder agentType(String agentType) {
            this.agentType = agentType;
            return this;
        }

        public Builder requiredInputs(String... inputs) {
            return requiredInputs(List.of(inputs));
        }

        public Builder requiredInputs(Collection<String> inputs) {
            this.requiredInputs.addAll(inputs);
            return this;
        }

        public Builder optionalInputs(String... inputs) {
            return optionalInputs(List.of(inputs));
        }

        public Builder optionalInputs(Collection<String> inputs) {
            this.optionalInputs.addAll(inputs);
            return this;
        }

        public Builder outputs(String... names) {
            return outputs(List.of(names));
        }

        public Builder outputs(Collection<String> names) {
            this.outputs.addAll(names);
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
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

        public Step build() {
            return new Step(this);
        }
    }
}
