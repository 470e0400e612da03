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


package dev.mars.tessera.workflow.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps agent type names to the factories that create their executors.
 * <p>
 * A shared executor instance can be registered directly; it is wrapped in a factory that
 * always returns the same instance. Thread-safe.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class StepExecutorRegistry {
    private static final Logger logger = LoggerFactory.getLogger(StepExecutorRegistry.class);

    private final Map<String, StepExecutorFactory> factories = new ConcurrentHashMap<>();

    /**
     * Registers a shared executor for {@code agentType}, replacing any previous registration.
     */
    public StepExecutorRegistry register(String agentType, StepExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("Executor cannot be null");
        }
        return registerFactory(agentType, invocation -> executor);
    }

    /**
     * Registers a factory creating a fresh executor per invocation, replacing any previous registration.
     */
    public StepExecutorRegistry registerFactory(String agentType, StepExecutorFactory factory) {
        if (agentType == null || agentType.isBlank()) {
            throw new IllegalArgumentException("Agent type cannot be null or empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("Factory cannot be null");
        }
        StepExecutorFactory previous = factories.put(agentType, factory);
        if (previous != null) {
            logger.info("Replaced executor registration for agent type {}", agentType);
        } else {
            logger.debug("Registered executor for agent type {}", agentType);
        }
        return this;
    }

    public boolean unregister(String agentType) {
        return factories.remove(agentType) != null;
    }

    public Optional<StepExecutorFactory> lookup(String agentType) {
        return Optional.ofNullable(factories.get(agentType));
    }

    public boolean isRegistered(String agentType) {
        return factories.containsKey(agentType);
    }

    public Set<String> getAgentTypes() {
        return new TreeSet<>(factories.keySet());
    }
}
