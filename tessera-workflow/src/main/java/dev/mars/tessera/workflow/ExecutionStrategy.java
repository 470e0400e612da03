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

import java.util.Locale;

/**
 * How the engine walks a workflow's dependency graph.
 */
public enum ExecutionStrategy {
    /** One step at a time in topological order. */
    SEQUENTIAL,
    /** Every ready step of a frontier is dispatched concurrently. */
    PARALLEL,
    /** Frontiers when the graph has any branching, otherwise sequential. */
    ADAPTIVE;

    public static ExecutionStrategy fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Execution strategy cannot be null");
        }
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
