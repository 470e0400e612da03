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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Classification of a step failure, used to decide whether a retry policy applies.
 */
public enum StepFailureKind {
    /** The executor did not answer within the step timeout. */
    TIMEOUT,
    /** The executor raised an error that is not I/O related. */
    EXECUTION,
    /** The executor failed with an I/O error, typically transient. */
    IO,
    /** The executor returned without producing every declared output. */
    CONTRACT_VIOLATION,
    /** No executor is registered for the step's agent type. */
    EXECUTOR_NOT_FOUND;

    /**
     * Kinds retried when a step declares no explicit list.
     */
    public static Set<StepFailureKind> defaultRetryable() {
        return EnumSet.of(TIMEOUT, IO);
    }

    /**
     * Parses a kind name, accepting any case and {@code -} as a separator.
     *
     * @throws IllegalArgumentException if the name matches no kind
     */
    public static StepFailureKind fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Failure kind cannot be null");
        }
        return valueOf(name.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
