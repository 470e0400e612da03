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

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Retry behaviour for a single step.
 * <p>
 * The delay before retry {@code n} (counting from zero) is {@code min(baseDelay * 2^n, maxDelay)}.
 * Only failures whose {@link StepFailureKind} is in {@link #getRetryableKinds()} are retried.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class RetryPolicy {

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Set<StepFailureKind> retryableKinds;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay,
                       Collection<StepFailureKind> retryableKinds) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative: " + maxRetries);
        }
        Objects.requireNonNull(baseDelay, "Base delay cannot be null");
        Objects.requireNonNull(maxDelay, "Max delay cannot be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("Base delay cannot be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is shorter than base delay " + baseDelay);
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.retryableKinds = retryableKinds == null || retryableKinds.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(StepFailureKind.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(retryableKinds));
    }

    /**
     * Three retries, one second base delay, one minute cap, retrying timeouts and I/O failures.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofMinutes(1), StepFailureKind.defaultRetryable());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ZERO, Duration.ZERO, Set.of());
    }

    public static RetryPolicy fromConfiguration(TesseraConfiguration configuration) {
        return new RetryPolicy(configuration.getMaxRetries(), configuration.getRetryBaseDelay(),
                configuration.getRetryMaxDelay(), StepFailureKind.defaultRetryable());
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public Set<StepFailureKind> getRetryableKinds() {
        return retryableKinds;
    }

    /**
     * @param retriesSoFar number of retries already performed
     */
    public boolean shouldRetry(StepFailureKind kind, int retriesSoFar) {
        return kind != null && retriesSoFar < maxRetries && retryableKinds.contains(kind);
    }

    /**
     * @param attempt zero-based retry index
     */
    public Duration computeDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("Attempt cannot be negative: " + attempt);
        }
        long baseMs = baseDelay.toMillis();
        long maxMs = maxDelay.toMillis();
        if (baseMs == 0) {
            return Duration.ZERO;
        }
        if (attempt >= 62 || baseMs > (maxMs >> attempt)) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(baseMs << attempt, maxMs));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RetryPolicy that = (RetryPolicy) o;
        return maxRetries == that.maxRetries
                && baseDelay.equals(that.baseDelay)
                && maxDelay.equals(that.maxDelay)
                && retryableKinds.equals(that.retryableKinds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxRetries, baseDelay, maxDelay, retryableKinds);
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxRetries=" + maxRetries +
                ", baseDelay=" + baseDelay +
                ", maxDelay=" + maxDelay +
                ", retryableKinds=" + retryableKinds +
                '}';
    }
}
