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

package dev.mars.tessera.storage;

import dev.mars.tessera.config.TesseraConfiguration;
import dev.mars.tessera.core.exceptions.StateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically removes expired records from a {@link StateStore}.
 */
public class StateCleanupScheduler implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(StateCleanupScheduler.class);

    private final StateStore stateStore;
    private final Duration interval;
    private final Duration maxAge;
    private final ScheduledExecutorService cleanupExecutor;
    private ScheduledFuture<?> task;

    public StateCleanupScheduler(StateStore stateStore, TesseraConfiguration configuration) {
        this(stateStore, configuration.getStateCleanupInterval(), configuration.getStateMaxAge());
    }

    public StateCleanupScheduler(StateStore stateStore, Duration interval, Duration maxAge) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Cleanup interval must be positive");
        }
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("Max age must be non-negative");
        }
        this.stateStore = stateStore;
        this.interval = interval;
        this.maxAge = maxAge;
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "tessera-state-cleanup");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (task != null) {
            return;
        }
        task = cleanupExecutor.scheduleWithFixedDelay(this::runCleanup,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("State cleanup scheduled every {} ms (max age {} ms)", interval.toMillis(), maxAge.toMillis());
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isDone();
    }

    /**
     * Runs one cleanup pass. Failures are logged so the schedule keeps running.
     *
     * @return the number of records removed, or {@code -1} if the pass failed
     */
    public int runCleanup() {
        try {
            return stateStore.cleanupExpired(maxAge);
        } catch (StateException e) {
            logger.error("State cleanup failed: {}", e.getMessage(), e);
            return -1;
        }
    }

    public synchronized void stop() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }
}
