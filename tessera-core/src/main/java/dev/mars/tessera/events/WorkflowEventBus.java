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

package dev.mars.tessera.events;

import dev.mars.tessera.config.TesseraConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Asynchronous publish/subscribe bus for workflow lifecycle events.
 *
 * <p><strong>Delivery:</strong></p>
 * <ul>
 *   <li>Every handler subscribed to a type receives each published event exactly once</li>
 *   <li>Handlers run concurrently on the bus executor</li>
 *   <li>A failing handler is logged and never prevents delivery to the others</li>
 * </ul>
 *
 * <p>Published events are also appended to a bounded history; once the capacity is reached
 * the oldest entry is evicted.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowEventBus {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEventBus.class);

    public static final String WORKFLOW_ID_KEY = "workflow_id";

    private final Map<String, List<EventHandler>> subscribers = new ConcurrentHashMap<>();
    private final Deque<EventRecord> history;
    private final int maxHistorySize;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    public WorkflowEventBus() {
        this(new TesseraConfiguration());
    }

    public WorkflowEventBus(TesseraConfiguration configuration) {
        this(configuration.getEventHistorySize());
    }

    public WorkflowEventBus(int maxHistorySize) {
        this(maxHistorySize, Executors.newCachedThreadPool(new EventThreadFactory()), true);
    }

    public WorkflowEventBus(int maxHistorySize, ExecutorService executor) {
        this(maxHistorySize, executor, false);
    }

    private WorkflowEventBus(int maxHistorySize, ExecutorService executor, boolean ownsExecutor) {
        if (maxHistorySize < 0) {
            throw new IllegalArgumentException("History size cannot be negative: " + maxHistorySize);
        }
        this.maxHistorySize = maxHistorySize;
        this.history = new ArrayDeque<>(Math.min(maxHistorySize, 1024));
        this.executor = executor;
        this.ownsExecutor = ownsExecutor;
    }

    public CompletableFuture<Void> publish(WorkflowEventType eventType, Map<String, Object> payload) {
        return publish(eventType.getWireName(), payload);
    }

    /**
     * Records the event in history and delivers it to every current subscriber of {@code eventType}.
     *
     * @return a future completing once every handler has finished, successfully or not
     */
    public CompletableFuture<Void> publish(String eventType, Map<String, Object> payload) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be null or empty");
        }
        Map<String, Object> data = payload != null ? payload : Collections.emptyMap();
        Object workflowId = data.get(WORKFLOW_ID_KEY);
        EventRecord record = new EventRecord(eventType, workflowId != null ? workflowId.toString() : null,
                Instant.now(), data);
        appendToHistory(record);

        List<EventHandler> handlers = subscribers.get(eventType);
        if (handlers == null || handlers.isEmpty()) {
            logger.debug("No subscribers for event {}", eventType);
            return CompletableFuture.completedFuture(null);
        }

        Map<String, Object> delivered = record.getData();
        List<CompletableFuture<Void>> deliveries = new ArrayList<>(handlers.size());
        for (EventHandler handler : handlers) {
            deliveries.add(CompletableFuture.runAsync(() -> invoke(eventType, handler, delivered), executor));
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]));
    }

    private void invoke(String eventType, EventHandler handler, Map<String, Object> payload) {
        try {
            handler.handle(payload);
        } catch (Exception e) {
            logger.warn("Event handler {} failed for event {}: {}", handler, eventType, e.getMessage(), e);
        }
    }

    public void subscribe(WorkflowEventType eventType, EventHandler handler) {
        subscribe(eventType.getWireName(), handler);
    }

    public void subscribe(String eventType, EventHandler handler) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be null or empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        subscribers.computeIfAbsent(eventType, key -> new CopyOnWriteArrayList<>()).add(handler);
        logger.debug("Subscribed handler {} to event {}", handler, eventType);
    }

    public void unsubscribe(WorkflowEventType eventType, EventHandler handler) {
        unsubscribe(eventType.getWireName(), handler);
    }

    /**
     * Removes a handler. Unknown types or handlers are ignored.
     */
    public void unsubscribe(String eventType, EventHandler handler) {
        List<EventHandler> handlers = subscribers.get(eventType);
        if (handlers != null && handlers.remove(handler)) {
            logger.debug("Unsubscribed handler {} from event {}", handler, eventType);
        }
    }

    public int getSubscriberCount(String eventType) {
        List<EventHandler> handlers = subscribers.get(eventType);
        return handlers != null ? handlers.size() : 0;
    }

    /**
     * Returns the most recent {@code limit} events matching the optional filters, oldest first.
     *
     * @param eventType  type filter, or {@code null} for all types
     * @param workflowId workflow filter, or {@code null} for all workflows
     * @param limit      maximum number of entries returned; must be positive
     */
    public List<EventRecord> getEventHistory(String eventType, String workflowId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        List<EventRecord> matches = new ArrayList<>();
        synchronized (history) {
            for (EventRecord record : history) {
                if (eventType != null && !eventType.equals(record.getType())) {
                    continue;
                }
                if (workflowId != null && !workflowId.equals(record.getWorkflowId())) {
                    continue;
                }
                matches.add(record);
            }
        }
        int from = Math.max(0, matches.size() - limit);
        return Collections.unmodifiableList(new ArrayList<>(matches.subList(from, matches.size())));
    }

    public List<EventRecord> getEventHistory(int limit) {
        return getEventHistory(null, null, limit);
    }

    public int getHistorySize() {
        synchronized (history) {
            return history.size();
        }
    }

    public void clearHistory() {
        synchronized (history) {
            history.clear();
        }
        logger.debug("Event history cleared");
    }

    /**
     * Stops the bus executor if the bus created it. Externally supplied executors are left running.
     */
    public void shutdown() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void appendToHistory(EventRecord record) {
        if (maxHistorySize == 0) {
            return;
        }
        synchronized (history) {
            if (history.size() >= maxHistorySize) {
                history.removeFirst();
            }
            history.addLast(record);
        }
    }

    private static final class EventThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "tessera-events-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
