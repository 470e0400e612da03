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

import dev.mars.tessera.core.ExecutionStatus;
import dev.mars.tessera.core.exceptions.InvalidTransitionException;
import dev.mars.tessera.core.exceptions.NotFoundException;
import dev.mars.tessera.core.exceptions.StateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for InMemoryStateStore.
 */
class InMemoryStateStoreTest {

    private static final Instant START = Instant.parse("2025-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new InMemoryStateStore(clock);
    }

    private WorkflowStateRecord running(String workflowId, String... remaining) {
        return WorkflowStateRecord.builder(workflowId)
                .executionId("exec-" + workflowId)
                .status(ExecutionStatus.RUNNING)
                .stepsRemaining(List.of(remaining))
                .createdAt(START)
                .updatedAt(START)
                .build();
    }

    @Nested
    @DisplayName("Save and read")
    class SaveAndRead {

        @Test
        void testSaveAndGet() throws StateException {
            WorkflowStateRecord record = running("wf-1", "a", "b");
            store.save("wf-1", record);

            assertEquals(record, store.get("wf-1").orElseThrow());
            assertTrue(store.get("missing").isEmpty());
            assertEquals(1, store.size());
        }

        @Test
        void testSaveReplacesPreviousRecord() throws StateException {
            store.save("wf-1", running("wf-1", "a"));
            store.save("wf-1", running("wf-1", "a").toBuilder().progress(0.5).build());

            assertEquals(0.5, store.get("wf-1").orElseThrow().getProgress());
            assertEquals(1, store.size());
        }

        @Test
        void testMismatchedKeyIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> store.save("other", running("wf-1")));
            assertThrows(IllegalArgumentException.class, () -> store.save("wf-1", null));
        }

        @Test
        @DisplayName("updated_at never moves backwards on save")
        void testUpdatedAtIsMonotonicOnSave() throws StateException {
            store.save("wf-1", running("wf-1").toBuilder().updatedAt(START.plusSeconds(60)).build());
            store.save("wf-1", running("wf-1").toBuilder().updatedAt(START).build());

            assertEquals(START.plusSeconds(60), store.get("wf-1").orElseThrow().getUpdatedAt());
        }

        @Test
        void testDelete() throws StateException {
            store.save("wf-1", running("wf-1"));

            assertTrue(store.delete("wf-1"));
            assertFalse(store.delete("wf-1"));
            assertEquals(0, store.size());
        }

        @Test
        void testGetAllReturnsSnapshot() throws StateException {
            store.save("wf-1", running("wf-1"));
            store.save("wf-2", running("wf-2"));

            Map<String, WorkflowStateRecord> all = store.getAll();
            store.delete("wf-1");

            assertEquals(Set.of("wf-1", "wf-2"), all.keySet());
            assertEquals(1, store.size());
        }
    }

    @Nested
    @DisplayName("Updates")
    class Updates {

        @Test
        void testUpdateProgress() throws Exception {
            store.save("wf-1", running("wf-1", "a", "b"));
            clock.advance(Duration.ofSeconds(5));

            WorkflowStateRecord updated = store.updateProgress("wf-1", 0.5, "b");

            assertEquals(0.5, updated.getProgress());
            assertEquals("b", updated.getCurrentStep());
            assertEquals(START.plusSeconds(5), updated.getUpdatedAt());
        }

        @Test
        void testUpdateProgressWithoutStepKeepsCurrentStep() throws Exception {
            store.save("wf-1", running("wf-1").toBuilder().currentStep("a").build());

            assertEquals("a", store.updateProgress("wf-1", 0.25, null).getCurrentStep());
        }

        @Test
        @DisplayName("Out-of-range progress is rejected and leaves the record unchanged")
        void testProgressOutOfRange() throws Exception {
            WorkflowStateRecord original = running("wf-1");
            store.save("wf-1", original);

            assertThrows(StateException.class, () -> store.updateProgress("wf-1", 1.5, "a"));
            assertThrows(StateException.class, () -> store.updateProgress("wf-1", -0.1, "a"));
            assertThrows(StateException.class, () -> store.updateProgress("wf-1", Double.NaN, "a"));

            assertEquals(original, store.get("wf-1").orElseThrow());
        }

        @Test
        void testUpdateUnknownWorkflow() {
            NotFoundException e = assertThrows(NotFoundException.class,
                    () -> store.updateProgress("missing", 0.1, null));
            assertEquals("missing", e.getResourceId());
            assertThrows(NotFoundException.class, () -> store.markStepCompleted("missing", "a", null));
            assertThrows(NotFoundException.class, () -> store.updateStatus("missing", ExecutionStatus.FAILED, null));
        }

        @Test
        @DisplayName("Completing a step moves it out of steps_remaining and stores its output")
        void testMarkStepCompleted() throws Exception {
            store.save("wf-1", running("wf-1", "a", "b"));

            WorkflowStateRecord updated = store.markStepCompleted("wf-1", "a", Map.of("x", 1));

            assertThat(updated.getStepsCompleted()).containsExactly("a");
            assertThat(updated.getStepsRemaining()).containsExactly("b");
            assertEquals(Map.of("x", 1), updated.getData().get("step_a"));
        }

        @Test
        void testMarkStepCompletedIsIdempotent() throws Exception {
            store.save("wf-1", running("wf-1", "a"));

            store.markStepCompleted("wf-1", "a", null);
            WorkflowStateRecord updated = store.markStepCompleted("wf-1", "a", null);

            assertThat(updated.getStepsCompleted()).containsExactly("a");
            assertThat(updated.getStepsRemaining()).isEmpty();
            assertFalse(updated.getData().containsKey("step_a"));
        }

        @Test
        void testUpdateStatus() throws Exception {
            store.save("wf-1", running("wf-1"));

            WorkflowStateRecord failed = store.updateStatus("wf-1", ExecutionStatus.FAILED, "step a failed");

            assertEquals(ExecutionStatus.FAILED, failed.getStatus());
            assertEquals("step a failed", failed.getError());
        }

        @Test
        void testInvalidStatusTransition() throws Exception {
            store.save("wf-1", running("wf-1"));
            store.updateStatus("wf-1", ExecutionStatus.COMPLETED, null);

            InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
                    () -> store.updateStatus("wf-1", ExecutionStatus.RUNNING, null));
            assertEquals(ExecutionStatus.COMPLETED, e.getCurrentStatus());
            assertEquals(ExecutionStatus.COMPLETED, store.get("wf-1").orElseThrow().getStatus());
        }

        @Test
        @DisplayName("updated_at never moves backwards when the clock does")
        void testUpdatedAtIsMonotonicOnUpdate() throws Exception {
            store.save("wf-1", running("wf-1").toBuilder().updatedAt(START.plusSeconds(30)).build());

            WorkflowStateRecord updated = store.updateProgress("wf-1", 0.1, null);

            assertEquals(START.plusSeconds(30), updated.getUpdatedAt());
        }
    }

    @Nested
    @DisplayName("Execution-guarded updates")
    class GuardedUpdates {

        @Test
        void testOwningExecutionCanUpdate() throws Exception {
            store.save("wf-1", running("wf-1", "a", "b"));

            assertTrue(store.updateProgress("wf-1", "exec-wf-1", 0.5, "a").isPresent());
            WorkflowStateRecord record = store.markStepCompleted("wf-1", "exec-wf-1", "a", Map.of("x", 1)).orElseThrow();
            assertEquals(Set.of("a"), Set.copyOf(record.getStepsCompleted()));
            assertEquals(ExecutionStatus.COMPLETED,
                    store.updateStatus("wf-1", "exec-wf-1", ExecutionStatus.COMPLETED, null).orElseThrow().getStatus());
        }

        @Test
        void testStaleExecutionCannotWriteNewerRecord() throws Exception {
            store.save("wf-1", running("wf-1", "a", "b"));
            // a second execution of the same workflow takes over the record
            WorkflowStateRecord newer = running("wf-1", "a", "b").toBuilder().executionId("exec-2").build();
            store.save("wf-1", newer);

            assertTrue(store.markStepCompleted("wf-1", "exec-wf-1", "a", Map.of()).isEmpty());
            assertTrue(store.updateProgress("wf-1", "exec-wf-1", 1.0, "b").isEmpty());
            assertTrue(store.updateStatus("wf-1", "exec-wf-1", ExecutionStatus.FAILED, "boom").isEmpty());

            WorkflowStateRecord stored = store.get("wf-1").orElseThrow();
            assertEquals(newer, stored);
            assertTrue(stored.getStepsCompleted().isEmpty());
            assertEquals(ExecutionStatus.RUNNING, stored.getStatus());
        }

        @Test
        void testGuardedUpdateOfMissingRecordIsEmpty() throws Exception {
            assertTrue(store.updateProgress("missing", "exec", 0.5, null).isEmpty());
            assertTrue(store.markStepCompleted("missing", "exec", "a", null).isEmpty());
            assertTrue(store.updateStatus("missing", "exec", ExecutionStatus.FAILED, null).isEmpty());
        }

        @Test
        void testGuardedUpdatesKeepValidation() throws Exception {
            store.save("wf-1", running("wf-1"));

            assertThrows(StateException.class, () -> store.updateProgress("wf-1", "exec-wf-1", 1.5, null));
            store.updateStatus("wf-1", "exec-wf-1", ExecutionStatus.COMPLETED, null);
            assertThrows(InvalidTransitionException.class,
                    () -> store.updateStatus("wf-1", "exec-wf-1", ExecutionStatus.RUNNING, null));
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @Test
        void testCleanupRemovesRecordsAtOrBeyondMaxAge() throws StateException {
            store.save("old", running("old"));
            store.save("young", running("young").toBuilder().createdAt(START.plus(Duration.ofHours(2))).build());
            clock.advance(Duration.ofHours(3));

            assertEquals(1, store.cleanupExpired(Duration.ofHours(3)));
            assertTrue(store.get("old").isEmpty());
            assertTrue(store.get("young").isPresent());
        }

        @Test
        void testZeroMaxAgeRemovesEverything() throws StateException {
            store.save("wf-1", running("wf-1"));
            store.save("wf-2", running("wf-2"));

            assertEquals(2, store.cleanupExpired(Duration.ZERO));
            assertEquals(0, store.size());
        }

        @Test
        void testNegativeMaxAgeIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> store.cleanupExpired(Duration.ofSeconds(-1)));
        }
    }

    @Test
    @DisplayName("Concurrent step completions are all recorded")
    void testConcurrentMarkStepCompleted() throws Exception {
        List<String> steps = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            steps.add("step-" + i);
        }
        store.save("wf-1", running("wf-1", steps.toArray(new String[0])));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<WorkflowStateRecord>> futures = new ArrayList<>();
            for (String step : steps) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return store.markStepCompleted("wf-1", step, Map.of("done", true));
                }));
            }
            start.countDown();
            for (Future<WorkflowStateRecord> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        WorkflowStateRecord result = store.get("wf-1").orElseThrow();
        assertEquals(50, result.getStepsCompleted().size());
        assertTrue(result.getStepsRemaining().isEmpty());
    }
}
