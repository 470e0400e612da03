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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.tessera.core.ExecutionStatus;
import dev.mars.tessera.core.exceptions.StateException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for FileStateStore.
 */
class FileStateStoreTest {

    private static final Instant CREATED = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path stateDir;

    private WorkflowStateRecord sampleRecord(String workflowId) {
        return WorkflowStateRecord.builder(workflowId)
                .executionId("exec-42")
                .status(ExecutionStatus.RUNNING)
                .currentStep("b")
                .stepsCompleted(List.of("a"))
                .stepsRemaining(List.of("a", "b", "c"))
                .progress(1.0 / 3)
                .data(Map.of("x", 1, "nested", Map.of("y", "z")))
                .createdAt(CREATED)
                .updatedAt(CREATED.plusSeconds(10))
                .metadata(Map.of("owner", "ops"))
                .build();
    }

    @Test
    void testRecordIsWrittenWithSnakeCaseSchema() throws Exception {
        FileStateStore store = new FileStateStore(stateDir);
        store.save("orders", sampleRecord("orders"));

        Path file = stateDir.resolve("orders.json");
        assertTrue(Files.exists(file));

        Map<String, Object> json = new ObjectMapper().readValue(file.toFile(), new TypeReference<>() { });
        assertEquals("orders", json.get("workflow_id"));
        assertEquals("exec-42", json.get("execution_id"));
        assertEquals("running", json.get("status"));
        assertEquals("b", json.get("current_step"));
        assertEquals(List.of("a"), json.get("steps_completed"));
        assertEquals(List.of("b", "c"), json.get("steps_remaining"));
        assertEquals("2025-03-01T10:00:00Z", json.get("created_at"));
        assertEquals("2025-03-01T10:00:10Z", json.get("updated_at"));
        assertTrue(json.containsKey("error"));
        assertNull(json.get("error"));
    }

    @Test
    void testRecordsSurviveRestart() throws Exception {
        FileStateStore first = new FileStateStore(stateDir);
        first.save("orders", sampleRecord("orders"));
        first.markStepCompleted("orders", "b", Map.of("approved", true));

        FileStateStore reopened = new FileStateStore(stateDir);
        WorkflowStateRecord restored = reopened.get("orders").orElseThrow();

        assertEquals(first.get("orders").orElseThrow(), restored);
        assertEquals(List.of("a", "b"), List.copyOf(restored.getStepsCompleted()));
        assertEquals(Map.of("approved", true), restored.getData().get("step_b"));
    }

    @Test
    void testDeleteRemovesFile() throws Exception {
        FileStateStore store = new FileStateStore(stateDir);
        store.save("orders", sampleRecord("orders"));

        assertTrue(store.delete("orders"));
        assertFalse(Files.exists(stateDir.resolve("orders.json")));
        assertTrue(new FileStateStore(stateDir).get("orders").isEmpty());
    }

    @Test
    void testWorkflowIdsAreEncodedInFileNames() throws Exception {
        FileStateStore store = new FileStateStore(stateDir);
        store.save("team/orders v2", sampleRecord("team/orders v2"));

        assertTrue(new FileStateStore(stateDir).get("team/orders v2").isPresent());
        try (var files = Files.list(stateDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testUnreadableFilesAreSkipped() throws Exception {
        Files.writeString(stateDir.resolve("broken.json"), "{ not json");
        FileStateStore store = new FileStateStore(stateDir);
        store.save("orders", sampleRecord("orders"));

        FileStateStore reopened = new FileStateStore(stateDir);

        assertEquals(1, reopened.size());
        assertTrue(reopened.get("broken").isEmpty());
    }

    @Test
    void testCleanupRemovesFiles() throws Exception {
        FileStateStore store = new FileStateStore(stateDir);
        store.save("orders", sampleRecord("orders"));

        assertEquals(1, store.cleanupExpired(java.time.Duration.ZERO));
        assertFalse(Files.exists(stateDir.resolve("orders.json")));
    }

    @Test
    void testUnusableDirectoryIsReported() throws IOException {
        Path file = stateDir.resolve("not-a-directory");
        Files.writeString(file, "x");

        assertThrows(StateException.class, () -> new FileStateStore(file));
    }
}
