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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.tessera.core.exceptions.StateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * Write-through {@link StateStore} that keeps one JSON document per workflow in a directory.
 * <p>
 * Records are held in memory for reads; every mutation is written to disk before it becomes
 * visible. Existing documents are loaded when the store is created.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FileStateStore extends InMemoryStateStore {
    private static final Logger logger = LoggerFactory.getLogger(FileStateStore.class);

    private static final String FILE_SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileStateStore(Path directory) throws StateException {
        this(directory, Clock.systemUTC());
    }

    public FileStateStore(Path directory, Clock clock) throws StateException {
        super(clock);
        if (directory == null) {
            throw new IllegalArgumentException("State directory cannot be null");
        }
        this.directory = directory;
        this.objectMapper = createObjectMapper();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StateException(null, "Cannot create state directory " + directory, e);
        }
        loadExisting();
    }

    static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    protected void persist(WorkflowStateRecord record) throws StateException {
        Path target = fileFor(record.getWorkflowId());
        Path temp = directory.resolve(target.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), record);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateException(record.getWorkflowId(),
                    "Failed to write state file " + target + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected void erase(String workflowId) throws StateException {
        Path target = fileFor(workflowId);
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            throw new StateException(workflowId, "Failed to delete state file " + target + ": " + e.getMessage(), e);
        }
    }

    private void loadExisting() throws StateException {
        int loaded = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*" + FILE_SUFFIX)) {
            for (Path file : files) {
                WorkflowStateRecord record;
                try {
                    record = objectMapper.readValue(file.toFile(), WorkflowStateRecord.class);
                } catch (IOException e) {
                    logger.warn("Skipping unreadable state file {}: {}", file, e.getMessage());
                    continue;
                }
                String expectedId = workflowIdFor(file);
                if (!record.getWorkflowId().equals(expectedId)) {
                    logger.warn("Skipping state file {}: contains workflow {}", file, record.getWorkflowId());
                    continue;
                }
                restore(record);
                loaded++;
            }
        } catch (IOException e) {
            throw new StateException(null, "Cannot read state directory " + directory, e);
        }
        logger.info("Loaded {} workflow states from {}", loaded, directory);
    }

    private Path fileFor(String workflowId) {
        return directory.resolve(URLEncoder.encode(workflowId, StandardCharsets.UTF_8) + FILE_SUFFIX);
    }

    private static String workflowIdFor(Path file) {
        String name = file.getFileName().toString();
        return URLDecoder.decode(name.substring(0, name.length() - FILE_SUFFIX.length()), StandardCharsets.UTF_8);
    }
}
