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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable history entry for a published event.
 */
public final class EventRecord {

    private final String type;
    private final String workflowId;
    private final Instant timestamp;
    private final Map<String, Object> data;

    public EventRecord(String type, String workflowId, Instant timestamp, Map<String, Object> data) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.workflowId = workflowId;
        this.timestamp = Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        this.data = data != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
                : Collections.emptyMap();
    }

    public String getType() {
        return type;
    }

    /**
     * @return the {@code workflow_id} taken from the payload, or {@code null} if absent
     */
    public String getWorkflowId() {
        return workflowId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String toString() {
        return "EventRecord{" +
                "type='" + type + '\'' +
                ", workflowId='" + workflowId + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
