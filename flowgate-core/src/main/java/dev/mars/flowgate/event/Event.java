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

package dev.mars.flowgate.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of something that happened: a type, a timestamp and an opaque
 * structured payload. Serialized as {@code {timestamp, event, data, correlationId?}}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonPropertyOrder({"timestamp", "event", "data", "correlationId"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Event {

    private final String type;
    private final Map<String, Object> payload;
    private final Instant timestamp;
    private final String correlationId;

    @JsonCreator
    public Event(@JsonProperty("event") String type,
                 @JsonProperty("data") Map<String, Object> payload,
                 @JsonProperty("timestamp") Instant timestamp,
                 @JsonProperty("correlationId") String correlationId) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        this.timestamp = Objects.requireNonNull(timestamp, "Event timestamp cannot be null");
        this.correlationId = correlationId;
    }

    public static Event of(String type, Map<String, Object> payload) {
        return new Event(type, payload, Instant.now(), null);
    }

    @JsonProperty("event")
    public String getType() {
        return type;
    }

    @JsonProperty("data")
    public Map<String, Object> getPayload() {
        return payload;
    }

    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonProperty("correlationId")
    public String getCorrelationId() {
        return correlationId;
    }

    @JsonIgnore
    public Optional<String> correlationId() {
        return Optional.ofNullable(correlationId);
    }

    /**
     * Payload value as a string, or null if absent.
     */
    public String getString(String field) {
        Object value = payload.get(field);
        return value == null ? null : value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Event event = (Event) o;
        return type.equals(event.type)
                && payload.equals(event.payload)
                && timestamp.equals(event.timestamp)
                && Objects.equals(correlationId, event.correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, payload, timestamp, correlationId);
    }

    @Override
    public String toString() {
        return "Event{" +
                "type='" + type + '\'' +
                ", timestamp=" + timestamp +
                (correlationId != null ? ", correlationId='" + correlationId + '\'' : "") +
                ", payload=" + payload +
                '}';
    }
}
