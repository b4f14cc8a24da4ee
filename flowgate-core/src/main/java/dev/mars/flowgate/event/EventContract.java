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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known event types and the payload fields each one requires.
 * Types not listed here are accepted with an opaque payload.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum EventContract {

    DECISION("decision", "alertId", "approved"),
    APPROVAL_REQUESTED("approval_requested", "alertId", "reason", "channel"),
    ESCALATION("escalation", "runId", "reason", "channel"),
    NOTIFICATION("notification", "message", "channel"),
    COMMAND_RECEIVED("command_received", "command"),
    WORKFLOW_EXECUTION_REQUESTED("workflow_execution_requested", "runId"),
    WORKFLOW_PAUSE_REQUESTED("workflow_pause_requested", "runId"),
    WORKFLOW_RESUME_REQUESTED("workflow_resume_requested", "runId"),
    WORKFLOW_CANCEL_REQUESTED("workflow_cancel_requested", "runId");

    private final String eventType;
    private final List<String> requiredFields;

    EventContract(String eventType, String... requiredFields) {
        this.eventType = eventType;
        this.requiredFields = List.of(requiredFields);
    }

    public String eventType() {
        return eventType;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public static Optional<EventContract> forType(String eventType) {
        return Arrays.stream(values())
                .filter(contract -> contract.eventType.equals(eventType))
                .findFirst();
    }

    /**
     * Checks the payload of a known event type against its required fields.
     *
     * @throws IllegalArgumentException if the type is blank or a required field is missing
     */
    public static void validate(String eventType, Map<String, Object> payload) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("Event type cannot be null or empty");
        }
        Optional<EventContract> contract = forType(eventType);
        if (contract.isEmpty()) {
            return;
        }
        List<String> missing = new ArrayList<>();
        for (String field : contract.get().requiredFields) {
            if (payload == null || payload.get(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Event '" + eventType + "' is missing required fields " + missing);
        }
    }
}
