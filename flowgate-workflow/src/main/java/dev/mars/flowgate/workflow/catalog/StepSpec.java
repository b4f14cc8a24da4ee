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

package dev.mars.flowgate.workflow.catalog;

import java.util.Objects;

/**
 * One step of a workflow template.
 *
 * @param eventType    event published when the step executes
 * @param description  human readable description, defaults to the event type
 * @param approvalGate whether the step waits for a human decision instead of publishing
 */
public record StepSpec(String eventType, String description, boolean approvalGate) {

    public StepSpec {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        if (description == null || description.isBlank()) {
            description = eventType;
        }
    }

    public static StepSpec step(String eventType, String description) {
        return new StepSpec(eventType, description, false);
    }

    public static StepSpec gate(String eventType, String description) {
        return new StepSpec(eventType, description, true);
    }
}
