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

package dev.mars.flowgate.workflow;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Enumeration of workflow run statuses.
 *
 * <pre>
 * PENDING → RUNNING → {COMPLETED | FAILED | CANCELLED}
 *    ↓         ↕
 * CANCELLED  PAUSED → CANCELLED
 * FAILED → PENDING (recovery only)
 * </pre>
 */
public enum WorkflowStatus {

    /**
     * Run is created and waiting to be started.
     */
    PENDING,

    /**
     * Run is executing steps.
     */
    RUNNING,

    /**
     * Run is halted by an operator or by a rejected approval gate.
     */
    PAUSED,

    /**
     * Every step has been executed.
     */
    COMPLETED,

    /**
     * A step could not be executed.
     */
    FAILED,

    /**
     * Run was cancelled by an operator.
     */
    CANCELLED;

    // ── Transition table (single source of truth) ──────────────────────

    private static final Map<WorkflowStatus, Set<WorkflowStatus>> TRANSITIONS;

    static {
        var map = new EnumMap<WorkflowStatus, Set<WorkflowStatus>>(WorkflowStatus.class);
        map.put(PENDING, EnumSet.of(RUNNING, CANCELLED));
        map.put(RUNNING, EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED));
        map.put(PAUSED, EnumSet.of(RUNNING, CANCELLED));
        map.put(COMPLETED, EnumSet.noneOf(WorkflowStatus.class));
        map.put(FAILED, EnumSet.of(PENDING));
        map.put(CANCELLED, EnumSet.noneOf(WorkflowStatus.class));
        map.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        TRANSITIONS = Collections.unmodifiableMap(map);
    }

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Checks if the status represents a successful completion.
     */
    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return TRANSITIONS.getOrDefault(this, EnumSet.noneOf(WorkflowStatus.class)).contains(target);
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return unmodifiable set of valid target statuses (empty for COMPLETED and CANCELLED)
     */
    public Set<WorkflowStatus> getValidTransitions() {
        return TRANSITIONS.getOrDefault(this, Collections.emptySet());
    }
}
