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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the {@link WorkflowStatus} transition table.
 */
class WorkflowStatusTest {

    static Stream<Arguments> allowedTransitions() {
        return Stream.of(
                Arguments.of(WorkflowStatus.PENDING, WorkflowStatus.RUNNING),
                Arguments.of(WorkflowStatus.PENDING, WorkflowStatus.CANCELLED),
                Arguments.of(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED),
                Arguments.of(WorkflowStatus.RUNNING, WorkflowStatus.COMPLETED),
                Arguments.of(WorkflowStatus.RUNNING, WorkflowStatus.FAILED),
                Arguments.of(WorkflowStatus.RUNNING, WorkflowStatus.CANCELLED),
                Arguments.of(WorkflowStatus.PAUSED, WorkflowStatus.RUNNING),
                Arguments.of(WorkflowStatus.PAUSED, WorkflowStatus.CANCELLED),
                Arguments.of(WorkflowStatus.FAILED, WorkflowStatus.PENDING));
    }

    static Stream<Arguments> forbiddenTransitions() {
        return Stream.of(
                Arguments.of(WorkflowStatus.PENDING, WorkflowStatus.COMPLETED),
                Arguments.of(WorkflowStatus.PENDING, WorkflowStatus.PAUSED),
                Arguments.of(WorkflowStatus.PAUSED, WorkflowStatus.COMPLETED),
                Arguments.of(WorkflowStatus.COMPLETED, WorkflowStatus.RUNNING),
                Arguments.of(WorkflowStatus.COMPLETED, WorkflowStatus.CANCELLED),
                Arguments.of(WorkflowStatus.FAILED, WorkflowStatus.RUNNING),
                Arguments.of(WorkflowStatus.FAILED, WorkflowStatus.CANCELLED),
                Arguments.of(WorkflowStatus.CANCELLED, WorkflowStatus.PENDING));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("allowedTransitions")
    @DisplayName("Allowed transitions are accepted")
    void allowed(WorkflowStatus from, WorkflowStatus to) {
        assertTrue(from.canTransitionTo(to));
        assertTrue(from.getValidTransitions().contains(to));
    }

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("forbiddenTransitions")
    @DisplayName("Forbidden transitions are rejected")
    void forbidden(WorkflowStatus from, WorkflowStatus to) {
        assertFalse(from.canTransitionTo(to));
    }

    @ParameterizedTest
    @EnumSource(WorkflowStatus.class)
    @DisplayName("No status transitions to itself")
    void noSelfTransition(WorkflowStatus status) {
        assertFalse(status.canTransitionTo(status));
    }

    @Test
    @DisplayName("COMPLETED and CANCELLED are final")
    void finalStates() {
        assertEquals(Set.of(), WorkflowStatus.COMPLETED.getValidTransitions());
        assertEquals(Set.of(), WorkflowStatus.CANCELLED.getValidTransitions());
        assertTrue(WorkflowStatus.COMPLETED.isTerminal());
        assertTrue(WorkflowStatus.FAILED.isTerminal());
        assertFalse(WorkflowStatus.PAUSED.isTerminal());
        assertTrue(WorkflowStatus.PAUSED.isActive());
    }
}
