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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EventContractTest {

    @Test
    @DisplayName("Known types must carry their required fields")
    void testMissingRequiredField() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> EventContract.validate("decision", Map.of("alertId", "a-1")));
        assertTrue(ex.getMessage().contains("approved"));
    }

    @Test
    @DisplayName("Complete payloads and unknown types are accepted")
    void testValidPayloads() {
        assertDoesNotThrow(() -> EventContract.validate("decision", Map.of("alertId", "a-1", "approved", true)));
        assertDoesNotThrow(() -> EventContract.validate("build_triggered", Map.of("anything", 1)));
        assertDoesNotThrow(() -> EventContract.validate("build_triggered", null));
    }

    @Test
    @DisplayName("Blank event types are rejected")
    void testBlankType() {
        assertThrows(IllegalArgumentException.class, () -> EventContract.validate(" ", Map.of()));
    }

    @Test
    @DisplayName("Decision view reads the approval shape")
    void testApprovalDecisionView() {
        Event event = new Event("decision",
                Map.of("alertId", "deploy_hitl_required_1", "approved", false, "user", "ops", "channel", "#c"),
                Instant.now(), null);

        ApprovalDecision decision = ApprovalDecision.fromEvent(event);

        assertEquals("deploy_hitl_required_1", decision.alertId());
        assertFalse(decision.approved());
        assertEquals("ops", decision.user());
        assertEquals(Map.of("alertId", "deploy_hitl_required_1", "approved", false, "user", "ops", "channel", "#c"),
                decision.toPayload());
    }

    @Test
    @DisplayName("Decision view rejects other event types")
    void testApprovalDecisionWrongType() {
        Event event = Event.of("escalation", Map.of("runId", "r", "reason", "x", "channel", "#e"));
        assertThrows(IllegalArgumentException.class, () -> ApprovalDecision.fromEvent(event));
    }
}
