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

package dev.mars.flowgate.workflow.approval;

import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.bus.EventLog;
import dev.mars.flowgate.bus.InMemoryEventLog;
import dev.mars.flowgate.event.ApprovalDecision;
import dev.mars.flowgate.event.ApprovalRequest;
import dev.mars.flowgate.workflow.RecordingNotificationService;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * Tests for {@link ApprovalGateway}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class ApprovalGatewayTest {

    private Vertx vertx;
    private EventLog eventLog;
    private EventBus bus;
    private RecordingNotificationService notifications;
    private ApprovalGateway gateway;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        eventLog = spy(new InMemoryEventLog());
        bus = new EventBus(eventLog);
        notifications = new RecordingNotificationService();
        gateway = new ApprovalGateway(bus, notifications, vertx, Duration.ofMillis(100));
    }

    @AfterEach
    void tearDown() throws Exception {
        vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    private void decide(String alertId, boolean approved) throws Exception {
        bus.publish("decision", new ApprovalDecision(alertId, approved, "alice", "#devops-alerts").toPayload());
    }

    @Nested
    @DisplayName("Requesting approval")
    class Requesting {

        @Test
        @DisplayName("Notifies approvers and tracks the request")
        void tracksRequest() {
            ApprovalRequest request = gateway.requestApproval("Approve deployment", "alert-1", "#devops-alerts");

            assertEquals("alert-1", request.getAlertId());
            assertEquals("alert-1", notifications.lastAlertId());
            assertEquals(1, gateway.pendingRequests().size());
            assertTrue(gateway.getRequest("alert-1").isPresent());
        }

        @Test
        @DisplayName("Notification failures never reach the caller")
        void notificationFailureSwallowed() {
            notifications.setFailing(true);

            assertDoesNotThrow(() -> gateway.requestApproval("Approve", "alert-2", "#devops-alerts"));
            assertTrue(gateway.getRequest("alert-2").isPresent());
        }

        @Test
        @DisplayName("Alert ids are unique per gate invocation")
        void uniqueAlertIds() {
            String first = gateway.newAlertId("automated_deployment", "hitl_required", "run-1");
            String second = gateway.newAlertId("automated_deployment", "hitl_required", "run-1");

            assertNotEquals(first, second);
            assertTrue(first.startsWith("automated_deployment_hitl_required_"));
        }
    }

    @Nested
    @DisplayName("Waiting for a decision")
    class Waiting {

        @Test
        @DisplayName("Times out with false when no decision arrives")
        void timesOut() throws Exception {
            long start = System.nanoTime();

            boolean approved = gateway.awaitDecision("never-decided", Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertFalse(approved);
            assertTrue(elapsedMs >= 900, "returned after " + elapsedMs + " ms");
            assertTrue(elapsedMs < 2500, "returned after " + elapsedMs + " ms");
        }

        @Test
        @DisplayName("Completes with the decision once it is published")
        void receivesLaterDecision() throws Exception {
            gateway.requestApproval("Approve", "alert-3", "#devops-alerts");
            CompletableFuture<Boolean> decision = gateway.awaitDecision("alert-3", Duration.ofSeconds(10));

            decide("other-alert", false);
            decide("alert-3", true);

            assertTrue(decision.get(5, TimeUnit.SECONDS));
            assertEquals(Boolean.TRUE, gateway.getRequest("alert-3").orElseThrow().getApproved().orElse(null));
            assertTrue(gateway.pendingRequests().isEmpty());
        }

        @Test
        @DisplayName("The first decision in log order wins")
        void firstDecisionWins() throws Exception {
            decide("alert-4", false);
            decide("alert-4", true);

            assertFalse(gateway.awaitDecision("alert-4", Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS));
            assertFalse(gateway.findDecision("alert-4").orElseThrow().approved());
        }

        @Test
        @DisplayName("Cancelling the wait stops polling")
        void cancelStopsPolling() throws Exception {
            CompletableFuture<Boolean> decision = gateway.awaitDecision("alert-5", Duration.ofSeconds(30));
            await().atMost(Duration.ofSeconds(2)).untilAsserted(() -> verify(eventLog, atLeastOnce()).readAll());

            decision.cancel(true);
            Thread.sleep(150);
            clearInvocations(eventLog);
            Thread.sleep(400);

            verify(eventLog, never()).readAll();
            assertTrue(decision.isCancelled());
        }
    }

    @Test
    @DisplayName("Rejects a non-positive poll interval")
    void rejectsZeroPollInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> new ApprovalGateway(bus, notifications, vertx, Duration.ZERO));
    }

    @Test
    @DisplayName("Decision payload matches the approval shape")
    void decisionPayload() {
        Map<String, Object> payload = new ApprovalDecision("a-1", true, "bob", "#ops").toPayload();

        assertEquals(Map.of("alertId", "a-1", "approved", true, "user", "bob", "channel", "#ops"), payload);
    }
}
