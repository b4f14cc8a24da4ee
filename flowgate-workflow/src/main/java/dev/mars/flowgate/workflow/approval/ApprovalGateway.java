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
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.event.ApprovalDecision;
import dev.mars.flowgate.event.ApprovalRequest;
import dev.mars.flowgate.event.EventContract;
import dev.mars.flowgate.notification.GuardedNotificationService;
import dev.mars.flowgate.notification.NotificationService;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Requests human decisions and waits for them to appear on the event bus.
 *
 * <p>A decision is a {@code decision} event carrying the gate's {@code alertId}. Waiting polls
 * the log on a Vert.x timer, with the read itself on a worker thread, so no thread blocks and
 * the bus lock is never held while waiting. When several decisions exist for one alert id the
 * first in log order wins.</p>
 *
 * <p>The future returned by {@link #awaitDecision(String, Duration)} completes with
 * {@code false} on timeout. Cancelling it stops the polling.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ApprovalGateway {

    private static final Logger logger = LoggerFactory.getLogger(ApprovalGateway.class);

    private final EventBus eventBus;
    private final NotificationService notifications;
    private final Vertx vertx;
    private final Duration pollInterval;
    private final ConcurrentMap<String, ApprovalRequest> requests = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public ApprovalGateway(EventBus eventBus, NotificationService notifications, Vertx vertx, Duration pollInterval) {
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus cannot be null");
        this.notifications = notifications instanceof GuardedNotificationService
                ? notifications
                : new GuardedNotificationService(Objects.requireNonNull(notifications, "notifications cannot be null"));
        this.vertx = Objects.requireNonNull(vertx, "vertx cannot be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        this.pollInterval = pollInterval;
    }

    /**
     * Creates an alert id that is unique for each gate invocation.
     */
    public String newAlertId(String templateName, String eventType, String runId) {
        return templateName + "_" + eventType + "_" + System.currentTimeMillis() + "_"
                + runId + "-" + sequence.incrementAndGet();
    }

    /**
     * Notifies approvers and tracks the request. Notification failures are logged, never raised.
     */
    public ApprovalRequest requestApproval(String reason, String alertId, String channel) {
        ApprovalRequest request = new ApprovalRequest(alertId, reason, channel, Instant.now());
        requests.put(alertId, request);
        notifications.notifyApprovalNeeded(reason, channel, alertId);
        logger.info("Approval requested: {} (alertId={}, channel={})", reason, alertId, channel);
        return request;
    }

    /**
     * Waits for the first decision with the given alert id.
     *
     * @return future completing with the decision, or {@code false} once {@code timeout} has elapsed
     */
    public CompletableFuture<Boolean> awaitDecision(String alertId, Duration timeout) {
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        long deadline = System.nanoTime() + timeout.toNanos();
        ConcurrentMap<String, Long> timer = new ConcurrentHashMap<>(1);

        result.whenComplete((approved, error) -> {
            Long timerId = timer.remove(alertId);
            if (timerId != null) {
                vertx.cancelTimer(timerId);
            }
            if (result.isCancelled()) {
                logger.info("Stopped waiting for decision (alertId={})", alertId);
            } else if (approved != null) {
                requests.computeIfPresent(alertId, (id, request) -> request.resolve(approved));
            }
        });

        poll(alertId, deadline, result, timer);
        return result;
    }

    /**
     * First decision in log order for the alert id, if any.
     */
    public Optional<ApprovalDecision> findDecision(String alertId) throws EventLogException {
        return eventBus.getEvents(EventContract.DECISION.eventType())
                .filter(event -> alertId.equals(event.getString("alertId")))
                .findFirst()
                .map(ApprovalDecision::fromEvent);
    }

    public Optional<ApprovalRequest> getRequest(String alertId) {
        return Optional.ofNullable(requests.get(alertId));
    }

    public List<ApprovalRequest> pendingRequests() {
        return requests.values().stream()
                .filter(request -> !request.isResolved())
                .sorted((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()))
                .collect(Collectors.toList());
    }

    public List<ApprovalRequest> allRequests() {
        return new ArrayList<>(requests.values());
    }

    private void poll(String alertId, long deadline, CompletableFuture<Boolean> result,
                      ConcurrentMap<String, Long> timer) {
        if (result.isDone()) {
            return;
        }
        vertx.executeBlocking(() -> findDecision(alertId), false)
                .onComplete(ar -> {
                    if (result.isDone()) {
                        return;
                    }
                    if (ar.succeeded() && ar.result().isPresent()) {
                        boolean approved = ar.result().get().approved();
                        logger.info("Decision received: {} (alertId={})", approved ? "approved" : "rejected", alertId);
                        result.complete(approved);
                        return;
                    }
                    if (ar.failed()) {
                        logger.warn("Failed to read decisions for alertId={}", alertId, ar.cause());
                    }

                    long remainingNanos = deadline - System.nanoTime();
                    if (remainingNanos <= 0) {
                        logger.warn("Timed out waiting for decision (alertId={})", alertId);
                        result.complete(false);
                        return;
                    }
                    long delayMs = Math.max(1, Math.min(pollInterval.toMillis(),
                            TimeUnit.NANOSECONDS.toMillis(remainingNanos)));
                    logger.debug("No decision yet for alertId={}, polling again in {} ms", alertId, delayMs);
                    timer.put(alertId, vertx.setTimer(delayMs, id -> {
                        timer.remove(alertId);
                        poll(alertId, deadline, result, timer);
                    }));
                    // cancelled between the check above and scheduling
                    if (result.isDone()) {
                        Long timerId = timer.remove(alertId);
                        if (timerId != null) {
                            vertx.cancelTimer(timerId);
                        }
                    }
                });
    }
}
