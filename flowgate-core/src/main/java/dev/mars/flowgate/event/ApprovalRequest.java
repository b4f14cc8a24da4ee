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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An outstanding or resolved request for a human decision at an approval gate.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class ApprovalRequest {

    private final String alertId;
    private final String reason;
    private final String channel;
    private final Instant createdAt;
    private final boolean resolved;
    private final Boolean approved;

    public ApprovalRequest(String alertId, String reason, String channel, Instant createdAt) {
        this(alertId, reason, channel, createdAt, false, null);
    }

    private ApprovalRequest(String alertId, String reason, String channel, Instant createdAt,
                            boolean resolved, Boolean approved) {
        this.alertId = Objects.requireNonNull(alertId, "alertId cannot be null");
        this.reason = reason;
        this.channel = channel;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        this.resolved = resolved;
        this.approved = approved;
    }

    /**
     * Returns a copy marked resolved with the given outcome.
     */
    public ApprovalRequest resolve(boolean approved) {
        return new ApprovalRequest(alertId, reason, channel, createdAt, true, approved);
    }

    public String getAlertId() {
        return alertId;
    }

    public String getReason() {
        return reason;
    }

    public String getChannel() {
        return channel;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean isResolved() {
        return resolved;
    }

    public Optional<Boolean> getApproved() {
        return Optional.ofNullable(approved);
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alertId);
        payload.put("reason", reason);
        payload.put("channel", channel);
        return payload;
    }

    @Override
    public String toString() {
        return "ApprovalRequest{" +
                "alertId='" + alertId + '\'' +
                ", reason='" + reason + '\'' +
                ", channel='" + channel + '\'' +
                ", resolved=" + resolved +
                (approved != null ? ", approved=" + approved : "") +
                '}';
    }
}
