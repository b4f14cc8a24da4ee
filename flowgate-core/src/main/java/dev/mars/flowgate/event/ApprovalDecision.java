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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Typed view of a {@code decision} event.
 *
 * @param alertId  gate invocation the decision answers
 * @param approved whether the gate may proceed
 * @param user     who decided, may be null
 * @param channel  where the decision was taken, may be null
 */
public record ApprovalDecision(String alertId, boolean approved, String user, String channel) {

    public ApprovalDecision {
        Objects.requireNonNull(alertId, "alertId cannot be null");
    }

    public static ApprovalDecision fromEvent(Event event) {
        if (!EventContract.DECISION.eventType().equals(event.getType())) {
            throw new IllegalArgumentException("Not a decision event: " + event.getType());
        }
        Object approved = event.getPayload().get("approved");
        boolean value = approved instanceof Boolean ? (Boolean) approved : Boolean.parseBoolean(String.valueOf(approved));
        return new ApprovalDecision(event.getString("alertId"), value,
                event.getString("user"), event.getString("channel"));
    }

    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alertId);
        payload.put("approved", approved);
        if (user != null) {
            payload.put("user", user);
        }
        if (channel != null) {
            payload.put("channel", channel);
        }
        return payload;
    }
}
