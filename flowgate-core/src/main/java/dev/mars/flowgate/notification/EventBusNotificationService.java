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

package dev.mars.flowgate.notification;

import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.event.EventContract;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Records notifications as events so that external adapters can subscribe to them.
 * Approval requests are published as {@code approval_requested}, everything else as
 * {@code notification}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class EventBusNotificationService implements NotificationService {

    private final EventBus eventBus;

    public EventBusNotificationService(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    @Override
    public void notify(String message, String channel) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("channel", channel);
        publish(EventContract.NOTIFICATION.eventType(), payload);
    }

    @Override
    public void notifyApprovalNeeded(String reason, String channel, String alertId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("alertId", alertId);
        payload.put("reason", reason);
        payload.put("channel", channel);
        publish(EventContract.APPROVAL_REQUESTED.eventType(), payload);
    }

    private void publish(String type, Map<String, Object> payload) {
        try {
            eventBus.publish(type, payload);
        } catch (EventLogException e) {
            throw new NotificationException("Failed to record '" + type + "' notification", e);
        }
    }

    /**
     * Unchecked failure raised to the caller; {@link GuardedNotificationService} absorbs it.
     */
    public static class NotificationException extends RuntimeException {
        public NotificationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
