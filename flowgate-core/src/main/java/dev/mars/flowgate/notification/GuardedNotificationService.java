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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Fan-out wrapper that never lets a notification failure reach the caller.
 * Each delegate is called in order; a failing delegate is logged as a warning and the
 * remaining delegates are still called.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class GuardedNotificationService implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(GuardedNotificationService.class);

    private final List<NotificationService> delegates;

    public GuardedNotificationService(NotificationService... delegates) {
        this.delegates = List.of(delegates);
    }

    public GuardedNotificationService(List<NotificationService> delegates) {
        this.delegates = List.copyOf(Objects.requireNonNull(delegates, "delegates cannot be null"));
    }

    @Override
    public void notify(String message, String channel) {
        for (NotificationService delegate : delegates) {
            try {
                delegate.notify(message, channel);
            } catch (RuntimeException e) {
                logger.warn("Notification to {} via {} failed: {}", channel, delegate.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void notifyApprovalNeeded(String reason, String channel, String alertId) {
        for (NotificationService delegate : delegates) {
            try {
                delegate.notifyApprovalNeeded(reason, channel, alertId);
            } catch (RuntimeException e) {
                logger.warn("Approval notification {} to {} via {} failed: {}", alertId, channel,
                        delegate.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }
}
