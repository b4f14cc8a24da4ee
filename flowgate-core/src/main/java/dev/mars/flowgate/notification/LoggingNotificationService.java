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

/**
 * Default collaborator that writes notifications to the log.
 */
public class LoggingNotificationService implements NotificationService {

    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationService.class);

    @Override
    public void notify(String message, String channel) {
        logger.info("[{}] {}", channel, message);
    }

    @Override
    public void notifyApprovalNeeded(String reason, String channel, String alertId) {
        logger.info("[{}] Approval needed: {} (alertId={})", channel, reason, alertId);
    }
}
