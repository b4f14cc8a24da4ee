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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalTime;
import java.util.Locale;

/**
 * Evaluates the small predicate vocabulary accepted by conditional execution.
 *
 * <ul>
 *   <li>{@code true} / {@code false} literals</li>
 *   <li>anything mentioning {@code time} or {@code business_hours}: the current hour lies in the
 *       configured inclusive window</li>
 *   <li>anything mentioning {@code resource}: resource availability, currently always available</li>
 * </ul>
 * Every other predicate is false. Predicates are never evaluated as code.
 */
public class ExecutionCondition {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionCondition.class);

    private final Clock clock;
    private final int businessHoursStart;
    private final int businessHoursEnd;

    public ExecutionCondition(Clock clock, int businessHoursStart, int businessHoursEnd) {
        if (businessHoursStart < 0 || businessHoursEnd > 23 || businessHoursStart > businessHoursEnd) {
            throw new IllegalArgumentException("Invalid business hours window: " + businessHoursStart + "-" + businessHoursEnd);
        }
        this.clock = clock;
        this.businessHoursStart = businessHoursStart;
        this.businessHoursEnd = businessHoursEnd;
    }

    public static ExecutionCondition defaults() {
        return new ExecutionCondition(Clock.systemDefaultZone(), 9, 17);
    }

    public boolean evaluate(String predicate) {
        if (predicate == null || predicate.isBlank()) {
            return false;
        }
        String normalized = predicate.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("true")) {
            return true;
        }
        if (normalized.equals("false")) {
            return false;
        }
        if (normalized.contains("business_hours") || normalized.contains("time")) {
            int hour = LocalTime.now(clock).getHour();
            return hour >= businessHoursStart && hour <= businessHoursEnd;
        }
        if (normalized.contains("resource")) {
            return true;
        }
        logger.warn("Unsupported condition '{}', treating as false", predicate);
        return false;
    }
}
