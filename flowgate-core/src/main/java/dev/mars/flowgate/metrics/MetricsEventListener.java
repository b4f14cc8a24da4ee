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

package dev.mars.flowgate.metrics;

import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.bus.EventSubscriber;
import dev.mars.flowgate.event.Event;
import dev.mars.flowgate.event.EventContract;

/**
 * Counts decisions, received commands and every published event.
 */
public class MetricsEventListener {

    private final MetricsRecorder metrics;
    private final EventSubscriber decisionSubscriber;
    private final EventSubscriber commandSubscriber;
    private final EventSubscriber publishedSubscriber;

    public MetricsEventListener(MetricsRecorder metrics) {
        this.metrics = metrics;
        this.decisionSubscriber = event -> metrics.increment(MetricsRecorder.HITL_DECISIONS);
        this.commandSubscriber = event -> metrics.increment(MetricsRecorder.COMMANDS_RECEIVED);
        this.publishedSubscriber = this::countPublished;
    }

    public void register(EventBus bus) {
        bus.subscribe(EventContract.DECISION.eventType(), decisionSubscriber);
        bus.subscribe(EventContract.COMMAND_RECEIVED.eventType(), commandSubscriber);
        bus.subscribeAll(publishedSubscriber);
    }

    public void unregister(EventBus bus) {
        bus.unsubscribe(EventContract.DECISION.eventType(), decisionSubscriber);
        bus.unsubscribe(EventContract.COMMAND_RECEIVED.eventType(), commandSubscriber);
        bus.unsubscribeAll(publishedSubscriber);
    }

    private void countPublished(Event event) {
        metrics.increment(MetricsRecorder.EVENTS_PUBLISHED);
    }
}
