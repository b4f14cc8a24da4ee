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

import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.bus.EventSubscriber;
import dev.mars.flowgate.core.exceptions.FlowgateException;
import dev.mars.flowgate.event.Event;
import dev.mars.flowgate.event.EventContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives the engine from control events published on the bus.
 *
 * <p>Subscribers run on the publisher's thread, so each request is handed to the executor
 * and the publisher returns immediately. Requests for unknown runs or invalid transitions
 * are logged and dropped.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkflowControlListener {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowControlListener.class);

    @FunctionalInterface
    private interface ControlAction {
        void apply(String runId) throws FlowgateException;
    }

    private final WorkflowEngine engine;
    private final Executor executor;
    private final Map<EventContract, EventSubscriber> subscribers;

    public WorkflowControlListener(WorkflowEngine engine, Executor executor) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.subscribers = Map.of(
                EventContract.WORKFLOW_EXECUTION_REQUESTED, handler(engine::start),
                EventContract.WORKFLOW_PAUSE_REQUESTED, handler(engine::pause),
                EventContract.WORKFLOW_RESUME_REQUESTED, handler(engine::resume),
                EventContract.WORKFLOW_CANCEL_REQUESTED, handler(engine::cancel));
    }

    public void register(EventBus bus) {
        subscribers.forEach((contract, subscriber) -> bus.subscribe(contract.eventType(), subscriber));
    }

    public void unregister(EventBus bus) {
        subscribers.forEach((contract, subscriber) -> bus.unsubscribe(contract.eventType(), subscriber));
    }

    private EventSubscriber handler(ControlAction action) {
        return event -> dispatch(event, action);
    }

    private void dispatch(Event event, ControlAction action) {
        String runId = event.getString("runId");
        try {
            executor.execute(() -> {
                try {
                    action.apply(runId);
                    logger.info("Handled {} for run {}", event.getType(), runId);
                } catch (FlowgateException e) {
                    logger.warn("Ignoring {} for run {}: {}", event.getType(), runId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            logger.warn("Engine is shut down, dropping {} for run {}", event.getType(), runId);
        }
    }
}
