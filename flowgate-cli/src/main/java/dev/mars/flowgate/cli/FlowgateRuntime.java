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

package dev.mars.flowgate.cli;

import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.bus.EventLog;
import dev.mars.flowgate.bus.EventLogFactory;
import dev.mars.flowgate.config.FlowgateConfiguration;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.core.exceptions.FlowgateException;
import dev.mars.flowgate.metrics.JsonFileMetricsStore;
import dev.mars.flowgate.metrics.MetricsEventListener;
import dev.mars.flowgate.metrics.MetricsRecorder;
import dev.mars.flowgate.notification.EventBusNotificationService;
import dev.mars.flowgate.notification.GuardedNotificationService;
import dev.mars.flowgate.notification.LoggingNotificationService;
import dev.mars.flowgate.notification.NotificationService;
import dev.mars.flowgate.workflow.DefaultWorkflowEngine;
import dev.mars.flowgate.workflow.ExecutionCondition;
import dev.mars.flowgate.workflow.WorkflowControlListener;
import dev.mars.flowgate.workflow.approval.ApprovalGateway;
import dev.mars.flowgate.workflow.catalog.WorkflowCatalog;
import dev.mars.flowgate.workflow.store.JsonFileWorkflowRunStore;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Wires the event log, bus, metrics, catalog, approval gateway and engine for one CLI
 * invocation, all rooted at the configured data directory.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class FlowgateRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(FlowgateRuntime.class);

    public static final String METRICS_FILE = "metrics.json";
    public static final String RUNS_FILE = "runs.json";

    private final FlowgateConfiguration configuration;
    private final Vertx vertx;
    private final EventBus eventBus;
    private final MetricsRecorder metrics;
    private final WorkflowCatalog catalog;
    private final ApprovalGateway approvalGateway;
    private final DefaultWorkflowEngine engine;

    private FlowgateRuntime(FlowgateConfiguration configuration, Vertx vertx) throws FlowgateException {
        this.configuration = configuration;
        this.vertx = vertx;
        Path dataDir = configuration.getDataDirectory();

        EventLog eventLog = EventLogFactory.create(configuration);
        this.eventBus = new EventBus(eventLog, configuration.getMaxPublishDepth());

        this.metrics = new MetricsRecorder(new JsonFileMetricsStore(dataDir.resolve(METRICS_FILE),
                configuration.isEventLogFsync()), !configuration.isPeriodicMetricsFlush());
        metrics.init();
        if (configuration.isPeriodicMetricsFlush()) {
            metrics.startPeriodicFlush(vertx, configuration.getMetricsFlushIntervalMs());
        }
        new MetricsEventListener(metrics).register(eventBus);

        this.catalog = WorkflowCatalog.load(configuration);
        NotificationService notifications = new GuardedNotificationService(
                new LoggingNotificationService(), new EventBusNotificationService(eventBus));
        this.approvalGateway = new ApprovalGateway(eventBus, notifications, vertx,
                configuration.getApprovalPollInterval());

        this.engine = DefaultWorkflowEngine.builder()
                .eventBus(eventBus)
                .approvalGateway(approvalGateway)
                .catalog(catalog)
                .notifications(notifications)
                .metrics(metrics)
                .runStore(new JsonFileWorkflowRunStore(dataDir.resolve(RUNS_FILE), configuration.isEventLogFsync()))
                .condition(new ExecutionCondition(Clock.systemDefaultZone(),
                        configuration.getBusinessHoursStart(), configuration.getBusinessHoursEnd()))
                .notificationChannel(configuration.getNotificationChannel())
                .escalationChannel(configuration.getEscalationChannel())
                .approvalTimeout(configuration.getApprovalTimeout())
                .controlPollInterval(configuration.getApprovalPollInterval())
                .build();
        new WorkflowControlListener(engine, engine.getExecutor()).register(eventBus);
        logger.debug("Runtime opened: {}", configuration);
    }

    /**
     * Opens a runtime for the given configuration. The caller closes it.
     *
     * @throws FlowgateException if persisted state or the template catalog cannot be loaded
     */
    public static FlowgateRuntime open(FlowgateConfiguration configuration) throws FlowgateException {
        Vertx vertx = Vertx.vertx();
        try {
            return new FlowgateRuntime(configuration, vertx);
        } catch (FlowgateException | RuntimeException e) {
            vertx.close();
            throw e;
        }
    }

    public FlowgateConfiguration getConfiguration() {
        return configuration;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public MetricsRecorder getMetrics() {
        return metrics;
    }

    public WorkflowCatalog getCatalog() {
        return catalog;
    }

    public ApprovalGateway getApprovalGateway() {
        return approvalGateway;
    }

    public DefaultWorkflowEngine getEngine() {
        return engine;
    }

    @Override
    public void close() {
        engine.shutdown();
        try {
            metrics.close();
        } catch (EventLogException e) {
            logger.error("Failed to flush metrics on close", e);
        }
        try {
            vertx.close().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.warn("Vert.x did not close cleanly: {}", e.getMessage());
        }
    }
}
