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

import dev.mars.flowgate.core.exceptions.EventLogException;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Named counters and run durations that survive restarts.
 *
 * <p>Lifecycle: {@link #init()} loads the persisted values, {@link #flush()} persists,
 * {@link #close()} stops periodic flushing and flushes a final time. Increments made before
 * {@code init()} or between flushes are kept as deltas and added to whatever the store
 * holds at flush time, so values persisted by other processes are never overwritten.</p>
 *
 * <p>In immediate mode every mutation is flushed straight away. A failed flush is logged and
 * its deltas are retried on the next flush.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class MetricsRecorder implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(MetricsRecorder.class);

    public static final String COMMANDS_RECEIVED = "commands_received";
    public static final String HITL_DECISIONS = "hitl_decisions";
    public static final String WORKFLOWS_STARTED = "workflows_started";
    public static final String WORKFLOWS_COMPLETED = "workflows_completed";
    public static final String WORKFLOW_PAUSED = "workflow_paused";
    public static final String WORKFLOWS_FAILED = "workflows_failed";
    public static final String WORKFLOWS_CANCELLED = "workflows_cancelled";
    public static final String ESCALATIONS = "escalations";
    public static final String EVENTS_PUBLISHED = "events_published";

    private final MetricsStore store;
    private final boolean immediateFlush;
    private final FlowgateTelemetryMetrics telemetry;
    private final ReentrantLock lock = new ReentrantLock();

    // guarded by lock
    private MetricsSnapshot persisted = MetricsSnapshot.empty();
    private final Map<String, Long> pendingCounters = new HashMap<>();
    private final Map<String, Double> pendingDurations = new LinkedHashMap<>();

    private Vertx vertx;
    private long flushTimerId;

    public MetricsRecorder(MetricsStore store, boolean immediateFlush) {
        this(store, immediateFlush, FlowgateTelemetryMetrics.getInstance());
    }

    MetricsRecorder(MetricsStore store, boolean immediateFlush, FlowgateTelemetryMetrics telemetry) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.immediateFlush = immediateFlush;
        this.telemetry = telemetry;
    }

    /**
     * Loads the persisted values. In-memory increments recorded so far are kept and added on top.
     */
    public void init() throws EventLogException {
        MetricsSnapshot loaded = store.load();
        lock.lock();
        try {
            persisted = loaded;
        } finally {
            lock.unlock();
        }
        logger.info("Metrics initialised: {}", loaded.getCounters());
    }

    /**
     * Flushes on a Vert.x periodic timer instead of after every mutation.
     */
    public void startPeriodicFlush(Vertx vertx, long intervalMs) {
        lock.lock();
        try {
            if (flushTimerId != 0) {
                return;
            }
            this.vertx = vertx;
            this.flushTimerId = vertx.setPeriodic(intervalMs, id -> {
                try {
                    flush();
                } catch (EventLogException e) {
                    logger.error("Periodic metrics flush failed", e);
                }
            });
        } finally {
            lock.unlock();
        }
        logger.info("Periodic metrics flush every {} ms", intervalMs);
    }

    public void increment(String name) {
        increment(name, 1);
    }

    public void increment(String name, long delta) {
        Objects.requireNonNull(name, "metric name cannot be null");
        lock.lock();
        try {
            pendingCounters.merge(name, delta, Long::sum);
        } finally {
            lock.unlock();
        }
        if (telemetry != null) {
            telemetry.recordIncrement(name, delta);
        }
        flushIfImmediate();
    }

    public void recordDuration(String name, double seconds) {
        Objects.requireNonNull(name, "duration name cannot be null");
        lock.lock();
        try {
            pendingDurations.put(name, seconds);
        } finally {
            lock.unlock();
        }
        if (telemetry != null) {
            telemetry.recordDuration(name, seconds);
        }
        flushIfImmediate();
    }

    public long getCounter(String name) {
        return snapshot().getCounter(name);
    }

    public Map<String, Long> getCounters() {
        return snapshot().getCounters();
    }

    public Map<String, Double> getDurations() {
        return snapshot().getDurations();
    }

    /**
     * Persisted values plus everything recorded since the last flush.
     */
    public MetricsSnapshot snapshot() {
        lock.lock();
        try {
            return persisted.merge(pendingCounters, pendingDurations);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds the pending deltas to the stored values.
     */
    public void flush() throws EventLogException {
        lock.lock();
        try {
            if (pendingCounters.isEmpty() && pendingDurations.isEmpty()) {
                return;
            }
            Map<String, Long> counters = new HashMap<>(pendingCounters);
            Map<String, Double> durations = new LinkedHashMap<>(pendingDurations);
            persisted = store.update(current -> current.merge(counters, durations));
            pendingCounters.clear();
            pendingDurations.clear();
            logger.debug("Flushed metrics: {}", persisted.getCounters());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() throws EventLogException {
        lock.lock();
        try {
            if (flushTimerId != 0 && vertx != null) {
                vertx.cancelTimer(flushTimerId);
                flushTimerId = 0;
            }
        } finally {
            lock.unlock();
        }
        flush();
    }

    private void flushIfImmediate() {
        if (!immediateFlush) {
            return;
        }
        try {
            flush();
        } catch (EventLogException e) {
            logger.error("Failed to persist metrics, will retry on next flush", e);
        }
    }
}
