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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * OpenTelemetry mirror of the Flowgate counters.
 *
 * Every recorder counter {@code x} is exported as {@code flowgate.x}; workflow durations
 * feed the {@code flowgate.workflow.duration.seconds} histogram. Without an SDK on the
 * classpath the global meter is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0 (OpenTelemetry)
 */
public class FlowgateTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(FlowgateTelemetryMetrics.class);
    private static final String METER_NAME = "flowgate";

    private static FlowgateTelemetryMetrics instance;

    private static final AttributeKey<String> METRIC_NAME_KEY = AttributeKey.stringKey("metric.name");

    private final Meter meter;
    private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
    private final DoubleHistogram workflowDuration;

    private FlowgateTelemetryMetrics() {
        meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        workflowDuration = meter.histogramBuilder("flowgate.workflow.duration.seconds")
                .setDescription("Workflow duration in seconds")
                .setUnit("s")
                .build();

        logger.info("FlowgateTelemetryMetrics initialized");
    }

    /**
     * Get the singleton instance of FlowgateTelemetryMetrics.
     */
    public static synchronized FlowgateTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new FlowgateTelemetryMetrics();
        }
        return instance;
    }

    public void recordIncrement(String name, long delta) {
        counters.computeIfAbsent(name, n -> meter.counterBuilder("flowgate." + n)
                        .setDescription("Flowgate counter " + n)
                        .setUnit("1")
                        .build())
                .add(delta);
    }

    public void recordDuration(String name, double seconds) {
        workflowDuration.record(seconds, Attributes.of(METRIC_NAME_KEY, name));
    }
}
