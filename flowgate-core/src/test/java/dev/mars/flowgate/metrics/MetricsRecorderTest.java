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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.bus.InMemoryEventLog;
import dev.mars.flowgate.core.exceptions.EventLogException;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link MetricsRecorder} and its stores.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class MetricsRecorderTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Counters survive a restart")
        void survivesRestart() throws Exception {
            Path file = tempDir.resolve("metrics.json");
            MetricsRecorder first = new MetricsRecorder(new JsonFileMetricsStore(file, false), true);
            first.init();
            first.increment(MetricsRecorder.WORKFLOWS_STARTED);
            first.increment(MetricsRecorder.WORKFLOWS_STARTED);
            first.recordDuration("run-1", 1.5);
            first.close();

            MetricsRecorder second = new MetricsRecorder(new JsonFileMetricsStore(file, false), true);
            second.init();

            assertEquals(2, second.getCounter(MetricsRecorder.WORKFLOWS_STARTED));
            assertEquals(1.5, second.getDurations().get("run-1"));
        }

        @Test
        @DisplayName("Increments made before init are added to persisted values")
        void additiveMergeOnInit() throws Exception {
            InMemoryMetricsStore store = new InMemoryMetricsStore();
            store.update(s -> s.merge(Map.of(MetricsRecorder.ESCALATIONS, 5L), Map.of()));

            MetricsRecorder recorder = new MetricsRecorder(store, false);
            recorder.increment(MetricsRecorder.ESCALATIONS, 2);
            recorder.init();

            assertEquals(7, recorder.getCounter(MetricsRecorder.ESCALATIONS));
            recorder.flush();
            assertEquals(7, store.load().getCounter(MetricsRecorder.ESCALATIONS));
        }

        @Test
        @DisplayName("Two recorders sharing a file never overwrite each other")
        void sharedFile() throws Exception {
            Path file = tempDir.resolve("metrics.json");
            MetricsRecorder a = new MetricsRecorder(new JsonFileMetricsStore(file, false), false);
            MetricsRecorder b = new MetricsRecorder(new JsonFileMetricsStore(file, false), false);
            a.init();
            b.init();

            a.increment(MetricsRecorder.HITL_DECISIONS, 3);
            b.increment(MetricsRecorder.HITL_DECISIONS, 4);
            a.flush();
            b.flush();

            assertEquals(7, new JsonFileMetricsStore(file, false).load().getCounter(MetricsRecorder.HITL_DECISIONS));
        }

        @Test
        @DisplayName("Failed immediate flush keeps the deltas for the next flush")
        void failedFlushRetained() throws Exception {
            MetricsStore store = mock(MetricsStore.class);
            when(store.update(any())).thenThrow(new EventLogException("read-only"));
            MetricsRecorder recorder = new MetricsRecorder(store, true);

            assertDoesNotThrow(() -> recorder.increment(MetricsRecorder.WORKFLOWS_FAILED));
            assertEquals(1, recorder.getCounter(MetricsRecorder.WORKFLOWS_FAILED));
            assertThrows(EventLogException.class, recorder::flush);
        }

        @Test
        @DisplayName("Periodic mode flushes on a timer")
        void periodicFlush() throws Exception {
            Vertx vertx = Vertx.vertx();
            try {
                InMemoryMetricsStore store = new InMemoryMetricsStore();
                MetricsRecorder recorder = new MetricsRecorder(store, false);
                recorder.startPeriodicFlush(vertx, 50);

                recorder.increment(MetricsRecorder.COMMANDS_RECEIVED);
                assertEquals(0, store.load().getCounter(MetricsRecorder.COMMANDS_RECEIVED));

                await().atMost(Duration.ofSeconds(5))
                        .pollInterval(Duration.ofMillis(20))
                        .until(() -> store.load().getCounter(MetricsRecorder.COMMANDS_RECEIVED) == 1);
                recorder.close();
            } finally {
                vertx.close();
            }
        }
    }

    @Test
    @DisplayName("Metrics file is a flat object plus workflowDurations")
    void fileFormat() throws Exception {
        Path file = tempDir.resolve("metrics.json");
        MetricsRecorder recorder = new MetricsRecorder(new JsonFileMetricsStore(file, false), true);
        recorder.increment(MetricsRecorder.WORKFLOWS_COMPLETED);
        recorder.recordDuration("run-7", 2.25);

        JsonNode root = new ObjectMapper().readTree(Files.readString(file));
        assertEquals(1, root.get(MetricsRecorder.WORKFLOWS_COMPLETED).asLong());
        assertEquals(2.25, root.get("workflowDurations").get("run-7").asDouble());
    }

    @Test
    @DisplayName("Event listener counts decisions, commands and every published event")
    void eventListener() throws Exception {
        MetricsRecorder recorder = new MetricsRecorder(new InMemoryMetricsStore(), true);
        EventBus bus = new EventBus(new InMemoryEventLog());
        new MetricsEventListener(recorder).register(bus);

        bus.publish("decision", Map.of("alertId", "x", "approved", true));
        bus.publish("command_received", Map.of("command", "/start feature"));
        bus.publish("new_task", Map.of());

        assertEquals(1, recorder.getCounter(MetricsRecorder.HITL_DECISIONS));
        assertEquals(1, recorder.getCounter(MetricsRecorder.COMMANDS_RECEIVED));
        assertEquals(3, recorder.getCounter(MetricsRecorder.EVENTS_PUBLISHED));
    }
}
