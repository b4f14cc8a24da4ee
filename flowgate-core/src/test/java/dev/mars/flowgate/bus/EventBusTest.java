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

package dev.mars.flowgate.bus;

import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.event.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Tests for {@link EventBus}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class EventBusTest {

    private EventBus bus;

    @BeforeEach
    void setUp() {
        bus = new EventBus(new InMemoryEventLog());
    }

    @Nested
    @DisplayName("Subscriptions")
    class Subscriptions {

        @Test
        @DisplayName("Subscriber is invoked exactly once with the published payload")
        void subscribeThenPublish() throws Exception {
            List<Event> received = new ArrayList<>();
            bus.subscribe("new_task", received::add);

            bus.publish("new_task", Map.of("task", "write docs"));

            assertEquals(1, received.size());
            assertEquals(Map.of("task", "write docs"), received.get(0).getPayload());
        }

        @Test
        @DisplayName("Unsubscribed callback is never invoked again")
        void unsubscribe() throws Exception {
            AtomicInteger calls = new AtomicInteger();
            EventSubscriber subscriber = event -> calls.incrementAndGet();
            bus.subscribe("new_task", subscriber);
            bus.publish("new_task", Map.of());

            bus.unsubscribe("new_task", subscriber);
            bus.publish("new_task", Map.of());

            assertEquals(1, calls.get());
            assertEquals(0, bus.subscriberCount("new_task"));
        }

        @Test
        @DisplayName("Removing an absent subscriber is a no-op")
        void unsubscribeAbsent() {
            assertDoesNotThrow(() -> bus.unsubscribe("never_subscribed", event -> { }));
        }

        @Test
        @DisplayName("Subscribers run in registration order and only for their type")
        void registrationOrder() throws Exception {
            List<String> calls = new ArrayList<>();
            bus.subscribe("a", event -> calls.add("first"));
            bus.subscribe("a", event -> calls.add("second"));
            bus.subscribe("b", event -> calls.add("other"));

            bus.publish("a", Map.of());

            assertEquals(List.of("first", "second"), calls);
        }

        @Test
        @DisplayName("A failing subscriber does not stop delivery or persistence")
        void failingSubscriberIsolated() throws Exception {
            List<Event> received = new ArrayList<>();
            bus.subscribe("a", event -> {
                throw new IllegalStateException("boom");
            });
            bus.subscribe("a", received::add);

            Event event = bus.publish("a", Map.of("x", 1));

            assertEquals(1, received.size());
            assertEquals(List.of(event), bus.getEvents().collect(Collectors.toList()));
        }
    }

    @Nested
    @DisplayName("Publishing")
    class Publishing {

        @Test
        @DisplayName("Contract violations are rejected before persistence")
        void contractViolation() throws Exception {
            assertThrows(IllegalArgumentException.class, () -> bus.publish("decision", Map.of("approved", true)));
            assertEquals(0, bus.getEvents().count());
        }

        @Test
        @DisplayName("Persistence failure propagates and no subscriber runs")
        void persistenceFailure() throws Exception {
            EventLog failing = mock(EventLog.class);
            doThrow(new EventLogException("disk full")).when(failing).append(any());
            EventSubscriber subscriber = mock(EventSubscriber.class);
            EventBus failingBus = new EventBus(failing);
            failingBus.subscribe("a", subscriber);

            assertThrows(EventLogException.class, () -> failingBus.publish("a", Map.of()));
            verifyNoInteractions(subscriber);
        }

        @Test
        @DisplayName("Subscribers may publish from inside a callback")
        void reentrantPublish() throws Exception {
            bus.subscribe("tests_requested", event -> bus.publish("tests_completed", Map.of()));

            bus.publish("tests_requested", Map.of());

            assertEquals(List.of("tests_requested", "tests_completed"),
                    bus.getEvents().map(Event::getType).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("Unbounded recursive publishing stops at the depth limit")
        void depthGuard() throws Exception {
            EventBus shallow = new EventBus(new InMemoryEventLog(), 3);
            shallow.subscribe("loop", event -> shallow.publish("loop", Map.of()));

            shallow.publish("loop", Map.of());

            // outer publish plus two nested levels before the guard trips
            assertEquals(3, shallow.getEvents().count());
        }

        @Test
        @DisplayName("Timestamps strictly increase so 'since' is exclusive and loses nothing")
        void sinceFilter() throws Exception {
            Event first = bus.publish("a", Map.of("n", 1));
            Event second = bus.publish("a", Map.of("n", 2));
            bus.publish("b", Map.of());

            assertTrue(second.getTimestamp().isAfter(first.getTimestamp()));
            List<Event> after = bus.getEvents("a", first.getTimestamp()).collect(Collectors.toList());
            assertEquals(List.of(second), after);
            assertEquals(2, bus.getEvents("a", Instant.EPOCH).count());
            assertEquals(3, bus.getEvents(null, null).count());
        }

        @Test
        @DisplayName("clear empties the log")
        void clear() throws Exception {
            bus.publish("a", Map.of());
            bus.clear();
            assertEquals(0, bus.getEvents().count());
        }

        @Test
        @DisplayName("subscribeAll sees every event after the typed subscribers")
        void subscribeAll() throws Exception {
            List<String> calls = new ArrayList<>();
            bus.subscribe("a", event -> calls.add("typed"));
            bus.subscribeAll(event -> calls.add("all:" + event.getType()));

            bus.publish("a", Map.of());
            bus.publish("b", Map.of());

            assertEquals(List.of("typed", "all:a", "all:b"), calls);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Concurrent publishers never lose events on a file backed log")
        void concurrentPublishers() throws Exception {
            EventBus fileBus = new EventBus(new JsonDocumentEventLog(tempDir.resolve("events.json"), false));
            int publishers = 8;
            int perPublisher = 15;
            ExecutorService executor = Executors.newFixedThreadPool(publishers);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int p = 0; p < publishers; p++) {
                    int publisher = p;
                    futures.add(executor.submit(() -> {
                        start.await();
                        for (int i = 0; i < perPublisher; i++) {
                            fileBus.publish("work", Map.of("id", publisher + "-" + i));
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }

            List<Event> events = fileBus.getEvents().collect(Collectors.toList());
            Set<String> ids = events.stream().map(e -> e.getString("id")).collect(Collectors.toSet());
            assertEquals(publishers * perPublisher, events.size());
            assertEquals(publishers * perPublisher, ids.size());

            List<Instant> timestamps = events.stream().map(Event::getTimestamp).collect(Collectors.toList());
            List<Instant> sorted = new ArrayList<>(timestamps);
            Collections.sort(sorted);
            assertThat(timestamps).as("log order is the single total order").isEqualTo(sorted);
            assertThat(new HashSet<>(timestamps)).hasSize(timestamps.size());
        }
    }
}
