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
import dev.mars.flowgate.event.EventContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Process-local publish/subscribe bus backed by a durable {@link EventLog}.
 *
 * <p>{@link #publish(String, Map)} validates the payload of known event types, appends the
 * event to the log under an exclusive lock and then, with the lock released, invokes the
 * subscribers registered for that type in registration order on the calling thread. A
 * failing subscriber is logged and does not affect the other subscribers or the persisted
 * event. Persistence failures propagate to the publisher.</p>
 *
 * <p>Subscribers may publish from inside a callback. Nesting is bounded per thread by
 * {@code maxPublishDepth}; a deeper publish fails with {@link IllegalStateException}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class EventBus {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_MAX_PUBLISH_DEPTH = 16;

    private final EventLog eventLog;
    private final int maxPublishDepth;
    private final ReentrantLock publishLock = new ReentrantLock(true);
    private final ConcurrentMap<String, CopyOnWriteArrayList<EventSubscriber>> subscribers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<EventSubscriber> allEventSubscribers = new CopyOnWriteArrayList<>();
    private final ThreadLocal<Integer> publishDepth = ThreadLocal.withInitial(() -> 0);

    // guarded by publishLock
    private Instant lastTimestamp = Instant.EPOCH;

    public EventBus(EventLog eventLog) {
        this(eventLog, DEFAULT_MAX_PUBLISH_DEPTH);
    }

    public EventBus(EventLog eventLog, int maxPublishDepth) {
        if (maxPublishDepth < 1) {
            throw new IllegalArgumentException("maxPublishDepth must be at least 1");
        }
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog cannot be null");
        this.maxPublishDepth = maxPublishDepth;
    }

    public Event publish(String eventType, Map<String, Object> payload) throws EventLogException {
        return publish(eventType, payload, null);
    }

    /**
     * Persists a new event and delivers it to the subscribers of its type.
     *
     * @param eventType     event type, never blank
     * @param payload       structured payload; known types must carry their required fields
     * @param correlationId optional id linking related events, typically a run id
     * @return the event as persisted
     * @throws EventLogException        if the event could not be persisted
     * @throws IllegalArgumentException if the payload violates the contract of a known type
     * @throws IllegalStateException    if nested publishing exceeds the configured depth
     */
    public Event publish(String eventType, Map<String, Object> payload, String correlationId) throws EventLogException {
        EventContract.validate(eventType, payload);

        int depth = publishDepth.get();
        if (depth >= maxPublishDepth) {
            throw new IllegalStateException("Nested publish depth " + depth + " exceeds limit "
                    + maxPublishDepth + " while publishing '" + eventType + "'");
        }

        Event event;
        publishLock.lock();
        try {
            event = new Event(eventType, payload, nextTimestamp(), correlationId);
            eventLog.append(event);
        } finally {
            publishLock.unlock();
        }
        logger.info("Published event '{}'{}", eventType,
                correlationId != null ? " [" + correlationId + "]" : "");

        publishDepth.set(depth + 1);
        try {
            dispatch(event, subscribers.get(eventType));
            dispatch(event, allEventSubscribers);
        } finally {
            if (depth == 0) {
                publishDepth.remove();
            } else {
                publishDepth.set(depth);
            }
        }
        return event;
    }

    public void subscribe(String eventType, EventSubscriber subscriber) {
        Objects.requireNonNull(eventType, "eventType cannot be null");
        Objects.requireNonNull(subscriber, "subscriber cannot be null");
        subscribers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).addIfAbsent(subscriber);
        logger.debug("Subscribed {} to '{}'", subscriber, eventType);
    }

    /**
     * Removes a subscription. Removing a subscriber that is not registered is a no-op.
     */
    public void unsubscribe(String eventType, EventSubscriber subscriber) {
        List<EventSubscriber> list = subscribers.get(eventType);
        if (list != null && list.remove(subscriber)) {
            logger.debug("Unsubscribed {} from '{}'", subscriber, eventType);
        }
    }

    /**
     * Registers a subscriber that receives every event after the type-specific subscribers.
     */
    public void subscribeAll(EventSubscriber subscriber) {
        allEventSubscribers.addIfAbsent(Objects.requireNonNull(subscriber, "subscriber cannot be null"));
    }

    public void unsubscribeAll(EventSubscriber subscriber) {
        allEventSubscribers.remove(subscriber);
    }

    public int subscriberCount(String eventType) {
        List<EventSubscriber> list = subscribers.get(eventType);
        return list == null ? 0 : list.size();
    }

    /**
     * Every logged event in log order. The log is re-read on each call.
     */
    public Stream<Event> getEvents() throws EventLogException {
        return eventLog.readAll().stream();
    }

    public Stream<Event> getEvents(String eventType) throws EventLogException {
        return getEvents().filter(event -> event.getType().equals(eventType));
    }

    /**
     * Events of one type whose timestamp is strictly after {@code since}.
     */
    public Stream<Event> getEvents(String eventType, Instant since) throws EventLogException {
        Stream<Event> events = eventType == null ? getEvents() : getEvents(eventType);
        return since == null ? events : events.filter(event -> event.getTimestamp().isAfter(since));
    }

    public void clear() throws EventLogException {
        publishLock.lock();
        try {
            eventLog.clear();
        } finally {
            publishLock.unlock();
        }
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    private Instant nextTimestamp() {
        Instant now = Instant.now();
        // strictly increasing so that "since" filters never drop an event
        if (!now.isAfter(lastTimestamp)) {
            now = lastTimestamp.plusNanos(1000);
        }
        lastTimestamp = now;
        return now;
    }

    private void dispatch(Event event, List<EventSubscriber> targets) {
        if (targets == null) {
            return;
        }
        for (EventSubscriber subscriber : targets) {
            try {
                subscriber.onEvent(event);
            } catch (Exception e) {
                logger.error("Subscriber {} failed handling event '{}'", subscriber, event.getType(), e);
            }
        }
    }
}
