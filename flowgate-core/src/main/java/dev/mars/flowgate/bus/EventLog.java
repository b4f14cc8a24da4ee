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

import java.util.List;

/**
 * Durable, totally ordered storage of events behind the {@link EventBus}.
 *
 * <p><b>Contract:</b> once {@link #append(Event)} returns, the event survives a process
 * restart and appears in {@link #readAll()} after every event appended before it.</p>
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>{@link JsonDocumentEventLog} - single JSON document rewritten on each append (default)</li>
 *   <li>{@link JsonLinesEventLog} - append-only JSON lines</li>
 *   <li>{@link InMemoryEventLog} - testing only</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public interface EventLog {

    /**
     * Durably appends an event to the end of the log.
     *
     * @throws EventLogException if the event could not be persisted
     */
    void append(Event event) throws EventLogException;

    /**
     * Reads the complete log in append order.
     *
     * @throws EventLogException if the log exists but cannot be read
     */
    List<Event> readAll() throws EventLogException;

    /**
     * Truncates the log to empty. Intended for tests and operator resets.
     */
    void clear() throws EventLogException;
}
