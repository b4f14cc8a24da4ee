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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.flowgate.config.JacksonConfig;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.event.Event;
import dev.mars.flowgate.storage.DurableFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Event log kept as one JSON document {@code {"events":[...]}}.
 *
 * <p>Every append re-reads the document, adds the event and replaces the file atomically
 * while holding the file's exclusive lock, so concurrent writers in other processes never
 * lose each other's events. The cost of an append grows with the size of the log; use
 * {@link JsonLinesEventLog} for long-lived installations.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class JsonDocumentEventLog implements EventLog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonDocumentEventLog.class);

    private final Path file;
    private final boolean fsyncEnabled;
    private final ObjectMapper mapper;

    public JsonDocumentEventLog(Path file, boolean fsyncEnabled) {
        this.file = file;
        this.fsyncEnabled = fsyncEnabled;
        this.mapper = JacksonConfig.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void append(Event event) throws EventLogException {
        try {
            DurableFiles.withExclusiveLock(file, () -> {
                EventDocument document = readDocument();
                document.events.add(event);
                DurableFiles.writeAtomically(file, mapper.writeValueAsBytes(document), fsyncEnabled);
                return null;
            });
            LOG.debug("Appended event '{}' to {}", event.getType(), file);
        } catch (IOException e) {
            throw new EventLogException("Failed to append event '" + event.getType() + "' to " + file, e);
        }
    }

    @Override
    public List<Event> readAll() throws EventLogException {
        try {
            return DurableFiles.withExclusiveLock(file, () -> List.copyOf(readDocument().events));
        } catch (IOException e) {
            throw new EventLogException("Failed to read event log " + file, e);
        }
    }

    @Override
    public void clear() throws EventLogException {
        try {
            DurableFiles.withExclusiveLock(file, () -> {
                DurableFiles.writeAtomically(file, mapper.writeValueAsBytes(new EventDocument()), fsyncEnabled);
                return null;
            });
            LOG.info("Cleared event log {}", file);
        } catch (IOException e) {
            throw new EventLogException("Failed to clear event log " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private EventDocument readDocument() throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return new EventDocument();
        }
        EventDocument document = mapper.readValue(file.toFile(), EventDocument.class);
        if (document.events == null) {
            document.events = new ArrayList<>();
        }
        return document;
    }

    static final class EventDocument {
        public List<Event> events = new ArrayList<>();
    }
}
