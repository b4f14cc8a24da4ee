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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowgate.config.JacksonConfig;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.event.Event;
import dev.mars.flowgate.storage.DurableFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only event log with one JSON record per line.
 *
 * <p>Appends cost the same regardless of log size. A torn trailing line, left by a crash
 * in the middle of a write, is ignored on read; a corrupt line anywhere else fails the
 * read.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class JsonLinesEventLog implements EventLog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesEventLog.class);

    private final Path file;
    private final boolean fsyncEnabled;
    private final ObjectMapper mapper = JacksonConfig.newObjectMapper();

    public JsonLinesEventLog(Path file, boolean fsyncEnabled) {
        this.file = file;
        this.fsyncEnabled = fsyncEnabled;
    }

    @Override
    public void append(Event event) throws EventLogException {
        try {
            byte[] line = (mapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
            DurableFiles.withExclusiveLock(file, () -> {
                DurableFiles.append(file, line, fsyncEnabled);
                return null;
            });
        } catch (IOException e) {
            throw new EventLogException("Failed to append event '" + event.getType() + "' to " + file, e);
        }
    }

    @Override
    public List<Event> readAll() throws EventLogException {
        List<String> lines;
        try {
            lines = DurableFiles.withExclusiveLock(file, () ->
                    Files.exists(file) ? Files.readAllLines(file, StandardCharsets.UTF_8) : List.of());
        } catch (IOException e) {
            throw new EventLogException("Failed to read event log " + file, e);
        }

        List<Event> events = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(mapper.readValue(line, Event.class));
            } catch (JsonProcessingException e) {
                if (i == lines.size() - 1) {
                    LOG.warn("Ignoring torn trailing record at line {} of {}", i + 1, file);
                } else {
                    throw new EventLogException("Corrupt record at line " + (i + 1) + " of " + file, e);
                }
            }
        }
        return events;
    }

    @Override
    public void clear() throws EventLogException {
        try {
            DurableFiles.withExclusiveLock(file, () -> {
                DurableFiles.writeAtomically(file, new byte[0], fsyncEnabled);
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
}
