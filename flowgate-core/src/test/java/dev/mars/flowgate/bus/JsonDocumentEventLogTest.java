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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.event.Event;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonDocumentEventLogTest extends EventLogContractTest {

    @Override
    protected EventLog createLog(Path dir) {
        return new JsonDocumentEventLog(dir.resolve("events.json"), false);
    }

    @Test
    @DisplayName("File is a single document with an events array")
    void documentFormat() throws Exception {
        log.append(Event.of("build_triggered", Map.of("runId", "r-9")));

        JsonNode root = new ObjectMapper().readTree(tempDir.resolve("events.json").toFile());
        assertTrue(root.get("events").isArray());
        JsonNode record = root.get("events").get(0);
        assertEquals("build_triggered", record.get("event").asText());
        assertEquals("r-9", record.get("data").get("runId").asText());
        assertTrue(record.get("timestamp").isTextual(), "timestamp is ISO-8601 text");
    }

    @Test
    @DisplayName("A second instance on the same file sees earlier appends")
    void survivesReopen() throws Exception {
        log.append(Event.of("a", Map.of()));
        EventLog reopened = createLog(tempDir);
        reopened.append(Event.of("b", Map.of()));

        assertEquals(2, log.readAll().size());
    }

    @Test
    @DisplayName("Corrupt document fails the read")
    void corruptDocument() throws Exception {
        Files.writeString(tempDir.resolve("events.json"), "{\"events\": [ {");
        assertThrows(EventLogException.class, () -> log.readAll());
        assertThrows(EventLogException.class, () -> log.append(Event.of("a", Map.of())));
    }
}
