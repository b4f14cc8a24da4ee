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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonLinesEventLogTest extends EventLogContractTest {

    @Override
    protected EventLog createLog(Path dir) {
        return new JsonLinesEventLog(dir.resolve("events.jsonl"), false);
    }

    @Test
    @DisplayName("Torn trailing line is ignored")
    void tornTrailingLine() throws Exception {
        log.append(Event.of("a", Map.of()));
        Files.write(tempDir.resolve("events.jsonl"), "{\"event\":\"b\",\"da".getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.APPEND);

        List<Event> events = log.readAll();
        assertEquals(1, events.size());
        assertEquals("a", events.get(0).getType());
    }

    @Test
    @DisplayName("Corrupt line in the middle fails the read")
    void corruptMiddleLine() throws Exception {
        Path file = tempDir.resolve("events.jsonl");
        log.append(Event.of("a", Map.of()));
        Files.write(file, "garbage\n".getBytes(StandardCharsets.UTF_8), StandardOpenOption.APPEND);
        log.append(Event.of("b", Map.of()));

        assertThrows(EventLogException.class, () -> log.readAll());
    }
}
