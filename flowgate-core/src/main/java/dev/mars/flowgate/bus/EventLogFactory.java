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

import dev.mars.flowgate.config.FlowgateConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Creates the event log selected by {@code flowgate.eventlog.format}.
 */
public final class EventLogFactory {

    private static final Logger LOG = LoggerFactory.getLogger(EventLogFactory.class);

    public static final String DOCUMENT_FILE = "events.json";
    public static final String JSON_LINES_FILE = "events.jsonl";

    private EventLogFactory() {
    }

    public static EventLog create(FlowgateConfiguration configuration) {
        Path dataDir = configuration.getDataDirectory();
        String format = configuration.getEventLogFormat().trim().toLowerCase();
        boolean fsync = configuration.isEventLogFsync();
        switch (format) {
            case "jsonl":
                LOG.info("Using JSON lines event log in {}", dataDir);
                return new JsonLinesEventLog(dataDir.resolve(JSON_LINES_FILE), fsync);
            case "document":
                LOG.info("Using JSON document event log in {}", dataDir);
                return new JsonDocumentEventLog(dataDir.resolve(DOCUMENT_FILE), fsync);
            default:
                LOG.warn("Unknown event log format '{}'. Using default: document", format);
                return new JsonDocumentEventLog(dataDir.resolve(DOCUMENT_FILE), fsync);
        }
    }
}
