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
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.flowgate.config.JacksonConfig;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.storage.DurableFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Metrics file holding a flat object of counters plus a nested
 * {@code workflowDurations} map of name to seconds.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class JsonFileMetricsStore implements MetricsStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileMetricsStore.class);

    public static final String DURATIONS_FIELD = "workflowDurations";

    private final Path file;
    private final boolean fsyncEnabled;
    private final ObjectMapper mapper = JacksonConfig.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public JsonFileMetricsStore(Path file, boolean fsyncEnabled) {
        this.file = file;
        this.fsyncEnabled = fsyncEnabled;
    }

    @Override
    public MetricsSnapshot load() throws EventLogException {
        try {
            return DurableFiles.withExclusiveLock(file, this::read);
        } catch (IOException e) {
            throw new EventLogException("Failed to load metrics from " + file, e);
        }
    }

    @Override
    public MetricsSnapshot update(UnaryOperator<MetricsSnapshot> change) throws EventLogException {
        try {
            return DurableFiles.withExclusiveLock(file, () -> {
                MetricsSnapshot updated = change.apply(read());
                DurableFiles.writeAtomically(file, mapper.writeValueAsBytes(toJson(updated)), fsyncEnabled);
                return updated;
            });
        } catch (IOException e) {
            throw new EventLogException("Failed to persist metrics to " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private MetricsSnapshot read() throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return MetricsSnapshot.empty();
        }
        JsonNode root = mapper.readTree(file.toFile());
        Map<String, Long> counters = new TreeMap<>();
        Map<String, Double> durations = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (DURATIONS_FIELD.equals(field.getKey()) && field.getValue().isObject()) {
                field.getValue().fields().forEachRemaining(d -> durations.put(d.getKey(), d.getValue().asDouble()));
            } else if (field.getValue().isNumber()) {
                counters.put(field.getKey(), field.getValue().asLong());
            } else {
                LOG.warn("Ignoring non-numeric metric '{}' in {}", field.getKey(), file);
            }
        }
        return new MetricsSnapshot(counters, durations);
    }

    private ObjectNode toJson(MetricsSnapshot snapshot) {
        ObjectNode root = mapper.createObjectNode();
        snapshot.getCounters().forEach(root::put);
        ObjectNode durations = root.putObject(DURATIONS_FIELD);
        snapshot.getDurations().forEach(durations::put);
        return root;
    }
}
