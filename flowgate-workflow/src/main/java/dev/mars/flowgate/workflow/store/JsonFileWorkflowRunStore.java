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

package dev.mars.flowgate.workflow.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.flowgate.config.JacksonConfig;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.storage.DurableFiles;
import dev.mars.flowgate.workflow.WorkflowRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Run table kept as a JSON document {@code {"runs": {id: run}}}.
 *
 * <p>Engine leases are lock files in the sibling directory {@code <file>.leases}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class JsonFileWorkflowRunStore implements WorkflowRunStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonFileWorkflowRunStore.class);

    private final Path file;
    private final boolean fsyncEnabled;
    private final Path leaseDirectory;
    private final ObjectMapper mapper = JacksonConfig.newObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final ConcurrentMap<String, DurableFiles.FileLease> leases = new ConcurrentHashMap<>();

    public JsonFileWorkflowRunStore(Path file, boolean fsyncEnabled) {
        this.file = file;
        this.fsyncEnabled = fsyncEnabled;
        this.leaseDirectory = file.resolveSibling(file.getFileName() + ".leases");
    }

    @Override
    public void save(WorkflowRun run) throws EventLogException {
        update(run.getId(), current -> run);
    }

    @Override
    public Optional<WorkflowRun> find(String runId) throws EventLogException {
        try {
            return Optional.ofNullable(DurableFiles.withExclusiveLock(file, () -> read().runs.get(runId)));
        } catch (IOException e) {
            throw new EventLogException("Failed to read run " + runId + " from " + file, e);
        }
    }

    @Override
    public <X extends Exception> WorkflowRun update(String runId, RunUpdate<X> update) throws X, EventLogException {
        try {
            return DurableFiles.withExclusiveLock(file, () -> {
                RunTable table = read();
                WorkflowRun current = table.runs.get(runId);
                WorkflowRun next;
                try {
                    next = update.apply(current);
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new AbortedUpdate(e);
                }
                if (next == null) {
                    return current;
                }
                table.runs.put(runId, next);
                DurableFiles.writeAtomically(file, mapper.writeValueAsBytes(table), fsyncEnabled);
                LOG.debug("Saved run {} ({}, version {})", runId, next.getStatus(), next.getVersion());
                return next;
            });
        } catch (AbortedUpdate e) {
            @SuppressWarnings("unchecked")
            X cause = (X) e.getCause();
            throw cause;
        } catch (IOException e) {
            throw new EventLogException("Failed to save run " + runId + " to " + file, e);
        }
    }

    @Override
    public void acquireLease(String ownerId) throws EventLogException {
        try {
            leases.put(ownerId, DurableFiles.acquireLease(leaseFile(ownerId)));
        } catch (IOException e) {
            throw new EventLogException("Failed to acquire lease " + ownerId, e);
        }
    }

    @Override
    public void releaseLease(String ownerId) {
        DurableFiles.FileLease lease = leases.remove(ownerId);
        if (lease == null) {
            return;
        }
        try {
            lease.close();
        } catch (IOException e) {
            LOG.warn("Failed to release lease {}: {}", lease.getPath(), e.getMessage());
        }
    }

    @Override
    public boolean isLeaseActive(String ownerId) throws EventLogException {
        try {
            return DurableFiles.isLeaseHeld(leaseFile(ownerId));
        } catch (IOException e) {
            throw new EventLogException("Failed to check lease " + ownerId, e);
        }
    }

    @Override
    public List<WorkflowRun> loadAll() throws EventLogException {
        try {
            List<WorkflowRun> all = DurableFiles.withExclusiveLock(file, () -> new ArrayList<>(read().runs.values()));
            all.sort(Comparator.comparing(WorkflowRun::getCreatedAt));
            return all;
        } catch (IOException e) {
            throw new EventLogException("Failed to load runs from " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private Path leaseFile(String ownerId) {
        return leaseDirectory.resolve(ownerId + ".lock");
    }

    private RunTable read() throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            return new RunTable();
        }
        RunTable table = mapper.readValue(file.toFile(), RunTable.class);
        if (table.runs == null) {
            table.runs = new LinkedHashMap<>();
        }
        return table;
    }

    static final class RunTable {
        public Map<String, WorkflowRun> runs = new LinkedHashMap<>();
    }

    // carries a checked exception raised by an update out of the locked section
    private static final class AbortedUpdate extends RuntimeException {
        AbortedUpdate(Exception cause) {
            super(cause);
        }
    }
}
