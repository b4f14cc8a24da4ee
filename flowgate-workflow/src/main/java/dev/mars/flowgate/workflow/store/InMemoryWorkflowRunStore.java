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

import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.workflow.WorkflowRun;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable run store for tests. Engines sharing one instance see each other's leases.
 */
public class InMemoryWorkflowRunStore implements WorkflowRunStore {

    private final Map<String, WorkflowRun> runs = new LinkedHashMap<>();
    private final Set<String> leases = ConcurrentHashMap.newKeySet();

    @Override
    public synchronized void save(WorkflowRun run) {
        runs.put(run.getId(), run);
    }

    @Override
    public synchronized List<WorkflowRun> loadAll() {
        List<WorkflowRun> all = new ArrayList<>(runs.values());
        all.sort(Comparator.comparing(WorkflowRun::getCreatedAt));
        return all;
    }

    @Override
    public synchronized Optional<WorkflowRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public synchronized <X extends Exception> WorkflowRun update(String runId, RunUpdate<X> update) throws X {
        WorkflowRun current = runs.get(runId);
        WorkflowRun next = update.apply(current);
        if (next == null) {
            return current;
        }
        runs.put(runId, next);
        return next;
    }

    @Override
    public void acquireLease(String ownerId) throws EventLogException {
        if (!leases.add(ownerId)) {
            throw new EventLogException("Lease " + ownerId + " is already held");
        }
    }

    @Override
    public void releaseLease(String ownerId) {
        leases.remove(ownerId);
    }

    @Override
    public boolean isLeaseActive(String ownerId) {
        return leases.contains(ownerId);
    }
}
