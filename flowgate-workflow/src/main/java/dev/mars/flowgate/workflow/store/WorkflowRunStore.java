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

import java.util.List;
import java.util.Optional;

/**
 * Persistence for the run table, so that run history survives restarts and several engines
 * can share it.
 *
 * <p>Engines change runs through {@link #update(String, RunUpdate)}, which applies the change
 * to the stored run atomically, so that a control issued by one engine is never overwritten by
 * another engine's stale snapshot. Each engine holds a lease for as long as it lives; a run
 * owned by an engine whose lease is gone was interrupted.</p>
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>{@link JsonFileWorkflowRunStore} - JSON file, read-modify-write under an exclusive lock</li>
 *   <li>{@link InMemoryWorkflowRunStore} - testing only</li>
 * </ul>
 */
public interface WorkflowRunStore {

    /**
     * Change applied to the stored run.
     *
     * @param <X> checked exception the change may raise, aborting the update
     */
    @FunctionalInterface
    interface RunUpdate<X extends Exception> {
        /**
         * @param current the stored run, or null if none is stored under the id
         * @return the replacement, or null to leave the stored run unchanged
         */
        WorkflowRun apply(WorkflowRun current) throws X;
    }

    /**
     * Inserts or replaces the run with the same id.
     */
    void save(WorkflowRun run) throws EventLogException;

    /**
     * All stored runs ordered by creation time.
     */
    List<WorkflowRun> loadAll() throws EventLogException;

    Optional<WorkflowRun> find(String runId) throws EventLogException;

    /**
     * Reads the stored run, applies {@code update} and stores the result, with no other writer in
     * between.
     *
     * @return the stored run after the call, or null if there is none
     * @throws X                 if {@code update} raised it; nothing is stored
     * @throws EventLogException if the store could not be read or written
     */
    <X extends Exception> WorkflowRun update(String runId, RunUpdate<X> update) throws X, EventLogException;

    /**
     * Takes the lease of engine {@code ownerId}, held until {@link #releaseLease(String)}.
     */
    void acquireLease(String ownerId) throws EventLogException;

    void releaseLease(String ownerId);

    /**
     * Whether engine {@code ownerId} is alive, in this process or another one.
     */
    boolean isLeaseActive(String ownerId) throws EventLogException;
}
