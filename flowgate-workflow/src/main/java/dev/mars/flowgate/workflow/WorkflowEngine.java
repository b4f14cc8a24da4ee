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

package dev.mars.flowgate.workflow;

import dev.mars.flowgate.core.exceptions.InvalidTransitionException;
import dev.mars.flowgate.core.exceptions.ValidationException;
import dev.mars.flowgate.core.exceptions.WorkflowNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Creates workflow runs from templates and drives them through their lifecycle.
 */
public interface WorkflowEngine {

    /**
     * Creates a PENDING run of a template.
     *
     * @param templateName name of a catalog template
     * @param agents       agent per step, or empty for the default agent
     * @param commands     command per step, or empty to use each step's event type
     * @param priority     run priority, NORMAL when null
     * @return the new run
     * @throws ValidationException if the name is empty or unknown, or the agents and commands
     *                             lists do not match each other or the template's step count
     */
    WorkflowRun create(String templateName, List<String> agents, List<String> commands,
                       WorkflowPriority priority) throws ValidationException;

    /**
     * Moves a PENDING run to RUNNING and executes its steps from the current step index.
     *
     * @return future completing when the run completes, fails, pauses or is cancelled
     */
    CompletableFuture<ExecutionResult> start(String runId)
            throws WorkflowNotFoundException, InvalidTransitionException;

    /**
     * Pauses a RUNNING run before its next step.
     */
    WorkflowRun pause(String runId) throws WorkflowNotFoundException, InvalidTransitionException;

    /**
     * Moves a PAUSED run back to RUNNING and continues from the current step index.
     * A gate step asks for a new decision under a fresh alert id.
     */
    CompletableFuture<ExecutionResult> resume(String runId)
            throws WorkflowNotFoundException, InvalidTransitionException;

    /**
     * Cancels a run that has not finished. Cancelling a cancelled run has no effect.
     *
     * @throws InvalidTransitionException if the run is COMPLETED or FAILED
     */
    WorkflowRun cancel(String runId) throws WorkflowNotFoundException, InvalidTransitionException;

    /**
     * Resets a FAILED run to PENDING. Any other run is left untouched.
     */
    RecoveryResult autoRecover(String runId) throws WorkflowNotFoundException;

    WorkflowAnalysis analyze(String runId) throws WorkflowNotFoundException;

    OptimizationReport optimize(String runId) throws WorkflowNotFoundException;

    /**
     * Starts each run on its own task. Failures of one run do not affect the others.
     *
     * @return future completing once every run has finished its pass
     * @throws ValidationException if {@code runIds} is empty
     */
    CompletableFuture<ParallelExecutionResult> parallelExecute(List<String> runIds) throws ValidationException;

    /**
     * Starts the run only if {@code predicate} holds; otherwise returns a skipped result.
     */
    CompletableFuture<ExecutionResult> conditionalExecute(String runId, String predicate)
            throws WorkflowNotFoundException, InvalidTransitionException;

    Optional<WorkflowRun> getRun(String runId);

    List<WorkflowRun> listRuns();

    List<WorkflowRun> findRunsByTemplate(String templateName);

    RunMonitor monitor(String runId) throws WorkflowNotFoundException;

    /**
     * Number of runs in each status, every status present.
     */
    Map<WorkflowStatus, Long> statusSummary();

    /**
     * Cancels pending decision waits and stops the executor.
     */
    void shutdown();
}
