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

import java.util.Optional;

/**
 * Outcome of one execution pass over a run: a start, a resume or a conditional start.
 *
 * @param runId         run the pass executed
 * @param status        run status when the pass ended
 * @param stepsExecuted steps completed during this pass
 * @param message       human readable summary
 * @param error         failure or skip reason, null when the pass ended normally
 */
public record ExecutionResult(String runId, WorkflowStatus status, int stepsExecuted,
                              String message, String error) {

    public static ExecutionResult of(WorkflowRun run, int stepsExecuted, String message) {
        return new ExecutionResult(run.getId(), run.getStatus(), stepsExecuted, message,
                run.getError().orElse(null));
    }

    public static ExecutionResult skipped(WorkflowRun run, String reason) {
        return new ExecutionResult(run.getId(), run.getStatus(), 0, "Skipped", reason);
    }

    public static ExecutionResult rejected(String runId, String reason) {
        return new ExecutionResult(runId, null, 0, "Not executed", reason);
    }

    public boolean isSuccessful() {
        return status == WorkflowStatus.COMPLETED;
    }

    public Optional<String> errorMessage() {
        return Optional.ofNullable(error);
    }
}
