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

package dev.mars.flowgate.core.exceptions;

/**
 * Failure while executing a step of a workflow run. Terminal for the affected run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WorkflowExecutionException extends FlowgateException {

    private final String runId;
    private final String stepId;

    public WorkflowExecutionException(String runId, String stepId, String message, Throwable cause) {
        super(String.format("Run '%s' failed at step '%s': %s", runId, stepId, message), cause);
        this.runId = runId;
        this.stepId = stepId;
    }

    public String getRunId() {
        return runId;
    }

    public String getStepId() {
        return stepId;
    }
}
