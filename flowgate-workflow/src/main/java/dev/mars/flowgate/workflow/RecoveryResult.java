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

/**
 * Outcome of {@link WorkflowEngine#autoRecover(String)}.
 *
 * @param runId     run that was inspected
 * @param recovered whether the run was moved back to PENDING
 * @param status    run status after the call
 * @param message   summary, "Workflow does not need recovery" when nothing was done
 */
public record RecoveryResult(String runId, boolean recovered, WorkflowStatus status, String message) {

    public static final String NOT_NEEDED = "Workflow does not need recovery";
}
