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
 * Progress view of a run returned by {@link WorkflowEngine#monitor(String)}.
 *
 * @param successRate percentage of steps completed, 0 to 100
 */
public record RunMonitor(String runId, String templateName, WorkflowStatus status, WorkflowPriority priority,
                         int totalSteps, long completedSteps, int currentStepIndex, double successRate) {

    static RunMonitor of(WorkflowRun run) {
        int total = run.getSteps().size();
        long completed = run.getCompletedStepCount();
        double rate = total == 0 ? 0.0 : (completed * 100.0) / total;
        return new RunMonitor(run.getId(), run.getTemplateName(), run.getStatus(), run.getPriority(),
                total, completed, run.getCurrentStepIndex(), rate);
    }
}
