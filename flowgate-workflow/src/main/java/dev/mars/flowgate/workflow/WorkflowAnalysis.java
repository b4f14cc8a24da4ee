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

import java.util.List;

/**
 * Static analysis of a run's step list.
 *
 * @param runId                     analysed run
 * @param totalSteps                number of steps
 * @param parallelizableSteps       steps without dependencies
 * @param estimatedExecutionSeconds rough execution estimate
 * @param bottlenecks               ids of approval gate steps
 * @param estimatedImprovementPercent expected gain from parallel execution
 */
public record WorkflowAnalysis(String runId, int totalSteps, int parallelizableSteps,
                               double estimatedExecutionSeconds, List<String> bottlenecks,
                               double estimatedImprovementPercent) {

    public WorkflowAnalysis {
        bottlenecks = List.copyOf(bottlenecks);
    }
}
