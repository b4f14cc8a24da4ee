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
 * Suggestions derived from a {@link WorkflowAnalysis}. Never changes the run.
 */
public record OptimizationReport(WorkflowAnalysis analysis, List<String> suggestions) {

    public static final String PARALLEL_SUGGESTION = "Enable parallel execution for independent steps";
    public static final String SPLIT_SUGGESTION = "Consider breaking workflow into smaller sub-workflows";
    public static final String SPEED_SUGGESTION = "Optimize step execution time";

    public OptimizationReport {
        suggestions = List.copyOf(suggestions);
    }
}
