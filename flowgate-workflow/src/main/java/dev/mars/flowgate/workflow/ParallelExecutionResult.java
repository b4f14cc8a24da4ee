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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated outcome of {@link WorkflowEngine#parallelExecute(java.util.List)}, keyed by run id
 * in request order.
 */
public final class ParallelExecutionResult {

    private final Map<String, ExecutionResult> results;

    public ParallelExecutionResult(Map<String, ExecutionResult> results) {
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public Map<String, ExecutionResult> getResults() {
        return results;
    }

    public long getSuccessCount() {
        return results.values().stream().filter(ExecutionResult::isSuccessful).count();
    }

    public long getFailureCount() {
        return results.size() - getSuccessCount();
    }

    public boolean isAllSuccessful() {
        return getFailureCount() == 0;
    }

    @Override
    public String toString() {
        return "ParallelExecutionResult{total=" + results.size() + ", successful=" + getSuccessCount() + '}';
    }
}
