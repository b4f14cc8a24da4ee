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

package dev.mars.flowgate.workflow.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Named, ordered list of step specifications describing one process shape.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class WorkflowTemplate {

    private final String name;
    private final String description;
    private final List<StepSpec> steps;

    public WorkflowTemplate(String name, String description, List<StepSpec> steps) {
        this.name = Objects.requireNonNull(name, "Template name cannot be null");
        this.description = description != null ? description : "";
        this.steps = List.copyOf(Objects.requireNonNull(steps, "Template steps cannot be null"));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public List<StepSpec> getSteps() {
        return steps;
    }

    public int getStepCount() {
        return steps.size();
    }

    public long getGateCount() {
        return steps.stream().filter(StepSpec::approvalGate).count();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowTemplate that = (WorkflowTemplate) o;
        return name.equals(that.name) && description.equals(that.description) && steps.equals(that.steps);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, steps);
    }

    @Override
    public String toString() {
        return "WorkflowTemplate{name='" + name + "', steps=" + steps.size() + ", gates=" + getGateCount() + '}';
    }
}
