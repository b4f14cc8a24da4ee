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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One instantiation of a workflow template, with its own status and step cursor.
 *
 * <p>Instances are immutable snapshots. The engine is the only writer and replaces the
 * snapshot on every state change. JSON mapping uses the fields directly.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class WorkflowRun {

    private final String id;
    private final String templateName;
    private final WorkflowStatus status;
    private final int currentStepIndex;
    private final WorkflowPriority priority;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant startedAt;
    private final Instant endedAt;
    private final String error;
    private final List<WorkflowStep> steps;
    // engine instance that last started or resumed the run, and that execution's id
    private final String owner;
    private final String executionId;
    private final long version;

    public WorkflowRun(String id, String templateName, WorkflowStatus status, int currentStepIndex,
                       WorkflowPriority priority, Instant createdAt, Instant updatedAt, Instant startedAt,
                       Instant endedAt, String error, List<WorkflowStep> steps) {
        this(id, templateName, status, currentStepIndex, priority, createdAt, updatedAt, startedAt,
                endedAt, error, steps, null, null, 0L);
    }

    @JsonCreator
    public WorkflowRun(@JsonProperty("id") String id,
                       @JsonProperty("templateName") String templateName,
                       @JsonProperty("status") WorkflowStatus status,
                       @JsonProperty("currentStepIndex") int currentStepIndex,
                       @JsonProperty("priority") WorkflowPriority priority,
                       @JsonProperty("createdAt") Instant createdAt,
                       @JsonProperty("updatedAt") Instant updatedAt,
                       @JsonProperty("startedAt") Instant startedAt,
                       @JsonProperty("endedAt") Instant endedAt,
                       @JsonProperty("error") String error,
                       @JsonProperty("steps") List<WorkflowStep> steps,
                       @JsonProperty("owner") String owner,
                       @JsonProperty("executionId") String executionId,
                       @JsonProperty("version") long version) {
        this.id = Objects.requireNonNull(id, "Run id cannot be null");
        this.templateName = Objects.requireNonNull(templateName, "Template name cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.currentStepIndex = currentStepIndex;
        this.priority = priority != null ? priority : WorkflowPriority.NORMAL;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        this.updatedAt = updatedAt != null ? updatedAt : createdAt;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.error = error;
        this.steps = steps == null ? List.of() : List.copyOf(steps);
        this.owner = owner;
        this.executionId = executionId;
        this.version = version;
    }

    static WorkflowRun create(String id, String templateName, WorkflowPriority priority,
                              List<WorkflowStep> steps, Instant now) {
        return new WorkflowRun(id, templateName, WorkflowStatus.PENDING, 0, priority,
                now, now, null, null, null, steps, null, null, 1L);
    }

    // ── Copy helpers used by the engine ────────────────────────────────
    // every copy is one version newer than its source

    private WorkflowRun copy(WorkflowStatus newStatus, int newIndex, Instant now, Instant started, Instant ended,
                             String newError, List<WorkflowStep> newSteps, String newOwner, String newExecutionId) {
        return new WorkflowRun(id, templateName, newStatus, newIndex, priority, createdAt, now, started, ended,
                newError, newSteps, newOwner, newExecutionId, version + 1);
    }

    WorkflowRun withStatus(WorkflowStatus newStatus, Instant now) {
        Instant started = startedAt == null && newStatus == WorkflowStatus.RUNNING ? now : startedAt;
        Instant ended = newStatus.isTerminal() ? now : null;
        return copy(newStatus, currentStepIndex, now, started, ended, error, steps, owner, executionId);
    }

    WorkflowRun withExecution(String newOwner, String newExecutionId, Instant now) {
        return copy(status, currentStepIndex, now, startedAt, endedAt, error, steps, newOwner, newExecutionId);
    }

    WorkflowRun withError(String newError, Instant now) {
        return copy(status, currentStepIndex, now, startedAt, endedAt, newError, steps, owner, executionId);
    }

    WorkflowRun withStepStatus(int index, StepStatus stepStatus, Instant now) {
        List<WorkflowStep> updated = new ArrayList<>(steps);
        updated.set(index, steps.get(index).withStatus(stepStatus));
        return copy(status, currentStepIndex, now, startedAt, endedAt, error, updated, owner, executionId);
    }

    WorkflowRun advance(Instant now) {
        return copy(status, currentStepIndex + 1, now, startedAt, endedAt, error, steps, owner, executionId);
    }

    WorkflowRun withAllStepsReset(Instant now) {
        List<WorkflowStep> reset = new ArrayList<>(steps.size());
        for (WorkflowStep step : steps) {
            reset.add(step.withStatus(StepStatus.PENDING));
        }
        return copy(status, currentStepIndex, now, startedAt, endedAt, error, reset, owner, executionId);
    }

    boolean isExecutedBy(String candidateExecutionId) {
        return executionId != null && executionId.equals(candidateExecutionId);
    }

    // ── Accessors ──────────────────────────────────────────────────────

    public String getId() {
        return id;
    }

    public String getTemplateName() {
        return templateName;
    }

    public WorkflowStatus getStatus() {
        return status;
    }

    public int getCurrentStepIndex() {
        return currentStepIndex;
    }

    public WorkflowPriority getPriority() {
        return priority;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getEndedAt() {
        return Optional.ofNullable(endedAt);
    }

    public Optional<String> getError() {
        return Optional.ofNullable(error);
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    public Optional<String> getOwner() {
        return Optional.ofNullable(owner);
    }

    public Optional<String> getExecutionId() {
        return Optional.ofNullable(executionId);
    }

    /**
     * Incremented on every change; the newer of two snapshots of one run has the higher version.
     */
    public long getVersion() {
        return version;
    }

    public Optional<WorkflowStep> getCurrentStep() {
        return currentStepIndex < steps.size() ? Optional.of(steps.get(currentStepIndex)) : Optional.empty();
    }

    public long getCompletedStepCount() {
        return steps.stream().filter(step -> step.getStatus() == StepStatus.COMPLETED).count();
    }

    /**
     * Gets the run duration if it has started.
     */
    public Optional<Duration> getDuration() {
        if (startedAt == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt, endedAt != null ? endedAt : Instant.now()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowRun that = (WorkflowRun) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkflowRun{" +
                "id='" + id + '\'' +
                ", templateName='" + templateName + '\'' +
                ", status=" + status +
                ", currentStepIndex=" + currentStepIndex + "/" + steps.size() +
                ", priority=" + priority +
                (error != null ? ", error='" + error + '\'' : "") +
                '}';
    }
}
