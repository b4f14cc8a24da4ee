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

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of a workflow run. Immutable; status changes produce a copy.
 *
 * <p>{@code dependencies} lists the ids of the earlier steps. Steps always execute in
 * declared order; the dependency list is used for analysis only.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class WorkflowStep {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_RETRY_COUNT = 3;

    private final String id;
    private final String agent;
    private final String command;
    private final String eventType;
    private final String description;
    private final boolean approvalGate;
    private final Map<String, Object> parameters;
    private final List<String> dependencies;
    private final int timeoutSeconds;
    private final int retryCount;
    private final StepStatus status;

    @JsonCreator
    public WorkflowStep(@JsonProperty("id") String id,
                        @JsonProperty("agent") String agent,
                        @JsonProperty("command") String command,
                        @JsonProperty("eventType") String eventType,
                        @JsonProperty("description") String description,
                        @JsonProperty("approvalGate") boolean approvalGate,
                        @JsonProperty("parameters") Map<String, Object> parameters,
                        @JsonProperty("dependencies") List<String> dependencies,
                        @JsonProperty("timeoutSeconds") Integer timeoutSeconds,
                        @JsonProperty("retryCount") Integer retryCount,
                        @JsonProperty("status") StepStatus status) {
        this.id = Objects.requireNonNull(id, "Step id cannot be null");
        this.agent = agent;
        this.command = command;
        this.eventType = Objects.requireNonNull(eventType, "Step eventType cannot be null");
        this.description = description != null ? description : eventType;
        this.approvalGate = approvalGate;
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        this.dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        this.timeoutSeconds = timeoutSeconds != null ? timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        this.retryCount = retryCount != null ? retryCount : DEFAULT_RETRY_COUNT;
        this.status = status != null ? status : StepStatus.PENDING;
    }

    public WorkflowStep withStatus(StepStatus newStatus) {
        return new WorkflowStep(id, agent, command, eventType, description, approvalGate,
                parameters, dependencies, timeoutSeconds, retryCount, newStatus);
    }

    public String getId() {
        return id;
    }

    public String getAgent() {
        return agent;
    }

    public String getCommand() {
        return command;
    }

    public String getEventType() {
        return eventType;
    }

    public String getDescription() {
        return description;
    }

    public boolean isApprovalGate() {
        return approvalGate;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public StepStatus getStatus() {
        return status;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowStep that = (WorkflowStep) o;
        return approvalGate == that.approvalGate
                && timeoutSeconds == that.timeoutSeconds
                && retryCount == that.retryCount
                && id.equals(that.id)
                && Objects.equals(agent, that.agent)
                && Objects.equals(command, that.command)
                && eventType.equals(that.eventType)
                && Objects.equals(description, that.description)
                && parameters.equals(that.parameters)
                && dependencies.equals(that.dependencies)
                && status == that.status;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, eventType, status);
    }

    @Override
    public String toString() {
        return "WorkflowStep{" +
                "id='" + id + '\'' +
                ", eventType='" + eventType + '\'' +
                ", agent='" + agent + '\'' +
                (approvalGate ? ", approvalGate=true" : "") +
                ", status=" + status +
                '}';
    }
}
