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

package dev.mars.flowgate.workflow.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.core.exceptions.ValidationException;
import dev.mars.flowgate.workflow.StepStatus;
import dev.mars.flowgate.workflow.WorkflowPriority;
import dev.mars.flowgate.workflow.WorkflowRun;
import dev.mars.flowgate.workflow.WorkflowStatus;
import dev.mars.flowgate.workflow.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JsonFileWorkflowRunStore}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class JsonFileWorkflowRunStoreTest {

    @TempDir
    Path tempDir;

    private WorkflowRun run(String id, WorkflowStatus status, Instant createdAt) {
        List<WorkflowStep> steps = List.of(
                new WorkflowStep("step-1", "Orchestrator", "build", "build_triggered", "Build started",
                        false, Map.of("branch", "main"), List.of(), null, null, StepStatus.COMPLETED),
                new WorkflowStep("step-2", "Approver", "approve", "hitl_required", "Approval for deployment",
                        true, Map.of(), List.of("step-1"), 60, 0, StepStatus.WAITING_APPROVAL));
        return new WorkflowRun(id, "automated_deployment", status, 1, WorkflowPriority.HIGH,
                createdAt, createdAt, createdAt, null, null, steps);
    }

    @Test
    @DisplayName("Saved runs load back with their steps in order")
    void roundTrip() throws Exception {
        JsonFileWorkflowRunStore store = new JsonFileWorkflowRunStore(tempDir.resolve("runs.json"), false);
        Instant created = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        WorkflowRun original = run("run-1", WorkflowStatus.RUNNING, created);

        store.save(original);
        WorkflowRun loaded = new JsonFileWorkflowRunStore(store.getFile(), false).loadAll().get(0);

        assertEquals("run-1", loaded.getId());
        assertEquals(WorkflowStatus.RUNNING, loaded.getStatus());
        assertEquals(WorkflowPriority.HIGH, loaded.getPriority());
        assertEquals(created, loaded.getCreatedAt());
        assertEquals(original.getSteps(), loaded.getSteps());
        WorkflowStep gate = loaded.getSteps().get(1);
        assertTrue(gate.isApprovalGate());
        assertEquals(60, gate.getTimeoutSeconds());
        assertEquals(0, gate.getRetryCount());
        assertEquals(StepStatus.WAITING_APPROVAL, gate.getStatus());
        assertTrue(loaded.getEndedAt().isEmpty());
    }

    @Test
    @DisplayName("Saving a run again replaces it, and runs are listed by creation time")
    void replaceAndOrder() throws Exception {
        JsonFileWorkflowRunStore store = new JsonFileWorkflowRunStore(tempDir.resolve("runs.json"), true);
        Instant now = Instant.now();
        store.save(run("run-late", WorkflowStatus.PENDING, now));
        store.save(run("run-early", WorkflowStatus.PENDING, now.minusSeconds(60)));
        store.save(run("run-late", WorkflowStatus.PAUSED, now));

        List<WorkflowRun> runs = store.loadAll();

        assertEquals(2, runs.size());
        assertEquals("run-early", runs.get(0).getId());
        assertEquals(WorkflowStatus.PAUSED, runs.get(1).getStatus());
    }

    @Test
    @DisplayName("The file is a runs object keyed by run id")
    void fileFormat() throws Exception {
        Path file = tempDir.resolve("runs.json");
        new JsonFileWorkflowRunStore(file, false).save(run("run-1", WorkflowStatus.PENDING, Instant.now()));

        JsonNode root = new ObjectMapper().readTree(file.toFile());

        assertTrue(root.path("runs").has("run-1"));
        assertEquals("PENDING", root.path("runs").path("run-1").path("status").asText());
        assertEquals("step-2", root.path("runs").path("run-1").path("steps").get(1).path("id").asText());
    }

    @Test
    @DisplayName("A missing file is an empty table and a corrupt file is reported")
    void missingAndCorrupt() throws Exception {
        Path file = tempDir.resolve("runs.json");
        assertTrue(new JsonFileWorkflowRunStore(file, false).loadAll().isEmpty());

        Files.writeString(file, "{\"runs\": [oops");

        assertThrows(EventLogException.class, () -> new JsonFileWorkflowRunStore(file, false).loadAll());
    }

    @Test
    @DisplayName("An update sees the stored run and its result is what find returns")
    void updateAndFind() throws Exception {
        JsonFileWorkflowRunStore store = new JsonFileWorkflowRunStore(tempDir.resolve("runs.json"), false);
        Instant created = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        store.save(run("run-1", WorkflowStatus.RUNNING, created));

        WorkflowRun updated = new JsonFileWorkflowRunStore(store.getFile(), false).update("run-1", current -> {
            assertEquals(WorkflowStatus.RUNNING, current.getStatus());
            return run("run-1", WorkflowStatus.PAUSED, current.getCreatedAt());
        });

        assertEquals(WorkflowStatus.PAUSED, updated.getStatus());
        assertEquals(WorkflowStatus.PAUSED, store.find("run-1").orElseThrow().getStatus());
        assertTrue(store.find("run-2").isEmpty());
        assertNull(store.update("run-2", current -> null));
        assertEquals(1, store.loadAll().size());
    }

    @Test
    @DisplayName("An update that throws stores nothing and its exception reaches the caller")
    void abortedUpdate() throws Exception {
        JsonFileWorkflowRunStore store = new JsonFileWorkflowRunStore(tempDir.resolve("runs.json"), false);
        store.save(run("run-1", WorkflowStatus.RUNNING, Instant.now()));

        ValidationException e = assertThrows(ValidationException.class, () -> store.update("run-1", current -> {
            throw new ValidationException("run-1 is busy");
        }));

        assertEquals("run-1 is busy", e.getMessage());
        assertEquals(WorkflowStatus.RUNNING, store.find("run-1").orElseThrow().getStatus());
    }

    @Test
    @DisplayName("A lease is visible to other stores on the same file until it is released")
    void leases() throws Exception {
        Path file = tempDir.resolve("runs.json");
        JsonFileWorkflowRunStore holder = new JsonFileWorkflowRunStore(file, false);
        JsonFileWorkflowRunStore observer = new JsonFileWorkflowRunStore(file, false);

        holder.acquireLease("engine-1");

        assertTrue(observer.isLeaseActive("engine-1"));
        assertFalse(observer.isLeaseActive("engine-2"));
        assertThrows(EventLogException.class, () -> observer.acquireLease("engine-1"));

        holder.releaseLease("engine-1");

        assertFalse(observer.isLeaseActive("engine-1"));
        assertFalse(Files.exists(tempDir.resolve("runs.json.leases").resolve("engine-1.lock")));
    }
}
