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

import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.core.exceptions.EventLogException;
import dev.mars.flowgate.core.exceptions.InvalidTransitionException;
import dev.mars.flowgate.core.exceptions.ValidationException;
import dev.mars.flowgate.core.exceptions.WorkflowExecutionException;
import dev.mars.flowgate.core.exceptions.WorkflowNotFoundException;
import dev.mars.flowgate.event.EventContract;
import dev.mars.flowgate.metrics.InMemoryMetricsStore;
import dev.mars.flowgate.metrics.MetricsRecorder;
import dev.mars.flowgate.notification.GuardedNotificationService;
import dev.mars.flowgate.notification.LoggingNotificationService;
import dev.mars.flowgate.notification.NotificationService;
import dev.mars.flowgate.workflow.approval.ApprovalGateway;
import dev.mars.flowgate.workflow.catalog.StepSpec;
import dev.mars.flowgate.workflow.catalog.WorkflowCatalog;
import dev.mars.flowgate.workflow.catalog.WorkflowTemplate;
import dev.mars.flowgate.workflow.store.InMemoryWorkflowRunStore;
import dev.mars.flowgate.workflow.store.WorkflowRunStore;
import dev.mars.flowgate.workflow.store.WorkflowRunStore.RunUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Workflow engine that executes the steps of each run sequentially on its own task.
 *
 * <p>A normal step publishes its event type on the {@link EventBus} with the run id as
 * correlation id. An approval gate step requests a decision through the
 * {@link ApprovalGateway} and waits for it; a rejection or a timeout pauses the run and
 * escalates. A publish failure fails the run and escalates. Failed steps are never retried
 * automatically.</p>
 *
 * <p>Every state change is applied to the stored run through
 * {@link WorkflowRunStore#update(String, WorkflowRunStore.RunUpdate)} under a per-run lock, so
 * engines in other processes sharing the store see it and may pause or cancel the run. Each
 * start or resume is an execution with its own id; a resumed execution waits for the previous
 * one to finish, and an execution stops as soon as the run belongs to a later one. The engine
 * holds a lease in the store while it lives. A run found RUNNING whose engine no longer holds
 * its lease was interrupted by a restart and is loaded as FAILED so that it can be
 * recovered.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class DefaultWorkflowEngine implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(DefaultWorkflowEngine.class);

    public static final String DEFAULT_AGENT = "Orchestrator";
    public static final String INTERRUPTED_BY_RESTART = "Interrupted by restart";

    private static final double SECONDS_PER_STEP_ESTIMATE = 0.1;
    private static final double PARALLEL_IMPROVEMENT_PERCENT = 20.0;
    private static final int LARGE_WORKFLOW_STEPS = 10;
    private static final double SLOW_WORKFLOW_SECONDS = 60.0;

    private final EventBus eventBus;
    private final WorkflowCatalog catalog;
    private final ApprovalGateway approvalGateway;
    private final NotificationService notifications;
    private final MetricsRecorder metrics;
    private final WorkflowRunStore runStore;
    private final ExecutionCondition condition;
    private final String notificationChannel;
    private final String escalationChannel;
    private final Duration approvalTimeout;
    private final Duration controlPollInterval;
    private final Clock clock;
    private final String ownerId = "engine-" + UUID.randomUUID();

    private final ExecutorService executorService;
    private final ConcurrentMap<String, WorkflowRun> runs = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Object> runLocks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<ExecutionResult>> activeTasks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<Boolean>> pendingDecisions = new ConcurrentHashMap<>();
    private volatile boolean shutdown = false;

    private enum GateOutcome { APPROVED, REJECTED, INTERRUPTED }

    private record GatePass(GateOutcome outcome, String alertId) {
    }

    /**
     * One start or resume of a run; {@code previousOwner} is the engine that executed it before.
     */
    private record Execution(String runId, String executionId, String previousOwner) {
    }

    private record Mutation(WorkflowRun before, WorkflowRun run, boolean changed) {
    }

    private DefaultWorkflowEngine(Builder builder) throws EventLogException {
        this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus is required");
        this.approvalGateway = Objects.requireNonNull(builder.approvalGateway, "approvalGateway is required");
        this.catalog = builder.catalog != null ? builder.catalog : WorkflowCatalog.defaults();
        NotificationService notificationService = builder.notifications != null
                ? builder.notifications : new LoggingNotificationService();
        this.notifications = notificationService instanceof GuardedNotificationService
                ? notificationService : new GuardedNotificationService(notificationService);
        this.metrics = builder.metrics != null ? builder.metrics : new MetricsRecorder(new InMemoryMetricsStore(), true);
        this.runStore = builder.runStore != null ? builder.runStore : new InMemoryWorkflowRunStore();
        this.condition = builder.condition != null ? builder.condition : ExecutionCondition.defaults();
        this.notificationChannel = builder.notificationChannel;
        this.escalationChannel = builder.escalationChannel;
        this.approvalTimeout = builder.approvalTimeout;
        this.controlPollInterval = builder.controlPollInterval;
        if (controlPollInterval.isZero() || controlPollInterval.isNegative()) {
            throw new IllegalArgumentException("controlPollInterval must be positive");
        }
        this.clock = builder.clock;
        this.executorService = Executors.newCachedThreadPool();
        runStore.acquireLease(ownerId);
        try {
            loadPersistedRuns();
        } catch (EventLogException | RuntimeException e) {
            runStore.releaseLease(ownerId);
            executorService.shutdown();
            throw e;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    // =========================================================================
    // Lifecycle operations
    // =========================================================================

    @Override
    public WorkflowRun create(String templateName, List<String> agents, List<String> commands,
                              WorkflowPriority priority) throws ValidationException {
        WorkflowTemplate template = catalog.require(templateName);
        List<String> agentList = agents != null ? agents : List.of();
        List<String> commandList = commands != null ? commands : List.of();
        if (agentList.size() != commandList.size()) {
            throw new ValidationException("Agents and commands must have the same length ("
                    + agentList.size() + " agents, " + commandList.size() + " commands)");
        }
        if (!agentList.isEmpty() && agentList.size() != template.getStepCount()) {
            throw new ValidationException("Workflow '" + templateName + "' has " + template.getStepCount()
                    + " steps but " + agentList.size() + " agents were given");
        }

        List<WorkflowStep> steps = new ArrayList<>();
        List<String> previousIds = new ArrayList<>();
        for (int i = 0; i < template.getSteps().size(); i++) {
            StepSpec spec = template.getSteps().get(i);
            String stepId = "step-" + (i + 1);
            steps.add(new WorkflowStep(stepId,
                    agentList.isEmpty() ? DEFAULT_AGENT : agentList.get(i),
                    commandList.isEmpty() ? spec.eventType() : commandList.get(i),
                    spec.eventType(), spec.description(), spec.approvalGate(),
                    Map.of(), previousIds, null, null, StepStatus.PENDING));
            previousIds.add(stepId);
        }

        String runId = "run-" + UUID.randomUUID();
        WorkflowRun run = WorkflowRun.create(runId, templateName,
                priority != null ? priority : WorkflowPriority.NORMAL, steps, now());
        mutate(runId, current -> run);
        logger.info("Created workflow run {} of '{}' with {} steps", runId, templateName, steps.size());
        return run;
    }

    @Override
    public CompletableFuture<ExecutionResult> start(String runId)
            throws WorkflowNotFoundException, InvalidTransitionException {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        String executionId = newExecutionId();
        Mutation started = transition(runId, WorkflowStatus.PENDING, WorkflowStatus.RUNNING, executionId);
        metrics.increment(MetricsRecorder.WORKFLOWS_STARTED);
        notifications.notify("Workflow " + started.run().getTemplateName() + " started (" + runId + ")", notificationChannel);
        return launch(new Execution(runId, executionId, started.before().getOwner().orElse(null)));
    }

    @Override
    public WorkflowRun pause(String runId) throws WorkflowNotFoundException, InvalidTransitionException {
        WorkflowRun paused = transition(runId, WorkflowStatus.RUNNING, WorkflowStatus.PAUSED, null).run();
        cancelPendingDecision(runId);
        metrics.increment(MetricsRecorder.WORKFLOW_PAUSED);
        notifications.notify("Workflow " + paused.getTemplateName() + " paused (" + runId + ")", notificationChannel);
        return paused;
    }

    @Override
    public CompletableFuture<ExecutionResult> resume(String runId)
            throws WorkflowNotFoundException, InvalidTransitionException {
        if (shutdown) {
            return CompletableFuture.failedFuture(new IllegalStateException("Workflow engine is shutdown"));
        }
        String executionId = newExecutionId();
        Mutation resumed = transition(runId, WorkflowStatus.PAUSED, WorkflowStatus.RUNNING, executionId);
        notifications.notify("Workflow " + resumed.run().getTemplateName() + " resumed (" + runId + ")", notificationChannel);
        return launch(new Execution(runId, executionId, resumed.before().getOwner().orElse(null)));
    }

    @Override
    public WorkflowRun cancel(String runId) throws WorkflowNotFoundException, InvalidTransitionException {
        require(runId);
        Mutation mutation = mutate(runId, current -> {
            if (current.getStatus() == WorkflowStatus.CANCELLED) {
                return null;
            }
            checkTransition(current, WorkflowStatus.CANCELLED);
            return current.withStatus(WorkflowStatus.CANCELLED, now());
        });
        WorkflowRun cancelled = mutation.run();
        if (!mutation.changed()) {
            logger.debug("Run {} is already cancelled", runId);
            return cancelled;
        }
        logger.info("Run {} ({}): {} → CANCELLED", runId, cancelled.getTemplateName(), mutation.before().getStatus());
        cancelPendingDecision(runId);
        metrics.increment(MetricsRecorder.WORKFLOWS_CANCELLED);
        notifications.notify("Workflow " + cancelled.getTemplateName() + " cancelled (" + runId + ")", notificationChannel);
        return cancelled;
    }

    @Override
    public RecoveryResult autoRecover(String runId) throws WorkflowNotFoundException {
        require(runId);
        Mutation mutation = mutate(runId, current -> {
            if (current.getStatus() != WorkflowStatus.FAILED) {
                return null;
            }
            Instant now = now();
            return current.withAllStepsReset(now)
                    .withError(null, now)
                    .withStatus(WorkflowStatus.PENDING, now);
        });
        if (!mutation.changed()) {
            return new RecoveryResult(runId, false, mutation.run().getStatus(), RecoveryResult.NOT_NEEDED);
        }
        logger.info("Run {} recovered: FAILED → PENDING at step index {}", runId, mutation.run().getCurrentStepIndex());
        return new RecoveryResult(runId, true, WorkflowStatus.PENDING, "Workflow recovered");
    }

    // =========================================================================
    // Analysis and batch operations
    // =========================================================================

    @Override
    public WorkflowAnalysis analyze(String runId) throws WorkflowNotFoundException {
        WorkflowRun run = require(runId);
        List<WorkflowStep> steps = run.getSteps();
        int parallelizable = (int) steps.stream().filter(step -> step.getDependencies().isEmpty()).count();
        List<String> bottlenecks = steps.stream()
                .filter(WorkflowStep::isApprovalGate)
                .map(WorkflowStep::getId)
                .collect(Collectors.toList());
        return new WorkflowAnalysis(runId, steps.size(), parallelizable,
                steps.size() * SECONDS_PER_STEP_ESTIMATE, bottlenecks,
                parallelizable > 1 ? PARALLEL_IMPROVEMENT_PERCENT : 0.0);
    }

    @Override
    public OptimizationReport optimize(String runId) throws WorkflowNotFoundException {
        WorkflowAnalysis analysis = analyze(runId);
        List<String> suggestions = new ArrayList<>();
        if (analysis.parallelizableSteps() > 1) {
            suggestions.add(OptimizationReport.PARALLEL_SUGGESTION);
        }
        if (analysis.totalSteps() > LARGE_WORKFLOW_STEPS) {
            suggestions.add(OptimizationReport.SPLIT_SUGGESTION);
        }
        if (analysis.estimatedExecutionSeconds() > SLOW_WORKFLOW_SECONDS) {
            suggestions.add(OptimizationReport.SPEED_SUGGESTION);
        }
        return new OptimizationReport(analysis, suggestions);
    }

    @Override
    public CompletableFuture<ParallelExecutionResult> parallelExecute(List<String> runIds) throws ValidationException {
        if (runIds == null || runIds.isEmpty()) {
            throw new ValidationException("At least one run id is required for parallel execution");
        }
        Map<String, CompletableFuture<ExecutionResult>> futures = new LinkedHashMap<>();
        for (String runId : runIds) {
            if (futures.containsKey(runId)) {
                continue;
            }
            CompletableFuture<ExecutionResult> future;
            try {
                future = start(runId);
            } catch (WorkflowNotFoundException | InvalidTransitionException e) {
                logger.warn("Parallel execution skipped run {}: {}", runId, e.getMessage());
                future = CompletableFuture.completedFuture(ExecutionResult.rejected(runId, e.getMessage()));
            }
            futures.put(runId, future.exceptionally(ex -> ExecutionResult.rejected(runId, ex.getMessage())));
        }
        return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    Map<String, ExecutionResult> results = new LinkedHashMap<>();
                    futures.forEach((runId, future) -> results.put(runId, future.join()));
                    return new ParallelExecutionResult(results);
                });
    }

    @Override
    public CompletableFuture<ExecutionResult> conditionalExecute(String runId, String predicate)
            throws WorkflowNotFoundException, InvalidTransitionException {
        WorkflowRun run = require(runId);
        if (!condition.evaluate(predicate)) {
            logger.info("Run {} not started, condition not met: {}", runId, predicate);
            return CompletableFuture.completedFuture(ExecutionResult.skipped(run, "Condition not met: " + predicate));
        }
        return start(runId);
    }

    // =========================================================================
    // Queries
    // =========================================================================

    @Override
    public Optional<WorkflowRun> getRun(String runId) {
        if (runId == null || !runs.containsKey(runId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(latest(runId));
    }

    @Override
    public List<WorkflowRun> listRuns() {
        return runs.values().stream()
                .sorted(Comparator.comparing(WorkflowRun::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowRun> findRunsByTemplate(String templateName) {
        return listRuns().stream()
                .filter(run -> run.getTemplateName().equals(templateName))
                .collect(Collectors.toList());
    }

    @Override
    public RunMonitor monitor(String runId) throws WorkflowNotFoundException {
        return RunMonitor.of(require(runId));
    }

    @Override
    public Map<WorkflowStatus, Long> statusSummary() {
        Map<WorkflowStatus, Long> summary = new EnumMap<>(WorkflowStatus.class);
        for (WorkflowStatus status : WorkflowStatus.values()) {
            summary.put(status, 0L);
        }
        runs.values().forEach(run -> summary.merge(run.getStatus(), 1L, Long::sum));
        return summary;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        pendingDecisions.values().forEach(wait -> wait.cancel(true));
        executorService.shutdown();
        runStore.releaseLease(ownerId);
        logger.info("DefaultWorkflowEngine shutdown initiated");
    }

    /**
     * Executor used for run tasks, shared with control event handling.
     */
    public Executor getExecutor() {
        return executorService;
    }

    public WorkflowCatalog getCatalog() {
        return catalog;
    }

    /**
     * Id under which this engine holds its lease and owns the runs it executes.
     */
    public String getOwnerId() {
        return ownerId;
    }

    // =========================================================================
    // Step execution
    // =========================================================================

    private CompletableFuture<ExecutionResult> launch(Execution execution) {
        String runId = execution.runId();
        synchronized (lockFor(runId)) {
            // one task per run: a resumed execution starts once the previous task has returned
            CompletableFuture<ExecutionResult> previous = activeTasks.get(runId);
            CompletableFuture<?> ready = previous == null
                    ? CompletableFuture.completedFuture(null)
                    : previous.handle((result, error) -> null);
            CompletableFuture<ExecutionResult> task =
                    ready.thenApplyAsync(ignored -> executeSteps(execution), executorService);
            activeTasks.put(runId, task);
            task.whenComplete((result, error) -> activeTasks.remove(runId, task));
            return task;
        }
    }

    private ExecutionResult executeSteps(Execution execution) {
        String runId = execution.runId();
        int executed = 0;
        while (true) {
            WorkflowRun run = latest(runId);
            if (!run.isExecutedBy(execution.executionId())) {
                logger.info("Run {} execution {} superseded by {}", runId, execution.executionId(),
                        run.getExecutionId().orElse(null));
                return ExecutionResult.of(run, executed, "Superseded by a later execution");
            }
            if (run.getStatus() != WorkflowStatus.RUNNING) {
                logger.info("Run {} halted with status {}", runId, run.getStatus());
                return ExecutionResult.of(run, executed, "Halted: " + run.getStatus());
            }
            int index = run.getCurrentStepIndex();
            if (index >= run.getSteps().size()) {
                return complete(execution, executed);
            }
            WorkflowStep step = run.getSteps().get(index);
            try {
                if (step.getStatus() == StepStatus.RUNNING) {
                    awaitInFlightStep(execution, index, step);
                    continue;
                }
                if (step.isApprovalGate()) {
                    GatePass pass = passGate(execution, run, index, step);
                    if (pass.outcome() == GateOutcome.REJECTED) {
                        return pauseAtGate(execution, index, step, pass.alertId(), executed);
                    }
                    if (pass.outcome() == GateOutcome.INTERRUPTED) {
                        resetWaitingStep(execution, index);
                        continue;
                    }
                    notifications.notify("Approval received for " + step.getDescription()
                            + ", workflow continues", notificationChannel);
                } else {
                    if (!markStepIfRunning(execution, index, StepStatus.RUNNING)) {
                        continue;
                    }
                    eventBus.publish(step.getEventType(), stepPayload(run, step), runId);
                    logger.info("Run {} executed {} '{}' ({})", runId, step.getId(), step.getEventType(), step.getDescription());
                }
                completeStep(runId, index);
                executed++;
            } catch (InterruptedException e) {
                // record the failure first: I/O on an interrupted thread closes the channel
                resetWaitingStep(execution, index);
                ExecutionResult failed = fail(runId, index, step,
                        new IllegalStateException("Interrupted while executing " + step.getId(), e), executed);
                Thread.currentThread().interrupt();
                return failed;
            } catch (EventLogException | RuntimeException e) {
                return fail(runId, index, step, e, executed);
            }
        }
    }

    private GatePass passGate(Execution execution, WorkflowRun run, int index, WorkflowStep step)
            throws InterruptedException {
        String runId = run.getId();
        String alertId = approvalGateway.newAlertId(run.getTemplateName(), step.getEventType(), runId);
        if (!markStepIfRunning(execution, index, StepStatus.WAITING_APPROVAL)) {
            return new GatePass(GateOutcome.INTERRUPTED, alertId);
        }
        approvalGateway.requestApproval(step.getDescription(), alertId, notificationChannel);
        CompletableFuture<Boolean> decision = approvalGateway.awaitDecision(alertId, approvalTimeout);
        pendingDecisions.put(runId, decision);
        // pause or cancel may have run before the wait was registered
        if (!isCurrent(latest(runId), execution)) {
            decision.cancel(true);
        }
        logger.info("Run {} waiting for approval at {} (alertId={})", runId, step.getId(), alertId);

        boolean approved;
        try {
            approved = waitForDecision(execution, decision);
        } catch (CancellationException e) {
            return new GatePass(GateOutcome.INTERRUPTED, alertId);
        } catch (InterruptedException e) {
            decision.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            logger.error("Waiting for decision {} failed, treating as rejected", alertId, e.getCause());
            approved = false;
        } finally {
            pendingDecisions.remove(runId, decision);
        }

        if (!isCurrent(latest(runId), execution)) {
            return new GatePass(GateOutcome.INTERRUPTED, alertId);
        }
        return new GatePass(approved ? GateOutcome.APPROVED : GateOutcome.REJECTED, alertId);
    }

    private boolean waitForDecision(Execution execution, CompletableFuture<Boolean> decision)
            throws InterruptedException, ExecutionException {
        while (true) {
            try {
                return decision.get(controlPollInterval.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                // an engine in another process may have paused or cancelled the run
                if (!isCurrent(latest(execution.runId()), execution)) {
                    decision.cancel(true);
                }
            }
        }
    }

    private void awaitInFlightStep(Execution execution, int index, WorkflowStep step) throws InterruptedException {
        String runId = execution.runId();
        String previousOwner = execution.previousOwner();
        if (previousOwner == null || previousOwner.equals(ownerId) || !isLeaseActive(previousOwner)) {
            logger.warn("Run {} step {} was interrupted while executing, running it again", runId, step.getId());
            mutate(runId, current -> current.isExecutedBy(execution.executionId())
                    && current.getCurrentStepIndex() == index
                    && current.getSteps().get(index).getStatus() == StepStatus.RUNNING
                    ? current.withStepStatus(index, StepStatus.PENDING, now())
                    : null);
            return;
        }
        logger.debug("Run {} waiting for engine {} to finish {}", runId, previousOwner, step.getId());
        Thread.sleep(controlPollInterval.toMillis());
    }

    private ExecutionResult pauseAtGate(Execution execution, int index, WorkflowStep step, String alertId, int executed) {
        Mutation mutation = mutate(execution.runId(), current -> {
            if (!isCurrent(current, execution)) {
                return null;
            }
            Instant now = now();
            return current.withStepStatus(index, StepStatus.REJECTED, now).withStatus(WorkflowStatus.PAUSED, now);
        });
        WorkflowRun paused = mutation.run();
        if (!mutation.changed()) {
            return ExecutionResult.of(paused, executed, "Halted: " + paused.getStatus());
        }
        logger.warn("Run {} paused: approval for {} rejected or timed out (alertId={})", paused.getId(), step.getId(), alertId);
        metrics.increment(MetricsRecorder.WORKFLOW_PAUSED);
        escalate(paused, step, "Approval rejected or timed out for '" + step.getDescription() + "'", alertId);
        return ExecutionResult.of(paused, executed, "Paused at approval gate " + step.getId());
    }

    private ExecutionResult fail(String runId, int index, WorkflowStep step, Exception cause, int executed) {
        WorkflowExecutionException failure = new WorkflowExecutionException(runId, step.getId(), cause.getMessage(), cause);
        logger.error("Workflow run {} failed at {} ({})", runId, step.getId(), step.getEventType(), failure);
        WorkflowRun failed = mutate(runId, current -> {
            Instant now = now();
            WorkflowRun next = current.withStepStatus(index, StepStatus.FAILED, now).withError(failure.getMessage(), now);
            return next.getStatus().canTransitionTo(WorkflowStatus.FAILED)
                    ? next.withStatus(WorkflowStatus.FAILED, now) : next;
        }).run();
        metrics.increment(MetricsRecorder.WORKFLOWS_FAILED);
        escalate(failed, step, failure.getMessage(), null);
        return ExecutionResult.of(failed, executed, "Failed at step " + step.getId());
    }

    private ExecutionResult complete(Execution execution, int executed) {
        Mutation mutation = mutate(execution.runId(), current ->
                isCurrent(current, execution) ? current.withStatus(WorkflowStatus.COMPLETED, now()) : null);
        WorkflowRun completed = mutation.run();
        if (!mutation.changed()) {
            return ExecutionResult.of(completed, executed, "Halted: " + completed.getStatus());
        }
        String runId = completed.getId();
        metrics.increment(MetricsRecorder.WORKFLOWS_COMPLETED);
        completed.getDuration().ifPresent(d -> metrics.recordDuration(runId, d.toMillis() / 1000.0));
        logger.info("Workflow run {} ({}) completed", runId, completed.getTemplateName());
        notifications.notify("Workflow " + completed.getTemplateName() + " completed (" + runId + ")", notificationChannel);
        return ExecutionResult.of(completed, executed, "Completed");
    }

    private void escalate(WorkflowRun run, WorkflowStep step, String reason, String alertId) {
        metrics.increment(MetricsRecorder.ESCALATIONS);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", run.getId());
        payload.put("reason", reason);
        payload.put("channel", escalationChannel);
        payload.put("workflow", run.getTemplateName());
        payload.put("stepId", step.getId());
        if (alertId != null) {
            payload.put("alertId", alertId);
        }
        try {
            eventBus.publish(EventContract.ESCALATION.eventType(), payload, run.getId());
        } catch (EventLogException | RuntimeException e) {
            logger.error("Failed to record escalation for run {}", run.getId(), e);
        }
        notifications.notify("Escalation for workflow " + run.getTemplateName() + " (" + run.getId() + "): "
                + reason, escalationChannel);
    }

    private Map<String, Object> stepPayload(WorkflowRun run, WorkflowStep step) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", run.getId());
        payload.put("workflow", run.getTemplateName());
        payload.put("stepId", step.getId());
        payload.put("agent", step.getAgent());
        payload.put("command", step.getCommand());
        payload.put("description", step.getDescription());
        payload.put("parameters", step.getParameters());
        return payload;
    }

    // =========================================================================
    // State helpers
    // =========================================================================

    private boolean isCurrent(WorkflowRun run, Execution execution) {
        return run.getStatus() == WorkflowStatus.RUNNING && run.isExecutedBy(execution.executionId());
    }

    private boolean markStepIfRunning(Execution execution, int index, StepStatus stepStatus) {
        return mutate(execution.runId(), current -> {
            if (!isCurrent(current, execution) || current.getCurrentStepIndex() != index
                    || current.getSteps().get(index).getStatus() == StepStatus.RUNNING) {
                return null;
            }
            return current.withStepStatus(index, stepStatus, now());
        }).changed();
    }

    private void completeStep(String runId, int index) {
        mutate(runId, current -> {
            if (current.getCurrentStepIndex() != index) {
                return null;
            }
            Instant now = now();
            return current.withStepStatus(index, StepStatus.COMPLETED, now).advance(now);
        });
    }

    private void resetWaitingStep(Execution execution, int index) {
        mutate(execution.runId(), current -> current.isExecutedBy(execution.executionId())
                && current.getSteps().get(index).getStatus() == StepStatus.WAITING_APPROVAL
                ? current.withStepStatus(index, StepStatus.PENDING, now())
                : null);
    }

    private Mutation transition(String runId, WorkflowStatus from, WorkflowStatus to, String executionId)
            throws WorkflowNotFoundException, InvalidTransitionException {
        require(runId);
        Mutation mutation = mutate(runId, current -> {
            if (current.getStatus() != from) {
                throw new InvalidTransitionException(runId, current.getStatus(), to,
                        current.getStatus().getValidTransitions().toArray(new WorkflowStatus[0]));
            }
            checkTransition(current, to);
            Instant now = now();
            WorkflowRun next = current.withStatus(to, now);
            return executionId == null ? next : next.withExecution(ownerId, executionId, now);
        });
        logger.info("Run {} ({}): {} → {}", runId, mutation.run().getTemplateName(), from, to);
        return mutation;
    }

    private void checkTransition(WorkflowRun run, WorkflowStatus target) throws InvalidTransitionException {
        if (!run.getStatus().canTransitionTo(target)) {
            throw new InvalidTransitionException(run.getId(), run.getStatus(), target,
                    run.getStatus().getValidTransitions().toArray(new WorkflowStatus[0]));
        }
    }

    private void cancelPendingDecision(String runId) {
        CompletableFuture<Boolean> wait = pendingDecisions.remove(runId);
        if (wait != null) {
            wait.cancel(true);
        }
    }

    private WorkflowRun require(String runId) throws WorkflowNotFoundException {
        WorkflowRun run = runId == null ? null : runs.get(runId);
        if (run == null) {
            throw new WorkflowNotFoundException(runId);
        }
        return run;
    }

    private Object lockFor(String runId) {
        return runLocks.computeIfAbsent(runId, id -> new Object());
    }

    /**
     * Newest known snapshot of the run, including changes made by other engines.
     */
    private WorkflowRun latest(String runId) {
        return mutate(runId, current -> null).run();
    }

    /**
     * Applies {@code update} to the newer of the stored and the cached run and stores the result.
     * If the store fails the change is kept in memory only and the failure is logged.
     */
    private <X extends Exception> Mutation mutate(String runId, RunUpdate<X> update) throws X {
        synchronized (lockFor(runId)) {
            WorkflowRun cached = runs.get(runId);
            AtomicReference<WorkflowRun> before = new AtomicReference<>(cached);
            AtomicBoolean changed = new AtomicBoolean(false);
            RunUpdate<X> applied = stored -> {
                WorkflowRun base = newer(stored, cached);
                before.set(base);
                WorkflowRun next = update.apply(base);
                changed.set(next != null);
                if (next != null) {
                    return next;
                }
                // write back a change that an earlier failed save kept in memory only
                return base != stored ? base : null;
            };
            WorkflowRun result;
            try {
                result = runStore.update(runId, applied);
            } catch (EventLogException e) {
                logger.error("Failed to persist run {}, keeping the change in memory only", runId, e);
                before.set(cached);
                WorkflowRun next = update.apply(cached);
                changed.set(next != null);
                result = next != null ? next : cached;
            }
            if (result != null) {
                runs.put(runId, result);
            }
            return new Mutation(before.get(), result, changed.get());
        }
    }

    private static WorkflowRun newer(WorkflowRun stored, WorkflowRun cached) {
        if (stored == null) {
            return cached;
        }
        if (cached == null) {
            return stored;
        }
        return stored.getVersion() >= cached.getVersion() ? stored : cached;
    }

    private boolean isLeaseActive(String owner) {
        if (ownerId.equals(owner)) {
            return true;
        }
        try {
            return runStore.isLeaseActive(owner);
        } catch (EventLogException e) {
            logger.warn("Could not check the lease of engine {}, assuming it is alive: {}", owner, e.getMessage());
            return true;
        }
    }

    private void loadPersistedRuns() throws EventLogException {
        List<WorkflowRun> persisted = runStore.loadAll();
        for (WorkflowRun run : persisted) {
            runs.put(run.getId(), run);
            if (run.getStatus() != WorkflowStatus.RUNNING) {
                continue;
            }
            Optional<String> owner = run.getOwner();
            if (owner.isPresent() && isLeaseActive(owner.get())) {
                logger.info("Run {} is executing in engine {}", run.getId(), owner.get());
                continue;
            }
            logger.warn("Run {} was running in an engine that stopped, marking FAILED", run.getId());
            mutate(run.getId(), current -> {
                if (current.getStatus() != WorkflowStatus.RUNNING
                        || !current.getExecutionId().equals(run.getExecutionId())) {
                    return null;
                }
                Instant now = now();
                return current.withError(INTERRUPTED_BY_RESTART, now).withStatus(WorkflowStatus.FAILED, now);
            });
        }
        if (!persisted.isEmpty()) {
            logger.info("Loaded {} persisted workflow runs", persisted.size());
        }
    }

    private String newExecutionId() {
        return "exec-" + UUID.randomUUID();
    }

    private Instant now() {
        return Instant.now(clock);
    }

    /**
     * Builder for {@link DefaultWorkflowEngine}. The event bus and approval gateway are required.
     */
    public static class Builder {
        private EventBus eventBus;
        private ApprovalGateway approvalGateway;
        private WorkflowCatalog catalog;
        private NotificationService notifications;
        private MetricsRecorder metrics;
        private WorkflowRunStore runStore;
        private ExecutionCondition condition;
        private String notificationChannel = "#devops-alerts";
        private String escalationChannel = "#escalations";
        private Duration approvalTimeout = Duration.ofHours(1);
        private Duration controlPollInterval = Duration.ofSeconds(1);
        private Clock clock = Clock.systemUTC();

        public Builder eventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder approvalGateway(ApprovalGateway approvalGateway) {
            this.approvalGateway = approvalGateway;
            return this;
        }

        public Builder catalog(WorkflowCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder notifications(NotificationService notifications) {
            this.notifications = notifications;
            return this;
        }

        public Builder metrics(MetricsRecorder metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder runStore(WorkflowRunStore runStore) {
            this.runStore = runStore;
            return this;
        }

        public Builder condition(ExecutionCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder notificationChannel(String notificationChannel) {
            this.notificationChannel = notificationChannel;
            return this;
        }

        public Builder escalationChannel(String escalationChannel) {
            this.escalationChannel = escalationChannel;
            return this;
        }

        public Builder approvalTimeout(Duration approvalTimeout) {
            this.approvalTimeout = approvalTimeout;
            return this;
        }

        /**
         * How often a waiting execution re-reads the run store for controls issued elsewhere.
         */
        public Builder controlPollInterval(Duration controlPollInterval) {
            this.controlPollInterval = controlPollInterval;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the engine and loads previously persisted runs.
         *
         * @throws EventLogException if the run store cannot be read
         */
        public DefaultWorkflowEngine build() throws EventLogException {
            return new DefaultWorkflowEngine(this);
        }
    }
}
