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

package dev.mars.flowgate.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.mars.flowgate.bus.EventBus;
import dev.mars.flowgate.config.FlowgateConfiguration;
import dev.mars.flowgate.config.JacksonConfig;
import dev.mars.flowgate.core.exceptions.InvalidTransitionException;
import dev.mars.flowgate.core.exceptions.ValidationException;
import dev.mars.flowgate.core.exceptions.WorkflowNotFoundException;
import dev.mars.flowgate.event.ApprovalDecision;
import dev.mars.flowgate.event.Event;
import dev.mars.flowgate.event.EventContract;
import dev.mars.flowgate.workflow.DefaultWorkflowEngine;
import dev.mars.flowgate.workflow.ExecutionResult;
import dev.mars.flowgate.workflow.RecoveryResult;
import dev.mars.flowgate.workflow.RunMonitor;
import dev.mars.flowgate.workflow.WorkflowPriority;
import dev.mars.flowgate.workflow.WorkflowRun;
import dev.mars.flowgate.workflow.WorkflowStatus;
import dev.mars.flowgate.workflow.catalog.WorkflowTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Root {@code flowgate} command. Every subcommand opens a runtime over the data directory,
 * prints its result as JSON and exits 0, or 1 on an invalid argument, unknown template or
 * unknown run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
@Command(
        name = "flowgate",
        mixinStandardHelpOptions = true,
        version = "flowgate 1.0.0",
        description = "Event bus and workflow orchestration with human approval gates",
        subcommands = {
                FlowgateCommand.StartWorkflowCommand.class,
                FlowgateCommand.ShowStatusCommand.class,
                FlowgateCommand.ListWorkflowsCommand.class,
                FlowgateCommand.ShowHistoryCommand.class,
                FlowgateCommand.ReplayHistoryCommand.class,
                FlowgateCommand.ShowWorkflowStatusCommand.class,
                FlowgateCommand.ShowMetricsCommand.class,
                FlowgateCommand.DecideCommand.class,
                FlowgateCommand.RecoverCommand.class,
                FlowgateCommand.CancelCommand.class,
                FlowgateCommand.ResumeCommand.class
        }
)
public final class FlowgateCommand implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(FlowgateCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;

    private static final ObjectMapper MAPPER = JacksonConfig.newObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Spec
    CommandSpec spec;

    @Option(names = {"--data-dir"}, description = "Data directory, overrides flowgate.data.dir")
    Path dataDir;

    @Option(names = {"--config"}, description = "Properties file with flowgate.* settings")
    Path configFile;

    /**
     * Command line with parameter and execution errors mapped to exit code 1.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new FlowgateCommand());
        commandLine.setParameterExceptionHandler((ex, args) -> {
            CommandLine failed = ex.getCommandLine();
            failed.getErr().println(ex.getMessage());
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, failed.getErr());
            failed.usage(failed.getErr());
            return EXIT_INVALID;
        });
        commandLine.setExecutionExceptionHandler((ex, failed, parseResult) -> {
            logger.error("Command '{}' failed", failed.getCommandName(), ex);
            failed.getErr().println("Error: " + ex.getMessage());
            return EXIT_INVALID;
        });
        return commandLine;
    }

    @Override
    public void run() {
        spec.commandLine().usage(out());
    }

    FlowgateConfiguration configuration() throws IOException {
        FlowgateConfiguration configuration = configFile != null
                ? FlowgateConfiguration.fromFile(configFile)
                : new FlowgateConfiguration();
        if (dataDir != null) {
            configuration.setProperty(FlowgateConfiguration.DATA_DIR, dataDir.toString());
        }
        return configuration;
    }

    @FunctionalInterface
    interface RuntimeAction {
        int run(FlowgateRuntime runtime) throws Exception;
    }

    int withRuntime(RuntimeAction action) throws Exception {
        return withRuntime(configuration(), action);
    }

    int withRuntime(FlowgateConfiguration configuration, RuntimeAction action) throws Exception {
        try (FlowgateRuntime runtime = FlowgateRuntime.open(configuration)) {
            return action.run(runtime);
        } catch (ValidationException | WorkflowNotFoundException | InvalidTransitionException e) {
            err().println("Error: " + e.getMessage());
            return EXIT_INVALID;
        }
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    void printJson(Object value) throws IOException {
        out().println(MAPPER.writeValueAsString(value));
        out().flush();
    }

    @Command(name = "start-workflow", description = "Create a run of a workflow template and execute it")
    static final class StartWorkflowCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Option(names = {"--workflow"}, required = true, description = "Workflow template name")
        String workflow;

        @Option(names = {"--timeout"}, description = "Approval timeout in seconds")
        Long timeoutSeconds;

        @Option(names = {"--priority"}, defaultValue = "NORMAL", description = "LOW, NORMAL, HIGH or CRITICAL")
        WorkflowPriority priority;

        @Override
        public Integer call() throws Exception {
            FlowgateConfiguration configuration = parent.configuration();
            if (timeoutSeconds != null) {
                if (timeoutSeconds <= 0) {
                    parent.err().println("Error: --timeout must be positive");
                    return EXIT_INVALID;
                }
                configuration.setProperty(FlowgateConfiguration.APPROVAL_TIMEOUT_SECONDS, String.valueOf(timeoutSeconds));
            }
            return parent.withRuntime(configuration, runtime -> {
                DefaultWorkflowEngine engine = runtime.getEngine();
                WorkflowRun run = engine.create(workflow, List.of(), List.of(), priority);
                ExecutionResult result = engine.start(run.getId()).get();
                parent.printJson(result);
                return EXIT_OK;
            });
        }
    }

    @Command(name = "show-status", description = "Run counts per status and the active runs")
    static final class ShowStatusCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                DefaultWorkflowEngine engine = runtime.getEngine();
                List<RunMonitor> active = new ArrayList<>();
                for (WorkflowRun run : engine.listRuns()) {
                    if (run.getStatus().isActive()) {
                        active.add(engine.monitor(run.getId()));
                    }
                }
                EventBus bus = runtime.getEventBus();
                Set<String> decided = bus.getEvents(EventContract.DECISION.eventType())
                        .map(event -> event.getString("alertId"))
                        .collect(Collectors.toSet());
                List<String> undecided = bus.getEvents(EventContract.APPROVAL_REQUESTED.eventType())
                        .map(event -> event.getString("alertId"))
                        .filter(alertId -> !decided.contains(alertId))
                        .collect(Collectors.toList());

                Map<String, Object> status = new LinkedHashMap<>();
                Map<WorkflowStatus, Long> summary = engine.statusSummary();
                status.put("summary", summary);
                status.put("active", active);
                status.put("undecidedApprovals", undecided);
                parent.printJson(status);
                return EXIT_OK;
            });
        }
    }

    @Command(name = "list-workflows", description = "Workflow templates with their steps and approval gates")
    static final class ListWorkflowsCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                List<Map<String, Object>> templates = new ArrayList<>();
                for (WorkflowTemplate template : runtime.getCatalog().templates()) {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("name", template.getName());
                    entry.put("description", template.getDescription());
                    entry.put("steps", template.getStepCount());
                    entry.put("gates", template.getGateCount());
                    entry.put("eventTypes", template.getSteps().stream()
                            .map(step -> step.approvalGate() ? step.eventType() + " (approval)" : step.eventType())
                            .collect(Collectors.toList()));
                    templates.add(entry);
                }
                parent.printJson(templates);
                return EXIT_OK;
            });
        }
    }

    @Command(name = "show-history", description = "Events from the log, oldest first")
    static final class ShowHistoryCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Option(names = {"--type"}, description = "Only events of this type")
        String type;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Most recent events to show, 0 for all")
        int limit;

        @Override
        public Integer call() throws Exception {
            if (limit < 0) {
                parent.err().println("Error: --limit cannot be negative");
                return EXIT_INVALID;
            }
            return parent.withRuntime(runtime -> {
                EventBus bus = runtime.getEventBus();
                List<Event> events = (type == null ? bus.getEvents() : bus.getEvents(type))
                        .collect(Collectors.toList());
                if (limit > 0 && events.size() > limit) {
                    events = events.subList(events.size() - limit, events.size());
                }
                parent.printJson(events);
                return EXIT_OK;
            });
        }
    }

    @Command(name = "replay-history", description = "Republish every logged event in order")
    static final class ReplayHistoryCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                EventBus bus = runtime.getEventBus();
                List<Event> history = bus.getEvents().collect(Collectors.toList());
                for (Event event : history) {
                    bus.publish(event.getType(), event.getPayload(), event.getCorrelationId());
                }
                logger.info("Replayed {} events", history.size());
                parent.printJson(Map.of("replayed", history.size()));
                return EXIT_OK;
            });
        }
    }

    @Command(name = "show-workflow-status", description = "Runs of one workflow template with their step statuses")
    static final class ShowWorkflowStatusCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Option(names = {"--workflow"}, required = true, description = "Workflow template name")
        String workflow;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                runtime.getCatalog().require(workflow);
                parent.printJson(runtime.getEngine().findRunsByTemplate(workflow));
                return EXIT_OK;
            });
        }
    }

    @Command(name = "show-metrics", description = "Counters and workflow durations")
    static final class ShowMetricsCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                Map<String, Object> metrics = new LinkedHashMap<>();
                metrics.put("counters", runtime.getMetrics().getCounters());
                metrics.put("workflowDurations", runtime.getMetrics().getDurations());
                parent.printJson(metrics);
                return EXIT_OK;
            });
        }
    }

    @Command(name = "decide", description = "Publish an approval decision for a waiting gate")
    static final class DecideCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Option(names = {"--alert-id"}, required = true, description = "Alert id from the approval request")
        String alertId;

        @ArgGroup(exclusive = true, multiplicity = "1")
        Verdict verdict;

        @Option(names = {"--user"}, description = "Who decided")
        String user;

        @Option(names = {"--channel"}, description = "Channel the decision came from")
        String channel;

        static final class Verdict {
            @Option(names = {"--approve"}, required = true, description = "Approve the request")
            boolean approve;

            @Option(names = {"--reject"}, required = true, description = "Reject the request")
            boolean reject;
        }

        @Override
        public Integer call() throws Exception {
            if (alertId.isBlank()) {
                parent.err().println("Error: --alert-id cannot be empty");
                return EXIT_INVALID;
            }
            return parent.withRuntime(runtime -> {
                ApprovalDecision decision = new ApprovalDecision(alertId, verdict.approve, user, channel);
                Event event = runtime.getEventBus().publish(EventContract.DECISION.eventType(), decision.toPayload());
                parent.printJson(event);
                return EXIT_OK;
            });
        }
    }

    @Command(name = "recover", description = "Move a failed run back to PENDING")
    static final class RecoverCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Option(names = {"--run"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                RecoveryResult result = runtime.getEngine().autoRecover(runId);
                parent.printJson(result);
                return EXIT_OK;
            });
        }
    }

    @Command(name = "cancel", description = "Cancel a run that has not finished")
    static final class CancelCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Option(names = {"--run"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                parent.printJson(runtime.getEngine().cancel(runId));
                return EXIT_OK;
            });
        }
    }

    @Command(name = "resume", description = "Resume a paused run from its current step")
    static final class ResumeCommand implements Callable<Integer> {
        @ParentCommand
        FlowgateCommand parent;

        @Option(names = {"--run"}, required = true, description = "Run id")
        String runId;

        @Override
        public Integer call() throws Exception {
            return parent.withRuntime(runtime -> {
                ExecutionResult result = runtime.getEngine().resume(runId).get();
                parent.printJson(result);
                return EXIT_OK;
            });
        }
    }
}
