package io.mcoda.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcoda.config.McodaConfig;
import io.mcoda.context.ContextStore;
import io.mcoda.context.LaneMessage;
import io.mcoda.job.CheckpointRecord;
import io.mcoda.job.CheckpointView;
import io.mcoda.job.JobEngine;
import io.mcoda.job.JobRecord;
import io.mcoda.routing.Agent;
import io.mcoda.routing.AgentHealth;
import io.mcoda.routing.HealthStatus;
import io.mcoda.routing.ResolveRequest;
import io.mcoda.routing.ResolvedAgent;
import io.mcoda.routing.RoutingDefault;
import io.mcoda.routing.RoutingDefaultsUpdate;
import io.mcoda.routing.RoutingException;
import io.mcoda.routing.RoutingPreview;
import io.mcoda.routing.RoutingResolver;
import io.mcoda.runtime.McodaRuntime;
import io.mcoda.security.PatternRedactor;
import io.mcoda.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

@Command(
        name = "mcoda",
        mixinStandardHelpOptions = true,
        description = "mcoda workspace jobs, agent routing and context lanes",
        subcommands = {
                McodaCommand.InitCommand.class,
                McodaCommand.JobCommand.class,
                McodaCommand.AgentsCommand.class,
                McodaCommand.RoutingCommand.class,
                McodaCommand.ContextCommand.class
        }
)
public final class McodaCommand implements Runnable {
    @Option(names = {"--workspace"}, description = "Workspace root directory", defaultValue = ".")
    String workspace;

    @Option(names = {"--workspace-id"}, description = "Workspace id (defaults to the absolute workspace path)")
    String workspaceId;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | job | agents | routing | context");
    }

    McodaConfig config() {
        return McodaConfig.fromRoot(workspace, workspaceId);
    }

    McodaRuntime runtime() {
        McodaRuntime runtime = new McodaRuntime(config());
        runtime.init();
        return runtime;
    }

    @Command(name = "init", description = "Create .mcoda/ and the workspace database")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        McodaCommand parent;

        @Override
        public Integer call() {
            McodaRuntime runtime = parent.runtime();
            System.out.println("Initialized mcoda workspace at: " + runtime.config().stateDir());
            return 0;
        }
    }

    @Command(
            name = "job",
            description = "Inspect jobs and their checkpoints",
            subcommands = {
                    JobListCommand.class,
                    JobShowCommand.class,
                    JobCheckpointsCommand.class,
                    JobLogCommand.class
            }
    )
    static final class JobCommand implements Runnable {
        @ParentCommand
        McodaCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | show | checkpoints | log");
        }
    }

    @Command(name = "list", description = "List recent jobs")
    static final class JobListCommand implements Callable<Integer> {
        @ParentCommand
        JobCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Maximum jobs to print")
        int limit;

        @Override
        public Integer call() {
            McodaRuntime runtime = parent.parent.runtime();
            System.out.println(Jsons.toJson(runtime.jobEngine().listJobs(limit)));
            return 0;
        }
    }

    @Command(name = "show", description = "Show a job row and its latest checkpoint")
    static final class JobShowCommand implements Callable<Integer> {
        @ParentCommand
        JobCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            JobEngine engine = parent.parent.runtime().jobEngine();
            Optional<JobRecord> job = engine.getJob(jobId);
            Optional<CheckpointView> checkpoint = engine.loadCheckpoint(jobId);
            if (job.isEmpty() && checkpoint.isEmpty()) {
                System.err.println("Job not found: " + jobId);
                return 1;
            }
            System.out.println(Jsons.toJson(new JobDetails(
                    job.orElse(null),
                    checkpoint.map(JobShowCommand::summarize).orElse(null)
            )));
            return 0;
        }

        private static CheckpointSummary summarize(CheckpointView view) {
            return new CheckpointSummary(
                    view.checkpointSeq(),
                    view.stage(),
                    view.status().wireValue(),
                    view.reason(),
                    view.createdAt(),
                    view.legacy(),
                    PatternRedactor.masked(view.payload())
            );
        }
    }

    @Command(name = "checkpoints", description = "List every checkpoint of a job in sequence order")
    static final class JobCheckpointsCommand implements Callable<Integer> {
        @ParentCommand
        JobCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            List<CheckpointRecord> records = parent.parent.runtime().jobEngine().listCheckpoints(jobId);
            List<CheckpointSummary> out = new ArrayList<>();
            for (CheckpointRecord record : records) {
                out.add(new CheckpointSummary(
                        record.checkpointSeq(),
                        record.stage(),
                        record.status(),
                        record.reason(),
                        record.createdAt(),
                        false,
                        PatternRedactor.masked(record.payload())
                ));
            }
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "log", description = "Print the job's stream log")
    static final class JobLogCommand implements Callable<Integer> {
        @ParentCommand
        JobCommand parent;

        @Parameters(index = "0", description = "Job id")
        String jobId;

        @Override
        public Integer call() {
            System.out.print(parent.parent.runtime().jobEngine().readLog(jobId));
            return 0;
        }
    }

    @Command(
            name = "agents",
            description = "Manage the local agent registry",
            subcommands = {
                    AgentsListCommand.class,
                    AgentsAddCommand.class,
                    AgentsHealthCommand.class
            }
    )
    static final class AgentsCommand implements Runnable {
        @ParentCommand
        McodaCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: list | add | health");
        }
    }

    @Command(name = "list", description = "List registered agents")
    static final class AgentsListCommand implements Callable<Integer> {
        @ParentCommand
        AgentsCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.parent.runtime().agentStore().listAgents()));
            return 0;
        }
    }

    @Command(name = "add", description = "Register or replace an agent")
    static final class AgentsAddCommand implements Callable<Integer> {
        @ParentCommand
        AgentsCommand parent;

        @Parameters(index = "0", description = "Agent slug")
        String slug;

        @Option(names = {"--id"}, description = "Agent id (defaults to the id of an existing agent with this slug, else a new UUID)")
        String id;

        @Option(names = {"--adapter"}, required = true, description = "Adapter kind, e.g. openai-api or ollama-cli")
        String adapter;

        @Option(names = {"--model"}, description = "Default model")
        String model;

        @Option(names = {"--capability"}, description = "Capability name (repeatable)")
        List<String> capabilities = new ArrayList<>();

        @Option(names = {"--rating"}, description = "Rating")
        Double rating;

        @Option(names = {"--cost-per-million"}, description = "Cost per million tokens")
        Double costPerMillion;

        @Override
        public Integer call() {
            McodaRuntime runtime = parent.parent.runtime();
            String agentId = id;
            if (agentId == null || agentId.isBlank()) {
                agentId = runtime.agentStore().findAgent(slug).map(Agent::id).orElse(UUID.randomUUID().toString());
            }
            runtime.agentStore().saveAgent(new Agent(agentId, slug, adapter, model, capabilities, null, rating, costPerMillion));
            System.out.println(Jsons.toJson(runtime.agentStore().findAgent(agentId).orElseThrow()));
            return 0;
        }
    }

    @Command(name = "health", description = "Record an agent health probe result")
    static final class AgentsHealthCommand implements Callable<Integer> {
        @ParentCommand
        AgentsCommand parent;

        @Parameters(index = "0", description = "Agent id or slug")
        String agent;

        @Option(names = {"--status"}, required = true, description = "healthy|degraded|unreachable")
        String status;

        @Option(names = {"--latency-ms"}, description = "Probe latency")
        Long latencyMs;

        @Option(names = {"--reason"}, description = "Reason text")
        String reason;

        @Override
        public Integer call() {
            McodaRuntime runtime = parent.parent.runtime();
            Agent found = runtime.agentStore().findAgent(agent)
                    .orElseThrow(() -> new RoutingException("Unknown agent: " + agent));
            HealthStatus parsed = HealthStatus.parse(status);
            if (parsed == HealthStatus.UNKNOWN) {
                throw new IllegalArgumentException("Unknown health status: " + status);
            }
            runtime.agentStore().recordHealth(found.id(), new AgentHealth(parsed, latencyMs, Instant.now(), reason));
            System.out.println(Jsons.toJson(runtime.agentStore().findAgent(found.id()).orElseThrow()));
            return 0;
        }
    }

    @Command(
            name = "routing",
            description = "Routing defaults and resolution",
            subcommands = {
                    RoutingDefaultsCommand.class,
                    RoutingPreviewCommand.class
            }
    )
    static final class RoutingCommand implements Runnable {
        @ParentCommand
        McodaCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: defaults | preview");
        }
    }

    @Command(name = "defaults", description = "Show or change routing defaults")
    static final class RoutingDefaultsCommand implements Callable<Integer> {
        @ParentCommand
        RoutingCommand parent;

        @Option(names = {"--global"}, description = "Operate on the global defaults")
        boolean global;

        @Option(names = {"--set"}, description = "command=agent binding (repeatable)")
        Map<String, String> set = new LinkedHashMap<>();

        @Option(names = {"--reset"}, description = "Command whose binding is removed (repeatable)")
        List<String> reset = new ArrayList<>();

        @Option(names = {"--qa-profile"}, description = "QA profile tag")
        String qaProfile;

        @Option(names = {"--docdex-scope"}, description = "Docdex scope tag")
        String docdexScope;

        @Override
        public Integer call() {
            McodaRuntime runtime = parent.parent.runtime();
            RoutingResolver resolver = runtime.routingResolver();
            String target = global ? McodaConfig.GLOBAL_WORKSPACE_ID : runtime.config().workspaceId();
            RoutingDefaultsUpdate update = new RoutingDefaultsUpdate(set, reset, qaProfile, docdexScope);
            List<RoutingDefault> defaults = update.isEmpty()
                    ? resolver.getWorkspaceDefaults(target)
                    : resolver.updateWorkspaceDefaults(target, update);
            System.out.println(Jsons.toJson(defaults));
            return 0;
        }
    }

    @Command(name = "preview", description = "Show the candidate chain and the agent a command resolves to")
    static final class RoutingPreviewCommand implements Callable<Integer> {
        @ParentCommand
        RoutingCommand parent;

        @Parameters(index = "0", description = "Command name")
        String command;

        @Option(names = {"--task-type"}, description = "Task type")
        String taskType;

        @Option(names = {"--agent"}, description = "Override agent slug")
        String agent;

        @Override
        public Integer call() {
            McodaRuntime runtime = parent.parent.runtime();
            RoutingResolver resolver = runtime.routingResolver();
            ResolveRequest request = ResolveRequest.of(runtime.config().workspaceId(), command)
                    .withTaskType(taskType)
                    .withOverride(agent);
            RoutingPreview preview = resolver.preview(request);
            ResolvedAgent resolved = null;
            String error = null;
            try {
                resolved = resolver.resolveAgentForCommand(request);
            } catch (RoutingException e) {
                error = e.getMessage();
            }
            System.out.println(Jsons.toJson(new PreviewOutcome(preview, resolved, error)));
            return error == null ? 0 : 2;
        }
    }

    @Command(
            name = "context",
            description = "Inspect persisted context lanes",
            subcommands = {ContextShowCommand.class}
    )
    static final class ContextCommand implements Runnable {
        @ParentCommand
        McodaCommand parent;

        @Override
        public void run() {
            System.out.println("Use subcommands: show");
        }
    }

    @Command(name = "show", description = "Print the stored messages of a lane")
    static final class ContextShowCommand implements Callable<Integer> {
        @ParentCommand
        ContextCommand parent;

        @Parameters(index = "0", description = "Lane id, e.g. job-42:task-7:builder")
        String laneId;

        @Override
        public Integer call() {
            ContextStore store = parent.parent.runtime().contextStore();
            List<LaneMessage> messages = store.loadLane(laneId);
            System.out.println(Jsons.toJson(new LaneOutcome(laneId, messages.size(), messages)));
            return 0;
        }
    }

    record JobDetails(JobRecord job, CheckpointSummary latestCheckpoint) {
    }

    record CheckpointSummary(
            long seq,
            String stage,
            String status,
            String reason,
            Instant createdAt,
            boolean legacy,
            JsonNode payload
    ) {
    }

    record PreviewOutcome(RoutingPreview preview, ResolvedAgent resolved, String error) {
    }

    record LaneOutcome(String laneId, int messageCount, List<LaneMessage> messages) {
    }
}
