package io.mcoda.runtime;

import io.mcoda.config.McodaConfig;
import io.mcoda.config.McodaSettings;
import io.mcoda.context.ContextLaneManager;
import io.mcoda.context.ContextStore;
import io.mcoda.context.FileContextStore;
import io.mcoda.context.Summarizer;
import io.mcoda.job.JobEngine;
import io.mcoda.routing.LocalRoutingBackend;
import io.mcoda.routing.RemoteRoutingBackend;
import io.mcoda.routing.RoutingBackend;
import io.mcoda.routing.RoutingResolver;
import io.mcoda.storage.AgentStore;
import io.mcoda.storage.Database;
import io.mcoda.storage.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the workspace database, the job engine, routing and context lanes for one CLI invocation.
 */
public final class McodaRuntime {
    private static final Logger log = LoggerFactory.getLogger(McodaRuntime.class);

    private final McodaConfig config;
    private final McodaSettings settings;
    private final Database database;
    private final WorkspaceStore workspaceStore;
    private final AgentStore agentStore;

    public McodaRuntime(McodaConfig config) {
        this(config, McodaSettings.load(config));
    }

    public McodaRuntime(McodaConfig config, McodaSettings settings) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.workspaceStore = new WorkspaceStore(database);
        this.agentStore = new AgentStore(database);
    }

    public void init() {
        database.init();
        log.debug("Workspace {} initialized at {}", config.workspaceId(), config.stateDir());
    }

    public McodaConfig config() {
        return config;
    }

    public McodaSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public WorkspaceStore workspaceStore() {
        return workspaceStore;
    }

    public AgentStore agentStore() {
        return agentStore;
    }

    public JobEngine jobEngine() {
        return new JobEngine(config, workspaceStore, settings.runtimeVersion(), Clock.systemUTC());
    }

    public RoutingBackend routingBackend() {
        if (settings.remoteRouting()) {
            log.debug("Using routing API at {}", settings.routingApiUrl());
            return new RemoteRoutingBackend(settings.routingApiUrl(), Duration.ofMillis(settings.routingTimeoutMs()));
        }
        return new LocalRoutingBackend(agentStore);
    }

    public RoutingResolver routingResolver() {
        return new RoutingResolver(routingBackend());
    }

    public ContextStore contextStore() {
        return new FileContextStore(config.contextDir(settings.context().storageDir()));
    }

    public ContextLaneManager contextLanes(Summarizer summarizer) {
        return ContextLaneManager.forWorkspace(config, settings.context(), summarizer);
    }
}
