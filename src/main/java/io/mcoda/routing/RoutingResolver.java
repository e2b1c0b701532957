package io.mcoda.routing;

import io.mcoda.config.McodaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the agent that runs a command.
 *
 * <p>An explicit override wins when it covers the required capabilities. Otherwise, and as a
 * fallback for a deficient override, the bindings are tried in fixed order (workspace command,
 * global command, workspace {@code default}, global {@code default}) and the first one that is
 * capable and not unreachable is returned. There is no scoring.
 */
public final class RoutingResolver {
    private static final Logger log = LoggerFactory.getLogger(RoutingResolver.class);

    private final RoutingBackend backend;

    public RoutingResolver(RoutingBackend backend) {
        this.backend = backend;
    }

    public ResolvedAgent resolveAgentForCommand(ResolveRequest request) {
        String command = CommandCatalog.normalize(request.commandName());
        List<String> required = CommandCatalog.requiredCapabilities(command, request.taskType());
        Set<String> missing = new LinkedHashSet<>();
        List<String> unreachable = new ArrayList<>();

        String override = request.overrideAgentSlug();
        if (override != null && !override.isBlank()) {
            Agent agent = backend.getAgent(override.trim())
                    .orElseThrow(() -> new RoutingException("Unknown agent: " + override));
            List<String> overrideMissing = agent.missingCapabilities(required);
            if (overrideMissing.isEmpty()) {
                return resolved(agent, command, required, RoutingSource.OVERRIDE, null, null);
            }
            log.warn("Override agent {} lacks {} for {}, falling back to routing defaults",
                    agent.label(), overrideMissing, command);
            missing.addAll(overrideMissing);
        }

        RoutingPreview preview = backend.preview(new PreviewRequest(
                request.workspaceId(),
                command,
                override,
                request.taskType(),
                request.projectKey(),
                required
        ));
        int considered = 0;
        for (RoutingCandidate candidate : preview.candidates()) {
            Agent agent = candidate.agent();
            if (agent == null && candidate.agentRef() != null) {
                agent = backend.getAgent(candidate.agentRef()).orElse(null);
            }
            if (agent == null) {
                log.warn("Routing default {}/{} points at missing agent {}",
                        candidate.workspaceId(), candidate.commandName(), candidate.agentRef());
                continue;
            }
            considered++;
            List<String> candidateMissing = agent.missingCapabilities(required);
            if (!candidateMissing.isEmpty()) {
                log.debug("Skipping {} ({}) for {}: missing {}",
                        agent.label(), candidate.source().wireValue(), command, candidateMissing);
                missing.addAll(candidateMissing);
                continue;
            }
            if (agent.healthStatus() == HealthStatus.UNREACHABLE) {
                log.debug("Skipping {} ({}) for {}: unreachable", agent.label(), candidate.source().wireValue(), command);
                unreachable.add(agent.label());
                continue;
            }
            log.info("Routed {} to {} via {}", command, agent.label(), candidate.source().wireValue());
            return resolved(agent, command, required, candidate.source(), candidate.qaProfile(), candidate.docdexScope());
        }

        if (!missing.isEmpty()) {
            throw new MissingCapabilityException(command, new ArrayList<>(missing));
        }
        if (!unreachable.isEmpty()) {
            throw new AgentUnreachableException(command, unreachable);
        }
        if (considered == 0) {
            throw new NoRoutingDefaultsException(request.workspaceId(), command);
        }
        throw new RoutingException("No routable agent for " + command);
    }

    /**
     * Validates every binding before a single backend write; on any failure nothing is persisted.
     */
    public List<RoutingDefault> updateWorkspaceDefaults(String workspaceId, RoutingDefaultsUpdate update) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId must not be blank");
        }
        String qaProfile = CommandCatalog.normalizeQaProfile(update.qaProfile());
        String docdexScope = CommandCatalog.normalizeDocdexScope(update.docdexScope());

        Map<String, String> normalizedSet = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : update.set().entrySet()) {
            String command = CommandCatalog.normalize(entry.getKey());
            String agentRef = entry.getValue();
            if (agentRef == null || agentRef.isBlank()) {
                throw new IllegalArgumentException("Agent missing for command " + command);
            }
            Agent agent = backend.getAgent(agentRef.trim())
                    .orElseThrow(() -> new RoutingException(
                            "Unknown agent " + agentRef + " for command " + command));
            List<String> missing = agent.missingCapabilities(CommandCatalog.requiredCapabilities(command, null));
            if (!missing.isEmpty()) {
                throw new MissingCapabilityException(agent.label(), command, missing);
            }
            normalizedSet.put(command, agent.label());
        }
        List<String> normalizedReset = new ArrayList<>();
        for (String command : update.reset()) {
            normalizedReset.add(CommandCatalog.normalize(command));
        }

        List<RoutingDefault> updated = backend.updateWorkspaceDefaults(
                workspaceId,
                new RoutingDefaultsUpdate(normalizedSet, normalizedReset, qaProfile, docdexScope)
        );
        log.info("Updated routing defaults for {}: set={} reset={}", workspaceId, normalizedSet.keySet(), normalizedReset);
        return updated;
    }

    public List<RoutingDefault> getWorkspaceDefaults(String workspaceId) {
        return backend.getWorkspaceDefaults(workspaceId);
    }

    public List<RoutingDefault> getGlobalDefaults() {
        return backend.getWorkspaceDefaults(McodaConfig.GLOBAL_WORKSPACE_ID);
    }

    public RoutingPreview preview(ResolveRequest request) {
        String command = CommandCatalog.normalize(request.commandName());
        return backend.preview(new PreviewRequest(
                request.workspaceId(),
                command,
                request.overrideAgentSlug(),
                request.taskType(),
                request.projectKey(),
                CommandCatalog.requiredCapabilities(command, request.taskType())
        ));
    }

    private static ResolvedAgent resolved(
            Agent agent,
            String command,
            List<String> required,
            RoutingSource source,
            String qaProfile,
            String docdexScope
    ) {
        return new ResolvedAgent(
                agent,
                command,
                agent.capabilities(),
                agent.healthStatus(),
                source,
                List.copyOf(required),
                qaProfile,
                docdexScope
        );
    }
}
