package io.mcoda.routing;

import io.mcoda.config.McodaConfig;
import io.mcoda.storage.AgentStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Routing backed by the workspace database.
 */
public final class LocalRoutingBackend implements RoutingBackend {
    private final AgentStore agents;

    public LocalRoutingBackend(AgentStore agents) {
        this.agents = agents;
    }

    @Override
    public RoutingPreview preview(PreviewRequest request) {
        String workspaceId = request.workspaceId();
        String command = request.commandName();
        List<RoutingCandidate> candidates = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        addCandidate(candidates, seen, workspaceId, command, RoutingSource.WORKSPACE_DEFAULT);
        addCandidate(candidates, seen, McodaConfig.GLOBAL_WORKSPACE_ID, command, RoutingSource.GLOBAL_DEFAULT);
        addCandidate(candidates, seen, workspaceId, CommandCatalog.DEFAULT_COMMAND, RoutingSource.WORKSPACE_DEFAULT);
        addCandidate(candidates, seen, McodaConfig.GLOBAL_WORKSPACE_ID, CommandCatalog.DEFAULT_COMMAND, RoutingSource.GLOBAL_DEFAULT);
        return new RoutingPreview(workspaceId, command, candidates);
    }

    @Override
    public List<RoutingDefault> getWorkspaceDefaults(String workspaceId) {
        return agents.listRoutingDefaults(workspaceId);
    }

    @Override
    public List<RoutingDefault> updateWorkspaceDefaults(String workspaceId, RoutingDefaultsUpdate update) {
        Map<String, String> byAgentId = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : update.set().entrySet()) {
            Agent agent = agents.findAgent(entry.getValue())
                    .orElseThrow(() -> new RoutingException(
                            "Unknown agent " + entry.getValue() + " for command " + entry.getKey()));
            byAgentId.put(entry.getKey(), agent.id());
        }
        agents.applyRoutingDefaults(workspaceId, byAgentId, update.reset(), update.qaProfile(), update.docdexScope());
        return agents.listRoutingDefaults(workspaceId);
    }

    @Override
    public Optional<Agent> getAgent(String idOrSlug) {
        return agents.findAgent(idOrSlug);
    }

    private void addCandidate(
            List<RoutingCandidate> candidates,
            Set<String> seen,
            String workspaceId,
            String command,
            RoutingSource source
    ) {
        if (workspaceId == null || !seen.add(workspaceId + "\u0000" + command)) {
            return;
        }
        agents.findRoutingDefault(workspaceId, command).ifPresent(row -> candidates.add(new RoutingCandidate(
                source,
                workspaceId,
                command,
                row.agentId(),
                agents.findAgent(row.agentId()).orElse(null),
                row.qaProfile(),
                row.docdexScope()
        )));
    }
}
