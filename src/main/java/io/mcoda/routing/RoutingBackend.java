package io.mcoda.routing;

import java.util.List;
import java.util.Optional;

/**
 * Source of agents and routing defaults, either the local workspace database or a routing API.
 */
public interface RoutingBackend {
    RoutingPreview preview(PreviewRequest request);

    List<RoutingDefault> getWorkspaceDefaults(String workspaceId);

    /**
     * Applies an already validated update in one write. Command names are canonical.
     */
    List<RoutingDefault> updateWorkspaceDefaults(String workspaceId, RoutingDefaultsUpdate update);

    Optional<Agent> getAgent(String idOrSlug);
}
