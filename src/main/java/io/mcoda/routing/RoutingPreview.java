package io.mcoda.routing;

import java.util.List;

/**
 * Candidate bindings for a command in precedence order: workspace command, global command,
 * workspace {@code default}, global {@code default}. Absent tiers are omitted.
 */
public record RoutingPreview(String workspaceId, String commandName, List<RoutingCandidate> candidates) {
    public RoutingPreview {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }
}
