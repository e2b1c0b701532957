package io.mcoda.routing;

/**
 * One binding from the fallback chain. {@code agent} is null when the bound agent no longer
 * exists in the registry.
 */
public record RoutingCandidate(
        RoutingSource source,
        String workspaceId,
        String commandName,
        String agentRef,
        Agent agent,
        String qaProfile,
        String docdexScope
) {
}
