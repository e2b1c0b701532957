package io.mcoda.routing;

import java.time.Instant;

public record RoutingDefault(
        String workspaceId,
        String commandName,
        String agentId,
        String agentSlug,
        String qaProfile,
        String docdexScope,
        Instant updatedAt
) {
}
