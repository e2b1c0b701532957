package io.mcoda.routing;

import java.util.List;

public record PreviewRequest(
        String workspaceId,
        String commandName,
        String agentOverride,
        String taskType,
        String projectKey,
        List<String> requiredCapabilities
) {
    public PreviewRequest {
        requiredCapabilities = requiredCapabilities == null ? List.of() : List.copyOf(requiredCapabilities);
    }
}
