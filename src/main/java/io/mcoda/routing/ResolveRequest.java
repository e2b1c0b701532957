package io.mcoda.routing;

public record ResolveRequest(
        String workspaceId,
        String commandName,
        String taskType,
        String overrideAgentSlug,
        String projectKey
) {
    public static ResolveRequest of(String workspaceId, String commandName) {
        return new ResolveRequest(workspaceId, commandName, null, null, null);
    }

    public ResolveRequest withTaskType(String type) {
        return new ResolveRequest(workspaceId, commandName, type, overrideAgentSlug, projectKey);
    }

    public ResolveRequest withOverride(String agentSlug) {
        return new ResolveRequest(workspaceId, commandName, taskType, agentSlug, projectKey);
    }
}
