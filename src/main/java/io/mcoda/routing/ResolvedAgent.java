package io.mcoda.routing;

import java.util.List;

public record ResolvedAgent(
        Agent agent,
        String commandName,
        List<String> capabilities,
        HealthStatus healthStatus,
        RoutingSource source,
        List<String> requiredCapabilities,
        String qaProfile,
        String docdexScope
) {
    public String agentSlug() {
        return agent.slug();
    }

    public String model() {
        return agent.defaultModel();
    }
}
