package io.mcoda.routing;

import java.util.ArrayList;
import java.util.List;

/**
 * An external coding agent as seen by routing. Capabilities are plain names such as
 * {@code code_write} or {@code qa_interpretation}.
 */
public record Agent(
        String id,
        String slug,
        String adapter,
        String defaultModel,
        List<String> capabilities,
        AgentHealth health,
        Double rating,
        Double costPerMillion
) {
    public Agent {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public HealthStatus healthStatus() {
        return health == null ? HealthStatus.UNKNOWN : health.status();
    }

    /**
     * Required capabilities this agent does not declare, in the order they were required.
     */
    public List<String> missingCapabilities(List<String> required) {
        List<String> missing = new ArrayList<>();
        for (String capability : required) {
            if (!capabilities.contains(capability)) {
                missing.add(capability);
            }
        }
        return missing;
    }

    public String label() {
        return slug == null || slug.isBlank() ? id : slug;
    }
}
