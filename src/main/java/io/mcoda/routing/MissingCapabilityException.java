package io.mcoda.routing;

import java.util.List;

public class MissingCapabilityException extends RoutingException {
    private final String commandName;
    private final List<String> missingCapabilities;

    public MissingCapabilityException(String commandName, List<String> missingCapabilities) {
        super("No agent with required capabilities for " + commandName + ": missing "
                + String.join(", ", missingCapabilities));
        this.commandName = commandName;
        this.missingCapabilities = List.copyOf(missingCapabilities);
    }

    public MissingCapabilityException(String agentSlug, String commandName, List<String> missingCapabilities) {
        super("Agent " + agentSlug + " missing required capabilities for " + commandName + ": "
                + String.join(", ", missingCapabilities));
        this.commandName = commandName;
        this.missingCapabilities = List.copyOf(missingCapabilities);
    }

    public String commandName() {
        return commandName;
    }

    public List<String> missingCapabilities() {
        return missingCapabilities;
    }
}
