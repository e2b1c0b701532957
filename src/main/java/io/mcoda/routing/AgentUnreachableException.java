package io.mcoda.routing;

import java.util.List;

public class AgentUnreachableException extends RoutingException {
    private final String commandName;
    private final List<String> agents;

    public AgentUnreachableException(String commandName, List<String> agents) {
        super("All capable agents for " + commandName + " are unreachable: " + String.join(", ", agents));
        this.commandName = commandName;
        this.agents = List.copyOf(agents);
    }

    public String commandName() {
        return commandName;
    }

    public List<String> agents() {
        return agents;
    }
}
