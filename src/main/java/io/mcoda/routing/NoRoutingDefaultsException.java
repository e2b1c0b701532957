package io.mcoda.routing;

public class NoRoutingDefaultsException extends RoutingException {
    public NoRoutingDefaultsException(String workspaceId, String commandName) {
        super("No routing defaults found for " + commandName + " in workspace " + workspaceId
                + "; set one with `routing defaults --set " + commandName + "=<agent>`");
    }
}
