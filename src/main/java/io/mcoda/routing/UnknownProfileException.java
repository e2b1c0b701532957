package io.mcoda.routing;

import java.util.Set;

/**
 * A qa profile or docdex scope outside the known values was supplied for a routing default.
 */
public class UnknownProfileException extends RoutingException {
    private final String kind;
    private final String value;

    public UnknownProfileException(String kind, String value, Set<String> allowed) {
        super("Unknown " + kind + " '" + value + "', expected one of " + String.join(", ", allowed));
        this.kind = kind;
        this.value = value;
    }

    public String kind() {
        return kind;
    }

    public String value() {
        return value;
    }
}
