package io.mcoda.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which precedence tier produced a routing decision.
 */
public enum RoutingSource {
    OVERRIDE("override"),
    WORKSPACE_DEFAULT("workspace_default"),
    GLOBAL_DEFAULT("global_default");

    private final String wireValue;

    RoutingSource(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static RoutingSource parse(String raw) {
        for (RoutingSource source : values()) {
            if (source.wireValue.equalsIgnoreCase(raw == null ? "" : raw.trim())) {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown routing source: " + raw);
    }
}
