package io.mcoda.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HealthStatus {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNREACHABLE("unreachable"),
    UNKNOWN("unknown");

    private final String wireValue;

    HealthStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static HealthStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        for (HealthStatus status : values()) {
            if (status.wireValue.equals(value)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
