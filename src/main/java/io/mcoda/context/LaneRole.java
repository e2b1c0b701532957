package io.mcoda.context;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LaneRole {
    LIBRARIAN,
    ARCHITECT,
    BUILDER,
    CRITIC,
    CUSTOM;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LaneRole parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return CUSTOM;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
