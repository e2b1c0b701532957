package io.mcoda.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A batch change to routing defaults. {@code set} maps command name to agent slug or id;
 * {@code reset} lists command names whose binding is removed. The optional qa profile and docdex
 * scope tag every binding written by this update.
 */
public record RoutingDefaultsUpdate(
        Map<String, String> set,
        List<String> reset,
        String qaProfile,
        String docdexScope
) {
    public RoutingDefaultsUpdate {
        set = set == null ? Map.of() : new LinkedHashMap<>(set);
        reset = reset == null ? List.of() : List.copyOf(reset);
    }

    public static RoutingDefaultsUpdate bind(String commandName, String agent) {
        return new RoutingDefaultsUpdate(Map.of(commandName, agent), List.of(), null, null);
    }

    public static RoutingDefaultsUpdate resetCommands(List<String> commands) {
        return new RoutingDefaultsUpdate(Map.of(), commands, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return set.isEmpty() && reset.isEmpty() && qaProfile == null && docdexScope == null;
    }
}
