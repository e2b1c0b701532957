package io.mcoda.routing;

import java.time.Instant;

/**
 * Last health probe result of an agent. {@code latencyMs} is null when the probe never connected.
 */
public record AgentHealth(HealthStatus status, Long latencyMs, Instant checkedAt, String reason) {
    public AgentHealth {
        status = status == null ? HealthStatus.UNKNOWN : status;
    }
}
