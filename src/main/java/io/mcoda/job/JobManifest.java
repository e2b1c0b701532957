package io.mcoda.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Static per-job metadata, written once when the job first starts.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobManifest(
        int schemaVersion,
        String jobId,
        String workspaceRoot,
        String workspaceId,
        String commandName,
        String jobType,
        Instant createdAt,
        boolean resumeSupported,
        JsonNode payload
) {
    public static final int SCHEMA_VERSION = 1;
}
