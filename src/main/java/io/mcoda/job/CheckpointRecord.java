package io.mcoda.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Immutable content of one {@code NNNNNN.ckpt.json} file.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CheckpointRecord(
        int schemaVersion,
        String jobId,
        String commandName,
        String jobType,
        long checkpointSeq,
        String checkpointId,
        Instant createdAt,
        String status,
        String reason,
        String stage,
        JsonNode payload,
        Engine engine,
        Progress progress,
        Indexes indexes
) {
    public static final int SCHEMA_VERSION = 1;

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Engine(String runtimeVersion, String platform) {
        public static Engine current(String runtimeVersion) {
            String version = runtimeVersion == null || runtimeVersion.isBlank() ? "dev" : runtimeVersion;
            return new Engine(version, System.getProperty("os.name", "unknown").toLowerCase(Locale.ROOT).replace(' ', '_')
                    + "-" + System.getProperty("os.arch", "unknown"));
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Progress(Integer step, Integer estimatedTotalSteps) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Indexes(List<String> tags, String cursor, List<String> parents) {
    }
}
