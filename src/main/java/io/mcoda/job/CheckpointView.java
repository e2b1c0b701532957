package io.mcoda.job;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.time.Instant;

/**
 * What a resuming command needs from the latest committed checkpoint. {@code manifest} is null
 * for jobs that predate manifests; {@code legacy} marks the single-file format.
 */
public record CheckpointView(
        String jobId,
        String commandName,
        String jobType,
        String stage,
        JsonNode payload,
        JobState status,
        String reason,
        long checkpointSeq,
        String checkpointId,
        Instant createdAt,
        Path checkpointPath,
        Long commandRunId,
        JobManifest manifest,
        boolean legacy
) {
}
