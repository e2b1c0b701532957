package io.mcoda.job;

import java.time.Instant;

/**
 * Fields to overwrite on a command run; null fields keep the stored value.
 */
public record CommandRunUpdate(
        JobState status,
        Instant completedAt,
        String summary,
        String outputPath,
        String errorCode,
        String errorMessage
) {
}
