package io.mcoda.job;

import java.time.Instant;

public record TaskRunLog(
        long commandRunId,
        String taskId,
        String phase,
        String status,
        String detailsJson,
        Instant createdAt
) {
}
