package io.mcoda.job;

import java.time.Instant;

/**
 * One CLI invocation. {@code id} is assigned by the store on insert and is {@code 0} before that.
 */
public record CommandRunRecord(
        long id,
        String command,
        String jobId,
        String workspaceId,
        JobState status,
        String agent,
        Instant startedAt,
        Instant completedAt,
        String summary,
        String outputPath,
        String errorCode,
        String errorMessage,
        Instant updatedAt
) {
    public static CommandRunRecord opened(String command, String jobId, String workspaceId, Instant now) {
        return new CommandRunRecord(0L, command, jobId, workspaceId, JobState.RUNNING, null, now, null,
                null, null, null, null, now);
    }
}
