package io.mcoda.job;

import java.time.Instant;

public record TokenUsageRecord(
        String command,
        String agent,
        String model,
        String action,
        String workspaceId,
        String taskId,
        String jobId,
        Long commandRunId,
        long promptTokens,
        long completionTokens,
        Double costEstimate,
        Instant recordedAt
) {
    public TokenUsageRecord withSession(JobSession session, String workspaceId) {
        return new TokenUsageRecord(
                command == null ? session.command() : command,
                agent,
                model,
                action,
                this.workspaceId == null ? workspaceId : this.workspaceId,
                taskId,
                jobId == null ? session.jobId() : jobId,
                commandRunId == null ? session.commandRunId() : commandRunId,
                Math.max(0L, promptTokens),
                Math.max(0L, completionTokens),
                costEstimate,
                recordedAt == null ? Instant.now() : recordedAt
        );
    }
}
