package io.mcoda.job;

import java.time.Instant;

public record TaskRunRecord(
        String taskId,
        String command,
        String status,
        Double storyPoints,
        Double durationSeconds,
        String workspaceId,
        String jobId,
        String notes,
        Instant createdAt
) {
    public TaskRunRecord withJob(String jobId, String workspaceId) {
        return new TaskRunRecord(taskId, command, status, storyPoints, durationSeconds,
                this.workspaceId == null ? workspaceId : this.workspaceId,
                this.jobId == null ? jobId : this.jobId,
                notes, createdAt == null ? Instant.now() : createdAt);
    }
}
