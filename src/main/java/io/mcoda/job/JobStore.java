package io.mcoda.job;

import java.util.List;
import java.util.Optional;

/**
 * Durable rows behind the {@link JobEngine}: job summaries, command runs and per-task telemetry.
 */
public interface JobStore {
    Optional<JobRecord> getJob(String jobId);

    List<JobRecord> listJobs(int limit);

    /**
     * Inserts or fully replaces the row with {@code job.id()}.
     */
    void saveJob(JobRecord job);

    long recordCommandRun(CommandRunRecord run);

    Optional<CommandRunRecord> getCommandRun(long id);

    void updateCommandRun(long id, CommandRunUpdate update);

    void recordTaskRunLog(TaskRunLog log);

    long recordTaskRun(TaskRunRecord run);

    long recordTokenUsage(TokenUsageRecord usage);
}
