package io.mcoda.job;

import java.nio.file.Path;

/**
 * Handle for the job driven by one CLI invocation. Created by {@link JobEngine#startJob} and passed
 * to every later engine call; never share one across concurrent invocations.
 */
public record JobSession(
        String jobId,
        String command,
        String jobType,
        long commandRunId,
        Path checkpointPath,
        Path manifestPath
) {
}
