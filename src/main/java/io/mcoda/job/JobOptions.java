package io.mcoda.job;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Optional arguments of the {@link JobEngine} operations.
 */
public final class JobOptions {
    private JobOptions() {
    }

    public record Start(
            String jobType,
            Boolean resumeSupported,
            String projectKey,
            String agentId,
            Integer totalUnits,
            Integer completedUnits
    ) {
        public static Start defaults() {
            return new Start(null, null, null, null, null, null);
        }

        public Start withTotalUnits(int total) {
            return new Start(jobType, resumeSupported, projectKey, agentId, total, completedUnits);
        }

        public Start withResumeSupported(boolean supported) {
            return new Start(jobType, supported, projectKey, agentId, totalUnits, completedUnits);
        }
    }

    public record Checkpoint(
            String status,
            String reason,
            Integer totalUnits,
            Integer completedUnits,
            List<String> tags,
            String cursor,
            List<String> parents
    ) {
        public static Checkpoint defaults() {
            return new Checkpoint(null, null, null, null, null, null, null);
        }

        public static Checkpoint status(String status) {
            return new Checkpoint(status, null, null, null, null, null, null);
        }

        public Checkpoint withProgress(Integer completed, Integer total) {
            return new Checkpoint(status, reason, total, completed, tags, cursor, parents);
        }

        public Checkpoint withReason(String reason) {
            return new Checkpoint(status, reason, totalUnits, completedUnits, tags, cursor, parents);
        }
    }

    public record Finalize(
            JsonNode result,
            String errorCode,
            String errorMessage
    ) {
        public static Finalize defaults() {
            return new Finalize(null, null, null);
        }

        public static Finalize result(JsonNode result) {
            return new Finalize(result, null, null);
        }

        public static Finalize error(String errorCode, String errorMessage) {
            return new Finalize(null, errorCode, errorMessage);
        }
    }

    public record Progress(Integer totalUnits, Integer completedUnits, String stateDetail) {
    }
}
