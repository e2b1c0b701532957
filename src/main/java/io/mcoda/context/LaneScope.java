package io.mcoda.context;

/**
 * Identifies a lane. The id is {@code <jobId|runId|"run">:<taskId|taskKey|"ad-hoc">:<role>}.
 * Ephemeral lanes live in memory only.
 */
public record LaneScope(
        String jobId,
        String runId,
        String taskId,
        String taskKey,
        LaneRole role,
        boolean ephemeral
) {
    public LaneScope {
        role = role == null ? LaneRole.CUSTOM : role;
    }

    public static LaneScope forTask(String jobId, String taskId, LaneRole role) {
        return new LaneScope(jobId, null, taskId, null, role, false);
    }

    public LaneScope asEphemeral() {
        return new LaneScope(jobId, runId, taskId, taskKey, role, true);
    }

    public String laneId() {
        String jobPart = firstPresent(jobId, runId, "run");
        String taskPart = firstPresent(taskId, taskKey, "ad-hoc");
        return jobPart + ":" + taskPart + ":" + role.wireValue();
    }

    private static String firstPresent(String first, String second, String fallback) {
        if (first != null && !first.isBlank()) {
            return first;
        }
        if (second != null && !second.isBlank()) {
            return second;
        }
        return fallback;
    }
}
