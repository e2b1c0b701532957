package io.mcoda.job;

import java.time.Instant;

/**
 * Summary row of one job as kept by the {@link JobStore}. Any field may be null in a partial
 * update; {@link #mergeOnto(JobRecord)} fills the gaps from the stored row.
 */
public record JobRecord(
        String id,
        String type,
        String commandName,
        String workspaceId,
        JobState state,
        String stateDetail,
        Integer totalUnits,
        Integer completedUnits,
        String payloadJson,
        String resultJson,
        String errorCode,
        String errorMessage,
        Boolean resumeSupported,
        String checkpointPath,
        String agentId,
        String projectKey,
        Instant createdAt,
        Instant startedAt,
        Instant lastCheckpointAt,
        Instant completedAt,
        Instant updatedAt
) {
    public static JobRecord partial(String id) {
        return new JobRecord(id, null, null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null);
    }

    public JobRecord mergeOnto(JobRecord existing) {
        if (existing == null) {
            return this;
        }
        return new JobRecord(
                id,
                pick(type, existing.type),
                pick(commandName, existing.commandName),
                pick(workspaceId, existing.workspaceId),
                pick(state, existing.state),
                pick(stateDetail, existing.stateDetail),
                pick(totalUnits, existing.totalUnits),
                pick(completedUnits, existing.completedUnits),
                pick(payloadJson, existing.payloadJson),
                pick(resultJson, existing.resultJson),
                pick(errorCode, existing.errorCode),
                pick(errorMessage, existing.errorMessage),
                pick(resumeSupported, existing.resumeSupported),
                pick(checkpointPath, existing.checkpointPath),
                pick(agentId, existing.agentId),
                pick(projectKey, existing.projectKey),
                pick(existing.createdAt, createdAt),
                pick(existing.startedAt, startedAt),
                pick(lastCheckpointAt, existing.lastCheckpointAt),
                pick(completedAt, existing.completedAt),
                pick(updatedAt, existing.updatedAt)
        );
    }

    public JobRecord withState(JobState nextState) {
        return new JobRecord(id, type, commandName, workspaceId, nextState, stateDetail, totalUnits, completedUnits,
                payloadJson, resultJson, errorCode, errorMessage, resumeSupported, checkpointPath, agentId,
                projectKey, createdAt, startedAt, lastCheckpointAt, completedAt, updatedAt);
    }

    public JobRecord withStateDetail(String detail) {
        return new JobRecord(id, type, commandName, workspaceId, state, detail, totalUnits, completedUnits,
                payloadJson, resultJson, errorCode, errorMessage, resumeSupported, checkpointPath, agentId,
                projectKey, createdAt, startedAt, lastCheckpointAt, completedAt, updatedAt);
    }

    public JobRecord withProgress(Integer total, Integer completed) {
        return new JobRecord(id, type, commandName, workspaceId, state, stateDetail, total, completed,
                payloadJson, resultJson, errorCode, errorMessage, resumeSupported, checkpointPath, agentId,
                projectKey, createdAt, startedAt, lastCheckpointAt, completedAt, updatedAt);
    }

    public JobRecord withCheckpointAt(Instant at) {
        return new JobRecord(id, type, commandName, workspaceId, state, stateDetail, totalUnits, completedUnits,
                payloadJson, resultJson, errorCode, errorMessage, resumeSupported, checkpointPath, agentId,
                projectKey, createdAt, startedAt, at, completedAt, at);
    }

    public JobRecord withOutcome(Instant completedAt, String resultJson, String errorCode, String errorMessage) {
        return new JobRecord(id, type, commandName, workspaceId, state, stateDetail, totalUnits, completedUnits,
                payloadJson, resultJson, errorCode, errorMessage, resumeSupported, checkpointPath, agentId,
                projectKey, createdAt, startedAt, lastCheckpointAt, completedAt, completedAt);
    }

    public JobRecord withoutOutcome() {
        return new JobRecord(id, type, commandName, workspaceId, state, stateDetail, totalUnits, completedUnits,
                payloadJson, null, null, null, resumeSupported, checkpointPath, agentId,
                projectKey, createdAt, startedAt, lastCheckpointAt, null, updatedAt);
    }

    public JobRecord withUpdatedAt(Instant at) {
        return new JobRecord(id, type, commandName, workspaceId, state, stateDetail, totalUnits, completedUnits,
                payloadJson, resultJson, errorCode, errorMessage, resumeSupported, checkpointPath, agentId,
                projectKey, createdAt, startedAt, lastCheckpointAt, completedAt, at);
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
