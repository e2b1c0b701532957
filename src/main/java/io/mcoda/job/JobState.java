package io.mcoda.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum JobState {
    QUEUED("queued"),
    RUNNING("running"),
    CHECKPOINTING("checkpointing"),
    PAUSED("paused"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String wireValue;

    JobState(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Maps a caller- or disk-supplied status onto a state. "succeeded" is an alias of completed;
     * unknown or missing values become {@link #QUEUED}.
     */
    @JsonCreator
    public static JobState normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return QUEUED;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if ("succeeded".equals(value)) {
            return COMPLETED;
        }
        for (JobState state : values()) {
            if (state.wireValue.equals(value)) {
                return state;
            }
        }
        return QUEUED;
    }

    /**
     * Terminal states never change through checkpoints or progress updates. Staying in the same
     * state is always allowed.
     */
    public boolean canTransitionTo(JobState next) {
        if (next == this) {
            return true;
        }
        return switch (this) {
            case COMPLETED, CANCELLED, FAILED -> false;
            case QUEUED, RUNNING, CHECKPOINTING, PAUSED -> true;
        };
    }

    /** Whether {@code startJob} may take the job back to running; failed jobs are resumable. */
    public boolean canResume() {
        return this != COMPLETED && this != CANCELLED;
    }
}
