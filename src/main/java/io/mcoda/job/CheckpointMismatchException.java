package io.mcoda.job;

/**
 * The job id requested for resume disagrees with the manifest or checkpoint found on disk.
 */
public class CheckpointMismatchException extends RuntimeException {
    private final String expectedJobId;
    private final String foundJobId;

    public CheckpointMismatchException(String expectedJobId, String foundJobId, String source) {
        super("Checkpoint mismatch: expected job " + expectedJobId + ", found " + source + " for " + foundJobId);
        this.expectedJobId = expectedJobId;
        this.foundJobId = foundJobId;
    }

    public String expectedJobId() {
        return expectedJobId;
    }

    public String foundJobId() {
        return foundJobId;
    }
}
