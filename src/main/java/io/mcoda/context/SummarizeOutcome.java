package io.mcoda.context;

/**
 * Result of one {@code summarizeIfNeeded} call. {@code overBudget} reports that the lane still
 * exceeds {@code modelLimit} afterwards; {@code capReached} that the pass limit is what stopped
 * the loop.
 */
public record SummarizeOutcome(
        String laneId,
        int passes,
        int messagesBefore,
        int messagesAfter,
        int tokensBefore,
        int tokensAfter,
        int modelLimit,
        boolean overBudget,
        boolean capReached
) {
    public static SummarizeOutcome unchanged(String laneId, int messages, int tokens, int modelLimit) {
        return new SummarizeOutcome(laneId, 0, messages, messages, tokens, tokens, modelLimit,
                tokens > modelLimit, false);
    }

    public boolean summarized() {
        return passes > 0;
    }
}
