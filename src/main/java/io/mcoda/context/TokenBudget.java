package io.mcoda.context;

import java.util.List;

/**
 * Character-count token estimate: {@code ceil(length / charsPerToken)}.
 */
public final class TokenBudget {
    private final int charsPerToken;

    public TokenBudget(int charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be greater than zero, got " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }

    public int estimate(List<LaneMessage> messages) {
        int total = 0;
        for (LaneMessage message : messages) {
            total += estimate(message.content());
        }
        return total;
    }

    public int estimate(String systemPrompt, String bundle, List<LaneMessage> history) {
        return estimate(systemPrompt) + estimate(bundle) + estimate(history);
    }
}
