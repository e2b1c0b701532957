package io.mcoda.context;

import java.util.List;

public interface Summarizer {
    /**
     * Condenses {@code messages} into a single system message. Implementations throw
     * {@link SummarizerFailureException} instead of returning empty content.
     */
    LaneMessage summarize(List<LaneMessage> messages, String model);
}
