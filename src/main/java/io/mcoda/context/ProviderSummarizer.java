package io.mcoda.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Summarizes lane history by asking a {@link TextGenerator} for a condensed transcript.
 */
public final class ProviderSummarizer implements Summarizer {
    private static final Logger log = LoggerFactory.getLogger(ProviderSummarizer.class);
    static final String SUMMARY_PREFIX = "Context summary: ";
    static final String SUMMARY_PROMPT = """
            You compress conversation history for a coding agent. Summarize the transcript below in a \
            few short paragraphs. Keep decisions, file paths, identifiers, open problems and pending \
            steps. Drop pleasantries and repeated content. Reply with the summary only.""";

    private final TextGenerator generator;

    public ProviderSummarizer(TextGenerator generator) {
        this.generator = generator;
    }

    @Override
    public LaneMessage summarize(List<LaneMessage> messages, String model) {
        List<LaneMessage> request = List.of(
                LaneMessage.system(SUMMARY_PROMPT),
                LaneMessage.user(formatHistory(messages))
        );
        String response;
        try {
            response = generator.generate(request, model);
        } catch (SummarizerFailureException e) {
            throw e;
        } catch (Exception e) {
            throw new SummarizerFailureException("Context summarizer call failed: " + e.getMessage(), e);
        }
        String content = response == null ? "" : response.trim();
        if (content.isEmpty()) {
            throw new SummarizerFailureException("Context summarizer response is empty");
        }
        log.debug("Summarized {} messages into {} chars", messages.size(), content.length());
        return LaneMessage.system(SUMMARY_PREFIX + content);
    }

    static String formatHistory(List<LaneMessage> messages) {
        StringBuilder sb = new StringBuilder();
        for (LaneMessage message : messages) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            String header = message.name() == null ? message.role() : message.role() + "(" + message.name() + ")";
            sb.append(header).append(": ").append(message.content());
        }
        return sb.toString();
    }
}
