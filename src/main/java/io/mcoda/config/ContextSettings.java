package io.mcoda.config;

import java.util.List;
import java.util.Map;

/**
 * Tunables for context lanes. Negative {@code maxMessages} or {@code maxBytesPerLane} disable that
 * limit; zero keeps nothing. Only {@code redactPatterns} are redacted unless {@code redactHeuristics}
 * also enables the built-in secret detection.
 */
public record ContextSettings(
        boolean enabled,
        String storageDir,
        boolean persistToolMessages,
        int maxMessages,
        long maxBytesPerLane,
        Map<String, Integer> modelTokenLimits,
        int defaultModelTokenLimit,
        int charsPerToken,
        boolean summarizeEnabled,
        List<String> redactPatterns,
        boolean redactHeuristics
) {
    public static final int DEFAULT_CHARS_PER_TOKEN = 4;
    public static final int DEFAULT_MODEL_TOKEN_LIMIT = 8192;

    public ContextSettings {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be greater than zero, got " + charsPerToken);
        }
        if (defaultModelTokenLimit <= 0) {
            throw new IllegalArgumentException("defaultModelTokenLimit must be greater than zero");
        }
        modelTokenLimits = modelTokenLimits == null ? Map.of() : Map.copyOf(modelTokenLimits);
        redactPatterns = redactPatterns == null ? List.of() : List.copyOf(redactPatterns);
        storageDir = storageDir == null || storageDir.isBlank() ? "context" : storageDir.trim();
    }

    public static ContextSettings defaults() {
        return new ContextSettings(
                true,
                "context",
                false,
                200,
                200_000L,
                Map.of(
                        "llama3", 8192,
                        "deepseek-coder", 128_000,
                        "mistral-nemo", 32_000
                ),
                DEFAULT_MODEL_TOKEN_LIMIT,
                DEFAULT_CHARS_PER_TOKEN,
                true,
                List.of(),
                false
        );
    }

    public ContextSettings withLimits(int maxMessages, long maxBytesPerLane) {
        return new ContextSettings(enabled, storageDir, persistToolMessages, maxMessages, maxBytesPerLane,
                modelTokenLimits, defaultModelTokenLimit, charsPerToken, summarizeEnabled, redactPatterns, redactHeuristics);
    }

    public ContextSettings withTokenLimits(Map<String, Integer> modelTokenLimits, int defaultModelTokenLimit) {
        return new ContextSettings(enabled, storageDir, persistToolMessages, maxMessages, maxBytesPerLane,
                modelTokenLimits, defaultModelTokenLimit, charsPerToken, summarizeEnabled, redactPatterns, redactHeuristics);
    }

    public ContextSettings withRedactPatterns(List<String> redactPatterns) {
        return new ContextSettings(enabled, storageDir, persistToolMessages, maxMessages, maxBytesPerLane,
                modelTokenLimits, defaultModelTokenLimit, charsPerToken, summarizeEnabled, redactPatterns, redactHeuristics);
    }

    public ContextSettings withRedactHeuristics(boolean redactHeuristics) {
        return new ContextSettings(enabled, storageDir, persistToolMessages, maxMessages, maxBytesPerLane,
                modelTokenLimits, defaultModelTokenLimit, charsPerToken, summarizeEnabled, redactPatterns, redactHeuristics);
    }

    /**
     * Resolves the token budget for {@code model}: exact override, then the override for the name
     * before the first ':', then the default.
     */
    public int tokenLimitFor(String model) {
        if (model == null || model.isBlank()) {
            return defaultModelTokenLimit;
        }
        Integer direct = modelTokenLimits.get(model);
        if (direct != null && direct > 0) {
            return direct;
        }
        String base = model.split(":", 2)[0];
        Integer baseMatch = modelTokenLimits.get(base);
        if (baseMatch != null && baseMatch > 0) {
            return baseMatch;
        }
        return defaultModelTokenLimit;
    }
}
