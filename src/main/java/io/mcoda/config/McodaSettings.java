package io.mcoda.config;

import io.mcoda.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Workspace tunables read from {@code .mcoda/mcoda-settings.json}. Missing file or missing fields
 * fall back to {@link #defaults()}; the routing API URL may also come from the environment.
 */
public record McodaSettings(
        ContextSettings context,
        String routingApiUrl,
        long routingTimeoutMs,
        String runtimeVersion
) {
    public static final long DEFAULT_ROUTING_TIMEOUT_MS = 10_000L;
    public static final String ENV_ROUTING_API_URL = "MCODA_ROUTING_API_URL";
    public static final String ENV_API_BASE_URL = "MCODA_API_BASE_URL";

    public static McodaSettings defaults() {
        return new McodaSettings(ContextSettings.defaults(), null, DEFAULT_ROUTING_TIMEOUT_MS, "dev");
    }

    public boolean remoteRouting() {
        return routingApiUrl != null && !routingApiUrl.isBlank();
    }

    public static McodaSettings load(McodaConfig config) {
        return load(config.settingsFile(), System.getenv());
    }

    static McodaSettings load(Path file, Map<String, String> env) {
        McodaSettings defaults = defaults();
        SettingsFile parsed = null;
        if (Files.exists(file)) {
            try {
                parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to parse settings file: " + file, e);
            }
        }
        McodaSettings resolved = fromFile(parsed, defaults);
        String envUrl = firstNonBlank(env.get(ENV_ROUTING_API_URL), env.get(ENV_API_BASE_URL));
        if (envUrl != null) {
            resolved = new McodaSettings(resolved.context(), envUrl, resolved.routingTimeoutMs(), resolved.runtimeVersion());
        }
        return resolved;
    }

    static McodaSettings fromFile(SettingsFile file, McodaSettings defaults) {
        if (file == null) {
            return defaults;
        }
        ContextSettings base = defaults.context();
        ContextFile ctx = file.context();
        ContextSettings context = ctx == null ? base : new ContextSettings(
                ctx.enabled() == null ? base.enabled() : ctx.enabled(),
                ctx.storageDir() == null ? base.storageDir() : ctx.storageDir(),
                ctx.persistToolMessages() == null ? base.persistToolMessages() : ctx.persistToolMessages(),
                ctx.maxMessages() == null ? base.maxMessages() : ctx.maxMessages(),
                ctx.maxBytesPerLane() == null ? base.maxBytesPerLane() : ctx.maxBytesPerLane(),
                ctx.modelTokenLimits() == null ? base.modelTokenLimits() : ctx.modelTokenLimits(),
                ctx.defaultModelTokenLimit() == null ? base.defaultModelTokenLimit() : ctx.defaultModelTokenLimit(),
                ctx.charsPerToken() == null ? base.charsPerToken() : ctx.charsPerToken(),
                ctx.summarizeEnabled() == null ? base.summarizeEnabled() : ctx.summarizeEnabled(),
                ctx.redactPatterns() == null ? base.redactPatterns() : ctx.redactPatterns(),
                ctx.redactHeuristics() == null ? base.redactHeuristics() : ctx.redactHeuristics()
        );
        return new McodaSettings(
                context,
                file.routingApiUrl() == null ? defaults.routingApiUrl() : file.routingApiUrl(),
                file.routingTimeoutMs() == null ? defaults.routingTimeoutMs() : Math.max(1_000L, file.routingTimeoutMs()),
                file.runtimeVersion() == null ? defaults.runtimeVersion() : file.runtimeVersion()
        );
    }

    private static String firstNonBlank(String a, String b) {
        if (a != null && !a.isBlank()) {
            return a.trim();
        }
        if (b != null && !b.isBlank()) {
            return b.trim();
        }
        return null;
    }

    record SettingsFile(
            ContextFile context,
            String routingApiUrl,
            Long routingTimeoutMs,
            String runtimeVersion
    ) {
    }

    record ContextFile(
            Boolean enabled,
            String storageDir,
            Boolean persistToolMessages,
            Integer maxMessages,
            Long maxBytesPerLane,
            Map<String, Integer> modelTokenLimits,
            Integer defaultModelTokenLimit,
            Integer charsPerToken,
            Boolean summarizeEnabled,
            List<String> redactPatterns,
            Boolean redactHeuristics
    ) {
    }
}
