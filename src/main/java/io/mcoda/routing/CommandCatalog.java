package io.mcoda.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Canonical command names, their aliases and the capabilities each command requires.
 */
public final class CommandCatalog {
    public static final String DEFAULT_COMMAND = "default";
    public static final String QA_CAPABILITY = "qa_interpretation";

    public static final Set<String> QA_PROFILES = orderedSet(
            "unit", "integration", "acceptance", "smoke", "e2e", "api", "ui", "mobile", "cli");
    public static final Set<String> DOCDEX_SCOPES = orderedSet(
            "sds", "pdr", "rfp", "openapi", "docs", "code", "all");

    private static final Map<String, List<String>> ALIASES = new LinkedHashMap<>();
    private static final Map<String, List<String>> REQUIRED = new LinkedHashMap<>();

    static {
        ALIASES.put("create-tasks", List.of("create_tasks", "create tasks"));
        ALIASES.put("refine-tasks", List.of("refine_tasks", "refine tasks"));
        ALIASES.put("work-on-tasks", List.of("work_on_tasks", "work on tasks"));
        ALIASES.put("code-review", List.of("code_review", "code review"));
        ALIASES.put("qa-tasks", List.of("qa_tasks", "qa tasks"));
        ALIASES.put("order-tasks", List.of("tasks:order", "order_tasks", "tasks order"));
        ALIASES.put("pdr", List.of("docs:pdr:generate", "docs-pdr-generate", "pdr-generate", "docs-pdr"));
        ALIASES.put("sds", List.of("docs:sds:generate", "docs-sds-generate", "sds-generate", "docs-sds"));
        ALIASES.put("openapi-from-docs", List.of("openapi", "openapi_from_docs"));
        ALIASES.put(DEFAULT_COMMAND, List.of("__default__", "agent:set-default"));

        REQUIRED.put("create-tasks", List.of("plan"));
        REQUIRED.put("refine-tasks", List.of("plan"));
        REQUIRED.put("order-tasks", List.of("plan"));
        REQUIRED.put("work-on-tasks", List.of("code_write"));
        REQUIRED.put("code-review", List.of("code_review"));
        REQUIRED.put("qa-tasks", List.of(QA_CAPABILITY));
        REQUIRED.put("pdr", List.of("docdex_query"));
        REQUIRED.put("sds", List.of("docdex_query"));
        REQUIRED.put("openapi-from-docs", List.of("docdex_query"));
    }

    private CommandCatalog() {
    }

    /**
     * Trims and lower-cases {@code commandName} and maps known aliases onto their canonical name.
     * Unknown commands pass through normalized.
     */
    public static String normalize(String commandName) {
        if (commandName == null || commandName.isBlank()) {
            throw new IllegalArgumentException("commandName must not be blank");
        }
        String normalized = commandName.trim().toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : ALIASES.entrySet()) {
            if (entry.getKey().equals(normalized) || entry.getValue().contains(normalized)) {
                return entry.getKey();
            }
        }
        return normalized;
    }

    public static List<String> requiredCapabilities(String commandName, String taskType) {
        String canonical = normalize(commandName);
        Set<String> required = new LinkedHashSet<>(REQUIRED.getOrDefault(canonical, List.of()));
        if (taskType != null && taskType.toLowerCase(Locale.ROOT).contains("qa")) {
            required.add(QA_CAPABILITY);
        }
        return new ArrayList<>(required);
    }

    public static Map<String, List<String>> requirementTable() {
        return Map.copyOf(REQUIRED);
    }

    /**
     * Returns the normalized profile, null for a blank value, or throws for an unknown one.
     */
    public static String normalizeQaProfile(String raw) {
        return normalizeKnown("qa profile", raw, QA_PROFILES);
    }

    public static String normalizeDocdexScope(String raw) {
        return normalizeKnown("docdex scope", raw, DOCDEX_SCOPES);
    }

    private static String normalizeKnown(String kind, String raw, Set<String> allowed) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (!allowed.contains(value)) {
            throw new UnknownProfileException(kind, raw, allowed);
        }
        return value;
    }

    private static Set<String> orderedSet(String... values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(values)));
    }
}
