package io.mcoda.job;

import java.util.Map;

final class JobTypes {
    static final String OTHER = "other";

    private static final Map<String, String> JOB_TYPE_BY_COMMAND = Map.of(
            "create-tasks", "task_creation",
            "refine-tasks", "task_refinement",
            "work-on-tasks", "work",
            "code-review", "review",
            "qa-tasks", "qa",
            "openapi-change", "openapi_change"
    );

    private JobTypes() {
    }

    static String derive(String command, String explicit) {
        if (explicit != null && !explicit.isBlank()) {
            return explicit.trim();
        }
        if (command == null) {
            return OTHER;
        }
        return JOB_TYPE_BY_COMMAND.getOrDefault(command.trim(), OTHER);
    }
}
