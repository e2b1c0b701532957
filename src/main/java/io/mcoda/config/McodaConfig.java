package io.mcoda.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class McodaConfig {
    public static final String STATE_DIR = ".mcoda";
    public static final String GLOBAL_WORKSPACE_ID = "__GLOBAL__";
    public static final String SETTINGS_FILE = "mcoda-settings.json";

    private final Path workspaceRoot;
    private final String workspaceId;

    public McodaConfig(Path workspaceRoot, String workspaceId) {
        this.workspaceRoot = workspaceRoot;
        this.workspaceId = workspaceId;
    }

    public static McodaConfig fromRoot(String root) {
        return fromRoot(root, null);
    }

    public static McodaConfig fromRoot(String root, String workspaceId) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String id = workspaceId == null || workspaceId.isBlank() ? base.toString() : workspaceId.trim();
        if (GLOBAL_WORKSPACE_ID.equals(id)) {
            throw new IllegalArgumentException("workspace id " + GLOBAL_WORKSPACE_ID + " is reserved for global routing defaults");
        }
        return new McodaConfig(base, id);
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    public String workspaceId() {
        return workspaceId;
    }

    public Path stateDir() {
        return workspaceRoot.resolve(STATE_DIR);
    }

    public Path dbFile() {
        return stateDir().resolve("mcoda.db");
    }

    public Path settingsFile() {
        return stateDir().resolve(SETTINGS_FILE);
    }

    public Path jobsDir() {
        return stateDir().resolve("jobs");
    }

    public Path jobDir(String jobId) {
        return jobsDir().resolve(jobId);
    }

    public Path manifestFile(String jobId) {
        return jobDir(jobId).resolve("manifest.json");
    }

    public Path checkpointsDir(String jobId) {
        return jobDir(jobId).resolve("checkpoints");
    }

    public Path legacyCheckpointFile(String jobId) {
        return jobDir(jobId).resolve("checkpoint.json");
    }

    public Path jobLogsDir(String jobId) {
        return jobDir(jobId).resolve("logs");
    }

    public Path contextDir(String storageDir) {
        return stateDir().resolve(storageDir == null || storageDir.isBlank() ? "context" : storageDir);
    }
}
