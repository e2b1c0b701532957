package io.mcoda.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mcoda.config.McodaConfig;
import io.mcoda.storage.Database;
import io.mcoda.storage.WorkspaceStore;
import io.mcoda.testing.TempDirs;
import io.mcoda.util.Jsons;
import io.mcoda.util.StorageIoException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

final class JobEngineTest {

    @Test
    void checkpointsAreSequencedAndLatestWinsOnLoad() throws Exception {
        Path root = TempDirs.create("job-seq");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("work-on-tasks", "job-1", payload("step", 0), JobOptions.Start.defaults());
            Assertions.assertEquals("work", session.jobType());

            f.engine.checkpoint(session, "plan", payload("step", 1), JobOptions.Checkpoint.defaults());
            f.engine.checkpoint(session, "apply", payload("step", 2), JobOptions.Checkpoint.defaults().withProgress(2, 5));

            List<CheckpointRecord> all = f.engine.listCheckpoints("job-1");
            Assertions.assertEquals(3, all.size());
            for (int i = 0; i < all.size(); i++) {
                Assertions.assertEquals(i + 1L, all.get(i).checkpointSeq());
            }
            Assertions.assertEquals("started", all.get(0).stage());
            Assertions.assertEquals(List.of("plan"), all.get(1).indexes().tags());
            Assertions.assertTrue(Files.exists(f.config.checkpointsDir("job-1").resolve("000003.ckpt.json")));

            CheckpointView view = f.engine.loadCheckpoint("job-1").orElseThrow();
            Assertions.assertEquals(3L, view.checkpointSeq());
            Assertions.assertEquals("apply", view.stage());
            Assertions.assertEquals(2, view.payload().path("step").asInt());
            Assertions.assertEquals(JobState.RUNNING, view.status());
            Assertions.assertFalse(view.legacy());

            JobRecord job = f.engine.getJob("job-1").orElseThrow();
            Assertions.assertEquals(JobState.RUNNING, job.state());
            Assertions.assertEquals("apply", job.stateDetail());
            Assertions.assertEquals(5, job.totalUnits());
            Assertions.assertEquals(2, job.completedUnits());
            Assertions.assertNotNull(job.lastCheckpointAt());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void completedCheckpointIsWhatLoadReturns() throws Exception {
        Path root = TempDirs.create("job-qa");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("qa", "job-42", Jsons.mapper().createObjectNode(), JobOptions.Start.defaults());
            f.engine.checkpoint(session, "selection", payload("n", 3), JobOptions.Checkpoint.defaults());
            f.engine.checkpoint(session, "done", payload("n", 3), JobOptions.Checkpoint.status("completed"));

            CheckpointView view = f.engine.loadCheckpoint("job-42").orElseThrow();
            Assertions.assertEquals("done", view.stage());
            Assertions.assertEquals(JobState.COMPLETED, view.status());
            Assertions.assertEquals(3L, view.checkpointSeq());
            Assertions.assertEquals(3, view.payload().path("n").asInt());
            Assertions.assertEquals(JobState.COMPLETED, f.engine.getJob("job-42").orElseThrow().state());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void resumeAppendsAfterHighestSequenceAndKeepsCreatedAt() throws Exception {
        Path root = TempDirs.create("job-resume");
        try {
            Fixture first = Fixture.open(root, Instant.parse("2025-01-01T00:00:00Z"));
            JobSession s1 = first.engine.startJob("create-tasks", "job-r", payload("n", 1), JobOptions.Start.defaults());
            first.engine.checkpoint(s1, "epics", payload("n", 2), JobOptions.Checkpoint.defaults());
            first.engine.checkpoint(s1, "stories", payload("n", 3), JobOptions.Checkpoint.status("paused"));

            Fixture second = Fixture.open(root, Instant.parse("2025-01-02T00:00:00Z"));
            CheckpointView resumed = second.engine.loadCheckpoint("job-r").orElseThrow();
            Assertions.assertEquals("stories", resumed.stage());
            Assertions.assertEquals(JobState.PAUSED, resumed.status());

            JobSession s2 = second.engine.startJob("create-tasks", "job-r", resumed.payload(), JobOptions.Start.defaults());
            Assertions.assertNotEquals(s1.commandRunId(), s2.commandRunId());
            second.engine.checkpoint(s2, "tasks", payload("n", 4), JobOptions.Checkpoint.defaults());

            List<CheckpointRecord> all = second.engine.listCheckpoints("job-r");
            Assertions.assertEquals(5, all.size());
            Assertions.assertEquals(List.of(1L, 2L, 3L, 4L, 5L),
                    all.stream().map(CheckpointRecord::checkpointSeq).toList());

            JobRecord job = second.engine.getJob("job-r").orElseThrow();
            Assertions.assertEquals(Instant.parse("2025-01-01T00:00:00Z"), job.createdAt());
            Assertions.assertEquals(Instant.parse("2025-01-01T00:00:00Z"), job.startedAt());
            Assertions.assertEquals(Instant.parse("2025-01-02T00:00:00Z"), job.updatedAt());
            Assertions.assertEquals(2, second.store.listCommandRuns("job-r").size());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void sequenceOrderIsNumericNotLexical() throws Exception {
        Path root = TempDirs.create("job-numeric");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("qa-tasks", "job-n", payload("i", 0), JobOptions.Start.defaults());
            Path dir = f.config.checkpointsDir("job-n");
            String template = Files.readString(dir.resolve("000001.ckpt.json"), StandardCharsets.UTF_8);
            ObjectNode big = (ObjectNode) Jsons.mapper().readTree(template);
            big.put("checkpoint_seq", 1_000_000L);
            big.put("stage", "late");
            Files.writeString(dir.resolve("1000000.ckpt.json"), Jsons.toJson(big), StandardCharsets.UTF_8);

            Assertions.assertEquals("late", f.engine.loadCheckpoint("job-n").orElseThrow().stage());
            CheckpointRecord next = f.engine.checkpoint(session, "after", payload("i", 1), JobOptions.Checkpoint.defaults());
            Assertions.assertEquals(1_000_001L, next.checkpointSeq());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void manifestForAnotherJobIsRejected() throws Exception {
        Path root = TempDirs.create("job-mismatch");
        try {
            Fixture f = Fixture.open(root);
            f.engine.startJob("work-on-tasks", "job-a", payload("x", 1), JobOptions.Start.defaults());
            Path manifest = f.config.manifestFile("job-a");
            ObjectNode node = (ObjectNode) Jsons.mapper().readTree(manifest.toFile());
            node.put("job_id", "job-b");
            Files.writeString(manifest, Jsons.toJson(node), StandardCharsets.UTF_8);

            CheckpointMismatchException load = Assertions.assertThrows(
                    CheckpointMismatchException.class, () -> f.engine.loadCheckpoint("job-a"));
            Assertions.assertEquals("job-b", load.foundJobId());
            Assertions.assertThrows(CheckpointMismatchException.class,
                    () -> f.engine.startJob("work-on-tasks", "job-a", payload("x", 2), JobOptions.Start.defaults()));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void checkpointFileForAnotherJobIsRejected() throws Exception {
        Path root = TempDirs.create("job-ckpt-mismatch");
        try {
            Fixture f = Fixture.open(root);
            f.engine.startJob("work-on-tasks", "job-a", payload("x", 1), JobOptions.Start.defaults());
            Path file = f.config.checkpointsDir("job-a").resolve("000001.ckpt.json");
            ObjectNode node = (ObjectNode) Jsons.mapper().readTree(file.toFile());
            node.put("job_id", "job-z");
            Files.writeString(file, Jsons.toJson(node), StandardCharsets.UTF_8);

            Assertions.assertThrows(CheckpointMismatchException.class, () -> f.engine.loadCheckpoint("job-a"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void fallsBackToLegacyCheckpointFile() throws Exception {
        Path root = TempDirs.create("job-legacy");
        try {
            Fixture f = Fixture.open(root);
            Path legacy = f.config.legacyCheckpointFile("job-old");
            Files.createDirectories(legacy.getParent());
            Files.writeString(legacy, """
                    {"jobId":"job-old","command":"refine-tasks","stage":"refining",
                     "payload":{"cursor":"t-9"},"updatedAt":"2024-06-01T10:00:00Z","commandRunId":7}
                    """, StandardCharsets.UTF_8);

            CheckpointView view = f.engine.loadCheckpoint("job-old").orElseThrow();
            Assertions.assertTrue(view.legacy());
            Assertions.assertEquals(1L, view.checkpointSeq());
            Assertions.assertEquals(JobState.RUNNING, view.status());
            Assertions.assertEquals("refining", view.stage());
            Assertions.assertEquals("t-9", view.payload().path("cursor").asText());
            Assertions.assertEquals(7L, view.commandRunId());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void missingJobHasNoCheckpoint() throws Exception {
        Path root = TempDirs.create("job-missing");
        try {
            Fixture f = Fixture.open(root);
            Assertions.assertTrue(f.engine.loadCheckpoint("nothing-here").isEmpty());
            Assertions.assertTrue(f.engine.listCheckpoints("nothing-here").isEmpty());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void corruptCheckpointIsAStorageError() throws Exception {
        Path root = TempDirs.create("job-corrupt");
        try {
            Fixture f = Fixture.open(root);
            f.engine.startJob("work-on-tasks", "job-c", payload("x", 1), JobOptions.Start.defaults());
            Files.writeString(f.config.checkpointsDir("job-c").resolve("000002.ckpt.json"), "{not json", StandardCharsets.UTF_8);

            Assertions.assertThrows(StorageIoException.class, () -> f.engine.loadCheckpoint("job-c"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void finalizeClosesRunAndRejectsLaterCheckpoints() throws Exception {
        Path root = TempDirs.create("job-finalize");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("code-review", "job-f", payload("x", 1), JobOptions.Start.defaults());
            f.engine.finalizeJob(session, "succeeded", "reviewed 3 files", "out/review.md",
                    JobOptions.Finalize.result(payload("files", 3)));

            JobRecord job = f.engine.getJob("job-f").orElseThrow();
            Assertions.assertEquals(JobState.COMPLETED, job.state());
            Assertions.assertNotNull(job.completedAt());
            Assertions.assertEquals(3, Jsons.mapper().readTree(job.resultJson()).path("files").asInt());

            CommandRunRecord run = f.store.getCommandRun(session.commandRunId()).orElseThrow();
            Assertions.assertEquals(JobState.COMPLETED, run.status());
            Assertions.assertEquals("out/review.md", run.outputPath());

            Assertions.assertThrows(IllegalStateException.class,
                    () -> f.engine.checkpoint(session, "late", payload("x", 2), JobOptions.Checkpoint.defaults()));
            Assertions.assertThrows(IllegalStateException.class,
                    () -> f.engine.startJob("code-review", "job-f", payload("x", 3), JobOptions.Start.defaults()));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void failedJobUsesSummaryAsErrorAndMayResume() throws Exception {
        Path root = TempDirs.create("job-failed");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("work-on-tasks", "job-x", payload("x", 1), JobOptions.Start.defaults());
            f.engine.finalizeJob(session, "failed", "agent crashed", null, JobOptions.Finalize.defaults());

            JobRecord failed = f.engine.getJob("job-x").orElseThrow();
            Assertions.assertEquals(JobState.FAILED, failed.state());
            Assertions.assertEquals("agent crashed", failed.errorMessage());

            JobSession resumed = f.engine.startJob("work-on-tasks", "job-x", payload("x", 2), JobOptions.Start.defaults());
            Assertions.assertEquals(JobState.RUNNING, f.engine.getJob("job-x").orElseThrow().state());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> f.engine.finalizeJob(resumed, "running", "not terminal", null, null));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void failedJobStaysFailedUntilStartedAgain() throws Exception {
        Path root = TempDirs.create("job-failed-late");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("work-on-tasks", "job-y", payload("x", 1), JobOptions.Start.defaults());
            f.engine.finalizeJob(session, "failed", "boom", null, JobOptions.Finalize.defaults());

            Assertions.assertThrows(IllegalStateException.class,
                    () -> f.engine.checkpoint(session, "late", payload("x", 2), JobOptions.Checkpoint.defaults()));
            Assertions.assertThrows(IllegalStateException.class,
                    () -> f.engine.updateProgress(session, new JobOptions.Progress(10, 5, "late")));
            JobRecord failed = f.engine.getJob("job-y").orElseThrow();
            Assertions.assertEquals(JobState.FAILED, failed.state());
            Assertions.assertEquals("boom", failed.errorMessage());
            Assertions.assertEquals(1L, f.engine.loadCheckpoint("job-y").orElseThrow().checkpointSeq());

            f.engine.startJob("work-on-tasks", "job-y", payload("x", 3), JobOptions.Start.defaults());
            JobRecord resumed = f.engine.getJob("job-y").orElseThrow();
            Assertions.assertEquals(JobState.RUNNING, resumed.state());
            Assertions.assertNull(resumed.errorMessage());
            Assertions.assertNull(resumed.completedAt());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void failedCheckpointWriteLeavesPreviousCheckpointCurrent() throws Exception {
        Path root = TempDirs.create("job-write-fail");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("work-on-tasks", "job-w", payload("x", 1), JobOptions.Start.defaults());
            f.engine.checkpoint(session, "plan", payload("x", 2), JobOptions.Checkpoint.defaults());

            Path checkpoints = f.config.checkpointsDir("job-w");
            Path blockedTemp = checkpoints.resolve(JobEngine.checkpointFileName(3) + ".tmp");
            Files.createDirectories(blockedTemp);
            Files.writeString(blockedTemp.resolve("occupied"), "x", StandardCharsets.UTF_8);

            Assertions.assertThrows(StorageIoException.class,
                    () -> f.engine.checkpoint(session, "apply", payload("x", 3), JobOptions.Checkpoint.defaults()));
            Assertions.assertFalse(Files.exists(checkpoints.resolve(JobEngine.checkpointFileName(3))));
            CheckpointView view = f.engine.loadCheckpoint("job-w").orElseThrow();
            Assertions.assertEquals(2L, view.checkpointSeq());
            Assertions.assertEquals("plan", view.stage());
            Assertions.assertEquals(2, f.engine.listCheckpoints("job-w").size());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void telemetryIsAttachedToTheCommandRun() throws Exception {
        Path root = TempDirs.create("job-telemetry");
        try {
            Fixture f = Fixture.open(root);
            JobSession session = f.engine.startJob("work-on-tasks", "job-t", payload("x", 1), JobOptions.Start.defaults());
            f.engine.logPhase(session, "apply", "start", payload("file", 1), "task-1");
            f.engine.recordTaskRun(session, new TaskRunRecord("task-1", "work-on-tasks", "succeeded", 3.0, 12.5,
                    null, null, null, null));
            f.engine.recordTokenUsage(session, new TokenUsageRecord(null, "codex", "gpt-4o", "work", null, "task-1",
                    null, null, 120, 80, 0.01, null));
            f.engine.recordTokenUsage(session, new TokenUsageRecord(null, "codex", "gpt-4o", "work", null, "task-1",
                    null, null, 30, -5, null, null));
            f.engine.appendLog("job-t", "line one\n");
            f.engine.appendLog("job-t", "line two\n");

            Assertions.assertEquals(1, f.store.listTaskRunLogs(session.commandRunId()).size());
            Assertions.assertEquals(1, f.store.countTaskRuns("job-t"));
            WorkspaceStore.TokenTotals totals = f.store.tokenTotalsForJob("job-t");
            Assertions.assertEquals(2, totals.entries());
            Assertions.assertEquals(150L, totals.promptTokens());
            Assertions.assertEquals(80L, totals.completionTokens());
            Assertions.assertEquals("line one\nline two\n", f.engine.readLog("job-t"));
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void unsafeJobIdsAreRejected() throws Exception {
        Path root = TempDirs.create("job-ids");
        try {
            Fixture f = Fixture.open(root);
            for (String bad : List.of("../escape", "a/b", "..", " ", "x".repeat(129))) {
                Assertions.assertThrows(IllegalArgumentException.class,
                        () -> f.engine.startJob("work-on-tasks", bad, payload("x", 1), JobOptions.Start.defaults()),
                        bad);
            }
            try (Stream<Path> files = Files.list(f.config.jobsDir())) {
                Assertions.assertEquals(0L, files.count());
            }
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void sequenceFileNamesParseBack() {
        Assertions.assertEquals("000042.ckpt.json", JobEngine.checkpointFileName(42));
        Assertions.assertEquals(42L, JobEngine.parseSequence("000042.ckpt.json"));
        Assertions.assertEquals(-1L, JobEngine.parseSequence("checkpoint.json"));
        Assertions.assertEquals(-1L, JobEngine.parseSequence("abc.ckpt.json"));
        Assertions.assertEquals(-1L, JobEngine.parseSequence(".ckpt.json"));
    }

    private static JsonNode payload(String key, int value) {
        return Jsons.mapper().createObjectNode().put(key, value);
    }

    private record Fixture(McodaConfig config, WorkspaceStore store, JobEngine engine) {
        static Fixture open(Path root) {
            return open(root, Instant.parse("2025-03-01T12:00:00Z"));
        }

        static Fixture open(Path root, Instant now) {
            McodaConfig config = McodaConfig.fromRoot(root.toString(), "ws-test");
            Database database = new Database(config);
            database.init();
            WorkspaceStore store = new WorkspaceStore(database);
            JobEngine engine = new JobEngine(config, store, "test", Clock.fixed(now, ZoneOffset.UTC));
            return new Fixture(config, store, engine);
        }
    }
}
