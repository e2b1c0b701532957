package io.mcoda.job;

import com.fasterxml.jackson.databind.JsonNode;
import io.mcoda.config.McodaConfig;
import io.mcoda.util.Jsons;
import io.mcoda.util.StorageIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the job lifecycle: start, checkpoint, resume and finalize.
 *
 * <p>Each job lives under {@code .mcoda/jobs/<jobId>/} with a write-once {@code manifest.json} and
 * one {@code NNNNNN.ckpt.json} file per checkpoint. Every file is written to a temp sibling and
 * renamed into place, so a reader never observes a torn checkpoint and a crash between two
 * checkpoints loses nothing that was already committed.
 *
 * <p>Sequence numbers are derived by scanning the checkpoint directory. That is only safe with a
 * single writer per job; running the same job id from two processes at once is not supported.
 */
public final class JobEngine {
    private static final Logger log = LoggerFactory.getLogger(JobEngine.class);
    private static final String CHECKPOINT_SUFFIX = ".ckpt.json";
    private static final String STARTED_STAGE = "started";
    private static final int MAX_JOB_ID_LENGTH = 128;

    private final McodaConfig config;
    private final JobStore store;
    private final String runtimeVersion;
    private final Clock clock;

    public JobEngine(McodaConfig config, JobStore store) {
        this(config, store, "dev", Clock.systemUTC());
    }

    public JobEngine(McodaConfig config, JobStore store, String runtimeVersion, Clock clock) {
        this.config = config;
        this.store = store;
        this.runtimeVersion = runtimeVersion;
        this.clock = clock;
    }

    public JobSession startJob(String command, String jobId, JsonNode payload, JobOptions.Start options) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be blank");
        }
        requireSafeJobId(jobId);
        JobOptions.Start opts = options == null ? JobOptions.Start.defaults() : options;
        try (MDC.MDCCloseable ignoredJob = MDC.putCloseable("jobId", jobId);
             MDC.MDCCloseable ignoredCommand = MDC.putCloseable("command", command)) {
            String jobType = JobTypes.derive(command, opts.jobType());
            boolean resumeSupported = opts.resumeSupported() == null || opts.resumeSupported();
            createDirectories(config.checkpointsDir(jobId));

            Instant now = clock.instant();
            Optional<JobRecord> existing = store.getJob(jobId);
            existing.ifPresent(JobEngine::requireResumable);

            JobManifest manifest = readManifest(jobId).orElse(null);
            if (manifest == null) {
                manifest = new JobManifest(
                        JobManifest.SCHEMA_VERSION,
                        jobId,
                        config.workspaceRoot().toString(),
                        config.workspaceId(),
                        command,
                        jobType,
                        existing.map(JobRecord::createdAt).orElse(now),
                        resumeSupported,
                        payload
                );
                Jsons.writeAtomic(config.manifestFile(jobId), manifest);
            } else if (manifest.jobId() != null && !manifest.jobId().equals(jobId)) {
                throw new CheckpointMismatchException(jobId, manifest.jobId(), "manifest");
            } else {
                log.info("Resuming job {} with manifest created at {}", jobId, manifest.createdAt());
            }

            JobRecord update = new JobRecord(
                    jobId,
                    jobType,
                    command,
                    config.workspaceId(),
                    JobState.RUNNING,
                    null,
                    opts.totalUnits(),
                    opts.completedUnits(),
                    Jsons.toJsonOrNull(payload),
                    null,
                    null,
                    null,
                    resumeSupported,
                    config.jobDir(jobId).toString(),
                    opts.agentId(),
                    opts.projectKey(),
                    manifest.createdAt(),
                    existing.map(JobRecord::startedAt).orElse(now),
                    now,
                    null,
                    now
            );
            store.saveJob(update.mergeOnto(existing.orElse(null)).withoutOutcome());

            long commandRunId = store.recordCommandRun(CommandRunRecord.opened(command, jobId, config.workspaceId(), now));
            JobSession session = new JobSession(
                    jobId,
                    command,
                    jobType,
                    commandRunId,
                    config.jobDir(jobId),
                    config.manifestFile(jobId)
            );
            writeCheckpointFile(session, STARTED_STAGE, payload, JobState.RUNNING, null,
                    new CheckpointRecord.Progress(0, null), null, null, null, now);
            log.info("Started job {} ({}) as command run {}", jobId, jobType, commandRunId);
            return session;
        }
    }

    public CheckpointRecord checkpoint(JobSession session, String stage, JsonNode payload, JobOptions.Checkpoint options) {
        JobOptions.Checkpoint opts = options == null ? JobOptions.Checkpoint.defaults() : options;
        try (MDC.MDCCloseable ignoredJob = MDC.putCloseable("jobId", session.jobId());
             MDC.MDCCloseable ignoredCommand = MDC.putCloseable("command", session.command())) {
            JobState status = JobState.normalize(opts.status() == null ? JobState.RUNNING.wireValue() : opts.status());
            JobState stored = status == JobState.CHECKPOINTING ? JobState.RUNNING : status;
            Optional<JobRecord> existing = store.getJob(session.jobId());
            existing.ifPresent(job -> requireTransition(job, stored));

            Instant now = clock.instant();
            CheckpointRecord written = writeCheckpointFile(
                    session,
                    stage,
                    payload,
                    status,
                    opts.reason(),
                    new CheckpointRecord.Progress(opts.completedUnits(), opts.totalUnits()),
                    opts.tags(),
                    opts.cursor(),
                    opts.parents(),
                    now
            );
            JobRecord update = JobRecord.partial(session.jobId())
                    .withState(stored)
                    .withStateDetail(stage)
                    .withProgress(opts.totalUnits(), opts.completedUnits())
                    .withCheckpointAt(now);
            saveMerged(session, update, existing.orElse(null), now);
            log.debug("Checkpoint {} written for stage {} ({})", written.checkpointSeq(), stage, status.wireValue());
            return written;
        }
    }

    /**
     * Returns the newest committed checkpoint of {@code jobId}, falling back to the legacy
     * single-file format. Job id disagreement with anything found on disk is fatal.
     */
    public Optional<CheckpointView> loadCheckpoint(String jobId) {
        requireSafeJobId(jobId);
        JobManifest manifest = readManifest(jobId).orElse(null);
        if (manifest != null && manifest.jobId() != null && !manifest.jobId().equals(jobId)) {
            throw new CheckpointMismatchException(jobId, manifest.jobId(), "manifest");
        }

        Optional<Path> latest = listCheckpointFiles(jobId).stream().reduce((first, second) -> second);
        if (latest.isPresent()) {
            Path file = latest.get();
            CheckpointRecord record = readJson(file, CheckpointRecord.class);
            if (record.jobId() != null && !record.jobId().equals(jobId)) {
                throw new CheckpointMismatchException(jobId, record.jobId(), "checkpoint " + file.getFileName());
            }
            return Optional.of(new CheckpointView(
                    jobId,
                    record.commandName(),
                    record.jobType(),
                    record.stage(),
                    record.payload(),
                    JobState.normalize(record.status()),
                    record.reason(),
                    record.checkpointSeq(),
                    record.checkpointId(),
                    record.createdAt(),
                    file,
                    null,
                    manifest,
                    false
            ));
        }

        Path legacyFile = config.legacyCheckpointFile(jobId);
        if (!Files.exists(legacyFile)) {
            return Optional.empty();
        }
        LegacyCheckpoint legacy = readJson(legacyFile, LegacyCheckpoint.class);
        if (legacy.jobId() != null && !legacy.jobId().equals(jobId)) {
            throw new CheckpointMismatchException(jobId, legacy.jobId(), "legacy checkpoint");
        }
        log.info("Job {} has no sequenced checkpoints, using legacy checkpoint.json", jobId);
        return Optional.of(new CheckpointView(
                jobId,
                legacy.command(),
                manifest == null ? null : manifest.jobType(),
                legacy.stage(),
                legacy.payload(),
                JobState.RUNNING,
                null,
                1L,
                legacy.updatedAt() == null ? UUID.randomUUID().toString() : legacy.updatedAt().toString(),
                legacy.updatedAt(),
                legacyFile,
                legacy.commandRunId(),
                manifest,
                true
        ));
    }

    public List<CheckpointRecord> listCheckpoints(String jobId) {
        requireSafeJobId(jobId);
        List<CheckpointRecord> out = new ArrayList<>();
        for (Path file : listCheckpointFiles(jobId)) {
            out.add(readJson(file, CheckpointRecord.class));
        }
        return out;
    }

    /**
     * Marks the command run and the job row terminal. {@code status} must resolve to completed,
     * failed or cancelled ("succeeded" is accepted as completed).
     */
    public void finalizeJob(JobSession session, String status, String summary, String outputPath, JobOptions.Finalize options) {
        JobOptions.Finalize opts = options == null ? JobOptions.Finalize.defaults() : options;
        JobState state = JobState.normalize(status);
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("finalize requires completed, failed or cancelled, got: " + status);
        }
        try (MDC.MDCCloseable ignoredJob = MDC.putCloseable("jobId", session.jobId());
             MDC.MDCCloseable ignoredCommand = MDC.putCloseable("command", session.command())) {
            Optional<JobRecord> existing = store.getJob(session.jobId());
            existing.ifPresent(job -> requireTransition(job, state));

            Instant now = clock.instant();
            String errorMessage = opts.errorMessage();
            if (errorMessage == null && state == JobState.FAILED) {
                errorMessage = summary;
            }
            store.updateCommandRun(session.commandRunId(), new CommandRunUpdate(
                    state,
                    now,
                    summary,
                    outputPath,
                    opts.errorCode(),
                    errorMessage
            ));
            JobRecord update = JobRecord.partial(session.jobId())
                    .withState(state)
                    .withStateDetail(summary)
                    .withOutcome(now, Jsons.toJsonOrNull(opts.result()), opts.errorCode(), errorMessage);
            saveMerged(session, update, existing.orElse(null), now);
            if (state == JobState.FAILED) {
                log.warn("Job {} failed: {}", session.jobId(), errorMessage);
            } else {
                log.info("Job {} finalized as {}", session.jobId(), state.wireValue());
            }
        }
    }

    public void updateProgress(JobSession session, JobOptions.Progress progress) {
        Instant now = clock.instant();
        JobRecord existing = store.getJob(session.jobId()).orElse(null);
        if (existing != null && existing.state() != null && existing.state().isTerminal()) {
            throw new IllegalStateException("Job " + session.jobId() + " is " + existing.state().wireValue()
                    + "; progress updates need a resumed session");
        }
        JobRecord update = JobRecord.partial(session.jobId())
                .withProgress(progress.totalUnits(), progress.completedUnits())
                .withStateDetail(progress.stateDetail());
        saveMerged(session, update, existing, now);
    }

    public void logPhase(JobSession session, String phase, String status, JsonNode details, String taskId) {
        store.recordTaskRunLog(new TaskRunLog(
                session.commandRunId(),
                taskId,
                phase,
                status,
                Jsons.toJsonOrNull(details),
                clock.instant()
        ));
    }

    public long recordTaskRun(JobSession session, TaskRunRecord run) {
        return store.recordTaskRun(run.withJob(session.jobId(), config.workspaceId()));
    }

    public long recordTokenUsage(JobSession session, TokenUsageRecord usage) {
        return store.recordTokenUsage(usage.withSession(session, config.workspaceId()));
    }

    public void appendLog(String jobId, String content) {
        requireSafeJobId(jobId);
        Path logFile = config.jobLogsDir(jobId).resolve("stream.log");
        try {
            Files.createDirectories(logFile.getParent());
            Files.writeString(logFile, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StorageIoException("Failed to append job log: " + logFile, e);
        }
    }

    public String readLog(String jobId) {
        requireSafeJobId(jobId);
        Path logFile = config.jobLogsDir(jobId).resolve("stream.log");
        if (!Files.exists(logFile)) {
            return "";
        }
        try {
            return Files.readString(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StorageIoException("Failed to read job log: " + logFile, e);
        }
    }

    public Optional<JobRecord> getJob(String jobId) {
        return store.getJob(jobId);
    }

    public List<JobRecord> listJobs(int limit) {
        return store.listJobs(limit);
    }

    static String checkpointFileName(long seq) {
        return String.format("%06d", seq) + CHECKPOINT_SUFFIX;
    }

    static long parseSequence(String fileName) {
        if (fileName == null || !fileName.endsWith(CHECKPOINT_SUFFIX)) {
            return -1L;
        }
        String prefix = fileName.substring(0, fileName.length() - CHECKPOINT_SUFFIX.length());
        if (prefix.isEmpty()) {
            return -1L;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (!Character.isDigit(prefix.charAt(i))) {
                return -1L;
            }
        }
        try {
            return Long.parseLong(prefix);
        } catch (NumberFormatException e) {
            return -1L;
        }
    }

    private CheckpointRecord writeCheckpointFile(
            JobSession session,
            String stage,
            JsonNode payload,
            JobState status,
            String reason,
            CheckpointRecord.Progress progress,
            List<String> tags,
            String cursor,
            List<String> parents,
            Instant now
    ) {
        Path dir = config.checkpointsDir(session.jobId());
        createDirectories(dir);
        long seq = nextCheckpointSeq(session.jobId());
        List<String> resolvedTags = tags != null ? List.copyOf(tags) : stage == null ? List.of() : List.of(stage);
        CheckpointRecord record = new CheckpointRecord(
                CheckpointRecord.SCHEMA_VERSION,
                session.jobId(),
                session.command(),
                session.jobType(),
                seq,
                UUID.randomUUID().toString(),
                now,
                status.wireValue(),
                reason,
                stage,
                payload,
                CheckpointRecord.Engine.current(runtimeVersion),
                progress,
                new CheckpointRecord.Indexes(resolvedTags, cursor, parents)
        );
        Jsons.writeAtomic(dir.resolve(checkpointFileName(seq)), record);
        return record;
    }

    private long nextCheckpointSeq(String jobId) {
        List<Path> files = listCheckpointFiles(jobId);
        if (files.isEmpty()) {
            return 1L;
        }
        return parseSequence(files.get(files.size() - 1).getFileName().toString()) + 1L;
    }

    private List<Path> listCheckpointFiles(String jobId) {
        Path dir = config.checkpointsDir(jobId);
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + CHECKPOINT_SUFFIX)) {
            for (Path path : stream) {
                if (parseSequence(path.getFileName().toString()) > 0L) {
                    files.add(path);
                }
            }
        } catch (NoSuchFileException e) {
            return files;
        } catch (IOException e) {
            throw new StorageIoException("Failed to list checkpoints: " + dir, e);
        }
        files.sort(Comparator.comparingLong(path -> parseSequence(path.getFileName().toString())));
        return files;
    }

    private Optional<JobManifest> readManifest(String jobId) {
        Path file = config.manifestFile(jobId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(readJson(file, JobManifest.class));
    }

    private <T> T readJson(Path file, Class<T> type) {
        try {
            return Jsons.mapper().readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new StorageIoException("Failed to read " + file, e);
        }
    }

    private void saveMerged(JobSession session, JobRecord update, JobRecord existing, Instant now) {
        JobRecord merged = update.mergeOnto(existing);
        if (existing == null) {
            merged = new JobRecord(
                    merged.id(),
                    merged.type() == null ? session.jobType() : merged.type(),
                    merged.commandName() == null ? session.command() : merged.commandName(),
                    merged.workspaceId() == null ? config.workspaceId() : merged.workspaceId(),
                    merged.state() == null ? JobState.RUNNING : merged.state(),
                    merged.stateDetail(),
                    merged.totalUnits(),
                    merged.completedUnits(),
                    merged.payloadJson(),
                    merged.resultJson(),
                    merged.errorCode(),
                    merged.errorMessage(),
                    merged.resumeSupported() == null ? Boolean.TRUE : merged.resumeSupported(),
                    merged.checkpointPath() == null ? session.checkpointPath().toString() : merged.checkpointPath(),
                    merged.agentId(),
                    merged.projectKey(),
                    merged.createdAt() == null ? now : merged.createdAt(),
                    merged.startedAt(),
                    merged.lastCheckpointAt(),
                    merged.completedAt(),
                    now
            );
        } else if (update.updatedAt() == null) {
            merged = merged.withUpdatedAt(now);
        }
        store.saveJob(merged);
    }

    private static void requireTransition(JobRecord job, JobState next) {
        JobState current = job.state() == null ? JobState.QUEUED : job.state();
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job " + job.id() + " cannot move from " + current.wireValue() + " to " + next.wireValue()
            );
        }
    }

    private static void requireResumable(JobRecord job) {
        JobState current = job.state() == null ? JobState.QUEUED : job.state();
        if (!current.canResume()) {
            throw new IllegalStateException("Job " + job.id() + " is " + current.wireValue() + " and cannot be resumed");
        }
    }

    private static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageIoException("Failed to create directory: " + dir, e);
        }
    }

    static void requireSafeJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
        if (jobId.length() > MAX_JOB_ID_LENGTH || ".".equals(jobId) || "..".equals(jobId)) {
            throw new IllegalArgumentException("Invalid jobId: " + jobId);
        }
        for (int i = 0; i < jobId.length(); i++) {
            char ch = jobId.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                throw new IllegalArgumentException("Invalid jobId: " + jobId);
            }
        }
    }

    private record LegacyCheckpoint(
            String jobId,
            String command,
            String stage,
            JsonNode payload,
            Instant updatedAt,
            Long commandRunId
    ) {
    }
}
