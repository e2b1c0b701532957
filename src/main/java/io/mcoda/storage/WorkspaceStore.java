package io.mcoda.storage;

import io.mcoda.job.CommandRunRecord;
import io.mcoda.job.CommandRunUpdate;
import io.mcoda.job.JobRecord;
import io.mcoda.job.JobState;
import io.mcoda.job.JobStore;
import io.mcoda.job.TaskRunLog;
import io.mcoda.job.TaskRunRecord;
import io.mcoda.job.TokenUsageRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link JobStore}. Timestamps are stored as epoch milliseconds.
 */
public final class WorkspaceStore implements JobStore {
    private static final String JOB_COLUMNS = """
            id,workspace_id,type,command_name,state,state_detail,total_units,completed_units,payload_json,result_json,
            error_code,error_message,resume_supported,checkpoint_path,agent_id,project_key,created_at_ms,started_at_ms,
            last_checkpoint_at_ms,completed_at_ms,updated_at_ms""";
    private static final String RUN_COLUMNS = """
            id,workspace_id,command_name,job_id,status,agent,summary,output_path,error_code,error_message,
            started_at_ms,completed_at_ms,updated_at_ms""";

    private final Database database;

    public WorkspaceStore(Database database) {
        this.database = database;
    }

    @Override
    public Optional<JobRecord> getJob(String jobId) {
        String sql = "SELECT " + JOB_COLUMNS + " FROM jobs WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readJob(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read job: " + jobId, e);
        }
    }

    @Override
    public List<JobRecord> listJobs(int limit) {
        String sql = "SELECT " + JOB_COLUMNS + " FROM jobs ORDER BY updated_at_ms DESC, id ASC LIMIT ?";
        List<JobRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readJob(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list jobs", e);
        }
    }

    @Override
    public void saveJob(JobRecord job) {
        String sql = """
                INSERT INTO jobs(%s) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(id) DO UPDATE SET
                    workspace_id=excluded.workspace_id,
                    type=excluded.type,
                    command_name=excluded.command_name,
                    state=excluded.state,
                    state_detail=excluded.state_detail,
                    total_units=excluded.total_units,
                    completed_units=excluded.completed_units,
                    payload_json=excluded.payload_json,
                    result_json=excluded.result_json,
                    error_code=excluded.error_code,
                    error_message=excluded.error_message,
                    resume_supported=excluded.resume_supported,
                    checkpoint_path=excluded.checkpoint_path,
                    agent_id=excluded.agent_id,
                    project_key=excluded.project_key,
                    created_at_ms=excluded.created_at_ms,
                    started_at_ms=excluded.started_at_ms,
                    last_checkpoint_at_ms=excluded.last_checkpoint_at_ms,
                    completed_at_ms=excluded.completed_at_ms,
                    updated_at_ms=excluded.updated_at_ms
                """.formatted(JOB_COLUMNS);
        Instant now = Instant.now();
        exec(sql, ps -> {
            ps.setString(1, job.id());
            ps.setString(2, job.workspaceId() == null ? "" : job.workspaceId());
            ps.setString(3, job.type() == null ? "other" : job.type());
            ps.setString(4, job.commandName() == null ? "" : job.commandName());
            ps.setString(5, (job.state() == null ? JobState.QUEUED : job.state()).wireValue());
            ps.setString(6, job.stateDetail());
            setInteger(ps, 7, job.totalUnits());
            setInteger(ps, 8, job.completedUnits());
            ps.setString(9, job.payloadJson());
            ps.setString(10, job.resultJson());
            ps.setString(11, job.errorCode());
            ps.setString(12, job.errorMessage());
            ps.setInt(13, job.resumeSupported() == null || job.resumeSupported() ? 1 : 0);
            ps.setString(14, job.checkpointPath());
            ps.setString(15, job.agentId());
            ps.setString(16, job.projectKey());
            ps.setLong(17, (job.createdAt() == null ? now : job.createdAt()).toEpochMilli());
            setInstant(ps, 18, job.startedAt());
            setInstant(ps, 19, job.lastCheckpointAt());
            setInstant(ps, 20, job.completedAt());
            ps.setLong(21, (job.updatedAt() == null ? now : job.updatedAt()).toEpochMilli());
        });
    }

    @Override
    public long recordCommandRun(CommandRunRecord run) {
        String sql = """
                INSERT INTO command_runs(workspace_id,command_name,job_id,status,agent,summary,output_path,error_code,
                    error_message,started_at_ms,completed_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        Instant now = Instant.now();
        return insertReturningId(sql, ps -> {
            ps.setString(1, run.workspaceId() == null ? "" : run.workspaceId());
            ps.setString(2, run.command());
            ps.setString(3, run.jobId());
            ps.setString(4, (run.status() == null ? JobState.RUNNING : run.status()).wireValue());
            ps.setString(5, run.agent());
            ps.setString(6, run.summary());
            ps.setString(7, run.outputPath());
            ps.setString(8, run.errorCode());
            ps.setString(9, run.errorMessage());
            ps.setLong(10, (run.startedAt() == null ? now : run.startedAt()).toEpochMilli());
            setInstant(ps, 11, run.completedAt());
            ps.setLong(12, (run.updatedAt() == null ? now : run.updatedAt()).toEpochMilli());
        }, "Failed to record command run");
    }

    @Override
    public Optional<CommandRunRecord> getCommandRun(long id) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM command_runs WHERE id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readRun(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read command run: " + id, e);
        }
    }

    public List<CommandRunRecord> listCommandRuns(String jobId) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM command_runs WHERE job_id=? ORDER BY id";
        List<CommandRunRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list command runs for job: " + jobId, e);
        }
    }

    @Override
    public void updateCommandRun(long id, CommandRunUpdate update) {
        String sql = """
                UPDATE command_runs SET
                    status=COALESCE(?,status),
                    completed_at_ms=COALESCE(?,completed_at_ms),
                    summary=COALESCE(?,summary),
                    output_path=COALESCE(?,output_path),
                    error_code=COALESCE(?,error_code),
                    error_message=COALESCE(?,error_message),
                    updated_at_ms=?
                WHERE id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, update.status() == null ? null : update.status().wireValue());
            setInstant(ps, 2, update.completedAt());
            ps.setString(3, update.summary());
            ps.setString(4, update.outputPath());
            ps.setString(5, update.errorCode());
            ps.setString(6, update.errorMessage());
            ps.setLong(7, Instant.now().toEpochMilli());
            ps.setLong(8, id);
            if (ps.executeUpdate() != 1) {
                throw new IllegalStateException("Command run not found: " + id);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update command run: " + id, e);
        }
    }

    @Override
    public void recordTaskRunLog(TaskRunLog entry) {
        exec("""
                INSERT INTO task_run_logs(command_run_id,task_id,phase,status,details_json,created_at_ms)
                VALUES(?,?,?,?,?,?)
                """, ps -> {
            ps.setLong(1, entry.commandRunId());
            ps.setString(2, entry.taskId());
            ps.setString(3, entry.phase());
            ps.setString(4, entry.status());
            ps.setString(5, entry.detailsJson());
            ps.setLong(6, (entry.createdAt() == null ? Instant.now() : entry.createdAt()).toEpochMilli());
        });
    }

    public List<TaskRunLog> listTaskRunLogs(long commandRunId) {
        String sql = """
                SELECT command_run_id,task_id,phase,status,details_json,created_at_ms
                FROM task_run_logs WHERE command_run_id=? ORDER BY id
                """;
        List<TaskRunLog> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, commandRunId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new TaskRunLog(
                            rs.getLong("command_run_id"),
                            rs.getString("task_id"),
                            rs.getString("phase"),
                            rs.getString("status"),
                            rs.getString("details_json"),
                            Instant.ofEpochMilli(rs.getLong("created_at_ms"))
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list task run logs", e);
        }
    }

    @Override
    public long recordTaskRun(TaskRunRecord run) {
        String sql = """
                INSERT INTO task_runs(task_id,command,status,story_points,duration_seconds,workspace_id,job_id,notes,created_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                """;
        return insertReturningId(sql, ps -> {
            ps.setString(1, run.taskId());
            ps.setString(2, run.command());
            ps.setString(3, run.status());
            setDouble(ps, 4, run.storyPoints());
            setDouble(ps, 5, run.durationSeconds());
            ps.setString(6, run.workspaceId());
            ps.setString(7, run.jobId());
            ps.setString(8, run.notes());
            ps.setLong(9, (run.createdAt() == null ? Instant.now() : run.createdAt()).toEpochMilli());
        }, "Failed to record task run");
    }

    @Override
    public long recordTokenUsage(TokenUsageRecord usage) {
        String sql = """
                INSERT INTO token_usage(workspace_id,command,agent,model,action,task_id,job_id,command_run_id,
                    prompt_tokens,completion_tokens,cost_estimate,recorded_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        return insertReturningId(sql, ps -> {
            ps.setString(1, usage.workspaceId());
            ps.setString(2, usage.command());
            ps.setString(3, usage.agent());
            ps.setString(4, usage.model());
            ps.setString(5, usage.action());
            ps.setString(6, usage.taskId());
            ps.setString(7, usage.jobId());
            if (usage.commandRunId() == null) {
                ps.setNull(8, Types.INTEGER);
            } else {
                ps.setLong(8, usage.commandRunId());
            }
            ps.setLong(9, usage.promptTokens());
            ps.setLong(10, usage.completionTokens());
            setDouble(ps, 11, usage.costEstimate());
            ps.setLong(12, (usage.recordedAt() == null ? Instant.now() : usage.recordedAt()).toEpochMilli());
        }, "Failed to record token usage");
    }

    public TokenTotals tokenTotalsForJob(String jobId) {
        String sql = """
                SELECT COUNT(*) AS entries, COALESCE(SUM(prompt_tokens),0) AS prompt, COALESCE(SUM(completion_tokens),0) AS completion
                FROM token_usage WHERE job_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new TokenTotals(rs.getInt("entries"), rs.getLong("prompt"), rs.getLong("completion"));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to sum token usage for job: " + jobId, e);
        }
    }

    public int countTaskRuns(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM task_runs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count task runs for job: " + jobId, e);
        }
    }

    private JobRecord readJob(ResultSet rs) throws SQLException {
        return new JobRecord(
                rs.getString("id"),
                rs.getString("type"),
                rs.getString("command_name"),
                rs.getString("workspace_id"),
                JobState.normalize(rs.getString("state")),
                rs.getString("state_detail"),
                getInteger(rs, "total_units"),
                getInteger(rs, "completed_units"),
                rs.getString("payload_json"),
                rs.getString("result_json"),
                rs.getString("error_code"),
                rs.getString("error_message"),
                rs.getInt("resume_supported") == 1,
                rs.getString("checkpoint_path"),
                rs.getString("agent_id"),
                rs.getString("project_key"),
                getInstant(rs, "created_at_ms"),
                getInstant(rs, "started_at_ms"),
                getInstant(rs, "last_checkpoint_at_ms"),
                getInstant(rs, "completed_at_ms"),
                getInstant(rs, "updated_at_ms")
        );
    }

    private CommandRunRecord readRun(ResultSet rs) throws SQLException {
        return new CommandRunRecord(
                rs.getLong("id"),
                rs.getString("command_name"),
                rs.getString("job_id"),
                rs.getString("workspace_id"),
                JobState.normalize(rs.getString("status")),
                rs.getString("agent"),
                getInstant(rs, "started_at_ms"),
                getInstant(rs, "completed_at_ms"),
                rs.getString("summary"),
                rs.getString("output_path"),
                rs.getString("error_code"),
                rs.getString("error_message"),
                getInstant(rs, "updated_at_ms")
        );
    }

    private long insertReturningId(String sql, Binder binder, String failure) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            binder.bind(ps);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new IllegalStateException(failure + ": no generated id");
                }
                return keys.getLong(1);
            }
        } catch (SQLException e) {
            throw new RuntimeException(failure, e);
        }
    }

    private void exec(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    static void setInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(value);
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    @FunctionalInterface
    interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record TokenTotals(int entries, long promptTokens, long completionTokens) {
    }
}
