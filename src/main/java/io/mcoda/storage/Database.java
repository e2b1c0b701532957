package io.mcoda.storage;

import io.mcoda.config.McodaConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The workspace SQLite database at {@code .mcoda/mcoda.db}. Holds job telemetry as well as the
 * agent registry and the routing defaults of this workspace and of {@code __GLOBAL__}.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final List<Migration> MIGRATIONS = List.of(
            new Migration(
                    "20250301_001_routing_indexes",
                    "Index routing defaults by agent and capabilities by name",
                    List.of(
                            "CREATE INDEX IF NOT EXISTS idx_routing_defaults_agent ON routing_defaults(agent_id)",
                            "CREATE INDEX IF NOT EXISTS idx_agent_capabilities_name ON agent_capabilities(capability)"
                    )),
            new Migration(
                    "20250301_002_token_usage_run_index",
                    "Index token usage by command run",
                    List.of("CREATE INDEX IF NOT EXISTS idx_token_usage_run ON token_usage(command_run_id)"))
    );
    private static final Map<String, String> REQUIRED_PRAGMAS = Map.of("journal_mode", "wal", "foreign_keys", "1");

    private final McodaConfig config;
    private final String jdbcUrl;

    public Database(McodaConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public McodaConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA foreign_keys=ON");
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.stateDir());
            Files.createDirectories(config.jobsDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize workspace directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        id TEXT PRIMARY KEY,
                        workspace_id TEXT NOT NULL,
                        type TEXT NOT NULL,
                        command_name TEXT NOT NULL,
                        state TEXT NOT NULL,
                        state_detail TEXT,
                        total_units INTEGER,
                        completed_units INTEGER,
                        payload_json TEXT,
                        result_json TEXT,
                        error_code TEXT,
                        error_message TEXT,
                        resume_supported INTEGER NOT NULL DEFAULT 1,
                        checkpoint_path TEXT,
                        agent_id TEXT,
                        project_key TEXT,
                        created_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        last_checkpoint_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS command_runs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        workspace_id TEXT NOT NULL,
                        command_name TEXT NOT NULL,
                        job_id TEXT,
                        status TEXT NOT NULL,
                        agent TEXT,
                        summary TEXT,
                        output_path TEXT,
                        error_code TEXT,
                        error_message TEXT,
                        started_at_ms INTEGER NOT NULL,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_runs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id TEXT NOT NULL,
                        command TEXT NOT NULL,
                        status TEXT NOT NULL,
                        story_points REAL,
                        duration_seconds REAL,
                        workspace_id TEXT,
                        job_id TEXT,
                        notes TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_run_logs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        command_run_id INTEGER NOT NULL,
                        task_id TEXT,
                        phase TEXT NOT NULL,
                        status TEXT NOT NULL,
                        details_json TEXT,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(command_run_id) REFERENCES command_runs(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS token_usage (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        workspace_id TEXT,
                        command TEXT,
                        agent TEXT,
                        model TEXT,
                        action TEXT,
                        task_id TEXT,
                        job_id TEXT,
                        command_run_id INTEGER,
                        prompt_tokens INTEGER NOT NULL DEFAULT 0,
                        completion_tokens INTEGER NOT NULL DEFAULT 0,
                        cost_estimate REAL,
                        recorded_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agents (
                        id TEXT PRIMARY KEY,
                        slug TEXT NOT NULL UNIQUE,
                        adapter TEXT NOT NULL,
                        default_model TEXT,
                        rating REAL,
                        cost_per_million REAL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_capabilities (
                        agent_id TEXT NOT NULL,
                        capability TEXT NOT NULL,
                        PRIMARY KEY(agent_id, capability),
                        FOREIGN KEY(agent_id) REFERENCES agents(id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS agent_health (
                        agent_id TEXT PRIMARY KEY,
                        status TEXT NOT NULL,
                        latency_ms INTEGER,
                        reason TEXT,
                        checked_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(agent_id) REFERENCES agents(id) ON DELETE CASCADE
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS routing_defaults (
                        workspace_id TEXT NOT NULL,
                        command_name TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        qa_profile TEXT,
                        docdex_scope TEXT,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(workspace_id, command_name),
                        FOREIGN KEY(agent_id) REFERENCES agents(id)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_workspace_updated ON jobs(workspace_id, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_command_runs_job ON command_runs(job_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_run_logs_run ON task_run_logs(command_run_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_token_usage_job ON token_usage(job_id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        Set<String> done = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT version FROM schema_migrations WHERE success=1")) {
            while (rs.next()) {
                done.add(rs.getString(1));
            }
        }
        for (Migration migration : MIGRATIONS) {
            if (done.contains(migration.version())) {
                continue;
            }
            runMigration(conn, migration);
            log.info("Applied schema migration {}", migration.version());
        }
    }

    private void runMigration(Connection conn, Migration migration) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            try (Statement st = conn.createStatement()) {
                for (String ddl : migration.statements()) {
                    st.execute(ddl);
                }
            }
            try (PreparedStatement ledger = conn.prepareStatement(
                    "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) "
                            + "VALUES(?,?,?,?,1)")) {
                ledger.setString(1, migration.version());
                ledger.setString(2, migration.description());
                ledger.setString(3, migration.checksum());
                ledger.setLong(4, System.currentTimeMillis());
                ledger.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            for (Map.Entry<String, String> required : REQUIRED_PRAGMAS.entrySet()) {
                String value = readPragma(st, required.getKey());
                if (!required.getValue().equalsIgnoreCase(value)) {
                    throw new IllegalStateException("SQLite pragma " + required.getKey() + " is " + value
                            + " but mcoda requires " + required.getValue());
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to configure SQLite connection for " + config.dbFile(), e);
        }
    }

    private static String readPragma(Statement st, String name) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + name)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version";
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(sql)) {
            List<SchemaMigrationRow> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(new SchemaMigrationRow(rs.getString(1), rs.getString(2), rs.getString(3),
                        rs.getLong(4), rs.getInt(5) == 1));
            }
            return rows;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read schema_migrations from " + config.dbFile(), e);
        }
    }

    private record Migration(String version, String description, List<String> statements) {
        String checksum() {
            try {
                MessageDigest digest = MessageDigest.getInstance("SHA-256");
                digest.update((version + '\n' + description + '\n').getBytes(StandardCharsets.UTF_8));
                for (String ddl : statements) {
                    digest.update((ddl + ";\n").getBytes(StandardCharsets.UTF_8));
                }
                return HexFormat.of().formatHex(digest.digest(), 0, 8);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException("SHA-256 unavailable", e);
            }
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
