package io.mcoda.storage;

import io.mcoda.routing.Agent;
import io.mcoda.routing.AgentHealth;
import io.mcoda.routing.HealthStatus;
import io.mcoda.routing.RoutingDefault;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Agent registry and routing default rows. Workspace and {@code __GLOBAL__} defaults share one
 * table keyed by workspace id.
 */
public final class AgentStore {
    private static final String AGENT_SELECT = """
            SELECT a.id,a.slug,a.adapter,a.default_model,a.rating,a.cost_per_million,
                   h.status AS health_status,h.latency_ms,h.reason AS health_reason,h.checked_at_ms
            FROM agents a LEFT JOIN agent_health h ON h.agent_id=a.id
            """;
    private static final String DEFAULT_SELECT = """
            SELECT d.workspace_id,d.command_name,d.agent_id,a.slug,d.qa_profile,d.docdex_scope,d.updated_at_ms
            FROM routing_defaults d LEFT JOIN agents a ON a.id=d.agent_id
            """;

    private final Database database;

    public AgentStore(Database database) {
        this.database = database;
    }

    /**
     * Inserts or replaces the agent and its full capability set. Health is kept.
     */
    public void saveAgent(Agent agent) {
        long nowMs = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement upsert = c.prepareStatement("""
                    INSERT INTO agents(id,slug,adapter,default_model,rating,cost_per_million,created_at_ms,updated_at_ms)
                    VALUES(?,?,?,?,?,?,?,?)
                    ON CONFLICT(id) DO UPDATE SET
                        slug=excluded.slug,
                        adapter=excluded.adapter,
                        default_model=excluded.default_model,
                        rating=excluded.rating,
                        cost_per_million=excluded.cost_per_million,
                        updated_at_ms=excluded.updated_at_ms
                    """);
                 PreparedStatement clearCaps = c.prepareStatement("DELETE FROM agent_capabilities WHERE agent_id=?");
                 PreparedStatement addCap = c.prepareStatement(
                         "INSERT OR IGNORE INTO agent_capabilities(agent_id,capability) VALUES(?,?)")) {
                upsert.setString(1, agent.id());
                upsert.setString(2, agent.slug());
                upsert.setString(3, agent.adapter() == null ? "unknown" : agent.adapter());
                upsert.setString(4, agent.defaultModel());
                setDouble(upsert, 5, agent.rating());
                setDouble(upsert, 6, agent.costPerMillion());
                upsert.setLong(7, nowMs);
                upsert.setLong(8, nowMs);
                upsert.executeUpdate();

                clearCaps.setString(1, agent.id());
                clearCaps.executeUpdate();
                for (String capability : agent.capabilities()) {
                    addCap.setString(1, agent.id());
                    addCap.setString(2, capability);
                    addCap.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to save agent: " + agent.slug(), e);
        }
        if (agent.health() != null) {
            recordHealth(agent.id(), agent.health());
        }
    }

    public void recordHealth(String agentId, AgentHealth health) {
        String sql = """
                INSERT INTO agent_health(agent_id,status,latency_ms,reason,checked_at_ms) VALUES(?,?,?,?,?)
                ON CONFLICT(agent_id) DO UPDATE SET
                    status=excluded.status,
                    latency_ms=excluded.latency_ms,
                    reason=excluded.reason,
                    checked_at_ms=excluded.checked_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, agentId);
            ps.setString(2, health.status().wireValue());
            if (health.latencyMs() == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setLong(3, health.latencyMs());
            }
            ps.setString(4, health.reason());
            ps.setLong(5, (health.checkedAt() == null ? Instant.now() : health.checkedAt()).toEpochMilli());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record health for agent: " + agentId, e);
        }
    }

    public Optional<Agent> findAgent(String idOrSlug) {
        if (idOrSlug == null || idOrSlug.isBlank()) {
            return Optional.empty();
        }
        String sql = AGENT_SELECT + " WHERE a.id=? OR a.slug=? ORDER BY CASE WHEN a.id=? THEN 0 ELSE 1 END LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            String key = idOrSlug.trim();
            ps.setString(1, key);
            ps.setString(2, key);
            ps.setString(3, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readAgent(c, rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read agent: " + idOrSlug, e);
        }
    }

    public List<Agent> listAgents() {
        List<Agent> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(AGENT_SELECT + " ORDER BY a.slug")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readAgent(c, rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list agents", e);
        }
    }

    public List<RoutingDefault> listRoutingDefaults(String workspaceId) {
        List<RoutingDefault> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(DEFAULT_SELECT + " WHERE d.workspace_id=? ORDER BY d.command_name")) {
            ps.setString(1, workspaceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readDefault(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list routing defaults for " + workspaceId, e);
        }
    }

    public Optional<RoutingDefault> findRoutingDefault(String workspaceId, String commandName) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(DEFAULT_SELECT + " WHERE d.workspace_id=? AND d.command_name=?")) {
            ps.setString(1, workspaceId);
            ps.setString(2, commandName);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readDefault(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read routing default " + workspaceId + "/" + commandName, e);
        }
    }

    /**
     * Writes bindings ({@code set}: command to agent id) and removes {@code reset} commands in one
     * transaction. Non-null tags are stored on the rows written; with an empty {@code set} they are
     * applied to every existing row of the workspace.
     */
    public void applyRoutingDefaults(
            String workspaceId,
            Map<String, String> set,
            List<String> reset,
            String qaProfile,
            String docdexScope
    ) {
        long nowMs = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement delete = c.prepareStatement(
                    "DELETE FROM routing_defaults WHERE workspace_id=? AND command_name=?");
                 PreparedStatement upsert = c.prepareStatement("""
                         INSERT INTO routing_defaults(workspace_id,command_name,agent_id,qa_profile,docdex_scope,updated_at_ms)
                         VALUES(?,?,?,?,?,?)
                         ON CONFLICT(workspace_id,command_name) DO UPDATE SET
                             agent_id=excluded.agent_id,
                             qa_profile=COALESCE(excluded.qa_profile,routing_defaults.qa_profile),
                             docdex_scope=COALESCE(excluded.docdex_scope,routing_defaults.docdex_scope),
                             updated_at_ms=excluded.updated_at_ms
                         """);
                 PreparedStatement tagAll = c.prepareStatement("""
                         UPDATE routing_defaults SET
                             qa_profile=COALESCE(?,qa_profile),
                             docdex_scope=COALESCE(?,docdex_scope),
                             updated_at_ms=?
                         WHERE workspace_id=?
                         """)) {
                for (String command : reset) {
                    delete.setString(1, workspaceId);
                    delete.setString(2, command);
                    delete.executeUpdate();
                }
                for (Map.Entry<String, String> entry : set.entrySet()) {
                    upsert.setString(1, workspaceId);
                    upsert.setString(2, entry.getKey());
                    upsert.setString(3, entry.getValue());
                    upsert.setString(4, qaProfile);
                    upsert.setString(5, docdexScope);
                    upsert.setLong(6, nowMs);
                    upsert.executeUpdate();
                }
                if (set.isEmpty() && (qaProfile != null || docdexScope != null)) {
                    tagAll.setString(1, qaProfile);
                    tagAll.setString(2, docdexScope);
                    tagAll.setLong(3, nowMs);
                    tagAll.setString(4, workspaceId);
                    tagAll.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to update routing defaults for " + workspaceId, e);
        }
    }

    private Agent readAgent(Connection c, ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        AgentHealth health = null;
        String status = rs.getString("health_status");
        if (status != null) {
            long latency = rs.getLong("latency_ms");
            Long latencyMs = rs.wasNull() ? null : latency;
            health = new AgentHealth(
                    HealthStatus.parse(status),
                    latencyMs,
                    WorkspaceStore.getInstant(rs, "checked_at_ms"),
                    rs.getString("health_reason")
            );
        }
        double rating = rs.getDouble("rating");
        Double ratingValue = rs.wasNull() ? null : rating;
        double cost = rs.getDouble("cost_per_million");
        Double costValue = rs.wasNull() ? null : cost;
        return new Agent(
                id,
                rs.getString("slug"),
                rs.getString("adapter"),
                rs.getString("default_model"),
                loadCapabilities(c, id),
                health,
                ratingValue,
                costValue
        );
    }

    private List<String> loadCapabilities(Connection c, String agentId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT capability FROM agent_capabilities WHERE agent_id=? ORDER BY capability")) {
            ps.setString(1, agentId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    private RoutingDefault readDefault(ResultSet rs) throws SQLException {
        return new RoutingDefault(
                rs.getString("workspace_id"),
                rs.getString("command_name"),
                rs.getString("agent_id"),
                rs.getString("slug"),
                rs.getString("qa_profile"),
                rs.getString("docdex_scope"),
                WorkspaceStore.getInstant(rs, "updated_at_ms")
        );
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }
}
