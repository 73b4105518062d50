package com.cohort.core.persistence;

import com.cohort.core.model.Agent;
import com.cohort.core.model.AgentStatus;
import com.cohort.core.model.Owner;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Agents plus the conditional updates that make the {@code status} column act as
 * the per-agent session lock.
 */
@Repository
public class AgentRepository extends JdbcSupport {

    private static final String COLUMNS = """
            id, team_id, aide_id, parent_agent_id, name, role, system_prompt, status,
            lead_next_run_at, backoff_next_run_at, backoff_attempt_count, created_at
            """;

    private static final String INSERT_SQL = """
            INSERT INTO agents (id, team_id, aide_id, parent_agent_id, name, role, system_prompt,
                                status, backoff_attempt_count, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, 0, ?)
            """;

    private static final String TRY_MARK_RUNNING_SQL = """
            UPDATE agents SET status = 'running' WHERE id = ? AND status = 'idle'
            """;

    private static final String MARK_IDLE_SQL = """
            UPDATE agents SET status = 'idle' WHERE id = ? AND status = 'running'
            """;

    private static final String SELECT_LEADS_DUE_SQL = """
            SELECT a.id
            FROM agents a
            LEFT JOIN teams t ON a.team_id = t.id
            LEFT JOIN aides d ON a.aide_id = d.id
            WHERE a.parent_agent_id IS NULL
              AND a.lead_next_run_at IS NOT NULL
              AND a.lead_next_run_at <= ?
              AND (t.status = 'active' OR d.status = 'active')
            ORDER BY a.lead_next_run_at ASC
            """;

    private static final String SELECT_BACKED_OFF_SQL = """
            SELECT id FROM agents WHERE backoff_next_run_at IS NOT NULL AND backoff_next_run_at > ?
            """;

    private final Clock clock;

    public AgentRepository(DataSource dataSource, Clock clock) {
        super(dataSource);
        this.clock = clock;
    }

    public Agent create(Owner owner, String parentAgentId, String name, String role, String systemPrompt) {
        var agent = new Agent(UUID.randomUUID().toString(), owner, parentAgentId, name, role, systemPrompt,
                AgentStatus.IDLE, null, null, 0, clock.instant());
        update(INSERT_SQL, agent.id(), owner.teamIdOrNull(), owner.aideIdOrNull(), parentAgentId,
                name, role, systemPrompt, agent.status(), agent.createdAt());
        return agent;
    }

    public Optional<Agent> findById(String agentId) {
        return queryOne("SELECT " + COLUMNS + " FROM agents WHERE id = ?", AgentRepository::map, agentId);
    }

    public List<Agent> findChildren(String parentAgentId) {
        return query("SELECT " + COLUMNS + " FROM agents WHERE parent_agent_id = ? ORDER BY created_at ASC",
                AgentRepository::map, parentAgentId);
    }

    /**
     * Compare-and-set {@code idle -> running}.
     *
     * @return true only for the single caller that performed the transition
     */
    public boolean tryMarkRunning(String agentId) {
        return update(TRY_MARK_RUNNING_SQL, agentId) == 1;
    }

    public void markIdle(String agentId) {
        update(MARK_IDLE_SQL, agentId);
    }

    /**
     * Stores the next proactive run. Ignored for subordinates so only leads ever carry one.
     */
    public void updateLeadNextRunAt(String agentId, Instant nextRunAt) {
        update("UPDATE agents SET lead_next_run_at = ? WHERE id = ? AND parent_agent_id IS NULL",
                nextRunAt, agentId);
    }

    public List<String> findLeadsDueToRun(Instant now) {
        return query(SELECT_LEADS_DUE_SQL, rs -> rs.getString("id"), now);
    }

    public Set<String> findBackedOff(Instant now) {
        return new HashSet<>(query(SELECT_BACKED_OFF_SQL, rs -> rs.getString("id"), now));
    }

    public void recordBackoff(String agentId, int attemptCount, Instant nextRunAt) {
        update("UPDATE agents SET backoff_attempt_count = ?, backoff_next_run_at = ? WHERE id = ?",
                attemptCount, nextRunAt, agentId);
    }

    public void clearBackoff(String agentId) {
        update("UPDATE agents SET backoff_attempt_count = 0, backoff_next_run_at = NULL"
                + " WHERE id = ? AND (backoff_attempt_count <> 0 OR backoff_next_run_at IS NOT NULL)", agentId);
    }

    private static Agent map(ResultSet rs) throws SQLException {
        return new Agent(
                rs.getString("id"),
                Owner.of(rs.getString("team_id"), rs.getString("aide_id")),
                rs.getString("parent_agent_id"),
                rs.getString("name"),
                rs.getString("role"),
                rs.getString("system_prompt"),
                enumColumn(rs, "status", AgentStatus.class),
                instantColumn(rs, "lead_next_run_at"),
                instantColumn(rs, "backoff_next_run_at"),
                rs.getInt("backoff_attempt_count"),
                instantColumn(rs, "created_at"));
    }
}
