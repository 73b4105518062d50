package com.cohort.core.persistence;

import com.cohort.core.model.AgentTask;
import com.cohort.core.model.Owner;
import com.cohort.core.model.QueueStatus;
import com.cohort.core.model.TaskSource;
import com.cohort.core.model.TaskStatus;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rows of {@code agent_tasks}. Every status transition is a conditional update on the
 * current status so the task state machine can only move forward.
 */
@Repository
public class TaskRepository extends JdbcSupport {

    private static final String COLUMNS = """
            id, team_id, aide_id, assigned_to_id, assigned_by_id, task, result, status, source,
            priority, created_at, started_at, completed_at
            """;

    private static final String INSERT_SQL = """
            INSERT INTO agent_tasks (id, team_id, aide_id, assigned_to_id, assigned_by_id, task,
                                     status, source, priority, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_CLAIM_CANDIDATES_SQL = """
            SELECT id FROM agent_tasks
            WHERE assigned_to_id = ? AND status = 'pending'
            ORDER BY priority DESC, created_at ASC, seq ASC
            """;

    private static final String CLAIM_SQL = """
            UPDATE agent_tasks SET status = 'in_progress', started_at = ?
            WHERE id = ? AND status = 'pending'
              AND NOT EXISTS (
                  SELECT 1 FROM agent_tasks busy
                  WHERE busy.assigned_to_id = ? AND busy.status = 'in_progress')
            """;

    private static final String FINISH_SQL = """
            UPDATE agent_tasks SET status = ?, result = ?, completed_at = ?
            WHERE id = ? AND status = 'in_progress'
            """;

    private static final String COUNT_BY_STATUS_SQL = """
            SELECT
                SUM(CASE WHEN status = 'pending' THEN 1 ELSE 0 END) AS pending,
                SUM(CASE WHEN status = 'in_progress' THEN 1 ELSE 0 END) AS in_progress
            FROM agent_tasks WHERE assigned_to_id = ?
            """;

    private static final String SELECT_AGENTS_WITH_OPEN_TASKS_SQL = """
            SELECT DISTINCT assigned_to_id FROM agent_tasks
            WHERE status IN ('pending', 'in_progress')
            """;

    private static final String SELECT_STALE_SQL = """
            SELECT t.id, t.team_id, t.aide_id, t.assigned_to_id, t.assigned_by_id, t.task, t.result,
                   t.status, t.source, t.priority, t.created_at, t.started_at, t.completed_at
            FROM agent_tasks t
            JOIN agents a ON a.id = t.assigned_to_id
            WHERE t.status = 'in_progress' AND t.started_at < ? AND a.status = 'idle'
            """;

    public TaskRepository(DataSource dataSource) {
        super(dataSource);
    }

    public void insert(AgentTask task) {
        update(INSERT_SQL, task.id(), task.owner().teamIdOrNull(), task.owner().aideIdOrNull(),
                task.assignedToId(), task.assignedById(), task.description(), task.status(),
                task.source(), task.priority(), task.createdAt());
    }

    public Optional<AgentTask> findById(String taskId) {
        return queryOne("SELECT " + COLUMNS + " FROM agent_tasks WHERE id = ?", TaskRepository::map, taskId);
    }

    /**
     * Claims the best pending task for the agent.
     * <p>
     * Candidates are tried in order; each attempt is a single conditional update, so a
     * candidate taken by a concurrent caller simply makes this attempt affect no row.
     * Nothing is claimed while the agent already has a task in progress.
     */
    public Optional<AgentTask> claimNext(String agentId, Instant startedAt) {
        List<String> candidates = query(SELECT_CLAIM_CANDIDATES_SQL, rs -> rs.getString("id"), agentId);
        for (String candidate : candidates) {
            if (update(CLAIM_SQL, startedAt, candidate, agentId) == 1) {
                return findById(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Moves an in-progress task to {@code completed} or {@code failed}.
     *
     * @return false when the task was not in progress; nothing is written then
     */
    public boolean finish(String taskId, TaskStatus terminal, String result, Instant completedAt) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return update(FINISH_SQL, terminal, result, completedAt, taskId) == 1;
    }

    public QueueStatus queueStatus(String agentId) {
        return queryOne(COUNT_BY_STATUS_SQL,
                rs -> QueueStatus.of(rs.getInt("pending"), rs.getInt("in_progress")), agentId)
                .orElse(QueueStatus.of(0, 0));
    }

    public Set<String> findAgentIdsWithOpenTasks() {
        return new LinkedHashSet<>(query(SELECT_AGENTS_WITH_OPEN_TASKS_SQL, rs -> rs.getString(1)));
    }

    public Optional<AgentTask> findMostRecentInProgress(String agentId) {
        return queryOne("SELECT " + COLUMNS + " FROM agent_tasks WHERE assigned_to_id = ? AND status = 'in_progress'"
                + " ORDER BY started_at DESC, seq DESC", TaskRepository::map, agentId);
    }

    /** Newest first. */
    public List<AgentTask> findByAgent(String agentId, int limit) {
        return query("SELECT " + COLUMNS + " FROM agent_tasks WHERE assigned_to_id = ?"
                + " ORDER BY created_at DESC, seq DESC LIMIT ?", TaskRepository::map, agentId, limit);
    }

    public List<AgentTask> findStaleInProgress(Instant startedBefore) {
        return query(SELECT_STALE_SQL, TaskRepository::map, startedBefore);
    }

    private static AgentTask map(ResultSet rs) throws SQLException {
        return new AgentTask(
                rs.getString("id"),
                Owner.of(rs.getString("team_id"), rs.getString("aide_id")),
                rs.getString("assigned_to_id"),
                rs.getString("assigned_by_id"),
                rs.getString("task"),
                rs.getString("result"),
                enumColumn(rs, "status", TaskStatus.class),
                enumColumn(rs, "source", TaskSource.class),
                rs.getInt("priority"),
                instantColumn(rs, "created_at"),
                instantColumn(rs, "started_at"),
                instantColumn(rs, "completed_at"));
    }
}
