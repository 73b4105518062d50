package com.cohort.core.persistence;

import com.cohort.core.model.MessageRole;
import com.cohort.core.model.ThreadMessage;
import com.cohort.core.model.ThreadStatus;
import com.cohort.core.model.WorkThread;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Work threads and their messages.
 * <p>
 * Sequence numbers are assigned inside the inserting transaction as {@code max + 1}; the
 * {@code (thread_id, sequence_number)} unique constraint rejects any duplicate.
 */
@Repository
public class ThreadRepository extends JdbcSupport {

    private static final String MESSAGE_COLUMNS =
            "id, thread_id, role, content, tool_calls, sequence_number, created_at";

    private static final String NEXT_SEQUENCE_SQL = """
            SELECT COALESCE(MAX(sequence_number), 0) + 1 FROM thread_messages WHERE thread_id = ?
            """;

    private static final String INSERT_MESSAGE_SQL = """
            INSERT INTO thread_messages (id, thread_id, role, content, tool_calls, sequence_number, created_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String COMPLETE_SQL = """
            UPDATE threads SET status = 'completed', completed_at = ?
            WHERE id = ? AND status <> 'completed'
            """;

    public ThreadRepository(DataSource dataSource) {
        super(dataSource);
    }

    public WorkThread create(String agentId, Instant now) {
        var thread = new WorkThread(UUID.randomUUID().toString(), agentId, ThreadStatus.ACTIVE, now, null);
        update("INSERT INTO threads (id, agent_id, status, created_at) VALUES (?, ?, ?, ?)",
                thread.id(), agentId, thread.status(), now);
        return thread;
    }

    public Optional<WorkThread> findById(String threadId) {
        return queryOne("SELECT id, agent_id, status, created_at, completed_at FROM threads WHERE id = ?",
                rs -> new WorkThread(
                        rs.getString("id"),
                        rs.getString("agent_id"),
                        enumColumn(rs, "status", ThreadStatus.class),
                        instantColumn(rs, "created_at"),
                        instantColumn(rs, "completed_at")),
                threadId);
    }

    public int countThreads(String agentId) {
        return count("SELECT COUNT(*) FROM threads WHERE agent_id = ?", agentId);
    }

    public ThreadMessage appendMessage(String threadId, MessageRole role, String content, String toolCalls,
                                       Instant now) {
        return inTransaction(conn -> {
            int sequence = query(conn, NEXT_SEQUENCE_SQL, rs -> rs.getInt(1), threadId).get(0);
            return insertMessage(conn, threadId, role, content, toolCalls, sequence, now);
        });
    }

    /** Ordered by sequence number. */
    public List<ThreadMessage> findMessages(String threadId) {
        return query("SELECT " + MESSAGE_COLUMNS + " FROM thread_messages WHERE thread_id = ?"
                + " ORDER BY sequence_number ASC", ThreadRepository::mapMessage, threadId);
    }

    public int countMessages(String threadId) {
        return count("SELECT COUNT(*) FROM thread_messages WHERE thread_id = ?", threadId);
    }

    /**
     * Replaces everything but the newest {@code keepRecent} messages with one system
     * summary at sequence 1, renumbers the survivors from 2 and marks the thread compacted.
     * Runs as one transaction.
     *
     * @return number of messages removed
     */
    public int compact(String threadId, String summary, int keepRecent, Instant now) {
        return inTransaction(conn -> {
            int total = query(conn, "SELECT COUNT(*) FROM thread_messages WHERE thread_id = ?",
                    rs -> rs.getInt(1), threadId).get(0);
            int cut = Math.max(0, total - keepRecent);
            update(conn, "DELETE FROM thread_messages WHERE thread_id = ? AND sequence_number <= ?",
                    threadId, cut);
            // two passes through negative numbers keep the unique constraint satisfied row by row
            update(conn, "UPDATE thread_messages SET sequence_number = -(sequence_number - ? + 1) WHERE thread_id = ?",
                    cut, threadId);
            update(conn, "UPDATE thread_messages SET sequence_number = -sequence_number WHERE thread_id = ?",
                    threadId);
            insertMessage(conn, threadId, MessageRole.SYSTEM, summary, null, 1, now);
            update(conn, "UPDATE threads SET status = ? WHERE id = ? AND status <> 'completed'",
                    ThreadStatus.COMPACTED, threadId);
            return cut;
        });
    }

    /**
     * @return false if the thread was already completed
     */
    public boolean complete(String threadId, Instant now) {
        return update(COMPLETE_SQL, now, threadId) == 1;
    }

    private ThreadMessage insertMessage(Connection conn, String threadId, MessageRole role, String content,
                                        String toolCalls, int sequence, Instant now) throws SQLException {
        var message = new ThreadMessage(UUID.randomUUID().toString(), threadId, role, content, toolCalls,
                sequence, now);
        update(conn, INSERT_MESSAGE_SQL, message.id(), threadId, role, content, toolCalls, sequence, now);
        return message;
    }

    private static ThreadMessage mapMessage(ResultSet rs) throws SQLException {
        return new ThreadMessage(
                rs.getString("id"),
                rs.getString("thread_id"),
                enumColumn(rs, "role", MessageRole.class),
                rs.getString("content"),
                rs.getString("tool_calls"),
                rs.getInt("sequence_number"),
                instantColumn(rs, "created_at"));
    }
}
