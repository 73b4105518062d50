package com.cohort.core.persistence;

import com.cohort.core.model.ConversationMessage;
import com.cohort.core.model.ConversationMode;
import com.cohort.core.model.MessageRole;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Durable conversations, one per agent and {@link ConversationMode}.
 */
@Repository
public class ConversationRepository extends JdbcSupport {

    private static final String INSERT_IF_ABSENT_SQL = """
            INSERT INTO conversations (id, agent_id, mode, created_at)
            SELECT ?, ?, ?, ?
            WHERE NOT EXISTS (SELECT 1 FROM conversations WHERE agent_id = ? AND mode = ?)
            """;

    private static final String SELECT_RECENT_SQL = """
            SELECT id, conversation_id, role, content, created_at FROM conversation_messages
            WHERE conversation_id = ?
            ORDER BY seq DESC
            LIMIT ?
            """;

    public ConversationRepository(DataSource dataSource) {
        super(dataSource);
    }

    /**
     * Returns the conversation id for the agent and mode, creating the row on first use.
     */
    public String getOrCreate(String agentId, ConversationMode mode, Instant now) {
        String sql = "SELECT id FROM conversations WHERE agent_id = ? AND mode = ?";
        return queryOne(sql, rs -> rs.getString("id"), agentId, mode).orElseGet(() -> {
            update(INSERT_IF_ABSENT_SQL, UUID.randomUUID().toString(), agentId, mode, now, agentId, mode);
            return queryOne(sql, rs -> rs.getString("id"), agentId, mode)
                    .orElseThrow(() -> new PersistenceException("Conversation not created for agent " + agentId, null));
        });
    }

    public ConversationMessage append(String conversationId, MessageRole role, String content, Instant now) {
        var message = new ConversationMessage(UUID.randomUUID().toString(), conversationId, role, content, now);
        update("INSERT INTO conversation_messages (id, conversation_id, role, content, created_at)"
                        + " VALUES (?, ?, ?, ?, ?)",
                message.id(), conversationId, role, content, now);
        return message;
    }

    /**
     * The newest {@code limit} messages, returned oldest first.
     */
    public List<ConversationMessage> findRecent(String conversationId, int limit) {
        List<ConversationMessage> newestFirst = new ArrayList<>(query(SELECT_RECENT_SQL,
                ConversationRepository::map, conversationId, limit));
        Collections.reverse(newestFirst);
        return newestFirst;
    }

    public int countMessages(String conversationId) {
        return count("SELECT COUNT(*) FROM conversation_messages WHERE conversation_id = ?", conversationId);
    }

    private static ConversationMessage map(ResultSet rs) throws SQLException {
        return new ConversationMessage(
                rs.getString("id"),
                rs.getString("conversation_id"),
                enumColumn(rs, "role", MessageRole.class),
                rs.getString("content"),
                instantColumn(rs, "created_at"));
    }
}
