package com.cohort.core.persistence;

import com.cohort.core.model.KnowledgeItem;
import com.cohort.core.model.KnowledgeItemType;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class KnowledgeItemRepository extends JdbcSupport {

    private static final String COLUMNS = "id, agent_id, type, content, confidence, source_thread_id, created_at";

    public KnowledgeItemRepository(DataSource dataSource) {
        super(dataSource);
    }

    public void insert(KnowledgeItem item) {
        update("INSERT INTO knowledge_items (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)",
                item.id(), item.agentId(), item.type(), item.content(), item.confidence(),
                item.sourceThreadId(), item.createdAt());
    }

    /** Oldest first. */
    public List<KnowledgeItem> findByAgent(String agentId) {
        return query("SELECT " + COLUMNS + " FROM knowledge_items WHERE agent_id = ? ORDER BY created_at ASC",
                KnowledgeItemRepository::map, agentId);
    }

    /**
     * Deletes one item, scoped to its agent so an agent cannot remove another's knowledge.
     */
    public boolean delete(String agentId, String itemId) {
        return update("DELETE FROM knowledge_items WHERE id = ? AND agent_id = ?", itemId, agentId) == 1;
    }

    private static KnowledgeItem map(ResultSet rs) throws SQLException {
        return new KnowledgeItem(
                rs.getString("id"),
                rs.getString("agent_id"),
                enumColumn(rs, "type", KnowledgeItemType.class),
                rs.getString("content"),
                doubleColumn(rs, "confidence"),
                rs.getString("source_thread_id"),
                instantColumn(rs, "created_at"));
    }
}
