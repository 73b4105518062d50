package com.cohort.core.persistence;

import com.cohort.core.model.Memory;
import com.cohort.core.model.MemoryType;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class MemoryRepository extends JdbcSupport {

    private static final String COLUMNS = "id, agent_id, type, content, source_message_id, created_at";

    public MemoryRepository(DataSource dataSource) {
        super(dataSource);
    }

    public void insert(Memory memory) {
        update("INSERT INTO memories (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)",
                memory.id(), memory.agentId(), memory.type(), memory.content(),
                memory.sourceMessageId(), memory.createdAt());
    }

    public List<Memory> findByAgent(String agentId) {
        return query("SELECT " + COLUMNS + " FROM memories WHERE agent_id = ? ORDER BY created_at ASC",
                MemoryRepository::map, agentId);
    }

    private static Memory map(ResultSet rs) throws SQLException {
        return new Memory(
                rs.getString("id"),
                rs.getString("agent_id"),
                enumColumn(rs, "type", MemoryType.class),
                rs.getString("content"),
                rs.getString("source_message_id"),
                instantColumn(rs, "created_at"));
    }
}
