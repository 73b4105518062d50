package com.cohort.core.persistence;

import com.cohort.core.model.Briefing;
import com.cohort.core.model.InboxItem;
import com.cohort.core.model.InboxItemType;
import com.cohort.core.model.Owner;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Briefings and the inbox items that announce them.
 */
@Repository
public class BriefingRepository extends JdbcSupport {

    private static final String BRIEFING_COLUMNS =
            "id, user_id, team_id, aide_id, agent_id, title, summary, content, created_at";

    private static final String INBOX_COLUMNS =
            "id, user_id, agent_id, briefing_id, type, title, content, is_read, created_at";

    public BriefingRepository(DataSource dataSource) {
        super(dataSource);
    }

    /**
     * Writes the briefing and its inbox notification together; neither is stored if either insert fails.
     */
    public void insertWithInboxItem(Briefing briefing, InboxItem notification) {
        inTransaction(conn -> {
            update(conn, "INSERT INTO briefings (" + BRIEFING_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                    briefing.id(), briefing.userId(), briefing.owner().teamIdOrNull(),
                    briefing.owner().aideIdOrNull(), briefing.agentId(), briefing.title(),
                    briefing.summary(), briefing.content(), briefing.createdAt());
            insertInboxItem(conn, notification);
            return null;
        });
    }

    public void insertInboxItem(InboxItem item) {
        inTransaction(conn -> {
            insertInboxItem(conn, item);
            return null;
        });
    }

    /**
     * Newest first.
     *
     * @param search case-insensitive substring matched against title and summary; null or blank matches all
     */
    public List<Briefing> findByOwner(Owner owner, String search, int limit) {
        String column = owner.teamIdOrNull() != null ? "team_id" : "aide_id";
        String sql = "SELECT " + BRIEFING_COLUMNS + " FROM briefings WHERE " + column + " = ?";
        if (search == null || search.isBlank()) {
            return query(sql + " ORDER BY created_at DESC LIMIT ?", BriefingRepository::mapBriefing,
                    owner.id(), limit);
        }
        String pattern = "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return query(sql + " AND (LOWER(title) LIKE ? OR LOWER(summary) LIKE ?) ORDER BY created_at DESC LIMIT ?",
                BriefingRepository::mapBriefing, owner.id(), pattern, pattern, limit);
    }

    /**
     * Looks up a briefing only if it belongs to {@code owner}.
     */
    public Optional<Briefing> findById(Owner owner, String briefingId) {
        return queryOne("SELECT " + BRIEFING_COLUMNS + " FROM briefings WHERE id = ?",
                BriefingRepository::mapBriefing, briefingId)
                .filter(b -> b.owner().equals(owner));
    }

    public int countByAgent(String agentId) {
        return count("SELECT COUNT(*) FROM briefings WHERE agent_id = ?", agentId);
    }

    public List<InboxItem> findInbox(String userId) {
        return query("SELECT " + INBOX_COLUMNS + " FROM inbox_items WHERE user_id = ? ORDER BY created_at DESC",
                BriefingRepository::mapInboxItem, userId);
    }

    public int countInboxItemsByAgent(String agentId) {
        return count("SELECT COUNT(*) FROM inbox_items WHERE agent_id = ?", agentId);
    }

    private void insertInboxItem(Connection conn, InboxItem item) throws SQLException {
        update(conn, "INSERT INTO inbox_items (" + INBOX_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                item.id(), item.userId(), item.agentId(), item.briefingId(), item.type(), item.title(),
                item.content(), item.read(), item.createdAt());
    }

    private static Briefing mapBriefing(ResultSet rs) throws SQLException {
        return new Briefing(
                rs.getString("id"),
                rs.getString("user_id"),
                Owner.of(rs.getString("team_id"), rs.getString("aide_id")),
                rs.getString("agent_id"),
                rs.getString("title"),
                rs.getString("summary"),
                rs.getString("content"),
                instantColumn(rs, "created_at"));
    }

    private static InboxItem mapInboxItem(ResultSet rs) throws SQLException {
        return new InboxItem(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("agent_id"),
                rs.getString("briefing_id"),
                enumColumn(rs, "type", InboxItemType.class),
                rs.getString("title"),
                rs.getString("content"),
                rs.getBoolean("is_read"),
                instantColumn(rs, "created_at"));
    }
}
