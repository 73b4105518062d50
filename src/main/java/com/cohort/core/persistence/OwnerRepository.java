package com.cohort.core.persistence;

import com.cohort.core.model.Owner;
import com.cohort.core.model.OwnerRecord;
import com.cohort.core.model.OwnerStatus;
import org.springframework.stereotype.Repository;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Teams and aides. Both tables share one shape, so every query is parameterised
 * by {@link Owner#table()}.
 */
@Repository
public class OwnerRepository extends JdbcSupport {

    private final Clock clock;

    public OwnerRepository(DataSource dataSource, Clock clock) {
        super(dataSource);
        this.clock = clock;
    }

    public OwnerRecord createTeam(String userId, String name, String mission) {
        return insert(Owner.team(UUID.randomUUID().toString()), userId, name, mission);
    }

    public OwnerRecord createAide(String userId, String name, String mission) {
        return insert(Owner.aide(UUID.randomUUID().toString()), userId, name, mission);
    }

    public Optional<OwnerRecord> find(Owner owner) {
        return queryOne("SELECT id, user_id, name, mission, status, created_at FROM " + owner.table()
                + " WHERE id = ?", rs -> map(owner, rs), owner.id());
    }

    /**
     * Resolves the human behind a team or aide.
     */
    public Optional<String> findUserId(Owner owner) {
        return queryOne("SELECT user_id FROM " + owner.table() + " WHERE id = ?",
                rs -> rs.getString("user_id"), owner.id());
    }

    public boolean isActive(Owner owner) {
        return find(owner).map(o -> o.status() == OwnerStatus.ACTIVE).orElse(false);
    }

    public void updateStatus(Owner owner, OwnerStatus status) {
        update("UPDATE " + owner.table() + " SET status = ? WHERE id = ?", status, owner.id());
    }

    /**
     * Deletes the owner; agents, tasks, threads and briefings go with it.
     */
    public void delete(Owner owner) {
        update("DELETE FROM " + owner.table() + " WHERE id = ?", owner.id());
    }

    private OwnerRecord insert(Owner owner, String userId, String name, String mission) {
        var record = new OwnerRecord(owner, userId, name, mission, OwnerStatus.ACTIVE, clock.instant());
        update("INSERT INTO " + owner.table() + " (id, user_id, name, mission, status, created_at)"
                        + " VALUES (?, ?, ?, ?, ?, ?)",
                owner.id(), userId, name, mission, record.status(), record.createdAt());
        return record;
    }

    private static OwnerRecord map(Owner owner, ResultSet rs) throws SQLException {
        return new OwnerRecord(
                owner,
                rs.getString("user_id"),
                rs.getString("name"),
                rs.getString("mission"),
                enumColumn(rs, "status", OwnerStatus.class),
                instantColumn(rs, "created_at"));
    }
}
