package com.cohort.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * The team or aide that an agent, its tasks and its briefings belong to.
 * <p>
 * Exactly one of the two variants exists for every owned row. Persistence stores the
 * owner as a pair of nullable {@code team_id}/{@code aide_id} columns; {@link #of(String, String)}
 * is the single place where that pair is turned back into a value.
 */
public sealed interface Owner extends Serializable permits Owner.TeamOwner, Owner.AideOwner {

    /** Identifier of the team or aide. */
    String id();

    /** Name of the table holding this kind of owner. */
    String table();

    default String teamIdOrNull() {
        return this instanceof TeamOwner team ? team.teamId() : null;
    }

    default String aideIdOrNull() {
        return this instanceof AideOwner aide ? aide.aideId() : null;
    }

    static Owner team(String teamId) {
        return new TeamOwner(teamId);
    }

    static Owner aide(String aideId) {
        return new AideOwner(aideId);
    }

    /**
     * Rebuilds an owner from its two storage columns.
     *
     * @throws IllegalStateException if both or neither column is set
     */
    static Owner of(String teamId, String aideId) {
        if (teamId != null && aideId == null) {
            return new TeamOwner(teamId);
        }
        if (aideId != null && teamId == null) {
            return new AideOwner(aideId);
        }
        throw new IllegalStateException("Row must reference exactly one of team or aide (team="
                + teamId + ", aide=" + aideId + ")");
    }

    record TeamOwner(String teamId) implements Owner {
        public TeamOwner {
            Objects.requireNonNull(teamId, "teamId");
        }

        @Override
        public String id() {
            return teamId;
        }

        @Override
        public String table() {
            return "teams";
        }
    }

    record AideOwner(String aideId) implements Owner {
        public AideOwner {
            Objects.requireNonNull(aideId, "aideId");
        }

        @Override
        public String id() {
            return aideId;
        }

        @Override
        public String table() {
            return "aides";
        }
    }
}
