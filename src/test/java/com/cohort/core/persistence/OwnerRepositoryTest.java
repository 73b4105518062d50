package com.cohort.core.persistence;

import com.cohort.core.model.Agent;
import com.cohort.core.model.Owner;
import com.cohort.core.model.OwnerRecord;
import com.cohort.core.model.OwnerStatus;
import com.cohort.core.model.TaskSource;
import com.cohort.core.testsupport.CohortFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OwnerRepositoryTest {

    private CohortFixture fx;

    @BeforeEach
    void setUp() {
        fx = new CohortFixture();
    }

    @Test
    @DisplayName("teams and aides resolve their user and start active")
    void createAndFind() {
        OwnerRecord team = fx.owners.createTeam("user-1", "Research desk", "Semis");
        OwnerRecord aide = fx.owners.createAide("user-2", "Inbox helper", null);

        assertEquals("user-1", fx.owners.findUserId(team.owner()).orElseThrow());
        assertEquals("user-2", fx.owners.findUserId(aide.owner()).orElseThrow());
        assertEquals("teams", team.owner().table());
        assertEquals("aides", aide.owner().table());
        assertTrue(fx.owners.isActive(team.owner()));
        assertTrue(fx.owners.findUserId(Owner.team("missing")).isEmpty());
    }

    @Test
    @DisplayName("a team id never resolves as an aide")
    void ownerKindsAreDisjoint() {
        OwnerRecord team = fx.owners.createTeam("user-1", "Research desk", null);

        assertTrue(fx.owners.find(Owner.aide(team.owner().id())).isEmpty());
    }

    @Test
    @DisplayName("paused owners are inactive and their leads are never due")
    void pausedLeadNotDue() {
        Agent lead = fx.createTeamLead();
        fx.agents.updateLeadNextRunAt(lead.id(), fx.clock.instant().minusSeconds(60));
        assertEquals(List.of(lead.id()), fx.agents.findLeadsDueToRun(fx.clock.instant()));

        fx.owners.updateStatus(lead.owner(), OwnerStatus.PAUSED);

        assertFalse(fx.owners.isActive(lead.owner()));
        assertTrue(fx.agents.findLeadsDueToRun(fx.clock.instant()).isEmpty());
    }

    @Test
    @DisplayName("subordinates never carry a proactive run time")
    void subordinateNoNextRun() {
        Agent lead = fx.createTeamLead();
        Agent sub = fx.createSubordinate(lead, "Sam");

        fx.agents.updateLeadNextRunAt(sub.id(), fx.clock.instant());

        assertNull(fx.reload(sub).leadNextRunAt());
    }

    @Test
    @DisplayName("deleting an owner removes its agents and tasks")
    void deleteCascades() {
        Agent lead = fx.createTeamLead();
        Agent sub = fx.createSubordinate(lead, "Sam");
        String taskId = fx.taskQueue.enqueue(sub.id(), lead.owner(), "x", TaskSource.DELEGATION, lead.id(), 0).id();

        fx.owners.delete(lead.owner());

        assertTrue(fx.agents.findById(lead.id()).isEmpty());
        assertTrue(fx.agents.findById(sub.id()).isEmpty());
        assertTrue(fx.taskRepository.findById(taskId).isEmpty());
    }

    @Test
    @DisplayName("the agent status compare-and-set admits one caller")
    void tryMarkRunning() {
        Agent lead = fx.createTeamLead();

        assertTrue(fx.agents.tryMarkRunning(lead.id()));
        assertFalse(fx.agents.tryMarkRunning(lead.id()));

        fx.agents.markIdle(lead.id());
        assertTrue(fx.agents.tryMarkRunning(lead.id()));
    }
}
