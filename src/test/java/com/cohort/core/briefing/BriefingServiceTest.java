package com.cohort.core.briefing;

import com.cohort.core.events.CohortEvent;
import com.cohort.core.model.Agent;
import com.cohort.core.model.Briefing;
import com.cohort.core.model.ConversationMode;
import com.cohort.core.model.InboxItem;
import com.cohort.core.model.InboxItemType;
import com.cohort.core.model.MessageRole;
import com.cohort.core.model.ThreadMessage;
import com.cohort.core.testsupport.CohortFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BriefingServiceTest {

    private CohortFixture fx;
    private BriefingService service;
    private Agent lead;

    @BeforeEach
    void setUp() {
        fx = new CohortFixture();
        service = fx.briefingService;
        lead = fx.createTeamLead();
    }

    private static ThreadMessage message(MessageRole role, String content, int seq) {
        return new ThreadMessage("m" + seq, "thread-1", role, content, null, seq, Instant.EPOCH);
    }

    @Nested
    @DisplayName("decide")
    class Decide {

        private final List<ThreadMessage> transcript = List.of(
                message(MessageRole.USER, "Review earnings", 1),
                message(MessageRole.ASSISTANT, "NVDA beat estimates by 12%", 2));

        @Test
        @DisplayName("a complete positive decision creates briefing, inbox item and event")
        void positive() {
            List<CohortEvent> events = new CopyOnWriteArrayList<>();
            fx.eventBus.subscribeAll(events::add);
            when(fx.llm.structuredCall(anyString(), contains("NVDA beat estimates"), eq(BriefingDecision.class)))
                    .thenReturn(new BriefingDecision(true, "NVDA beat", "Estimates beaten by 12%",
                            "NVDA beat estimates by 12% on data center demand."));

            Optional<Briefing> briefing = service.decide(lead, transcript);

            assertTrue(briefing.isPresent());
            List<InboxItem> inbox = service.inbox("user-1");
            assertEquals(1, inbox.size());
            assertEquals(briefing.get().id(), inbox.get(0).briefingId());
            assertEquals("Estimates beaten by 12%", inbox.get(0).content());
            assertFalse(inbox.get(0).read());
            assertEquals(CohortEvent.BRIEFING_CREATED, events.get(0).eventType());
            assertEquals(1.0, fx.meterRegistry.get("cohort.briefing.decisions").tag("result", "briefed")
                    .counter().count());
        }

        @Test
        @DisplayName("a negative decision writes nothing")
        void negative() {
            when(fx.llm.structuredCall(anyString(), anyString(), eq(BriefingDecision.class)))
                    .thenReturn(new BriefingDecision(false, null, null, null));

            assertTrue(service.decide(lead, transcript).isEmpty());
            assertEquals(0, fx.briefingRepository.countByAgent(lead.id()));
            assertTrue(fx.conversations.recent(lead.id(), ConversationMode.FOREGROUND, 5).isEmpty());
        }

        @Test
        @DisplayName("a failing classifier is treated as no briefing")
        void classifierFails() {
            when(fx.llm.structuredCall(anyString(), anyString(), eq(BriefingDecision.class)))
                    .thenThrow(new IllegalStateException("timeout"));

            assertTrue(service.decide(lead, transcript).isEmpty());
            assertEquals(0, fx.briefingRepository.countByAgent(lead.id()));
        }

        @Test
        @DisplayName("subordinates are never asked")
        void subordinate() {
            Agent sub = fx.createSubordinate(lead, "Sam");

            assertTrue(service.decide(sub, transcript).isEmpty());
            verify(fx.llm, never()).structuredCall(anyString(), anyString(), eq(BriefingDecision.class));
        }

        @Test
        @DisplayName("findings folded into the compaction summary reach the classifier")
        void compactionSummaryConsidered() {
            List<ThreadMessage> compacted = List.of(
                    message(MessageRole.SYSTEM, "Earlier: found a 40% jump in AMD guidance", 1),
                    message(MessageRole.USER, "Check the calendar", 2),
                    message(MessageRole.ASSISTANT, "No events this week", 3));
            when(fx.llm.structuredCall(anyString(), contains("40% jump in AMD guidance"),
                    eq(BriefingDecision.class)))
                    .thenReturn(new BriefingDecision(true, "AMD guidance", "Guidance up 40%", "AMD raised guidance."));

            assertTrue(service.decide(lead, compacted).isPresent());
        }

        @Test
        @DisplayName("a summary alone is enough to ask the classifier")
        void summaryWithoutAssistantOutput() {
            List<ThreadMessage> compacted = List.of(
                    message(MessageRole.SYSTEM, "Earlier: the supplier contract was renewed", 1),
                    message(MessageRole.USER, "Anything else?", 2));

            assertTrue(service.decide(lead, compacted).isEmpty());
            verify(fx.llm).structuredCall(anyString(), contains("supplier contract was renewed"),
                    eq(BriefingDecision.class));
        }
    }

    @Test
    @DisplayName("session output puts the summary before the assistant messages")
    void sessionOutputOrder() {
        String output = BriefingService.sessionOutput(List.of(
                message(MessageRole.SYSTEM, "summary", 1),
                message(MessageRole.USER, "question", 2),
                message(MessageRole.ASSISTANT, "first", 3),
                message(MessageRole.ASSISTANT, "second", 4)));

        assertEquals("Summary of earlier work in this session:\nsummary\n\n"
                + "Session output:\nfirst\n\n---\n\nsecond", output);
        assertEquals("", BriefingService.sessionOutput(List.of(message(MessageRole.USER, "only a question", 1))));
    }

    @Test
    @DisplayName("briefings are listed newest first and scoped to their owner")
    void listScopedToOwner() {
        service.createBriefing(lead, "First", "one", "full one");
        fx.clock.advance(Duration.ofMinutes(5));
        service.createBriefing(lead, "Second", "two", "full two");
        Agent otherLead = fx.createTeamLead();
        service.createBriefing(otherLead, "Elsewhere", "x", "y");

        List<Briefing> listed = service.list(lead.owner(), null, 10);

        assertEquals(List.of("Second", "First"), listed.stream().map(Briefing::title).toList());
        assertEquals(1, service.list(lead.owner(), "SECOND", 10).size());
        assertEquals(1, service.list(lead.owner(), null, 1).size());
    }

    @Test
    @DisplayName("without a resolvable user the briefing is dropped")
    void noUser() {
        fx.owners.delete(lead.owner());

        assertTrue(service.createBriefing(lead, "t", "s", "f").isEmpty());
        assertTrue(service.requestUserInput(lead, "t", "s", "f").isEmpty());
    }

    @Test
    @DisplayName("feedback requests carry no briefing link")
    void feedbackRequest() {
        InboxItem item = service.requestUserInput(lead, "Pick one", "AMD or INTC?", "Which should we cover?")
                .orElseThrow();

        assertEquals(InboxItemType.FEEDBACK, item.type());
        assertNull(item.briefingId());
        assertEquals("Which should we cover?",
                fx.conversations.recent(lead.id(), ConversationMode.FOREGROUND, 1).get(0).content());
    }
}
