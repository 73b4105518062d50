package com.cohort.core.agent;

import com.cohort.core.knowledge.KnowledgeStore;
import com.cohort.core.memory.MemoryStore;
import com.cohort.core.model.Agent;
import com.cohort.core.model.ConversationMessage;
import com.cohort.core.model.KnowledgeItem;
import com.cohort.core.model.Memory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prompt text for agents. Foreground prompts see memories about the user; background
 * prompts see knowledge items. The two never mix.
 */
public final class AgentPrompts {

    static final String FALLBACK_ACKNOWLEDGMENT =
            "Got it. I'm looking into this now and will follow up when I have something useful.";

    static final String COMPACTION_SYSTEM_PROMPT = """
            Summarize the earlier part of an agent's work session so the agent can continue
            without it. Keep every task it was given, what it found, decisions it made, tool
            results it still depends on and open questions. Be factual and compact.
            """;

    private AgentPrompts() {}

    static String identity(Agent agent) {
        if (agent.systemPrompt() != null && !agent.systemPrompt().isBlank()) {
            return agent.systemPrompt().strip();
        }
        return "You are " + agent.name() + ", " + agent.role() + ".";
    }

    /**
     * System prompt for processing queued tasks.
     */
    static String background(Agent agent, List<KnowledgeItem> knowledge, List<ConversationMessage> teamMessages) {
        var prompt = new StringBuilder(identity(agent)).append("\n\n");
        prompt.append("""
                You are working through your task queue in the background. The user is not \
                watching; do the work, use your tools where they help, and answer each task \
                with a complete, self-contained result.
                """);
        if (agent.isLead()) {
            prompt.append("""

                    You lead a team. Delegate work that fits a subordinate with delegateToAgent \
                    and check progress with getTeamStatus. When you find something the user \
                    should know now, use createBriefing; when you need a decision from the user, \
                    use requestUserInput. Do not brief on routine progress.
                    """);
        } else {
            prompt.append("""

                    You report to a lead. When you finish or give up on a delegated task, send \
                    the outcome with reportToLead. If you are blocked, ask with requestInput.
                    """);
        }
        prompt.append("\n## Your knowledge\n").append(KnowledgeStore.formatForPrompt(knowledge)).append('\n');
        if (!teamMessages.isEmpty()) {
            prompt.append("\n## Recent messages from your team\n")
                    .append(teamMessages.stream().map(ConversationMessage::content)
                            .collect(Collectors.joining("\n")))
                    .append('\n');
        }
        return prompt.toString();
    }

    /**
     * System prompt for the short reply to a user message.
     */
    static String acknowledgment(Agent agent, List<Memory> memories, List<ConversationMessage> recent) {
        var prompt = new StringBuilder(identity(agent)).append("\n\n");
        prompt.append("""
                The user just sent you a message. Reply in one or two sentences: show you \
                understood the request and say you are on it. Do not attempt the work itself \
                and do not promise specific results.
                """);
        prompt.append("\n## What you know about the user\n").append(MemoryStore.formatForPrompt(memories)).append('\n');
        if (!recent.isEmpty()) {
            prompt.append("\n## Recent conversation\n")
                    .append(recent.stream()
                            .map(m -> m.role().name().toLowerCase() + ": " + m.content())
                            .collect(Collectors.joining("\n")))
                    .append('\n');
        }
        return prompt.toString();
    }

    /**
     * Task a lead receives when its proactive run is due and nothing is queued.
     */
    public static String proactiveReview() {
        return "Proactive review: check on your team's mission. Look at your team's status and "
                + "recent reports, decide whether anything needs to be delegated or followed up, "
                + "and brief the user only if something noteworthy changed.";
    }

    static String bootstrap(String mission) {
        return "You have just been set up. Your mission: " + mission
                + "\nGet oriented: plan how to pursue this mission, delegate initial work to your team "
                + "if you have one, and record what you learn.";
    }
}
