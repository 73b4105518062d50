package com.cohort.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Every tool an agent can be offered: its wire name, description, argument type and catalog.
 */
public enum ToolName {

    DELEGATE_TO_AGENT("delegateToAgent", ToolCatalog.LEAD, ToolCall.DelegateToAgent.class,
            "Assign a task to a subordinate agent on your team. The subordinate will execute the task and report back."),
    GET_TEAM_STATUS("getTeamStatus", ToolCatalog.LEAD, ToolCall.GetTeamStatus.class,
            "Get the current status of all subordinate agents on your team, including their queued work."),
    CREATE_BRIEFING("createBriefing", ToolCatalog.LEAD, ToolCall.CreateBriefing.class,
            "Send the user a briefing: stored for later lookup, announced in their inbox and added to the conversation."),
    REQUEST_USER_INPUT("requestUserInput", ToolCatalog.LEAD, ToolCall.RequestUserInput.class,
            "Ask the user for feedback or a decision through their inbox and the conversation."),
    LIST_BRIEFINGS("listBriefings", ToolCatalog.LEAD, ToolCall.ListBriefings.class,
            "List previous briefings for this team or aide, newest first."),
    GET_BRIEFING("getBriefing", ToolCatalog.LEAD, ToolCall.GetBriefing.class,
            "Retrieve a single briefing by id, including full content."),
    REPORT_TO_LEAD("reportToLead", ToolCatalog.SUBORDINATE, ToolCall.ReportToLead.class,
            "Send the results of your current task back to your lead. Use this when you have completed or failed a task."),
    REQUEST_INPUT("requestInput", ToolCatalog.SUBORDINATE, ToolCall.RequestInput.class,
            "Ask your lead for clarification or additional input when you need more information to complete a task."),
    ADD_KNOWLEDGE_ITEM("addKnowledgeItem", ToolCatalog.BOTH, ToolCall.AddKnowledgeItem.class,
            "Store a piece of professional knowledge to use in future work sessions."),
    LIST_KNOWLEDGE_ITEMS("listKnowledgeItems", ToolCatalog.BOTH, ToolCall.ListKnowledgeItems.class,
            "List the knowledge items you have stored, optionally filtered by type."),
    REMOVE_KNOWLEDGE_ITEM("removeKnowledgeItem", ToolCatalog.BOTH, ToolCall.RemoveKnowledgeItem.class,
            "Remove one of your knowledge items that is outdated or wrong.");

    private final String wireName;
    private final ToolCatalog catalog;
    private final Class<? extends ToolCall> argumentType;
    private final String description;

    ToolName(String wireName, ToolCatalog catalog, Class<? extends ToolCall> argumentType, String description) {
        this.wireName = wireName;
        this.catalog = catalog;
        this.argumentType = argumentType;
        this.description = description;
    }

    public String wireName() {
        return wireName;
    }

    public ToolCatalog catalog() {
        return catalog;
    }

    public Class<? extends ToolCall> argumentType() {
        return argumentType;
    }

    public String description() {
        return description;
    }

    public static Optional<ToolName> fromWireName(String name) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(name)).findFirst();
    }

    /**
     * The tools offered to a lead or to a subordinate.
     */
    public static List<ToolName> catalogFor(boolean isLead) {
        return Arrays.stream(values()).filter(t -> t.catalog.allows(isLead)).toList();
    }

    /**
     * Decodes JSON arguments into this tool's call record. Blank input counts as {@code {}}.
     */
    public ToolCall decode(String argumentsJson, ObjectMapper mapper) throws JsonProcessingException {
        String json = argumentsJson == null || argumentsJson.isBlank() ? "{}" : argumentsJson;
        return mapper.readValue(json, argumentType);
    }
}
