package com.cohort.core.tools;

import com.cohort.core.model.KnowledgeItemType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.ai.tool.annotation.ToolParam;

import java.util.Locale;

/**
 * The closed set of tool invocations, one record per tool carrying its typed arguments.
 * {@link ToolName} maps wire names to these types.
 */
public sealed interface ToolCall {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(DelegateToAgent call);
        R visit(GetTeamStatus call);
        R visit(CreateBriefing call);
        R visit(RequestUserInput call);
        R visit(ListBriefings call);
        R visit(GetBriefing call);
        R visit(ReportToLead call);
        R visit(RequestInput call);
        R visit(AddKnowledgeItem call);
        R visit(ListKnowledgeItems call);
        R visit(RemoveKnowledgeItem call);
    }

    // ── Lead ─────────────────────────────────────────────────────────────

    record DelegateToAgent(
        @ToolParam(description = "The id of the subordinate agent to delegate the task to") String agentId,
        @ToolParam(description = "A clear description of the task for the subordinate to complete") String task
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record GetTeamStatus() implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record CreateBriefing(
        @ToolParam(description = "A concise, specific title for the briefing") String title,
        @ToolParam(description = "A one or two sentence summary for the inbox notification") String summary,
        @ToolParam(description = "The full briefing content for the user") String fullMessage
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RequestUserInput(
        @ToolParam(description = "A concise title for the feedback request") String title,
        @ToolParam(description = "A brief summary for the inbox notification (1-2 sentences)") String summary,
        @ToolParam(description = "The full message content to be added to the conversation") String fullMessage
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ListBriefings(
        @ToolParam(description = "Optional search text matched against briefing title or summary", required = false)
        String query,
        @ToolParam(description = "Maximum number of briefings to return (default: 20)", required = false)
        Integer limit
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record GetBriefing(
        @ToolParam(description = "The briefing id to retrieve") String briefingId
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ── Subordinate ──────────────────────────────────────────────────────

    enum ReportStatus {
        SUCCESS,
        FAILURE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static ReportStatus fromWire(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    record ReportToLead(
        @ToolParam(description = "A detailed description of the task result or the reason for failure") String result,
        @ToolParam(description = "Whether the task was completed successfully (success) or failed (failure)")
        ReportStatus status
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RequestInput(
        @ToolParam(description = "The question or clarification you need from your lead") String question
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    // ── Both ─────────────────────────────────────────────────────────────

    record AddKnowledgeItem(
        @ToolParam(description = "fact (domain knowledge), technique (how to do something), "
                + "pattern (observed trend) or lesson (learning from experience)") KnowledgeItemType type,
        @ToolParam(description = "The knowledge item content to store") String content,
        @ToolParam(description = "Confidence level from 0 to 1", required = false) Double confidence
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record ListKnowledgeItems(
        @ToolParam(description = "Only return items of this type", required = false) KnowledgeItemType type,
        @ToolParam(description = "Maximum number of items to return (default: 20)", required = false) Integer limit
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    record RemoveKnowledgeItem(
        @ToolParam(description = "The id of the knowledge item to remove") String knowledgeItemId
    ) implements ToolCall {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
