package com.cohort.core.llm;

import java.util.List;

/**
 * Final answer of a tool-enabled generation.
 *
 * @param text      the assistant's final text
 * @param toolCalls every tool call the model made on the way, in order
 * @param steps     number of model calls it took
 */
public record LlmResponse(
    String text,
    List<ToolInvocation> toolCalls,
    int steps
) {

    public LlmResponse {
        toolCalls = List.copyOf(toolCalls);
    }

    public boolean usedTools() {
        return !toolCalls.isEmpty();
    }

    public record ToolInvocation(String name, String arguments) {}
}
