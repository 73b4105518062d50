package com.cohort.core.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.util.json.schema.JsonSchemaGenerator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Exposes an agent's tool catalog to the chat model as Spring AI {@link ToolCallback}s.
 * Each callback is bound to the calling agent's {@link ToolContext}.
 */
@Component
public class AgentToolCallbacks {

    private final ToolDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    public AgentToolCallbacks(ToolDispatcher dispatcher, ObjectMapper objectMapper) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
    }

    public List<ToolCallback> forAgent(ToolContext context) {
        return ToolName.catalogFor(context.isLead()).stream()
                .<ToolCallback>map(tool -> new BoundToolCallback(tool, context))
                .toList();
    }

    private final class BoundToolCallback implements ToolCallback {

        private final ToolName tool;
        private final ToolContext context;
        private final ToolDefinition definition;

        BoundToolCallback(ToolName tool, ToolContext context) {
            this.tool = tool;
            this.context = context;
            this.definition = ToolDefinition.builder()
                    .name(tool.wireName())
                    .description(tool.description())
                    .inputSchema(JsonSchemaGenerator.generateForType(tool.argumentType()))
                    .build();
        }

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            ToolResult result = dispatcher.dispatch(tool, toolInput, context);
            try {
                return objectMapper.writeValueAsString(result);
            } catch (JsonProcessingException e) {
                return "{\"success\":false,\"error\":\"Could not serialize result of " + tool.wireName() + "\"}";
            }
        }
    }
}
