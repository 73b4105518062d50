package com.cohort.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.model.tool.ToolCallingManager;
import org.springframework.ai.model.tool.ToolExecutionResult;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps Spring AI's {@link ChatClient} for the three kinds of calls agents make:
 * tool-enabled generation over a message history, short plain-text completions
 * and structured (typed) output.
 * <p>
 * Tool execution is driven here rather than inside the chat model so that the number
 * of tool rounds stays bounded per call.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ToolCallingManager toolCallingManager;

    public LlmService(ChatClient.Builder builder, ToolCallingManager toolCallingManager) {
        this.chatClient = builder.build();
        this.toolCallingManager = toolCallingManager;
    }

    /**
     * Runs the model over {@code history} with the given tools, executing requested tool
     * calls and feeding their results back until the model answers with plain text.
     *
     * @param maxSteps maximum number of model calls
     * @throws LlmStepLimitException   if the model still wants tools on the last allowed step
     * @throws LlmEmptyResponseException if the final answer is blank
     */
    public LlmResponse generate(String systemPrompt, List<Message> history, List<ToolCallback> tools, int maxSteps) {
        List<Message> conversation = new ArrayList<>();
        conversation.add(new SystemMessage(systemPrompt));
        conversation.addAll(history);
        ChatOptions options = ToolCallingChatOptions.builder()
                .toolCallbacks(tools)
                .internalToolExecutionEnabled(false)
                .build();

        List<LlmResponse.ToolInvocation> invocations = new ArrayList<>();
        long start = System.currentTimeMillis();
        for (int step = 1; step <= maxSteps; step++) {
            Prompt prompt = new Prompt(conversation, options);
            ChatResponse response = chatClient.prompt(prompt).call().chatResponse();
            if (response == null || response.getResult() == null) {
                throw new LlmEmptyResponseException("LLM returned no generation at step " + step);
            }
            AssistantMessage output = response.getResult().getOutput();
            if (!response.hasToolCalls()) {
                String text = output.getText();
                if (text == null || text.isBlank()) {
                    throw new LlmEmptyResponseException("LLM returned empty content after " + step + " step(s)");
                }
                log.info("LLM generation complete ({} step(s), {} tool call(s), {}ms)",
                        step, invocations.size(), System.currentTimeMillis() - start);
                return new LlmResponse(text, invocations, step);
            }
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                log.debug("Step {}: model requested tool {}", step, call.name());
                invocations.add(new LlmResponse.ToolInvocation(call.name(), call.arguments()));
            }
            if (step == maxSteps) {
                break;
            }
            ToolExecutionResult executed = toolCallingManager.executeToolCalls(prompt, response);
            conversation = new ArrayList<>(executed.conversationHistory());
        }
        log.warn("LLM generation hit the step limit of {}", maxSteps);
        throw new LlmStepLimitException(maxSteps);
    }

    /**
     * Plain completion without tools under a token budget.
     */
    public String generateText(String systemPrompt, String userPrompt, int maxTokens) {
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .options(ChatOptions.builder().maxTokens(maxTokens).build())
                .call()
                .content();
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty text");
        }
        return response.trim();
    }

    /**
     * Sends a system + user prompt to the LLM and returns the response
     * deserialized into the given {@code outputType}.
     * <p>
     * Uses {@link BeanOutputConverter} to append JSON format instructions to the user
     * prompt; falls back to a lenient Jackson parse when the converter rejects the output.
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        log.debug("Structured LLM call started -> {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt + "\n\n" + converter.getFormat())
                .call()
                .content();
        log.debug("Structured LLM call complete -> {} ({}ms)", outputType.getSimpleName(),
                System.currentTimeMillis() - start);
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + outputType.getSimpleName());
        }
        try {
            return converter.convert(response);
        } catch (Exception e) {
            log.warn("Failed to parse LLM response to {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    private <T> T parseWithJackson(String json, Class<T> outputType) {
        try {
            var mapper = new ObjectMapper();
            mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
            mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
            mapper.registerModule(new ParameterNamesModule());
            return mapper.readValue(stripCodeFence(json), outputType);
        } catch (Exception e) {
            log.error("Jackson fallback parsing failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripCodeFence(String text) {
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
