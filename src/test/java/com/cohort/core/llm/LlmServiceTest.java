package com.cohort.core.llm;

import com.cohort.core.briefing.BriefingDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingManager;
import org.springframework.ai.model.tool.ToolExecutionResult;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the entire {@link ChatClient} chain so no real LLM calls are made.
 */
class LlmServiceTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private ToolCallingManager mockToolCallingManager;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);
        mockToolCallingManager = mock(ToolCallingManager.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockChatClient.prompt(any(Prompt.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.options(any(ChatOptions.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        llmService = new LlmService(mockBuilder, mockToolCallingManager);
    }

    private static ChatResponse textResponse(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    private static ChatResponse toolCallResponse(String toolName, String arguments) {
        var call = new AssistantMessage.ToolCall("call-1", "function", toolName, arguments);
        return new ChatResponse(List.of(new Generation(new AssistantMessage("", Map.of(), List.of(call)))));
    }

    @Nested
    @DisplayName("generate")
    class Generate {

        private final List<Message> history = List.of(new UserMessage("Summarize NVDA"));

        @Test
        @DisplayName("returns the text of a plain answer in one step")
        void plainAnswer() {
            when(mockCallResponse.chatResponse()).thenReturn(textResponse("NVDA grew 20%"));

            LlmResponse response = llmService.generate("system", history, List.of(), 5);

            assertEquals("NVDA grew 20%", response.text());
            assertEquals(1, response.steps());
            assertFalse(response.usedTools());
            verifyNoInteractions(mockToolCallingManager);
        }

        @Test
        @DisplayName("executes requested tools and feeds the results back")
        void executesTools() {
            when(mockCallResponse.chatResponse())
                    .thenReturn(toolCallResponse("getTeamStatus", "{}"))
                    .thenReturn(textResponse("Team is idle"));
            ToolExecutionResult executed = mock(ToolExecutionResult.class);
            when(executed.conversationHistory()).thenReturn(List.of(new UserMessage("Summarize NVDA")));
            when(mockToolCallingManager.executeToolCalls(any(Prompt.class), any(ChatResponse.class)))
                    .thenReturn(executed);

            LlmResponse response = llmService.generate("system", history, List.of(), 5);

            assertEquals("Team is idle", response.text());
            assertEquals(2, response.steps());
            assertEquals(List.of(new LlmResponse.ToolInvocation("getTeamStatus", "{}")), response.toolCalls());
            verify(mockToolCallingManager, times(1)).executeToolCalls(any(Prompt.class), any(ChatResponse.class));
        }

        @Test
        @DisplayName("sends the system prompt first, then the history")
        void promptOrder() {
            when(mockCallResponse.chatResponse()).thenReturn(textResponse("ok"));

            llmService.generate("be brief", history, List.of(), 5);

            ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
            verify(mockChatClient).prompt(captor.capture());
            List<Message> sent = captor.getValue().getInstructions();
            assertEquals(2, sent.size());
            assertEquals("be brief", sent.get(0).getText());
            assertEquals("Summarize NVDA", sent.get(1).getText());
        }

        @Test
        @DisplayName("a model that keeps calling tools hits the step limit")
        void stepLimit() {
            when(mockCallResponse.chatResponse()).thenReturn(toolCallResponse("getTeamStatus", "{}"));
            ToolExecutionResult executed = mock(ToolExecutionResult.class);
            when(executed.conversationHistory()).thenReturn(List.of(new UserMessage("again")));
            when(mockToolCallingManager.executeToolCalls(any(Prompt.class), any(ChatResponse.class)))
                    .thenReturn(executed);

            LlmStepLimitException e = assertThrows(LlmStepLimitException.class,
                    () -> llmService.generate("system", history, List.of(), 3));

            assertEquals(3, e.getMaxSteps());
            verify(mockToolCallingManager, times(2)).executeToolCalls(any(Prompt.class), any(ChatResponse.class));
        }

        @Test
        @DisplayName("a blank final answer is an error")
        void blankAnswer() {
            when(mockCallResponse.chatResponse()).thenReturn(textResponse("   "));

            assertThrows(LlmEmptyResponseException.class,
                    () -> llmService.generate("system", history, List.of(), 5));
        }

        @Test
        @DisplayName("a missing response is an error")
        void missingResponse() {
            when(mockCallResponse.chatResponse()).thenReturn(null);

            assertThrows(LlmEmptyResponseException.class,
                    () -> llmService.generate("system", history, List.of(), 5));
        }
    }

    @Nested
    @DisplayName("generateText")
    class GenerateText {

        @Test
        @DisplayName("returns trimmed text under the token budget")
        void trimmedText() {
            when(mockCallResponse.content()).thenReturn("  On it.  ");

            assertEquals("On it.", llmService.generateText("system", "Research NVDA", 200));

            ArgumentCaptor<ChatOptions> captor = ArgumentCaptor.forClass(ChatOptions.class);
            verify(mockRequestSpec).options(captor.capture());
            assertEquals(200, captor.getValue().getMaxTokens());
        }

        @Test
        @DisplayName("an empty completion is an error")
        void emptyText() {
            when(mockCallResponse.content()).thenReturn("");

            assertThrows(LlmEmptyResponseException.class,
                    () -> llmService.generateText("system", "user", 50));
        }
    }

    @Nested
    @DisplayName("structuredCall")
    class StructuredCall {

        @Test
        @DisplayName("appends format instructions to the user prompt")
        void appendsFormatInstructions() {
            when(mockCallResponse.content()).thenReturn("""
                    {"shouldBrief":false,"title":null,"summary":null,"fullMessage":null}
                    """);

            llmService.structuredCall("System prompt", "User prompt", BriefingDecision.class);

            verify(mockRequestSpec).system("System prompt");
            ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
            verify(mockRequestSpec).user(userCaptor.capture());
            assertTrue(userCaptor.getValue().startsWith("User prompt\n\n"));
            assertTrue(userCaptor.getValue().length() > "User prompt\n\n".length());
        }

        @Test
        @DisplayName("deserializes the response into the target type")
        void deserializes() {
            when(mockCallResponse.content()).thenReturn("""
                    {"shouldBrief":true,"title":"NVDA Q4","summary":"Revenue up","fullMessage":"Details"}
                    """);

            BriefingDecision decision = llmService.structuredCall("s", "u", BriefingDecision.class);

            assertTrue(decision.isComplete());
            assertEquals("NVDA Q4", decision.title());
        }

        @Test
        @DisplayName("unparseable output raises LlmParseException")
        void unparseable() {
            when(mockCallResponse.content()).thenReturn("I think you should brief the user.");

            assertThrows(LlmParseException.class,
                    () -> llmService.structuredCall("s", "u", BriefingDecision.class));
        }

        @Test
        @DisplayName("an empty response raises LlmEmptyResponseException")
        void empty() {
            when(mockCallResponse.content()).thenReturn(null);

            assertThrows(LlmEmptyResponseException.class,
                    () -> llmService.structuredCall("s", "u", BriefingDecision.class));
        }
    }

    @Test
    @DisplayName("stripCodeFence removes markdown fences")
    void stripCodeFence() {
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("```\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.stripCodeFence("  {\"a\":1}  "));
    }
}
