package com.evolver.core.llm;

import com.evolver.core.model.ActionPlan;
import com.evolver.core.model.PatchOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}. The {@link ChatClient} fluent chain is mocked.
 */
class LlmServiceTest {

    private ChatClientRequestSpec requestSpec;
    private CallResponseSpec callResponse;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        ChatClient chatClient = mock(ChatClient.class);
        requestSpec = mock(ChatClientRequestSpec.class);
        callResponse = mock(CallResponseSpec.class);

        when(chatClient.prompt()).thenReturn(requestSpec);
        when(requestSpec.system(anyString())).thenReturn(requestSpec);
        when(requestSpec.user(anyString())).thenReturn(requestSpec);
        when(requestSpec.call()).thenReturn(callResponse);

        llmService = new LlmService(chatClient);
    }

    // --- structuredCall ---

    @Test
    @DisplayName("structuredCall sends the system prompt and appends format instructions to the user prompt")
    void structuredCallSendsPrompts() {
        when(callResponse.content()).thenReturn("""
                {"strategyKey":"SYNTAX_ONLY","rationale":"docs only"}
                """);

        llmService.structuredCall("System prompt", "User prompt", StrategyChoice.class);

        verify(requestSpec).system("System prompt");
        ArgumentCaptor<String> userCaptor = ArgumentCaptor.forClass(String.class);
        verify(requestSpec).user(userCaptor.capture());
        String user = userCaptor.getValue();
        assertTrue(user.startsWith("User prompt\n\n"));
        assertTrue(user.length() > "User prompt\n\n".length(), "format instructions should follow the prompt");
    }

    @Test
    @DisplayName("structuredCall deserializes a plan with patches")
    void structuredCallParsesPlan() {
        when(callResponse.content()).thenReturn("""
                {"analysis":"add a helper","patches":[
                  {"operation":"INSERT","filePath":"util.py","content":"def helper():\\n    pass\\n","lineNumber":1}
                ]}
                """);

        ActionPlan plan = llmService.structuredCall("s", "u", ActionPlan.class);

        assertEquals("add a helper", plan.analysis());
        assertEquals(1, plan.patches().size());
        assertEquals(PatchOperation.INSERT, plan.patches().get(0).operation());
        assertEquals("util.py", plan.patches().get(0).filePath());
        assertEquals(1, plan.patches().get(0).lineNumber());
    }

    @Test
    @DisplayName("structuredCall rejects empty content")
    void structuredCallRejectsEmptyContent() {
        when(callResponse.content()).thenReturn("   ");

        var e = assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", StrategyChoice.class));
        assertTrue(e.getMessage().contains("StrategyChoice"));
    }

    @Test
    @DisplayName("structuredCall rejects null content")
    void structuredCallRejectsNullContent() {
        when(callResponse.content()).thenReturn(null);

        assertThrows(LlmEmptyResponseException.class,
                () -> llmService.structuredCall("s", "u", StrategyChoice.class));
    }

    @Test
    @DisplayName("structuredCall raises LlmParseException when neither parser accepts the content")
    void structuredCallFailsOnGarbage() {
        when(callResponse.content()).thenReturn("I would rather not answer in JSON.");

        assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", StrategyChoice.class));
    }

    // --- textCall ---

    @Test
    @DisplayName("textCall returns the stripped answer without format instructions")
    void textCallReturnsStrippedAnswer() {
        when(callResponse.content()).thenReturn("\n  Add retry logic to the fetcher.  \n");

        String text = llmService.textCall("sys", "user");

        assertEquals("Add retry logic to the fetcher.", text);
        verify(requestSpec).user("user");
    }

    @Test
    @DisplayName("textCall rejects blank content")
    void textCallRejectsBlank() {
        when(callResponse.content()).thenReturn("");

        assertThrows(LlmEmptyResponseException.class, () -> llmService.textCall("sys", "user"));
    }

    // --- lenient parsing ---

    @Test
    @DisplayName("parseWithJackson strips fences and accepts snake_case aliases")
    void parseWithJacksonHandlesFencesAndAliases() {
        String fenced = """
                ```json
                {"strategy_key":"DISCARD","rationale":"nothing to do","extra":42}
                ```
                """;

        StrategyChoice choice = llmService.parseWithJackson(fenced, StrategyChoice.class);

        assertEquals("DISCARD", choice.strategyKey());
        assertEquals("nothing to do", choice.rationale());
    }

    @Test
    @DisplayName("parseWithJackson wraps Jackson errors")
    void parseWithJacksonWrapsErrors() {
        var e = assertThrows(LlmParseException.class,
                () -> llmService.parseWithJackson("{not json", StrategyChoice.class));
        assertNotNull(e.getCause());
    }

    @Test
    void stripFencesHandlesAllShapes() {
        assertEquals("{}", LlmService.stripFences("```json\n{}\n```"));
        assertEquals("{}", LlmService.stripFences("```\n{}\n```"));
        assertEquals("{}", LlmService.stripFences("  {}  "));
        assertEquals("{\"a\":1}", LlmService.stripFences("{\"a\":1}```"));
    }
}
