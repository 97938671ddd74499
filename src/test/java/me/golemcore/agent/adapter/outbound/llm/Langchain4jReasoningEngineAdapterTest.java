package me.golemcore.agent.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import me.golemcore.agent.domain.exception.EngineRejectedException;
import me.golemcore.agent.domain.exception.EngineUnavailableException;
import me.golemcore.agent.domain.model.Decision;
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.ReasoningContext;
import me.golemcore.agent.domain.model.ToolDescriptor;
import me.golemcore.agent.domain.model.TurnInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class Langchain4jReasoningEngineAdapterTest {

    private static final String SYSTEM_PROMPT = "You are a test agent.";

    private ChatModel chatModel;
    private Langchain4jReasoningEngineAdapter adapter;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        adapter = new Langchain4jReasoningEngineAdapter(chatModel, new ObjectMapper(), SYSTEM_PROMPT);
    }

    @Test
    void shouldReturnFinalAnswerForPlainText() {
        whenModelReplies(AiMessage.from("  Paris is the capital.  "));

        Decision decision = adapter.decide(context(List.of(memory("input", "Capital of France?"))));

        Decision.FinalAnswer answer = assertInstanceOf(Decision.FinalAnswer.class, decision);
        assertEquals("Paris is the capital.", answer.text());
        assertEquals(Langchain4jReasoningEngineAdapter.ENGINE_ID, adapter.getEngineId());
    }

    @Test
    void shouldReturnToolRequestsWithParsedArguments() {
        whenModelReplies(AiMessage.from(List.of(
                ToolExecutionRequest.builder().id("call-1").name("weather")
                        .arguments("{\"city\":\"Oslo\",\"days\":2}").build(),
                ToolExecutionRequest.builder().id("call-2").name("datetime").arguments("").build())));

        Decision decision = adapter.decide(context(List.of(memory("input", "Weather?"))));

        Decision.ToolRequests requests = assertInstanceOf(Decision.ToolRequests.class, decision);
        assertEquals(2, requests.calls().size());
        assertEquals("call-1", requests.calls().get(0).getId());
        assertEquals("weather", requests.calls().get(0).getName());
        assertEquals("Oslo", requests.calls().get(0).getArguments().get("city"));
        assertEquals(2, requests.calls().get(0).getArguments().get("days"));
        assertTrue(requests.calls().get(1).getArguments().isEmpty());
    }

    @Test
    void shouldRejectMalformedToolArguments() {
        whenModelReplies(AiMessage.from(List.of(
                ToolExecutionRequest.builder().id("c").name("weather").arguments("{not json").build())));

        assertThrows(EngineRejectedException.class, () -> adapter.decide(context(List.of())));
    }

    @Test
    void shouldReturnNeedsInputForMarkedText() {
        whenModelReplies(AiMessage.from("Which city do you mean? [needs-input]"));

        Decision decision = adapter.decide(context(List.of(memory("input", "Weather?"))));

        Decision.NeedsInput needsInput = assertInstanceOf(Decision.NeedsInput.class, decision);
        assertEquals("Which city do you mean?", needsInput.prompt());
    }

    @Test
    void shouldReturnNeedsInputForEmptyText() {
        whenModelReplies(AiMessage.from(" "));

        Decision decision = adapter.decide(context(List.of(memory("input", "?"))));

        assertInstanceOf(Decision.NeedsInput.class, decision);
    }

    @Test
    void shouldRenderMemoryAsTranscript() {
        whenModelReplies(AiMessage.from("done"));
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);

        adapter.decide(context(List.of(
                memory("input", "What time is it?"),
                memory("tool:datetime", "2026-03-01 10:00:00 UTC"),
                memory("error", "[TOOL_FAILURE] oops"),
                memory("answer", "It is ten."))));

        verify(chatModel).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue().messages();
        assertEquals(5, messages.size());
        assertEquals(SYSTEM_PROMPT, assertInstanceOf(SystemMessage.class, messages.get(0)).text());
        assertEquals("What time is it?", assertInstanceOf(UserMessage.class, messages.get(1)).singleText());
        assertEquals("Tool result [datetime]: 2026-03-01 10:00:00 UTC",
                assertInstanceOf(UserMessage.class, messages.get(2)).singleText());
        assertEquals("Error: [TOOL_FAILURE] oops", assertInstanceOf(UserMessage.class, messages.get(3)).singleText());
        assertEquals("It is ten.", assertInstanceOf(AiMessage.class, messages.get(4)).text());
    }

    @Test
    void shouldFallBackToInputWhenMemoryIsEmpty() {
        List<ChatMessage> messages = adapter.convertMessages(context(List.of()));

        assertEquals(2, messages.size());
        assertEquals("hello", assertInstanceOf(UserMessage.class, messages.get(1)).singleText());
    }

    @Test
    void shouldConvertToolDescriptorsToSpecifications() {
        whenModelReplies(AiMessage.from("ok"));
        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        ToolDescriptor weather = ToolDescriptor.builder()
                .name("weather")
                .description("Weather forecast")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "city", Map.of("type", "string", "description", "City name"),
                                "units", Map.of("type", "string", "enum", List.of("metric", "imperial")),
                                "days", Map.of("type", "integer")),
                        "required", List.of("city")))
                .build();

        adapter.decide(ReasoningContext.builder()
                .sessionId("s1")
                .turnNumber(1)
                .input(TurnInput.user("hello"))
                .memory(List.of())
                .tools(List.of(weather, ToolDescriptor.simple("ping", "Ping")))
                .build());

        verify(chatModel).chat(captor.capture());
        List<ToolSpecification> specifications = captor.getValue().toolSpecifications();
        assertEquals(2, specifications.size());
        ToolSpecification spec = specifications.get(0);
        assertEquals("weather", spec.name());
        assertEquals("Weather forecast", spec.description());
        assertEquals(List.of("city"), spec.parameters().required());
        assertEquals(3, spec.parameters().properties().size());
    }

    @Test
    void shouldClassifyTransientModelFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RateLimitException("429"));

        assertThrows(EngineUnavailableException.class, () -> adapter.decide(context(List.of())));
    }

    @Test
    void shouldClassifyRejectedModelFailure() {
        when(chatModel.chat(any(ChatRequest.class))).thenThrow(new InvalidRequestException("bad"));

        assertThrows(EngineRejectedException.class, () -> adapter.decide(context(List.of())));
    }

    private void whenModelReplies(AiMessage message) {
        when(chatModel.chat(any(ChatRequest.class))).thenReturn(ChatResponse.builder().aiMessage(message).build());
    }

    private static ReasoningContext context(List<MemoryEntry> memory) {
        return ReasoningContext.builder()
                .sessionId("s1")
                .turnNumber(1)
                .input(TurnInput.user("hello"))
                .memory(memory)
                .tools(List.of())
                .build();
    }

    private static MemoryEntry memory(String key, String value) {
        return new MemoryEntry("s1", 1, key, value, "s1#1", Instant.EPOCH);
    }
}
