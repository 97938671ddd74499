package me.golemcore.agent.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.exception.EngineRejectedException;
import me.golemcore.agent.domain.model.Decision;
import me.golemcore.agent.domain.model.MemoryEntry;
import me.golemcore.agent.domain.model.ReasoningContext;
import me.golemcore.agent.domain.model.ToolCall;
import me.golemcore.agent.domain.model.ToolDescriptor;
import me.golemcore.agent.domain.model.TurnInput;
import me.golemcore.agent.port.outbound.ReasoningEnginePort;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Reasoning engine backed by any langchain4j {@link ChatModel}.
 *
 * <p>
 * The memory window is rendered as a chat transcript: inputs become user
 * messages, answers and questions become assistant messages, tool results and
 * errors are fed back as user messages tagged with their key. Tool descriptors
 * are converted to {@link ToolSpecification}s.
 *
 * <p>
 * The model's reply maps onto a {@link Decision}:
 * <ul>
 * <li>tool execution requests - {@link Decision.ToolRequests}</li>
 * <li>text ending with {@value #NEEDS_INPUT_MARKER}, or no text at all -
 * {@link Decision.NeedsInput}</li>
 * <li>any other text - {@link Decision.FinalAnswer}</li>
 * </ul>
 */
@Slf4j
public class Langchain4jReasoningEngineAdapter implements ReasoningEnginePort {

    public static final String ENGINE_ID = "langchain4j";
    public static final String NEEDS_INPUT_MARKER = "[needs-input]";
    static final String DEFAULT_INPUT_PROMPT = "Please provide more details to continue.";

    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final String systemPrompt;

    public Langchain4jReasoningEngineAdapter(ChatModel chatModel, ObjectMapper objectMapper, String systemPrompt) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public String getEngineId() {
        return ENGINE_ID;
    }

    @Override
    public Decision decide(ReasoningContext context) {
        List<ChatMessage> messages = convertMessages(context);
        List<ToolSpecification> tools = convertTools(context.getTools());

        ChatResponse response;
        try {
            ChatRequest.Builder request = ChatRequest.builder().messages(messages);
            if (!tools.isEmpty()) {
                request.toolSpecifications(tools);
            }
            log.trace("[Engine] Calling model with {} messages, {} tools", messages.size(), tools.size());
            response = chatModel.chat(request.build());
        } catch (RuntimeException e) {
            throw EngineErrorClassifier.toAgentException(e);
        }
        return convertResponse(response);
    }

    List<ChatMessage> convertMessages(ReasoningContext context) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        boolean hasConversation = false;
        List<MemoryEntry> memory = context.getMemory() != null ? context.getMemory() : List.of();
        for (MemoryEntry entry : memory) {
            ChatMessage message = toChatMessage(entry);
            if (message != null) {
                messages.add(message);
                hasConversation = true;
            }
        }
        if (!hasConversation) {
            TurnInput input = context.getInput();
            String text = input != null && input.text() != null ? input.text() : "Continue.";
            messages.add(UserMessage.from(text));
        }
        return messages;
    }

    private ChatMessage toChatMessage(MemoryEntry entry) {
        String value = entry.getValue() != null ? entry.getValue() : "";
        String key = entry.getKey();
        if (MemoryEntry.KEY_INPUT.equals(key)) {
            return value.isBlank() ? null : UserMessage.from(value);
        }
        if (MemoryEntry.KEY_ANSWER.equals(key) || MemoryEntry.KEY_NEEDS_INPUT.equals(key)) {
            return value.isBlank() ? null : AiMessage.from(value);
        }
        if (entry.isToolResult()) {
            String toolName = key.substring(MemoryEntry.TOOL_KEY_PREFIX.length());
            return UserMessage.from("Tool result [" + toolName + "]: " + value);
        }
        if (MemoryEntry.KEY_ERROR.equals(key)) {
            return UserMessage.from("Error: " + value);
        }
        return UserMessage.from(key + ": " + value);
    }

    private List<ToolSpecification> convertTools(List<ToolDescriptor> descriptors) {
        if (descriptors == null || descriptors.isEmpty()) {
            return Collections.emptyList();
        }
        return descriptors.stream()
                .map(this::convertToolDescriptor)
                .toList();
    }

    @SuppressWarnings("unchecked")
    private ToolSpecification convertToolDescriptor(ToolDescriptor tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties
                && !properties.isEmpty()) {
            JsonObjectSchema.Builder schemaBuilder = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                schemaBuilder.addProperty(String.valueOf(entry.getKey()),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                schemaBuilder.required((List<String>) required);
            }
            builder.parameters(schemaBuilder.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = (String) paramSchema.get("type");
        String description = (String) paramSchema.get("description");
        List<Object> enumValues = (List<Object>) paramSchema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(String::valueOf).toList())
                    .description(description)
                    .build();
        }

        String effectiveType = type != null ? type : "string";
        switch (effectiveType) {
        case "integer":
            return JsonIntegerSchema.builder().description(description).build();
        case "number":
            return JsonNumberSchema.builder().description(description).build();
        case "boolean":
            return JsonBooleanSchema.builder().description(description).build();
        case "array": {
            JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description);
            Object items = paramSchema.get("items");
            builder.items(items instanceof Map
                    ? toJsonSchemaElement((Map<String, Object>) items)
                    : JsonStringSchema.builder().build());
            return builder.build();
        }
        case "object": {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    builder.addProperty(String.valueOf(entry.getKey()),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            return builder.build();
        }
        default:
            return JsonStringSchema.builder().description(description).build();
        }
    }

    Decision convertResponse(ChatResponse response) {
        AiMessage aiMessage = response != null ? response.aiMessage() : null;
        if (aiMessage == null) {
            throw new EngineRejectedException("Model returned no assistant message");
        }

        if (aiMessage.hasToolExecutionRequests()) {
            List<ToolCall> calls = aiMessage.toolExecutionRequests().stream()
                    .map(this::toToolCall)
                    .toList();
            log.trace("[Engine] Parsed {} tool calls from response", calls.size());
            return Decision.toolRequests(calls);
        }

        String text = aiMessage.text();
        if (text == null || text.isBlank()) {
            return Decision.needsInput(DEFAULT_INPUT_PROMPT);
        }
        String trimmed = text.strip();
        if (trimmed.endsWith(NEEDS_INPUT_MARKER)) {
            String prompt = trimmed.substring(0, trimmed.length() - NEEDS_INPUT_MARKER.length()).strip();
            return Decision.needsInput(prompt.isEmpty() ? DEFAULT_INPUT_PROMPT : prompt);
        }
        return Decision.finalAnswer(trimmed);
    }

    private ToolCall toToolCall(ToolExecutionRequest request) {
        String id = request.id() != null && !request.id().isBlank()
                ? request.id()
                : "call_" + UUID.randomUUID().toString().substring(0, 8);
        return ToolCall.builder()
                .id(id)
                .name(request.name())
                .arguments(parseJsonArgs(request.name(), request.arguments()))
                .build();
    }

    private Map<String, Object> parseJsonArgs(String toolName, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, MAP_TYPE_REF);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (Exception e) {
            throw new EngineRejectedException("Malformed arguments for tool call " + toolName + ": "
                    + e.getMessage(), e);
        }
    }
}
