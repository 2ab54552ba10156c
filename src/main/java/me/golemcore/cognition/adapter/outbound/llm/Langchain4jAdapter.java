package me.golemcore.cognition.adapter.outbound.llm;

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

import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.LlmResponse;
import me.golemcore.cognition.domain.model.LlmUsage;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * LLM adapter using the langchain4j library.
 *
 * <p>
 * Supports two API flavours, chosen by {@code bot.llm.api-type}:
 * <ul>
 * <li>{@code openai} - OpenAI or any OpenAI-compatible endpoint; structured
 * output is requested through a strict JSON schema response format
 * <li>{@code anthropic} - Claude models; the schema is appended to the system
 * prompt instead
 * </ul>
 *
 * <p>
 * Each call is a single attempt. The library's own retries are disabled so
 * that timeouts and backoff stay under the control of the invocation service.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 *
 * @see LlmProviderAdapter
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final String API_TYPE_ANTHROPIC = "anthropic";
    private static final String SCHEMA_KEY_PROPERTIES = "properties";
    private static final String SCHEMA_KEY_REQUIRED = "required";

    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }

        BotProperties.LlmProperties llm = properties.getLlm();
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("[LLM] No API key configured for langchain4j adapter, calls will fail");
            return;
        }

        try {
            this.chatModel = isAnthropic() ? createAnthropicModel(llm) : createOpenAiModel(llm);
            initialized = true;
            log.info("[LLM] Langchain4j adapter initialized: apiType={}, model={}", llm.getApiType(), llm.getModel());
        } catch (RuntimeException e) {
            log.warn("[LLM] Failed to initialize langchain4j adapter: {}", e.getMessage());
        }
    }

    private boolean isAnthropic() {
        return API_TYPE_ANTHROPIC.equalsIgnoreCase(properties.getLlm().getApiType());
    }

    private Duration requestTimeout() {
        return properties.getInvocation().getTimeout();
    }

    private ChatModel createAnthropicModel(BotProperties.LlmProperties llm) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(requestTimeout());

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(BotProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .temperature(llm.getTemperature())
                .maxTokens(llm.getMaxTokens())
                .supportedCapabilities(Set.of(Capability.RESPONSE_FORMAT_JSON_SCHEMA))
                .strictJsonSchema(true)
                .timeout(requestTimeout());

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public String getCurrentModel() {
        return properties.getLlm().getModel();
    }

    @Override
    public boolean isAvailable() {
        return initialized && chatModel != null;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            ChatRequest.Builder builder = ChatRequest.builder()
                    .messages(convertMessages(request));

            if (request.getResponseSchema() != null && !isAnthropic()) {
                builder.responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(JsonSchema.builder()
                                .name(request.getSchemaName() != null ? request.getSchemaName() : "response")
                                .rootElement(toJsonSchemaElement(request.getResponseSchema()))
                                .build())
                        .build());
            }
            if (request.getTemperature() != null) {
                builder.temperature(request.getTemperature());
            }
            if (request.getMaxTokens() != null) {
                builder.maxOutputTokens(request.getMaxTokens());
            }

            log.trace("[LLM] Calling {} with schema {}", getCurrentModel(), request.getSchemaName());
            ChatResponse response = chatModel.chat(builder.build());
            return convertResponse(response);
        });
    }

    private List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        String systemPrompt = request.getSystemPrompt();
        if (request.getResponseSchema() != null && isAnthropic()) {
            systemPrompt = (systemPrompt != null ? systemPrompt + "\n\n" : "")
                    + "Respond with a single JSON object matching this schema and nothing else:\n"
                    + schemaAsText(request.getResponseSchema());
        }
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(request.getUserPrompt() != null ? request.getUserPrompt() : ""));
        return messages;
    }

    private String schemaAsText(Map<String, Object> schema) {
        try {
            return objectMapper.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            return String.valueOf(schema);
        }
    }

    @SuppressWarnings("unchecked")
    private JsonSchemaElement toJsonSchemaElement(Map<String, Object> schema) {
        String type = (String) schema.get("type");
        String description = (String) schema.get("description");
        List<String> enumValues = (List<String>) schema.get("enum");

        if (enumValues != null && !enumValues.isEmpty()) {
            JsonEnumSchema.Builder builder = JsonEnumSchema.builder().enumValues(enumValues);
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }

        if (type == null) {
            type = "string";
        }

        switch (type) {
        case "integer" -> {
            JsonIntegerSchema.Builder builder = JsonIntegerSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "number" -> {
            JsonNumberSchema.Builder builder = JsonNumberSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "boolean" -> {
            JsonBooleanSchema.Builder builder = JsonBooleanSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        case "array" -> {
            JsonArraySchema.Builder builder = JsonArraySchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            if (schema.containsKey("items")) {
                builder.items(toJsonSchemaElement((Map<String, Object>) schema.get("items")));
            }
            return builder.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            if (schema.containsKey(SCHEMA_KEY_PROPERTIES)) {
                Map<String, Object> nested = (Map<String, Object>) schema.get(SCHEMA_KEY_PROPERTIES);
                for (Map.Entry<String, Object> entry : nested.entrySet()) {
                    builder.addProperty(entry.getKey(), toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            if (schema.containsKey(SCHEMA_KEY_REQUIRED)) {
                builder.required((List<String>) schema.get(SCHEMA_KEY_REQUIRED));
            }
            builder.additionalProperties(false);
            return builder.build();
        }
        default -> {
            JsonStringSchema.Builder builder = JsonStringSchema.builder();
            if (description != null && !description.isBlank()) {
                builder.description(description);
            }
            return builder.build();
        }
        }
    }

    private LlmResponse convertResponse(ChatResponse response) {
        LlmUsage usage = null;
        if (response.tokenUsage() != null) {
            usage = LlmUsage.builder()
                    .inputTokens(response.tokenUsage().inputTokenCount())
                    .outputTokens(response.tokenUsage().outputTokenCount())
                    .totalTokens(response.tokenUsage().totalTokenCount())
                    .build();
        }

        return LlmResponse.builder()
                .content(response.aiMessage().text())
                .usage(usage)
                .model(getCurrentModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : "stop")
                .build();
    }
}
