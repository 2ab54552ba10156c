package me.golemcore.cognition.domain.component;

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

import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.DecisionKind;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.Urgency;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Strict parser for the decision payload returned by the model.
 *
 * <p>
 * Accepts a single JSON object, optionally wrapped in a markdown code fence,
 * with all of {@code decision}, {@code reasoning}, {@code action},
 * {@code shouldContactUser} and {@code urgency}. A missing field, a wrong type
 * or an unknown decision kind or urgency is a {@link ErrorKind#PARSE} failure.
 */
@Component
public class DecisionParser {

    static final int MAX_REASONING_LENGTH = 1000;
    static final int MAX_ACTION_LENGTH = 500;

    private final ObjectMapper objectMapper;

    public DecisionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OperationResult<Decision> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return parseError("empty response");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJson(raw));
        } catch (JsonProcessingException e) {
            return parseError("not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return parseError("expected a JSON object");
        }

        Optional<String> kindText = text(root, "decision");
        if (kindText.isEmpty()) {
            return parseError("missing 'decision'");
        }
        Optional<DecisionKind> kind = DecisionKind.fromWireName(kindText.get());
        if (kind.isEmpty()) {
            return parseError("unknown decision '" + kindText.get() + "'");
        }

        Optional<String> reasoning = text(root, "reasoning");
        if (reasoning.isEmpty()) {
            return parseError("missing 'reasoning'");
        }
        Optional<String> action = text(root, "action");
        if (action.isEmpty()) {
            return parseError("missing 'action'");
        }

        JsonNode contact = root.get("shouldContactUser");
        if (contact == null || !contact.isBoolean()) {
            return parseError("'shouldContactUser' must be a boolean");
        }

        Optional<String> urgencyText = text(root, "urgency");
        if (urgencyText.isEmpty()) {
            return parseError("missing 'urgency'");
        }
        Optional<Urgency> urgency = Urgency.fromWireName(urgencyText.get());
        if (urgency.isEmpty()) {
            return parseError("unknown urgency '" + urgencyText.get() + "'");
        }

        return OperationResult.success(Decision.builder()
                .kind(kind.get())
                .reasoning(truncate(reasoning.get(), MAX_REASONING_LENGTH))
                .action(truncate(action.get(), MAX_ACTION_LENGTH))
                .shouldContactUser(contact.booleanValue())
                .urgency(urgency.get())
                .fallback(false)
                .build());
    }

    /**
     * Strip a surrounding markdown code fence, if any.
     */
    public static String extractJson(String raw) {
        String trimmed = raw.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closingFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closingFence > firstNewline) {
                trimmed = trimmed.substring(firstNewline + 1, closingFence).trim();
            }
        }
        return trimmed;
    }

    private static Optional<String> text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText().trim());
    }

    private static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }

    private static OperationResult<Decision> parseError(String message) {
        return OperationResult.failure(ErrorKind.PARSE, "Invalid decision: " + message);
    }
}
