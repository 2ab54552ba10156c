package me.golemcore.cognition.domain.service;

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

import me.golemcore.cognition.domain.component.DecisionParser;
import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.CallClass;
import me.golemcore.cognition.domain.model.ConceptNode;
import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.DecisionContext;
import me.golemcore.cognition.domain.model.DecisionKind;
import me.golemcore.cognition.domain.model.DecisionRecord;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.LlmRequest;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.Reflection;
import me.golemcore.cognition.domain.model.SelfQuestion;
import me.golemcore.cognition.domain.model.Urgency;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Asks the model what the agent should do next.
 *
 * <p>
 * The request carries a snapshot of the agent: current state, recently
 * reinforced concepts, top pending self-questions and the latest reflections.
 * The reply must match the decision schema; anything else (timeout, throttling,
 * transport error, malformed output) yields the fallback decision
 * {@code integrate_knowledge / continue_learning}. Every decision is written
 * to the audit trail before it is returned.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class DecisionService {

    static final String FALLBACK_ACTION = "continue_learning";
    static final String SCHEMA_NAME = "cognitive_decision";

    private static final String SYSTEM_PROMPT = """
            You are the inner voice of an autonomous conversational agent that keeps thinking \
            between conversations. Each cycle you choose exactly one next step for yourself.

            Allowed decisions:
            - explore_concept: dig into a concept; put the concept name in "action"
            - reflect: reflect on recent experiences; put the topic in "action"
            - integrate_knowledge: connect what you already know
            - ask_question: formulate a question you want answered; put it in "action"
            - change_state: switch mode; "action" names the new mode \
            (thinking, reflecting, exploring, sleeping, awake)
            - rest: pause and let memories settle
            - initiate_contact: you want to talk to the user

            Set shouldContactUser only when something is genuinely worth the user's attention.
            Answer with JSON only.""";

    private final LlmInvocationService invoker;
    private final DecisionParser parser;
    private final DecisionAuditService auditService;
    private final KnowledgeGraphService knowledgeGraphService;
    private final SelfQuestionService selfQuestionService;
    private final JournalService journalService;
    private final BotProperties properties;
    private final Clock clock;

    public DecisionService(LlmInvocationService invoker, DecisionParser parser,
            DecisionAuditService auditService, KnowledgeGraphService knowledgeGraphService,
            SelfQuestionService selfQuestionService, JournalService journalService,
            BotProperties properties, Clock clock) {
        this.invoker = invoker;
        this.parser = parser;
        this.auditService = auditService;
        this.knowledgeGraphService = knowledgeGraphService;
        this.selfQuestionService = selfQuestionService;
        this.journalService = journalService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Decide the next action. Never throws and never returns {@code null}.
     */
    public Decision decide(AgentState state) {
        DecisionContext context = buildContext(state);
        OperationResult<Decision> result;
        try {
            result = invoker.invoke(buildRequest(context), CallClass.EPHEMERAL, parser::parse);
        } catch (RuntimeException e) {
            log.error("[Decision] Unexpected failure while deciding", e);
            result = OperationResult.failure(ErrorKind.TRANSIENT_IO, e.getMessage());
        }

        Decision decision;
        if (result.isSuccess()) {
            decision = result.getValue();
            log.info("[Decision] {} -> {} (contact={}, urgency={})", decision.getKind().getWireName(),
                    decision.getAction(), decision.isShouldContactUser(), decision.getUrgency().getWireName());
        } else {
            decision = fallback(result.getErrorKind().name().toLowerCase(Locale.ROOT), result.getError());
            log.warn("[Decision] Falling back to {}: {} {}", FALLBACK_ACTION, result.getErrorKind(),
                    result.getError());
        }

        audit(decision, context, result);
        return decision;
    }

    public DecisionContext buildContext(AgentState state) {
        BotProperties.CognitionProperties config = properties.getCognition();
        return DecisionContext.builder()
                .state(state)
                .concepts(knowledgeGraphService.getRecentConcepts(config.getRecentConcepts()))
                .questions(selfQuestionService.getPendingByPriority(config.getPendingQuestions()))
                .reflections(journalService.getRecentReflections(config.getRecentReflections()))
                .build();
    }

    LlmRequest buildRequest(DecisionContext context) {
        return LlmRequest.builder()
                .systemPrompt(SYSTEM_PROMPT)
                .userPrompt(renderContext(context))
                .schemaName(SCHEMA_NAME)
                .responseSchema(decisionSchema())
                .temperature(properties.getLlm().getTemperature())
                .build();
    }

    static Decision fallback(String cause, String detail) {
        String reasoning = "fallback: " + cause + (detail != null ? " (" + detail + ")" : "");
        return Decision.builder()
                .kind(DecisionKind.INTEGRATE_KNOWLEDGE)
                .reasoning(AgentStateService.truncate(reasoning, AgentStateService.MAX_THOUGHT_LENGTH))
                .action(FALLBACK_ACTION)
                .shouldContactUser(false)
                .urgency(Urgency.LOW)
                .fallback(true)
                .build();
    }

    private String renderContext(DecisionContext context) {
        AgentState state = context.getState();
        StringBuilder sb = new StringBuilder();
        sb.append("## Current state\n")
                .append("- mode: ").append(state.getMode().name().toLowerCase(Locale.ROOT)).append('\n')
                .append("- motivation: ").append(state.getMotivation())
                .append(" (intensity ").append(state.getMotivationIntensity()).append("/10)\n")
                .append("- autonomy: ").append(state.getAutonomyLevel()).append("/10\n")
                .append("- last thought: ").append(state.getLastThought() != null ? state.getLastThought() : "-")
                .append("\n\n");

        sb.append("## Recent concepts\n");
        if (context.getConcepts().isEmpty()) {
            sb.append("- none yet\n");
        }
        for (ConceptNode concept : context.getConcepts()) {
            sb.append("- ").append(concept.getName())
                    .append(" (confidence ").append(concept.getConfidence()).append(")\n");
        }

        sb.append("\n## Pending questions\n");
        if (context.getQuestions().isEmpty()) {
            sb.append("- none\n");
        }
        for (SelfQuestion question : context.getQuestions()) {
            sb.append("- [").append(question.getPriority()).append("] ").append(question.getQuestion()).append('\n');
        }

        sb.append("\n## Recent reflections\n");
        if (context.getReflections().isEmpty()) {
            sb.append("- none\n");
        }
        for (Reflection reflection : context.getReflections()) {
            sb.append("- ").append(reflection.getTopic()).append(": ").append(reflection.getContent()).append('\n');
        }

        sb.append("\nWhat do you do next?");
        return sb.toString();
    }

    static Map<String, Object> decisionSchema() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("decision", Map.of(
                "type", "string",
                "enum", Arrays.stream(DecisionKind.values()).map(DecisionKind::getWireName).toList()));
        fields.put("reasoning", Map.of("type", "string", "description", "Why this step, one or two sentences"));
        fields.put("action", Map.of("type", "string", "description", "Concrete subject of the step"));
        fields.put("shouldContactUser", Map.of("type", "boolean"));
        fields.put("urgency", Map.of(
                "type", "string",
                "enum", Arrays.stream(Urgency.values()).map(Urgency::getWireName).toList()));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", fields);
        schema.put("required", List.of("decision", "reasoning", "action", "shouldContactUser", "urgency"));
        return schema;
    }

    private void audit(Decision decision, DecisionContext context, OperationResult<Decision> result) {
        try {
            auditService.record(DecisionRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .kind(decision.getKind())
                    .reasoning(decision.getReasoning())
                    .action(decision.getAction())
                    .shouldContactUser(decision.isShouldContactUser())
                    .urgency(decision.getUrgency())
                    .fallback(decision.isFallback())
                    .errorKind(result.isSuccess() ? null : result.getErrorKind())
                    .error(result.isSuccess() ? null : result.getError())
                    .mode(context.getState().getMode())
                    .conceptsInContext(context.getConcepts().size())
                    .questionsInContext(context.getQuestions().size())
                    .reflectionsInContext(context.getReflections().size())
                    .timestamp(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Decision] Audit failed: {}", e.getMessage());
        }
    }
}
