package me.golemcore.cognition.domain.service;

import me.golemcore.cognition.domain.model.AgentState;
import me.golemcore.cognition.domain.model.ContactDecision;
import me.golemcore.cognition.domain.model.SelfQuestion;
import me.golemcore.cognition.domain.model.Urgency;
import me.golemcore.cognition.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Decides whether the agent should reach out to the user on its own.
 *
 * <p>
 * Contact requires both an important open question (pending, priority at least
 * {@code bot.contact.min-question-priority}) and a motivated agent (intensity
 * at least {@code bot.contact.min-motivation-intensity}). Either condition
 * alone is never enough.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContactGate {

    private final SelfQuestionService selfQuestionService;
    private final BotProperties properties;

    public ContactDecision evaluate(AgentState state) {
        BotProperties.ContactProperties config = properties.getContact();
        if (state == null) {
            return ContactDecision.none("No agent state");
        }
        if (state.getMotivationIntensity() < config.getMinMotivationIntensity()) {
            return ContactDecision.none("Motivation intensity " + state.getMotivationIntensity()
                    + " below " + config.getMinMotivationIntensity());
        }

        Optional<SelfQuestion> question = selfQuestionService.findTopPending(config.getMinQuestionPriority());
        if (question.isEmpty()) {
            return ContactDecision.none("No pending question with priority >= " + config.getMinQuestionPriority());
        }

        SelfQuestion q = question.get();
        log.debug("[Contact] Question {} (priority {}) qualifies for contact", q.getId(), q.getPriority());
        return ContactDecision.builder()
                .shouldContact(true)
                .message("I have been thinking about something and would like your view: " + q.getQuestion())
                .reason("Pending question with priority " + q.getPriority() + " while motivation is "
                        + state.getMotivationIntensity())
                .urgency(Urgency.MEDIUM)
                .questionId(q.getId())
                .build();
    }
}
