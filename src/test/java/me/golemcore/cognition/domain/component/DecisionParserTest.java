package me.golemcore.cognition.domain.component;

import me.golemcore.cognition.domain.model.Decision;
import me.golemcore.cognition.domain.model.DecisionKind;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.Urgency;
import me.golemcore.cognition.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DecisionParserTest {

    private final DecisionParser parser = new DecisionParser(AutoConfiguration.objectMapper());

    @Test
    void shouldParseCompleteDecision() {
        OperationResult<Decision> result = parser.parse("""
                {"decision":"explore_concept","reasoning":"Curious about tides","action":"tides",
                 "shouldContactUser":false,"urgency":"low"}
                """);

        assertTrue(result.isSuccess());
        Decision decision = result.getValue();
        assertEquals(DecisionKind.EXPLORE_CONCEPT, decision.getKind());
        assertEquals("tides", decision.getAction());
        assertEquals(Urgency.LOW, decision.getUrgency());
        assertFalse(decision.isFallback());
    }

    @Test
    void shouldAcceptCodeFencedPayload() {
        OperationResult<Decision> result = parser.parse("""
                ```json
                {"decision":"rest","reasoning":"Tired","action":"sleep","shouldContactUser":false,"urgency":"medium"}
                ```""");

        assertTrue(result.isSuccess());
        assertEquals(DecisionKind.REST, result.getValue().getKind());
        assertEquals(Urgency.MEDIUM, result.getValue().getUrgency());
    }

    @Test
    void shouldRejectMissingField() {
        OperationResult<Decision> result = parser.parse("""
                {"decision":"reflect","reasoning":"r","shouldContactUser":false,"urgency":"low"}
                """);

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.PARSE, result.getErrorKind());
        assertTrue(result.getError().contains("action"));
    }

    @Test
    void shouldRejectUnknownDecisionKind() {
        OperationResult<Decision> result = parser.parse("""
                {"decision":"dance","reasoning":"r","action":"a","shouldContactUser":false,"urgency":"low"}
                """);

        assertEquals(ErrorKind.PARSE, result.getErrorKind());
    }

    @Test
    void shouldRejectNonBooleanContactFlag() {
        OperationResult<Decision> result = parser.parse("""
                {"decision":"reflect","reasoning":"r","action":"a","shouldContactUser":"yes","urgency":"low"}
                """);

        assertEquals(ErrorKind.PARSE, result.getErrorKind());
    }

    @Test
    void shouldRejectUnknownUrgency() {
        OperationResult<Decision> result = parser.parse("""
                {"decision":"reflect","reasoning":"r","action":"a","shouldContactUser":true,"urgency":"critical"}
                """);

        assertEquals(ErrorKind.PARSE, result.getErrorKind());
    }

    @Test
    void shouldRejectNonJsonAndEmptyInput() {
        assertEquals(ErrorKind.PARSE, parser.parse("I think I will rest now").getErrorKind());
        assertEquals(ErrorKind.PARSE, parser.parse("  ").getErrorKind());
        assertEquals(ErrorKind.PARSE, parser.parse("[1,2]").getErrorKind());
    }

    @Test
    void shouldTruncateOverlongReasoning() {
        String reasoning = "x".repeat(DecisionParser.MAX_REASONING_LENGTH + 50);
        OperationResult<Decision> result = parser.parse("{\"decision\":\"reflect\",\"reasoning\":\"" + reasoning
                + "\",\"action\":\"a\",\"shouldContactUser\":false,\"urgency\":\"high\"}");

        assertEquals(DecisionParser.MAX_REASONING_LENGTH, result.getValue().getReasoning().length());
    }
}
