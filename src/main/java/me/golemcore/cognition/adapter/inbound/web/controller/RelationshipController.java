package me.golemcore.cognition.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.cognition.domain.model.ErrorKind;
import me.golemcore.cognition.domain.model.OperationResult;
import me.golemcore.cognition.domain.model.RelationshipEvent;
import me.golemcore.cognition.domain.model.RelationshipEvent.EventType;
import me.golemcore.cognition.domain.model.RelationshipPattern;
import me.golemcore.cognition.domain.model.TrustHistoryEntry;
import me.golemcore.cognition.domain.model.TrustMetric;
import me.golemcore.cognition.domain.service.TrustScoringService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Trust tracking endpoints for a single relationship.
 */
@RestController
@RequestMapping("/api/relationships/{relationshipId}")
@RequiredArgsConstructor
public class RelationshipController {

    private final TrustScoringService trustScoringService;

    @PostMapping("/events")
    public Mono<ResponseEntity<TrustResponse>> recordEvent(@PathVariable String relationshipId,
            @RequestBody EventRequest request) {
        if (request == null || request.type() == null || request.trustImpact() == null) {
            throw badRequest("type and trustImpact are required");
        }
        EventType type = parseType(request.type());
        double trust = unwrap(trustScoringService.recordEvent(relationshipId, type, request.trustImpact(),
                request.description(), request.emotionalResponse()));
        return Mono.just(ResponseEntity.ok(new TrustResponse(relationshipId, trust)));
    }

    @PostMapping("/events/{eventId}/resolve")
    public Mono<ResponseEntity<RelationshipEvent>> resolveEvent(@PathVariable String relationshipId,
            @PathVariable String eventId) {
        OperationResult<RelationshipEvent> resolved = trustScoringService.resolveEvent(relationshipId, eventId);
        if (!resolved.isSuccess() && resolved.getErrorKind() == ErrorKind.INVARIANT_VIOLATION) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, resolved.getError());
        }
        return Mono.just(ResponseEntity.ok(unwrap(resolved)));
    }

    @GetMapping("/trust")
    public Mono<ResponseEntity<TrustMetric>> getTrust(@PathVariable String relationshipId) {
        TrustMetric metric = trustScoringService.getTrustMetric(relationshipId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown relationship"));
        return Mono.just(ResponseEntity.ok(metric));
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<List<TrustHistoryEntry>>> getHistory(@PathVariable String relationshipId) {
        return Mono.just(ResponseEntity.ok(unwrap(trustScoringService.getHistory(relationshipId))));
    }

    @GetMapping("/healing")
    public Mono<ResponseEntity<HealingResponse>> getHealing(@PathVariable String relationshipId) {
        return Mono.just(ResponseEntity.ok(
                new HealingResponse(relationshipId, trustScoringService.needsHealing(relationshipId))));
    }

    @PostMapping("/patterns")
    public Mono<ResponseEntity<List<RelationshipPattern>>> learnPatterns(@PathVariable String relationshipId) {
        return Mono.just(ResponseEntity.ok(unwrap(trustScoringService.learnPatterns(relationshipId))));
    }

    @GetMapping("/patterns")
    public Mono<ResponseEntity<List<RelationshipPattern>>> getPatterns(@PathVariable String relationshipId) {
        return Mono.just(ResponseEntity.ok(trustScoringService.getPatterns(relationshipId)));
    }

    private static EventType parseType(String type) {
        try {
            return EventType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw badRequest("Unknown event type: " + type);
        }
    }

    private static <T> T unwrap(OperationResult<T> result) {
        if (result.isSuccess()) {
            return result.getValue();
        }
        HttpStatus status = switch (result.getErrorKind()) {
        case INVARIANT_VIOLATION -> HttpStatus.BAD_REQUEST;
        case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
        default -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        throw new ResponseStatusException(status, result.getError());
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    record EventRequest(String type, Integer trustImpact, String description, String emotionalResponse) {
    }

    record TrustResponse(String relationshipId, double trustLevel) {
    }

    record HealingResponse(String relationshipId, boolean needsHealing) {
    }
}
