package me.golemcore.negotiation.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.negotiation.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.negotiation.domain.exception.InputQueueFullException;
import me.golemcore.negotiation.domain.exception.InvalidRosterException;
import me.golemcore.negotiation.domain.exception.NoSuchSessionException;
import me.golemcore.negotiation.domain.exception.NotManualParticipantException;
import me.golemcore.negotiation.domain.exception.SessionCancelledException;
import me.golemcore.negotiation.domain.exception.UnknownParticipantException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for negotiation controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.negotiation.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({ NoSuchSessionException.class, UnknownParticipantException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(RuntimeException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler({ InvalidRosterException.class, NotManualParticipantException.class,
            IllegalArgumentException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleBadRequest(RuntimeException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({ InputQueueFullException.class, SessionCancelledException.class,
            IllegalStateException.class })
    public Mono<ResponseEntity<ApiErrorResponse>> handleConflict(RuntimeException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
