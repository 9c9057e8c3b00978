package com.sporewriter.exception;

import com.sporewriter.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MorphismException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMorphism(MorphismException ex) {
        log.warn("Rejected match: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(MalformedGraphException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleMalformedGraph(MalformedGraphException ex) {
        log.warn("Malformed graph: {}", ex.getMessage());
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return badRequest("Validation failed: " + errors);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleUnreadableBody(ServerWebInputException ex) {
        log.warn("Unreadable request: {}", ex.getReason());
        return badRequest("Invalid request body: " + ex.getReason());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        ErrorResponse error = ErrorResponse.builder()
                .detail("Internal server error: " + ex.getMessage())
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error));
    }

    private Mono<ResponseEntity<ErrorResponse>> badRequest(String detail) {
        ErrorResponse error = ErrorResponse.builder()
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error));
    }
}
