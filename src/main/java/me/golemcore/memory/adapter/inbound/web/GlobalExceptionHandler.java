package me.golemcore.memory.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.memory.domain.exception.ConsolidationAbortedException;
import me.golemcore.memory.domain.exception.MemoryEntityNotFoundException;
import me.golemcore.memory.domain.exception.StorageUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps domain failures to HTTP responses for the memory API.
 */
@ControllerAdvice(basePackages = "me.golemcore.memory.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, ex.getReason());
    }

    @ExceptionHandler(MemoryEntityNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(MemoryEntityNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(ConsolidationAbortedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConsolidationAborted(ConsolidationAbortedException ex) {
        log.warn("[API] Consolidation aborted at watermark {}: {}", ex.getWatermark(), ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStorageUnavailable(StorageUnavailableException ex) {
        log.error("[API] Storage unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Storage unavailable");
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
