package me.golemcore.contextengine.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.contextengine.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.contextengine.port.outbound.StoreUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps controller failures to {@link ApiErrorResponse} bodies. Request
 * validation is a 400, a context store that stays unavailable after its
 * retries is a 503.
 */
@ControllerAdvice(basePackages = "me.golemcore.contextengine.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return error(status, ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInvalidPackage(IllegalArgumentException ex) {
        log.warn("[API] Rejected request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleStoreUnavailable(StoreUnavailableException ex) {
        log.warn("[API] Context store unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Context store unavailable");
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUnexpected(Exception ex) {
        log.error("[API] Unexpected failure", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static Mono<ResponseEntity<ApiErrorResponse>> error(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
