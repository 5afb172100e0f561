package dev.blogpress.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PassInProgressException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handlePassInProgress(PassInProgressException ex, ServerWebExchange exchange) {
        log.warn("Publishing pass rejected: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.CONFLICT, ex.getMessage(), exchange));
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Mono<ErrorResponse> handleIllegalState(IllegalStateException ex, ServerWebExchange exchange) {
        log.warn("Service unavailable: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), exchange));
    }

    @ExceptionHandler(RuntimeException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleRuntimeException(RuntimeException ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}: {}", exchange.getRequest().getPath().value(), ex.getMessage(), ex);
        // Don't expose internal error details
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", exchange));
    }

    private ErrorResponse build(HttpStatus status, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }
}
