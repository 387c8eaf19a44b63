package com.techStack.accessSys.handler;

import com.techStack.accessSys.dto.response.ApiResponse;
import com.techStack.accessSys.dto.response.ErrorCode;
import com.techStack.accessSys.exception.authorization.CeilingViolationException;
import com.techStack.accessSys.exception.authorization.CycleDetectedException;
import com.techStack.accessSys.exception.service.CustomException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global Exception Handler
 *
 * Maps write-path failures to ApiResponse error bodies. Decision endpoints never
 * reach this for evaluation failures; those come back as deny decisions.
 */
@Slf4j
@RestControllerAdvice
@Order(Ordered.HIGHEST_PRECEDENCE)
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final Clock clock;

    /* =========================
       Domain Exceptions
       ========================= */

    @ExceptionHandler(CeilingViolationException.class)
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> handleCeilingViolation(
            CeilingViolationException ex, ServerWebExchange exchange) {

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tenantId", ex.getTenantId());
        details.put("capability", ex.getCapability());
        details.put("action", ex.getAction());

        log.warn("🚫 {} {} rejected: {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), ex.getMessage());
        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(ApiResponse.error(ex.getMessage(), ex.getCode(), details, clock.instant())));
    }

    @ExceptionHandler(CycleDetectedException.class)
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> handleCycle(
            CycleDetectedException ex, ServerWebExchange exchange) {

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", ex.getKind());
        details.put("startId", ex.getStartId());
        details.put("repeatedId", ex.getRepeatedId());

        log.warn("🚫 {} {} rejected: {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), ex.getMessage());
        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(ApiResponse.error(ex.getMessage(), ex.getCode(), details, clock.instant())));
    }

    @ExceptionHandler(CustomException.class)
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> handleCustomException(
            CustomException ex, ServerWebExchange exchange) {

        String code = ex.getCode() != null ? ex.getCode() : codeFor(ex.getStatus());
        Map<String, Object> details = ex.getField() == null ? null : Map.of("field", ex.getField());

        if (ex.getStatus().is5xxServerError()) {
            log.error("❌ {} {} failed: {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(),
                    ex.getMessage(), ex);
        } else {
            log.warn("⚠️ {} {} rejected: {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(),
                    ex.getMessage());
        }
        return Mono.just(ResponseEntity.status(ex.getStatus())
                .body(ApiResponse.error(ex.getMessage(), code, details, clock.instant())));
    }

    /* =========================
       Request Validation
       ========================= */

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ApiResponse<Map<String, Object>>>> handleBindException(WebExchangeBindException ex) {
        Map<String, Object> errors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }
        log.debug("Request validation failed: {}", errors);
        return Mono.just(ResponseEntity.badRequest()
                .body(ApiResponse.error("Request validation failed", ErrorCode.VALIDATION_ERROR.getCode(),
                        errors, clock.instant())));
    }

    @ExceptionHandler({ServerWebInputException.class, IllegalArgumentException.class})
    public Mono<ResponseEntity<ApiResponse<Void>>> handleBadInput(Exception ex) {
        String message = ex instanceof ServerWebInputException input && input.getReason() != null
                ? input.getReason() : ex.getMessage();
        log.debug("Bad request: {}", message);
        return Mono.just(ResponseEntity.badRequest()
                .body(ApiResponse.error(message, ErrorCode.VALIDATION_ERROR.getCode(), clock.instant())));
    }

    /* =========================
       Fallback
       ========================= */

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiResponse<Void>>> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("❌ Unexpected error on {} {}: {}", exchange.getRequest().getMethod(),
                exchange.getRequest().getPath(), ex.getMessage(), ex);
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred", ErrorCode.UNEXPECTED_ERROR.getCode(),
                        clock.instant())));
    }

    private static String codeFor(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> ErrorCode.RESOURCE_NOT_FOUND.getCode();
            case BAD_REQUEST, UNPROCESSABLE_ENTITY -> ErrorCode.VALIDATION_ERROR.getCode();
            case SERVICE_UNAVAILABLE -> ErrorCode.SERVICE_UNAVAILABLE.getCode();
            default -> ErrorCode.UNEXPECTED_ERROR.getCode();
        };
    }
}
