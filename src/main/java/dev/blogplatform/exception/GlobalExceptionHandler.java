package dev.blogplatform.exception;

import dev.blogplatform.config.RequestIdFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Translates typed business failures into HTTP statuses with an {@link ErrorResponse} body.
 * Messages are resolved through {@link MessageSource}; unknown keys are shown as-is.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {} {}={}", ex.getResourceName(), ex.getFieldName(), ex.getFieldValue());
        return Mono.just(build(HttpStatus.NOT_FOUND, "error.not_found", ex.getMessage(), exchange));
    }

    @ExceptionHandler(DuplicateResourceException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleDuplicateResource(DuplicateResourceException ex, ServerWebExchange exchange) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.conflict", ex.getMessage(), exchange));
    }

    @ExceptionHandler(InvalidTokenException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleInvalidToken(InvalidTokenException ex, ServerWebExchange exchange) {
        log.warn("Invalid reset token: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.bad_request", ex.getMessage(), exchange));
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleInvalidCredentials(InvalidCredentialsException ex, ServerWebExchange exchange) {
        log.warn("Credential check failed: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.bad_request", ex.getMessage(), exchange));
    }

    @ExceptionHandler(AccountInactiveException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleAccountInactive(AccountInactiveException ex, ServerWebExchange exchange) {
        log.warn("Inactive account: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.FORBIDDEN, "error.forbidden", ex.getMessage(), exchange));
    }

    @ExceptionHandler(BadCredentialsException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Mono<ErrorResponse> handleBadCredentials(BadCredentialsException ex, ServerWebExchange exchange) {
        log.warn("Authentication failed: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.UNAUTHORIZED, "error.unauthorized", "error.invalid_credentials", exchange));
    }

    @ExceptionHandler(AccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleAccessDenied(AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.FORBIDDEN, "error.forbidden", ex.getMessage(), exchange));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage()
                                : msg(locale, "error.invalid_value"),
                        (existing, ignored) -> existing
                ));
        log.warn("Validation failed: {}", errors);
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_data", exchange);
        body.setValidationErrors(errors);
        return Mono.just(body);
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, violation.getMessage());
        });
        log.warn("Constraint violations: {}", errors);
        ErrorResponse body = build(HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_params", exchange);
        body.setValidationErrors(errors);
        return Mono.just(body);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        String reason = ex.getReason() != null ? ex.getReason() : "error.invalid_request";
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.bad_request", reason, exchange));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_REQUEST, "error.bad_request", ex.getMessage(), exchange));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) status = HttpStatus.INTERNAL_SERVER_ERROR;
        String errorKey = statusToKey(status);
        String message = ex.getReason() != null ? ex.getReason() : errorKey;
        return Mono.just(ResponseEntity.status(status).body(build(status, errorKey, message, exchange)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}: ", exchange.getRequest().getPath().value(), ex);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, "error.internal_server_error",
                "error.unexpected_error", exchange));
    }

    private ErrorResponse build(HttpStatus status, String errorKey, String messageKey, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(msg(locale, errorKey))
                .message(msg(locale, messageKey))
                .path(exchange.getRequest().getPath().value())
                .requestId(exchange.getAttribute(RequestIdFilter.REQUEST_ID_ATTR))
                .build();
    }

    private Locale resolveLocale(ServerWebExchange exchange) {
        Locale locale = exchange.getLocaleContext().getLocale();
        return locale != null ? locale : Locale.ENGLISH;
    }

    private String msg(Locale locale, String code, Object... args) {
        if (code == null) {
            return null;
        }
        return messageSource.getMessage(code, args, code, locale);
    }

    private String statusToKey(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "error.not_found";
            case UNAUTHORIZED -> "error.unauthorized";
            case FORBIDDEN -> "error.forbidden";
            case CONFLICT -> "error.conflict";
            case BAD_REQUEST -> "error.bad_request";
            case TOO_MANY_REQUESTS -> "error.rate_limit_exceeded";
            default -> "error.internal_server_error";
        };
    }
}
