package dev.pagecraft.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    // single bundle, messages.properties
    private static final Locale MESSAGE_LOCALE = Locale.ENGLISH;

    private final MessageSource messageSource;

    @ExceptionHandler(PageEngineException.class)
    public Mono<ResponseEntity<ErrorResponse>> handlePageEngineException(PageEngineException ex,
                                                                        ServerWebExchange exchange) {
        ErrorKind kind = ex.getKind();
        log.warn("{} on {}: {}", kind.getCode(), exchange.getRequest().getPath().value(), ex.getMessage());
        return Mono.just(ResponseEntity.status(kind.getStatus()).body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(kind.getStatus().value())
                .error(msg(kind.getMessageKey()))
                .kind(kind)
                .message(ex.getMessage())
                .path(exchange.getRequest().getPath().value())
                .build()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage()
                                : msg("error.invalid_value"),
                        (existing, duplicate) -> existing
                ));

        log.warn("Validation failed: {}", errors);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(msg("error.validation_failed"))
                .kind(ErrorKind.VALIDATION_ERROR)
                .message(msg("error.invalid_request_data"))
                .path(exchange.getRequest().getPath().value())
                .validationErrors(errors)
                .build());
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error(msg("error.bad_request"))
                .kind(ErrorKind.VALIDATION_ERROR)
                .message(ex.getReason() != null ? ex.getReason() : msg("error.invalid_request"))
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(msg("error.internal_server_error"))
                .message(msg("error.unexpected_error"))
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    private String msg(String code, Object... args) {
        return messageSource.getMessage(code, args, code, MESSAGE_LOCALE);
    }
}
