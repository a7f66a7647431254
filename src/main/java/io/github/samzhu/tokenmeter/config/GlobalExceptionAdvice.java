package io.github.samzhu.tokenmeter.config;

import java.time.Clock;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.tokenmeter.dto.EnforcementResult;
import io.github.samzhu.tokenmeter.dto.UsageLimit;
import io.github.samzhu.tokenmeter.dto.api.ErrorResponse;
import io.github.samzhu.tokenmeter.exception.MeteredOperationException;
import io.github.samzhu.tokenmeter.exception.MeteringConfigurationException;
import io.github.samzhu.tokenmeter.exception.ResourceNotFoundException;
import io.github.samzhu.tokenmeter.exception.SubscriptionResolutionException;
import io.github.samzhu.tokenmeter.exception.UsageAccessDeniedException;
import io.github.samzhu.tokenmeter.exception.UsageLimitExceededException;

/**
 * REST API 例外轉換。
 *
 * <p>將領域例外轉為一致的 {@link ErrorResponse}，不回傳 stack trace。
 * 設定錯誤只回傳通用訊息，詳細原因寫入日誌。
 */
@RestControllerAdvice
public class GlobalExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionAdvice.class);

    private final Clock clock;

    public GlobalExceptionAdvice(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(UsageLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleLimitExceeded(UsageLimitExceededException ex) {
        EnforcementResult result = ex.getResult();
        UsageLimit usage = result.usage();
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(ErrorResponse.limitExceeded(
            result.message(),
            usage == null ? null : usage.currentUsage(),
            usage == null ? null : usage.limit(),
            clock.instant()));
    }

    @ExceptionHandler(UsageAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(UsageAccessDeniedException ex) {
        return build(HttpStatus.FORBIDDEN, "access_denied", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(ResourceNotFoundException ex) {
        return build(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return build(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(err -> err.getField() + ": " + err.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return build(HttpStatus.BAD_REQUEST, "validation_failed", message);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingIdentity(MissingRequestHeaderException ex) {
        return build(HttpStatus.UNAUTHORIZED, "unauthorized", "Missing header: " + ex.getHeaderName());
    }

    @ExceptionHandler(MeteredOperationException.class)
    public ResponseEntity<ErrorResponse> handleOperationFailed(MeteredOperationException ex) {
        log.error("Metered operation failed: feature={}, requestId={}", ex.getFeature(), ex.getRequestId(), ex);
        return build(HttpStatus.BAD_GATEWAY, "operation_failed", "AI operation failed");
    }

    @ExceptionHandler({MeteringConfigurationException.class, SubscriptionResolutionException.class})
    public ResponseEntity<ErrorResponse> handleConfiguration(RuntimeException ex) {
        log.error("Metering unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unable to load usage information");
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error, message, clock.instant()));
    }
}
