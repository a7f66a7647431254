package io.github.samzhu.tokenmeter.dto.api;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * API 錯誤回應。
 *
 * <p>一般錯誤只帶 {@code error}、{@code message}、{@code timestamp}；
 * 超額拒絕 (429) 另帶 {@code usageLimitExceeded}、{@code currentUsage}、{@code limit}。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String message,
    Boolean usageLimitExceeded,
    Long currentUsage,
    Long limit,
    Instant timestamp
) {

    public static ErrorResponse of(String error, String message, Instant timestamp) {
        return new ErrorResponse(error, message, null, null, null, timestamp);
    }

    public static ErrorResponse limitExceeded(String message, Long currentUsage, Long limit, Instant timestamp) {
        return new ErrorResponse("usage_limit_exceeded", message, Boolean.TRUE, currentUsage, limit, timestamp);
    }
}
