package io.github.samzhu.tokenmeter.dto.api;

import java.time.Instant;

import io.github.samzhu.tokenmeter.document.TokenUsageEvent;

/**
 * 單筆用量事件的 API 呈現（不含內部訂閱 ID）。
 */
public record UsageEventView(
    String requestId,
    String endpoint,
    String featureUsed,
    String modelUsed,
    long tokensUsed,
    Instant createdAt
) {

    public static UsageEventView from(TokenUsageEvent event) {
        return new UsageEventView(
            event.requestId(),
            event.endpoint(),
            event.featureUsed(),
            event.modelUsed(),
            event.tokensUsed(),
            event.createdAt());
    }
}
