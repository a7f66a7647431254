package io.github.samzhu.tokenmeter.dto.api;

import java.time.Instant;

import io.github.samzhu.tokenmeter.dto.UsageLimit;

/**
 * 當期用量 API 回應。
 *
 * <p>用於 GET /api/v1/usage/current 端點。
 */
public record CurrentUsageResponse(
    UsageInfo usage,
    SubscriptionInfo subscription
) {

    /**
     * 當期用量資訊。
     *
     * @param current 已用 Token
     * @param limit 上限，-1 = 無限制
     * @param overage 超額 Token
     * @param percentage 使用率，上限 100
     * @param remaining 剩餘 Token，無限制時為 null
     * @param periodStart 週期開始
     * @param periodEnd 週期結束
     * @param daysRemaining 距週期結束天數
     * @param unlimited 是否無限制
     */
    public record UsageInfo(
        long current,
        long limit,
        long overage,
        double percentage,
        Long remaining,
        Instant periodStart,
        Instant periodEnd,
        long daysRemaining,
        boolean unlimited
    ) {}

    public record SubscriptionInfo(
        String planName,
        String status
    ) {}

    public static CurrentUsageResponse from(UsageLimit limit, long daysRemaining) {
        return new CurrentUsageResponse(
            new UsageInfo(
                limit.currentUsage(),
                limit.limit(),
                limit.overage(),
                limit.percentage(),
                limit.unlimited() ? null : limit.remaining(),
                limit.periodStart(),
                limit.periodEnd(),
                daysRemaining,
                limit.unlimited()),
            new SubscriptionInfo(limit.planName(), limit.subscriptionStatus()));
    }
}
