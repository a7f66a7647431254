package io.github.samzhu.tokenmeter.dto;

import java.time.Instant;

/**
 * 當期用量與上限的計算結果。
 *
 * <p>每次都由事件紀錄重新加總，不快取。無限制方案固定回傳
 * {@code currentUsage = 0, limit = -1, overage = 0}。
 *
 * @param currentUsage 當期已用 Token
 * @param limit 方案上限，-1 = 無限制
 * @param overage 超額 Token 數，{@code max(0, currentUsage - limit)}
 * @param periodStart 週期開始
 * @param periodEnd 週期結束
 * @param planName 方案名稱
 * @param subscriptionStatus 訂閱狀態
 */
public record UsageLimit(
    long currentUsage,
    long limit,
    long overage,
    Instant periodStart,
    Instant periodEnd,
    String planName,
    String subscriptionStatus
) {

    public static final long UNLIMITED = -1L;

    public boolean unlimited() {
        return limit == UNLIMITED;
    }

    /**
     * 使用率百分比，上限 100；無限制方案為 0。
     */
    public double percentage() {
        if (unlimited()) {
            return 0.0;
        }
        if (limit == 0) {
            return currentUsage > 0 ? 100.0 : 0.0;
        }
        return Math.min(100.0, (double) currentUsage / limit * 100.0);
    }

    /**
     * 剩餘可用 Token；無限制方案回傳 {@link Long#MAX_VALUE}。
     */
    public long remaining() {
        if (unlimited()) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, limit - currentUsage);
    }
}
