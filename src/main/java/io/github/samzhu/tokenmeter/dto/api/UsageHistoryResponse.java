package io.github.samzhu.tokenmeter.dto.api;

import java.util.List;
import java.util.Map;

/**
 * 用戶用量歷史 API 回應。
 *
 * <p>用於 GET /api/v1/usage/history 端點。{@code dailyUsage} 以 UTC 日期 (YYYY-MM-DD) 為鍵。
 *
 * @param days 查詢天數
 * @param totalEvents 事件數
 * @param totalTokens Token 總數
 * @param dailyUsage 每日總量與功能拆分
 * @param featureBreakdown 依功能彙總
 * @param modelBreakdown 依模型彙總
 * @param rawEvents 最新的原始事件
 */
public record UsageHistoryResponse(
    int days,
    long totalEvents,
    long totalTokens,
    Map<String, DailyFeatureUsage> dailyUsage,
    Map<String, Long> featureBreakdown,
    Map<String, Long> modelBreakdown,
    List<UsageEventView> rawEvents
) {

    /**
     * 單日用量。
     *
     * @param total 當日 Token 總數
     * @param features 當日依功能拆分
     */
    public record DailyFeatureUsage(
        long total,
        Map<String, Long> features
    ) {}
}
