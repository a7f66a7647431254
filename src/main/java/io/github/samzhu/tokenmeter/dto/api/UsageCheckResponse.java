package io.github.samzhu.tokenmeter.dto.api;

/**
 * 配額預檢回應。
 *
 * @param allowed 是否可執行
 * @param estimatedTokens 預估 Token
 * @param displayCost 依模型成本倍率換算的顯示成本
 * @param model 實際用於預估的模型
 * @param currentUsage 當期已用 Token，無法取得時為 null
 * @param limit 上限，-1 = 無限制
 * @param message 拒絕原因
 */
public record UsageCheckResponse(
    boolean allowed,
    long estimatedTokens,
    long displayCost,
    String model,
    Long currentUsage,
    Long limit,
    String message
) {}
