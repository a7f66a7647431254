package io.github.samzhu.tokenmeter.dto;

/**
 * 一次 AI 操作的用量記錄請求。
 *
 * @param endpoint 呼叫的 API 路徑
 * @param tokensUsed 實際消耗 Token 數（必須 >= 0）
 * @param modelUsed 使用的模型
 * @param featureUsed 功能標籤
 * @param requestId 冪等鍵，null 時自動產生
 */
public record UsageRecord(
    String endpoint,
    long tokensUsed,
    String modelUsed,
    String featureUsed,
    String requestId
) {}
