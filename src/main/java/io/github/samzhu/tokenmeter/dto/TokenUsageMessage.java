package io.github.samzhu.tokenmeter.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 用量事件資料（CloudEvents data payload）。
 *
 * <p>AI 功能服務在操作完成後發布，由 {@code tokenUsageConsumer} 消費並寫入用量紀錄。
 *
 * <p>欄位說明：
 * <ul>
 *   <li>{@code userId} - 用戶識別碼（上游已驗證身分）</li>
 *   <li>{@code endpoint} - 觸發的 API 路徑，如 {@code /api/refine}</li>
 *   <li>{@code tokensUsed} - AI 供應商回報的實際 Token 數，失敗時忽略</li>
 *   <li>{@code modelUsed} / {@code featureUsed} - 模型與功能標籤</li>
 *   <li>{@code requestId} - 冪等鍵，重複投遞時只記錄一次</li>
 *   <li>{@code status} - success / error；error 時改記固定失敗 Token</li>
 * </ul>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 */
public record TokenUsageMessage(
    @JsonProperty("user_id") String userId,
    String endpoint,
    @JsonProperty("tokens_used") long tokensUsed,
    @JsonProperty("model_used") String modelUsed,
    @JsonProperty("feature_used") String featureUsed,
    @JsonProperty("request_id") String requestId,
    String status
) {

    /**
     * 判斷此事件是否代表成功的 AI 呼叫。
     *
     * @return status 為 null 或 "success"（不分大小寫）時回傳 true
     */
    public boolean isSuccess() {
        return status == null || "success".equalsIgnoreCase(status);
    }

    public UsageRecord toUsageRecord() {
        return new UsageRecord(endpoint, tokensUsed, modelUsed, featureUsed, requestId);
    }
}
