package io.github.samzhu.tokenmeter.dto;

/**
 * 受計量 AI 操作的描述。
 *
 * @param operation 操作類型，用於預估倍率 (chat / refine / assess)
 * @param endpoint 呼叫的 API 路徑
 * @param feature 記錄用的功能標籤
 * @param model 模型，null 時使用預設模型
 * @param textLength 輸入文字長度
 * @param requestId 冪等鍵，可為 null
 */
public record MeteredRequest(
    String operation,
    String endpoint,
    String feature,
    String model,
    int textLength,
    String requestId
) {}
