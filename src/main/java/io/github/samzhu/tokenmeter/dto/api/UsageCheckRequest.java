package io.github.samzhu.tokenmeter.dto.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * AI 操作前的配額預檢請求。
 *
 * <p>用於 POST /api/v1/usage/check 端點。
 *
 * @param operation 操作類型 (chat / refine / assess)
 * @param textLength 輸入文字長度（字元）
 * @param model 模型，null 時使用預設模型
 */
public record UsageCheckRequest(
    @NotBlank(message = "operation is required")
    String operation,

    @PositiveOrZero(message = "textLength must not be negative")
    int textLength,

    String model
) {}
