package io.github.samzhu.tokenmeter.dto.api;

import jakarta.validation.constraints.NotBlank;

/**
 * 換方案請求。
 *
 * <p>用於 POST /api/v1/subscriptions 端點。
 */
public record ChangePlanRequest(
    @NotBlank(message = "planId is required")
    String planId
) {}
