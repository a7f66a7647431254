package io.github.samzhu.tokenmeter.dto.api;

/**
 * 開通計費 API 回應。
 *
 * @param created 本次是否新建訂閱
 * @param message 結果說明
 * @param subscription 目前的訂閱
 */
public record SetupBillingResponse(
    boolean created,
    String message,
    SubscriptionResponse subscription
) {}
