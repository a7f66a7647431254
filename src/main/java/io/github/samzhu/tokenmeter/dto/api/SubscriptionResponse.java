package io.github.samzhu.tokenmeter.dto.api;

import java.time.Instant;

import io.github.samzhu.tokenmeter.dto.ActiveSubscription;

/**
 * 訂閱 API 回應。
 *
 * <p>用於 GET/POST /api/v1/subscriptions 端點。
 */
public record SubscriptionResponse(
    String subscriptionId,
    String status,
    Instant currentPeriodStart,
    Instant currentPeriodEnd,
    PlanView plan
) {

    public static SubscriptionResponse from(ActiveSubscription active) {
        return new SubscriptionResponse(
            active.subscription().id(),
            active.subscription().status(),
            active.subscription().currentPeriodStart(),
            active.subscription().currentPeriodEnd(),
            PlanView.from(active.plan()));
    }
}
