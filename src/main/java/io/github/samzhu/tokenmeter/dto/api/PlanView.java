package io.github.samzhu.tokenmeter.dto.api;

import io.github.samzhu.tokenmeter.document.SubscriptionPlan;

/**
 * 方案的 API 呈現。
 */
public record PlanView(
    String id,
    String name,
    String description,
    long monthlyTokenLimit,
    int priceCents,
    boolean unlimited
) {

    public static PlanView from(SubscriptionPlan plan) {
        return new PlanView(
            plan.id(),
            plan.name(),
            plan.description(),
            plan.monthlyTokenLimit(),
            plan.priceCents(),
            plan.isUnlimited());
    }
}
