package io.github.samzhu.tokenmeter.dto;

import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.document.UserSubscription;

/**
 * 已解析的 active 訂閱與其方案。
 *
 * @param subscription 訂閱
 * @param plan 方案
 * @param provisioned 是否為本次呼叫自動開通
 */
public record ActiveSubscription(
    UserSubscription subscription,
    SubscriptionPlan plan,
    boolean provisioned
) {}
