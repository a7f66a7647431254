package io.github.samzhu.tokenmeter.service;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.document.TokenUsageEvent;
import io.github.samzhu.tokenmeter.document.UserSubscription;
import io.github.samzhu.tokenmeter.dto.ActiveSubscription;
import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.UsageLimit;
import io.github.samzhu.tokenmeter.repository.TokenUsageEventRepository;

/**
 * 當期用量計算服務。
 *
 * <p>當期用量 = 該訂閱在 {@code [periodStart, periodEnd]} 內所有事件的 Token 加總，
 * 每次呼叫都重新計算，不使用任何快取或累計欄位。
 */
@Service
public class UsageLimitService {

    private static final Logger log = LoggerFactory.getLogger(UsageLimitService.class);

    private final SubscriptionService subscriptionService;
    private final TokenUsageEventRepository eventRepository;

    public UsageLimitService(SubscriptionService subscriptionService,
                             TokenUsageEventRepository eventRepository) {
        this.subscriptionService = subscriptionService;
        this.eventRepository = eventRepository;
    }

    /**
     * 計算用戶當期用量與上限。
     *
     * @param context 計費歸屬
     * @return 用量，無法解析訂閱或讀取失敗時為 empty
     */
    public Optional<UsageLimit> evaluate(BillingContext context) {
        try {
            ActiveSubscription active = subscriptionService.getOrCreateActiveSubscription(context);
            UserSubscription subscription = active.subscription();
            SubscriptionPlan plan = active.plan();

            if (plan.isUnlimited()) {
                return Optional.of(new UsageLimit(
                    0, UsageLimit.UNLIMITED, 0,
                    subscription.currentPeriodStart(), subscription.currentPeriodEnd(),
                    plan.name(), subscription.status()));
            }

            long currentUsage = eventRepository.findInBillingPeriod(
                    context.userId(), subscription.id(),
                    subscription.currentPeriodStart(), subscription.currentPeriodEnd())
                .stream()
                .mapToLong(TokenUsageEvent::tokensUsed)
                .sum();
            long limit = plan.monthlyTokenLimit();

            log.debug("Usage evaluated: userId={}, plan={}, current={}, limit={}",
                context.userId(), plan.name(), currentUsage, limit);

            return Optional.of(new UsageLimit(
                currentUsage, limit, Math.max(0, currentUsage - limit),
                subscription.currentPeriodStart(), subscription.currentPeriodEnd(),
                plan.name(), subscription.status()));
        } catch (Exception e) {
            log.error("Failed to evaluate usage limit: userId={}, error={}",
                context.userId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    public Optional<UsageLimit> evaluate(String userId) {
        return evaluate(BillingContext.ofUser(userId));
    }
}
