package io.github.samzhu.tokenmeter.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.document.BillingPeriod;
import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.document.TokenUsageEvent;
import io.github.samzhu.tokenmeter.document.UserSubscription;
import io.github.samzhu.tokenmeter.dto.ActiveSubscription;
import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.exception.MeteringConfigurationException;
import io.github.samzhu.tokenmeter.repository.BillingPeriodRepository;
import io.github.samzhu.tokenmeter.repository.TokenUsageEventRepository;
import io.github.samzhu.tokenmeter.repository.UserSubscriptionRepository;
import io.github.samzhu.tokenmeter.util.PeriodUtils;

/**
 * 訂閱解析與管理服務。
 *
 * <p>負責：
 * <ul>
 *   <li>解析用戶 active 訂閱，沒有時自動開通 Free 方案（首次使用）</li>
 *   <li>過期週期自動滾動（{@code metering.billing.auto-renew}）並結算舊週期</li>
 *   <li>換方案：取消舊訂閱、建立新訂閱與新週期帳務</li>
 * </ul>
 *
 * <p>不快取任何訂閱狀態，每次呼叫都重新讀取資料庫。
 * 冷啟動時兩個併發請求可能各自開通一筆 Free 訂閱，讀取端一律取最新一筆，不影響判斷。
 */
@Service
public class SubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionService.class);

    private final UserSubscriptionRepository subscriptionRepository;
    private final BillingPeriodRepository billingPeriodRepository;
    private final TokenUsageEventRepository eventRepository;
    private final PlanCatalogService planCatalog;
    private final MeteringProperties properties;
    private final Clock clock;

    public SubscriptionService(
            UserSubscriptionRepository subscriptionRepository,
            BillingPeriodRepository billingPeriodRepository,
            TokenUsageEventRepository eventRepository,
            PlanCatalogService planCatalog,
            MeteringProperties properties,
            Clock clock) {
        this.subscriptionRepository = subscriptionRepository;
        this.billingPeriodRepository = billingPeriodRepository;
        this.eventRepository = eventRepository;
        this.planCatalog = planCatalog;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 取得用戶 active 訂閱，沒有時開通 Free 方案。
     *
     * @param context 計費歸屬
     * @return active 訂閱與方案
     * @throws MeteringConfigurationException 找不到 Free 方案或訂閱參照的方案
     */
    public ActiveSubscription getOrCreateActiveSubscription(BillingContext context) {
        Instant now = clock.instant();
        Optional<UserSubscription> existing = subscriptionRepository
            .findFirstByUserIdAndStatusOrderByCurrentPeriodStartDesc(context.userId(), UserSubscription.STATUS_ACTIVE);

        if (existing.isPresent()) {
            UserSubscription subscription = existing.get();
            SubscriptionPlan plan = loadPlan(subscription);
            return new ActiveSubscription(renewIfExpired(subscription, plan, now), plan, false);
        }

        return provisionFreePlan(context, now);
    }

    public ActiveSubscription getOrCreateActiveSubscription(String userId) {
        return getOrCreateActiveSubscription(BillingContext.ofUser(userId));
    }

    /**
     * 確保用戶有 active 訂閱（冪等）。
     *
     * @param context 計費歸屬
     * @return active 訂閱，{@code provisioned} 表示本次是否新建
     */
    public ActiveSubscription ensureSubscription(BillingContext context) {
        ActiveSubscription active = getOrCreateActiveSubscription(context);
        if (active.provisioned()) {
            log.info("Billing set up: userId={}, plan={}", context.userId(), active.plan().name());
        } else {
            log.debug("Billing already set up: userId={}, plan={}", context.userId(), active.plan().name());
        }
        return active;
    }

    /**
     * 查詢用戶 active 訂閱，不自動開通也不滾動週期。
     */
    public Optional<ActiveSubscription> findActiveSubscription(String userId) {
        return subscriptionRepository
            .findFirstByUserIdAndStatusOrderByCurrentPeriodStartDesc(userId, UserSubscription.STATUS_ACTIVE)
            .map(subscription -> new ActiveSubscription(subscription, loadPlan(subscription), false));
    }

    /**
     * 換方案。
     *
     * <p>取消所有 active 訂閱後建立新訂閱，週期從現在開始，並開立收取方案費用的新週期帳務。
     * 舊訂閱的用量事件保留原訂閱 ID，不計入新週期。
     *
     * @param context 計費歸屬
     * @param planId 新方案 ID
     * @return 新的 active 訂閱
     * @throws IllegalArgumentException 方案不存在或已停售
     */
    public ActiveSubscription changePlan(BillingContext context, String planId) {
        SubscriptionPlan plan = planCatalog.findActivePlan(planId)
            .orElseThrow(() -> new IllegalArgumentException("Invalid plan"));

        Instant now = clock.instant();
        long canceled = subscriptionRepository.cancelActiveByUserId(context.userId(), now);

        UserSubscription subscription = subscriptionRepository.insert(UserSubscription.activate(
            context.userId(),
            context.organizationId(),
            plan.id(),
            now,
            PeriodUtils.subscriptionPeriodEnd(now, properties.billing().periodDays()),
            now));

        openBillingPeriod(subscription, plan, plan.priceCents(), now);

        log.info("Plan changed: userId={}, plan={}, subscriptionId={}, canceledSubscriptions={}",
            context.userId(), plan.name(), subscription.id(), canceled);
        return new ActiveSubscription(subscription, plan, false);
    }

    private ActiveSubscription provisionFreePlan(BillingContext context, Instant now) {
        SubscriptionPlan freePlan = planCatalog.findFreePlan();

        UserSubscription subscription = subscriptionRepository.insert(UserSubscription.activate(
            context.userId(),
            context.organizationId(),
            freePlan.id(),
            now,
            PeriodUtils.subscriptionPeriodEnd(now, properties.billing().periodDays()),
            now));

        openBillingPeriod(subscription, freePlan, 0, now);

        log.info("Provisioned free subscription: userId={}, subscriptionId={}, periodEnd={}",
            context.userId(), subscription.id(), subscription.currentPeriodEnd());
        return new ActiveSubscription(subscription, freePlan, true);
    }

    /**
     * 週期已過期且開啟自動續期時，將週期滾動到涵蓋現在，並結算舊週期。
     */
    private UserSubscription renewIfExpired(UserSubscription subscription, SubscriptionPlan plan, Instant now) {
        if (!properties.billing().autoRenew() || !subscription.isExpired(now)) {
            return subscription;
        }

        PeriodUtils.Window next = PeriodUtils.rollForward(
            subscription.currentPeriodEnd(), now, properties.billing().periodDays());

        long updated = subscriptionRepository.rollPeriodById(
            subscription.id(), subscription.currentPeriodEnd(), next.start(), next.end(), now);
        if (updated == 0) {
            // 其他請求已完成滾動
            log.debug("Subscription period already rolled: subscriptionId={}", subscription.id());
            return subscriptionRepository.findById(subscription.id()).orElse(subscription);
        }

        closeBillingPeriod(subscription, plan, now);
        UserSubscription renewed = subscription.withPeriod(next.start(), next.end(), now);
        openBillingPeriod(renewed, plan, plan.priceCents(), now);

        log.info("Subscription period renewed: userId={}, subscriptionId={}, periodStart={}, periodEnd={}",
            subscription.userId(), subscription.id(), next.start(), next.end());
        return renewed;
    }

    private SubscriptionPlan loadPlan(UserSubscription subscription) {
        return planCatalog.findPlan(subscription.planId())
            .orElseThrow(() -> new MeteringConfigurationException(
                "Plan not found for subscription: subscriptionId=" + subscription.id()
                    + ", planId=" + subscription.planId()));
    }

    private void openBillingPeriod(UserSubscription subscription, SubscriptionPlan plan,
                                   int amountChargedCents, Instant now) {
        try {
            billingPeriodRepository.insert(BillingPeriod.open(
                subscription.id(),
                subscription.currentPeriodStart(),
                subscription.currentPeriodEnd(),
                plan.monthlyTokenLimit(),
                amountChargedCents,
                now));
        } catch (Exception e) {
            // 週期帳務只供稽核，失敗不影響訂閱
            log.error("Failed to create billing period: subscriptionId={}, error={}",
                subscription.id(), e.getMessage(), e);
        }
    }

    private void closeBillingPeriod(UserSubscription subscription, SubscriptionPlan plan, Instant now) {
        try {
            long used = eventRepository.findInBillingPeriod(
                    subscription.userId(), subscription.id(),
                    subscription.currentPeriodStart(), subscription.currentPeriodEnd())
                .stream()
                .mapToLong(TokenUsageEvent::tokensUsed)
                .sum();
            long overage = plan.isUnlimited() ? 0 : Math.max(0, used - plan.monthlyTokenLimit());
            billingPeriodRepository.closePeriod(
                subscription.id(), subscription.currentPeriodStart(), used, overage, now);
            log.info("Billing period closed: subscriptionId={}, tokensUsed={}, overage={}",
                subscription.id(), used, overage);
        } catch (Exception e) {
            log.error("Failed to close billing period: subscriptionId={}, error={}",
                subscription.id(), e.getMessage(), e);
        }
    }
}
