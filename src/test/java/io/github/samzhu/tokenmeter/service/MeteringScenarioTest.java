package io.github.samzhu.tokenmeter.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.config.MeteringProperties.BillingConfig;
import io.github.samzhu.tokenmeter.document.BillingPeriod;
import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.document.TokenUsageEvent;
import io.github.samzhu.tokenmeter.document.UserSubscription;
import io.github.samzhu.tokenmeter.dto.ActiveSubscription;
import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.EnforcementResult;
import io.github.samzhu.tokenmeter.dto.UsageLimit;
import io.github.samzhu.tokenmeter.dto.UsageRecord;

/**
 * 訂閱解析、用量記錄、用量計算與配額閘門的整合情境。
 */
class MeteringScenarioTest {

    private static final String USER = "user-1";

    private MeteringFixture fixture;
    private SubscriptionPlan free;
    private SubscriptionPlan pro;
    private SubscriptionPlan unlimited;

    @BeforeEach
    void setUp() {
        fixture = new MeteringFixture();
        free = fixture.addPlan("Free", 10_000, 0);
        pro = fixture.addPlan("Pro", 200_000, 1900);
        unlimited = fixture.addPlan("Unlimited", SubscriptionPlan.UNLIMITED, 9900);
    }

    @Test
    void shouldProvisionFreePlanOnFirstUse() {
        // When: 新用戶第一次請求
        EnforcementResult result = fixture.enforcementService.enforce(500, USER);

        // Then
        assertThat(result.allowed()).isTrue();
        assertThat(fixture.activeSubscriptions(USER)).hasSize(1);

        UserSubscription subscription = fixture.activeSubscriptions(USER).get(0);
        assertThat(subscription.planId()).isEqualTo(free.id());
        assertThat(subscription.currentPeriodStart()).isEqualTo(MeteringFixture.START);
        assertThat(subscription.currentPeriodEnd()).isEqualTo(MeteringFixture.START.plus(Duration.ofDays(30)));

        BillingPeriod period = fixture.billingPeriod(subscription.id(), BillingPeriod.STATUS_ACTIVE).orElseThrow();
        assertThat(period.tokensLimit()).isEqualTo(10_000);
        assertThat(period.amountChargedCents()).isZero();

        // 記錄後用量反映實際 Token
        fixture.recorderService.record(
            new UsageRecord("/api/refine", 480, "gemini-2.5-flash-lite", "refine", "req-a"), BillingContext.ofUser(USER));

        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();
        assertThat(usage.currentUsage()).isEqualTo(480);
        assertThat(usage.limit()).isEqualTo(10_000);
        assertThat(usage.overage()).isZero();
        assertThat(usage.planName()).isEqualTo("Free");
    }

    @Test
    void shouldReuseSubscriptionProvisionedByEarlierCall() {
        // When: 同一用戶連續兩次解析
        ActiveSubscription first = fixture.subscriptionService.getOrCreateActiveSubscription(USER);
        ActiveSubscription second = fixture.subscriptionService.getOrCreateActiveSubscription(USER);

        // Then
        assertThat(first.provisioned()).isTrue();
        assertThat(second.provisioned()).isFalse();
        assertThat(second.subscription().id()).isEqualTo(first.subscription().id());
        assertThat(fixture.activeSubscriptions(USER)).hasSize(1);
        assertThat(fixture.billingPeriods).hasSize(1);
    }

    @Test
    void shouldDenyWhenEstimateWouldExceedLimit() {
        // Given: 已用 9,800
        String subscriptionId = provision();
        fixture.addEvent(USER, subscriptionId, 9_800, MeteringFixture.START.plus(Duration.ofHours(1)));
        fixture.clock.advance(Duration.ofHours(2));

        // When
        EnforcementResult result = fixture.enforcementService.enforce(300, USER);

        // Then
        assertThat(result.allowed()).isFalse();
        assertThat(result.message()).isEqualTo(
            "This request would exceed your monthly limit of 10,000 tokens. Please upgrade your plan to continue.");
        assertThat(result.usage().currentUsage()).isEqualTo(9_800);
        assertThat(fixture.events).hasSize(1);
    }

    @Test
    void shouldAllowExactlyUpToLimit() {
        // Given: 剛好用滿
        String subscriptionId = provision();
        fixture.addEvent(USER, subscriptionId, 10_000, MeteringFixture.START.plus(Duration.ofMinutes(5)));
        fixture.clock.advance(Duration.ofMinutes(10));

        // Then: 0 放行、1 拒絕
        assertThat(fixture.enforcementService.enforce(0, USER).allowed()).isTrue();
        assertThat(fixture.enforcementService.enforce(1, USER).allowed()).isFalse();
    }

    @Test
    void shouldAllowBoundaryWhereUsagePlusEstimateEqualsLimit() {
        String subscriptionId = provision();
        fixture.addEvent(USER, subscriptionId, 9_500, MeteringFixture.START.plus(Duration.ofMinutes(5)));
        fixture.clock.advance(Duration.ofMinutes(10));

        assertThat(fixture.enforcementService.enforce(500, USER).allowed()).isTrue();
        assertThat(fixture.enforcementService.enforce(501, USER).allowed()).isFalse();
    }

    @Test
    void shouldAlwaysAllowUnlimitedPlan() {
        // Given: Unlimited 方案，已用 5,000,000
        ActiveSubscription active = fixture.subscriptionService.changePlan(BillingContext.ofUser(USER), unlimited.id());
        fixture.addEvent(USER, active.subscription().id(), 5_000_000, MeteringFixture.START.plus(Duration.ofHours(1)));
        fixture.clock.advance(Duration.ofHours(2));

        // When
        EnforcementResult result = fixture.enforcementService.enforce(1_000_000, USER);
        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        // Then
        assertThat(result.allowed()).isTrue();
        assertThat(usage.currentUsage()).isZero();
        assertThat(usage.limit()).isEqualTo(UsageLimit.UNLIMITED);
        assertThat(usage.overage()).isZero();
        assertThat(usage.percentage()).isZero();
    }

    @Test
    void shouldResetUsageAfterPlanChange() {
        // Given: Free 方案已用 9,000
        String oldSubscriptionId = provision();
        fixture.addEvent(USER, oldSubscriptionId, 9_000, MeteringFixture.START.plus(Duration.ofHours(1)));
        fixture.clock.advance(Duration.ofDays(3));

        // When
        ActiveSubscription changed = fixture.subscriptionService.changePlan(BillingContext.ofUser(USER), pro.id());

        // Then: 舊訂閱取消、新訂閱從零開始
        assertThat(fixture.activeSubscriptions(USER))
            .extracting(UserSubscription::id)
            .containsExactly(changed.subscription().id());
        assertThat(fixture.subscriptions)
            .filteredOn(s -> s.id().equals(oldSubscriptionId))
            .extracting(UserSubscription::status)
            .containsExactly(UserSubscription.STATUS_CANCELED);

        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();
        assertThat(usage.currentUsage()).isZero();
        assertThat(usage.limit()).isEqualTo(200_000);
        assertThat(usage.planName()).isEqualTo("Pro");

        BillingPeriod period = fixture.billingPeriod(changed.subscription().id(), BillingPeriod.STATUS_ACTIVE)
            .orElseThrow();
        assertThat(period.amountChargedCents()).isEqualTo(1900);
        assertThat(period.periodStart()).isEqualTo(fixture.clock.instant());

        // 舊事件仍掛在舊訂閱
        assertThat(fixture.events).extracting(TokenUsageEvent::subscriptionId).containsExactly(oldSubscriptionId);
    }

    @Test
    void shouldKeepSingleActiveSubscriptionAcrossRepeatedPlanChanges() {
        BillingContext context = BillingContext.ofUser(USER);
        provision();
        fixture.subscriptionService.changePlan(context, pro.id());
        fixture.subscriptionService.changePlan(context, unlimited.id());
        fixture.subscriptionService.changePlan(context, free.id());

        assertThat(fixture.activeSubscriptions(USER)).hasSize(1);
        assertThat(fixture.subscriptions).hasSize(4);
    }

    @Test
    void shouldSumEventsInsideInclusivePeriodBoundaries() {
        // Given
        UserSubscription subscription = fixture.subscriptionService
            .getOrCreateActiveSubscription(USER).subscription();
        Instant start = subscription.currentPeriodStart();
        Instant end = subscription.currentPeriodEnd();

        fixture.addEvent(USER, subscription.id(), 100, start);
        fixture.addEvent(USER, subscription.id(), 200, end);
        fixture.addEvent(USER, subscription.id(), 400, start.minusMillis(1));
        fixture.addEvent(USER, "sub-other", 800, start.plusSeconds(60));
        fixture.addEvent("user-2", subscription.id(), 1_600, start.plusSeconds(60));

        // When
        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        // Then: 只計入本人、本訂閱、週期內（兩端皆含）
        assertThat(usage.currentUsage()).isEqualTo(300);
    }

    @Test
    void shouldReportOverageWhenUsageExceedsLimit() {
        // Given: 軟性配額，併發請求讓用量超過上限
        String subscriptionId = provision();
        fixture.addEvent(USER, subscriptionId, 9_900, MeteringFixture.START.plusSeconds(10));
        fixture.addEvent(USER, subscriptionId, 600, MeteringFixture.START.plusSeconds(20));

        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        assertThat(usage.currentUsage()).isEqualTo(10_500);
        assertThat(usage.overage()).isEqualTo(500);
        assertThat(usage.percentage()).isEqualTo(100.0);
        assertThat(usage.remaining()).isZero();
    }

    @Test
    void shouldRecordFailureTaxUnderFailedFeature() {
        // Given
        provision();
        BillingContext context = BillingContext.ofUser(USER);

        // When: AI 呼叫失敗
        fixture.recorderService.recordFailure("/api/refine", "gemini-2.5-flash", "refine", "req-fail", context);

        // Then
        assertThat(fixture.events).singleElement().satisfies(event -> {
            assertThat(event.tokensUsed()).isEqualTo(50);
            assertThat(event.featureUsed()).isEqualTo("refine_failed");
            assertThat(event.requestId()).isEqualTo("req-fail");
        });
        assertThat(fixture.limitService.evaluate(USER).orElseThrow().currentUsage()).isEqualTo(50);
    }

    @Test
    void shouldRecordDuplicateRequestOnlyOnce() {
        BillingContext context = BillingContext.ofUser(USER);
        UsageRecord record = new UsageRecord("/api/chat", 120, "gemini-2.5-flash-lite", "chat", "req-dup");

        assertThat(fixture.recorderService.record(record, context)).isPresent();
        assertThat(fixture.recorderService.record(record, context)).isEmpty();

        assertThat(fixture.events).hasSize(1);
        assertThat(fixture.limitService.evaluate(USER).orElseThrow().currentUsage()).isEqualTo(120);
    }

    @Test
    void shouldRollExpiredPeriodAndCloseBillingPeriod() {
        // Given: 第一週期用了 3,000
        String subscriptionId = provision();
        Instant firstEnd = MeteringFixture.START.plus(Duration.ofDays(30));
        fixture.addEvent(USER, subscriptionId, 3_000, MeteringFixture.START.plus(Duration.ofDays(2)));

        // When: 週期結束後一天
        fixture.clock.advance(Duration.ofDays(31));
        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        // Then
        assertThat(usage.currentUsage()).isZero();
        assertThat(usage.periodStart()).isEqualTo(firstEnd.plusMillis(1));
        assertThat(usage.periodEnd()).isEqualTo(firstEnd.plus(Duration.ofDays(30)));

        BillingPeriod closed = fixture.billingPeriod(subscriptionId, BillingPeriod.STATUS_CLOSED).orElseThrow();
        assertThat(closed.tokensUsed()).isEqualTo(3_000);
        assertThat(closed.overageTokens()).isZero();

        BillingPeriod open = fixture.billingPeriod(subscriptionId, BillingPeriod.STATUS_ACTIVE).orElseThrow();
        assertThat(open.periodStart()).isEqualTo(firstEnd.plusMillis(1));
    }

    @Test
    void shouldCountEventAtPeriodEndOnlyInClosedPeriod() {
        // Given: 事件剛好落在第一週期結束時間
        String subscriptionId = provision();
        Instant firstEnd = MeteringFixture.START.plus(Duration.ofDays(30));
        fixture.addEvent(USER, subscriptionId, 200, firstEnd);

        // When
        fixture.clock.advance(Duration.ofDays(31));
        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        // Then: 只計入已結算的舊週期
        BillingPeriod closed = fixture.billingPeriod(subscriptionId, BillingPeriod.STATUS_CLOSED).orElseThrow();
        assertThat(closed.tokensUsed()).isEqualTo(200);
        assertThat(usage.currentUsage()).isZero();
    }

    @Test
    void shouldCountEventJustAfterPeriodEndInRenewedPeriod() {
        String subscriptionId = provision();
        Instant firstEnd = MeteringFixture.START.plus(Duration.ofDays(30));
        fixture.addEvent(USER, subscriptionId, 200, firstEnd.plusMillis(1));

        fixture.clock.advance(Duration.ofDays(31));
        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        BillingPeriod closed = fixture.billingPeriod(subscriptionId, BillingPeriod.STATUS_CLOSED).orElseThrow();
        assertThat(closed.tokensUsed()).isZero();
        assertThat(usage.currentUsage()).isEqualTo(200);
    }

    @Test
    void shouldSkipUnusedPeriodsWhenRolling() {
        provision();

        fixture.clock.advance(Duration.ofDays(95));
        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        assertThat(usage.periodStart()).isEqualTo(MeteringFixture.START.plus(Duration.ofDays(90)).plusMillis(1));
        assertThat(usage.periodEnd()).isEqualTo(MeteringFixture.START.plus(Duration.ofDays(120)));
    }

    @Test
    void shouldKeepExpiredPeriodWhenAutoRenewDisabled() {
        // Given
        fixture = new MeteringFixture(new MeteringProperties(
            new BillingConfig("Free", 30, false), null, null, null, null, null));
        fixture.addPlan("Free", 10_000, 0);
        String subscriptionId = provision();
        fixture.addEvent(USER, subscriptionId, 700, MeteringFixture.START.plus(Duration.ofDays(1)));

        // When
        fixture.clock.advance(Duration.ofDays(40));
        UsageLimit usage = fixture.limitService.evaluate(USER).orElseThrow();

        // Then
        assertThat(usage.currentUsage()).isEqualTo(700);
        assertThat(usage.periodEnd()).isEqualTo(MeteringFixture.START.plus(Duration.ofDays(30)));
        assertThat(fixture.billingPeriods).hasSize(1);
    }

    @Test
    void shouldFailClosedWhenFreePlanMissing() {
        // Given: 目錄中沒有 Free 方案
        fixture = new MeteringFixture();
        fixture.addPlan("Pro", 200_000, 1900);

        // When
        EnforcementResult result = fixture.enforcementService.enforce(10, USER);

        // Then
        assertThat(result.allowed()).isFalse();
        assertThat(result.message()).isEqualTo("Unable to verify usage limits");
        assertThat(fixture.limitService.evaluate(USER)).isEmpty();
        assertThat(fixture.subscriptions).isEmpty();
    }

    private String provision() {
        return fixture.subscriptionService.getOrCreateActiveSubscription(USER).subscription().id();
    }
}
