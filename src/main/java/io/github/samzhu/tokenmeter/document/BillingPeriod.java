package io.github.samzhu.tokenmeter.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 訂閱週期帳務文件。
 *
 * <p>每次開通、換方案或週期滾動時建立一筆。{@code tokensUsed} 只在週期結束時寫入結算值，
 * 期間內的用量一律由 {@code token_usage_events} 重新加總，此文件不作為配額判斷依據。
 */
@Document(collection = "billing_periods")
@CompoundIndex(name = "subscription_period_idx", def = "{'subscriptionId': 1, 'periodStart': -1}")
public record BillingPeriod(
    @Id String id,

    String subscriptionId,
    Instant periodStart,
    Instant periodEnd,

    /** 結算用量（開帳時為 0） */
    long tokensUsed,
    /** 方案上限快照，-1 = 無限制 */
    long tokensLimit,
    /** 超額 Token 數 */
    long overageTokens,
    /** 收費金額（分） */
    int amountChargedCents,
    /** active / closed */
    String status,

    Instant createdAt,
    Instant updatedAt
) {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_CLOSED = "closed";

    /**
     * 開立新週期。
     */
    public static BillingPeriod open(String subscriptionId, Instant periodStart, Instant periodEnd,
            long tokensLimit, int amountChargedCents, Instant now) {
        return new BillingPeriod(null, subscriptionId, periodStart, periodEnd,
            0, tokensLimit, 0, amountChargedCents, STATUS_ACTIVE, now, now);
    }
}
