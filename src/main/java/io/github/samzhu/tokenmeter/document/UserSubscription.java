package io.github.samzhu.tokenmeter.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 用戶訂閱文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>每位用戶最多一筆 {@code status = active} 的訂閱</li>
 *   <li>換方案時舊訂閱改為 {@code canceled}，不刪除，舊用量事件仍指向舊訂閱 ID</li>
 *   <li>狀態以字串儲存，不使用 Enum</li>
 * </ul>
 */
@Document(collection = "user_subscriptions")
@CompoundIndex(name = "user_status_idx", def = "{'userId': 1, 'status': 1, 'currentPeriodStart': -1}")
public record UserSubscription(
    @Id String id,

    /** 訂閱用戶 ID */
    String userId,
    /** 用戶所屬組織（開通當下），可為 null */
    String organizationId,
    /** 方案 ID */
    String planId,
    /** active / canceled */
    String status,
    /** 當期開始時間 (UTC) */
    Instant currentPeriodStart,
    /** 當期結束時間 (UTC) */
    Instant currentPeriodEnd,

    Instant createdAt,
    Instant updatedAt
) {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_CANCELED = "canceled";

    /**
     * 建立一筆 active 訂閱。
     */
    public static UserSubscription activate(String userId, String organizationId, String planId,
            Instant periodStart, Instant periodEnd, Instant now) {
        return new UserSubscription(null, userId, organizationId, planId, STATUS_ACTIVE,
            periodStart, periodEnd, now, now);
    }

    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }

    /**
     * 判斷當期是否已結束。
     *
     * @param now 現在時間
     * @return 週期結束時間早於 now 時為 true
     */
    public boolean isExpired(Instant now) {
        return currentPeriodEnd != null && currentPeriodEnd.isBefore(now);
    }

    /**
     * 回傳週期已更新的副本。
     */
    public UserSubscription withPeriod(Instant periodStart, Instant periodEnd, Instant now) {
        return new UserSubscription(id, userId, organizationId, planId, status,
            periodStart, periodEnd, createdAt, now);
    }
}
