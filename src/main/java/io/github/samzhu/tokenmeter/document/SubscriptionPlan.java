package io.github.samzhu.tokenmeter.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 訂閱方案文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>方案一經訂閱參照即不修改，停售以 {@code active = false} 表示</li>
 *   <li>{@code monthlyTokenLimit = -1} 表示無限制方案</li>
 *   <li>名稱唯一，Free 方案以名稱查找</li>
 * </ul>
 */
@Document(collection = "subscription_plans")
public record SubscriptionPlan(
    @Id String id,

    /** 方案名稱（唯一） */
    @Indexed(unique = true) String name,
    /** 方案說明 */
    String description,
    /** 每週期 Token 上限，-1 = 無限制 */
    long monthlyTokenLimit,
    /** 價格（分） */
    int priceCents,
    /** 是否可供選購 */
    boolean active,

    Instant createdAt,
    Instant updatedAt
) {

    /** 無限制方案的上限值 */
    public static final long UNLIMITED = -1L;

    /**
     * 建立新方案。
     */
    public static SubscriptionPlan create(String name, String description,
            long monthlyTokenLimit, int priceCents, boolean active, Instant now) {
        return new SubscriptionPlan(null, name, description, monthlyTokenLimit,
            priceCents, active, now, now);
    }

    public boolean isUnlimited() {
        return monthlyTokenLimit == UNLIMITED;
    }
}
