package io.github.samzhu.tokenmeter.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Token 用量事件文件。
 *
 * <p>設計原則：
 * <ul>
 *   <li>只增不改：事件寫入後不更新、不刪除</li>
 *   <li>用量唯一依據：當期用量 = 該訂閱在週期內所有事件的 {@code tokensUsed} 加總</li>
 *   <li>{@code requestId} 唯一，重複投遞的事件會被索引擋下</li>
 *   <li>寫入時記錄訂閱週期快照，供事後稽核</li>
 * </ul>
 */
@Document(collection = "token_usage_events")
@CompoundIndexes({
    @CompoundIndex(name = "subscription_created_idx", def = "{'subscriptionId': 1, 'createdAt': 1}"),
    @CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "org_created_idx", def = "{'organizationId': 1, 'createdAt': 1}"),
    @CompoundIndex(name = "team_created_idx", def = "{'teamId': 1, 'createdAt': 1}")
})
public record TokenUsageEvent(
    @Id String id,

    // ========== 歸屬 ==========
    String userId,
    String organizationId,
    String teamId,
    String subscriptionId,

    // ========== 用量 ==========
    /** 呼叫的 API 路徑，如 /api/refine */
    String endpoint,
    /** 消耗的 Token 數（>= 0） */
    long tokensUsed,
    String modelUsed,
    /** 功能標籤，如 chat、refine、refine_failed */
    String featureUsed,
    @Indexed(unique = true) String requestId,

    // ========== 週期快照 ==========
    Instant billingPeriodStart,
    Instant billingPeriodEnd,

    Instant createdAt
) {
}
