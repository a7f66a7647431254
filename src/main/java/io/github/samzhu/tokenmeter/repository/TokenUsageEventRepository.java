package io.github.samzhu.tokenmeter.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import io.github.samzhu.tokenmeter.document.TokenUsageEvent;

/**
 * Token 用量事件資料存取介面。
 *
 * <p>事件只透過 {@code insert} 寫入。所有時間區間查詢兩端皆包含
 * ({@code $gte} / {@code $lte})，剛好落在週期邊界的事件計入該週期。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/repositories/query-methods.html">Query Methods</a>
 */
public interface TokenUsageEventRepository extends MongoRepository<TokenUsageEvent, String> {

    // ========== 配額計算 ==========

    /**
     * 查詢用戶在某訂閱週期內的所有事件（只取計算用量所需欄位）。
     *
     * @param userId 用戶 ID
     * @param subscriptionId 訂閱 ID
     * @param periodStart 週期開始（含）
     * @param periodEnd 週期結束（含）
     * @return 週期內事件
     */
    @Query(value = "{ 'userId': ?0, 'subscriptionId': ?1, 'createdAt': { '$gte': ?2, '$lte': ?3 } }",
           fields = "{ 'tokensUsed': 1, 'createdAt': 1 }")
    List<TokenUsageEvent> findInBillingPeriod(String userId, String subscriptionId,
            Instant periodStart, Instant periodEnd);

    // ========== 報表查詢 ==========

    /**
     * 查詢用戶自某時間起的事件，最新在前。
     *
     * @param userId 用戶 ID
     * @param since 起始時間（含）
     * @param pageable 筆數限制
     * @return 事件清單
     */
    List<TokenUsageEvent> findByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
            String userId, Instant since, Pageable pageable);

    /**
     * 查詢組織在時間區間內的事件。
     */
    @Query("{ 'organizationId': ?0, 'createdAt': { '$gte': ?1, '$lte': ?2 } }")
    List<TokenUsageEvent> findByOrganizationInWindow(String organizationId, Instant start, Instant end);

    /**
     * 查詢團隊在時間區間內的事件。
     */
    @Query("{ 'teamId': ?0, 'createdAt': { '$gte': ?1, '$lte': ?2 } }")
    List<TokenUsageEvent> findByTeamInWindow(String teamId, Instant start, Instant end);

    boolean existsByRequestId(String requestId);
}
