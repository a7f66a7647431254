package io.github.samzhu.tokenmeter.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.tokenmeter.document.BillingPeriod;

/**
 * 訂閱週期帳務資料存取介面。
 */
public interface BillingPeriodRepository extends MongoRepository<BillingPeriod, String> {

    List<BillingPeriod> findBySubscriptionIdOrderByPeriodStartDesc(String subscriptionId);

    /**
     * 結算週期：寫入最終用量與超額並關帳。
     *
     * @param subscriptionId 訂閱 ID
     * @param periodStart 週期開始時間
     * @param tokensUsed 最終用量
     * @param overageTokens 超額 Token 數
     * @param now 當前時間
     * @return 更新的文件數
     */
    @Query("{ 'subscriptionId': ?0, 'periodStart': ?1, 'status': 'active' }")
    @Update("{ '$set': { 'tokensUsed': ?2, 'overageTokens': ?3, 'status': 'closed', 'updatedAt': ?4 } }")
    long closePeriod(String subscriptionId, Instant periodStart, long tokensUsed, long overageTokens, Instant now);
}
