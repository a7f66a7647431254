package io.github.samzhu.tokenmeter.repository;

import java.time.Instant;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.tokenmeter.document.UserSubscription;

/**
 * 用戶訂閱資料存取介面。
 *
 * <p>查詢 active 訂閱一律取最新一筆：冷啟動併發可能產生兩筆 active，
 * 讀取端不因此失敗。
 */
public interface UserSubscriptionRepository extends MongoRepository<UserSubscription, String> {

    // ========== 基本查詢 ==========

    /**
     * 查詢用戶最新的指定狀態訂閱。
     *
     * @param userId 用戶 ID
     * @param status 訂閱狀態
     * @return 訂閱（如存在）
     */
    Optional<UserSubscription> findFirstByUserIdAndStatusOrderByCurrentPeriodStartDesc(String userId, String status);

    boolean existsByUserIdAndStatus(String userId, String status);

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 取消用戶所有 active 訂閱（換方案前執行）。
     *
     * @param userId 用戶 ID
     * @param now 當前時間
     * @return 更新的文件數
     */
    @Query("{ 'userId': ?0, 'status': 'active' }")
    @Update("{ '$set': { 'status': 'canceled', 'updatedAt': ?1 } }")
    long cancelActiveByUserId(String userId, Instant now);

    /**
     * 滾動訂閱週期。
     *
     * <p>以舊的週期結束時間作為條件，併發滾動時只有一個請求會更新成功。
     *
     * @param id 訂閱 ID
     * @param expectedPeriodEnd 滾動前的週期結束時間
     * @param periodStart 新週期開始
     * @param periodEnd 新週期結束
     * @param now 當前時間
     * @return 更新的文件數，0 表示已被其他請求滾動
     */
    @Query("{ '_id': ?0, 'status': 'active', 'currentPeriodEnd': ?1 }")
    @Update("{ '$set': { 'currentPeriodStart': ?2, 'currentPeriodEnd': ?3, 'updatedAt': ?4 } }")
    long rollPeriodById(String id, Instant expectedPeriodEnd, Instant periodStart, Instant periodEnd, Instant now);
}
