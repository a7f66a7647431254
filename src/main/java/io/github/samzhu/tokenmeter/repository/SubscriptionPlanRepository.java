package io.github.samzhu.tokenmeter.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenmeter.document.SubscriptionPlan;

/**
 * 訂閱方案資料存取介面。
 *
 * <p>方案寫入只發生在啟動時的目錄補齊，其餘皆為查詢。
 *
 * @see io.github.samzhu.tokenmeter.service.PlanCatalogSeeder
 */
public interface SubscriptionPlanRepository extends MongoRepository<SubscriptionPlan, String> {

    /**
     * 依名稱查詢可選購的方案（用於 Free 方案查找）。
     *
     * @param name 方案名稱
     * @return 方案（如存在且 active）
     */
    Optional<SubscriptionPlan> findFirstByNameAndActiveTrue(String name);

    /**
     * 查詢所有可選購方案，依價格由低到高排列。
     */
    List<SubscriptionPlan> findByActiveTrueOrderByPriceCentsAsc();

    boolean existsByName(String name);
}
