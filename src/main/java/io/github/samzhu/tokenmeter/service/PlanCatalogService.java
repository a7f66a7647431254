package io.github.samzhu.tokenmeter.service;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.exception.MeteringConfigurationException;
import io.github.samzhu.tokenmeter.repository.SubscriptionPlanRepository;

/**
 * 方案目錄查詢服務。
 */
@Service
public class PlanCatalogService {

    private static final Logger log = LoggerFactory.getLogger(PlanCatalogService.class);

    private final SubscriptionPlanRepository planRepository;
    private final MeteringProperties properties;

    public PlanCatalogService(SubscriptionPlanRepository planRepository, MeteringProperties properties) {
        this.planRepository = planRepository;
        this.properties = properties;
    }

    /**
     * 查詢所有可選購方案，價格由低到高。
     */
    public List<SubscriptionPlan> listActivePlans() {
        return planRepository.findByActiveTrueOrderByPriceCentsAsc();
    }

    /**
     * 取得自動開通使用的 Free 方案。
     *
     * @return Free 方案
     * @throws MeteringConfigurationException 目錄中沒有可用的 Free 方案
     */
    public SubscriptionPlan findFreePlan() {
        String name = properties.billing().freePlanName();
        return planRepository.findFirstByNameAndActiveTrue(name)
            .orElseThrow(() -> {
                log.error("Free plan not found in catalog: name={}", name);
                return new MeteringConfigurationException("Free plan not found: " + name);
            });
    }

    /**
     * 依 ID 查詢可選購方案（換方案時驗證）。
     *
     * @param planId 方案 ID
     * @return 方案，不存在或已停售時為 empty
     */
    public Optional<SubscriptionPlan> findActivePlan(String planId) {
        return planRepository.findById(planId).filter(SubscriptionPlan::active);
    }

    /**
     * 依 ID 查詢方案，包含已停售者（既有訂閱仍參照停售方案）。
     */
    public Optional<SubscriptionPlan> findPlan(String planId) {
        return planRepository.findById(planId);
    }
}
