package io.github.samzhu.tokenmeter.service;

import java.time.Clock;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.config.MeteringProperties.PlanSeed;
import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.repository.SubscriptionPlanRepository;

/**
 * 啟動時補齊方案目錄。
 *
 * <p>只新增名稱尚不存在的方案，已存在的方案一律不修改。
 * 設定 {@code metering.seed-plans=false} 可停用。
 */
@Component
@ConditionalOnProperty(prefix = "metering", name = "seed-plans", havingValue = "true", matchIfMissing = true)
public class PlanCatalogSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(PlanCatalogSeeder.class);

    private final SubscriptionPlanRepository planRepository;
    private final MeteringProperties properties;
    private final Clock clock;

    public PlanCatalogSeeder(SubscriptionPlanRepository planRepository,
                             MeteringProperties properties,
                             Clock clock) {
        this.planRepository = planRepository;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        int created = 0;
        Instant now = clock.instant();
        for (PlanSeed seed : properties.plans()) {
            if (seed.name() == null || seed.name().isBlank()) {
                log.warn("Skipping plan seed without name");
                continue;
            }
            if (planRepository.existsByName(seed.name())) {
                continue;
            }
            planRepository.insert(SubscriptionPlan.create(
                seed.name(), seed.description(), seed.monthlyTokenLimit(),
                seed.priceCents(), seed.active(), now));
            created++;
            log.info("Seeded subscription plan: name={}, limit={}, priceCents={}",
                seed.name(), seed.monthlyTokenLimit(), seed.priceCents());
        }
        log.info("Plan catalog ready: seeded={}, configured={}", created, properties.plans().size());
    }
}
