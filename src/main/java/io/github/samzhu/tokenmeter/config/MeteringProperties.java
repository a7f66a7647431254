package io.github.samzhu.tokenmeter.config;

import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Token Meter 服務的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@link BillingConfig} - 訂閱週期與 Free 方案設定</li>
 *   <li>{@link PlanSeed} - 啟動時寫入的方案目錄</li>
 *   <li>{@link EstimationConfig} - 各模型的 Token 預估參數</li>
 *   <li>{@link ReportingConfig} - 用量報表的預設查詢範圍</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * metering:
 *   billing:
 *     free-plan-name: Free
 *     period-days: 30
 *     auto-renew: true
 *   failure-tax-tokens: 50
 *   plans:
 *     - name: Free
 *       monthly-token-limit: 10000
 *       price-cents: 0
 *   estimation:
 *     default-model: gemini-2.5-flash-lite
 *     operation-multipliers:
 *       refine: 1.5
 *     models:
 *       "[gemini-2.5-flash-lite]":
 *         base: 50
 *         per-character: 0.2
 *         cost-multiplier: 1.0
 * </pre>
 *
 * @param billing 訂閱週期設定
 * @param failureTaxTokens AI 呼叫失敗時記錄的固定 Token 數
 * @param seedPlans 是否在啟動時補齊缺少的方案
 * @param plans 方案目錄定義
 * @param estimation Token 預估設定
 * @param reporting 報表設定
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@ConfigurationProperties(prefix = "metering")
public record MeteringProperties(
    BillingConfig billing,
    Long failureTaxTokens,
    Boolean seedPlans,
    List<PlanSeed> plans,
    EstimationConfig estimation,
    ReportingConfig reporting
) {
    public MeteringProperties {
        if (billing == null) {
            billing = BillingConfig.defaults();
        }
        if (failureTaxTokens == null || failureTaxTokens < 0) {
            failureTaxTokens = 50L;
        }
        if (seedPlans == null) {
            seedPlans = Boolean.TRUE;
        }
        if (plans == null) {
            plans = List.of();
        }
        if (estimation == null) {
            estimation = EstimationConfig.defaults();
        }
        if (reporting == null) {
            reporting = ReportingConfig.defaults();
        }
    }

    /**
     * 建立全預設值的配置（測試與最小部署使用）。
     */
    public static MeteringProperties defaults() {
        return new MeteringProperties(null, null, null, null, null, null);
    }

    /**
     * 訂閱週期設定。
     *
     * <p>新訂閱的週期為 {@code [now, now + periodDays]}。
     * {@code autoRenew} 開啟時，解析到已過期的 active 訂閱會自動滾動到涵蓋現在的週期。
     *
     * @param freePlanName 自動開通時使用的方案名稱，預設 Free
     * @param periodDays 週期天數，預設 30
     * @param autoRenew 是否自動滾動過期週期，預設 true
     */
    public record BillingConfig(
        String freePlanName,
        int periodDays,
        Boolean autoRenew
    ) {
        public BillingConfig {
            if (freePlanName == null || freePlanName.isBlank()) {
                freePlanName = "Free";
            }
            if (periodDays <= 0) {
                periodDays = 30;
            }
            if (autoRenew == null) {
                autoRenew = Boolean.TRUE;
            }
        }

        public static BillingConfig defaults() {
            return new BillingConfig("Free", 30, Boolean.TRUE);
        }
    }

    /**
     * 方案目錄的種子定義。
     *
     * @param name 方案名稱（唯一）
     * @param description 說明
     * @param monthlyTokenLimit 每週期 Token 上限，-1 表示無限制
     * @param priceCents 價格（分）
     * @param active 是否可供選購
     */
    public record PlanSeed(
        String name,
        String description,
        long monthlyTokenLimit,
        int priceCents,
        Boolean active
    ) {
        public PlanSeed {
            if (active == null) {
                active = Boolean.TRUE;
            }
        }
    }

    /**
     * 單一模型的 Token 預估參數。
     *
     * <pre>
     * estimate = ceil((base + textLength × perCharacter) × operationMultiplier)
     * displayCost = ceil(estimate × costMultiplier)
     * </pre>
     *
     * @param base 基本 Token 數
     * @param perCharacter 每字元 Token 數
     * @param costMultiplier 相對成本倍率
     */
    public record ModelEstimate(
        double base,
        double perCharacter,
        double costMultiplier
    ) {
        public ModelEstimate {
            if (costMultiplier <= 0) {
                costMultiplier = 1.0;
            }
        }
    }

    /**
     * Token 預估設定。
     *
     * @param defaultModel 未指定或未知模型時使用的模型
     * @param operationMultipliers 操作類型倍率（chat / refine / assess）
     * @param models 模型參數
     */
    public record EstimationConfig(
        String defaultModel,
        Map<String, Double> operationMultipliers,
        Map<String, ModelEstimate> models
    ) {
        public EstimationConfig {
            if (defaultModel == null || defaultModel.isBlank()) {
                defaultModel = "gemini-2.5-flash-lite";
            }
            if (operationMultipliers == null || operationMultipliers.isEmpty()) {
                operationMultipliers = Map.of("chat", 1.0, "refine", 1.5, "assess", 1.2);
            }
            if (models == null || models.isEmpty()) {
                models = Map.of(
                    "gemini-2.5-flash-lite", new ModelEstimate(50, 0.2, 1.0),
                    "gemini-2.5-flash", new ModelEstimate(100, 0.4, 6.25));
            }
        }

        public static EstimationConfig defaults() {
            return new EstimationConfig(null, null, null);
        }
    }

    /**
     * 用量報表設定。
     *
     * @param historyDays 歷史查詢預設天數，預設 30
     * @param historyLimit 歷史查詢預設筆數，預設 100
     * @param rawEventLimit 回應中原始事件的最大筆數，預設 50
     * @param topUsers 排行榜人數，預設 10
     * @param trendDays 趨勢天數，預設 7
     */
    public record ReportingConfig(
        int historyDays,
        int historyLimit,
        int rawEventLimit,
        int topUsers,
        int trendDays
    ) {
        public ReportingConfig {
            if (historyDays <= 0) {
                historyDays = 30;
            }
            if (historyLimit <= 0) {
                historyLimit = 100;
            }
            if (rawEventLimit <= 0) {
                rawEventLimit = 50;
            }
            if (topUsers <= 0) {
                topUsers = 10;
            }
            if (trendDays <= 0) {
                trendDays = 7;
            }
        }

        public static ReportingConfig defaults() {
            return new ReportingConfig(30, 100, 50, 10, 7);
        }
    }
}
