package io.github.samzhu.tokenmeter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Token Meter Service - AI 功能的 Token 用量計量與配額控管服務。
 *
 * <p>此服務負責 AI 工單助理的計費基礎：
 * <ul>
 *   <li>解析用戶當期訂閱，首次使用時自動開通 Free 方案</li>
 *   <li>以 append-only 方式記錄每次 AI 操作的 Token 用量</li>
 *   <li>依事件紀錄重新計算當期用量，判斷是否超額</li>
 *   <li>AI 呼叫前的配額閘門（預估 Token + 當期用量 ≤ 上限）</li>
 *   <li>提供用戶、團隊、組織層級的用量報表 REST API</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * AI Route ──estimate──→ Enforcement Gate ──→ Usage Limit Evaluator ──→ token_usage_events
 *    │                                              ↑
 *    └──record (或 CloudEvent)──→ Usage Recorder ──→ Subscription Resolver ──→ user_subscriptions
 *                                                                           billing_periods
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/">Spring Data MongoDB</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/">Spring Cloud Stream</a>
 */
@SpringBootApplication
public class TokenMeterApplication {

    private static final Logger log = LoggerFactory.getLogger(TokenMeterApplication.class);

    public static void main(String[] args) {
        log.info("Starting Token Meter Service - AI Usage Metering");
        SpringApplication.run(TokenMeterApplication.class, args);
    }
}
