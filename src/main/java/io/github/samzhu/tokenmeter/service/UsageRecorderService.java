package io.github.samzhu.tokenmeter.service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.document.TokenUsageEvent;
import io.github.samzhu.tokenmeter.document.UserSubscription;
import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.UsageRecord;
import io.github.samzhu.tokenmeter.exception.UsageRecordingException;
import io.github.samzhu.tokenmeter.repository.TokenUsageEventRepository;

/**
 * 用量記錄服務。
 *
 * <p>每次 AI 操作完成後寫入一筆 {@link TokenUsageEvent}，事件掛在用戶當期訂閱下，
 * 並記錄週期快照與組織、團隊歸屬。
 *
 * <p>錯誤處理：記錄失敗只寫日誌，不拋出例外。AI 操作已經完成，
 * 記帳失敗不應讓用戶看到錯誤；代價是該次用量可能漏記。
 */
@Service
public class UsageRecorderService {

    private static final Logger log = LoggerFactory.getLogger(UsageRecorderService.class);

    static final String FAILED_SUFFIX = "_failed";

    private final TokenUsageEventRepository eventRepository;
    private final SubscriptionService subscriptionService;
    private final MeteringProperties properties;
    private final Clock clock;

    public UsageRecorderService(
            TokenUsageEventRepository eventRepository,
            SubscriptionService subscriptionService,
            MeteringProperties properties,
            Clock clock) {
        this.eventRepository = eventRepository;
        this.subscriptionService = subscriptionService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 記錄一次 AI 操作的用量。
     *
     * <p>處理流程：
     * <ol>
     *   <li>補齊 requestId（未提供時產生 UUID）</li>
     *   <li>解析 active 訂閱（必要時自動開通 Free）</li>
     *   <li>寫入事件，重複的 requestId 視為已記錄</li>
     * </ol>
     *
     * @param record 用量
     * @param context 計費歸屬
     * @return 寫入的事件，失敗或重複時為 empty
     */
    public Optional<TokenUsageEvent> record(UsageRecord record, BillingContext context) {
        String requestId = record.requestId() == null || record.requestId().isBlank()
            ? UUID.randomUUID().toString()
            : record.requestId();

        try {
            if (record.tokensUsed() < 0) {
                throw new UsageRecordingException(
                    "tokensUsed must not be negative: " + record.tokensUsed(), requestId);
            }

            UserSubscription subscription = subscriptionService
                .getOrCreateActiveSubscription(context)
                .subscription();

            TokenUsageEvent saved = eventRepository.insert(new TokenUsageEvent(
                null,
                context.userId(),
                context.organizationId(),
                context.teamId(),
                subscription.id(),
                record.endpoint(),
                record.tokensUsed(),
                record.modelUsed(),
                record.featureUsed(),
                requestId,
                subscription.currentPeriodStart(),
                subscription.currentPeriodEnd(),
                clock.instant()));

            log.info("Usage recorded: userId={}, feature={}, model={}, tokens={}, requestId={}",
                context.userId(), record.featureUsed(), record.modelUsed(), record.tokensUsed(), requestId);
            return Optional.of(saved);
        } catch (DuplicateKeyException e) {
            log.info("Usage already recorded, skipping: userId={}, requestId={}", context.userId(), requestId);
        } catch (Exception e) {
            log.error("Failed to record usage: userId={}, feature={}, requestId={}, error={}",
                context.userId(), record.featureUsed(), requestId, e.getMessage(), e);
        }
        return Optional.empty();
    }

    /**
     * 記錄失敗的 AI 操作。
     *
     * <p>不論預估多少，一律記錄固定的失敗 Token（{@code metering.failure-tax-tokens}），
     * 功能標籤加上 {@code _failed} 後綴。
     *
     * @param endpoint API 路徑
     * @param modelUsed 模型
     * @param featureUsed 功能標籤
     * @param requestId 冪等鍵，可為 null
     * @param context 計費歸屬
     * @return 寫入的事件，失敗或重複時為 empty
     */
    public Optional<TokenUsageEvent> recordFailure(String endpoint, String modelUsed, String featureUsed,
                                                   String requestId, BillingContext context) {
        return record(new UsageRecord(
            endpoint,
            properties.failureTaxTokens(),
            modelUsed,
            failedFeature(featureUsed),
            requestId), context);
    }

    static String failedFeature(String featureUsed) {
        if (featureUsed == null || featureUsed.isBlank()) {
            return "unknown" + FAILED_SUFFIX;
        }
        return featureUsed.endsWith(FAILED_SUFFIX) ? featureUsed : featureUsed + FAILED_SUFFIX;
    }
}
