package io.github.samzhu.tokenmeter.service;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.EnforcementResult;
import io.github.samzhu.tokenmeter.dto.UsageLimit;

/**
 * AI 呼叫前的配額閘門。
 *
 * <p>判斷規則：
 * <ul>
 *   <li>無法取得用量 → 拒絕（fail closed）</li>
 *   <li>無限制方案 → 放行</li>
 *   <li>{@code currentUsage + estimatedTokens <= limit} → 放行，否則拒絕</li>
 * </ul>
 *
 * <p>此為軟性配額：判斷與記錄之間沒有鎖，併發請求可能讓用量略為超過上限。
 */
@Service
public class UsageEnforcementService {

    private static final Logger log = LoggerFactory.getLogger(UsageEnforcementService.class);

    static final String UNABLE_TO_VERIFY = "Unable to verify usage limits";
    static final String CHECK_ERROR = "Error checking usage limits";

    private final UsageLimitService limitService;

    public UsageEnforcementService(UsageLimitService limitService) {
        this.limitService = limitService;
    }

    /**
     * 判斷用戶是否可以執行預估消耗 {@code estimatedTokens} 的操作。
     *
     * @param estimatedTokens 預估 Token（>= 0）
     * @param context 計費歸屬
     * @return 判斷結果
     * @throws IllegalArgumentException estimatedTokens 為負數
     */
    public EnforcementResult enforce(long estimatedTokens, BillingContext context) {
        if (estimatedTokens < 0) {
            throw new IllegalArgumentException("estimatedTokens must not be negative: " + estimatedTokens);
        }

        try {
            Optional<UsageLimit> evaluated = limitService.evaluate(context);
            if (evaluated.isEmpty()) {
                log.warn("Usage limits unavailable, denying request: userId={}", context.userId());
                return EnforcementResult.deny(null, UNABLE_TO_VERIFY, estimatedTokens);
            }

            UsageLimit usage = evaluated.get();
            if (usage.unlimited()) {
                return EnforcementResult.allow(usage, estimatedTokens);
            }

            if (estimatedTokens > usage.limit() - usage.currentUsage()) {
                log.info("Usage limit exceeded: userId={}, current={}, estimated={}, limit={}",
                    context.userId(), usage.currentUsage(), estimatedTokens, usage.limit());
                return EnforcementResult.deny(usage, limitExceededMessage(usage.limit()), estimatedTokens);
            }

            return EnforcementResult.allow(usage, estimatedTokens);
        } catch (Exception e) {
            log.error("Failed to check usage limits: userId={}, error={}",
                context.userId(), e.getMessage(), e);
            return EnforcementResult.deny(null, CHECK_ERROR, estimatedTokens);
        }
    }

    public EnforcementResult enforce(long estimatedTokens, String userId) {
        return enforce(estimatedTokens, BillingContext.ofUser(userId));
    }

    static String limitExceededMessage(long limit) {
        return String.format(Locale.US,
            "This request would exceed your monthly limit of %,d tokens. Please upgrade your plan to continue.",
            limit);
    }
}
