package io.github.samzhu.tokenmeter.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.TokenUsageMessage;
import io.github.samzhu.tokenmeter.service.BillingContextService;
import io.github.samzhu.tokenmeter.service.UsageRecorderService;

/**
 * CloudEvents 用量事件消費者函式配置。
 *
 * <p>AI 功能服務完成操作後發布用量事件（Structured Mode），
 * Spring Cloud Stream 解析後將 data 轉為 {@link TokenUsageMessage}。
 *
 * <p>處理規則：
 * <ul>
 *   <li>{@code status = success} → 記錄實際 Token</li>
 *   <li>其他狀態 → 記錄固定失敗 Token，功能標籤加上 {@code _failed}</li>
 * </ul>
 *
 * <p>Binding name: {@code tokenUsageConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class UsageEventFunction {

    private static final Logger log = LoggerFactory.getLogger(UsageEventFunction.class);

    private final BillingContextService contextService;
    private final UsageRecorderService recorderService;

    public UsageEventFunction(BillingContextService contextService, UsageRecorderService recorderService) {
        this.contextService = contextService;
        this.recorderService = recorderService;
    }

    /**
     * 用量事件消費者 Bean。
     *
     * <p>錯誤處理：不重新拋出例外，避免訊息重複投遞迴圈。
     * 重複投遞的事件由 requestId 唯一索引擋下。
     *
     * @return CloudEvents 訊息消費者
     */
    @Bean
    public Consumer<Message<TokenUsageMessage>> tokenUsageConsumer() {
        return message -> {
            try {
                TokenUsageMessage data = message.getPayload();

                log.debug("CloudEvent received: id={}, type={}, source={}, userId={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    data.userId());

                if (data.userId() == null || data.userId().isBlank()) {
                    log.warn("Dropping usage event without user: id={}", CloudEventMessageUtils.getId(message));
                    return;
                }

                BillingContext context = contextService.resolve(data.userId());
                if (data.isSuccess()) {
                    recorderService.record(data.toUsageRecord(), context);
                } else {
                    recorderService.recordFailure(data.endpoint(), data.modelUsed(),
                        data.featureUsed(), data.requestId(), context);
                }
            } catch (Exception e) {
                log.error("Failed to process CloudEvent: id={}, error={}",
                    CloudEventMessageUtils.getId(message), e.getMessage(), e);
                // 不重新拋出例外，避免訊息重複投遞
            }
        };
    }
}
