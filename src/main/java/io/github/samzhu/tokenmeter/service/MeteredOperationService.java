package io.github.samzhu.tokenmeter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.EnforcementResult;
import io.github.samzhu.tokenmeter.dto.MeteredRequest;
import io.github.samzhu.tokenmeter.dto.UsageRecord;
import io.github.samzhu.tokenmeter.exception.MeteredOperationException;
import io.github.samzhu.tokenmeter.exception.UsageLimitExceededException;

/**
 * AI 操作的計量流程。
 *
 * <p>每個 AI 功能都依相同順序執行：
 * <ol>
 *   <li>預估 Token</li>
 *   <li>配額閘門判斷，拒絕時不呼叫 AI</li>
 *   <li>呼叫 AI</li>
 *   <li>成功記錄實際 Token（未回報時記錄預估值），失敗記錄固定失敗 Token</li>
 * </ol>
 */
@Service
public class MeteredOperationService {

    private static final Logger log = LoggerFactory.getLogger(MeteredOperationService.class);

    private final TokenEstimationService estimationService;
    private final UsageEnforcementService enforcementService;
    private final UsageRecorderService recorderService;

    public MeteredOperationService(
            TokenEstimationService estimationService,
            UsageEnforcementService enforcementService,
            UsageRecorderService recorderService) {
        this.estimationService = estimationService;
        this.enforcementService = enforcementService;
        this.recorderService = recorderService;
    }

    /**
     * AI 呼叫。
     *
     * @param <T> 回應型別
     */
    @FunctionalInterface
    public interface MeteredCall<T> {

        /**
         * @param model 實際使用的模型
         * @return AI 回應與供應商回報的 Token
         */
        MeteredResponse<T> invoke(String model) throws Exception;
    }

    /**
     * AI 回應。
     *
     * @param body 回應內容
     * @param tokensUsed 供應商回報的 Token，未回報時為 null
     */
    public record MeteredResponse<T>(T body, Long tokensUsed) {

        public static <T> MeteredResponse<T> of(T body, long tokensUsed) {
            return new MeteredResponse<>(body, tokensUsed);
        }

        public static <T> MeteredResponse<T> unreported(T body) {
            return new MeteredResponse<>(body, null);
        }
    }

    /**
     * 預檢結果（不呼叫 AI）。
     *
     * @param model 實際用於預估的模型
     * @param estimatedTokens 預估 Token
     * @param displayCost 顯示成本
     * @param result 閘門判斷
     */
    public record Preflight(
        String model,
        long estimatedTokens,
        long displayCost,
        EnforcementResult result
    ) {}

    /**
     * 只做預估與閘門判斷。
     */
    public Preflight preflight(String operation, int textLength, String model, BillingContext context) {
        String resolvedModel = estimationService.resolveModel(model);
        long estimated = estimationService.estimate(operation, textLength, resolvedModel);
        EnforcementResult result = enforcementService.enforce(estimated, context);
        return new Preflight(resolvedModel, estimated,
            estimationService.displayCost(estimated, resolvedModel), result);
    }

    /**
     * 以計量流程執行 AI 呼叫。
     *
     * @param request 操作描述
     * @param context 計費歸屬
     * @param call AI 呼叫
     * @return AI 回應內容
     * @throws UsageLimitExceededException 閘門拒絕，AI 未被呼叫
     * @throws MeteredOperationException AI 呼叫失敗，已記錄失敗 Token
     */
    public <T> T execute(MeteredRequest request, BillingContext context, MeteredCall<T> call) {
        Preflight preflight = preflight(request.operation(), request.textLength(), request.model(), context);
        if (!preflight.result().allowed()) {
            throw new UsageLimitExceededException(preflight.result());
        }

        MeteredResponse<T> response;
        try {
            response = call.invoke(preflight.model());
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("AI operation failed, recording failure usage: userId={}, feature={}, error={}",
                context.userId(), request.feature(), e.getMessage());
            recorderService.recordFailure(request.endpoint(), preflight.model(), request.feature(),
                request.requestId(), context);
            throw new MeteredOperationException(request.feature(), request.requestId(), e);
        }

        long tokensUsed = response.tokensUsed() != null
            ? response.tokensUsed()
            : preflight.estimatedTokens();
        recorderService.record(new UsageRecord(
            request.endpoint(), tokensUsed, preflight.model(), request.feature(), request.requestId()), context);
        return response.body();
    }
}
