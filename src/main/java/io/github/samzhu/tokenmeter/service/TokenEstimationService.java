package io.github.samzhu.tokenmeter.service;

import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.config.MeteringProperties.EstimationConfig;
import io.github.samzhu.tokenmeter.config.MeteringProperties.ModelEstimate;

/**
 * AI 操作的 Token 預估服務。
 *
 * <p>預估公式：
 * <pre>
 * estimate = ceil((base + textLength × perCharacter) × operationMultiplier)
 * </pre>
 *
 * <p>未設定的模型使用預設模型參數，未設定的操作倍率為 1.0。
 */
@Service
public class TokenEstimationService {

    private final EstimationConfig config;

    public TokenEstimationService(MeteringProperties properties) {
        this.config = properties.estimation();
    }

    /**
     * 預估 Token 消耗。
     *
     * @param operation 操作類型 (chat / refine / assess)
     * @param textLength 輸入文字長度
     * @param model 模型，null 時使用預設模型
     * @return 預估 Token
     */
    public long estimate(String operation, int textLength, String model) {
        ModelEstimate params = modelParameters(model);
        double multiplier = operation == null
            ? 1.0
            : config.operationMultipliers().getOrDefault(operation, 1.0);
        double raw = (params.base() + Math.max(0, textLength) * params.perCharacter()) * multiplier;
        return (long) Math.ceil(raw);
    }

    /**
     * 換算顯示給用戶的相對成本。
     *
     * @param estimatedTokens 預估 Token
     * @param model 模型
     * @return {@code ceil(estimatedTokens × costMultiplier)}
     */
    public long displayCost(long estimatedTokens, String model) {
        return (long) Math.ceil(estimatedTokens * modelParameters(model).costMultiplier());
    }

    /**
     * 取得實際用於預估的模型名稱。
     */
    public String resolveModel(String model) {
        if (model == null || model.isBlank() || !config.models().containsKey(model)) {
            return config.defaultModel();
        }
        return model;
    }

    private ModelEstimate modelParameters(String model) {
        ModelEstimate params = config.models().get(resolveModel(model));
        return params != null ? params : new ModelEstimate(0, 0, 1.0);
    }
}
