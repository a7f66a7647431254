package io.github.samzhu.tokenmeter.exception;

import io.github.samzhu.tokenmeter.dto.EnforcementResult;

/**
 * 配額閘門拒絕請求。
 *
 * <p>攜帶閘門結果，API 層轉為 429 並帶出當期用量與上限。
 */
public class UsageLimitExceededException extends RuntimeException {

    private final EnforcementResult result;

    public UsageLimitExceededException(EnforcementResult result) {
        super(result.message());
        this.result = result;
    }

    public EnforcementResult getResult() {
        return result;
    }
}
