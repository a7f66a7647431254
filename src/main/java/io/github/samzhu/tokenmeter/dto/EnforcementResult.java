package io.github.samzhu.tokenmeter.dto;

/**
 * 配額閘門的判斷結果。
 *
 * @param allowed 是否放行
 * @param usage 判斷當下的用量（無法取得時為 null）
 * @param message 拒絕原因，放行時為 null
 * @param estimatedTokens 此次判斷使用的預估 Token
 */
public record EnforcementResult(
    boolean allowed,
    UsageLimit usage,
    String message,
    long estimatedTokens
) {

    public static EnforcementResult allow(UsageLimit usage, long estimatedTokens) {
        return new EnforcementResult(true, usage, null, estimatedTokens);
    }

    public static EnforcementResult deny(UsageLimit usage, String message, long estimatedTokens) {
        return new EnforcementResult(false, usage, message, estimatedTokens);
    }
}
