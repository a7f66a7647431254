package io.github.samzhu.tokenmeter.exception;

/**
 * 受計量的 AI 操作執行失敗。
 *
 * <p>拋出前已記錄固定的失敗 Token。
 */
public class MeteredOperationException extends RuntimeException {

    private final String feature;
    private final String requestId;

    public MeteredOperationException(String feature, String requestId, Throwable cause) {
        super(String.format("AI operation failed: feature='%s', requestId='%s'", feature, requestId), cause);
        this.feature = feature;
        this.requestId = requestId;
    }

    public String getFeature() {
        return feature;
    }

    public String getRequestId() {
        return requestId;
    }
}
