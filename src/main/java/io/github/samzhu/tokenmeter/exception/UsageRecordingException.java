package io.github.samzhu.tokenmeter.exception;

/**
 * 用量寫入失敗。
 *
 * <p>只在 {@code UsageRecorderService} 內部使用：記錄失敗會寫入日誌，
 * 不會讓已完成的 AI 操作失敗。
 */
public class UsageRecordingException extends RuntimeException {

    private final String requestId;

    public UsageRecordingException(String message, String requestId) {
        super(message);
        this.requestId = requestId;
    }

    public UsageRecordingException(String message, String requestId, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
