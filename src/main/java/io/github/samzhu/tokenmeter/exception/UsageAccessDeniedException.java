package io.github.samzhu.tokenmeter.exception;

/**
 * 用戶無權查看組織或團隊用量。
 */
public class UsageAccessDeniedException extends RuntimeException {

    public UsageAccessDeniedException(String message) {
        super(message);
    }
}
