package io.github.samzhu.tokenmeter.exception;

/**
 * 查詢的組織、團隊或方案不存在。
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
