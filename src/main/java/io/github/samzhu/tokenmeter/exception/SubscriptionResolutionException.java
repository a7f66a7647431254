package io.github.samzhu.tokenmeter.exception;

/**
 * 無法解析用戶的 active 訂閱（資料存取失敗或設定錯誤）。
 *
 * <p>配額判斷遇到此異常時回傳「無法判斷」，由閘門拒絕請求。
 */
public class SubscriptionResolutionException extends RuntimeException {

    private final String userId;

    public SubscriptionResolutionException(String userId, Throwable cause) {
        super(String.format("Failed to resolve subscription: userId='%s', reason='%s'",
            userId, cause.getMessage()), cause);
        this.userId = userId;
    }

    public SubscriptionResolutionException(String userId) {
        super(String.format("Unable to resolve subscription: userId='%s'", userId));
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
