package io.github.samzhu.tokenmeter.dto;

/**
 * 單次請求的計費歸屬。
 *
 * <p>每個請求只解析一次，之後傳給訂閱解析與用量記錄使用，
 * 避免各元件各自重查組織與團隊。{@code organizationId} 與 {@code teamId}
 * 只用於歸屬，查不到時為 null。
 *
 * @param userId 用戶 ID（必填）
 * @param organizationId 所屬組織，可為 null
 * @param teamId 所屬團隊（最早加入者），可為 null
 */
public record BillingContext(
    String userId,
    String organizationId,
    String teamId
) {
    public BillingContext {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
    }

    /**
     * 建立沒有組織與團隊歸屬的 context。
     */
    public static BillingContext ofUser(String userId) {
        return new BillingContext(userId, null, null);
    }
}
