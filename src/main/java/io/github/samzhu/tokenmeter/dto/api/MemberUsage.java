package io.github.samzhu.tokenmeter.dto.api;

/**
 * 成員用量。
 *
 * @param userId 用戶 ID
 * @param fullName 顯示名稱
 * @param role 組織或團隊角色
 * @param tokensUsed Token 數
 * @param requests 請求數
 */
public record MemberUsage(
    String userId,
    String fullName,
    String role,
    long tokensUsed,
    long requests
) {}
