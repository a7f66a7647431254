package io.github.samzhu.tokenmeter.dto.api;

/**
 * 團隊用量（組織報表使用）。
 *
 * @param teamId 團隊 ID
 * @param teamName 團隊名稱
 * @param tokensUsed Token 數
 * @param tokenLimit 團隊上限，0 表示未設定
 * @param usagePercent 佔團隊上限百分比，未設定上限時為 0
 * @param activeUsers 有用量的成員數
 * @param requests 請求數
 */
public record TeamUsage(
    String teamId,
    String teamName,
    long tokensUsed,
    long tokenLimit,
    double usagePercent,
    long activeUsers,
    long requests
) {}
