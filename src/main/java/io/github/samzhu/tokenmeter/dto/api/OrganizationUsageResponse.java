package io.github.samzhu.tokenmeter.dto.api;

import java.util.List;
import java.util.Map;

/**
 * 組織用量 API 回應。
 *
 * <p>用於 GET /api/v1/usage/organization 與 GET /api/v1/usage/organization/{orgId} 端點。
 */
public record OrganizationUsageResponse(
    OrganizationInfo organization,
    ReportPeriod period,
    long totalTokens,
    long totalEvents,
    long uniqueUsers,
    Map<String, Long> featureBreakdown,
    Map<String, Long> dailyUsage,
    List<DailyTotal> trend,
    List<TeamUsage> teams,
    List<MemberUsage> members,
    List<UserUsage> topUsers,
    int teamsCount,
    String userRole
) {

    public record OrganizationInfo(
        String id,
        String name,
        long tokenLimit
    ) {}
}
