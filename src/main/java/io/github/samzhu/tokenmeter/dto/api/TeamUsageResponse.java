package io.github.samzhu.tokenmeter.dto.api;

import java.util.List;
import java.util.Map;

/**
 * 團隊用量 API 回應。
 *
 * <p>用於 GET /api/v1/usage/team/{teamId} 端點。
 */
public record TeamUsageResponse(
    TeamInfo team,
    ReportPeriod period,
    long totalTokens,
    long totalEvents,
    Map<String, Long> featureBreakdown,
    Map<String, Long> dailyUsage,
    List<MemberUsage> members,
    String userRole
) {

    public record TeamInfo(
        String id,
        String name,
        String organizationId,
        long tokenLimit
    ) {}
}
