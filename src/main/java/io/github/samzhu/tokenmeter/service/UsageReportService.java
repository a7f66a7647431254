package io.github.samzhu.tokenmeter.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.config.MeteringProperties;
import io.github.samzhu.tokenmeter.config.MeteringProperties.ReportingConfig;
import io.github.samzhu.tokenmeter.document.Organization;
import io.github.samzhu.tokenmeter.document.Team;
import io.github.samzhu.tokenmeter.document.TeamMembership;
import io.github.samzhu.tokenmeter.document.TokenUsageEvent;
import io.github.samzhu.tokenmeter.document.UserProfile;
import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.dto.UsageLimit;
import io.github.samzhu.tokenmeter.dto.api.CurrentUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.MemberUsage;
import io.github.samzhu.tokenmeter.dto.api.OrganizationUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.ReportPeriod;
import io.github.samzhu.tokenmeter.dto.api.TeamUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.UsageEventView;
import io.github.samzhu.tokenmeter.dto.api.UsageHistoryResponse;
import io.github.samzhu.tokenmeter.dto.api.UserUsage;
import io.github.samzhu.tokenmeter.exception.ResourceNotFoundException;
import io.github.samzhu.tokenmeter.exception.SubscriptionResolutionException;
import io.github.samzhu.tokenmeter.exception.UsageAccessDeniedException;
import io.github.samzhu.tokenmeter.repository.OrganizationRepository;
import io.github.samzhu.tokenmeter.repository.TeamMembershipRepository;
import io.github.samzhu.tokenmeter.repository.TeamRepository;
import io.github.samzhu.tokenmeter.repository.TokenUsageEventRepository;
import io.github.samzhu.tokenmeter.repository.UserProfileRepository;
import io.github.samzhu.tokenmeter.util.PeriodUtils;

/**
 * 用量報表服務。
 *
 * <p>提供用戶、組織、團隊三個層級的用量檢視。組織與團隊報表以當前 UTC 日曆月為範圍，
 * 並在查詢前檢查呼叫者權限：
 * <ul>
 *   <li>組織報表 - 呼叫者必須是該組織的 {@code org_admin}</li>
 *   <li>團隊報表 - 呼叫者必須是團隊成員，且為 {@code team_admin} 或 {@code org_admin}</li>
 * </ul>
 */
@Service
public class UsageReportService {

    private static final Logger log = LoggerFactory.getLogger(UsageReportService.class);

    private final UsageLimitService limitService;
    private final BillingContextService contextService;
    private final UsageAggregationService aggregation;
    private final TokenUsageEventRepository eventRepository;
    private final UserProfileRepository profileRepository;
    private final TeamMembershipRepository membershipRepository;
    private final TeamRepository teamRepository;
    private final OrganizationRepository organizationRepository;
    private final ReportingConfig reporting;
    private final Clock clock;

    public UsageReportService(
            UsageLimitService limitService,
            BillingContextService contextService,
            UsageAggregationService aggregation,
            TokenUsageEventRepository eventRepository,
            UserProfileRepository profileRepository,
            TeamMembershipRepository membershipRepository,
            TeamRepository teamRepository,
            OrganizationRepository organizationRepository,
            MeteringProperties properties,
            Clock clock) {
        this.limitService = limitService;
        this.contextService = contextService;
        this.aggregation = aggregation;
        this.eventRepository = eventRepository;
        this.profileRepository = profileRepository;
        this.membershipRepository = membershipRepository;
        this.teamRepository = teamRepository;
        this.organizationRepository = organizationRepository;
        this.reporting = properties.reporting();
        this.clock = clock;
    }

    /**
     * 用戶當期用量，首次查詢時自動開通 Free 方案。
     *
     * @param userId 用戶 ID
     * @return 當期用量
     * @throws SubscriptionResolutionException 無法解析訂閱
     */
    public CurrentUsageResponse currentUsage(String userId) {
        BillingContext context = contextService.resolve(userId);
        UsageLimit usage = limitService.evaluate(context)
            .orElseThrow(() -> new SubscriptionResolutionException(userId));
        return CurrentUsageResponse.from(usage,
            PeriodUtils.getDaysRemaining(usage.periodEnd(), clock.instant()));
    }

    /**
     * 用戶用量歷史。
     *
     * @param userId 用戶 ID
     * @param days 查詢天數，null 或非正數時使用預設值
     * @param limit 最多讀取的事件數，null 或非正數時使用預設值
     * @return 用量歷史
     */
    public UsageHistoryResponse history(String userId, Integer days, Integer limit) {
        int effectiveDays = days == null || days <= 0 ? reporting.historyDays() : days;
        int effectiveLimit = limit == null || limit <= 0 ? reporting.historyLimit() : limit;
        Instant since = clock.instant().minus(Duration.ofDays(effectiveDays));

        List<TokenUsageEvent> events = eventRepository
            .findByUserIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDesc(
                userId, since, PageRequest.of(0, effectiveLimit));

        log.debug("History loaded: userId={}, days={}, events={}", userId, effectiveDays, events.size());

        return new UsageHistoryResponse(
            effectiveDays,
            events.size(),
            aggregation.totalTokens(events),
            aggregation.dailyFeatureUsage(events),
            aggregation.byFeature(events),
            aggregation.byModel(events),
            events.stream()
                .limit(reporting.rawEventLimit())
                .map(UsageEventView::from)
                .toList());
    }

    /**
     * 呼叫者所屬組織的用量報表。
     *
     * @param callerId 呼叫者 ID
     * @return 組織用量
     * @throws UsageAccessDeniedException 呼叫者不屬於任何組織或不是組織管理員
     */
    public OrganizationUsageResponse ownOrganizationReport(String callerId) {
        UserProfile profile = profileRepository.findById(callerId)
            .filter(p -> p.organizationId() != null)
            .orElseThrow(() -> new UsageAccessDeniedException("User not in an organization"));
        return organizationReport(callerId, profile.organizationId());
    }

    /**
     * 指定組織的用量報表（當月）。
     *
     * @param callerId 呼叫者 ID
     * @param organizationId 組織 ID
     * @return 組織用量
     * @throws UsageAccessDeniedException 呼叫者不是該組織的管理員
     * @throws ResourceNotFoundException 組織不存在
     */
    public OrganizationUsageResponse organizationReport(String callerId, String organizationId) {
        UserProfile profile = profileRepository.findById(callerId)
            .orElseThrow(() -> new UsageAccessDeniedException("Access denied - user profile not found"));
        if (!profile.isOrgAdmin() || !organizationId.equals(profile.organizationId())) {
            log.warn("Organization usage access denied: userId={}, organizationId={}", callerId, organizationId);
            throw new UsageAccessDeniedException(
                "Access denied - organization admin privileges required for this organization");
        }

        Organization organization = organizationRepository.findById(organizationId)
            .orElseThrow(() -> new ResourceNotFoundException("Organization not found"));

        Instant now = clock.instant();
        PeriodUtils.Window month = PeriodUtils.calendarMonth(now);
        List<TokenUsageEvent> events = eventRepository.findByOrganizationInWindow(
            organizationId, month.start(), month.end());
        List<Team> teams = teamRepository.findByOrganizationId(organizationId);
        List<UserProfile> members = profileRepository.findByOrganizationId(organizationId);

        Map<String, Long> daily = aggregation.dailyTotals(events);
        Map<String, UserUsage> byUser = aggregation.byUser(events);

        List<MemberUsage> memberUsage = members.stream()
            .map(member -> toMemberUsage(member.id(), member.fullName(), member.orgRole(), byUser))
            .sorted((a, b) -> Long.compare(b.tokensUsed(), a.tokensUsed()))
            .toList();

        log.info("Organization usage report: organizationId={}, events={}, teams={}",
            organizationId, events.size(), teams.size());

        return new OrganizationUsageResponse(
            new OrganizationUsageResponse.OrganizationInfo(
                organization.id(), organization.name(), organization.tokenLimit()),
            new ReportPeriod(month.start(), month.end()),
            aggregation.totalTokens(events),
            events.size(),
            aggregation.uniqueUsers(events),
            aggregation.byFeature(events),
            daily,
            aggregation.trend(daily, PeriodUtils.toUtcDate(now), reporting.trendDays()),
            aggregation.byTeam(events, teams),
            memberUsage,
            aggregation.topUsers(events, reporting.topUsers()),
            teams.size(),
            profile.orgRole());
    }

    /**
     * 團隊用量報表（當月）。
     *
     * @param callerId 呼叫者 ID
     * @param teamId 團隊 ID
     * @return 團隊用量
     * @throws UsageAccessDeniedException 呼叫者不是團隊成員，或既非團隊管理員也非組織管理員
     * @throws ResourceNotFoundException 團隊不存在
     */
    public TeamUsageResponse teamReport(String callerId, String teamId) {
        TeamMembership membership = membershipRepository.findByUserIdAndTeamId(callerId, teamId)
            .orElseThrow(() -> new UsageAccessDeniedException(
                "Access denied to team - user is not a member of this team"));

        boolean orgAdmin = profileRepository.findById(callerId)
            .map(UserProfile::isOrgAdmin)
            .orElse(false);
        if (!membership.isTeamAdmin() && !orgAdmin) {
            log.warn("Team usage access denied: userId={}, teamId={}", callerId, teamId);
            throw new UsageAccessDeniedException("Access denied - team admin privileges required");
        }

        Team team = teamRepository.findById(teamId)
            .orElseThrow(() -> new ResourceNotFoundException("Team not found"));

        PeriodUtils.Window month = PeriodUtils.calendarMonth(clock.instant());
        List<TokenUsageEvent> events = eventRepository.findByTeamInWindow(teamId, month.start(), month.end());
        List<TeamMembership> memberships = membershipRepository.findByTeamId(teamId);
        Map<String, UserUsage> byUser = aggregation.byUser(events);

        List<MemberUsage> members = memberships.stream()
            .map(m -> toMemberUsage(m.userId(),
                profileRepository.findById(m.userId()).map(UserProfile::fullName).orElse(null),
                m.teamRole(), byUser))
            .sorted((a, b) -> Long.compare(b.tokensUsed(), a.tokensUsed()))
            .toList();

        log.info("Team usage report: teamId={}, events={}, members={}", teamId, events.size(), members.size());

        return new TeamUsageResponse(
            new TeamUsageResponse.TeamInfo(team.id(), team.name(), team.organizationId(), team.tokenLimit()),
            new ReportPeriod(month.start(), month.end()),
            aggregation.totalTokens(events),
            events.size(),
            aggregation.byFeature(events),
            aggregation.dailyTotals(events),
            members,
            membership.teamRole());
    }

    private static MemberUsage toMemberUsage(String userId, String fullName, String role,
                                             Map<String, UserUsage> byUser) {
        UserUsage usage = byUser.get(userId);
        return new MemberUsage(userId, fullName, role,
            usage == null ? 0 : usage.tokensUsed(),
            usage == null ? 0 : usage.requests());
    }
}
