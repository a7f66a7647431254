package io.github.samzhu.tokenmeter.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.tokenmeter.dto.ActiveSubscription;
import io.github.samzhu.tokenmeter.dto.EnforcementResult;
import io.github.samzhu.tokenmeter.dto.UsageLimit;
import io.github.samzhu.tokenmeter.dto.api.CurrentUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.OrganizationUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.SetupBillingResponse;
import io.github.samzhu.tokenmeter.dto.api.SubscriptionResponse;
import io.github.samzhu.tokenmeter.dto.api.TeamUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.UsageCheckRequest;
import io.github.samzhu.tokenmeter.dto.api.UsageCheckResponse;
import io.github.samzhu.tokenmeter.dto.api.UsageHistoryResponse;
import io.github.samzhu.tokenmeter.service.BillingContextService;
import io.github.samzhu.tokenmeter.service.MeteredOperationService;
import io.github.samzhu.tokenmeter.service.MeteredOperationService.Preflight;
import io.github.samzhu.tokenmeter.service.SubscriptionService;
import io.github.samzhu.tokenmeter.service.UsageReportService;
import jakarta.validation.Valid;

/**
 * 用量 REST API 控制器。
 *
 * <p>提供以下端點：
 * <ul>
 *   <li>{@code GET /api/v1/usage/current} - 當期用量（首次呼叫自動開通 Free）</li>
 *   <li>{@code GET /api/v1/usage/history} - 個人用量歷史</li>
 *   <li>{@code GET /api/v1/usage/organization} - 所屬組織用量</li>
 *   <li>{@code GET /api/v1/usage/organization/{orgId}} - 指定組織用量</li>
 *   <li>{@code GET /api/v1/usage/team/{teamId}} - 團隊用量</li>
 *   <li>{@code POST /api/v1/usage/setup-billing} - 開通計費（冪等）</li>
 *   <li>{@code POST /api/v1/usage/check} - AI 操作前的配額預檢</li>
 * </ul>
 *
 * <p>身分由上游驗證後以 {@value #USER_HEADER} header 傳入。
 */
@RestController
@RequestMapping("/api/v1/usage")
public class UsageApiController {

    private static final Logger log = LoggerFactory.getLogger(UsageApiController.class);

    static final String USER_HEADER = "X-User-Id";

    private final UsageReportService reportService;
    private final SubscriptionService subscriptionService;
    private final BillingContextService contextService;
    private final MeteredOperationService meteredOperationService;

    public UsageApiController(UsageReportService reportService,
                              SubscriptionService subscriptionService,
                              BillingContextService contextService,
                              MeteredOperationService meteredOperationService) {
        this.reportService = reportService;
        this.subscriptionService = subscriptionService;
        this.contextService = contextService;
        this.meteredOperationService = meteredOperationService;
    }

    @GetMapping("/current")
    public ResponseEntity<CurrentUsageResponse> getCurrentUsage(@RequestHeader(USER_HEADER) String userId) {
        log.info("API request: getCurrentUsage userId={}", userId);
        return ResponseEntity.ok(reportService.currentUsage(userId));
    }

    /**
     * 查詢個人用量歷史。
     *
     * <p>端點：{@code GET /api/v1/usage/history?days=&limit=}
     *
     * @param userId 用戶 ID
     * @param days 查詢天數，預設 30
     * @param limit 最多事件數，預設 100
     * @return 用量歷史
     */
    @GetMapping("/history")
    public ResponseEntity<UsageHistoryResponse> getHistory(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(required = false) Integer days,
            @RequestParam(required = false) Integer limit) {

        log.info("API request: getHistory userId={}, days={}, limit={}", userId, days, limit);
        return ResponseEntity.ok(reportService.history(userId, days, limit));
    }

    @GetMapping("/organization")
    public ResponseEntity<OrganizationUsageResponse> getOwnOrganizationUsage(
            @RequestHeader(USER_HEADER) String userId) {
        log.info("API request: getOwnOrganizationUsage userId={}", userId);
        return ResponseEntity.ok(reportService.ownOrganizationReport(userId));
    }

    @GetMapping("/organization/{orgId}")
    public ResponseEntity<OrganizationUsageResponse> getOrganizationUsage(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String orgId) {
        log.info("API request: getOrganizationUsage userId={}, orgId={}", userId, orgId);
        return ResponseEntity.ok(reportService.organizationReport(userId, orgId));
    }

    @GetMapping("/team/{teamId}")
    public ResponseEntity<TeamUsageResponse> getTeamUsage(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String teamId) {
        log.info("API request: getTeamUsage userId={}, teamId={}", userId, teamId);
        return ResponseEntity.ok(reportService.teamReport(userId, teamId));
    }

    /**
     * 開通計費。已有 active 訂閱時不做任何變更。
     */
    @PostMapping("/setup-billing")
    public ResponseEntity<SetupBillingResponse> setupBilling(@RequestHeader(USER_HEADER) String userId) {
        log.info("API request: setupBilling userId={}", userId);
        ActiveSubscription active = subscriptionService.ensureSubscription(contextService.resolve(userId));
        String message = active.provisioned()
            ? "Free subscription created successfully"
            : "User already has an active subscription";
        return ResponseEntity.ok(new SetupBillingResponse(
            active.provisioned(), message, SubscriptionResponse.from(active)));
    }

    /**
     * AI 操作前的配額預檢。
     *
     * <p>放行回傳 200，拒絕回傳 429，兩者都帶預估 Token 與當期用量。
     */
    @PostMapping("/check")
    public ResponseEntity<UsageCheckResponse> checkUsage(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody UsageCheckRequest request) {

        log.info("API request: checkUsage userId={}, operation={}, textLength={}",
            userId, request.operation(), request.textLength());

        Preflight preflight = meteredOperationService.preflight(
            request.operation(), request.textLength(), request.model(), contextService.resolve(userId));
        EnforcementResult result = preflight.result();
        UsageLimit usage = result.usage();

        UsageCheckResponse body = new UsageCheckResponse(
            result.allowed(),
            preflight.estimatedTokens(),
            preflight.displayCost(),
            preflight.model(),
            usage == null ? null : usage.currentUsage(),
            usage == null ? null : usage.limit(),
            result.message());

        return result.allowed()
            ? ResponseEntity.ok(body)
            : ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(body);
    }
}
