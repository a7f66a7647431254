package io.github.samzhu.tokenmeter.controller;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.github.samzhu.tokenmeter.dto.api.ChangePlanRequest;
import io.github.samzhu.tokenmeter.dto.api.PlanView;
import io.github.samzhu.tokenmeter.dto.api.SubscriptionResponse;
import io.github.samzhu.tokenmeter.service.BillingContextService;
import io.github.samzhu.tokenmeter.service.PlanCatalogService;
import io.github.samzhu.tokenmeter.service.SubscriptionService;
import jakarta.validation.Valid;

/**
 * 訂閱管理 API 控制器。
 *
 * <p>提供方案目錄查詢、目前訂閱查詢與換方案端點。
 */
@RestController
@RequestMapping("/api/v1/subscriptions")
public class SubscriptionApiController {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionApiController.class);

    private final SubscriptionService subscriptionService;
    private final PlanCatalogService planCatalog;
    private final BillingContextService contextService;

    public SubscriptionApiController(SubscriptionService subscriptionService,
                                     PlanCatalogService planCatalog,
                                     BillingContextService contextService) {
        this.subscriptionService = subscriptionService;
        this.planCatalog = planCatalog;
        this.contextService = contextService;
    }

    @GetMapping("/plans")
    public ResponseEntity<List<PlanView>> getPlans() {
        log.debug("API request: getPlans");
        return ResponseEntity.ok(planCatalog.listActivePlans().stream()
            .map(PlanView::from)
            .toList());
    }

    /**
     * 取得目前訂閱，沒有時自動開通 Free 方案。
     */
    @GetMapping
    public ResponseEntity<SubscriptionResponse> getSubscription(
            @RequestHeader(UsageApiController.USER_HEADER) String userId) {
        log.info("API request: getSubscription userId={}", userId);
        return ResponseEntity.ok(SubscriptionResponse.from(
            subscriptionService.getOrCreateActiveSubscription(contextService.resolve(userId))));
    }

    /**
     * 換方案。
     *
     * @param userId 用戶 ID
     * @param request 新方案
     * @return 新訂閱；方案無效時 400
     */
    @PostMapping
    public ResponseEntity<SubscriptionResponse> changePlan(
            @RequestHeader(UsageApiController.USER_HEADER) String userId,
            @Valid @RequestBody ChangePlanRequest request) {
        log.info("API request: changePlan userId={}, planId={}", userId, request.planId());
        return ResponseEntity.ok(SubscriptionResponse.from(
            subscriptionService.changePlan(contextService.resolve(userId), request.planId())));
    }
}
