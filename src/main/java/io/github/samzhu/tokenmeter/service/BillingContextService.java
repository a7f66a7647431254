package io.github.samzhu.tokenmeter.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.tokenmeter.document.TeamMembership;
import io.github.samzhu.tokenmeter.document.UserProfile;
import io.github.samzhu.tokenmeter.dto.BillingContext;
import io.github.samzhu.tokenmeter.repository.TeamMembershipRepository;
import io.github.samzhu.tokenmeter.repository.UserProfileRepository;

/**
 * 解析請求的計費歸屬（組織與團隊）。
 *
 * <p>歸屬只影響報表，不影響配額判斷，因此任何查詢失敗都降級為 null 歸屬並記錄警告。
 */
@Service
public class BillingContextService {

    private static final Logger log = LoggerFactory.getLogger(BillingContextService.class);

    private final UserProfileRepository profileRepository;
    private final TeamMembershipRepository membershipRepository;

    public BillingContextService(UserProfileRepository profileRepository,
                                 TeamMembershipRepository membershipRepository) {
        this.profileRepository = profileRepository;
        this.membershipRepository = membershipRepository;
    }

    /**
     * 解析用戶的計費歸屬。
     *
     * @param userId 用戶 ID
     * @return 計費歸屬，組織或團隊查不到時對應欄位為 null
     */
    public BillingContext resolve(String userId) {
        String organizationId = null;
        String teamId = null;
        try {
            organizationId = profileRepository.findById(userId)
                .map(UserProfile::organizationId)
                .orElse(null);
        } catch (Exception e) {
            log.warn("Organization lookup failed, recording without organization: userId={}, error={}",
                userId, e.getMessage());
        }
        try {
            teamId = membershipRepository.findFirstByUserIdOrderByJoinedAtAsc(userId)
                .map(TeamMembership::teamId)
                .orElse(null);
        } catch (Exception e) {
            log.warn("Team lookup failed, recording without team: userId={}, error={}",
                userId, e.getMessage());
        }
        log.debug("Billing context resolved: userId={}, organizationId={}, teamId={}",
            userId, organizationId, teamId);
        return new BillingContext(userId, organizationId, teamId);
    }
}
