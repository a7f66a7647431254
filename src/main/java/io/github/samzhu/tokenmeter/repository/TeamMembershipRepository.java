package io.github.samzhu.tokenmeter.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.tokenmeter.document.TeamMembership;

/**
 * 團隊成員關係資料存取介面（唯讀）。
 */
public interface TeamMembershipRepository extends MongoRepository<TeamMembership, String> {

    /**
     * 查詢用戶最早加入的團隊，作為用量事件的團隊歸屬。
     */
    Optional<TeamMembership> findFirstByUserIdOrderByJoinedAtAsc(String userId);

    Optional<TeamMembership> findByUserIdAndTeamId(String userId, String teamId);

    List<TeamMembership> findByTeamId(String teamId);
}
