package io.github.samzhu.tokenmeter.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 團隊成員關係（唯讀）。
 */
@Document(collection = "user_team_memberships")
@CompoundIndex(name = "user_team_idx", def = "{'userId': 1, 'teamId': 1}", unique = true)
public record TeamMembership(
    @Id String id,
    String userId,
    String teamId,
    /** team_admin / member / viewer */
    String teamRole,
    Instant joinedAt
) {

    public static final String ROLE_TEAM_ADMIN = "team_admin";
    public static final String ROLE_MEMBER = "member";
    public static final String ROLE_VIEWER = "viewer";

    public boolean isTeamAdmin() {
        return ROLE_TEAM_ADMIN.equals(teamRole);
    }
}
