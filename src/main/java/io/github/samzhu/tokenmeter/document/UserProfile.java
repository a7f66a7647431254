package io.github.samzhu.tokenmeter.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 用戶資料（唯讀，由帳號模組維護）。
 *
 * <p>{@code id} 即用戶 ID。本服務只讀取組織歸屬與組織角色。
 */
@Document(collection = "user_profiles")
public record UserProfile(
    @Id String id,
    String organizationId,
    String fullName,
    /** org_admin / member */
    String orgRole
) {

    public static final String ROLE_ORG_ADMIN = "org_admin";
    public static final String ROLE_MEMBER = "member";

    public boolean isOrgAdmin() {
        return ROLE_ORG_ADMIN.equals(orgRole);
    }
}
