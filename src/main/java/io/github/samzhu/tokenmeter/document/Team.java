package io.github.samzhu.tokenmeter.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 團隊（唯讀）。{@code tokenLimit} 僅用於報表的使用率，不參與配額判斷。
 */
@Document(collection = "teams")
public record Team(
    @Id String id,
    @Indexed String organizationId,
    String name,
    String slug,
    long tokenLimit
) {
}
