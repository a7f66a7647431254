package io.github.samzhu.tokenmeter.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "organizations")
public record Organization(
    @Id String id,
    String name,
    long tokenLimit
) {
}
