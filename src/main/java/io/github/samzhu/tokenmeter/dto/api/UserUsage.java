package io.github.samzhu.tokenmeter.dto.api;

public record UserUsage(
    String userId,
    long tokensUsed,
    long requests
) {}
