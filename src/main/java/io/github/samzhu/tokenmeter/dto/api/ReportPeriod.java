package io.github.samzhu.tokenmeter.dto.api;

import java.time.Instant;

/**
 * 報表的時間區間（UTC 月初至月底，兩端皆含）。
 */
public record ReportPeriod(
    Instant start,
    Instant end
) {}
