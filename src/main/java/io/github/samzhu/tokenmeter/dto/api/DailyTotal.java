package io.github.samzhu.tokenmeter.dto.api;

import java.time.LocalDate;

/**
 * 單日 Token 總量（趨勢圖使用，無用量的日期為 0）。
 */
public record DailyTotal(
    LocalDate date,
    long tokens
) {}
