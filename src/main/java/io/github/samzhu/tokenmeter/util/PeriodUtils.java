package io.github.samzhu.tokenmeter.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * 週期管理工具類。
 *
 * <p>提供訂閱週期與報表月份的計算方法。所有時間計算均使用 UTC 時區，
 * 呼叫端傳入現在時間，方便以固定 Clock 測試。
 */
public final class PeriodUtils {

    private PeriodUtils() {
        // 工具類不允許實例化
    }

    /**
     * 時間區間，兩端皆含。
     *
     * @param start 開始時間
     * @param end 結束時間
     */
    public record Window(Instant start, Instant end) {

        public boolean contains(Instant instant) {
            return !instant.isBefore(start) && !instant.isAfter(end);
        }
    }

    /**
     * 計算訂閱週期的結束時間。
     *
     * @param periodStart 週期開始
     * @param periodDays 週期天數
     * @return {@code periodStart + periodDays}
     */
    public static Instant subscriptionPeriodEnd(Instant periodStart, int periodDays) {
        return periodStart.plus(Duration.ofDays(periodDays));
    }

    /**
     * 將已過期的訂閱週期往後滾動，直到涵蓋 {@code now}。
     *
     * <p>新週期從舊週期結束後的下一毫秒開始，結束時間為舊結束時間加上 {@code periodDays}，
     * 中間沒有使用的週期一併跳過。區間兩端皆含，落在舊結束時間的事件只屬於舊週期。
     *
     * @param currentEnd 目前週期結束時間
     * @param now 現在時間
     * @param periodDays 週期天數
     * @return 涵蓋 now 的新週期
     */
    public static Window rollForward(Instant currentEnd, Instant now, int periodDays) {
        Duration length = Duration.ofDays(periodDays);
        Instant end = currentEnd.plus(length);
        if (end.isBefore(now)) {
            long skipped = Duration.between(end, now).toMillis() / length.toMillis() + 1;
            end = end.plus(length.multipliedBy(skipped));
        }
        // MongoDB 日期精度為毫秒
        return new Window(end.minus(length).plusMillis(1), end);
    }

    /**
     * 取得 now 所在的 UTC 日曆月。
     *
     * @param now 現在時間
     * @return 該月 1 號 00:00:00 至最後一天 23:59:59.999
     */
    public static Window calendarMonth(Instant now) {
        LocalDate firstDay = now.atZone(ZoneOffset.UTC).toLocalDate().withDayOfMonth(1);
        LocalDate lastDay = firstDay.withDayOfMonth(firstDay.lengthOfMonth());
        return new Window(
            firstDay.atStartOfDay(ZoneOffset.UTC).toInstant(),
            lastDay.atTime(23, 59, 59, 999_000_000).atZone(ZoneOffset.UTC).toInstant());
    }

    /**
     * 取得事件所屬的 UTC 日期。
     */
    public static LocalDate toUtcDate(Instant instant) {
        return instant.atZone(ZoneOffset.UTC).toLocalDate();
    }

    /**
     * 計算距離週期結束的剩餘天數。
     *
     * @param periodEnd 週期結束時間
     * @param now 現在時間
     * @return 剩餘天數，如果已過期則返回 0
     */
    public static long getDaysRemaining(Instant periodEnd, Instant now) {
        if (periodEnd == null || now.isAfter(periodEnd)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(now, periodEnd);
    }
}
