package io.github.samzhu.points.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;

/**
 * 日曆日計算工具類。
 *
 * <p>連續活動以「日曆日」為單位，而非經過的小時數，
 * 因此同一天內的時間差不影響計算結果。所有方法都需明確傳入時區。
 */
public final class DayUtils {

    private DayUtils() {
        // 工具類不允許實例化
    }

    /**
     * 取得時間點在指定時區的日曆日。
     *
     * @param instant 時間點
     * @param zone 時區
     * @return 日曆日
     */
    public static LocalDate toDate(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }

    /**
     * 計算兩個時間點之間相差的日曆日數。
     *
     * <p>例如 23:59 與隔天 00:01 相差 1 天；同一天的 00:01 與 23:59 相差 0 天。
     *
     * @param from 起始時間
     * @param to 結束時間
     * @param zone 時區
     * @return 相差日數，{@code to} 早於 {@code from} 時為負數
     */
    public static long calendarDaysBetween(Instant from, Instant to, ZoneId zone) {
        return ChronoUnit.DAYS.between(toDate(from, zone), toDate(to, zone));
    }
}
