package io.github.samzhu.points.service;

import java.time.Instant;
import java.time.ZoneId;

import io.github.samzhu.points.domain.StreakState;
import io.github.samzhu.points.util.DayUtils;

/**
 * 連續活動狀態機。
 *
 * <p>每次成功給予點數時依日曆日差異轉移：
 * <pre>
 * NoActivity          → Active(1)，起始時間 = now
 * Active(n)，同一天   → Active(n)
 * Active(n)，隔天     → Active(n + 1)，起始時間不變
 * Active(n)，≥ 2 天後 → Active(1)，起始時間 = now
 * now 早於最後活動時間 → 不變（時鐘偏移）
 * </pre>
 */
public class StreakTracker {

    private final ZoneId zone;

    public StreakTracker(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @param current 目前狀態
     * @param lastActionAt 上一次活動時間，null 表示從未活動
     * @param now 本次活動時間
     * @return 轉移後的狀態
     */
    public StreakState advance(StreakState current, Instant lastActionAt, Instant now) {
        if (current == null || !current.isActive() || lastActionAt == null) {
            return new StreakState(1, now);
        }
        if (now.isBefore(lastActionAt)) {
            return current;
        }

        long days = DayUtils.calendarDaysBetween(lastActionAt, now, zone);
        if (days == 0) {
            return current;
        }
        if (days == 1) {
            return new StreakState(current.currentStreak() + 1, current.startedAt());
        }
        return new StreakState(1, now);
    }

    public ZoneId zone() {
        return zone;
    }
}
