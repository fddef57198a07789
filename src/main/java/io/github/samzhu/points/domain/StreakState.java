package io.github.samzhu.points.domain;

import java.time.Instant;

/**
 * 連續活動狀態。
 *
 * <p>{@code currentStreak == 0} 對應 NoActivity 狀態，
 * 其餘對應 Active(n)。
 *
 * @param currentStreak 連續天數
 * @param startedAt 本次連續紀錄的起始時間，NoActivity 時為 null
 */
public record StreakState(
    int currentStreak,
    Instant startedAt
) {
    public static final StreakState NO_ACTIVITY = new StreakState(0, null);

    public StreakState {
        if (currentStreak < 0) {
            throw new IllegalArgumentException("Streak cannot be negative: " + currentStreak);
        }
    }

    public boolean isActive() {
        return currentStreak > 0;
    }
}
