package io.github.samzhu.points.dto;

import java.time.Instant;

/**
 * 用戶進度摘要。
 *
 * @param userId 用戶 ID
 * @param pointsBalance 點數餘額
 * @param level 當前等級
 * @param levelName 當前等級名稱
 * @param nextLevel 下一等級，已達最高等級時為 null
 * @param nextLevelName 下一等級名稱，已達最高等級時為 null
 * @param pointsToNextLevel 距下一等級所需點數，已達最高等級時為 0
 * @param progressToNextLevel 到下一等級的進度 [0, 1]
 * @param currentStreak 連續活動天數
 * @param streakStartedAt 連續活動起始時間
 * @param lastActionAt 最後活動時間
 */
public record ProgressSummary(
    String userId,
    long pointsBalance,
    int level,
    String levelName,
    Integer nextLevel,
    String nextLevelName,
    long pointsToNextLevel,
    double progressToNextLevel,
    int currentStreak,
    Instant streakStartedAt,
    Instant lastActionAt
) {

    public boolean isMaxLevel() {
        return nextLevel == null;
    }
}
