package io.github.samzhu.points.dto;

/**
 * 排行榜項目。
 *
 * @param rank 名次，從 1 開始
 * @param userId 用戶 ID
 * @param pointsBalance 點數餘額
 * @param level 等級
 * @param levelName 等級名稱
 */
public record LeaderboardEntry(
    int rank,
    String userId,
    long pointsBalance,
    int level,
    String levelName
) {
}
