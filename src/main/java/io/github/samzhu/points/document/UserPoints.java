package io.github.samzhu.points.document;

import java.time.Instant;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.points.domain.StreakState;

/**
 * 用戶點數狀態文件。
 *
 * <p>{@code users} 集合由外部用戶管理子系統擁有，此 record 只映射本服務負責的欄位，
 * 其他欄位在讀取時忽略。本服務不建立也不刪除用戶。
 *
 * <p>更新原則：
 * <ul>
 *   <li>餘額只用 {@code $inc} 原子增量，不做讀取後寫回</li>
 *   <li>等級只用 {@code $max}，確保單調遞增</li>
 *   <li>只有 {@link io.github.samzhu.points.service.PointsEngine} 可以寫入這些欄位</li>
 * </ul>
 */
@Document(collection = "users")
public record UserPoints(
    @Id String id,

    /** 用戶唯一識別碼 */
    @Indexed(unique = true) String userId,

    // ========== 點數與等級 ==========
    /** 點數餘額，等於帳本中該用戶所有點數的總和 */
    long pointsBalance,
    /** 當前等級 (≥ 1) */
    int currentLevel,

    // ========== 連續活動 ==========
    /** 連續活動天數 */
    int currentStreak,
    /** 本次連續活動起始時間 */
    Instant streakStartedAt,
    /** 最後一次獲得點數的時間 */
    @Indexed Instant lastActionAt,

    // ========== 時間戳記 ==========
    /** 文件最後更新時間 */
    Instant updatedAt
) {

    public UserPoints {
        if (currentLevel < 1) {
            currentLevel = 1;
        }
    }

    /**
     * 建立新用戶的初始狀態（餘額 0、等級 1、無連續活動）。
     *
     * @param userId 用戶 ID
     * @return UserPoints
     */
    public static UserPoints initial(String userId) {
        return new UserPoints(null, userId, 0, 1, 0, null, null, null);
    }

    /**
     * @return 目前的連續活動狀態
     */
    public StreakState streak() {
        return currentStreak <= 0 ? StreakState.NO_ACTIVITY : new StreakState(currentStreak, streakStartedAt);
    }
}
