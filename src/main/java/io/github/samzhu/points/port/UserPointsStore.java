package io.github.samzhu.points.port;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import io.github.samzhu.points.document.UserPoints;
import io.github.samzhu.points.exception.UnknownUserException;

/**
 * 用戶點數狀態的存取與原子更新命令。
 *
 * <p>用戶生命週期由外部子系統負責；此介面只提供讀取與原子命令，
 * 所有寫入都不得是「讀取、修改、寫回」。
 *
 * @see io.github.samzhu.points.adapter.MongoUserPointsStore
 */
public interface UserPointsStore {

    Optional<UserPoints> find(String userId);

    /**
     * 原子增加餘額並推進最後活動時間。
     *
     * <p>單一原子命令完成，回傳更新<b>前</b>的狀態，
     * 讓呼叫端得知本次增量所依據的前一個餘額、等級與前一次活動時間。
     * 最後活動時間以 {@code $max} 寫入，時鐘偏移時不會倒退。
     *
     * @param userId 用戶 ID
     * @param points 增量
     * @param actedAt 活動時間
     * @return 更新前的狀態
     * @throws UnknownUserException 如果用戶不存在
     */
    UserPoints incrementBalance(String userId, int points, Instant actedAt);

    /**
     * 將等級提高到指定值；已高於指定值時不變。
     *
     * <p>單一原子命令完成，回傳命令執行前的已儲存等級；
     * 回傳值小於 {@code level} 表示本次呼叫確實提高了等級。
     *
     * @param userId 用戶 ID
     * @param level 新等級
     * @return 更新前的已儲存等級
     * @throws UnknownUserException 如果用戶不存在
     */
    int raiseLevel(String userId, int level);

    /**
     * 設定連續活動狀態。
     *
     * @param userId 用戶 ID
     * @param currentStreak 連續天數
     * @param streakStartedAt 起始時間
     */
    void assignStreak(String userId, int currentStreak, Instant streakStartedAt);

    /**
     * 查詢餘額排行榜，依餘額降序、等級降序排列。
     *
     * @param limit 最大筆數
     * @return 用戶清單
     */
    List<UserPoints> findTopByBalance(int limit);

    /**
     * 查詢自某時間起有活動的用戶。
     *
     * @param since 起始時間（含）
     * @return 用戶清單
     */
    List<UserPoints> findActiveSince(Instant since);
}
