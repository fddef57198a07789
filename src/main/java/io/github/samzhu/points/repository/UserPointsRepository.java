package io.github.samzhu.points.repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;

import io.github.samzhu.points.document.UserPoints;

/**
 * 用戶點數狀態資料存取介面。
 *
 * <p>更新操作策略：
 * <ul>
 *   <li>連續活動使用 {@code @Query + @Update} 進行原子更新</li>
 *   <li>餘額增量與等級提升需要回傳更新前狀態，透過 MongoTemplate findAndModify 完成</li>
 * </ul>
 *
 * @see io.github.samzhu.points.document.UserPoints
 * @see io.github.samzhu.points.adapter.MongoUserPointsStore
 */
public interface UserPointsRepository extends MongoRepository<UserPoints, String> {

    Optional<UserPoints> findByUserId(String userId);

    // ========== 排行與活動查詢 ==========

    /**
     * 查詢點數排行榜。
     *
     * @param pageable 分頁參數（限制筆數）
     * @return 依餘額、等級降序排列的用戶
     */
    List<UserPoints> findAllByOrderByPointsBalanceDescCurrentLevelDesc(Pageable pageable);

    /**
     * 查詢自某時間起有活動的用戶（用於對帳排程）。
     *
     * @param since 起始時間（含）
     * @return 用戶清單
     */
    @Query("{ 'lastActionAt': { '$gte': ?0 } }")
    List<UserPoints> findActiveSince(Instant since);

    // ========== 更新操作 (@Query + @Update) ==========

    /**
     * 設定連續活動狀態。
     *
     * @param userId 用戶 ID
     * @param currentStreak 連續天數
     * @param streakStartedAt 起始時間
     * @param now 當前時間
     * @return 符合條件的文件數
     */
    @Query("{ 'userId': ?0 }")
    @Update("{ '$set': { 'currentStreak': ?1, 'streakStartedAt': ?2, 'updatedAt': ?3 } }")
    long assignStreakByUserId(String userId, int currentStreak, Instant streakStartedAt, Instant now);
}
