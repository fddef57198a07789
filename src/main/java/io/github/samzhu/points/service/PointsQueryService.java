package io.github.samzhu.points.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import io.github.samzhu.points.document.PointsTransaction;
import io.github.samzhu.points.document.UserPoints;
import io.github.samzhu.points.domain.LevelThreshold;
import io.github.samzhu.points.dto.LeaderboardEntry;
import io.github.samzhu.points.dto.ProgressSummary;
import io.github.samzhu.points.exception.UnknownUserException;
import io.github.samzhu.points.port.PointsLedger;
import io.github.samzhu.points.port.UserPointsStore;

/**
 * 點數查詢服務。
 *
 * <p>提供帳本歷史、用戶進度與排行榜查詢，供 API 層或其他服務使用。
 * 所有查詢只讀，不需要交易。
 */
@Service
public class PointsQueryService {

    private static final Logger log = LoggerFactory.getLogger(PointsQueryService.class);

    static final int MAX_PAGE_SIZE = 100;

    private final PointsLedger ledger;
    private final UserPointsStore userPointsStore;
    private final LevelCalculator levelCalculator;

    public PointsQueryService(
            PointsLedger ledger,
            UserPointsStore userPointsStore,
            LevelCalculator levelCalculator) {
        this.ledger = ledger;
        this.userPointsStore = userPointsStore;
        this.levelCalculator = levelCalculator;
    }

    // ========== 帳本查詢 ==========

    /**
     * 分頁查詢用戶交易歷史，最新的在前。
     *
     * @param userId 用戶 ID
     * @param page 頁碼，從 0 開始
     * @param size 每頁筆數，限制在 1-100
     * @return 分頁結果
     */
    public Page<PointsTransaction> history(String userId, int page, int size) {
        log.debug("Querying history: userId={}, page={}, size={}", userId, page, size);
        return ledger.findByUser(userId, PageRequest.of(Math.max(0, page), clamp(size)));
    }

    /**
     * 查詢時間範圍內的交易（含邊界），依時間升序。
     *
     * @throws IllegalArgumentException 如果 {@code from} 晚於 {@code to}
     */
    public List<PointsTransaction> transactionsBetween(String userId, Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to: from=" + from + ", to=" + to);
        }
        return ledger.findByUserBetween(userId, from, to);
    }

    public List<PointsTransaction> byCorrelationId(String correlationId) {
        return ledger.findByCorrelationId(correlationId);
    }

    /**
     * 查詢特定動作的近期交易。
     *
     * @param action 動作代碼
     * @param since 起始時間，null 表示不限
     * @param limit 最大筆數，限制在 1-100
     * @return 依時間降序的交易
     */
    public List<PointsTransaction> byAction(String action, Instant since, int limit) {
        return ledger.findByAction(action, since, clamp(limit));
    }

    // ========== 進度與排行 ==========

    /**
     * 查詢用戶進度摘要。
     *
     * @param userId 用戶 ID
     * @return 進度摘要
     * @throws UnknownUserException 用戶不存在
     */
    public ProgressSummary progress(String userId) {
        UserPoints user = userPointsStore.find(userId)
            .orElseThrow(() -> new UnknownUserException(userId));

        long balance = user.pointsBalance();
        int level = user.currentLevel();
        Optional<LevelThreshold> next = levelCalculator.nextLevel(balance);

        return new ProgressSummary(
            userId,
            balance,
            level,
            levelCalculator.nameOf(level),
            next.map(LevelThreshold::level).orElse(null),
            next.map(LevelThreshold::name).orElse(null),
            levelCalculator.pointsToNextLevel(balance),
            levelCalculator.progressToNextLevel(balance),
            user.currentStreak(),
            user.streakStartedAt(),
            user.lastActionAt()
        );
    }

    /**
     * 查詢排行榜，依餘額降序、等級降序。
     *
     * @param limit 筆數，限制在 1-100
     * @return 排行榜，名次從 1 開始
     */
    public List<LeaderboardEntry> leaderboard(int limit) {
        List<UserPoints> users = userPointsStore.findTopByBalance(clamp(limit));
        List<LeaderboardEntry> entries = new ArrayList<>(users.size());
        for (int i = 0; i < users.size(); i++) {
            UserPoints user = users.get(i);
            entries.add(new LeaderboardEntry(
                i + 1,
                user.userId(),
                user.pointsBalance(),
                user.currentLevel(),
                levelCalculator.nameOf(user.currentLevel())
            ));
        }
        return entries;
    }

    private static int clamp(int size) {
        return Math.max(1, Math.min(MAX_PAGE_SIZE, size));
    }
}
