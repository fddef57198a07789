package io.github.samzhu.points.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import io.github.samzhu.points.config.PointsProperties;
import io.github.samzhu.points.document.UserPoints;
import io.github.samzhu.points.dto.ReconciliationReport;
import io.github.samzhu.points.exception.UnknownUserException;
import io.github.samzhu.points.port.PointsLedger;
import io.github.samzhu.points.port.UserPointsStore;

/**
 * 帳本對帳服務。
 *
 * <p>以帳本為事實來源，檢查用戶文件中的餘額與等級：
 * <ul>
 *   <li>餘額必須等於帳本點數總和</li>
 *   <li>等級必須等於依帳本總和計算的等級</li>
 * </ul>
 *
 * <p>不一致只記錄警告，不自動修正餘額；等級可透過 {@link #backfillLevel} 回補。
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final PointsLedger ledger;
    private final UserPointsStore userPointsStore;
    private final LevelCalculator levelCalculator;
    private final PointsEngine pointsEngine;
    private final PointsProperties.ReconciliationConfig config;
    private final Clock clock;

    public ReconciliationService(
            PointsLedger ledger,
            UserPointsStore userPointsStore,
            LevelCalculator levelCalculator,
            PointsEngine pointsEngine,
            PointsProperties properties,
            Clock clock) {
        this.ledger = ledger;
        this.userPointsStore = userPointsStore;
        this.levelCalculator = levelCalculator;
        this.pointsEngine = pointsEngine;
        this.config = properties.reconciliation();
        this.clock = clock;
    }

    /**
     * 對帳單一用戶。
     *
     * @param userId 用戶 ID
     * @return 對帳結果
     * @throws UnknownUserException 用戶不存在
     */
    public ReconciliationReport verify(String userId) {
        UserPoints user = userPointsStore.find(userId)
            .orElseThrow(() -> new UnknownUserException(userId));
        long ledgerTotal = ledger.sumPoints(userId, null);
        return new ReconciliationReport(
            userId,
            ledgerTotal,
            user.pointsBalance(),
            levelCalculator.levelFor(ledgerTotal),
            user.currentLevel()
        );
    }

    /**
     * 依帳本重算用戶在某時間點的等級。
     *
     * @param userId 用戶 ID
     * @param at 時間點（含）
     * @return 當時的等級
     */
    public int levelAt(String userId, Instant at) {
        return levelCalculator.levelFor(ledger.sumPoints(userId, at));
    }

    /**
     * @see PointsEngine#recalculateLevel(String)
     */
    public int backfillLevel(String userId) {
        return pointsEngine.recalculateLevel(userId);
    }

    /**
     * 定時對帳：檢查近期有活動的用戶。
     */
    @Scheduled(cron = "${points.reconciliation.cron:0 15 * * * *}")
    public void scheduledSweep() {
        sweep();
    }

    /**
     * 對帳 {@code lookback} 期間內有活動的所有用戶。
     *
     * @return 不一致的用戶數
     */
    public int sweep() {
        Instant since = clock.instant().minus(config.lookback());
        List<UserPoints> users = userPointsStore.findActiveSince(since);
        if (users.isEmpty()) {
            log.debug("No active users to reconcile since {}", since);
            return 0;
        }

        log.info("Starting reconciliation: users={}, since={}", users.size(), since);
        int inconsistent = 0;
        for (UserPoints user : users) {
            try {
                ReconciliationReport report = verify(user.userId());
                if (!report.consistent()) {
                    inconsistent++;
                    log.warn("Points drift detected: userId={}, ledgerTotal={}, storedBalance={}, "
                            + "expectedLevel={}, storedLevel={}",
                        report.userId(), report.ledgerTotal(), report.storedBalance(),
                        report.expectedLevel(), report.storedLevel());
                }
            } catch (RuntimeException e) {
                log.error("Reconciliation failed: userId={}, error={}", user.userId(), e.getMessage(), e);
            }
        }

        log.info("Reconciliation completed: users={}, inconsistent={}", users.size(), inconsistent);
        return inconsistent;
    }
}
