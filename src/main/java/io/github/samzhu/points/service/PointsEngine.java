package io.github.samzhu.points.service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.RetryOperations;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionOperations;

import io.github.samzhu.points.document.PointsTransaction;
import io.github.samzhu.points.document.UserPoints;
import io.github.samzhu.points.domain.ActionCatalog;
import io.github.samzhu.points.domain.StreakState;
import io.github.samzhu.points.dto.AwardRequest;
import io.github.samzhu.points.dto.AwardResult;
import io.github.samzhu.points.dto.LevelUpEvent;
import io.github.samzhu.points.dto.PointsEarnedEvent;
import io.github.samzhu.points.exception.InvalidActionException;
import io.github.samzhu.points.exception.StorageTransactionException;
import io.github.samzhu.points.exception.UnknownUserException;
import io.github.samzhu.points.port.AuditRecorder;
import io.github.samzhu.points.port.EventEmitter;
import io.github.samzhu.points.port.PointsLedger;
import io.github.samzhu.points.port.UserPointsStore;

/**
 * 點數引擎：在單一交易邊界內給予點數。
 *
 * <p>處理流程：
 * <pre>
 * 1. 驗證動作代碼（任何寫入之前）
 * 2. 推導冪等鍵
 * 3. ┌─ 交易開始（暫時性失敗時整個交易重試）──────────
 *    │ 寫入帳本（唯一索引衝突 = 重複 → 標記回滾，回傳 false）
 *    │ $inc 餘額並 $max lastActionAt（回傳更新前狀態）
 *    │ 依新餘額計算等級，高於已儲存等級時 $max（回傳更新前等級）
 *    │ 連續活動狀態轉移
 *    └─ 提交 ──────────────────────────────────────────
 * 4. 稽核記錄（盡力而為）
 * 5. 發佈 points_earned，步驟 3 確實提高已儲存等級時再發佈 level_up
 * </pre>
 *
 * <p>稽核與事件在交易提交後才執行：提交失敗不會留下稽核記錄或事件，
 * 稽核寫入失敗也不會回滾點數。
 *
 * <p>併發：不使用任何鎖。正確性依賴帳本冪等鍵的唯一索引、餘額的原子增量，
 * 以及回傳更新前等級的原子 {@code $max}：只有實際改變已儲存等級的請求會發佈
 * {@code level_up}，舊等級取自該命令的更新前狀態。
 * 兩個交易同時寫入同一個冪等鍵時，輸家收到的寫入衝突屬暫時性失敗，
 * 重試後即以重複請求回傳 false。
 */
@Service
public class PointsEngine {

    private static final Logger log = LoggerFactory.getLogger(PointsEngine.class);

    private final ActionCatalog actionCatalog;
    private final IdempotencyKeyDeriver keyDeriver;
    private final PointsLedger ledger;
    private final UserPointsStore userPointsStore;
    private final LevelCalculator levelCalculator;
    private final StreakTracker streakTracker;
    private final AuditRecorder auditRecorder;
    private final EventEmitter eventEmitter;
    private final TransactionOperations transactionOperations;
    private final RetryOperations retryOperations;
    private final Clock clock;

    public PointsEngine(
            ActionCatalog actionCatalog,
            IdempotencyKeyDeriver keyDeriver,
            PointsLedger ledger,
            UserPointsStore userPointsStore,
            LevelCalculator levelCalculator,
            StreakTracker streakTracker,
            AuditRecorder auditRecorder,
            EventEmitter eventEmitter,
            TransactionOperations transactionOperations,
            RetryOperations retryOperations,
            Clock clock) {
        this.actionCatalog = actionCatalog;
        this.keyDeriver = keyDeriver;
        this.ledger = ledger;
        this.userPointsStore = userPointsStore;
        this.levelCalculator = levelCalculator;
        this.streakTracker = streakTracker;
        this.auditRecorder = auditRecorder;
        this.eventEmitter = eventEmitter;
        this.transactionOperations = transactionOperations;
        this.retryOperations = retryOperations;
        this.clock = clock;
    }

    /**
     * 給予點數。
     *
     * @param userId 用戶 ID
     * @param action 動作代碼
     * @param metadata 上下文，參與冪等鍵計算
     * @return true 表示新套用；false 表示重複請求，沒有任何副作用
     * @throws InvalidActionException 動作代碼不存在
     * @throws UnknownUserException 用戶不存在（已回滾）
     * @throws StorageTransactionException 儲存層失敗（已回滾，可重試）
     */
    public boolean awardPoints(String userId, String action, Map<String, Object> metadata) {
        return award(AwardRequest.of(userId, action, metadata)).applied();
    }

    /**
     * 給予點數並回傳詳細結果。
     *
     * @param request 給予請求
     * @return 給予結果
     * @throws InvalidActionException 動作代碼不存在
     * @throws UnknownUserException 用戶不存在（已回滾）
     * @throws StorageTransactionException 儲存層失敗，暫時性失敗已重試仍失敗（已回滾，可重試）
     */
    public AwardResult award(AwardRequest request) {
        int points = actionCatalog.pointsFor(request.action());
        String key = keyDeriver.derive(request.userId(), request.action(), request.metadata());

        AwardResult result;
        try {
            result = retryOperations.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying points transaction: userId={}, action={}, key={}, attempt={}, error={}",
                        request.userId(), request.action(), key, context.getRetryCount() + 1,
                        context.getLastThrowable().getMessage());
                }
                return transactionOperations.execute(status -> applyAward(request, points, key, status));
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Points transaction rolled back: userId={}, action={}, key={}, error={}",
                request.userId(), request.action(), key, e.getMessage());
            throw new StorageTransactionException(request.userId(), request.action(), e);
        }

        if (result == null || !result.applied()) {
            log.debug("Duplicate award ignored: userId={}, action={}, key={}",
                request.userId(), request.action(), key);
            return result != null ? result : AwardResult.duplicate(key);
        }

        log.info("Points awarded: userId={}, action={}, points={}, balance={}, level={}, streak={}",
            request.userId(), request.action(), points, result.newBalance(), result.newLevel(),
            result.streak().currentStreak());

        recordAudit(request, result);
        publishEvents(result);
        return result;
    }

    /**
     * 依目前餘額重新計算等級，落後時以 {@code $max} 提高。
     *
     * <p>冪等，可用於門檻調整後的回補。
     *
     * @param userId 用戶 ID
     * @return 重新計算後的等級
     * @throws UnknownUserException 用戶不存在
     * @throws StorageTransactionException 儲存層失敗
     */
    public int recalculateLevel(String userId) {
        try {
            UserPoints user = userPointsStore.find(userId)
                .orElseThrow(() -> new UnknownUserException(userId));
            int expected = levelCalculator.levelFor(user.pointsBalance());
            if (expected > user.currentLevel()) {
                int previous = userPointsStore.raiseLevel(userId, expected);
                log.info("Level backfilled: userId={}, {} -> {}", userId, previous, Math.max(previous, expected));
                return Math.max(previous, expected);
            }
            return user.currentLevel();
        } catch (DataAccessException e) {
            throw new StorageTransactionException(userId, "recalculate_level", e);
        }
    }

    private AwardResult applyAward(AwardRequest request, int points, String key, TransactionStatus status) {
        String userId = request.userId();
        // MongoDB Date 只保存到毫秒
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        PointsTransaction transaction = PointsTransaction.create(
            userId,
            key,
            request.action(),
            points,
            request.metadata(),
            request.source(),
            request.correlationId(),
            now
        );

        if (!ledger.append(transaction)) {
            // MongoDB 在寫入錯誤後會中止交易，只能回滾
            status.setRollbackOnly();
            return AwardResult.duplicate(key);
        }

        UserPoints before = userPointsStore.incrementBalance(userId, points, now);
        long previousBalance = before.pointsBalance();
        long newBalance = previousBalance + points;

        // 已儲存等級可能落後或超前於餘額；只有實際提高已儲存等級才算升級
        int previousLevel = before.currentLevel();
        int newLevel = previousLevel;
        int computedLevel = levelCalculator.levelFor(newBalance);
        if (computedLevel > previousLevel) {
            previousLevel = userPointsStore.raiseLevel(userId, computedLevel);
            newLevel = Math.max(previousLevel, computedLevel);
        }

        StreakState previousStreak = before.streak();
        StreakState streak = streakTracker.advance(previousStreak, before.lastActionAt(), now);
        if (!streak.equals(previousStreak)) {
            userPointsStore.assignStreak(userId, streak.currentStreak(), streak.startedAt());
        }

        return AwardResult.applied(transaction, previousBalance, newBalance, previousLevel, newLevel, streak);
    }

    private void recordAudit(AwardRequest request, AwardResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source", result.transaction().source());
        details.put("idempotency_key", result.idempotencyKey());
        details.put("correlation_id", request.correlationId());
        details.put("points", result.points());
        details.put("balance_before", result.previousBalance());
        details.put("balance_after", result.newBalance());
        details.put("level_before", result.previousLevel());
        details.put("level_after", result.newLevel());

        try {
            auditRecorder.record(request.userId(), request.action(), details);
        } catch (RuntimeException e) {
            log.warn("Audit record failed: userId={}, action={}, error={}",
                request.userId(), request.action(), e.getMessage());
        }
    }

    private void publishEvents(AwardResult result) {
        emit(PointsEarnedEvent.NAME, PointsEarnedEvent.from(result).toPayload());
        if (result.leveledUp()) {
            log.info("Level up: userId={}, {} -> {}",
                result.transaction().userId(), result.previousLevel(), result.newLevel());
            emit(LevelUpEvent.NAME, LevelUpEvent.from(result).toPayload());
        }
    }

    private void emit(String eventName, Map<String, Object> payload) {
        try {
            eventEmitter.emit(eventName, payload);
        } catch (RuntimeException e) {
            log.error("Event publish failed: type={}, payload={}, error={}", eventName, payload, e.getMessage());
        }
    }
}
