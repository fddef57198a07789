package io.github.samzhu.points.dto;

import io.github.samzhu.points.document.PointsTransaction;
import io.github.samzhu.points.domain.StreakState;

/**
 * 點數給予結果。
 *
 * <p>重複請求時 {@code applied == false}，其餘欄位除 {@code idempotencyKey} 外皆為預設值。
 *
 * @param applied 是否為新套用
 * @param idempotencyKey 冪等鍵
 * @param transaction 新建立的交易記錄，重複時為 null
 * @param previousBalance 套用前餘額
 * @param newBalance 套用後餘額
 * @param previousLevel 套用前的已儲存等級
 * @param newLevel 套用後的已儲存等級，永不低於 {@code previousLevel}
 * @param streak 套用後的連續活動狀態，重複時為 null
 */
public record AwardResult(
    boolean applied,
    String idempotencyKey,
    PointsTransaction transaction,
    long previousBalance,
    long newBalance,
    int previousLevel,
    int newLevel,
    StreakState streak
) {

    public static AwardResult duplicate(String idempotencyKey) {
        return new AwardResult(false, idempotencyKey, null, 0, 0, 0, 0, null);
    }

    public static AwardResult applied(
            PointsTransaction transaction,
            long previousBalance,
            long newBalance,
            int previousLevel,
            int newLevel,
            StreakState streak) {
        return new AwardResult(true, transaction.idempotencyKey(), transaction,
            previousBalance, newBalance, previousLevel, newLevel, streak);
    }

    /**
     * @return true 表示本次給予提高了已儲存等級
     */
    public boolean leveledUp() {
        return applied && newLevel > previousLevel;
    }

    public int points() {
        return transaction == null ? 0 : transaction.points();
    }
}
