package io.github.samzhu.points.dto;

/**
 * 帳本對帳結果。
 *
 * @param userId 用戶 ID
 * @param ledgerTotal 帳本點數總和
 * @param storedBalance 用戶文件中的餘額
 * @param expectedLevel 依帳本總和計算的等級
 * @param storedLevel 用戶文件中的等級
 */
public record ReconciliationReport(
    String userId,
    long ledgerTotal,
    long storedBalance,
    int expectedLevel,
    int storedLevel
) {

    public boolean balanceMatches() {
        return ledgerTotal == storedBalance;
    }

    public boolean levelMatches() {
        return expectedLevel == storedLevel;
    }

    public boolean consistent() {
        return balanceMatches() && levelMatches();
    }

    /**
     * @return 餘額差額（儲存值 - 帳本值）
     */
    public long drift() {
        return storedBalance - ledgerTotal;
    }
}
