package io.github.samzhu.points.exception;

/**
 * 儲存層交易失敗異常。
 *
 * <p>包裝 Spring {@code DataAccessException} 或 {@code TransactionException}。
 * 拋出時整個操作已回滾：不會存在「帳本記錄存在但餘額未更新」的中間狀態，
 * 因此呼叫端可以安全重試（重試時重複的請求會得到 {@code false}）。
 */
public class StorageTransactionException extends RuntimeException {

    private final String userId;
    private final String action;

    public StorageTransactionException(String userId, String action, Throwable cause) {
        super(String.format("Points transaction rolled back: userId='%s', action='%s': %s",
            userId, action, cause.getMessage()), cause);
        this.userId = userId;
        this.action = action;
    }

    public String getUserId() {
        return userId;
    }

    public String getAction() {
        return action;
    }

    /**
     * @return 一律為 true，暫時性基礎設施錯誤
     */
    public boolean isRetryable() {
        return true;
    }
}
