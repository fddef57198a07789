package io.github.samzhu.points.exception;

/**
 * 用戶不存在異常。
 *
 * <p>用戶生命週期由外部用戶管理子系統負責，本服務不會自動建立用戶。
 * 發生於交易內時，整個 award 會回滾，不可重試。
 */
public class UnknownUserException extends RuntimeException {

    private final String userId;

    public UnknownUserException(String userId) {
        super("User not found: " + userId);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
