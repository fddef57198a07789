package io.github.samzhu.points.service;

import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

import com.mongodb.MongoException;

/**
 * 只重試暫時性失敗的重試策略。
 *
 * <p>暫時性失敗：
 * <ul>
 *   <li>{@link TransientDataAccessException}（含其子類別）</li>
 *   <li>帶有 {@code TransientTransactionError} 標籤的 {@link MongoException}，
 *       例如兩個交易同時寫入同一個冪等鍵時的 WriteConflict</li>
 * </ul>
 * 例外鏈中任一層符合即視為暫時性失敗。其餘例外（未知用戶、連線中斷等）不重試。
 *
 * <p>重試整個交易後，輸掉寫入衝突的請求會看到已提交的帳本記錄，
 * 以重複請求的方式回傳 false。
 */
public class TransientFailureRetryPolicy extends SimpleRetryPolicy {

    public TransientFailureRetryPolicy(int maxAttempts) {
        super(maxAttempts);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable last = context.getLastThrowable();
        return (last == null || isTransient(last)) && context.getRetryCount() < getMaxAttempts();
    }

    /**
     * @param failure 例外
     * @return true 表示例外鏈中有暫時性失敗
     */
    public static boolean isTransient(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof TransientDataAccessException) {
                return true;
            }
            if (current instanceof MongoException mongoException
                    && mongoException.hasErrorLabel(MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
