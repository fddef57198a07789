package io.github.samzhu.points.exception;

/**
 * 未知動作代碼異常。
 *
 * <p>當請求的動作代碼不在 {@link io.github.samzhu.points.domain.ActionCatalog} 中時拋出。
 * 此檢查發生在任何寫入之前，因此不會留下任何狀態。
 *
 * <p>處理方式：
 * <ul>
 *   <li>不可重試：同樣的請求永遠會失敗</li>
 *   <li>呼叫端應對應為用戶端錯誤（例如 HTTP 400）</li>
 *   <li>若為新動作，應在 application.yaml 的 {@code points.actions} 新增配置</li>
 * </ul>
 */
public class InvalidActionException extends RuntimeException {

    private final String action;

    public InvalidActionException(String action) {
        super(String.format("Unknown action code: action='%s'. " +
            "Please add it to points.actions in application.yaml", action));
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
