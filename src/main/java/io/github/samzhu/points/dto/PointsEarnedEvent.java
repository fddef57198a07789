package io.github.samzhu.points.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code points_earned} 領域事件。
 *
 * @param userId 用戶 ID
 * @param action 動作代碼
 * @param points 給予點數
 * @param newBalance 套用後餘額
 */
public record PointsEarnedEvent(
    String userId,
    String action,
    int points,
    long newBalance
) {
    public static final String NAME = "points_earned";

    public static PointsEarnedEvent from(AwardResult result) {
        return new PointsEarnedEvent(
            result.transaction().userId(),
            result.transaction().action(),
            result.points(),
            result.newBalance());
    }

    /**
     * @return snake_case 事件內容
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", userId);
        payload.put("action", action);
        payload.put("points", points);
        payload.put("new_balance", newBalance);
        return payload;
    }
}
