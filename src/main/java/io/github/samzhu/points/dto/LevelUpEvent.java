package io.github.samzhu.points.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code level_up} 領域事件。
 *
 * @param userId 用戶 ID
 * @param oldLevel 原等級
 * @param newLevel 新等級
 */
public record LevelUpEvent(
    String userId,
    int oldLevel,
    int newLevel
) {
    public static final String NAME = "level_up";

    public static LevelUpEvent from(AwardResult result) {
        return new LevelUpEvent(result.transaction().userId(), result.previousLevel(), result.newLevel());
    }

    /**
     * @return snake_case 事件內容
     */
    public Map<String, Object> toPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", userId);
        payload.put("old_level", oldLevel);
        payload.put("new_level", newLevel);
        return payload;
    }
}
