package io.github.samzhu.points.dto;

import java.util.Map;

/**
 * 點數給予請求。
 *
 * @param userId 用戶 ID
 * @param action 動作代碼
 * @param metadata 上下文（例如 {@code document_id}），參與冪等鍵計算
 * @param source 呼叫來源管道，可為 null
 * @param correlationId 關聯 ID，可為 null；不參與冪等鍵計算
 */
public record AwardRequest(
    String userId,
    String action,
    Map<String, Object> metadata,
    String source,
    String correlationId
) {
    public AwardRequest {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be blank");
        }
        if (metadata == null) {
            metadata = Map.of();
        }
    }

    /**
     * 建立不帶來源與關聯 ID 的請求。
     */
    public static AwardRequest of(String userId, String action, Map<String, Object> metadata) {
        return new AwardRequest(userId, action, metadata, null, null);
    }
}
