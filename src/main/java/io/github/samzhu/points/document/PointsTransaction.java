package io.github.samzhu.points.document;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 點數交易記錄文件（帳本）。
 *
 * <p>用途：記錄每一次成功給予的點數，是餘額對帳的唯一事實來源。
 *
 * <p>設計原則：
 * <ul>
 *   <li>只增不改：記錄一旦建立就不會修改或刪除（依合規政策保存）</li>
 *   <li>冪等鍵唯一：{@code idempotencyKey} 有唯一索引，重複寫入由資料庫拒絕</li>
 *   <li>ID 自動生成：由 MongoDB 自動產生 ObjectId</li>
 * </ul>
 */
@Document(collection = "points_transactions")
@CompoundIndexes({
    @CompoundIndex(name = "user_created_idx", def = "{'userId': 1, 'createdAt': -1}"),
    @CompoundIndex(name = "action_created_idx", def = "{'action': 1, 'createdAt': -1}")
})
public record PointsTransaction(
    @Id String id,

    // ========== 基本識別 ==========
    /** 獲得點數的用戶 ID */
    String userId,
    /** 冪等鍵，SHA-256(userId, action, metadata) */
    @Indexed(unique = true) String idempotencyKey,

    // ========== 點數資訊 ==========
    /** 動作代碼 */
    String action,
    /** 給予的點數 */
    int points,
    /** 呼叫端提供的上下文（例如 document_id） */
    Map<String, Object> metadata,

    // ========== 來源追蹤 ==========
    /** 呼叫來源管道，例如 api、system、document-service */
    String source,
    /** 關聯 ID，用於跨服務追蹤 */
    @Indexed String correlationId,

    // ========== 時間戳記 ==========
    /** 記錄建立時間 */
    Instant createdAt
) {

    /** 未指定來源時的預設值 */
    public static final String DEFAULT_SOURCE = "system";

    /**
     * 建立新的交易記錄。
     *
     * @param userId 用戶 ID
     * @param idempotencyKey 冪等鍵
     * @param action 動作代碼
     * @param points 點數
     * @param metadata 上下文
     * @param source 來源管道，null 時使用 {@link #DEFAULT_SOURCE}
     * @param correlationId 關聯 ID，可為 null
     * @param createdAt 建立時間，截斷到毫秒（MongoDB {@code Date} 精度）
     * @return PointsTransaction
     */
    public static PointsTransaction create(
            String userId,
            String idempotencyKey,
            String action,
            int points,
            Map<String, Object> metadata,
            String source,
            String correlationId,
            Instant createdAt) {

        return new PointsTransaction(
            null, // ID 自動產生
            userId,
            idempotencyKey,
            action,
            points,
            metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata)),
            source == null || source.isBlank() ? DEFAULT_SOURCE : source,
            correlationId,
            createdAt == null ? null : createdAt.truncatedTo(ChronoUnit.MILLIS)
        );
    }
}
