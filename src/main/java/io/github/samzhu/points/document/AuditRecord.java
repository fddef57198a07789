package io.github.samzhu.points.document;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.points.util.FingerprintUtils;

/**
 * 稽核記錄文件。
 *
 * <p>記錄 WHO / WHAT / WHEN / WHERE / HOW：
 * <ul>
 *   <li>{@code actor} - 誰（用戶 ID）</li>
 *   <li>{@code actionCode} - 做了什麼</li>
 *   <li>{@code occurredAt} - 何時</li>
 *   <li>{@code source} - 從哪個管道</li>
 *   <li>{@code details} - 結果細節（點數、餘額、等級）</li>
 * </ul>
 *
 * <p>{@code digest} 為其他欄位正規化後的 SHA-256，記錄被竄改時 {@link #verify()} 會回傳 false。
 * {@code occurredAt} 截斷到毫秒，與 MongoDB {@code Date} 的精度一致，讀回的記錄才能通過驗證。
 */
@Document(collection = "audit_records")
@CompoundIndex(name = "actor_occurred_idx", def = "{'actor': 1, 'occurredAt': -1}")
public record AuditRecord(
    @Id String id,
    String actor,
    String actionCode,
    Instant occurredAt,
    String source,
    Map<String, Object> details,
    String digest
) {

    /**
     * 建立稽核記錄並計算摘要。
     *
     * @param actor 執行者
     * @param actionCode 動作代碼
     * @param occurredAt 發生時間，截斷到毫秒
     * @param source 來源管道
     * @param details 細節
     * @return AuditRecord
     */
    public static AuditRecord create(
            String actor,
            String actionCode,
            Instant occurredAt,
            String source,
            Map<String, Object> details) {

        Map<String, Object> copy = details == null ? Map.of() : new LinkedHashMap<>(details);
        Instant stored = occurredAt == null ? null : occurredAt.truncatedTo(ChronoUnit.MILLIS);
        return new AuditRecord(
            null,
            actor,
            actionCode,
            stored,
            source,
            copy,
            computeDigest(actor, actionCode, stored, source, copy)
        );
    }

    /**
     * 重新計算摘要並與儲存值比對。
     *
     * @return true 表示記錄未被修改
     */
    public boolean verify() {
        return digest != null && digest.equals(computeDigest(actor, actionCode, occurredAt, source, details));
    }

    private static String computeDigest(
            String actor, String actionCode, Instant occurredAt, String source, Map<String, Object> details) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("actor", actor);
        content.put("actionCode", actionCode);
        content.put("occurredAt", occurredAt == null ? null : occurredAt.toString());
        content.put("source", source);
        content.put("details", details == null ? Map.of() : details);
        return FingerprintUtils.fingerprint(content);
    }
}
