package io.github.samzhu.points.service;

import java.util.Arrays;
import java.util.Map;

import org.springframework.stereotype.Component;

import io.github.samzhu.points.util.FingerprintUtils;

/**
 * 冪等鍵推導。
 *
 * <p>冪等鍵 = SHA-256( 正規化 JSON {@code [userId, action, metadata]} )，
 * Map 依 key 遞迴排序，因此與 metadata 的插入順序無關。
 * 值的型別會影響結果：{@code 42} 與 {@code "42"} 產生不同的鍵。
 *
 * <p>範例：同一用戶上傳 {@code document_id: 42} 兩次得到同一個鍵（第二次視為重複），
 * 上傳 {@code document_id: 43} 則得到新的鍵。
 */
@Component
public class IdempotencyKeyDeriver {

    /**
     * @param userId 用戶 ID
     * @param action 動作代碼
     * @param metadata 上下文，null 視為空 Map
     * @return 64 字元小寫十六進位字串
     */
    public String derive(String userId, String action, Map<String, Object> metadata) {
        Map<String, Object> context = metadata == null ? Map.of() : metadata;
        return FingerprintUtils.fingerprint(Arrays.asList(userId, action, context));
    }
}
