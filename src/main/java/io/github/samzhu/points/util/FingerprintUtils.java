package io.github.samzhu.points.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * 指紋計算工具類：正規化 JSON 序列化 + SHA-256。
 *
 * <p>正規化規則：
 * <ul>
 *   <li>Map 依 key 排序（遞迴套用至巢狀 Map）</li>
 *   <li>物件屬性依字母排序</li>
 *   <li>時間以 ISO-8601 字串輸出</li>
 * </ul>
 *
 * <p>同樣的輸入永遠得到同樣的輸出，不依賴 Map 的實作或插入順序。
 */
public final class FingerprintUtils {

    private static final ObjectMapper CANONICAL_MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
        .build();

    private FingerprintUtils() {
        // 工具類不允許實例化
    }

    /**
     * 將物件序列化為正規化 JSON。
     *
     * @param value 任意可序列化的值
     * @return 正規化 JSON 字串
     * @throws IllegalArgumentException 如果值無法序列化
     */
    public static String canonicalJson(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be canonicalized: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * 計算字串的 SHA-256 摘要。
     *
     * @param text 輸入字串 (UTF-8)
     * @return 64 字元小寫十六進位字串
     */
    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            // 所有 JDK 都必須提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * 計算物件正規化 JSON 的 SHA-256 摘要。
     *
     * @param value 任意可序列化的值
     * @return 64 字元小寫十六進位字串
     */
    public static String fingerprint(Object value) {
        return sha256Hex(canonicalJson(value));
    }
}
