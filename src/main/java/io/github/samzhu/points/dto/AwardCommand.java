package io.github.samzhu.points.dto;

import java.util.Map;

/**
 * 點數給予命令，由上游服務以 CloudEvent data 發送。
 *
 * <p>{@code userId} 未提供時使用 CloudEvent {@code subject}；
 * 關聯 ID 一律使用 CloudEvent {@code id}。
 *
 * @param userId 用戶 ID
 * @param action 動作代碼
 * @param metadata 上下文
 * @param source 呼叫來源管道
 */
public record AwardCommand(
    String userId,
    String action,
    Map<String, Object> metadata,
    String source
) {
}
