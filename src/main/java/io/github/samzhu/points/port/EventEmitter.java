package io.github.samzhu.points.port;

import java.util.Map;

/**
 * 領域事件發佈器（外部協作者），供分析管線消費。
 *
 * <p>Fire-and-forget：實作必須吞下發佈失敗，不得拋出例外給呼叫端。
 */
public interface EventEmitter {

    /**
     * 發佈事件。
     *
     * @param eventName 事件名稱，例如 {@code points_earned}、{@code level_up}
     * @param payload 事件內容，key 使用 snake_case
     */
    void emit(String eventName, Map<String, Object> payload);
}
