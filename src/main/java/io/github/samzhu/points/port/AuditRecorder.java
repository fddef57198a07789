package io.github.samzhu.points.port;

import java.util.Map;

/**
 * 稽核記錄器（外部協作者）。
 *
 * <p>盡力而為：實作必須自行記錄並吞下寫入失敗，不得拋出例外給呼叫端，
 * 也不得影響點數交易的提交。
 */
public interface AuditRecorder {

    /**
     * 記錄一筆稽核事件。
     *
     * @param actor 執行者（WHO）
     * @param actionCode 動作代碼（WHAT）
     * @param details 結果細節（HOW），可包含 {@code source}（WHERE）
     */
    void record(String actor, String actionCode, Map<String, Object> details);
}
