package io.github.samzhu.points.port;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import io.github.samzhu.points.document.PointsTransaction;

/**
 * 點數帳本：只增不改的交易記錄儲存。
 *
 * <p>實作必須以儲存層的唯一約束保證同一冪等鍵只存在一筆記錄。
 * 重複判斷只依賴約束違反的結果，不得先查詢是否存在再寫入。
 *
 * @see io.github.samzhu.points.adapter.MongoPointsLedger
 */
public interface PointsLedger {

    /**
     * 附加一筆交易記錄。
     *
     * @param transaction 新記錄
     * @return true 表示寫入成功；false 表示冪等鍵已存在（唯一約束拒絕）
     */
    boolean append(PointsTransaction transaction);

    /**
     * 分頁查詢用戶交易記錄，依建立時間降序排列。
     *
     * @param userId 用戶 ID
     * @param pageable 分頁參數
     * @return 分頁結果
     */
    Page<PointsTransaction> findByUser(String userId, Pageable pageable);

    /**
     * 查詢用戶在時間範圍內的交易記錄（含邊界），依建立時間升序排列。
     *
     * @param userId 用戶 ID
     * @param from 起始時間
     * @param to 結束時間
     * @return 交易記錄清單
     */
    List<PointsTransaction> findByUserBetween(String userId, Instant from, Instant to);

    /**
     * 依關聯 ID 查詢交易記錄，依建立時間升序排列。
     *
     * @param correlationId 關聯 ID
     * @return 交易記錄清單
     */
    List<PointsTransaction> findByCorrelationId(String correlationId);

    /**
     * 查詢特定動作自某時間起的交易記錄，依建立時間降序排列。
     *
     * @param action 動作代碼
     * @param since 起始時間（含）
     * @param limit 最大筆數
     * @return 交易記錄清單
     */
    List<PointsTransaction> findByAction(String action, Instant since, int limit);

    /**
     * 加總用戶的點數。
     *
     * @param userId 用戶 ID
     * @param upTo 截止時間（含），null 表示全部
     * @return 點數總和，無記錄時為 0
     */
    long sumPoints(String userId, Instant upTo);
}
