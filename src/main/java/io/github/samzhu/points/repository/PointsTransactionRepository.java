package io.github.samzhu.points.repository;

import java.time.Instant;
import java.util.List;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import io.github.samzhu.points.document.PointsTransaction;

/**
 * 點數交易記錄資料存取介面。
 *
 * <p>提供對 {@code points_transactions} 集合的查詢操作。
 * 記錄只增不改，寫入只透過 {@link io.github.samzhu.points.adapter.MongoPointsLedger#append}。
 *
 * @see io.github.samzhu.points.document.PointsTransaction
 */
public interface PointsTransactionRepository extends MongoRepository<PointsTransaction, String> {

    /**
     * 分頁查詢用戶交易記錄，按建立時間降序排列。
     *
     * @param userId 用戶唯一識別碼
     * @param pageable 分頁參數
     * @return 分頁結果
     */
    Page<PointsTransaction> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    /**
     * 查詢用戶在時間範圍內的交易記錄（含邊界）。
     *
     * @param userId 用戶唯一識別碼
     * @param from 起始時間
     * @param to 結束時間
     * @return 依建立時間升序的交易記錄
     */
    @Query(value = "{ 'userId': ?0, 'createdAt': { '$gte': ?1, '$lte': ?2 } }", sort = "{ 'createdAt': 1 }")
    List<PointsTransaction> findByUserIdWithin(String userId, Instant from, Instant to);

    List<PointsTransaction> findByCorrelationIdOrderByCreatedAtAsc(String correlationId);

    /**
     * 查詢特定動作自某時間起的交易記錄。
     *
     * @param action 動作代碼
     * @param since 起始時間（含）
     * @param pageable 用於限制筆數
     * @return 依建立時間降序的交易記錄
     */
    @Query(value = "{ 'action': ?0, 'createdAt': { '$gte': ?1 } }", sort = "{ 'createdAt': -1 }")
    List<PointsTransaction> findRecentByAction(String action, Instant since, Pageable pageable);

    long countByUserId(String userId);
}
