package io.github.samzhu.points.repository;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;

import io.github.samzhu.points.document.AuditRecord;

/**
 * 稽核記錄資料存取介面。
 *
 * <p>記錄為只讀資料，建立後不會修改。
 *
 * @see io.github.samzhu.points.document.AuditRecord
 */
public interface AuditRecordRepository extends MongoRepository<AuditRecord, String> {

    /**
     * 查詢用戶所有稽核記錄，按發生時間降序排列。
     *
     * @param actor 執行者
     * @return 稽核記錄清單
     */
    List<AuditRecord> findByActorOrderByOccurredAtDesc(String actor);
}
