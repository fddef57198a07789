package io.github.samzhu.points.adapter;

import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import io.github.samzhu.points.document.AuditRecord;
import io.github.samzhu.points.document.PointsTransaction;
import io.github.samzhu.points.port.AuditRecorder;
import io.github.samzhu.points.repository.AuditRecordRepository;

/**
 * 寫入 {@code audit_records} 集合的稽核記錄器。
 *
 * <p>WHERE 取自 {@code details.source}，未提供時為 {@value PointsTransaction#DEFAULT_SOURCE}。
 * 寫入失敗只記錄警告。
 */
@Component
public class MongoAuditRecorder implements AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(MongoAuditRecorder.class);

    private final AuditRecordRepository repository;
    private final Clock clock;

    public MongoAuditRecorder(AuditRecordRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public void record(String actor, String actionCode, Map<String, Object> details) {
        Object source = details != null ? details.get("source") : null;
        AuditRecord record = AuditRecord.create(
            actor,
            actionCode,
            clock.instant(),
            source != null ? source.toString() : PointsTransaction.DEFAULT_SOURCE,
            details
        );

        try {
            repository.save(record);
        } catch (DataAccessException e) {
            log.warn("Failed to write audit record: actor={}, action={}, error={}",
                actor, actionCode, e.getMessage());
        }
    }
}
