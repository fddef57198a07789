package io.github.samzhu.points.adapter;

import java.time.Instant;
import java.util.List;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

import io.github.samzhu.points.document.PointsTransaction;
import io.github.samzhu.points.port.PointsLedger;
import io.github.samzhu.points.repository.PointsTransactionRepository;

/**
 * MongoDB 帳本實作。
 *
 * <p>{@code idempotencyKey} 的唯一索引是重複判斷的唯一依據：
 * 寫入時遇到 {@link DuplicateKeyException} 即代表同一請求已經套用過。
 * 索引由 {@code spring.data.mongodb.auto-index-creation} 在啟動時建立。
 */
@Component
public class MongoPointsLedger implements PointsLedger {

    private static final Logger log = LoggerFactory.getLogger(MongoPointsLedger.class);

    private final PointsTransactionRepository repository;
    private final MongoTemplate mongoTemplate;

    public MongoPointsLedger(PointsTransactionRepository repository, MongoTemplate mongoTemplate) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public boolean append(PointsTransaction transaction) {
        try {
            repository.insert(transaction);
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Idempotency key already recorded: userId={}, key={}",
                transaction.userId(), transaction.idempotencyKey());
            return false;
        }
    }

    @Override
    public Page<PointsTransaction> findByUser(String userId, Pageable pageable) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }

    @Override
    public List<PointsTransaction> findByUserBetween(String userId, Instant from, Instant to) {
        return repository.findByUserIdWithin(userId, from, to);
    }

    @Override
    public List<PointsTransaction> findByCorrelationId(String correlationId) {
        return repository.findByCorrelationIdOrderByCreatedAtAsc(correlationId);
    }

    @Override
    public List<PointsTransaction> findByAction(String action, Instant since, int limit) {
        Instant from = since != null ? since : Instant.EPOCH;
        return repository.findRecentByAction(action, from, PageRequest.of(0, limit));
    }

    @Override
    public long sumPoints(String userId, Instant upTo) {
        Criteria criteria = Criteria.where("userId").is(userId);
        if (upTo != null) {
            criteria = criteria.and("createdAt").lte(upTo);
        }

        Aggregation aggregation = Aggregation.newAggregation(
            Aggregation.match(criteria),
            Aggregation.group("userId").sum("points").as("total")
        );

        AggregationResults<Document> results =
            mongoTemplate.aggregate(aggregation, PointsTransaction.class, Document.class);
        Document result = results.getUniqueMappedResult();
        if (result == null || result.get("total") == null) {
            return 0L;
        }
        // $sum 在 int32 溢位時會自動轉為 int64
        return ((Number) result.get("total")).longValue();
    }
}
