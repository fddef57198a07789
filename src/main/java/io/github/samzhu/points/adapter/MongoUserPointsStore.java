package io.github.samzhu.points.adapter;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import io.github.samzhu.points.document.UserPoints;
import io.github.samzhu.points.exception.UnknownUserException;
import io.github.samzhu.points.port.UserPointsStore;
import io.github.samzhu.points.repository.UserPointsRepository;

/**
 * MongoDB 用戶點數狀態實作。
 *
 * <p>所有寫入都是單一原子命令：
 * <ul>
 *   <li>餘額：{@code findAndModify} + {@code $inc}，回傳更新前文件</li>
 *   <li>等級：{@code findAndModify} + {@code $max}，回傳更新前等級</li>
 *   <li>連續活動：{@code $set}</li>
 * </ul>
 */
@Component
public class MongoUserPointsStore implements UserPointsStore {

    private final UserPointsRepository repository;
    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoUserPointsStore(UserPointsRepository repository, MongoTemplate mongoTemplate, Clock clock) {
        this.repository = repository;
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<UserPoints> find(String userId) {
        return repository.findByUserId(userId);
    }

    @Override
    public UserPoints incrementBalance(String userId, int points, Instant actedAt) {
        Query query = Query.query(Criteria.where("userId").is(userId));
        Update update = new Update()
            .inc("pointsBalance", points)
            .max("lastActionAt", actedAt)
            .set("updatedAt", actedAt);

        UserPoints before = mongoTemplate.findAndModify(
            query, update, FindAndModifyOptions.options().returnNew(false), UserPoints.class);
        if (before == null) {
            throw new UnknownUserException(userId);
        }
        return before;
    }

    @Override
    public int raiseLevel(String userId, int level) {
        Query query = Query.query(Criteria.where("userId").is(userId));
        Update update = new Update()
            .max("currentLevel", level)
            .set("updatedAt", clock.instant());

        UserPoints before = mongoTemplate.findAndModify(
            query, update, FindAndModifyOptions.options().returnNew(false), UserPoints.class);
        if (before == null) {
            throw new UnknownUserException(userId);
        }
        return before.currentLevel();
    }

    @Override
    public void assignStreak(String userId, int currentStreak, Instant streakStartedAt) {
        repository.assignStreakByUserId(userId, currentStreak, streakStartedAt, clock.instant());
    }

    @Override
    public List<UserPoints> findTopByBalance(int limit) {
        return repository.findAllByOrderByPointsBalanceDescCurrentLevelDesc(PageRequest.of(0, limit));
    }

    @Override
    public List<UserPoints> findActiveSince(Instant since) {
        return repository.findActiveSince(since);
    }
}
