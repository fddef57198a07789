package io.github.samzhu.points.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;

import io.github.samzhu.points.document.PointsTransaction;
import io.github.samzhu.points.document.UserPoints;
import io.github.samzhu.points.dto.AwardRequest;
import io.github.samzhu.points.dto.AwardResult;
import io.github.samzhu.points.dto.LevelUpEvent;
import io.github.samzhu.points.dto.PointsEarnedEvent;
import io.github.samzhu.points.exception.InvalidActionException;
import io.github.samzhu.points.exception.StorageTransactionException;
import io.github.samzhu.points.exception.UnknownUserException;
import io.github.samzhu.points.support.EngineFixture;
import io.github.samzhu.points.support.MutableClock;
import io.github.samzhu.points.support.SnapshotTransactionOperations;

class PointsEngineTest {

    private MutableClock clock;
    private EngineFixture fixture;
    private PointsEngine engine;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T09:00:00Z");
        fixture = EngineFixture.transactional(clock);
        engine = fixture.engine;
    }

    @Nested
    class Scenarios {

        @Test
        void shouldStayAtLevelOneForFirstActions() {
            // Given
            fixture.users.addUser("u1");

            // When
            boolean registered = engine.awardPoints("u1", "registration", Map.of());
            boolean uploaded = engine.awardPoints("u1", "document_upload", Map.of("document_id", 7));

            // Then
            assertThat(registered).isTrue();
            assertThat(uploaded).isTrue();
            UserPoints user = fixture.users.get("u1");
            assertThat(user.pointsBalance()).isEqualTo(175);
            assertThat(user.currentLevel()).isEqualTo(1);
            assertThat(fixture.ledger.size()).isEqualTo(2);
            assertThat(fixture.events.named(PointsEarnedEvent.NAME)).hasSize(2);
            assertThat(fixture.events.named(LevelUpEvent.NAME)).isEmpty();
        }

        @Test
        void shouldEmitOneLevelUpWhenCrossingThreshold() {
            // Given
            fixture.users.addUser("u2", 450);

            // When
            boolean applied = engine.awardPoints("u2", "document_approved", Map.of("document_id", 1));

            // Then
            assertThat(applied).isTrue();
            UserPoints user = fixture.users.get("u2");
            assertThat(user.pointsBalance()).isEqualTo(600);
            assertThat(user.currentLevel()).isEqualTo(2);
            assertThat(fixture.events.named(LevelUpEvent.NAME))
                .singleElement()
                .satisfies(event -> assertThat(event.payload())
                    .containsEntry("user_id", "u2")
                    .containsEntry("old_level", 1)
                    .containsEntry("new_level", 2));
            assertThat(fixture.events.named(PointsEarnedEvent.NAME))
                .singleElement()
                .satisfies(event -> assertThat(event.payload())
                    .containsEntry("action", "document_approved")
                    .containsEntry("points", 150)
                    .containsEntry("new_balance", 600L));
        }

        @Test
        void shouldTreatSameMetadataTwiceAsDuplicate() {
            // Given
            fixture.users.addUser("u3");
            engine.awardPoints("u3", "document_upload", Map.of("document_id", 42));
            int eventsAfterFirst = fixture.events.events().size();
            int auditsAfterFirst = fixture.audit.entries().size();

            // When
            boolean second = engine.awardPoints("u3", "document_upload", Map.of("document_id", 42));

            // Then
            assertThat(second).isFalse();
            assertThat(fixture.users.get("u3").pointsBalance()).isEqualTo(75);
            assertThat(fixture.ledger.size()).isEqualTo(1);
            assertThat(fixture.events.events()).hasSize(eventsAfterFirst);
            assertThat(fixture.audit.entries()).hasSize(auditsAfterFirst);
        }

        @Test
        void shouldApplyDifferentMetadata() {
            // Given
            fixture.users.addUser("u4");

            // When
            boolean first = engine.awardPoints("u4", "document_upload", Map.of("document_id", 42));
            boolean second = engine.awardPoints("u4", "document_upload", Map.of("document_id", 43));

            // Then
            assertThat(first).isTrue();
            assertThat(second).isTrue();
            assertThat(fixture.users.get("u4").pointsBalance()).isEqualTo(150);
            assertThat(fixture.ledger.size()).isEqualTo(2);
        }
    }

    @Test
    void shouldReturnDetailedResult() {
        // Given
        fixture.users.addUser("u5", 980, 2);

        // When
        AwardResult result = engine.award(new AwardRequest(
            "u5", "registration", Map.of(), "document-service", "corr-1"));

        // Then
        assertThat(result.applied()).isTrue();
        assertThat(result.idempotencyKey()).hasSize(64);
        assertThat(result.previousBalance()).isEqualTo(980);
        assertThat(result.newBalance()).isEqualTo(1080);
        assertThat(result.previousLevel()).isEqualTo(2);
        assertThat(result.newLevel()).isEqualTo(3);
        assertThat(result.leveledUp()).isTrue();

        PointsTransaction stored = fixture.ledger.all().get(0);
        assertThat(stored.source()).isEqualTo("document-service");
        assertThat(stored.correlationId()).isEqualTo("corr-1");
        assertThat(stored.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldCarryOnlyKeyInDuplicateResult() {
        // Given
        fixture.users.addUser("u6");
        AwardResult first = engine.award(AwardRequest.of("u6", "registration", null));

        // When
        AwardResult second = engine.award(AwardRequest.of("u6", "registration", Map.of()));

        // Then
        assertThat(second.applied()).isFalse();
        assertThat(second.leveledUp()).isFalse();
        assertThat(second.idempotencyKey()).isEqualTo(first.idempotencyKey());
        assertThat(((SnapshotTransactionOperations) fixture.transactions).rollbacks()).isEqualTo(1);
    }

    @Test
    void shouldIgnoreCorrelationIdForIdempotency() {
        // Given
        fixture.users.addUser("u7");
        engine.award(new AwardRequest("u7", "registration", Map.of(), "api", "corr-a"));

        // When
        AwardResult retry = engine.award(new AwardRequest("u7", "registration", Map.of(), "api", "corr-b"));

        // Then
        assertThat(retry.applied()).isFalse();
    }

    @Test
    void shouldEmitSingleLevelUpWhenJumpingSeveralLevels() {
        // Given
        fixture.users.addUser("u8", 1900, 3);

        // When
        engine.awardPoints("u8", "telemedicine_completed", Map.of());

        // Then
        assertThat(fixture.users.get("u8").currentLevel()).isEqualTo(4);
        assertThat(fixture.events.named(LevelUpEvent.NAME))
            .singleElement()
            .satisfies(event -> assertThat(event.payload())
                .containsEntry("old_level", 3)
                .containsEntry("new_level", 4));
    }

    @Test
    void shouldDescribeAwardInAuditRecord() {
        // Given
        fixture.users.addUser("u9");

        // When
        engine.award(new AwardRequest("u9", "registration", Map.of(), "api", "corr-9"));

        // Then
        assertThat(fixture.audit.entries()).singleElement().satisfies(entry -> {
            assertThat(entry.actor()).isEqualTo("u9");
            assertThat(entry.actionCode()).isEqualTo("registration");
            assertThat(entry.details())
                .containsEntry("source", "api")
                .containsEntry("correlation_id", "corr-9")
                .containsEntry("points", 100)
                .containsEntry("balance_before", 0L)
                .containsEntry("balance_after", 100L);
        });
    }

    @Nested
    class StoredLevelDrift {

        @Test
        void shouldEmitLevelUpWhenLaggingStoredLevelIsRaised() {
            // Given: balance 600 already qualifies for level 2, stored level is still 1
            fixture.users.addUser("d1", 600, 1);

            // When
            AwardResult result = engine.award(AwardRequest.of("d1", "document_upload", Map.of("document_id", 1)));

            // Then
            assertThat(result.previousLevel()).isEqualTo(1);
            assertThat(result.newLevel()).isEqualTo(2);
            assertThat(result.leveledUp()).isTrue();
            assertThat(fixture.users.get("d1").currentLevel()).isEqualTo(2);
            assertThat(fixture.events.named(LevelUpEvent.NAME))
                .singleElement()
                .satisfies(event -> assertThat(event.payload())
                    .containsEntry("old_level", 1)
                    .containsEntry("new_level", 2));
        }

        @Test
        void shouldNotEmitLevelUpWhenStoredLevelIsAlreadyHigher() {
            // Given: stored level 3 is ahead of what balance 450 + 150 computes (level 2)
            fixture.users.addUser("d2", 450, 3);

            // When
            AwardResult result = engine.award(AwardRequest.of("d2", "document_approved", Map.of("document_id", 1)));

            // Then
            assertThat(result.applied()).isTrue();
            assertThat(result.previousLevel()).isEqualTo(3);
            assertThat(result.newLevel()).isEqualTo(3);
            assertThat(result.leveledUp()).isFalse();
            assertThat(fixture.users.get("d2").currentLevel()).isEqualTo(3);
            assertThat(fixture.users.get("d2").pointsBalance()).isEqualTo(600);
            assertThat(fixture.events.named(LevelUpEvent.NAME)).isEmpty();
            assertThat(fixture.audit.entries()).singleElement()
                .satisfies(entry -> assertThat(entry.details())
                    .containsEntry("level_before", 3)
                    .containsEntry("level_after", 3));
        }
    }

    @Nested
    class TransientFailures {

        @Test
        void shouldRetryTransientFailureAndApply() {
            // Given
            fixture.users.addUser("t1");
            fixture.ledger.failNextAppends(1, new TransientDataAccessResourceException("write conflict"));

            // When
            boolean applied = engine.awardPoints("t1", "registration", Map.of());

            // Then
            assertThat(applied).isTrue();
            assertThat(fixture.ledger.size()).isEqualTo(1);
            assertThat(fixture.users.get("t1").pointsBalance()).isEqualTo(100);
            assertThat(fixture.events.named(PointsEarnedEvent.NAME)).hasSize(1);
        }

        @Test
        void shouldReturnDuplicateWhenRetryFindsCommittedKey() {
            // Given: the competing request committed first, this one hit a write conflict
            fixture.users.addUser("t2");
            engine.awardPoints("t2", "document_upload", Map.of("document_id", 42));
            fixture.ledger.failNextAppends(1, new TransientDataAccessResourceException("write conflict"));

            // When
            boolean applied = engine.awardPoints("t2", "document_upload", Map.of("document_id", 42));

            // Then
            assertThat(applied).isFalse();
            assertThat(fixture.ledger.size()).isEqualTo(1);
            assertThat(fixture.users.get("t2").pointsBalance()).isEqualTo(75);
            assertThat(fixture.events.named(PointsEarnedEvent.NAME)).hasSize(1);
        }

        @Test
        void shouldFailAsRetryableWhenAttemptsAreExhausted() {
            // Given
            fixture.users.addUser("t3");
            fixture.ledger.failNextAppends(EngineFixture.MAX_ATTEMPTS,
                new TransientDataAccessResourceException("write conflict"));

            // When / Then
            assertThatThrownBy(() -> engine.awardPoints("t3", "registration", Map.of()))
                .isInstanceOfSatisfying(StorageTransactionException.class,
                    e -> assertThat(e.isRetryable()).isTrue());
            assertThat(fixture.ledger.size()).isZero();
            assertThat(fixture.users.get("t3").pointsBalance()).isZero();
            assertThat(((SnapshotTransactionOperations) fixture.transactions).rollbacks())
                .isEqualTo(EngineFixture.MAX_ATTEMPTS);
        }

        @Test
        void shouldNotRetryNonTransientFailure() {
            // Given
            fixture.users.addUser("t4");
            fixture.ledger.failNextAppends(1, new DataAccessResourceFailureException("connection reset"));

            // When / Then
            assertThatThrownBy(() -> engine.awardPoints("t4", "registration", Map.of()))
                .isInstanceOf(StorageTransactionException.class);
            assertThat(((SnapshotTransactionOperations) fixture.transactions).rollbacks()).isEqualTo(1);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldFailUnknownActionBeforeAnyWrite() {
            // Given
            fixture.users.addUser("u1");

            // When / Then
            assertThatThrownBy(() -> engine.awardPoints("u1", "teleport", Map.of()))
                .isInstanceOf(InvalidActionException.class)
                .extracting(e -> ((InvalidActionException) e).getAction())
                .isEqualTo("teleport");
            assertThat(fixture.ledger.size()).isZero();
            assertThat(fixture.users.get("u1").pointsBalance()).isZero();
            assertThat(fixture.events.events()).isEmpty();
        }

        @Test
        void shouldRollBackLedgerRowForUnknownUser() {
            // When / Then
            assertThatThrownBy(() -> engine.awardPoints("ghost", "registration", Map.of()))
                .isInstanceOf(UnknownUserException.class);
            assertThat(fixture.ledger.size()).isZero();
            assertThat(fixture.audit.entries()).isEmpty();
            assertThat(fixture.events.events()).isEmpty();
        }

        @Test
        void shouldRollBackStorageFailureAsRetryable() {
            // Given
            fixture.users.addUser("u2", 450);
            fixture.users.failNextRaiseLevel(new DataAccessResourceFailureException("connection reset"));

            // When / Then
            assertThatThrownBy(() -> engine.awardPoints("u2", "document_approved", Map.of()))
                .isInstanceOfSatisfying(StorageTransactionException.class, e -> {
                    assertThat(e.isRetryable()).isTrue();
                    assertThat(e.getUserId()).isEqualTo("u2");
                    assertThat(e.getAction()).isEqualTo("document_approved");
                    assertThat(e.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
                });
            assertThat(fixture.ledger.size()).isZero();
            assertThat(fixture.users.get("u2").pointsBalance()).isEqualTo(450);
            assertThat(fixture.events.events()).isEmpty();

            // And a retry of the same request succeeds
            assertThat(engine.awardPoints("u2", "document_approved", Map.of())).isTrue();
            assertThat(fixture.users.get("u2").pointsBalance()).isEqualTo(600);
        }

        @Test
        void shouldKeepAwardWhenAuditFails() {
            // Given
            fixture.users.addUser("u3");
            fixture.audit.failWith(new IllegalStateException("audit store down"));

            // When
            boolean applied = engine.awardPoints("u3", "registration", Map.of());

            // Then
            assertThat(applied).isTrue();
            assertThat(fixture.users.get("u3").pointsBalance()).isEqualTo(100);
            assertThat(fixture.events.named(PointsEarnedEvent.NAME)).hasSize(1);
        }

        @Test
        void shouldKeepAwardWhenEventFails() {
            // Given
            fixture.users.addUser("u4");
            fixture.events.failWith(new IllegalStateException("broker down"));

            // When
            boolean applied = engine.awardPoints("u4", "registration", Map.of());

            // Then
            assertThat(applied).isTrue();
            assertThat(fixture.users.get("u4").pointsBalance()).isEqualTo(100);
            assertThat(fixture.audit.entries()).hasSize(1);
        }
    }

    @Nested
    class Streaks {

        @Test
        void shouldStartStreakOnFirstAction() {
            // Given
            fixture.users.addUser("s1");

            // When
            engine.awardPoints("s1", "registration", Map.of());

            // Then
            UserPoints user = fixture.users.get("s1");
            assertThat(user.currentStreak()).isEqualTo(1);
            assertThat(user.streakStartedAt()).isEqualTo(clock.instant());
            assertThat(user.lastActionAt()).isEqualTo(clock.instant());
        }

        @Test
        void shouldKeepStreakOnSameDay() {
            // Given
            fixture.users.addUser("s2");
            engine.awardPoints("s2", "registration", Map.of());
            clock.advance(Duration.ofHours(5));

            // When
            engine.awardPoints("s2", "profile_completed", Map.of());

            // Then
            assertThat(fixture.users.get("s2").currentStreak()).isEqualTo(1);
        }

        @Test
        void shouldExtendStreakOnNextDay() {
            // Given
            fixture.users.addUser("s3");
            Instant start = clock.instant();
            engine.awardPoints("s3", "registration", Map.of());
            clock.advance(Duration.ofDays(1));

            // When
            engine.awardPoints("s3", "profile_completed", Map.of());

            // Then
            UserPoints user = fixture.users.get("s3");
            assertThat(user.currentStreak()).isEqualTo(2);
            assertThat(user.streakStartedAt()).isEqualTo(start);
        }

        @Test
        void shouldResetStreakAfterGap() {
            // Given
            fixture.users.addUser("s4");
            engine.awardPoints("s4", "registration", Map.of());
            clock.advance(Duration.ofDays(1));
            engine.awardPoints("s4", "profile_completed", Map.of());
            clock.advance(Duration.ofDays(3));

            // When
            engine.awardPoints("s4", "document_upload", Map.of("document_id", 1));

            // Then
            UserPoints user = fixture.users.get("s4");
            assertThat(user.currentStreak()).isEqualTo(1);
            assertThat(user.streakStartedAt()).isEqualTo(clock.instant());
        }

        @Test
        void shouldNotTouchStreakOnDuplicate() {
            // Given
            fixture.users.addUser("s5");
            engine.awardPoints("s5", "registration", Map.of());
            clock.advance(Duration.ofDays(1));

            // When
            engine.awardPoints("s5", "registration", Map.of());

            // Then
            UserPoints user = fixture.users.get("s5");
            assertThat(user.currentStreak()).isEqualTo(1);
            assertThat(user.lastActionAt()).isEqualTo(Instant.parse("2025-03-10T09:00:00Z"));
        }

        @Test
        void shouldNotMoveLastActionBackOnClockSkew() {
            // Given
            fixture.users.addUser("s6");
            engine.awardPoints("s6", "registration", Map.of());
            clock.advance(Duration.ofHours(-2));

            // When
            engine.awardPoints("s6", "profile_completed", Map.of());

            // Then
            UserPoints user = fixture.users.get("s6");
            assertThat(user.pointsBalance()).isEqualTo(150);
            assertThat(user.currentStreak()).isEqualTo(1);
            assertThat(user.lastActionAt()).isEqualTo(Instant.parse("2025-03-10T09:00:00Z"));
        }

        @Test
        void shouldStoreTimestampsAtMillisecondPrecision() {
            // Given
            fixture.users.addUser("s7");
            clock.advance(Duration.ofNanos(123_456_789));

            // When
            engine.awardPoints("s7", "registration", Map.of());

            // Then
            Instant millis = Instant.parse("2025-03-10T09:00:00.123Z");
            assertThat(fixture.ledger.all()).singleElement()
                .satisfies(tx -> assertThat(tx.createdAt()).isEqualTo(millis));
            assertThat(fixture.users.get("s7").lastActionAt()).isEqualTo(millis);
        }
    }

    @Nested
    class RecalculateLevel {

        @Test
        void shouldRaiseLaggingLevel() {
            // Given
            fixture.users.addUser("r1", 2500);

            // When
            int level = engine.recalculateLevel("r1");

            // Then
            assertThat(level).isEqualTo(4);
            assertThat(fixture.users.get("r1").currentLevel()).isEqualTo(4);
        }

        @Test
        void shouldNeverLowerLevel() {
            // Given
            fixture.users.add(new UserPoints(null, "r2", 100, 3, 0, null, null, null));

            // When
            int level = engine.recalculateLevel("r2");

            // Then
            assertThat(level).isEqualTo(3);
            assertThat(fixture.users.get("r2").currentLevel()).isEqualTo(3);
        }

        @Test
        void shouldFailForUnknownUser() {
            assertThatThrownBy(() -> engine.recalculateLevel("ghost"))
                .isInstanceOf(UnknownUserException.class);
        }
    }
}
