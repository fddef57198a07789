package io.github.samzhu.points.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;

import io.github.samzhu.points.document.AuditRecord;
import io.github.samzhu.points.repository.AuditRecordRepository;

class MongoAuditRecorderTest {

    private static final Instant NOW = Instant.parse("2025-03-10T09:00:00Z");

    private AuditRecordRepository repository;
    private MongoAuditRecorder recorder;

    @BeforeEach
    void setUp() {
        repository = mock(AuditRecordRepository.class);
        recorder = new MongoAuditRecorder(repository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldSaveRecordWithVerifiableDigest() {
        // When
        recorder.record("u1", "registration", Map.of("source", "api", "points", 100));

        // Then
        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repository).save(captor.capture());
        AuditRecord record = captor.getValue();
        assertThat(record.actor()).isEqualTo("u1");
        assertThat(record.actionCode()).isEqualTo("registration");
        assertThat(record.occurredAt()).isEqualTo(NOW);
        assertThat(record.source()).isEqualTo("api");
        assertThat(record.digest()).hasSize(64);
        assertThat(record.verify()).isTrue();
    }

    @Test
    void shouldDefaultSourceToSystem() {
        // When
        recorder.record("u1", "registration", Map.of("points", 100));

        // Then
        ArgumentCaptor<AuditRecord> captor = ArgumentCaptor.forClass(AuditRecord.class);
        verify(repository).save(captor.capture());
        assertThat(captor.getValue().source()).isEqualTo("system");
    }

    @Test
    void shouldNotThrowWhenWriteFails() {
        // Given
        when(repository.save(any(AuditRecord.class)))
            .thenThrow(new DataAccessResourceFailureException("timeout"));

        // When / Then
        assertThatCode(() -> recorder.record("u1", "registration", Map.of()))
            .doesNotThrowAnyException();
    }
}
