package io.github.samzhu.points.config;

import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.RetryOperations;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

import io.github.samzhu.points.domain.ActionCatalog;
import io.github.samzhu.points.domain.LevelThresholdTable;
import io.github.samzhu.points.service.LevelCalculator;
import io.github.samzhu.points.service.StreakTracker;
import io.github.samzhu.points.service.TransientFailureRetryPolicy;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link PointsProperties} 的型別安全配置綁定，
 * 並在啟動時由配置建立不可變的動作目錄與等級門檻表。
 * 配置不合法時（例如門檻未從 (1, 0) 開始）啟動即失敗。
 *
 * @see PointsProperties
 */
@Configuration
@EnableConfigurationProperties(PointsProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ActionCatalog actionCatalog(PointsProperties properties) {
        return new ActionCatalog(properties.actions());
    }

    @Bean
    public LevelThresholdTable levelThresholdTable(PointsProperties properties) {
        return new LevelThresholdTable(properties.levels().stream()
            .map(PointsProperties.LevelConfig::toThreshold)
            .toList());
    }

    @Bean
    public LevelCalculator levelCalculator(LevelThresholdTable levelThresholdTable) {
        return new LevelCalculator(levelThresholdTable);
    }

    /**
     * 點數交易的重試策略：只重試暫時性失敗，例如併發交易的寫入衝突。
     */
    @Bean
    public RetryOperations pointsRetryOperations(PointsProperties properties) {
        FixedBackOffPolicy backOff = new FixedBackOffPolicy();
        backOff.setBackOffPeriod(properties.retry().backoff().toMillis());

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new TransientFailureRetryPolicy(properties.retry().maxAttempts()));
        retryTemplate.setBackOffPolicy(backOff);
        return retryTemplate;
    }

    @Bean
    public StreakTracker streakTracker(PointsProperties properties) {
        return new StreakTracker(ZoneId.of(properties.streak().zone()));
    }
}
