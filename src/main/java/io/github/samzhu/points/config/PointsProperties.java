package io.github.samzhu.points.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import io.github.samzhu.points.domain.LevelThreshold;

import jakarta.validation.constraints.NotEmpty;

/**
 * 點數引擎的組態屬性，支援型別安全的配置綁定。
 *
 * <p>此配置包含以下部分：
 * <ul>
 *   <li>{@code actions} - 動作代碼與固定點數，必填</li>
 *   <li>{@link LevelConfig} - 等級門檻，未設定時使用預設五級</li>
 *   <li>{@link StreakConfig} - 連續活動的日曆時區</li>
 *   <li>{@link EventsConfig} - 領域事件的輸出 binding 與 CloudEvent source</li>
 *   <li>{@link ReconciliationConfig} - 對帳排程</li>
 *   <li>{@link RetryConfig} - 暫時性交易失敗的重試次數</li>
 * </ul>
 *
 * <p>配置範例 (application.yaml)：
 * <pre>
 * points:
 *   actions:
 *     "[registration]": 100
 *     "[document_upload]": 75
 *   levels:
 *     - level: 1
 *       name: Iniciante
 *       points-required: 0
 *     - level: 2
 *       name: Bronze
 *       points-required: 500
 *   streak:
 *     zone: UTC
 *   events:
 *     binding: pointsEvents-out-0
 *     source: urn:points-engine
 *   reconciliation:
 *     cron: "0 15 * * * *"
 *     lookback: PT24H
 *   retry:
 *     max-attempts: 3
 *     backoff: 50ms
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html">Spring Boot Externalized Configuration</a>
 */
@Validated
@ConfigurationProperties(prefix = "points")
public record PointsProperties(
    @NotEmpty Map<String, Integer> actions,
    List<LevelConfig> levels,
    StreakConfig streak,
    EventsConfig events,
    ReconciliationConfig reconciliation,
    RetryConfig retry
) {
    public PointsProperties {
        if (levels == null || levels.isEmpty()) {
            levels = LevelConfig.defaults();
        }
        if (streak == null) {
            streak = StreakConfig.defaults();
        }
        if (events == null) {
            events = EventsConfig.defaults();
        }
        if (reconciliation == null) {
            reconciliation = ReconciliationConfig.defaults();
        }
        if (retry == null) {
            retry = RetryConfig.defaults();
        }
    }

    /**
     * 單一等級門檻設定。
     *
     * @param level 等級編號，從 1 開始連續
     * @param name 顯示名稱
     * @param pointsRequired 最低累計點數
     */
    public record LevelConfig(
        int level,
        String name,
        long pointsRequired
    ) {
        public LevelThreshold toThreshold() {
            return new LevelThreshold(level, name, pointsRequired);
        }

        /**
         * 預設等級：Iniciante / Bronze / Prata / Ouro / Platina。
         */
        public static List<LevelConfig> defaults() {
            return List.of(
                new LevelConfig(1, "Iniciante", 0),
                new LevelConfig(2, "Bronze", 500),
                new LevelConfig(3, "Prata", 1000),
                new LevelConfig(4, "Ouro", 2000),
                new LevelConfig(5, "Platina", 5000)
            );
        }
    }

    /**
     * 連續活動設定。
     *
     * <p>「同一天」「隔天」以此時區的日曆日判斷。
     *
     * @param zone 時區 ID，預設 UTC
     */
    public record StreakConfig(
        String zone
    ) {
        public StreakConfig {
            if (zone == null || zone.isBlank()) {
                zone = "UTC";
            }
        }

        public static StreakConfig defaults() {
            return new StreakConfig("UTC");
        }
    }

    /**
     * 領域事件發佈設定。
     *
     * @param binding StreamBridge 輸出 binding 名稱，預設 {@code pointsEvents-out-0}
     * @param source CloudEvent source 屬性，預設 {@code urn:points-engine}
     */
    public record EventsConfig(
        String binding,
        String source
    ) {
        public EventsConfig {
            if (binding == null || binding.isBlank()) {
                binding = "pointsEvents-out-0";
            }
            if (source == null || source.isBlank()) {
                source = "urn:points-engine";
            }
        }

        public static EventsConfig defaults() {
            return new EventsConfig("pointsEvents-out-0", "urn:points-engine");
        }
    }

    /**
     * 對帳排程設定。
     *
     * @param cron 排程 Cron 表達式，預設每小時 15 分
     * @param lookback 只檢查此期間內有活動的用戶，預設 24 小時
     */
    public record ReconciliationConfig(
        String cron,
        Duration lookback
    ) {
        public ReconciliationConfig {
            if (cron == null || cron.isBlank()) {
                cron = "0 15 * * * *";
            }
            if (lookback == null || lookback.isNegative() || lookback.isZero()) {
                lookback = Duration.ofHours(24);
            }
        }

        public static ReconciliationConfig defaults() {
            return new ReconciliationConfig("0 15 * * * *", Duration.ofHours(24));
        }
    }

    /**
     * 暫時性交易失敗（寫入衝突、TransientTransactionError）的重試設定。
     *
     * @param maxAttempts 含第一次在內的最大嘗試次數，預設 3
     * @param backoff 兩次嘗試之間的等待時間，預設 50 毫秒
     */
    public record RetryConfig(
        int maxAttempts,
        Duration backoff
    ) {
        public RetryConfig {
            if (maxAttempts < 1) {
                maxAttempts = 3;
            }
            if (backoff == null || backoff.isNegative()) {
                backoff = Duration.ofMillis(50);
            }
        }

        public static RetryConfig defaults() {
            return new RetryConfig(3, Duration.ofMillis(50));
        }
    }
}
