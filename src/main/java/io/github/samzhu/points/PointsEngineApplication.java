package io.github.samzhu.points;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Points Engine - 點數與等級服務。
 *
 * <p>負責在用戶完成入門流程動作時給予點數，並維護等級與連續活動天數：
 * <ul>
 *   <li>冪等給予：同一 (用戶, 動作, 上下文) 只會給予一次，併發時亦然</li>
 *   <li>餘額等於帳本點數總和，等級只升不降</li>
 *   <li>稽核記錄與 CloudEvents 領域事件</li>
 *   <li>定時對帳</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Upstream (Publisher) → RabbitMQ → awardCommandConsumer → PointsEngine → MongoDB
 *                                                              │          points_transactions (帳本)
 *                                                              │          users (餘額/等級/連續活動)
 *                                                              │          audit_records (稽核)
 *                                                              ↓
 *                                                  pointsEvents (points_earned / level_up)
 * </pre>
 *
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/">Spring Cloud Stream</a>
 */
@SpringBootApplication
@EnableScheduling
public class PointsEngineApplication {

    private static final Logger log = LoggerFactory.getLogger(PointsEngineApplication.class);

    public static void main(String[] args) {
        log.info("Starting Points Engine - points, levels and streaks");
        SpringApplication.run(PointsEngineApplication.class, args);
    }
}
