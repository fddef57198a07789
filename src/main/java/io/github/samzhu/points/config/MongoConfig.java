package io.github.samzhu.points.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用以下功能：
 * <ul>
 *   <li>Repository 自動掃描 - 自動註冊 {@code io.github.samzhu.points.repository} 下的介面</li>
 *   <li>Auditing 審計功能</li>
 *   <li>多文件交易 - {@link MongoTransactionManager}，需要 replica set</li>
 * </ul>
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code users} - 用戶點數、等級、連續活動（外部擁有）</li>
 *   <li>{@code points_transactions} - 點數帳本</li>
 *   <li>{@code audit_records} - 稽核記錄</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/client-session-transactions.html">Sessions &amp; Transactions</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.points.repository")
@EnableMongoAuditing
public class MongoConfig {

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    /**
     * 點數給予的交易邊界。
     */
    @Bean
    public TransactionOperations pointsTransactionOperations(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
