package io.github.samzhu.billing.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用以下功能：
 * <ul>
 *   <li>Repository 自動掃描 - 自動註冊 {@code io.github.samzhu.billing.repository} 下的介面</li>
 *   <li>Auditing 審計功能 - 支援 {@code @CreatedDate}、{@code @LastModifiedDate} 等註解</li>
 *   <li>多文件交易 - 餘額 CAS 與交易紀錄寫入必須在同一個交易內完成（需要 replica set）</li>
 * </ul>
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code user_balances} - 用戶餘額投影</li>
 *   <li>{@code transactions} - 只增不改的交易帳本</li>
 *   <li>{@code usage_records} - 每次計費用量紀錄</li>
 *   <li>{@code model_pricing} - 目前生效的模型定價</li>
 *   <li>{@code pricing_changes} - 定價變更稽核紀錄</li>
 *   <li>{@code pending_pricing_changes} - 待人工審核的定價變更</li>
 *   <li>{@code sync_logs} - 定價同步執行紀錄</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/client-session-transactions.html">Sessions &amp; Transactions</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.billing.repository")
@EnableMongoAuditing
public class MongoConfig {

    @Bean
    public MongoTransactionManager transactionManager(MongoDatabaseFactory databaseFactory) {
        return new MongoTransactionManager(databaseFactory);
    }

    @Bean
    public TransactionTemplate transactionTemplate(MongoTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }
}
