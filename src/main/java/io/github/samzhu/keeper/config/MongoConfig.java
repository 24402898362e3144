package io.github.samzhu.keeper.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>Repository 自動掃描 {@code io.github.samzhu.keeper.repository} 下的介面。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code gpu_sessions} - GPU Session 與狀態</li>
 *   <li>{@code credit_transactions} - 點數交易帳本（只增不改）</li>
 *   <li>{@code user_accounts} - 訂閱等級、餘額、自動儲值設定</li>
 * </ul>
 *
 * <p>需要 {@code spring.data.mongodb.auto-index-creation=true} 以建立文件上宣告的索引。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.keeper.repository")
public class MongoConfig {
}
