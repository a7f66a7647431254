package io.github.samzhu.tokenmeter.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.config.EnableMongoAuditing;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

/**
 * MongoDB 資料庫配置。
 *
 * <p>啟用以下功能：
 * <ul>
 *   <li>Repository 自動掃描 - 自動註冊 {@code io.github.samzhu.tokenmeter.repository} 下的介面</li>
 *   <li>Auditing 審計功能 - 支援 {@code @CreatedDate}、{@code @LastModifiedDate} 等註解</li>
 * </ul>
 *
 * <p>本服務寫入的集合：
 * <ul>
 *   <li>{@code subscription_plans} - 方案目錄</li>
 *   <li>{@code user_subscriptions} - 用戶訂閱（每位用戶最多一筆 active）</li>
 *   <li>{@code billing_periods} - 訂閱週期帳務記錄</li>
 *   <li>{@code token_usage_events} - Token 用量事件（append-only，用量的唯一依據）</li>
 * </ul>
 *
 * <p>唯讀集合（由產品其他部分維護）：{@code user_profiles}、{@code user_team_memberships}、
 * {@code teams}、{@code organizations}。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/configuration.html">Spring Data MongoDB Configuration</a>
 */
@Configuration
@EnableMongoRepositories(basePackages = "io.github.samzhu.tokenmeter.repository")
@EnableMongoAuditing
public class MongoConfig {
}
