package io.github.samzhu.tokenmeter.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.tokenmeter.document.BillingPeriod;
import io.github.samzhu.tokenmeter.document.Organization;
import io.github.samzhu.tokenmeter.document.SubscriptionPlan;
import io.github.samzhu.tokenmeter.document.Team;
import io.github.samzhu.tokenmeter.document.TeamMembership;
import io.github.samzhu.tokenmeter.document.TokenUsageEvent;
import io.github.samzhu.tokenmeter.document.UserProfile;
import io.github.samzhu.tokenmeter.document.UserSubscription;
import io.github.samzhu.tokenmeter.dto.TokenUsageMessage;
import io.github.samzhu.tokenmeter.dto.api.CurrentUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.ErrorResponse;
import io.github.samzhu.tokenmeter.dto.api.OrganizationUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.TeamUsageResponse;
import io.github.samzhu.tokenmeter.dto.api.UsageHistoryResponse;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>註冊 Jackson 與 Spring Data MongoDB 需要反射存取的 record：
 * <ul>
 *   <li>{@link TokenUsageMessage} - CloudEvents data payload</li>
 *   <li>{@code document} 套件 - MongoDB 文件映射</li>
 *   <li>{@code dto.api} 套件中含巢狀 record 的回應</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.TokenMeterRuntimeHints.class)
public class NativeHintsConfig {

    static class TokenMeterRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            hints.reflection()
                .registerType(TokenUsageMessage.class, MemberCategory.values());

            // MongoDB 文件
            hints.reflection()
                .registerType(SubscriptionPlan.class, MemberCategory.values())
                .registerType(UserSubscription.class, MemberCategory.values())
                .registerType(BillingPeriod.class, MemberCategory.values())
                .registerType(TokenUsageEvent.class, MemberCategory.values())
                .registerType(UserProfile.class, MemberCategory.values())
                .registerType(TeamMembership.class, MemberCategory.values())
                .registerType(Team.class, MemberCategory.values())
                .registerType(Organization.class, MemberCategory.values());

            // 巢狀回應 record
            hints.reflection()
                .registerType(ErrorResponse.class, MemberCategory.values())
                .registerType(CurrentUsageResponse.class, MemberCategory.values())
                .registerType(CurrentUsageResponse.UsageInfo.class, MemberCategory.values())
                .registerType(CurrentUsageResponse.SubscriptionInfo.class, MemberCategory.values())
                .registerType(UsageHistoryResponse.class, MemberCategory.values())
                .registerType(UsageHistoryResponse.DailyFeatureUsage.class, MemberCategory.values())
                .registerType(OrganizationUsageResponse.class, MemberCategory.values())
                .registerType(OrganizationUsageResponse.OrganizationInfo.class, MemberCategory.values())
                .registerType(TeamUsageResponse.class, MemberCategory.values())
                .registerType(TeamUsageResponse.TeamInfo.class, MemberCategory.values());
        }
    }
}
