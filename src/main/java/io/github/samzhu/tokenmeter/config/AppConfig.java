package io.github.samzhu.tokenmeter.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link MeteringProperties} 的型別安全配置綁定，並提供 UTC {@link Clock}，
 * 所有週期計算都透過此 Clock 取得現在時間，測試時可替換為固定時鐘。
 *
 * @see MeteringProperties
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html#features.external-config.typesafe-configuration-properties.enabling-annotated-types">Enabling @ConfigurationProperties</a>
 */
@Configuration
@EnableConfigurationProperties(MeteringProperties.class)
public class AppConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
