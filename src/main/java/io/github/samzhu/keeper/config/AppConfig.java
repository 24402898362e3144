package io.github.samzhu.keeper.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import io.github.samzhu.keeper.config.KeeperProperties.ExecutorConfig;
import io.github.samzhu.keeper.provider.ProviderRegistry;
import io.github.samzhu.keeper.resilience.CircuitBreakerRegistry;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link KeeperProperties} 的型別安全配置綁定，並註冊：
 * <ul>
 *   <li>{@link Clock} - 所有時間判斷的來源，測試可替換</li>
 *   <li>{@code backgroundExecutor} - 供應商停機、健康探測、自動儲值</li>
 *   <li>{@link CircuitBreakerRegistry} - 每個外部依賴一個斷路器</li>
 *   <li>{@link ProviderRegistry} - 已設定的 GPU 供應商</li>
 * </ul>
 *
 * @see KeeperProperties
 * @see <a href="https://docs.spring.io/spring-boot/reference/features/external-config.html#features.external-config.typesafe-configuration-properties.enabling-annotated-types">Enabling @ConfigurationProperties</a>
 */
@Configuration
@EnableConfigurationProperties(KeeperProperties.class)
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 背景任務執行緒池，佇列滿時拒絕新任務（呼叫端記錄日誌）。
     */
    @Bean
    public ThreadPoolTaskExecutor backgroundExecutor(KeeperProperties properties) {
        ExecutorConfig config = properties.executor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.corePoolSize());
        executor.setMaxPoolSize(config.maxPoolSize());
        executor.setQueueCapacity(config.queueCapacity());
        executor.setThreadNamePrefix("keeper-bg-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(KeeperProperties properties, Clock clock) {
        return new CircuitBreakerRegistry(properties, clock);
    }

    @Bean
    public ProviderRegistry providerRegistry(KeeperProperties properties, RestClient.Builder restClientBuilder) {
        return ProviderRegistry.fromProperties(properties, restClientBuilder);
    }
}
