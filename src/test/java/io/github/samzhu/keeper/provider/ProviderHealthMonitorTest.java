package io.github.samzhu.keeper.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.HealthConfig;

class ProviderHealthMonitorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);

    private LocalGpuProvider vast;
    private LocalGpuProvider runpod;
    private LocalGpuProvider lambda;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        vast = new LocalGpuProvider("vast", "us-east", 1);
        runpod = new LocalGpuProvider("runpod", "eu-west", 2);
        lambda = new LocalGpuProvider("lambda", "us-west", 3);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldStartHealthyAndRankByPriority() {
        // Given: 尚未探測
        ProviderHealthMonitor monitor = monitor(List.of(lambda, runpod, vast), Duration.ofSeconds(1));

        // Then: 全部視為 HEALTHY，延遲未知時依優先順序
        assertThat(monitor.getRankedProviders())
            .extracting(ProviderHealthRecord::provider)
            .containsExactly("vast", "runpod", "lambda");
        assertThat(monitor.getBestProvider()).map(ProviderHealthRecord::provider).contains("vast");
    }

    @Test
    void shouldDegradeThenMarkDownAfterRepeatedFailures() {
        // Given
        ProviderHealthMonitor monitor = monitor(List.of(vast, runpod), Duration.ofSeconds(1));
        vast.setAvailable(false);

        // When: 第一次失敗
        monitor.probeAll();

        // Then: 錯誤率 30，DEGRADED 但仍可用
        ProviderHealthRecord first = find(monitor, "vast");
        assertThat(first.status()).isEqualTo(ProviderHealthStatus.DEGRADED);
        assertThat(first.errorRate()).isEqualTo(30.0);
        assertThat(first.lastError()).contains("provider unavailable");
        assertThat(monitor.isAvailable("vast")).isTrue();
        assertThat(monitor.getBestProvider()).map(ProviderHealthRecord::provider).contains("runpod");

        // When: 第二次失敗
        monitor.probeAll();

        // Then: 錯誤率 60 超過門檻，DOWN 並從排序移除
        assertThat(find(monitor, "vast").status()).isEqualTo(ProviderHealthStatus.DOWN);
        assertThat(monitor.isAvailable("vast")).isFalse();
        assertThat(monitor.getRankedProviders())
            .extracting(ProviderHealthRecord::provider)
            .containsExactly("runpod");
    }

    @Test
    void shouldRecoverToHealthyOnSuccess() {
        // Given
        ProviderHealthMonitor monitor = monitor(List.of(vast), Duration.ofSeconds(1));
        vast.setAvailable(false);
        monitor.probeAll();
        monitor.probeAll();
        assertThat(find(monitor, "vast").status()).isEqualTo(ProviderHealthStatus.DOWN);

        // When
        vast.setAvailable(true);
        monitor.probeAll();

        // Then: 狀態回到 HEALTHY，錯誤率只遞減
        ProviderHealthRecord record = find(monitor, "vast");
        assertThat(record.status()).isEqualTo(ProviderHealthStatus.HEALTHY);
        assertThat(record.errorRate()).isEqualTo(59.5);
        assertThat(record.lastLatencyMs()).isNotNull();
        assertThat(record.lastError()).isNull();
        assertThat(record.lastCheckedAt()).isEqualTo(clock.instant());
    }

    @Test
    void shouldReturnEmptyBestProviderWhenAllDown() {
        // Given
        ProviderHealthMonitor monitor = monitor(List.of(vast, runpod), Duration.ofSeconds(1));
        vast.setAvailable(false);
        runpod.setAvailable(false);

        // When
        monitor.probeAll();
        monitor.probeAll();

        // Then
        assertThat(monitor.getBestProvider()).isEmpty();
        assertThat(monitor.getAll())
            .extracting(ProviderHealthRecord::provider)
            .containsExactly("runpod", "vast");
    }

    @Test
    void shouldTimeOutHangingProviderWithoutBlockingOthers() throws Exception {
        // Given: 一個卡住的供應商
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        GpuProvider hanging = new LocalGpuProvider("hanging", "ap-east", 0) {
            @Override
            public void healthCheck() {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.set(true);
                    Thread.currentThread().interrupt();
                }
            }
        };
        pool = Executors.newFixedThreadPool(4);
        HealthConfig health = new HealthConfig(Duration.ofMillis(200), 0.5, 30, 50, 100);
        ProviderRegistry registry = new ProviderRegistry(List.of(hanging, vast));
        ProviderHealthMonitor monitor = new ProviderHealthMonitor(registry, properties(health), clock, pool);

        // When
        long start = System.nanoTime();
        monitor.probeAll();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        release.countDown();

        // Then: 本輪在逾時附近結束，其他供應商正常
        assertThat(elapsedMs).isLessThan(5_000);
        ProviderHealthRecord hangingRecord = find(monitor, "hanging");
        assertThat(hangingRecord.status()).isEqualTo(ProviderHealthStatus.DEGRADED);
        assertThat(hangingRecord.lastError()).startsWith("timeout after 200ms");
        assertThat(find(monitor, "vast").status()).isEqualTo(ProviderHealthStatus.HEALTHY);
        assertThat(find(monitor, "vast").lastLatencyMs()).isNotNull();
        // 逾時的探測被中斷，不會佔住背景執行緒
        await().atMost(Duration.ofSeconds(2)).untilTrue(interrupted);
    }

    private ProviderHealthMonitor monitor(List<GpuProvider> providers, Duration probeTimeout) {
        HealthConfig health = new HealthConfig(probeTimeout, 0.5, 30, 50, 100);
        return new ProviderHealthMonitor(new ProviderRegistry(providers), properties(health), clock,
            new SyncTaskExecutor());
    }

    private static KeeperProperties properties(HealthConfig health) {
        return new KeeperProperties(null, health, null, null, null, null, null, null, null, null, null);
    }

    private static ProviderHealthRecord find(ProviderHealthMonitor monitor, String name) {
        return monitor.getAll().stream()
            .filter(r -> r.provider().equals(name))
            .findFirst()
            .orElseThrow();
    }
}
