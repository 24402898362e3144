package io.github.samzhu.keeper.provider;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.tdunning.math.stats.TDigest;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.HealthConfig;

/**
 * 供應商健康監控，維護可供故障轉移使用的排序清單。
 *
 * <p>每個探測週期：
 * <ol>
 *   <li>在背景執行緒池上平行探測每個供應商，各自有逾時上限</li>
 *   <li>成功：HEALTHY，錯誤率遞減，延遲寫入 T-Digest</li>
 *   <li>失敗或逾時：錯誤率遞增，超過門檻為 DOWN，否則 DEGRADED</li>
 * </ol>
 *
 * <p>單一供應商失敗或卡住不影響其他供應商的探測。
 * 此監控只提供排序建議，不會阻擋開機嘗試。
 *
 * @see <a href="https://github.com/tdunning/t-digest">T-Digest GitHub</a>
 */
@Service
public class ProviderHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    private static final Comparator<ProviderHealthRecord> RANKING = Comparator
        .comparing(ProviderHealthRecord::status)
        .thenComparing(r -> r.lastLatencyMs() != null ? r.lastLatencyMs() : Long.MAX_VALUE)
        .thenComparingInt(ProviderHealthRecord::priority);

    private final ProviderRegistry providerRegistry;
    private final HealthConfig config;
    private final Clock clock;
    private final Executor executor;
    private final Map<String, ProviderState> states = new ConcurrentHashMap<>();

    public ProviderHealthMonitor(
            ProviderRegistry providerRegistry,
            KeeperProperties properties,
            Clock clock,
            @Qualifier("backgroundExecutor") Executor executor) {
        this.providerRegistry = providerRegistry;
        this.config = properties.health();
        this.clock = clock;
        this.executor = executor;
        providerRegistry.all().forEach(p -> states.put(p.name(), new ProviderState(p, config.digestCompression())));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        probeAll();
    }

    /**
     * 探測所有供應商，等待本輪全部完成（每個探測最多 probeTimeout）。
     */
    @Scheduled(cron = "${keeper.health.probe-cron:0 * * * * *}")
    public void probeAll() {
        long startTime = System.currentTimeMillis();

        List<CompletableFuture<Void>> probes = states.values().stream()
            .map(this::probe)
            .toList();
        CompletableFuture.allOf(probes.toArray(CompletableFuture[]::new)).join();

        long down = states.values().stream()
            .filter(s -> s.snapshot().status() == ProviderHealthStatus.DOWN)
            .count();
        log.debug("Provider probe completed: {} providers in {}ms, down: {}",
            states.size(), System.currentTimeMillis() - startTime, down);
    }

    private CompletableFuture<Void> probe(ProviderState state) {
        CompletableFuture<Long> call = new CompletableFuture<>();
        FutureTask<Long> task = new FutureTask<>(() -> timedHealthCheck(state.provider)) {
            @Override
            protected void done() {
                if (isCancelled()) {
                    return;
                }
                try {
                    call.complete(get());
                } catch (ExecutionException e) {
                    call.completeExceptionally(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    call.completeExceptionally(e);
                }
            }
        };
        try {
            executor.execute(task);
        } catch (RuntimeException e) {
            // 執行緒池飽和
            call.completeExceptionally(e);
        }

        return call
            .orTimeout(config.probeTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .handle((latencyMs, error) -> {
                Instant now = clock.instant();
                if (error == null) {
                    state.recordSuccess(latencyMs, now, config);
                    return null;
                }
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
                String reason;
                if (cause instanceof TimeoutException) {
                    // 中斷卡住的探測，釋放背景執行緒
                    task.cancel(true);
                    reason = "timeout after " + config.probeTimeout().toMillis() + "ms";
                } else {
                    reason = cause.getMessage();
                }
                ProviderHealthStatus status = state.recordFailure(reason, now, config);
                log.warn("Provider probe failed: provider={}, status={}, reason={}",
                    state.provider.name(), status, reason);
                return null;
            });
    }

    private static long timedHealthCheck(GpuProvider provider) {
        long start = System.nanoTime();
        provider.healthCheck();
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    }

    // ========== 查詢 ==========

    /**
     * 最佳供應商：非 DOWN，HEALTHY 優先，其次延遲最低，再依設定優先順序。
     *
     * @return 全部 DOWN 時為 empty，呼叫端應視為容量不足
     */
    public Optional<ProviderHealthRecord> getBestProvider() {
        return getRankedProviders().stream().findFirst();
    }

    /**
     * 依相同規則排序的可用供應商清單（故障轉移用）。
     */
    public List<ProviderHealthRecord> getRankedProviders() {
        return states.values().stream()
            .map(ProviderState::snapshot)
            .filter(ProviderHealthRecord::isAvailable)
            .sorted(RANKING)
            .toList();
    }

    public boolean isAvailable(String provider) {
        ProviderState state = states.get(provider);
        return state != null && state.snapshot().isAvailable();
    }

    /**
     * 所有供應商的健康度，依名稱排序。
     */
    public List<ProviderHealthRecord> getAll() {
        return states.values().stream()
            .map(ProviderState::snapshot)
            .sorted(Comparator.comparing(ProviderHealthRecord::provider))
            .toList();
    }

    /**
     * 單一供應商的可變健康狀態，只由探測迴圈修改。
     */
    private static final class ProviderState {

        private final GpuProvider provider;
        private final TDigest latencyDigest;
        private ProviderHealthStatus status = ProviderHealthStatus.HEALTHY;
        private Long lastLatencyMs;
        private double errorRate;
        private Instant lastCheckedAt;
        private String lastError;

        ProviderState(GpuProvider provider, int compression) {
            this.provider = provider;
            this.latencyDigest = TDigest.createMergingDigest(compression);
        }

        synchronized void recordSuccess(long latencyMs, Instant now, HealthConfig config) {
            status = ProviderHealthStatus.HEALTHY;
            errorRate = Math.max(0, errorRate - config.successDecay());
            lastLatencyMs = latencyMs;
            lastCheckedAt = now;
            lastError = null;
            latencyDigest.add(latencyMs);
        }

        synchronized ProviderHealthStatus recordFailure(String reason, Instant now, HealthConfig config) {
            errorRate = Math.min(100, errorRate + config.failurePenalty());
            status = errorRate > config.downThreshold() ? ProviderHealthStatus.DOWN : ProviderHealthStatus.DEGRADED;
            lastCheckedAt = now;
            lastError = reason;
            return status;
        }

        synchronized ProviderHealthRecord snapshot() {
            boolean empty = latencyDigest.size() == 0;
            return new ProviderHealthRecord(
                provider.name(),
                status,
                lastLatencyMs,
                empty ? 0.0 : latencyDigest.quantile(0.5),
                empty ? 0.0 : latencyDigest.quantile(0.95),
                errorRate,
                lastCheckedAt,
                lastError,
                provider.region(),
                provider.priority()
            );
        }
    }
}
