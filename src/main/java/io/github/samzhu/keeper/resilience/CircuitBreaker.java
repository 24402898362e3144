package io.github.samzhu.keeper.resilience;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.keeper.config.KeeperProperties.BreakerConfig;
import io.github.samzhu.keeper.exception.DependencyUnavailableException;

/**
 * 單一外部依賴的斷路器。
 *
 * <p>狀態機：
 * <pre>
 * CLOSED ──(連續失敗達 failureThreshold)──→ OPEN
 * OPEN ──(經過 resetTimeout 後的第一個呼叫)──→ HALF_OPEN
 * HALF_OPEN ──(halfOpenMaxCalls 次成功)──→ CLOSED
 * HALF_OPEN ──(任一失敗)──→ OPEN
 * </pre>
 *
 * <p>特性：
 * <ul>
 *   <li>開路時不執行呼叫，直接拋出 {@code DependencyUnavailableException(rejected=true)}</li>
 *   <li>被包裝的呼叫失敗時拋出 {@code DependencyUnavailableException(rejected=false)}，保留原始例外</li>
 *   <li>不做重試，重試策略由呼叫端決定</li>
 *   <li>狀態只在鎖內修改，被包裝的呼叫在鎖外執行</li>
 * </ul>
 */
public class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String name;
    private final BreakerConfig config;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private int halfOpenAdmitted;
    private int halfOpenSuccesses;
    private Instant lastFailureAt;
    private Instant nextRetryAt;

    // ========== 累計統計 ==========
    private long totalRequests;
    private long totalFailures;
    private long totalRejections;
    private long tripCount;

    public CircuitBreaker(String name, BreakerConfig config, Clock clock) {
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public BreakerConfig getConfig() {
        return config;
    }

    /**
     * 透過斷路器執行呼叫。
     *
     * @param operation 被保護的呼叫
     * @return 呼叫結果
     * @throws DependencyUnavailableException 開路中被拒絕，或呼叫本身失敗
     */
    public <T> T execute(Supplier<T> operation) {
        acquirePermission();
        T result;
        try {
            result = operation.get();
        } catch (RuntimeException e) {
            onFailure(e);
            throw new DependencyUnavailableException(name, e);
        }
        onSuccess();
        return result;
    }

    /**
     * 無回傳值版本的 {@link #execute(Supplier)}。
     */
    public void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    /**
     * 目前狀態。開路且已超過 resetTimeout 時仍回報 OPEN，直到下一個呼叫進來。
     */
    public synchronized CircuitState getState() {
        return state;
    }

    /**
     * 強制回到 CLOSED 並清除連續失敗計數（運維用）。
     */
    public void reset() {
        CircuitState previous;
        synchronized (this) {
            previous = state;
            state = CircuitState.CLOSED;
            consecutiveFailures = 0;
            halfOpenAdmitted = 0;
            halfOpenSuccesses = 0;
            nextRetryAt = null;
        }
        log.info("Circuit breaker manually reset: name={}, previous={}", name, previous);
    }

    /**
     * 取得統計快照。
     */
    public synchronized CircuitStats stats() {
        return new CircuitStats(
            name,
            state,
            consecutiveFailures,
            lastFailureAt,
            nextRetryAt,
            totalRequests,
            totalFailures,
            totalRejections,
            tripCount,
            config.failureThreshold(),
            config.resetTimeout().toMillis(),
            config.halfOpenMaxCalls()
        );
    }

    private void acquirePermission() {
        CircuitState from = null;
        Instant retryAt = null;
        boolean rejected = false;

        synchronized (this) {
            totalRequests++;
            Instant now = clock.instant();

            if (state == CircuitState.OPEN) {
                if (nextRetryAt != null && !now.isBefore(nextRetryAt)) {
                    from = state;
                    state = CircuitState.HALF_OPEN;
                    halfOpenAdmitted = 0;
                    halfOpenSuccesses = 0;
                } else {
                    totalRejections++;
                    rejected = true;
                    retryAt = nextRetryAt;
                }
            }

            if (!rejected && state == CircuitState.HALF_OPEN) {
                if (halfOpenAdmitted >= config.halfOpenMaxCalls()) {
                    totalRejections++;
                    rejected = true;
                    retryAt = nextRetryAt;
                } else {
                    halfOpenAdmitted++;
                }
            }
        }

        if (from != null) {
            log.info("Circuit breaker half-open: name={}, trial calls={}", name, config.halfOpenMaxCalls());
        }
        if (rejected) {
            log.debug("Circuit breaker rejected call: name={}, retryAt={}", name, retryAt);
            throw new DependencyUnavailableException(name, retryAt);
        }
    }

    private void onSuccess() {
        CircuitState from = null;
        synchronized (this) {
            switch (state) {
                case CLOSED -> consecutiveFailures = 0;
                case HALF_OPEN -> {
                    halfOpenSuccesses++;
                    if (halfOpenSuccesses >= config.halfOpenMaxCalls()) {
                        from = state;
                        state = CircuitState.CLOSED;
                        consecutiveFailures = 0;
                        nextRetryAt = null;
                    }
                }
                case OPEN -> {
                    // 開路前已放行的呼叫晚到，不影響狀態
                }
            }
        }
        if (from != null) {
            log.info("Circuit breaker closed: name={}, from={}", name, from);
        }
    }

    private void onFailure(RuntimeException e) {
        CircuitState from = null;
        Instant retryAt;
        synchronized (this) {
            Instant now = clock.instant();
            totalFailures++;
            consecutiveFailures++;
            lastFailureAt = now;

            boolean trip = state == CircuitState.HALF_OPEN
                || (state == CircuitState.CLOSED && consecutiveFailures >= config.failureThreshold());
            if (trip) {
                from = state;
                state = CircuitState.OPEN;
                nextRetryAt = now.plus(config.resetTimeout());
                tripCount++;
            }
            retryAt = nextRetryAt;
        }
        if (from != null) {
            log.warn("Circuit breaker opened: name={}, from={}, consecutiveFailures={}, retryAt={}, cause={}",
                name, from, consecutiveFailures, retryAt, e.getMessage());
        } else {
            log.debug("Circuit breaker recorded failure: name={}, consecutiveFailures={}, cause={}",
                name, consecutiveFailures, e.getMessage());
        }
    }

    /**
     * 斷路器統計快照。
     *
     * @param name 依賴名稱
     * @param state 目前狀態
     * @param consecutiveFailures 連續失敗次數
     * @param lastFailureAt 最後一次失敗時間
     * @param nextRetryAt 開路後允許試探的時間
     * @param totalRequests 累計呼叫數（含被拒絕）
     * @param totalFailures 累計失敗數
     * @param totalRejections 累計快速失敗數
     * @param tripCount 累計開路次數
     * @param failureThreshold 開路門檻
     * @param resetTimeoutMs 開路等待時間 (毫秒)
     * @param halfOpenMaxCalls 半開試探呼叫數
     */
    public record CircuitStats(
        String name,
        CircuitState state,
        int consecutiveFailures,
        Instant lastFailureAt,
        Instant nextRetryAt,
        long totalRequests,
        long totalFailures,
        long totalRejections,
        long tripCount,
        int failureThreshold,
        long resetTimeoutMs,
        int halfOpenMaxCalls
    ) {
    }
}
