package io.github.samzhu.keeper.resilience;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.resilience.CircuitBreaker.CircuitStats;

/**
 * 斷路器登錄表，每個外部依賴一個 {@link CircuitBreaker}。
 *
 * <p>啟動時依 {@code keeper.breakers} 建立已設定的斷路器；
 * 未設定的名稱在第一次 {@link #get(String)} 時以 {@code keeper.default-breaker} 建立。
 */
public class CircuitBreakerRegistry {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreakerRegistry.class);

    private final KeeperProperties properties;
    private final Clock clock;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(KeeperProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        properties.breakers().keySet().forEach(this::get);
        log.info("Circuit breaker registry initialized: {}", breakers.keySet());
    }

    /**
     * 取得（必要時建立）指定依賴的斷路器。
     *
     * @param name 依賴名稱
     * @return 斷路器
     */
    public CircuitBreaker get(String name) {
        return breakers.computeIfAbsent(name, key -> new CircuitBreaker(key, properties.breakerFor(key), clock));
    }

    /**
     * 所有斷路器的統計快照，依名稱排序。
     */
    public List<CircuitStats> snapshot() {
        return breakers.values().stream()
            .map(CircuitBreaker::stats)
            .sorted(Comparator.comparing(CircuitStats::name))
            .toList();
    }

    /**
     * 重置指定斷路器。
     *
     * @param name 依賴名稱
     * @return false 表示該斷路器不存在
     */
    public boolean reset(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }
}
