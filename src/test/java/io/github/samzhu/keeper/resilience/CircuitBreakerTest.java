package io.github.samzhu.keeper.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.BreakerConfig;
import io.github.samzhu.keeper.exception.DependencyUnavailableException;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-06-01T10:00:00Z"));
        breaker = new CircuitBreaker("vast", new BreakerConfig(3, Duration.ofSeconds(30), 2), clock);
    }

    @Test
    void shouldStayClosedBelowThreshold() {
        // Given: 連續失敗次數低於門檻
        fail(2);

        // Then
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.stats().consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void shouldResetConsecutiveFailuresOnSuccess() {
        // Given
        fail(2);

        // When
        String result = breaker.execute(() -> "ok");

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(breaker.stats().consecutiveFailures()).isZero();
        fail(2);
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
    }

    @Test
    void shouldOpenAfterThresholdAndRejectWithoutInvoking() {
        // Given: 連續 3 次失敗
        fail(3);
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);

        // When: 開路中再呼叫
        AtomicInteger invocations = new AtomicInteger();

        // Then: 快速失敗，呼叫未被執行
        assertThatThrownBy(() -> breaker.execute(invocations::incrementAndGet))
            .isInstanceOfSatisfying(DependencyUnavailableException.class, e -> {
                assertThat(e.isRejected()).isTrue();
                assertThat(e.getDependency()).isEqualTo("vast");
                assertThat(e.getRetryAt()).isEqualTo(Instant.parse("2025-06-01T10:00:30Z"));
            });
        assertThat(invocations).hasValue(0);
        assertThat(breaker.stats().totalRejections()).isEqualTo(1);
        assertThat(breaker.stats().tripCount()).isEqualTo(1);
    }

    @Test
    void shouldWrapOperationFailureWithCause() {
        // When / Then
        assertThatThrownBy(() -> breaker.execute(() -> {
            throw new IllegalStateException("boom");
        }))
            .isInstanceOfSatisfying(DependencyUnavailableException.class, e -> {
                assertThat(e.isRejected()).isFalse();
                assertThat(e.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
            });
    }

    @Test
    void shouldMoveToHalfOpenAfterResetTimeoutAndCloseAfterTrialSuccesses() {
        // Given
        fail(3);
        clock.advance(Duration.ofSeconds(30));

        // When: 第一個試探呼叫成功
        breaker.execute(() -> "trial-1");

        // Then: 仍在半開，需 2 次成功才關閉
        assertThat(breaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

        breaker.execute(() -> "trial-2");
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.stats().consecutiveFailures()).isZero();
        assertThat(breaker.stats().nextRetryAt()).isNull();
    }

    @Test
    void shouldReopenOnHalfOpenFailure() {
        // Given
        fail(3);
        clock.advance(Duration.ofSeconds(31));

        // When: 半開試探失敗
        fail(1);

        // Then: 重新開路並重新計算等待時間
        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(breaker.stats().nextRetryAt()).isEqualTo(Instant.parse("2025-06-01T10:01:01Z"));
        assertThat(breaker.stats().tripCount()).isEqualTo(2);
    }

    @Test
    void shouldCloseOnManualReset() {
        // Given
        fail(3);

        // When
        breaker.reset();

        // Then
        assertThat(breaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(breaker.execute(() -> "after-reset")).isEqualTo("after-reset");
    }

    @Test
    void registryShouldUseConfiguredAndDefaultSettings() {
        // Given
        KeeperProperties properties = new KeeperProperties(
            null, null, new BreakerConfig(5, Duration.ofSeconds(30), 3),
            Map.of("stripe", new BreakerConfig(2, Duration.ofSeconds(60), 1)),
            null, null, null, null, null, null, null);
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(properties, clock);

        // When
        CircuitBreaker stripe = registry.get("stripe");
        CircuitBreaker runpod = registry.get("runpod");

        // Then
        assertThat(stripe.getConfig().failureThreshold()).isEqualTo(2);
        assertThat(runpod.getConfig().failureThreshold()).isEqualTo(5);
        assertThat(registry.get("runpod")).isSameAs(runpod);
        assertThat(registry.snapshot()).extracting(CircuitBreaker.CircuitStats::name)
            .containsExactly("runpod", "stripe");
    }

    @Test
    void registryResetShouldReportUnknownNames() {
        // Given
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(KeeperProperties.defaults(), clock);
        CircuitBreaker lambda = registry.get("lambda");
        for (int i = 0; i < 5; i++) {
            try {
                lambda.run(() -> {
                    throw new IllegalStateException("down");
                });
            } catch (DependencyUnavailableException ignored) {
                // 預期失敗
            }
        }
        assertThat(lambda.getState()).isEqualTo(CircuitState.OPEN);

        // When / Then
        assertThat(registry.reset("lambda")).isTrue();
        assertThat(lambda.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(registry.reset("unknown")).isFalse();
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            assertThatThrownBy(() -> breaker.execute(() -> {
                throw new IllegalStateException("provider error");
            })).isInstanceOf(DependencyUnavailableException.class);
        }
    }
}
