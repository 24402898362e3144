package io.github.samzhu.keeper.exception;

import java.time.Instant;

/**
 * 外部依賴不可用異常。
 *
 * <p>由 {@link io.github.samzhu.keeper.resilience.CircuitBreaker} 拋出，分為兩種情況：
 * <ul>
 *   <li>{@code rejected=true} - 斷路器開路中，呼叫未被執行（快速失敗）</li>
 *   <li>{@code rejected=false} - 呼叫已執行但失敗，原始例外保留於 {@link #getCause()}</li>
 * </ul>
 *
 * <p>呼叫端可據此決定是否切換至下一個供應商。
 */
public class DependencyUnavailableException extends RuntimeException {

    private final String dependency;
    private final boolean rejected;
    private final Instant retryAt;

    public DependencyUnavailableException(String dependency, Instant retryAt) {
        super(String.format("Dependency '%s' is unavailable (circuit open, retry after %s)", dependency, retryAt));
        this.dependency = dependency;
        this.rejected = true;
        this.retryAt = retryAt;
    }

    public DependencyUnavailableException(String dependency, Throwable cause) {
        super(String.format("Dependency '%s' call failed: %s", dependency, cause.getMessage()), cause);
        this.dependency = dependency;
        this.rejected = false;
        this.retryAt = null;
    }

    public String getDependency() {
        return dependency;
    }

    /**
     * @return true 表示呼叫被斷路器拒絕，未實際執行
     */
    public boolean isRejected() {
        return rejected;
    }

    public Instant getRetryAt() {
        return retryAt;
    }
}
