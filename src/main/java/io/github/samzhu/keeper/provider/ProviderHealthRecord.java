package io.github.samzhu.keeper.provider;

import java.time.Instant;

/**
 * 供應商健康度快照。
 *
 * @param provider 供應商名稱
 * @param status 健康狀態
 * @param lastLatencyMs 最近一次成功探測的延遲，尚未成功探測為 null
 * @param p50LatencyMs 延遲 P50
 * @param p95LatencyMs 延遲 P95
 * @param errorRate 錯誤率估計 (0-100)
 * @param lastCheckedAt 最近一次探測時間
 * @param lastError 最近一次失敗原因
 * @param region 區域
 * @param priority 設定的優先順序
 */
public record ProviderHealthRecord(
    String provider,
    ProviderHealthStatus status,
    Long lastLatencyMs,
    double p50LatencyMs,
    double p95LatencyMs,
    double errorRate,
    Instant lastCheckedAt,
    String lastError,
    String region,
    int priority
) {

    public boolean isAvailable() {
        return status != ProviderHealthStatus.DOWN;
    }
}
