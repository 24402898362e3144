package io.github.samzhu.keeper.provider;

/**
 * 供應商健康狀態，宣告順序即排序優先順序。
 */
public enum ProviderHealthStatus {
    HEALTHY,
    DEGRADED,
    DOWN
}
