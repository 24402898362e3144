package io.github.samzhu.keeper.resilience;

/**
 * 斷路器狀態。
 */
public enum CircuitState {
    /** 正常放行 */
    CLOSED,
    /** 開路，快速失敗 */
    OPEN,
    /** 半開，允許有限的試探呼叫 */
    HALF_OPEN
}
