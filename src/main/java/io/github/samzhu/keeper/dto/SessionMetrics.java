package io.github.samzhu.keeper.dto;

/**
 * 推播給訂閱者的即時指標。
 *
 * @param elapsedMinutes 目前已計費分鐘數
 * @param currentCostCents 目前累計費用 (美分)
 * @param gpuUtilization GPU 使用率，可為 null
 * @param memoryUsedMb 已使用顯示記憶體，可為 null
 * @param temperature GPU 溫度，可為 null
 */
public record SessionMetrics(
    long elapsedMinutes,
    long currentCostCents,
    Double gpuUtilization,
    Long memoryUsedMb,
    Double temperature
) {
}
