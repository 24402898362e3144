package io.github.samzhu.keeper.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * GPU 實例上的 agent 回報的活動資料（CloudEvent data）。
 *
 * <p>Session ID 優先取自 payload，缺少時使用 CloudEvent {@code subject}。
 *
 * @param sessionId Session ID
 * @param gpuUtilization GPU 使用率 (0-100)
 * @param memoryUsedMb 已使用顯示記憶體 (MB)
 * @param temperature GPU 溫度 (°C)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionActivityData(
    String sessionId,
    Double gpuUtilization,
    Long memoryUsedMb,
    Double temperature
) {
}
