package io.github.samzhu.keeper.dto.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * 建立 Session 請求。
 *
 * @param type burst 或 vpn，預設 burst
 * @param tier GPU 運算等級
 * @param gpuType GPU 型號，未指定時使用等級預設
 * @param gpuCount GPU 數量，預設 1
 * @param modelId 預載模型 ID
 */
public record CreateSessionRequest(
    @Pattern(regexp = "burst|vpn", message = "type must be burst or vpn")
    String type,

    @NotBlank(message = "tier is required")
    String tier,

    String gpuType,

    @Min(value = 1, message = "gpuCount must be at least 1")
    @Max(value = 8, message = "gpuCount must be at most 8")
    Integer gpuCount,

    String modelId
) {
}
