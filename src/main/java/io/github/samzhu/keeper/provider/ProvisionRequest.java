package io.github.samzhu.keeper.provider;

/**
 * 開機請求。
 *
 * @param sessionId 對應的 Session ID，供應商端可作為標籤
 * @param tier GPU 運算等級
 * @param gpuType GPU 型號
 * @param gpuCount GPU 數量
 * @param modelId 預載模型 ID，可為 null
 */
public record ProvisionRequest(
    String sessionId,
    String tier,
    String gpuType,
    int gpuCount,
    String modelId
) {
}
