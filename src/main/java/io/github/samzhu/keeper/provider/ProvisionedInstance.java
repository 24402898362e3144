package io.github.samzhu.keeper.provider;

/**
 * 開機成功後的實例資訊。
 *
 * @param provider 供應商名稱
 * @param instanceId 供應商端實例 ID
 * @param accessUrl 連線位址
 */
public record ProvisionedInstance(
    String provider,
    String instanceId,
    String accessUrl
) {
}
