package io.github.samzhu.keeper.dto.api;

/**
 * 自動儲值設定回應（已套用預設值）。
 */
public record AutoTopUpConfigResponse(
    String userId,
    boolean enabled,
    long thresholdCents,
    long amountCents,
    long creditBalanceCents,
    boolean hasPaymentMethod
) {
}
